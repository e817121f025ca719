package io.proactive.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.proactive.cron.CreateJobRequest;
import io.proactive.cron.InvalidScheduleException;
import io.proactive.cron.JobNotFoundException;
import io.proactive.cron.JobService;
import io.proactive.cron.JobStateException;
import io.proactive.cron.JobType;
import io.proactive.cron.NextRunCalculator;
import io.proactive.cron.SqliteJobLedger;

import java.io.PrintStream;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line access to the job ledger, printing JSON.
 *
 * <pre>
 * list [all]
 * create &lt;name&gt; &lt;one_shot|recurring&gt; &lt;schedule&gt; &lt;prompt&gt;
 * get &lt;job-id&gt;
 * pause &lt;job-id&gt;
 * resume &lt;job-id&gt;
 * delete &lt;job-id&gt;
 * </pre>
 *
 * <p>The database path comes from {@code PROACTIVE_SCHEDULER_DB_PATH}
 * (default {@code ./data/scheduler.db}) and cron schedules are evaluated in
 * {@code PROACTIVE_TIMEZONE} (blank means the system zone). Errors go to stderr as {@code {"error": ...}}
 * with exit code 1.</p>
 */
public class JobCli {

    static final String DEFAULT_DB_PATH = "./data/scheduler.db";

    private final JobService jobService;
    private final PrintStream out;
    private final PrintStream err;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public JobCli(JobService jobService, PrintStream out, PrintStream err) {
        this.jobService = jobService;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        String dbPath = System.getenv().getOrDefault("PROACTIVE_SCHEDULER_DB_PATH", DEFAULT_DB_PATH);
        ZoneId zone = resolveZone(System.getenv("PROACTIVE_TIMEZONE"));
        Clock clock = Clock.system(zone);
        int exitCode;
        try (var ledger = new SqliteJobLedger(dbPath, clock)) {
            ledger.init();
            var jobService = new JobService(ledger, new NextRunCalculator(zone), clock);
            exitCode = new JobCli(jobService, System.out, System.err).run(args);
        }
        System.exit(exitCode);
    }

    /**
     * Executes one command.
     *
     * @return the process exit code
     */
    public int run(String... args) {
        String command = args.length > 0 ? args[0] : null;
        String[] rest = args.length > 0 ? Arrays.copyOfRange(args, 1, args.length) : new String[0];
        try {
            return switch (command == null ? "" : command) {
                case "list" -> json(jobService.list(rest.length > 0 && "all".equals(rest[0])));
                case "create" -> create(rest);
                case "get" -> json(jobService.get(requireId(rest, "get"))
                        .orElseThrow(() -> new JobNotFoundException(rest[0])));
                case "pause" -> json(jobService.pause(requireId(rest, "pause")));
                case "resume" -> json(jobService.resume(requireId(rest, "resume")));
                case "delete" -> delete(requireId(rest, "delete"));
                default -> error("Unknown command: %s. Available: list, create, get, pause, resume, delete"
                        .formatted(command == null ? "(none)" : command));
            };
        } catch (UsageException | InvalidScheduleException | JobNotFoundException | JobStateException
                 | IllegalArgumentException e) {
            return error(e.getMessage());
        }
    }

    private int create(String[] args) {
        if (args.length < 4 || Arrays.stream(args).limit(4).anyMatch(String::isBlank)) {
            throw new UsageException("Usage: create <name> <one_shot|recurring> <schedule> <prompt>");
        }
        JobType jobType = JobType.fromValue(args[1]);
        return json(jobService.create(new CreateJobRequest(args[0], null, jobType, args[2], args[3])));
    }

    private int delete(String id) {
        if (!jobService.delete(id)) {
            throw new JobNotFoundException(id);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("deleted", true);
        result.put("id", id);
        return json(result);
    }

    static ZoneId resolveZone(String timezone) {
        return timezone == null || timezone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timezone.trim());
    }

    private static String requireId(String[] args, String command) {
        if (args.length == 0 || args[0].isBlank()) {
            throw new UsageException("Usage: " + command + " <job-id>");
        }
        return args[0];
    }

    private int json(Object value) {
        try {
            out.println(objectMapper.writeValueAsString(value));
            return 0;
        } catch (JsonProcessingException e) {
            return error("Failed to serialize output: " + e.getMessage());
        }
    }

    private int error(String message) {
        try {
            err.println(objectMapper.copy().disable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(Map.of("error", message)));
        } catch (JsonProcessingException e) {
            err.println(message);
        }
        return 1;
    }

    private static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
