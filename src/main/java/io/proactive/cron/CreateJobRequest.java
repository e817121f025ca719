package io.proactive.cron;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Input for creating a scheduled job.
 *
 * @param name        task name
 * @param description optional description
 * @param jobType     one_shot or recurring
 * @param schedule    ISO-8601 instant or 5-field cron expression, depending on the type
 * @param prompt      the prompt to execute when the job runs
 */
public record CreateJobRequest(
        String name,
        String description,
        @JsonAlias("job_type") JobType jobType,
        String schedule,
        String prompt
) {
    public static CreateJobRequest oneShot(String name, String schedule, String prompt) {
        return new CreateJobRequest(name, null, JobType.ONE_SHOT, schedule, prompt);
    }

    public static CreateJobRequest recurring(String name, String schedule, String prompt) {
        return new CreateJobRequest(name, null, JobType.RECURRING, schedule, prompt);
    }
}
