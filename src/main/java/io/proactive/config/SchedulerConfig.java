package io.proactive.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.proactive.channel.ChannelRegistry;
import io.proactive.channel.DeliveryPort;
import io.proactive.channel.OwnerDeliveryPort;
import io.proactive.channel.TelegramChannel;
import io.proactive.core.AgentClient;
import io.proactive.core.ChatModelAgentClient;
import io.proactive.cron.JobService;
import io.proactive.cron.NextRunCalculator;
import io.proactive.cron.SchedulerRunner;
import io.proactive.cron.SqliteJobLedger;
import io.proactive.heartbeat.HeartbeatJobProvisioner;
import io.proactive.heartbeat.HeartbeatRunner;
import io.proactive.heartbeat.ResponseDeduplicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the job ledger, the delivery channels, the agent and both runners.
 */
@Configuration
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    public Clock clock(ProactiveProperties properties) {
        return Clock.system(properties.zoneId());
    }

    @Bean
    public ActiveHours activeHours(ProactiveProperties properties) {
        return ActiveHours.from(properties);
    }

    @Bean
    public NextRunCalculator nextRunCalculator(ProactiveProperties properties) {
        return new NextRunCalculator(properties.zoneId());
    }

    @Bean(initMethod = "init", destroyMethod = "close")
    public SqliteJobLedger jobLedger(ProactiveProperties properties, Clock clock) {
        return new SqliteJobLedger(properties.scheduler().databasePath(), clock);
    }

    @Bean
    public JobService jobService(SqliteJobLedger jobLedger, NextRunCalculator calculator, Clock clock) {
        return new JobService(jobLedger, calculator, clock);
    }

    @Bean
    public ChannelRegistry channelRegistry() {
        return new ChannelRegistry();
    }

    @Bean
    @ConditionalOnProperty(name = "proactive.telegram.enabled", havingValue = "true")
    public TelegramChannel telegramChannel(ProactiveProperties properties, ChannelRegistry channelRegistry,
                                           RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        var telegram = properties.telegram();
        if (telegram.token() == null || telegram.token().isBlank() || telegram.chatId() == 0L) {
            throw new IllegalStateException("proactive.telegram.token and proactive.telegram.chat-id are required");
        }
        var channel = new TelegramChannel(telegram.token(), telegram.chatId(),
                restClientBuilder.baseUrl("https://api.telegram.org").build(), objectMapper);
        channelRegistry.register(channel);
        return channel;
    }

    @Bean
    public DeliveryPort deliveryPort(ChannelRegistry channelRegistry, ProactiveProperties properties) {
        return new OwnerDeliveryPort(channelRegistry, properties.delivery().ownerChannel());
    }

    @Bean
    public AgentClient agentClient(ChatModel chatModel) {
        return new ChatModelAgentClient(chatModel);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService jobExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "proactive-job-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public SchedulerRunner schedulerRunner(SqliteJobLedger jobLedger, NextRunCalculator calculator,
                                           AgentClient agentClient, DeliveryPort deliveryPort,
                                           ActiveHours activeHours, Clock clock, ExecutorService jobExecutor) {
        return new SchedulerRunner(jobLedger, calculator, agentClient, deliveryPort, activeHours, clock, jobExecutor);
    }

    @Bean
    @ConditionalOnProperty(name = "proactive.heartbeat.enabled", havingValue = "true", matchIfMissing = true)
    public HeartbeatRunner heartbeatRunner(AgentClient agentClient, DeliveryPort deliveryPort,
                                           ActiveHours activeHours, Clock clock, ProactiveProperties properties) {
        var heartbeat = properties.heartbeat();
        log.info("Heartbeat configured: every {} minutes, file: {}, mode: {}",
                heartbeat.intervalMinutes(), heartbeat.file(), heartbeat.mode());
        return new HeartbeatRunner(agentClient, deliveryPort, activeHours, Path.of(heartbeat.file()),
                Duration.ofMinutes(heartbeat.intervalMinutes()),
                new ResponseDeduplicator(ResponseDeduplicator.DEFAULT_WINDOW, clock), clock);
    }

    @Bean
    public HeartbeatJobProvisioner heartbeatJobProvisioner(JobService jobService, ProactiveProperties properties) {
        var heartbeat = properties.heartbeat();
        return new HeartbeatJobProvisioner(jobService, heartbeat.intervalMinutes(), heartbeat.file());
    }
}
