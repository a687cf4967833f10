package fr.tictak.pulse.config;

import fr.tictak.pulse.concurrent.BoundedWorkerPool;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String CHANNEL_EXECUTOR = "channelExecutor";

    /**
     * Executor for out-of-band deliveries (e-mail, mobile push) and pattern aggregation.
     */
    @Bean(name = CHANNEL_EXECUTOR)
    public ThreadPoolTaskExecutor channelExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("pulse-channel-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean(destroyMethod = "close")
    public BoundedWorkerPool batchWorkerPool(PulseProperties properties) {
        return new BoundedWorkerPool("pulse-batch", properties.getBatch().getConcurrency());
    }
}
