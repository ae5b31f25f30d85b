package workout.logger.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pool that runs the batched child fetches issued by request loaders.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "batchLoaderExecutor")
    public Executor batchLoaderExecutor(
            @Value("${workout.loader.executor.core-pool-size:4}") int corePoolSize,
            @Value("${workout.loader.executor.max-pool-size:16}") int maxPoolSize,
            @Value("${workout.loader.executor.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("batch-loader-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
