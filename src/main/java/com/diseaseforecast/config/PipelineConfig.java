package com.diseaseforecast.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.validation.ValidationConfigurationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock(@Value("${pipeline.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }

    /** {@code @PastOrPresent} and friends read "today" from the pipeline clock. */
    @Bean
    public ValidationConfigurationCustomizer pipelineClockValidation(Clock clock) {
        return configuration -> configuration.clockProvider(() -> clock);
    }

    /** One thread: scheduled pipeline jobs never run side by side. */
    @Bean
    public ThreadPoolTaskScheduler pipelineTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("pipeline-job-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }
}
