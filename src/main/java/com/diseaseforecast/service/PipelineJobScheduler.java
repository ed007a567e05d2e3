package com.diseaseforecast.service;

import com.diseaseforecast.dto.AggregationResult;
import com.diseaseforecast.dto.JobStatusResponse;
import com.diseaseforecast.dto.TrainingCycleReport;
import com.diseaseforecast.exception.JobNotFoundException;
import com.diseaseforecast.util.YearWeeks;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Calendar jobs of the pipeline: weekly aggregation at the end of each week and the training
 * cycle on the last day of each month. Job failures are logged and never reach the scheduler
 * thread.
 */
@Slf4j
@Service
public class PipelineJobScheduler {

    public static final String WEEKLY_AGGREGATION = "weekly_aggregation";
    public static final String MONTHLY_MODEL_TRAINING = "monthly_model_training";

    private final TaskScheduler taskScheduler;
    private final PipelineOrchestrator orchestrator;
    private final Clock clock;
    private final boolean enabled;
    private final int forecastSteps;

    private final Map<String, JobDefinition> jobs = new LinkedHashMap<>();
    private final ConcurrentHashMap<String, ScheduledFuture<?>> scheduled = new ConcurrentHashMap<>();

    public PipelineJobScheduler(TaskScheduler taskScheduler,
                                PipelineOrchestrator orchestrator,
                                Clock clock,
                                @Value("${pipeline.scheduler.enabled:true}") boolean enabled,
                                @Value("${pipeline.scheduler.weekly-aggregation-cron:0 59 23 * * SUN}") String weeklyCron,
                                @Value("${pipeline.scheduler.monthly-training-cron:0 0 23 L * *}") String monthlyCron,
                                @Value("${pipeline.forecast.default-steps:4}") int forecastSteps) {
        this.taskScheduler = taskScheduler;
        this.orchestrator = orchestrator;
        this.clock = clock;
        this.enabled = enabled;
        this.forecastSteps = forecastSteps;
        register(new JobDefinition(WEEKLY_AGGREGATION, "Weekly Case Aggregation",
            weeklyCron, this::weeklyAggregationJob));
        register(new JobDefinition(MONTHLY_MODEL_TRAINING, "Monthly Model Training and Forecasting",
            monthlyCron, this::monthlyTrainingJob));
    }

    @PostConstruct
    void init() {
        if (enabled) {
            startAll();
        } else {
            log.info("Pipeline scheduler disabled | jobs={}", jobs.keySet());
        }
    }

    @PreDestroy
    void shutdown() {
        stopAll();
    }

    public JobStatusResponse start(String name) {
        JobDefinition job = find(name);
        scheduled.computeIfAbsent(name, n -> taskScheduler.schedule(job.task(), new CronTrigger(job.cron(), clock.getZone())));
        log.info("Job started | name={} | cron={} | nextRun={}", name, job.cron(), nextRun(job));
        return toStatus(job);
    }

    public JobStatusResponse stop(String name) {
        JobDefinition job = find(name);
        ScheduledFuture<?> future = scheduled.remove(name);
        if (future != null) {
            future.cancel(false);
            log.info("Job stopped | name={}", name);
        } else {
            log.info("Job was not running | name={}", name);
        }
        return toStatus(job);
    }

    public void startAll() {
        jobs.keySet().forEach(this::start);
    }

    public void stopAll() {
        jobs.keySet().forEach(this::stop);
    }

    public List<JobStatusResponse> status() {
        return jobs.values().stream().map(this::toStatus).toList();
    }

    public JobStatusResponse status(String name) {
        return toStatus(find(name));
    }

    /** Runs a job body on the calling thread, exactly as the trigger would. */
    public JobStatusResponse runNow(String name) {
        JobDefinition job = find(name);
        log.info("Job triggered manually | name={}", name);
        job.task().run();
        return toStatus(job);
    }

    void weeklyAggregationJob() {
        String yearweek = YearWeeks.of(LocalDate.now(clock));
        log.info("Job weekly_aggregation started | yearweek={}", yearweek);
        try {
            AggregationResult result = orchestrator.runWeeklyAggregation(yearweek);
            log.info("Job weekly_aggregation completed | yearweek={} | weeksWritten={}",
                     yearweek, result.getWeeksWritten());
        } catch (RuntimeException ex) {
            log.error("Job weekly_aggregation failed | yearweek={} | reason={}", yearweek, ex.getMessage(), ex);
        }
    }

    void monthlyTrainingJob() {
        log.info("Job monthly_model_training started | steps={}", forecastSteps);
        try {
            TrainingCycleReport report = orchestrator.runTrainingCycle(forecastSteps);
            log.info("Job monthly_model_training completed | succeeded={} | skipped={} | failed={}",
                     report.getSucceeded(), report.getSkipped(), report.getFailed());
        } catch (RuntimeException ex) {
            log.error("Job monthly_model_training failed | reason={}", ex.getMessage(), ex);
        }
    }

    private void register(JobDefinition job) {
        // fail fast on a bad expression
        CronExpression.parse(job.cron());
        jobs.put(job.name(), job);
    }

    private JobDefinition find(String name) {
        JobDefinition job = jobs.get(name);
        if (job == null) {
            throw new JobNotFoundException(name);
        }
        return job;
    }

    private JobStatusResponse toStatus(JobDefinition job) {
        boolean running = scheduled.containsKey(job.name());
        return JobStatusResponse.builder()
            .name(job.name())
            .description(job.description())
            .cron(job.cron())
            .running(running)
            .nextRunTime(running ? nextRun(job) : null)
            .build();
    }

    private ZonedDateTime nextRun(JobDefinition job) {
        return CronExpression.parse(job.cron()).next(ZonedDateTime.now(clock));
    }

    private record JobDefinition(String name, String description, String cron, Runnable task) {
    }
}
