package com.diseaseforecast.service;

import com.diseaseforecast.dto.AggregationResult;
import com.diseaseforecast.dto.AnomalyCheckResponse;
import com.diseaseforecast.dto.CodeOutcome;
import com.diseaseforecast.dto.CodeOutcomeStatus;
import com.diseaseforecast.dto.PredictionResponse;
import com.diseaseforecast.dto.TrainingCycleReport;
import com.diseaseforecast.entity.ModelArtifact;
import com.diseaseforecast.entity.PredictionRecord;
import com.diseaseforecast.exception.AggregationFailureException;
import com.diseaseforecast.exception.InsufficientDataException;
import com.diseaseforecast.exception.InvalidForecastHorizonException;
import com.diseaseforecast.repository.WeeklyCaseRepository;
import com.diseaseforecast.timeseries.ForecastPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static com.diseaseforecast.service.PipelineGuard.NOTIFICATION_LOCK;
import static com.diseaseforecast.service.PipelineGuard.WEEKLY_CASE_LOCK;

/**
 * Entry points shared by REST callers and scheduled jobs.
 * <p>
 * Codes are processed one after another; a failing code is recorded in the cycle report and
 * the cycle moves on. Aggregation failures are never contained since everything downstream
 * reads weekly_case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private final AggregationService      aggregationService;
    private final ModelStoreService       modelStoreService;
    private final ForecastService         forecastService;
    private final AnomalyDetectionService anomalyDetectionService;
    private final WeeklyCaseRepository    weeklyCaseRepository;
    private final PipelineGuard           guard;
    private final Clock                   clock;

    @Value("${pipeline.forecast.max-steps:52}")
    private int maxSteps;

    public AggregationResult runWeeklyAggregation(String targetYearweek) {
        String target = targetYearweek != null ? targetYearweek : "all unaggregated weeks";
        return aggregate(target, () -> aggregationService.aggregate(targetYearweek));
    }

    public AggregationResult runLatestWeekAggregation() {
        return aggregate("latest week", aggregationService::aggregateLatest);
    }

    public TrainingCycleReport runTrainingCycle(int forecastSteps) {
        validateSteps(forecastSteps);
        return guard.exclusive(WEEKLY_CASE_LOCK, () -> {
            Instant startedAt = Instant.now(clock);
            List<String> codes = weeklyCaseRepository.findDistinctCodes();
            log.info("Training cycle started | codes={} | steps={}", codes.size(), forecastSteps);

            List<CodeOutcome> outcomes = new ArrayList<>(codes.size());
            for (String code : codes) {
                outcomes.add(trainAndForecast(code, forecastSteps));
            }

            TrainingCycleReport report = TrainingCycleReport.builder()
                .forecastSteps(forecastSteps)
                .startedAt(startedAt)
                .completedAt(Instant.now(clock))
                .outcomes(outcomes)
                .build();
            log.info("Training cycle completed | succeeded={} | skipped={} | failed={}",
                     report.getSucceeded(), report.getSkipped(), report.getFailed());
            return report;
        });
    }

    /** Forecasts again from an already stored model version, without retraining. */
    public List<PredictionResponse> forecastFromStoredModel(String code, String version, int forecastSteps) {
        validateSteps(forecastSteps);
        return guard.exclusive(WEEKLY_CASE_LOCK, () -> {
            ModelArtifact artifact = modelStoreService.load(code, version);
            List<ForecastPoint> points = forecastService.forecast(artifact, forecastSteps);
            List<PredictionRecord> saved = forecastService.persistPredictions(code, version, points);
            log.info("Stored model forecast | code={} | version={} | predictions={}", code, version, saved.size());
            return forecastService.toResponses(saved);
        });
    }

    public AnomalyCheckResponse checkAnomalies(String targetYearweek) {
        return guard.exclusive(NOTIFICATION_LOCK, () -> anomalyDetectionService.checkAndNotify(targetYearweek));
    }

    private AggregationResult aggregate(String target, Supplier<AggregationResult> action) {
        return guard.exclusive(WEEKLY_CASE_LOCK, () -> {
            log.info("Weekly aggregation started | target={}", target);
            try {
                AggregationResult result = action.get();
                log.info("Weekly aggregation completed | target={} | weeksWritten={}", target, result.getWeeksWritten());
                return result;
            } catch (DataAccessException | TransactionException ex) {
                log.error("Weekly aggregation failed | target={} | reason={}", target, ex.getMessage(), ex);
                throw new AggregationFailureException(target, ex);
            }
        });
    }

    private CodeOutcome trainAndForecast(String code, int steps) {
        try {
            long observations = weeklyCaseRepository.countByCode(code);
            if (observations == 0) {
                log.warn("Training cycle | code={} | status=SKIPPED | reason=no weekly cases", code);
                return skipped(code, "No weekly cases");
            }
            ModelArtifact artifact = modelStoreService.train(code);
            List<ForecastPoint> points = forecastService.forecast(artifact, steps);
            List<PredictionRecord> saved = forecastService.persistPredictions(code, artifact.getVersion(), points);
            log.info("Training cycle | code={} | status=SUCCEEDED | version={} | predictions={}",
                     code, artifact.getVersion(), saved.size());
            return CodeOutcome.builder()
                .code(code)
                .status(CodeOutcomeStatus.SUCCEEDED)
                .modelVersion(artifact.getVersion())
                .observations(artifact.getObservationCount())
                .predictionsWritten(saved.size())
                .build();
        } catch (InsufficientDataException ex) {
            log.warn("Training cycle | code={} | status=SKIPPED | reason={}", code, ex.getMessage());
            return skipped(code, ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Training cycle | code={} | status=FAILED | reason={}", code, ex.getMessage(), ex);
            return CodeOutcome.builder()
                .code(code)
                .status(CodeOutcomeStatus.FAILED)
                .message(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName())
                .build();
        }
    }

    private CodeOutcome skipped(String code, String reason) {
        return CodeOutcome.builder().code(code).status(CodeOutcomeStatus.SKIPPED).message(reason).build();
    }

    private void validateSteps(int steps) {
        if (steps < 1 || steps > maxSteps) {
            throw new InvalidForecastHorizonException(steps, maxSteps);
        }
    }
}
