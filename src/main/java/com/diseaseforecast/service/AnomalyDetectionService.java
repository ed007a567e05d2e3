package com.diseaseforecast.service;

import com.diseaseforecast.dto.AnomalyCheckResponse;
import com.diseaseforecast.dto.NotificationResponse;
import com.diseaseforecast.entity.Notification;
import com.diseaseforecast.entity.PredictionRecord;
import com.diseaseforecast.entity.WeeklyCase;
import com.diseaseforecast.exception.PersistenceFailureException;
import com.diseaseforecast.repository.NotificationRepository;
import com.diseaseforecast.repository.PredictionRepository;
import com.diseaseforecast.repository.WeeklyCaseRepository;
import com.diseaseforecast.util.YearWeeks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One-sided control-limit check of forecasts against the same ISO week number in earlier years.
 * <p>
 * A forecast trips when {@code predicted > mean + k * stdev}, with the sample standard deviation
 * taken as 0 for a single historical week.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyDetectionService {

    private final PredictionRepository   predictionRepository;
    private final WeeklyCaseRepository   weeklyCaseRepository;
    private final NotificationRepository notificationRepository;

    @Value("${pipeline.anomaly.stdev-multiplier:2.0}")
    private double stdevMultiplier;

    /**
     * Tests the newest forecast of every code for the week, creating at most one notification per
     * (code, week).
     *
     * @param targetYearweek week to check; {@code null} uses the latest forecast week
     * @return the week actually checked and the number of notifications created
     */
    @Transactional
    public AnomalyCheckResponse checkAndNotify(String targetYearweek) {
        String yearweek = targetYearweek != null
            ? YearWeeks.validate(targetYearweek)
            : predictionRepository.findLatestForecastYearweek().orElse(null);
        if (yearweek == null) {
            log.info("Anomaly check skipped | reason=no forecasts");
            return AnomalyCheckResponse.builder().notificationsCreated(0).build();
        }

        Map<String, PredictionRecord> latestPerCode = new LinkedHashMap<>();
        for (PredictionRecord p : predictionRepository.findByYearweekAndActualFalseOrderByCodeAscCreatedAtDescIdDesc(yearweek)) {
            latestPerCode.putIfAbsent(p.getCode(), p);
        }

        int created = 0;
        for (PredictionRecord prediction : latestPerCode.values()) {
            if (evaluate(prediction, yearweek)) {
                created++;
            }
        }
        log.info("Anomaly check done | yearweek={} | codes={} | notifications={}",
                 yearweek, latestPerCode.size(), created);
        return AnomalyCheckResponse.builder().yearweek(yearweek).notificationsCreated(created).build();
    }

    public Optional<Baseline> baseline(String code, String yearweek) {
        List<WeeklyCase> history = weeklyCaseRepository.findByCodeAndYearweekLikeAndYearweekLessThan(
            code, "____" + YearWeeks.weekSuffix(yearweek), String.format("%04d00", YearWeeks.year(yearweek)));
        if (history.isEmpty()) {
            return Optional.empty();
        }
        SummaryStatistics stats = new SummaryStatistics();
        history.forEach(w -> stats.addValue(w.getCases()));
        return Optional.of(new Baseline(stats.getN(), stats.getMean(), stats.getStandardDeviation()));
    }

    @Transactional(readOnly = true)
    public List<NotificationResponse> listNotifications(String code) {
        List<Notification> rows = code != null
            ? notificationRepository.findByCodeOrderByCreatedAtDesc(code)
            : notificationRepository.findAllByOrderByCreatedAtDesc();
        return rows.stream()
            .map(n -> NotificationResponse.builder()
                .id(n.getId()).createdAt(n.getCreatedAt()).code(n.getCode())
                .yearweek(n.getYearweek()).message(n.getMessage())
                .build())
            .toList();
    }

    private boolean evaluate(PredictionRecord prediction, String yearweek) {
        String code = prediction.getCode();
        Optional<Baseline> baseline = baseline(code, yearweek);
        if (baseline.isEmpty()) {
            log.info("Anomaly check | code={} | yearweek={} | verdict=NO_BASELINE", code, yearweek);
            return false;
        }

        double predicted = prediction.getPredictedCases();
        double threshold = baseline.get().threshold(stdevMultiplier);
        if (predicted <= threshold) {
            log.debug("Anomaly check | code={} | yearweek={} | predicted={} | threshold={} | verdict=NORMAL",
                      code, yearweek, predicted, threshold);
            return false;
        }
        if (notificationRepository.existsByCodeAndYearweek(code, yearweek)) {
            log.info("Anomaly check | code={} | yearweek={} | verdict=ALREADY_NOTIFIED", code, yearweek);
            return false;
        }

        String message = String.format(Locale.ROOT,
            "Predicted anomaly for week %s: ICD10 %s predicted_cases=%.2f > threshold(mean+%.1f*stdev)=%.2f. "
                + "Cases next week are predicted to be anomalous, please beware.",
            yearweek, code, predicted, stdevMultiplier, threshold);
        try {
            notificationRepository.saveAndFlush(Notification.builder()
                .code(code).yearweek(yearweek).message(message).build());
        } catch (DataAccessException ex) {
            throw new PersistenceFailureException("Could not save notification for " + code + " / " + yearweek, ex);
        }
        log.warn("Anomaly notified | code={} | yearweek={} | predicted={} | threshold={}",
                 code, yearweek, predicted, threshold);
        return true;
    }

    public record Baseline(long samples, double mean, double stdev) {
        public double threshold(double multiplier) {
            return mean + multiplier * stdev;
        }
    }
}
