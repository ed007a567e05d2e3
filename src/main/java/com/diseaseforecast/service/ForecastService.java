package com.diseaseforecast.service;

import com.diseaseforecast.dto.PredictionResponse;
import com.diseaseforecast.entity.ModelArtifact;
import com.diseaseforecast.entity.PredictionRecord;
import com.diseaseforecast.exception.InsufficientDataException;
import com.diseaseforecast.exception.PersistenceFailureException;
import com.diseaseforecast.repository.PredictionRepository;
import com.diseaseforecast.repository.WeeklyCaseRepository;
import com.diseaseforecast.timeseries.ForecastPoint;
import com.diseaseforecast.util.YearWeeks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {

    private final PredictionRepository predictionRepository;
    private final WeeklyCaseRepository weeklyCaseRepository;
    private final ModelPayloadCodec    codec;
    private final Clock                clock;

    @Value("${pipeline.forecast.confidence-level:0.95}")
    private double confidenceLevel;

    /** Next {@code steps} weeks after the artifact's training window, oldest first. */
    public List<ForecastPoint> forecast(ModelArtifact artifact, int steps) {
        return codec.decode(artifact).forecast(steps, confidenceLevel);
    }

    /**
     * Writes one forecast row per point, for the weeks following the latest aggregated week of
     * {@code code}. Rows are keyed by code, target week and model version and overwritten in place.
     */
    @Transactional
    public List<PredictionRecord> persistPredictions(String code, String modelVersion, List<ForecastPoint> points) {
        if (points.isEmpty()) {
            return List.of();
        }
        String lastWeek = weeklyCaseRepository.findLatestYearweek(code)
            .orElseThrow(() -> new InsufficientDataException(code));
        Instant now = Instant.now(clock);

        List<String> targets = new ArrayList<>(points.size());
        for (int i = 1; i <= points.size(); i++) {
            targets.add(YearWeeks.plusWeeks(lastWeek, i));
        }
        Map<String, PredictionRecord> existing = predictionRepository.findAllById(
                targets.stream().map(t -> PredictionRecord.keyOf(code, t, modelVersion)).toList())
            .stream()
            .collect(Collectors.toMap(PredictionRecord::getId, Function.identity()));

        List<PredictionRecord> rows = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            String target = targets.get(i);
            String id = PredictionRecord.keyOf(code, target, modelVersion);
            ForecastPoint point = points.get(i);
            PredictionRecord row = existing.getOrDefault(id, PredictionRecord.builder()
                .id(id).code(code).yearweek(target).modelVersion(modelVersion).build());
            row.setMondayOfWeek(YearWeeks.mondayOf(target));
            row.setPredictedCases(point.predicted());
            row.setConfidenceLower(point.lower());
            row.setConfidenceUpper(point.upper());
            row.setCreatedAt(now);
            row.setActual(false);
            rows.add(row);
        }

        try {
            List<PredictionRecord> saved = predictionRepository.saveAllAndFlush(rows);
            log.info("Predictions saved | code={} | version={} | weeks={}..{}",
                     code, modelVersion, targets.get(0), targets.get(targets.size() - 1));
            return saved;
        } catch (DataAccessException ex) {
            throw new PersistenceFailureException(
                "Could not save predictions for " + code + " / " + modelVersion, ex);
        }
    }

    @Transactional(readOnly = true)
    public List<PredictionResponse> getPredictions(String code, String modelVersion) {
        List<PredictionRecord> rows;
        if (code != null && modelVersion != null) {
            rows = predictionRepository.findByCodeAndModelVersionOrderByYearweekAsc(code, modelVersion);
        } else if (code != null) {
            rows = predictionRepository.findByCodeOrderByYearweekAsc(code);
        } else if (modelVersion != null) {
            rows = predictionRepository.findByModelVersionOrderByCodeAscYearweekAsc(modelVersion);
        } else {
            rows = predictionRepository.findAllByOrderByCodeAscYearweekAsc();
        }
        return toResponses(rows);
    }

    public List<PredictionResponse> toResponses(List<PredictionRecord> rows) {
        return rows.stream().map(this::toResponse).toList();
    }

    private PredictionResponse toResponse(PredictionRecord r) {
        return PredictionResponse.builder()
            .predictionId(r.getId()).code(r.getCode()).yearweek(r.getYearweek())
            .mondayOfWeek(r.getMondayOfWeek()).predictedCases(r.getPredictedCases())
            .confidenceLower(r.getConfidenceLower()).confidenceUpper(r.getConfidenceUpper())
            .modelVersion(r.getModelVersion()).createdAt(r.getCreatedAt()).actual(r.isActual())
            .build();
    }
}
