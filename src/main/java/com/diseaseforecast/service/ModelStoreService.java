package com.diseaseforecast.service;

import com.diseaseforecast.dto.ModelArtifactResponse;
import com.diseaseforecast.entity.ModelArtifact;
import com.diseaseforecast.entity.WeeklyCase;
import com.diseaseforecast.exception.InsufficientDataException;
import com.diseaseforecast.exception.ModelNotFoundException;
import com.diseaseforecast.repository.ModelArtifactRepository;
import com.diseaseforecast.repository.WeeklyCaseRepository;
import com.diseaseforecast.timeseries.SarimaOrder;
import com.diseaseforecast.timeseries.SeasonalArimaModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.List;

/**
 * Trains, versions and retrieves one seasonal model per ICD10 code.
 * <p>
 * Versions look like {@code A90_20240115_156_3f9a2c1b}: code, training date, number of weeks
 * in the training window and a fingerprint of the model order and series values. Retraining on the same
 * day with identical data reproduces the same version and payload; any change in the data
 * produces a new version. Old versions are kept.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelStoreService {

    private static final int FINGERPRINT_LENGTH = 8;

    private final WeeklyCaseRepository    weeklyCaseRepository;
    private final ModelArtifactRepository artifactRepository;
    private final ModelPayloadCodec       codec;
    private final Clock                   clock;

    @Value("${pipeline.model.ar-order:2}")
    private int arOrder;

    @Value("${pipeline.model.seasonal-differencing:1}")
    private int seasonalDifferencing;

    @Value("${pipeline.model.seasonal-ma-order:1}")
    private int seasonalMaOrder;

    @Value("${pipeline.model.seasonal-period:52}")
    private int seasonalPeriod;

    @Transactional
    public ModelArtifact train(String code) {
        List<WeeklyCase> series = weeklyCaseRepository.findByCodeOrderByMondayOfWeekAsc(code);
        if (series.isEmpty()) {
            throw new InsufficientDataException(code);
        }
        double[] values = weeklyValues(series);
        if (values.length > series.size()) {
            log.info("Missing weeks filled with zero | code={} | weeks={} | filled={}",
                     code, values.length, values.length - series.size());
        }
        SarimaOrder order = modelOrder();
        SeasonalArimaModel model = SeasonalArimaModel.fit(values, order);

        LocalDate today = LocalDate.now(clock);
        String version = versionOf(code, today, values, order);
        ModelArtifact artifact = artifactRepository.findByCodeAndVersion(code, version)
            .orElseGet(() -> ModelArtifact.builder().code(code).version(version).build());
        artifact.setTrainedOn(today);
        artifact.setObservationCount(values.length);
        artifact.setSeasonalPeriod(order.period());
        artifact.setPayload(codec.encode(model));
        ModelArtifact saved = artifactRepository.save(artifact);

        log.info("Model trained | code={} | version={} | observations={} | seasonalDiff={} | sigma2={}",
                 code, version, values.length, model.getAppliedSeasonalD(), model.getSigma2());
        return saved;
    }

    @Transactional(readOnly = true)
    public ModelArtifact load(String code, String version) {
        ModelArtifact artifact = artifactRepository.findByCodeAndVersion(code, version)
            .orElseThrow(() -> new ModelNotFoundException(code, version));
        log.info("Model loaded | code={} | version={}", code, version);
        return artifact;
    }

    @Transactional(readOnly = true)
    public List<ModelArtifactResponse> listVersions(String code) {
        return artifactRepository.findByCodeOrderByCreatedAtDesc(code).stream()
            .map(a -> ModelArtifactResponse.builder()
                .code(a.getCode()).version(a.getVersion()).trainedOn(a.getTrainedOn())
                .observationCount(a.getObservationCount()).seasonalPeriod(a.getSeasonalPeriod())
                .createdAt(a.getCreatedAt())
                .build())
            .toList();
    }

    /**
     * One value per calendar week from the first to the last Monday. Weeks without a row had no
     * reported cases and count as 0, so lag {@code s} stays one season back.
     */
    static double[] weeklyValues(List<WeeklyCase> series) {
        LocalDate first = series.get(0).getMondayOfWeek();
        LocalDate last = series.get(series.size() - 1).getMondayOfWeek();
        double[] values = new double[(int) ChronoUnit.WEEKS.between(first, last) + 1];
        for (WeeklyCase week : series) {
            values[(int) ChronoUnit.WEEKS.between(first, week.getMondayOfWeek())] += week.getCases();
        }
        return values;
    }

    SarimaOrder modelOrder() {
        return new SarimaOrder(arOrder, seasonalDifferencing, seasonalMaOrder, seasonalPeriod);
    }

    static String versionOf(String code, LocalDate trainedOn, double[] values, SarimaOrder order) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
        digest.update(order.toString().getBytes(StandardCharsets.UTF_8));
        ByteBuffer buffer = ByteBuffer.allocate(Double.BYTES * values.length);
        for (double v : values) {
            buffer.putDouble(v);
        }
        digest.update(buffer.array());
        String fingerprint = HexFormat.of().formatHex(digest.digest()).substring(0, FINGERPRINT_LENGTH);
        return code + "_" + trainedOn.format(DateTimeFormatter.BASIC_ISO_DATE) + "_" + values.length + "_" + fingerprint;
    }
}
