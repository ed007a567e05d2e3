package com.diseaseforecast.service;

import com.diseaseforecast.dto.AggregationResult;
import com.diseaseforecast.dto.AggregationResult.AggregationMode;
import com.diseaseforecast.entity.WeeklyCase;
import com.diseaseforecast.repository.DailyCaseRepository;
import com.diseaseforecast.repository.WeeklyCaseRepository;
import com.diseaseforecast.repository.WeeklyTotal;
import com.diseaseforecast.util.YearWeeks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Folds daily cases into weekly totals per ICD10 code.
 * <p>
 * Group selection and upsert run in one transaction; re-running for the same week
 * with unchanged daily data leaves {@code weekly_case} as it was.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationService {

    private final DailyCaseRepository  dailyCaseRepository;
    private final WeeklyCaseRepository weeklyCaseRepository;

    /**
     * @param targetYearweek week to recompute for every code; {@code null} backfills every
     *                       (code, week) pair that has daily cases but no weekly row yet
     */
    @Transactional
    public AggregationResult aggregate(String targetYearweek) {
        if (targetYearweek == null) {
            int written = upsert(dailyCaseRepository.sumByCodeForUnaggregatedWeeks());
            log.info("Aggregation done | mode=BACKFILL | weeksWritten={}", written);
            return AggregationResult.builder().mode(AggregationMode.BACKFILL).weeksWritten(written).build();
        }
        int written = upsert(dailyCaseRepository.sumByCodeForYearweek(YearWeeks.validate(targetYearweek)));
        log.info("Aggregation done | mode=TARGET_WEEK | yearweek={} | weeksWritten={}", targetYearweek, written);
        return AggregationResult.builder()
            .mode(AggregationMode.TARGET_WEEK).yearweek(targetYearweek).weeksWritten(written).build();
    }

    /** Recomputes the most recent week that has daily cases. */
    @Transactional
    public AggregationResult aggregateLatest() {
        Optional<String> latest = dailyCaseRepository.findLatestYearweek();
        if (latest.isEmpty()) {
            log.warn("Aggregation skipped | mode=LATEST_WEEK | reason=no daily cases");
            return AggregationResult.builder().mode(AggregationMode.LATEST_WEEK).weeksWritten(0).build();
        }
        int written = upsert(dailyCaseRepository.sumByCodeForYearweek(latest.get()));
        log.info("Aggregation done | mode=LATEST_WEEK | yearweek={} | weeksWritten={}", latest.get(), written);
        return AggregationResult.builder()
            .mode(AggregationMode.LATEST_WEEK).yearweek(latest.get()).weeksWritten(written).build();
    }

    private int upsert(List<WeeklyTotal> totals) {
        if (totals.isEmpty()) {
            return 0;
        }
        List<String> ids = totals.stream().map(t -> WeeklyCase.keyOf(t.code(), t.yearweek())).toList();
        Map<String, WeeklyCase> existing = weeklyCaseRepository.findAllById(ids).stream()
            .collect(Collectors.toMap(WeeklyCase::getId, Function.identity()));

        List<WeeklyCase> rows = new ArrayList<>(totals.size());
        for (WeeklyTotal total : totals) {
            String id = WeeklyCase.keyOf(total.code(), total.yearweek());
            WeeklyCase row = existing.getOrDefault(id, WeeklyCase.builder()
                .id(id).code(total.code()).yearweek(total.yearweek()).build());
            row.setCases(total.cases() != null ? total.cases() : 0L);
            row.setMondayOfWeek(YearWeeks.mondayOf(total.firstDate()));
            rows.add(row);
        }
        weeklyCaseRepository.saveAll(rows);
        return rows.size();
    }
}
