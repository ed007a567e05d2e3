package com.diseaseforecast.service;

import com.diseaseforecast.dto.DailyCaseRequest;
import com.diseaseforecast.dto.DailyCaseResponse;
import com.diseaseforecast.dto.WeeklyCaseResponse;
import com.diseaseforecast.entity.DailyCase;
import com.diseaseforecast.entity.WeeklyCase;
import com.diseaseforecast.repository.DailyCaseRepository;
import com.diseaseforecast.repository.WeeklyCaseRepository;
import com.diseaseforecast.util.YearWeeks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CaseIngestionService {

    private final DailyCaseRepository  dailyCaseRepository;
    private final WeeklyCaseRepository weeklyCaseRepository;

    /**
     * Stores one day's count. A second submission for the same code and date leaves
     * the first one untouched and is reported with {@code created=false}.
     */
    public DailyCaseResponse submitDailyCase(DailyCaseRequest req) {
        String id = DailyCase.keyOf(req.getCode(), req.getDate());
        Optional<DailyCase> existing = dailyCaseRepository.findById(id);
        if (existing.isPresent()) {
            log.info("Duplicate daily case ignored | id={}", id);
            return toResponse(existing.get(), false);
        }

        DailyCase record = DailyCase.builder()
            .id(id)
            .caseDate(req.getDate())
            .cases(req.getCases())
            .code(req.getCode())
            .yearweek(YearWeeks.of(req.getDate()))
            .build();
        try {
            DailyCase saved = dailyCaseRepository.save(record);
            log.info("Daily case saved | id={} | cases={} | yearweek={}", id, saved.getCases(), saved.getYearweek());
            return toResponse(saved, true);
        } catch (DataIntegrityViolationException ex) {
            log.info("Duplicate daily case ignored (concurrent submit) | id={}", id);
            return toResponse(record, false);
        }
    }

    @Transactional(readOnly = true)
    public Optional<String> getLatestYearweek() {
        return dailyCaseRepository.findLatestYearweek();
    }

    @Transactional(readOnly = true)
    public List<WeeklyCaseResponse> getWeeklyStats(String yearweek) {
        List<WeeklyCase> rows = yearweek != null
            ? weeklyCaseRepository.findByYearweekOrderByCasesDesc(YearWeeks.validate(yearweek))
            : weeklyCaseRepository.findAllByOrderByYearweekDescCasesDesc();
        return rows.stream().map(CaseIngestionService::toWeeklyResponse).toList();
    }

    static WeeklyCaseResponse toWeeklyResponse(WeeklyCase w) {
        return WeeklyCaseResponse.builder()
            .yearweek(w.getYearweek()).code(w.getCode())
            .cases(w.getCases()).mondayOfWeek(w.getMondayOfWeek())
            .build();
    }

    private DailyCaseResponse toResponse(DailyCase d, boolean created) {
        return DailyCaseResponse.builder()
            .id(d.getId()).date(d.getCaseDate()).code(d.getCode())
            .cases(d.getCases()).yearweek(d.getYearweek())
            .created(created)
            .build();
    }
}
