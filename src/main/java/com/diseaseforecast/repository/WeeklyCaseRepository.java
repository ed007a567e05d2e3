package com.diseaseforecast.repository;

import com.diseaseforecast.entity.WeeklyCase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface WeeklyCaseRepository extends JpaRepository<WeeklyCase, String> {

    List<WeeklyCase> findByCodeOrderByMondayOfWeekAsc(String code);

    long countByCode(String code);

    @Query("SELECT DISTINCT w.code FROM WeeklyCase w ORDER BY w.code")
    List<String> findDistinctCodes();

    @Query("SELECT MAX(w.yearweek) FROM WeeklyCase w WHERE w.code = :code")
    Optional<String> findLatestYearweek(@Param("code") String code);

    List<WeeklyCase> findByYearweekOrderByCasesDesc(String yearweek);

    List<WeeklyCase> findAllByOrderByYearweekDescCasesDesc();

    /**
     * Same-week-number history before a year, e.g. pattern {@code "____01"} with
     * upper bound {@code "202400"} selects week 01 of every year up to 2023.
     */
    List<WeeklyCase> findByCodeAndYearweekLikeAndYearweekLessThan(
        String code, String yearweekPattern, String yearweekUpperBound);
}
