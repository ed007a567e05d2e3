package com.diseaseforecast.repository;

import com.diseaseforecast.entity.DailyCase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface DailyCaseRepository extends JpaRepository<DailyCase, String> {

    @Query("""
        SELECT new com.diseaseforecast.repository.WeeklyTotal(d.code, d.yearweek, SUM(d.cases), MIN(d.caseDate))
        FROM DailyCase d
        WHERE d.yearweek = :yearweek
        GROUP BY d.code, d.yearweek
    """)
    List<WeeklyTotal> sumByCodeForYearweek(@Param("yearweek") String yearweek);

    @Query("""
        SELECT new com.diseaseforecast.repository.WeeklyTotal(d.code, d.yearweek, SUM(d.cases), MIN(d.caseDate))
        FROM DailyCase d
        WHERE NOT EXISTS (
            SELECT 1 FROM WeeklyCase w
            WHERE w.yearweek = d.yearweek AND w.code = d.code
        )
        GROUP BY d.code, d.yearweek
    """)
    List<WeeklyTotal> sumByCodeForUnaggregatedWeeks();

    @Query("SELECT MAX(d.yearweek) FROM DailyCase d")
    Optional<String> findLatestYearweek();

    List<DailyCase> findByCodeAndYearweek(String code, String yearweek);
}
