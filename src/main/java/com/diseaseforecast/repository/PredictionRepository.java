package com.diseaseforecast.repository;

import com.diseaseforecast.entity.PredictionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface PredictionRepository extends JpaRepository<PredictionRecord, String> {

    List<PredictionRecord> findByCodeAndModelVersionOrderByYearweekAsc(String code, String modelVersion);

    List<PredictionRecord> findByCodeOrderByYearweekAsc(String code);

    List<PredictionRecord> findByModelVersionOrderByCodeAscYearweekAsc(String modelVersion);

    List<PredictionRecord> findAllByOrderByCodeAscYearweekAsc();

    @Query("SELECT MAX(p.yearweek) FROM PredictionRecord p WHERE p.actual = false")
    Optional<String> findLatestForecastYearweek();

    /** Forecast rows of a week, newest first within each code. */
    List<PredictionRecord> findByYearweekAndActualFalseOrderByCodeAscCreatedAtDescIdDesc(String yearweek);
}
