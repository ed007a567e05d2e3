package com.diseaseforecast.controller;

import com.diseaseforecast.repository.DailyCaseRepository;
import com.diseaseforecast.repository.WeeklyCaseRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class CaseControllerIntegrationTest {

    @Autowired TestRestTemplate     restTemplate;
    @Autowired DailyCaseRepository  dailyCaseRepository;
    @Autowired WeeklyCaseRepository weeklyCaseRepository;

    @AfterEach
    void cleanUp() {
        weeklyCaseRepository.deleteAll();
        dailyCaseRepository.deleteAll();
    }

    private Map<String, Object> dailyCase(String date, String code, int cases) {
        Map<String, Object> body = new HashMap<>();
        body.put("date", date);
        body.put("code", code);
        body.put("cases", cases);
        return body;
    }

    @Test
    void submitDailyCase_returnsCreatedThenOkForDuplicate() {
        ResponseEntity<Map> first = restTemplate.postForEntity("/api/v1/cases", dailyCase("2024-01-01", "A90", 5), Map.class);
        assertThat(first.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(first.getBody()).containsEntry("yearweek", "202401").containsEntry("created", true);

        ResponseEntity<Map> second = restTemplate.postForEntity("/api/v1/cases", dailyCase("2024-01-01", "A90", 9), Map.class);
        assertThat(second.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(second.getBody()).containsEntry("created", false).containsEntry("cases", 5);
    }

    @Test
    void submitDailyCase_invalidBody_returns422WithFieldErrors() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/cases", dailyCase("2024-01-01", "", -1), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsEntry("errorCode", "VALIDATION_FAILED");
        assertThat((List<?>) resp.getBody().get("fieldErrors")).hasSize(2);
    }

    @Test
    void submitDailyCase_missingCases_returns422AndStoresNothing() {
        Map<String, Object> body = dailyCase("2024-01-01", "A90", 0);
        body.remove("cases");

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/cases", body, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat((List<Map<String, Object>>) resp.getBody().get("fieldErrors"))
            .singleElement()
            .satisfies(fe -> assertThat(fe).containsEntry("field", "cases").containsEntry("message", "cases is required"));
        assertThat(dailyCaseRepository.count()).isZero();

        ResponseEntity<Map> retry = restTemplate.postForEntity("/api/v1/cases", dailyCase("2024-01-01", "A90", 7), Map.class);
        assertThat(retry.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(retry.getBody()).containsEntry("cases", 7);
    }

    @Test
    void aggregateThenReadWeeklyStats() {
        restTemplate.postForEntity("/api/v1/cases", dailyCase("2024-01-01", "A90", 5), Map.class);
        restTemplate.postForEntity("/api/v1/cases", dailyCase("2024-01-03", "A90", 3), Map.class);

        ResponseEntity<Map> agg = restTemplate.postForEntity("/api/v1/aggregations?yearweek=202401", null, Map.class);
        assertThat(agg.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(agg.getBody()).containsEntry("weeksWritten", 1).containsEntry("mode", "TARGET_WEEK");

        ResponseEntity<List> weekly = restTemplate.getForEntity("/api/v1/weekly-cases?yearweek=202401", List.class);
        assertThat(weekly.getBody()).hasSize(1);
        Map<?, ?> row = (Map<?, ?>) weekly.getBody().get(0);
        assertThat(row.get("code")).isEqualTo("A90");
        assertThat(((Number) row.get("cases")).longValue()).isEqualTo(8L);
        assertThat(row.get("mondayOfWeek")).isEqualTo("2024-01-01");

        ResponseEntity<Map> latest = restTemplate.getForEntity("/api/v1/cases/latest-yearweek", Map.class);
        assertThat(latest.getBody()).containsEntry("yearweek", "202401");
    }

    @Test
    void latestYearweek_emptyStore_returns204() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/cases/latest-yearweek", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
    }

    @Test
    void aggregate_malformedYearweek_returns400() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/aggregations?yearweek=2024-1", null, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody()).containsEntry("errorCode", "INVALID_YEARWEEK");
    }
}
