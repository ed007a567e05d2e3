package com.diseaseforecast.config;

import com.diseaseforecast.dto.DailyCaseRequest;
import jakarta.validation.Configuration;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineConfigTest {

    private final PipelineConfig config = new PipelineConfig();

    private Validator validatorAt(Clock clock) {
        Configuration<?> configuration = Validation.byDefaultProvider().configure();
        config.pipelineClockValidation(clock).customize(configuration);
        return configuration.buildValidatorFactory().getValidator();
    }

    private static DailyCaseRequest request(LocalDate date) {
        return DailyCaseRequest.builder().date(date).code("A90").cases(3).build();
    }

    @Test
    void pastOrPresent_usesPipelineZoneToday() {
        // 2030-06-01 10:30 in Kiritimati (UTC+14) is still 2030-05-31 in UTC
        Clock clock = Clock.fixed(Instant.parse("2030-05-31T20:30:00Z"), ZoneId.of("Pacific/Kiritimati"));

        Set<ConstraintViolation<DailyCaseRequest>> violations =
            validatorAt(clock).validate(request(LocalDate.of(2030, 6, 1)));

        assertThat(violations).isEmpty();
    }

    @Test
    void pastOrPresent_rejectsTomorrowInPipelineZone() {
        Clock clock = Clock.fixed(Instant.parse("2030-05-31T20:30:00Z"), ZoneId.of("Pacific/Kiritimati"));

        Set<ConstraintViolation<DailyCaseRequest>> violations =
            validatorAt(clock).validate(request(LocalDate.of(2030, 6, 2)));

        assertThat(violations).extracting(v -> v.getPropertyPath().toString()).containsExactly("date");
    }

    @Test
    void clock_followsConfiguredZone() {
        assertThat(config.clock("Asia/Tokyo").getZone()).isEqualTo(ZoneId.of("Asia/Tokyo"));
    }
}
