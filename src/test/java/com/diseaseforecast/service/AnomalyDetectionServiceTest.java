package com.diseaseforecast.service;

import com.diseaseforecast.dto.AnomalyCheckResponse;
import com.diseaseforecast.entity.Notification;
import com.diseaseforecast.entity.PredictionRecord;
import com.diseaseforecast.entity.WeeklyCase;
import com.diseaseforecast.exception.InvalidYearweekException;
import com.diseaseforecast.repository.NotificationRepository;
import com.diseaseforecast.repository.PredictionRepository;
import com.diseaseforecast.repository.WeeklyCaseRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceTest {

    @Mock PredictionRepository   predictionRepository;
    @Mock WeeklyCaseRepository   weeklyCaseRepository;
    @Mock NotificationRepository notificationRepository;
    @InjectMocks AnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(service, "stdevMultiplier", 2.0);
    }

    private static PredictionRecord prediction(String code, String yearweek, double predicted, Instant createdAt) {
        return PredictionRecord.builder()
            .id(code + "/" + yearweek + "/v").code(code).yearweek(yearweek)
            .mondayOfWeek(LocalDate.of(2024, 1, 1)).predictedCases(predicted)
            .modelVersion("v").createdAt(createdAt).build();
    }

    private void history(String code, long... cases) {
        List<WeeklyCase> rows = Arrays.stream(cases)
            .mapToObj(c -> WeeklyCase.builder().code(code).cases(c).build())
            .toList();
        when(weeklyCaseRepository.findByCodeAndYearweekLikeAndYearweekLessThan(code, "____01", "202400"))
            .thenReturn(rows);
    }

    private void forecasts(PredictionRecord... rows) {
        when(predictionRepository.findByYearweekAndActualFalseOrderByCodeAscCreatedAtDescIdDesc("202401"))
            .thenReturn(List.of(rows));
    }

    @Test
    void predictionEqualToThreshold_doesNotNotify() {
        history("A90", 9, 11, 13);
        forecasts(prediction("A90", "202401", 15.0, Instant.now()));

        assertThat(service.checkAndNotify("202401").getNotificationsCreated()).isZero();
        verify(notificationRepository, never()).saveAndFlush(any());
    }

    @Test
    void predictionAboveThreshold_notifiesOnce() {
        history("A90", 9, 11, 13);
        forecasts(prediction("A90", "202401", 16.0, Instant.now()));

        assertThat(service.checkAndNotify("202401").getNotificationsCreated()).isEqualTo(1);

        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getCode()).isEqualTo("A90");
        assertThat(captor.getValue().getYearweek()).isEqualTo("202401");
        assertThat(captor.getValue().getMessage())
            .startsWith("Predicted anomaly for week 202401")
            .contains("A90", "16.00", "15.00");
    }

    @Test
    void spikeOverHistory_notifies() {
        history("A90", 10, 12, 11);
        forecasts(prediction("A90", "202401", 50.0, Instant.now()));

        assertThat(service.checkAndNotify("202401").getNotificationsCreated()).isEqualTo(1);
    }

    @Test
    void singleHistoricalWeek_usesZeroStdev() {
        history("A90", 10);
        forecasts(prediction("A90", "202401", 10.5, Instant.now()));

        assertThat(service.baseline("A90", "202401")).get()
            .satisfies(b -> {
                assertThat(b.samples()).isEqualTo(1);
                assertThat(b.stdev()).isZero();
            });
        assertThat(service.checkAndNotify("202401").getNotificationsCreated()).isEqualTo(1);
    }

    @Test
    void noHistory_skipsCode() {
        when(weeklyCaseRepository.findByCodeAndYearweekLikeAndYearweekLessThan(anyString(), anyString(), anyString()))
            .thenReturn(List.of());
        forecasts(prediction("A90", "202401", 500.0, Instant.now()));

        assertThat(service.checkAndNotify("202401").getNotificationsCreated()).isZero();
        verifyNoInteractions(notificationRepository);
    }

    @Test
    void alreadyNotified_isNotRepeated() {
        history("A90", 10, 12, 11);
        forecasts(prediction("A90", "202401", 50.0, Instant.now()));
        when(notificationRepository.existsByCodeAndYearweek("A90", "202401")).thenReturn(true);

        assertThat(service.checkAndNotify("202401").getNotificationsCreated()).isZero();
        verify(notificationRepository, never()).saveAndFlush(any());
    }

    @Test
    void onlyNewestForecastPerCodeIsTested() {
        history("A90", 10, 12, 11);
        Instant now = Instant.parse("2024-01-02T00:00:00Z");
        forecasts(prediction("A90", "202401", 11.0, now),
                  prediction("A90", "202401", 80.0, now.minusSeconds(3600)));

        assertThat(service.checkAndNotify("202401").getNotificationsCreated()).isZero();
    }

    @Test
    void everyCodeOfTheWeekIsChecked() {
        history("A90", 10, 12, 11);
        history("B20", 100, 110, 105);
        forecasts(prediction("A90", "202401", 50.0, Instant.now()),
                  prediction("B20", "202401", 106.0, Instant.now()));

        assertThat(service.checkAndNotify("202401").getNotificationsCreated()).isEqualTo(1);
    }

    @Test
    void noTarget_usesLatestForecastWeek() {
        when(predictionRepository.findLatestForecastYearweek()).thenReturn(Optional.of("202401"));
        history("A90", 10, 12, 11);
        forecasts(prediction("A90", "202401", 50.0, Instant.now()));

        AnomalyCheckResponse result = service.checkAndNotify(null);

        assertThat(result.getYearweek()).isEqualTo("202401");
        assertThat(result.getNotificationsCreated()).isEqualTo(1);
    }

    @Test
    void noForecastsAtAll_returnsZero() {
        when(predictionRepository.findLatestForecastYearweek()).thenReturn(Optional.empty());

        AnomalyCheckResponse result = service.checkAndNotify(null);

        assertThat(result.getYearweek()).isNull();
        assertThat(result.getNotificationsCreated()).isZero();
        verifyNoInteractions(weeklyCaseRepository, notificationRepository);
    }

    @Test
    void invalidTarget_isRejected() {
        assertThatThrownBy(() -> service.checkAndNotify("2024W1"))
            .isInstanceOf(InvalidYearweekException.class);
    }
}
