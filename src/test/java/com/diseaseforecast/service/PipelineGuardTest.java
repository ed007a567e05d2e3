package com.diseaseforecast.service;

import com.diseaseforecast.exception.PipelineBusyException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class PipelineGuardTest {

    private final PipelineGuard guard = new PipelineGuard();
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(guard, "waitSeconds", 0L);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void exclusive_returnsResultAndReleases() {
        assertThat(guard.exclusive(PipelineGuard.WEEKLY_CASE_LOCK, () -> 42)).isEqualTo(42);
        assertThat(guard.isHeld(PipelineGuard.WEEKLY_CASE_LOCK)).isFalse();
    }

    @Test
    void exclusive_releasesAfterFailure() {
        assertThatThrownBy(() -> guard.exclusive(PipelineGuard.WEEKLY_CASE_LOCK, () -> {
            throw new IllegalStateException("fail");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(guard.isHeld(PipelineGuard.WEEKLY_CASE_LOCK)).isFalse();
    }

    @Test
    void overlappingRunOnSameKey_isRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<String> running = executor.submit(() -> guard.exclusive(PipelineGuard.WEEKLY_CASE_LOCK, () -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return "first";
        }));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> guard.exclusive(PipelineGuard.WEEKLY_CASE_LOCK, () -> "second"))
            .isInstanceOf(PipelineBusyException.class)
            .extracting("errorCode").isEqualTo("PIPELINE_BUSY");
        assertThat(guard.exclusive(PipelineGuard.NOTIFICATION_LOCK, () -> "other")).isEqualTo("other");

        release.countDown();
        assertThat(running.get(5, TimeUnit.SECONDS)).isEqualTo("first");
        assertThat(guard.exclusive(PipelineGuard.WEEKLY_CASE_LOCK, () -> "third")).isEqualTo("third");
    }
}
