package org.neuralchilli.qrun.monitoring;

import org.junit.jupiter.api.Test;
import org.neuralchilli.qrun.domain.TaskResult;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RunMonitorTest {

    @Test
    void shouldCountOutcomes() {
        RunMonitor monitor = new RunMonitor();

        monitor.recordResult(TaskResult.completed("a", "f", Duration.ofMillis(10)));
        monitor.recordResult(TaskResult.skipped("b"));
        monitor.recordResult(TaskResult.failed("c", 1, "exited with status 1", Duration.ofMillis(5)));
        monitor.recordResult(TaskResult.timedOut("d", Duration.ofMillis(100), Duration.ofMillis(120)));
        monitor.recordFingerprintAdded();

        RunMonitor.RunStats stats = monitor.getStats();
        assertThat(stats.executed()).isEqualTo(3);
        assertThat(stats.skipped()).isEqualTo(1);
        assertThat(stats.failed()).isEqualTo(1);
        assertThat(stats.timedOut()).isEqualTo(1);
        assertThat(stats.fingerprintsAdded()).isEqualTo(1);
        assertThat(stats.totalTaskMillis()).isEqualTo(135);
        assertThat(stats.slowestTask()).isEqualTo("d");
        assertThat(stats.cacheHitRate()).isEqualTo(0.25);
    }

    @Test
    void shouldHaveZeroHitRateWhenNothingRan() {
        assertThat(new RunMonitor().getStats().cacheHitRate()).isZero();
    }
}
