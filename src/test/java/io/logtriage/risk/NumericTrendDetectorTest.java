package io.logtriage.risk;

import io.logtriage.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NumericTrendDetectorTest {
    private final NumericTrendDetector detector = new NumericTrendDetector(3);

    @Test
    void risingDiskUsageFires() {
        List<EscalationSignal> signals = detector.detect("storage", Timelines.of(
                Fixtures.warn(1, "10:00:00", "storage", "disk usage 70%"),
                Fixtures.warn(2, "10:05:00", "storage", "disk usage 75%"),
                Fixtures.warn(3, "10:10:00", "storage", "disk usage 82%")
        ));

        assertEquals(1, signals.size());
        assertEquals(SignalType.NUMERIC_TREND, signals.get(0).type());
        assertEquals("disk_percent: 70 -> 82 over 3 samples", signals.get(0).detail());
    }

    @Test
    void twoSamplesAreNotATrend() {
        assertTrue(detector.detect("storage", Timelines.of(
                Fixtures.warn(1, "10:00:00", "storage", "disk usage 70%"),
                Fixtures.warn(2, "10:05:00", "storage", "disk usage 90%")
        )).isEmpty());
    }

    @Test
    void dipResetsTheRun() {
        List<EscalationSignal> signals = detector.detect("storage", Timelines.of(
                Fixtures.warn(1, "10:00:00", "storage", "disk usage 70%"),
                Fixtures.warn(2, "10:01:00", "storage", "disk usage 60%"),
                Fixtures.warn(3, "10:02:00", "storage", "disk usage 75%"),
                Fixtures.warn(4, "10:03:00", "storage", "disk usage 80%"),
                Fixtures.warn(5, "10:04:00", "storage", "disk usage 85%")
        ));

        assertEquals(1, signals.size());
        assertEquals("disk_percent: 60 -> 85 over 4 samples", signals.get(0).detail());
        assertEquals(List.of(2, 3, 4, 5), signals.get(0).entries().stream().map(e -> e.lineNumber()).toList());
    }

    @Test
    void flatSeriesDoesNotFire() {
        assertTrue(detector.detect("api", Timelines.of(
                Fixtures.warn(1, "10:00:00", "api", "latency 200ms"),
                Fixtures.warn(2, "10:01:00", "api", "latency 200ms"),
                Fixtures.warn(3, "10:02:00", "api", "latency 200ms")
        )).isEmpty());
    }

    @Test
    void shrinkingFreeCapacityIsWorsening() {
        List<EscalationSignal> signals = detector.detect("db", Timelines.of(
                Fixtures.warn(1, "10:00:00", "db", "volume has 2 GB free"),
                Fixtures.warn(2, "10:01:00", "db", "volume has 1 GB free"),
                Fixtures.warn(3, "10:02:00", "db", "volume has 512 MB free")
        ));

        assertEquals(1, signals.size());
        assertEquals("free_capacity: 2048 -> 512 over 3 samples", signals.get(0).detail());
    }

    @Test
    void growingFreeCapacityDoesNotFire() {
        assertTrue(detector.detect("db", Timelines.of(
                Fixtures.warn(1, "10:00:00", "db", "volume has 512 MB free"),
                Fixtures.warn(2, "10:01:00", "db", "volume has 1 GB free"),
                Fixtures.warn(3, "10:02:00", "db", "volume has 2 GB free")
        )).isEmpty());
    }

    @Test
    void risingFreeDiskPercentIsNotADiskUsageTrend() {
        assertTrue(detector.detect("storage", Timelines.of(
                Fixtures.warn(1, "10:00:00", "storage", "disk free space at 60%"),
                Fixtures.warn(2, "10:01:00", "storage", "disk free space at 70%"),
                Fixtures.warn(3, "10:02:00", "storage", "disk free space at 80%")
        )).isEmpty());
    }

    @Test
    void everyMetricOnALineIsSampled() {
        List<EscalationSignal> signals = detector.detect("node", Timelines.of(
                Fixtures.warn(1, "10:00:00", "node", "cpu 40%, disk usage 70%"),
                Fixtures.warn(2, "10:01:00", "node", "cpu 40%, disk usage 80%"),
                Fixtures.warn(3, "10:02:00", "node", "cpu 40%, disk usage 90%")
        ));

        assertEquals(1, signals.size());
        assertEquals("disk_percent: 70 -> 90 over 3 samples", signals.get(0).detail());
    }
}
