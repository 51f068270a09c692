package io.logtriage.correlate;

import io.logtriage.Fixtures;
import io.logtriage.model.LogEntry;
import io.logtriage.model.LogLevel;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

final class TemporalClustererTest {
    private final TemporalClusterer clusterer = new TemporalClusterer(Duration.ofSeconds(60));

    @Test
    void splitsWhereConsecutiveWarningsAreFurtherApartThanTheWindow() {
        TemporalClusterer.Result result = clusterer.cluster(List.of(
                Fixtures.warn(1, "10:00:00", "api", "slow"),
                Fixtures.warn(2, "10:00:30", "db", "slow"),
                Fixtures.warn(3, "10:02:00", "api", "slow")
        ));

        Assertions.assertEquals(2, result.clusters().size());
        Assertions.assertEquals(List.of(1, 2), lines(result.clusters().get(0)));
        Assertions.assertEquals(List.of(3), lines(result.clusters().get(1)));
    }

    @Test
    void chainsTransitivelyThroughIntermediateEntries() {
        TemporalClusterer.Result result = clusterer.cluster(List.of(
                Fixtures.warn(1, "10:00:00", "api", "a"),
                Fixtures.warn(2, "10:00:50", "db", "b"),
                Fixtures.warn(3, "10:01:40", "cache", "c")
        ));

        Assertions.assertEquals(1, result.clusters().size());
        Assertions.assertEquals(List.of(1, 2, 3), lines(result.clusters().get(0)));
    }

    @Test
    void gapExactlyEqualToWindowStaysTogether() {
        TemporalClusterer.Result result = clusterer.cluster(List.of(
                Fixtures.error(1, "10:00:00", "api", "a"),
                Fixtures.error(2, "10:01:00", "db", "b")
        ));
        Assertions.assertEquals(1, result.clusters().size());
    }

    @Test
    void sortsOutOfOrderInputAndIgnoresInfo() {
        TemporalClusterer.Result result = clusterer.cluster(List.of(
                Fixtures.error(5, "10:00:40", "db", "late"),
                Fixtures.info(6, "10:00:20", "api", "fine"),
                Fixtures.critical(7, "10:00:10", "api", "early")
        ));

        Assertions.assertEquals(1, result.clusters().size());
        Assertions.assertEquals(List.of(7, 5), lines(result.clusters().get(0)));
    }

    @Test
    void unparseableTimestampsAreSkippedAndReported() {
        LogEntry broken = Fixtures.entry(9, "yesterday-ish", LogLevel.ERROR, "api", "oops");
        TemporalClusterer.Result result = clusterer.cluster(List.of(
                broken,
                Fixtures.error(10, "10:00:00", "api", "fine")
        ));

        Assertions.assertEquals(List.of(broken), result.unparseable());
        Assertions.assertEquals(1, result.clusters().size());
        Assertions.assertEquals(List.of(10), lines(result.clusters().get(0)));
    }

    @Test
    void negativeWindowIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new TemporalClusterer(Duration.ofSeconds(-1)));
    }

    private static List<Integer> lines(List<TimedEntry> cluster) {
        return cluster.stream().map(t -> t.entry().lineNumber()).toList();
    }
}
