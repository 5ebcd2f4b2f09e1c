package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.model.CodecStat;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

public class LockingCodecPerformanceTrackerTest {
    @Test
    public void testAggregatesPerCodec() {
        final LockingCodecPerformanceTracker tracker = new LockingCodecPerformanceTracker(Optional.empty());
        tracker.record("h264", 100, true);
        tracker.record("H264", 300, false);
        tracker.record("vp9", 50, true);
        tracker.record(null, 10, false);
        tracker.record(" ", 10, false);

        final List<CodecStat> stats = tracker.snapshot();
        Assertions.assertEquals(List.of("h264", "unknown", "vp9"),
                List.of(stats.get(0).getCodecName(), stats.get(1).getCodecName(), stats.get(2).getCodecName()));
        final CodecStat h264 = stats.get(0);
        Assertions.assertEquals(2, h264.getSampleCount());
        Assertions.assertEquals(1, h264.getSuccessCount());
        Assertions.assertEquals(400, h264.getTotalTimeMs());
        Assertions.assertEquals(200.0, h264.getAvgTimeMs(), 1e-9);
        Assertions.assertEquals(0.5, h264.getSuccessRate(), 1e-9);
        Assertions.assertEquals(2, stats.get(1).getSampleCount());
    }

    @Test
    public void testSnapshotIsDetached() {
        final LockingCodecPerformanceTracker tracker = new LockingCodecPerformanceTracker(Optional.empty());
        tracker.record("h264", 100, true);
        final List<CodecStat> before = tracker.snapshot();
        tracker.record("h264", 100, true);
        Assertions.assertEquals(1, before.get(0).getSampleCount());
        Assertions.assertThrows(UnsupportedOperationException.class, () -> before.add(before.get(0)));
        tracker.reset();
        Assertions.assertTrue(tracker.snapshot().isEmpty());
    }

    @Test
    public void testConcurrentRecording() throws InterruptedException {
        final LockingCodecPerformanceTracker tracker = new LockingCodecPerformanceTracker(Optional.empty());
        final ExecutorService executor = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 1000; i++) {
            final boolean success = i % 4 != 0;
            executor.submit(() -> tracker.record("hevc", 2, success));
        }
        executor.shutdown();
        Assertions.assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        final CodecStat stat = tracker.snapshot().get(0);
        Assertions.assertEquals(1000, stat.getSampleCount());
        Assertions.assertEquals(750, stat.getSuccessCount());
        Assertions.assertEquals(2000, stat.getTotalTimeMs());
    }

    @Test
    public void testPublishesTimer() {
        final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        final LockingCodecPerformanceTracker tracker = new LockingCodecPerformanceTracker(Optional.of(meterRegistry));
        tracker.record("h264", 40, true);
        tracker.record("h264", 60, false);
        Assertions.assertEquals(1, meterRegistry.get("cura.video.frame.extraction")
                .tags("codec", "h264", "result", "success")
                .timer()
                .count());
        Assertions.assertEquals(1, meterRegistry.get("cura.video.frame.extraction")
                .tags("codec", "h264", "result", "failure")
                .timer()
                .count());
    }
}
