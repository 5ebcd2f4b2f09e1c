package ch.bergturbenthal.cura.libs.service.impl;

import ch.bergturbenthal.cura.libs.model.CodecStat;
import ch.bergturbenthal.cura.libs.service.CodecPerformanceTracker;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class LockingCodecPerformanceTracker implements CodecPerformanceTracker {
    public static final String UNKNOWN_CODEC = "unknown";
    private final Object lock = new Object();
    private final Map<String, CodecStat> stats = new HashMap<>();
    private final Optional<MeterRegistry> meterRegistryOptional;

    public LockingCodecPerformanceTracker(final Optional<MeterRegistry> meterRegistryOptional) {
        this.meterRegistryOptional = meterRegistryOptional;
    }

    public static String normalizeCodecName(final String codecName) {
        if (codecName == null || codecName.isBlank())
            return UNKNOWN_CODEC;
        return codecName.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public void record(final String codecName, final long elapsedMs, final boolean success) {
        final String codec = normalizeCodecName(codecName);
        final long elapsed = Math.max(0, elapsedMs);
        synchronized (lock) {
            stats.merge(codec, new CodecStat(codec, elapsed, 1, success ? 1 : 0),
                    (existing, sample) -> existing.add(elapsed, success));
        }
        meterRegistryOptional.ifPresent(meterRegistry -> meterRegistry
                .timer("cura.video.frame.extraction", "codec", codec, "result", success ? "success" : "failure")
                .record(elapsed, TimeUnit.MILLISECONDS));
        log.debug("Frame extraction {} for {} took {}ms", success ? "succeeded" : "failed", codec, elapsed);
    }

    @Override
    public List<CodecStat> snapshot() {
        final List<CodecStat> copy;
        synchronized (lock) {
            copy = new ArrayList<>(stats.values());
        }
        copy.sort(Comparator.comparing(CodecStat::getCodecName));
        return List.copyOf(copy);
    }

    @Override
    public void reset() {
        synchronized (lock) {
            stats.clear();
        }
    }
}
