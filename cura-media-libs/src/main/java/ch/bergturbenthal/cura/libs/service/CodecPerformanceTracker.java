package ch.bergturbenthal.cura.libs.service;

import ch.bergturbenthal.cura.libs.model.CodecStat;

import java.util.List;

public interface CodecPerformanceTracker {
    void record(String codecName, long elapsedMs, boolean success);

    /**
     * @return a copy of the current statistics ordered by codec name
     */
    List<CodecStat> snapshot();

    void reset();
}
