package ch.bergturbenthal.cura.libs.model;

import lombok.Value;

@Value
public class CodecStat {
    String codecName;
    long totalTimeMs;
    long sampleCount;
    long successCount;

    public double getAvgTimeMs() {
        if (sampleCount == 0)
            return 0;
        return (double) totalTimeMs / sampleCount;
    }

    public double getSuccessRate() {
        if (sampleCount == 0)
            return 0;
        return (double) successCount / sampleCount;
    }

    public CodecStat add(final long elapsedMs, final boolean success) {
        return new CodecStat(codecName, totalTimeMs + elapsedMs, sampleCount + 1, successCount + (success ? 1 : 0));
    }
}
