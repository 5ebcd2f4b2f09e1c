package ch.bergturbenthal.cura.libs.util;

import ch.bergturbenthal.cura.libs.exception.MediaException;
import ch.bergturbenthal.cura.libs.model.ErrorKind;

import java.util.Locale;

public class GpsCoordinates {

    /**
     * Converts degree/minute/second values and a hemisphere reference (N, S, E or W) to signed decimal degrees.
     *
     * @throws MediaException
     *             of kind {@link ErrorKind#DECODE_FAILURE} when the value is missing or outside of the valid range
     */
    public static double toDecimalDegrees(final double[] dms, final String ref, final boolean latitude)
            throws MediaException {
        if (dms == null || dms.length == 0)
            throw new MediaException(ErrorKind.DECODE_FAILURE, "Empty GPS coordinate");
        double value = 0;
        double divisor = 1;
        for (int i = 0; i < Math.min(dms.length, 3); i++) {
            value += dms[i] / divisor;
            divisor *= 60;
        }
        if (Double.isNaN(value) || Double.isInfinite(value))
            throw new MediaException(ErrorKind.DECODE_FAILURE, "Invalid GPS coordinate");
        final String hemisphere = ref == null ? "" : ref.trim().toUpperCase(Locale.ROOT);
        if (hemisphere.equals("S") || hemisphere.equals("W"))
            value = -value;
        final double limit = latitude ? 90 : 180;
        if (value < -limit || value > limit)
            throw new MediaException(ErrorKind.DECODE_FAILURE,
                    (latitude ? "Latitude " : "Longitude ") + value + " out of range");
        return value;
    }
}
