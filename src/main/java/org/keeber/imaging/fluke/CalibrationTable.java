package org.keeber.imaging.fluke;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.keeber.imaging.fluke.ThermalRecord.ThermalRecordException;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Dense raw-count to radiant-temperature (°C) lookup, built from the quadratic curve segments
 * of `CalibrationData.gpbenc`.
 *
 * The camera stores each segment as counts = a·t² + b·t + c over [t_lo, t_hi]; the table holds
 * the inverse for every integer count the segment covers.
 */
public class CalibrationTable {
    private static final Logger logger = Logger.getLogger(CalibrationTable.class.getName());
    public static final int SIZE = 65536;

    private final float[] radiant;
    @Getter private final int entries;
    @Getter private final boolean placeholder;
    @Getter private final int range;

    private CalibrationTable(float[] radiant, int entries, boolean placeholder, int range) {
        this.radiant = radiant;
        this.entries = entries;
        this.placeholder = placeholder;
        this.range = range;
    }

    /**
     * An empty table standing in for a camera that ships no usable curve.
     */
    public static CalibrationTable placeholder(int range) {
        float[] empty = new float[SIZE];
        Arrays.fill(empty, Float.NaN);
        return new CalibrationTable(empty, 0, true, range);
    }

    public boolean isEmpty() {
        return entries == 0;
    }

    /**
     * @param count raw 16-bit count.
     * @return radiant temperature in °C, or empty if no segment covers the count.
     */
    public OptionalDouble lookup(int count) {
        if (count < 0 || count >= SIZE || Float.isNaN(radiant[count])) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(radiant[count]);
    }

    /**
     * One curve segment as read from the blob.
     */
    @Getter
    @RequiredArgsConstructor(access = AccessLevel.PACKAGE)
    public static class Segment {
        private final int offset;
        private final float tLo, tHi, a, b, c;

        /**
         * Forward curve: temperature (°C) to counts.
         */
        public double counts(double t) {
            return a * t * t + b * t + c;
        }

        /**
         * Inverse curve, the positive root of a·t² + b·t + (c - j) = 0.
         *
         * @return temperature in °C, or NaN when the discriminant is negative.
         */
        public double temperature(double j) {
            double disc = (double) b * b - 4d * a * (c - j);
            if (disc < 0) {
                return Double.NaN;
            }
            return (-b + Math.sqrt(disc)) / (2d * a);
        }

        boolean isPlaceholder() {
            return a == FlukeFormat.Calibration.PLACEHOLDER[0] && b == FlukeFormat.Calibration.PLACEHOLDER[1] && c == FlukeFormat.Calibration.PLACEHOLDER[2];
        }

        boolean isUsable() {
            return tLo >= FlukeFormat.Calibration.SANITY_FLOOR && tLo < tHi && a != 0 && !isPlaceholder();
        }
    }

    /**
     * Endpoint offsets of the two segment layouts.
     */
    enum Layout {
        A(FlukeFormat.Calibration.Index.T_LO, FlukeFormat.Calibration.Index.T_HI),
        B(FlukeFormat.Calibration.ShiftedIndex.T_LO, FlukeFormat.Calibration.ShiftedIndex.T_HI);

        final int tLo, tHi;

        Layout(int tLo, int tHi) {
            this.tLo = tLo;
            this.tHi = tHi;
        }
    }

    /**
     * Build the table.
     *
     * @param calibration the calibration blob, may be null when the file has none.
     * @param acceptPlaceholder return an empty placeholder table instead of failing when no curve is usable.
     * @param model camera model for error reporting, may be null.
     * @return the table.
     * @throws ThermalRecordException if no usable curve is found and a placeholder is not acceptable.
     */
    public static CalibrationTable build(byte[] calibration, boolean acceptPlaceholder, String model) throws ThermalRecordException {
        if (calibration == null || calibration.length == 0) {
            if (acceptPlaceholder) {
                logger.log(Level.FINE, "No calibration data, using placeholder table");
                return placeholder(0);
            }
            throw new ThermalRecordException(ThermalRecordException.Reason.MISSING_CALIBRATION, model, "Calibration data is missing.");
        }
        int range = calibration.length > FlukeFormat.Calibration.RANGE_BYTE ? calibration[FlukeFormat.Calibration.RANGE_BYTE] & 0xff : 0;
        List<Segment> all = new ArrayList<>();
        for (Layout layout : Layout.values()) {
            all = segments(calibration, layout);
            List<Segment> usable = all.stream().filter(Segment::isUsable).toList();
            if (!usable.isEmpty()) {
                CalibrationTable table = invert(usable, range);
                logger.log(Level.FINE, "Calibration layout {0}: {1} segments, {2} counts", new Object[] { layout, usable.size(), table.entries });
                if (!table.isEmpty()) {
                    return table;
                }
            }
        }
        if (all.isEmpty()) {
            if (acceptPlaceholder) {
                return placeholder(range);
            }
            throw new ThermalRecordException(ThermalRecordException.Reason.UNSUPPORTED_CAMERA, model,
                    "Calibration data does not contain the expected curve tags.");
        }
        if (acceptPlaceholder && all.size() == 1 && all.get(0).isPlaceholder()) {
            logger.log(Level.FINE, "Calibration holds a placeholder curve only");
            return placeholder(range);
        }
        throw new ThermalRecordException(ThermalRecordException.Reason.MISSING_CALIBRATION, model,
                "No usable calibration curve found (" + all.size() + " tagged segments).");
    }

    /**
     * Read every tagged segment in the blob under the given layout.
     */
    static List<Segment> segments(byte[] calibration, Layout layout) {
        ByteBuffer buffer = ByteBuffer.wrap(calibration).order(ByteOrder.LITTLE_ENDIAN);
        byte[] magic = FlukeFormat.Calibration.MAGIC;
        List<Segment> found = new ArrayList<>();
        int at = 0;
        while ((at = ModelDetector.indexOf(calibration, magic, at)) >= 0) {
            int start = at + magic.length;
            if (start + FlukeFormat.Calibration.SEGMENT_LENGTH > calibration.length) {
                break;
            }
            found.add(new Segment(start,
                    buffer.getFloat(start + layout.tLo),
                    buffer.getFloat(start + layout.tHi),
                    buffer.getFloat(start + FlukeFormat.Calibration.Index.A),
                    buffer.getFloat(start + FlukeFormat.Calibration.Index.B),
                    buffer.getFloat(start + FlukeFormat.Calibration.Index.C)));
            at++;
        }
        return found;
    }

    /**
     * Fill the dense table from the usable segments. Earlier segments keep the counts they cover.
     */
    static CalibrationTable invert(List<Segment> segments, int range) {
        float[] radiant = new float[SIZE];
        Arrays.fill(radiant, Float.NaN);
        int entries = 0;
        for (Segment segment : segments) {
            double lo = segment.counts(segment.getTLo());
            double hi = segment.counts(segment.getTHi());
            if (Double.isNaN(lo) || Double.isNaN(hi)) {
                continue;
            }
            long from = (long) Math.ceil(lo);
            long to = Math.min((long) Math.ceil(hi), from + FlukeFormat.Calibration.MAX_COUNTS_PER_SEGMENT);
            for (long j = Math.max(0, from); j < Math.min(to, SIZE); j++) {
                if (!Float.isNaN(radiant[(int) j])) {
                    continue;
                }
                double t = segment.temperature(j);
                if (Double.isNaN(t) || t < FlukeFormat.Calibration.MIN_PLAUSIBLE || t > FlukeFormat.Calibration.MAX_PLAUSIBLE) {
                    continue;
                }
                radiant[(int) j] = (float) t;
                entries++;
            }
        }
        return new CalibrationTable(radiant, entries, false, range);
    }

}
