package org.keeber.imaging.fluke;

import java.util.DoubleSummaryStatistics;
import java.util.stream.IntStream;

import lombok.Getter;
import lombok.NonNull;

/**
 * A width x height grid of temperatures in °C, row-major, row 0 at the top. Pixels without a
 * value are NaN.
 */
public class ThermalFrame {

    public enum Provenance {
        /** `IR.data`, declared geometry. */
        FIXED_ARRAY,
        /** `IR.data`, geometry corrected from the sample count. */
        FIXED_ARRAY_REGRIDDED,
        /** A length-delimited span of the scanned blob. */
        SCANNED_SPAN,
        /** The last bytes of the scanned blob. */
        SCANNED_TAIL
    }

    @Getter private final int width, height;
    @Getter private final Provenance provenance;
    private final float[] temperatures;
    private transient Stats stats;

    public ThermalFrame(int width, int height, @NonNull float[] temperatures, @NonNull Provenance provenance) {
        if (width < 0 || height < 0 || temperatures.length != (long) width * height) {
            throw new IllegalArgumentException("Expected " + width + "x" + height + " values, got " + temperatures.length);
        }
        this.width = width;
        this.height = height;
        this.temperatures = temperatures;
        this.provenance = provenance;
    }

    /**
     * @return a copy of the row-major values.
     */
    public float[] getTemperatures() {
        return temperatures.clone();
    }

    /**
     * @return the values as [row][column].
     */
    public float[][] getRows() {
        return IntStream.range(0, height).mapToObj(y -> {
            float[] row = new float[width];
            System.arraycopy(temperatures, y * width, row, 0, width);
            return row;
        }).toArray(float[][]::new);
    }

    public float temperatureAt(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return temperatures[y * width + x];
    }

    public Stats getStats() {
        return stats == null ? stats = new Stats(temperatures) : stats;
    }

    /**
     * Summary over the pixels that have a value.
     */
    public static class Stats {
        private final DoubleSummaryStatistics summary;

        private Stats(float[] values) {
            this.summary = IntStream.range(0, values.length).mapToDouble(i -> values[i]).filter(v -> !Double.isNaN(v)).summaryStatistics();
        }

        public long getCount() {
            return summary.getCount();
        }

        public double getMin() {
            return summary.getCount() == 0 ? Double.NaN : summary.getMin();
        }

        public double getMax() {
            return summary.getCount() == 0 ? Double.NaN : summary.getMax();
        }

        public double getAverage() {
            return summary.getCount() == 0 ? Double.NaN : summary.getAverage();
        }
    }

}
