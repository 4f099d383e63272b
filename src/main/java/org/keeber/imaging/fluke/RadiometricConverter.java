package org.keeber.imaging.fluke;

import java.util.Arrays;
import java.util.IntSummaryStatistics;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;

import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Turns raw counts into object temperatures (°C).
 *
 * With a calibration table each count is looked up as a radiant temperature and corrected for
 * emissivity, transmission and reflected background using a T⁴ radiance model. Without one the
 * counts are scaled linearly into a temperature window.
 */
@Getter
@Setter
@Accessors(chain = true)
public class RadiometricConverter {
    private static final Logger logger = Logger.getLogger(RadiometricConverter.class.getName());

    @NonNull private CalibrationTable table;
    private double emissivity = FlukeFormat.Radiometry.DEFAULT_EMISSIVITY;
    private double transmission = FlukeFormat.Radiometry.DEFAULT_TRANSMISSION;
    private double background = FlukeFormat.Radiometry.DEFAULT_BACKGROUND;
    /** (low, high) °C mapped onto the full 16-bit count range. */
    private double[] rangeHint;
    private Double metadataMin, metadataMax;

    public RadiometricConverter(@NonNull CalibrationTable table) {
        this.table = table;
    }

    /**
     * @param counts raw counts.
     * @return temperatures in °C, NaN where there is no value.
     */
    public float[] convert(int[] counts) {
        if (!table.isEmpty()) {
            return radiometric(counts);
        }
        return linear(counts);
    }

    /**
     * Object temperature from one radiant temperature.
     *
     * @param radiant radiant temperature (°C) from the table.
     * @return °C, or NaN when the corrected radiance is not positive.
     */
    public double correct(double radiant) {
        double e = clamp(emissivity);
        double tau = clamp(transmission);
        double tbg4 = Math.pow(background + FlukeFormat.Radiometry.KELVIN, 4);
        double traw4 = Math.pow(radiant + FlukeFormat.Radiometry.KELVIN, 4);
        double x = (traw4 - (1 - e) * tbg4) / (tau * e);
        if (x <= 0) {
            return Double.NaN;
        }
        return Math.pow(x, 0.25) - FlukeFormat.Radiometry.KELVIN;
    }

    private float[] radiometric(int[] counts) {
        float[] out = new float[counts.length];
        for (int i = 0; i < counts.length; i++) {
            OptionalDouble radiant = table.lookup(counts[i]);
            out[i] = radiant.isPresent() ? (float) correct(radiant.getAsDouble()) : Float.NaN;
        }
        return out;
    }

    private float[] linear(int[] counts) {
        if (rangeHint != null) {
            double lo = rangeHint[0], hi = rangeHint[1];
            logger.log(Level.FINE, "No calibration curve, scaling counts into [{0}, {1}] °C", new Object[] { lo, hi });
            return scale(counts, 0, FlukeFormat.Radiometry.FULL_SCALE, lo, hi);
        }
        double[] window = window();
        IntSummaryStatistics observed = IntStream.of(counts).summaryStatistics();
        if (counts.length == 0 || observed.getMax() <= observed.getMin()) {
            float[] flat = new float[counts.length];
            Arrays.fill(flat, (float) background);
            return flat;
        }
        logger.log(Level.FINE, "No calibration curve, scaling counts [{0}, {1}] into [{2}, {3}] °C",
                new Object[] { observed.getMin(), observed.getMax(), window[0], window[1] });
        return scale(counts, observed.getMin(), observed.getMax(), window[0], window[1]);
    }

    /**
     * Metadata min / max when both present and ordered, else a window around the background.
     */
    double[] window() {
        if (metadataMin != null && metadataMax != null && metadataMin < metadataMax) {
            return new double[] { metadataMin, metadataMax };
        }
        return new double[] { background - FlukeFormat.Radiometry.WINDOW_BELOW, background + FlukeFormat.Radiometry.WINDOW_ABOVE };
    }

    public RadiometricConverter setMetadataRange(Optional<Double> min, Optional<Double> max) {
        this.metadataMin = min.orElse(null);
        this.metadataMax = max.orElse(null);
        return this;
    }

    private static float[] scale(int[] counts, double countLo, double countHi, double lo, double hi) {
        float[] out = new float[counts.length];
        double k = (hi - lo) / (countHi - countLo);
        for (int i = 0; i < counts.length; i++) {
            out[i] = (float) (lo + (counts[i] - countLo) * k);
        }
        return out;
    }

    static double clamp(double factor) {
        if (Double.isNaN(factor)) {
            return 1.0;
        }
        return Math.max(FlukeFormat.Radiometry.MIN_FACTOR, Math.min(1.0, factor));
    }

}
