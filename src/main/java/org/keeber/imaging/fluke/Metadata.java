package org.keeber.imaging.fluke;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Scalar fields merged from the camera-info record, the JSON side-file and the image-info record.
 *
 * Unset numeric fields are null. Getters for the radiometric inputs fall back to the defaults in
 * {@link FlukeFormat.Radiometry}.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@Accessors(chain = true)
public class Metadata {
    private String manufacturer;
    private String model;
    private String cameraSerial;
    private String engineSerial;
    private String lens;
    private String lensSerial;
    private String calibrationDate;
    private String captureDateTime;
    private String title;
    private String comments;
    private boolean containsAnnotations;
    private boolean containsAudio;
    private boolean containsCnxReadings;

    private int irWidth;
    private int irHeight;
    private int vlWidth;
    private int vlHeight;

    @Getter(AccessLevel.NONE) private Double emissivity;
    @Getter(AccessLevel.NONE) private Double transmission;
    @Getter(AccessLevel.NONE) private Double backgroundTemperature;
    @Getter(AccessLevel.NONE) private Double minTemperature;
    @Getter(AccessLevel.NONE) private Double maxTemperature;
    @Getter(AccessLevel.NONE) private Double avgTemperature;
    @Getter(AccessLevel.NONE) private Double centerTemperature;

    public double getEmissivity() {
        return emissivity == null ? FlukeFormat.Radiometry.DEFAULT_EMISSIVITY : emissivity;
    }

    public double getTransmission() {
        return transmission == null ? FlukeFormat.Radiometry.DEFAULT_TRANSMISSION : transmission;
    }

    public double getBackgroundTemperature() {
        return backgroundTemperature == null ? FlukeFormat.Radiometry.DEFAULT_BACKGROUND : backgroundTemperature;
    }

    public Optional<Double> getMinTemperature() {
        return Optional.ofNullable(minTemperature);
    }

    public Optional<Double> getMaxTemperature() {
        return Optional.ofNullable(maxTemperature);
    }

    public Optional<Double> getAvgTemperature() {
        return Optional.ofNullable(avgTemperature);
    }

    public Optional<Double> getCenterTemperature() {
        return Optional.ofNullable(centerTemperature);
    }

    boolean hasEmissivity() {
        return emissivity != null;
    }

    boolean hasTransmission() {
        return transmission != null;
    }

    boolean hasBackgroundTemperature() {
        return backgroundTemperature != null;
    }

}
