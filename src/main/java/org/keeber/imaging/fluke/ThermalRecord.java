package org.keeber.imaging.fluke;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * The decoded content of one `.is2` file: the temperature frame plus the merged metadata.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
public class ThermalRecord {
    private final String fileName;
    @NonNull private final String profileName;
    @NonNull private final ThermalFrame frame;
    @NonNull private final Metadata metadata;
    @NonNull private final CalibrationTable calibration;
    private final String thumbnailPath;
    private final String photoPath;

    public int getWidth() {
        return frame.getWidth();
    }

    public int getHeight() {
        return frame.getHeight();
    }

    public double getEmissivity() {
        return metadata.getEmissivity();
    }

    public double getTransmission() {
        return metadata.getTransmission();
    }

    public double getBackgroundTemperature() {
        return metadata.getBackgroundTemperature();
    }

    public String getCameraManufacturer() {
        return metadata.getManufacturer();
    }

    public String getCameraModel() {
        return metadata.getModel();
    }

    public String getCameraSerial() {
        return metadata.getCameraSerial();
    }

    public String getCaptureDateTime() {
        return metadata.getCaptureDateTime();
    }

    /**
     * Archive path of the thumbnail image, loading is left to the caller.
     */
    public Optional<String> getThumbnailPath() {
        return Optional.ofNullable(thumbnailPath);
    }

    /**
     * Archive path of the full-size visible image, loading is left to the caller.
     */
    public Optional<String> getPhotoPath() {
        return Optional.ofNullable(photoPath);
    }

    public static class ThermalRecordException extends Exception {

        public enum Reason {
            FILE_NOT_FOUND,
            UNSUPPORTED_FORMAT,
            UNSUPPORTED_CAMERA,
            MISSING_CALIBRATION,
            MISSING_PAYLOAD,
            MALFORMED_RECORD;

            boolean reportable() {
                return this != FILE_NOT_FOUND && this != UNSUPPORTED_FORMAT;
            }
        }

        @Getter private final Reason reason;
        @Getter private final String model;

        ThermalRecordException(Reason reason, String model, String message) {
            super(describe(reason, model, message));
            this.reason = reason;
            this.model = model;
        }

        private static String describe(Reason reason, String model, String message) {
            String text = model == null ? message : "[" + model + "] " + message;
            return reason.reportable() ? text + FlukeFormat.REPORT_HINT : text;
        }

    }

}
