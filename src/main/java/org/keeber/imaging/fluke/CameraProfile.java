package org.keeber.imaging.fluke;

import java.util.List;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Per-model layout of an `.is2` container. Instances are immutable.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class CameraProfile {

    public enum ThermalSource {
        /** Plain little-endian uint16 array (`IR.data`). */
        FIXED_ARRAY,
        /** Blob found by scanning a length-delimited sub-record stream. */
        SCANNED_BLOB
    }

    public enum HeaderSkip {
        BY_WIDTH, BY_HEIGHT;

        public int samples(int width, int height) {
            return this == BY_WIDTH ? width : height;
        }
    }

    public enum CalibrationPolicy {
        REQUIRED, PLACEHOLDER_ALLOWED
    }

    /**
     * A 4-byte little-endian float at a fixed byte offset.
     */
    @Getter
    @RequiredArgsConstructor
    public static class FloatField {
        private final int offset;
    }

    /**
     * Byte ranges [start, end) of the Latin-1 camera-info strings.
     */
    @Getter
    @AllArgsConstructor
    public static class CameraInfoLayout {
        private final int manufacturerStart, manufacturerEnd;
        private final int modelStart, modelEnd;
        private final int engineSerialStart, engineSerialEnd;
        private final int cameraSerialStart, cameraSerialEnd;
        private final int minBytes;

        public static final CameraInfoLayout CLASSIC = new CameraInfoLayout(
                FlukeFormat.CameraInfo.Index.MANUFACTURER, FlukeFormat.CameraInfo.Index.MANUFACTURER_END,
                FlukeFormat.CameraInfo.Index.MODEL, FlukeFormat.CameraInfo.Index.MODEL_END,
                FlukeFormat.CameraInfo.Index.ENGINE_SERIAL, FlukeFormat.CameraInfo.Index.ENGINE_SERIAL_END,
                FlukeFormat.CameraInfo.Index.CAMERA_SERIAL, FlukeFormat.CameraInfo.Index.CAMERA_SERIAL_END,
                FlukeFormat.CameraInfo.MIN_BYTES);
    }

    /**
     * Float offsets inside the image-info record. The temperature range pair is optional.
     */
    @Getter
    @AllArgsConstructor
    public static class ImageInfoLayout {
        @NonNull private final FloatField emissivity;
        @NonNull private final FloatField background;
        @NonNull private final FloatField transmission;
        private final FloatField rangeLow;
        private final FloatField rangeHigh;
        private final int minBytes;

        public Optional<FloatField[]> getRange() {
            return rangeLow == null || rangeHigh == null ? Optional.empty() : Optional.of(new FloatField[] { rangeLow, rangeHigh });
        }

        public static final ImageInfoLayout CLASSIC = new ImageInfoLayout(
                new FloatField(FlukeFormat.ImageInfo.Index.EMISSIVITY),
                new FloatField(FlukeFormat.ImageInfo.Index.BACKGROUND),
                new FloatField(FlukeFormat.ImageInfo.Index.TRANSMISSION),
                null, null, FlukeFormat.ImageInfo.MIN_BYTES);
    }

    /**
     * A (width, height) pair.
     */
    @Getter
    @RequiredArgsConstructor
    public static class Size {
        private final int width, height;

        public long pixels() {
            return (long) width * height;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Size && ((Size) o).width == width && ((Size) o).height == height;
        }

        @Override
        public int hashCode() {
            return width * 31 + height;
        }

        @Override
        public String toString() {
            return width + "x" + height;
        }
    }

    @NonNull private final String canonicalName;
    @NonNull private final String cameraInfoPath;
    @NonNull private final String calibrationPath;
    @NonNull private final String metadataPath;
    @NonNull private final String imageInfoPath;
    @NonNull private final String thermalPath;
    private final CameraInfoLayout cameraInfoLayout;
    @NonNull private final ImageInfoLayout imageInfoLayout;
    @NonNull private final ThermalSource thermalSource;
    @NonNull private final HeaderSkip headerSkip;
    @NonNull private final List<Size> payloadSizes;
    @NonNull private final CalibrationPolicy calibrationPolicy;

    public Optional<CameraInfoLayout> getCameraInfoLayout() {
        return Optional.ofNullable(cameraInfoLayout);
    }

    public Size getDefaultSize() {
        return payloadSizes.get(0);
    }

    public boolean acceptsPlaceholderCalibration() {
        return calibrationPolicy == CalibrationPolicy.PLACEHOLDER_ALLOWED;
    }

    /**
     * Classic models: thermogram in `IR.data`, metadata in `ImageProperties.json`, Latin-1 camera info.
     */
    public static CameraProfile classic(String canonicalName, int width, int height) {
        return new CameraProfile(canonicalName,
                FlukeFormat.Paths.CAMERA_INFO,
                FlukeFormat.Paths.CALIBRATION,
                FlukeFormat.Paths.IMAGE_PROPERTIES,
                FlukeFormat.Paths.IR_IMAGE_INFO,
                FlukeFormat.Paths.IR_DATA,
                CameraInfoLayout.CLASSIC,
                ImageInfoLayout.CLASSIC,
                ThermalSource.FIXED_ARRAY,
                HeaderSkip.BY_WIDTH,
                List.of(new Size(width, height)),
                CalibrationPolicy.REQUIRED);
    }

    @Override
    public String toString() {
        return canonicalName + " (" + thermalSource + ", " + getDefaultSize() + ")";
    }

}
