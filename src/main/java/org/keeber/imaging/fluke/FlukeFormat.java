package org.keeber.imaging.fluke;

import java.util.List;

/**
 * Layout constants for the Fluke `.is2` container.
 *
 * An `.is2` file is a ZIP archive. The records inside are either fixed-layout little-endian
 * blobs (`*.gpbenc`), raw 16-bit sample arrays (`IR.data`), or JSON side-files.
 */
public class FlukeFormat {

    /**
     * Logical paths of the sub-files inside the archive.
     */
    public static class Paths {
        public static final String CAMERA_INFO          = "CameraInfo.gpbenc";
        public static final String CALIBRATION          = "CalibrationData.gpbenc";
        public static final String IMAGE_PROPERTIES     = "ImageProperties.json";
        public static final String METADATA             = "metadata.json";
        public static final String IR_IMAGE_INFO        = "Images/Main/IRImageInfo.gpbenc";
        public static final String IR_DATA              = "Images/Main/IR.data";
        public static final String CAL_TEMP_DATA_REX    = "CalTempDataRex.gpbenc";
        public static final String MAIN_IMAGES          = "Images/Main";
        public static final String THUMBNAILS           = "Thumbnails";
        public static final String IMAGE_SUFFIX         = ".jpg";
    }

    /**
     * `CameraInfo.gpbenc` on classic models: Latin-1 text at fixed byte ranges [start, end).
     */
    public static class CameraInfo {
        public static final int MIN_BYTES               = 124;

        public static class Index {
            public static final int MANUFACTURER        = 76;   // .. 94
            public static final int MANUFACTURER_END    = 94;
            public static final int MODEL               = 97;   // .. 103
            public static final int MODEL_END           = 103;
            public static final int ENGINE_SERIAL       = 104;  // .. 112
            public static final int ENGINE_SERIAL_END   = 112;
            public static final int CAMERA_SERIAL       = 115;  // .. 124
            public static final int CAMERA_SERIAL_END   = 124;
        }

        /** Characters stripped from the end of a model string. */
        public static final String MODEL_PADDING        = "- \t\0";
    }

    /**
     * `IRImageInfo.gpbenc`: 4-byte little-endian floats.
     */
    public static class ImageInfo {
        public static final int MIN_BYTES               = 47;

        public static class Index {
            public static final int EMISSIVITY          = 33;
            public static final int BACKGROUND          = 38;
            public static final int TRANSMISSION        = 43;
        }
    }

    /**
     * `CalibrationData.gpbenc`: a sequence of curve segments each introduced by {@link #MAGIC}.
     *
     * Segment layout after the tag (24 bytes): low endpoint, high endpoint, c, b, a, as 4-byte
     * little-endian floats with one separator byte between them. A second variant places the two
     * endpoints one byte later; which firmware writes it is not known, both are tried.
     */
    public static class Calibration {
        public static final byte[] MAGIC                = new byte[] { 74, 25, 13 };
        public static final int SEGMENT_LENGTH          = 24;
        public static final int RANGE_BYTE              = 18;   // Auto range selector (1 or 2 seen)

        public static class Index {
            public static final int T_LO                = 0;
            public static final int T_HI                = 5;
            public static final int C                   = 10;
            public static final int B                   = 15;
            public static final int A                   = 20;
        }

        public static class ShiftedIndex {
            public static final int T_LO                = 1;
            public static final int T_HI                = 6;
        }

        public static final float SANITY_FLOOR          = -180f;
        public static final double MIN_PLAUSIBLE        = -273.2;
        public static final double MAX_PLAUSIBLE        = 3000;
        public static final int MAX_COUNTS_PER_SEGMENT  = 65536;
        /** Coefficients written by cameras that ship no real curve. */
        public static final float[] PLACEHOLDER         = new float[] { 0f, 0f, 0f };
    }

    /**
     * `IR.data`: little-endian unsigned 16-bit samples.
     */
    public static class IrData {

        public static class Index {
            public static final int WIDTH               = 192;  // Sample index, legacy embedded header
            public static final int HEIGHT              = 193;
        }

        /** Widths tried when the declared geometry does not fit the sample count. */
        public static final int[] PLAUSIBLE_WIDTHS      = new int[] { 640, 480, 384, 320, 288, 240, 220, 160, 120, 80 };
        public static final int MAX_HEIGHT              = 10000;
    }

    /**
     * Length-delimited sub-record stream (`CalTempDataRex.gpbenc`).
     */
    public static class SubRecord {

        public static class WireType {
            public static final int VARINT              = 0;
            public static final int FIXED64             = 1;
            public static final int LENGTH_DELIMITED    = 2;
            public static final int FIXED32             = 5;
        }

        public static final int NESTED_THRESHOLD        = 1024;
        public static final int MAX_DEPTH               = 8;
        public static final int MAX_SPANS               = 100_000;
    }

    /**
     * Dimension hints.
     */
    public static class Dimensions {
        public static final int GENERIC_WIDTH           = 640;
        public static final int GENERIC_HEIGHT          = 480;
        public static final int HINT_MIN                = 100;
        public static final int HINT_MAX                = 4096;
        public static final int HINT_STEM_LENGTH        = 8;
        /** Largest width or height accepted from metadata or the embedded header. */
        public static final int MAX_SIDE                = 4096;
    }

    /**
     * Radiometric constants and metadata defaults.
     */
    public static class Radiometry {
        public static final double KELVIN               = 273.15;
        public static final double MIN_FACTOR           = 1e-6;
        public static final double DEFAULT_EMISSIVITY   = 0.95;
        public static final double DEFAULT_TRANSMISSION = 1.0;
        public static final double DEFAULT_BACKGROUND   = 20.0;
        public static final double WINDOW_BELOW         = 20.0;
        public static final double WINDOW_ABOVE         = 35.0;
        public static final int FULL_SCALE              = 65535;
    }

    /**
     * JSON side-file keys. Each field is an ordered alias list, `ImageProperties.json` names first
     * and `metadata.json` names after.
     */
    public static class MetadataKeys {
        public static final List<String> MAKE           = List.of("IRPROP_THERMAL_IMAGER_MAKE", "cameraManufacturer", "manufacturer");
        public static final List<String> MODEL          = List.of("IRPROP_THERMAL_IMAGER_MODEL", "cameraModel", "model");
        public static final List<String> SERIAL         = List.of("IRPROP_THERMAL_IMAGER_SN", "cameraSerial", "serialNumber");
        public static final List<String> LENS           = List.of("IRPROP_THERMAL_IMAGER_IR_LENSES", "irLens");
        public static final List<String> LENS_SERIAL    = List.of("IRPROP_THERMAL_IMAGER_IR_LENSES_SN", "irLensSerial");
        public static final List<String> CAL_DATE       = List.of("IRPROP_THERMAL_IMAGER_CALIBRATION_DATE", "calibrationDate");
        public static final List<String> IR_WIDTH       = List.of("IRPROP_IR_SENSOR_WIDTH", "irSensorWidth", "irWidth");
        public static final List<String> IR_HEIGHT      = List.of("IRPROP_IR_SENSOR_HEIGHT", "irSensorHeight", "irHeight");
        public static final List<String> VL_WIDTH       = List.of("IRPROP_VL_SENSOR_WIDTH", "vlSensorWidth", "vlWidth");
        public static final List<String> VL_HEIGHT      = List.of("IRPROP_VL_SENSOR_HEIGHT", "vlSensorHeight", "vlHeight");
        public static final List<String> CAPTURED       = List.of("IRPROP_THERMAL_IMAGE_CAPTURE_DATE_TIME", "captureDateTime", "timestamp");
        public static final List<String> MIN_TEMP       = List.of("IRPROP_THERMAL_IMAGE_MIN_TEMP_C", "minTemperature", "minTemp");
        public static final List<String> MAX_TEMP       = List.of("IRPROP_THERMAL_IMAGE_MAX_TEMP_C", "maxTemperature", "maxTemp");
        public static final List<String> AVG_TEMP       = List.of("IRPROP_THERMAL_IMAGE_AVG_TEMP_C", "avgTemperature", "avgTemp");
        public static final List<String> CENTER_TEMP    = List.of("IRPROP_THERMAL_IMAGE_CENTER_POINT_TEMP_C", "centerTemperature", "centerTemp");
        public static final List<String> BACKGROUND     = List.of("IRPROP_THERMAL_IMAGE_BG_TEMP_C", "backgroundTemperature", "reflectedTemperature");
        public static final List<String> EMISSIVITY     = List.of("IRPROP_THERMAL_IMAGE_EMISSIVITY", "emissivity");
        public static final List<String> TRANSMISSION   = List.of("IRPROP_THERMAL_IMAGE_TRANSMISSIVITY", "transmission", "transmissivity");
        public static final List<String> TITLE          = List.of("IRPROP_THERMAL_IMAGE_TITLE", "title");
        public static final List<String> COMMENTS       = List.of("IRPROP_THERMAL_IMAGE_COMMENTS", "comments");
        public static final List<String> ANNOTATIONS    = List.of("IRPROP_THERMAL_IMAGE_CONTAINS_ANNOTATIONS", "containsAnnotations");
        public static final List<String> AUDIO          = List.of("IRPROP_THERMAL_IMAGE_CONTAINS_AUDIO", "containsAudio");
        public static final List<String> CNX_READINGS   = List.of("IRPROP_THERMAL_IMAGE_CONTAINS_CNX_READINGS", "containsCnxReadings");
    }

    public static final String REPORT_HINT = " This camera variant is not supported yet. Please open an issue on the project repository "
            + "with the camera model and, if possible, a sample .is2 file so support can be added.";

}
