package org.keeber.imaging.fluke;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.keeber.imaging.fluke.CameraProfile.CalibrationPolicy;
import org.keeber.imaging.fluke.CameraProfile.HeaderSkip;
import org.keeber.imaging.fluke.CameraProfile.ImageInfoLayout;
import org.keeber.imaging.fluke.CameraProfile.FloatField;
import org.keeber.imaging.fluke.CameraProfile.Size;
import org.keeber.imaging.fluke.CameraProfile.ThermalSource;
import org.keeber.imaging.fluke.ThermalRecord.ThermalRecordException;

import lombok.Getter;
import lombok.NonNull;

/**
 * Registry of known camera models.
 *
 * The list order is the detection order: a name that is a substring of another
 * registered name must come after the longer one.
 */
public class CameraProfiles {
    public static final String UNKNOWN = "Unknown";
    public static final Size CLASSIC_DEFAULT_SIZE = new Size(320, 240);

    public static final CameraProfile TIS75_PLUS = new CameraProfile("TiS75+",
            FlukeFormat.Paths.CAMERA_INFO,
            FlukeFormat.Paths.CALIBRATION,
            FlukeFormat.Paths.METADATA,
            FlukeFormat.Paths.IR_IMAGE_INFO,
            FlukeFormat.Paths.CAL_TEMP_DATA_REX,
            null,                                                   // Camera info is variant-encoded, model found by scanning
            new ImageInfoLayout(
                new FloatField(43),                                 // emissivity
                new FloatField(38),                                 // background
                new FloatField(43),                                 // transmission
                new FloatField(38),                                 // range low
                new FloatField(33),                                 // range high
                FlukeFormat.ImageInfo.MIN_BYTES),
            ThermalSource.SCANNED_BLOB,
            HeaderSkip.BY_WIDTH,
            List.of(new Size(384, 288)),
            CalibrationPolicy.PLACEHOLDER_ALLOWED);

    public static final CameraProfile TI480P = CameraProfile.classic("Ti480P", 640, 480);
    public static final CameraProfile TI300 = CameraProfile.classic("Ti300", 320, 240);

    private static final CameraProfiles DEFAULT = new CameraProfiles(List.of(TIS75_PLUS, TI480P, TI300));

    @Getter private final List<CameraProfile> profiles;

    public CameraProfiles(@NonNull List<CameraProfile> profiles) {
        this.profiles = List.copyOf(profiles);
    }

    public static CameraProfiles getDefault() {
        return DEFAULT;
    }

    public List<String> getSupportedModels() {
        return profiles.stream().map(CameraProfile::getCanonicalName).toList();
    }

    /**
     * Find a registered profile whose canonical name occurs in (or prefixes) the given model string.
     */
    public Optional<CameraProfile> lookup(String model) {
        String name = normalise(model);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        return profiles.stream()
                .filter(p -> name.contains(p.getCanonicalName()) || name.startsWith(p.getCanonicalName()))
                .findFirst();
    }

    /**
     * Pick the profile for a file.
     *
     * @param model detected model name, may be null.
     * @param hasFixedArray the container holds an `IR.data` array.
     * @param hasScannedBlob the container holds a scanned-blob thermal source.
     * @return the matching profile, or the classic default when the model is unknown.
     * @throws ThermalRecordException if the model is unknown and only a scanned blob is present.
     */
    public CameraProfile resolve(String model, boolean hasFixedArray, boolean hasScannedBlob) throws ThermalRecordException {
        Optional<CameraProfile> known = lookup(model);
        if (known.isPresent()) {
            return known.get();
        }
        String name = normalise(model);
        if (!hasFixedArray && hasScannedBlob) {
            throw new ThermalRecordException(ThermalRecordException.Reason.UNSUPPORTED_CAMERA, name.isEmpty() ? null : name,
                    "Unknown camera model (file has a scanned thermal blob only). Supported: "
                    + getSupportedModels().stream().collect(Collectors.joining(", ")) + ".");
        }
        // Fixed array present, or no source seen yet: classic layout, dimensions resolved later
        return CameraProfile.classic(name.isEmpty() ? UNKNOWN : name, CLASSIC_DEFAULT_SIZE.getWidth(), CLASSIC_DEFAULT_SIZE.getHeight());
    }

    static String normalise(String model) {
        if (model == null) {
            return "";
        }
        String name = stripTrailing(model.trim(), FlukeFormat.CameraInfo.MODEL_PADDING);
        return name.equals("?") || name.equals(UNKNOWN) ? "" : name;
    }

    static String stripTrailing(String value, String chars) {
        int end = value.length();
        while (end > 0 && chars.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(0, end);
    }

}
