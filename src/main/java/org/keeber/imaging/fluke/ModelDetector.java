package org.keeber.imaging.fluke;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Reads the camera model from the camera-info record.
 */
@RequiredArgsConstructor
public class ModelDetector {
    private static final Logger logger = Logger.getLogger(ModelDetector.class.getName());

    @NonNull private final CameraProfiles profiles;

    public ModelDetector() {
        this(CameraProfiles.getDefault());
    }

    /**
     * 1) any registered model name embedded anywhere in the record (variant-encoded records),
     * 2) the classic fixed byte range, accepted when printable even if not registered.
     *
     * @param cameraInfo the raw record, may be null.
     * @return the model name or empty.
     */
    public Optional<String> detect(byte[] cameraInfo) {
        if (cameraInfo == null || cameraInfo.length == 0) {
            return Optional.empty();
        }
        for (CameraProfile profile : profiles.getProfiles()) {
            if (indexOf(cameraInfo, profile.getCanonicalName().getBytes(StandardCharsets.US_ASCII), 0) >= 0) {
                logger.log(Level.FINE, "Model {0} found embedded in camera info", profile.getCanonicalName());
                return Optional.of(profile.getCanonicalName());
            }
        }
        int start = FlukeFormat.CameraInfo.Index.MODEL;
        int end = FlukeFormat.CameraInfo.Index.MODEL_END;
        if (cameraInfo.length < end) {
            return Optional.empty();
        }
        String slice = CameraProfiles.stripTrailing(
                new String(cameraInfo, start, end - start, StandardCharsets.ISO_8859_1).trim(), FlukeFormat.CameraInfo.MODEL_PADDING);
        if (slice.isEmpty()) {
            return Optional.empty();
        }
        for (CameraProfile profile : profiles.getProfiles()) {
            if (slice.contains(profile.getCanonicalName()) || profile.getCanonicalName().contains(slice)) {
                return Optional.of(profile.getCanonicalName());
            }
        }
        return isPrintable(slice) ? Optional.of(slice) : Optional.empty();
    }

    static boolean isPrintable(String value) {
        return value.chars().allMatch(c -> c >= 0x20 && c != 0x7F && !(c >= 0x80 && c < 0xA0));
    }

    /**
     * Naive byte substring search.
     */
    static int indexOf(byte[] haystack, byte[] needle, int from) {
        outer:
        for (int i = Math.max(0, from); i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

}
