package org.keeber.imaging.fluke;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.keeber.imaging.fluke.CameraProfile.Size;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Reconciles the thermal image size from the sources a container offers.
 *
 * Priority, highest first: image metadata (unless the generic 640x480), the hexadecimal stem
 * of the largest visible image, the header embedded in `IR.data`, the generic 640x480 from
 * metadata, the profile sizes.
 */
public class DimensionResolver {
    private static final Logger logger = Logger.getLogger(DimensionResolver.class.getName());

    public enum Source {
        METADATA(0), FILENAME(1), EMBEDDED(2), GENERIC_METADATA(3), PROFILE(4);

        @Getter private final int priority;

        Source(int priority) {
            this.priority = priority;
        }
    }

    /**
     * A size suggested by one source.
     */
    @Getter
    @RequiredArgsConstructor
    public static class DimensionCandidate {
        private final int width, height;
        @NonNull private final Source source;
        private final int priority;

        public DimensionCandidate(int width, int height, Source source) {
            this(width, height, source, source.getPriority());
        }

        public Size toSize() {
            return new Size(width, height);
        }

        @Override
        public String toString() {
            return width + "x" + height + " (" + source + ")";
        }
    }

    /**
     * Collect every candidate, sorted by priority. Sources with no usable value contribute nothing.
     *
     * @param metadata merged metadata.
     * @param container the archive, for the visible image file names.
     * @param samples the fixed-array samples, or null for scanned-blob sources.
     * @param profile the camera profile.
     * @return candidates, highest priority first.
     */
    public static List<DimensionCandidate> candidates(Metadata metadata, RawContainer container, int[] samples, CameraProfile profile) {
        List<DimensionCandidate> found = new ArrayList<>();
        if (metadata.getIrWidth() > 0 && metadata.getIrHeight() > 0) {
            if (!withinSideLimit(metadata.getIrWidth()) || !withinSideLimit(metadata.getIrHeight())) {
                logger.log(Level.WARNING, "Ignoring metadata size {0}x{1}", new Object[] { metadata.getIrWidth(), metadata.getIrHeight() });
            } else {
                boolean generic = metadata.getIrWidth() == FlukeFormat.Dimensions.GENERIC_WIDTH && metadata.getIrHeight() == FlukeFormat.Dimensions.GENERIC_HEIGHT;
                found.add(new DimensionCandidate(metadata.getIrWidth(), metadata.getIrHeight(), generic ? Source.GENERIC_METADATA : Source.METADATA));
            }
        }
        fromFileName(container).ifPresent(found::add);
        fromEmbeddedHeader(samples).ifPresent(found::add);
        for (Size size : profile.getPayloadSizes()) {
            found.add(new DimensionCandidate(size.getWidth(), size.getHeight(), Source.PROFILE));
        }
        found.sort(Comparator.comparingInt(DimensionCandidate::getPriority));
        return found;
    }

    /**
     * Distinct sizes in priority order.
     */
    public static List<Size> sizes(List<DimensionCandidate> candidates) {
        Set<Size> sizes = new LinkedHashSet<>();
        candidates.forEach(c -> sizes.add(c.toSize()));
        return new ArrayList<>(sizes);
    }

    /**
     * Pick the best size. The metadata is left untouched, see {@link #apply} once the payload
     * geometry is final.
     *
     * @return the chosen candidate.
     */
    public static DimensionCandidate resolve(Metadata metadata, RawContainer container, int[] samples, CameraProfile profile) {
        DimensionCandidate best = candidates(metadata, container, samples, profile).get(0);
        logger.log(Level.FINE, "Thermal size {0}", best);
        return best;
    }

    /**
     * Record the final thermal size in the metadata. Visible-light dimensions still holding the
     * generic default are replaced too.
     */
    public static void apply(Metadata metadata, int width, int height) {
        boolean vlGeneric = (metadata.getVlWidth() == 0 && metadata.getVlHeight() == 0)
                || (metadata.getVlWidth() == FlukeFormat.Dimensions.GENERIC_WIDTH && metadata.getVlHeight() == FlukeFormat.Dimensions.GENERIC_HEIGHT);
        boolean irChanged = metadata.getIrWidth() != width || metadata.getIrHeight() != height;
        if (vlGeneric && irChanged) {
            metadata.setVlWidth(width).setVlHeight(height);
        }
        metadata.setIrWidth(width).setIrHeight(height);
    }

    /**
     * An 8-digit hex stem of the largest visible image, e.g. `00A00078` for 160x120.
     */
    static Optional<DimensionCandidate> fromFileName(RawContainer container) {
        if (container == null) {
            return Optional.empty();
        }
        return container.largest(FlukeFormat.Paths.MAIN_IMAGES, FlukeFormat.Paths.IMAGE_SUFFIX)
                .flatMap(entry -> parseStem(entry.getStem()))
                .map(size -> new DimensionCandidate(size.getWidth(), size.getHeight(), Source.FILENAME));
    }

    /**
     * Two big-endian 16-bit values, each accepted in [100, 4096].
     */
    static Optional<Size> parseStem(String stem) {
        if (stem == null || stem.length() != FlukeFormat.Dimensions.HINT_STEM_LENGTH || !stem.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            return Optional.empty();
        }
        int width = Integer.parseInt(stem.substring(0, 4), 16);
        int height = Integer.parseInt(stem.substring(4), 16);
        if (!inHintRange(width) || !inHintRange(height)) {
            return Optional.empty();
        }
        return Optional.of(new Size(width, height));
    }

    static Optional<DimensionCandidate> fromEmbeddedHeader(int[] samples) {
        if (samples == null || samples.length <= FlukeFormat.IrData.Index.HEIGHT) {
            return Optional.empty();
        }
        int width = samples[FlukeFormat.IrData.Index.WIDTH];
        int height = samples[FlukeFormat.IrData.Index.HEIGHT];
        if (width <= 0 || height <= 0 || !withinSideLimit(width) || !withinSideLimit(height) || (long) width * height > samples.length) {
            return Optional.empty();
        }
        return Optional.of(new DimensionCandidate(width, height, Source.EMBEDDED));
    }

    private static boolean withinSideLimit(int value) {
        return value <= FlukeFormat.Dimensions.MAX_SIDE;
    }

    private static boolean inHintRange(int value) {
        return value >= FlukeFormat.Dimensions.HINT_MIN && value <= FlukeFormat.Dimensions.HINT_MAX;
    }

}
