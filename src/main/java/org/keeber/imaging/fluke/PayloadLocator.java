package org.keeber.imaging.fluke;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.keeber.imaging.fluke.CameraProfile.HeaderSkip;
import org.keeber.imaging.fluke.CameraProfile.Size;
import org.keeber.imaging.fluke.SubRecordScanner.Span;
import org.keeber.imaging.fluke.ThermalFrame.Provenance;
import org.keeber.imaging.fluke.ThermalRecord.ThermalRecordException;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Finds the raw counts of the thermogram.
 */
public class PayloadLocator {
    private static final Logger logger = Logger.getLogger(PayloadLocator.class.getName());

    /**
     * Raw counts (row-major) and the geometry they were read with.
     */
    @Getter
    @RequiredArgsConstructor
    public static class Payload {
        private final int[] counts;
        private final int width, height;
        private final Provenance provenance;
    }

    /**
     * Little-endian unsigned 16-bit samples. A trailing odd byte is ignored.
     */
    public static int[] samples(byte[] data, int offset, int length) {
        ByteBuffer buffer = ByteBuffer.wrap(data, offset, length).slice().order(ByteOrder.LITTLE_ENDIAN);
        int[] out = new int[length / 2];
        for (int i = 0; i < out.length; i++) {
            out[i] = Short.toUnsignedInt(buffer.getShort(i * 2));
        }
        return out;
    }

    public static int[] samples(byte[] data) {
        return samples(data, 0, data.length);
    }

    /**
     * Fixed-array source: skip one row (or column) of header samples, then width·height pixels.
     *
     * When the samples after the header do not hold width·height pixels, the first plausible width
     * dividing the sample count is adopted instead. With no size at all and no embedded header the
     * whole buffer is tried that way.
     *
     * @param samples the `IR.data` samples.
     * @param width declared width, 0 to read it from the embedded header.
     * @param height declared height, 0 to read it from the embedded header.
     * @param skip header convention.
     * @param model camera model for error reporting.
     * @throws ThermalRecordException if no geometry fits the samples.
     */
    public static Payload locateFixed(int[] samples, int width, int height, HeaderSkip skip, String model) throws ThermalRecordException {
        int header = 0;
        if (width == 0 && height == 0) {
            Optional<DimensionResolver.DimensionCandidate> embedded = DimensionResolver.fromEmbeddedHeader(samples);
            if (embedded.isPresent()) {
                width = embedded.get().getWidth();
                height = embedded.get().getHeight();
                header = skip.samples(width, height);
            }
        } else {
            header = skip.samples(width, height);
        }
        long available = (long) samples.length - header;
        long pixels = (long) width * height;
        if (width > 0 && height > 0 && available >= pixels) {
            int[] counts = new int[(int) pixels];
            System.arraycopy(samples, header, counts, 0, counts.length);
            return new Payload(counts, width, height, Provenance.FIXED_ARRAY);
        }
        Optional<Payload> regridded = regrid(samples, header);
        if (regridded.isPresent()) {
            logger.log(Level.FINE, "IR.data holds {0} samples, not {1}x{2}; using {3}x{4}",
                    new Object[] { available, width, height, regridded.get().getWidth(), regridded.get().getHeight() });
            return regridded.get();
        }
        if (width == 0 && height == 0) {
            throw new ThermalRecordException(ThermalRecordException.Reason.MISSING_PAYLOAD, model, "Could not determine the thermal image size.");
        }
        throw new ThermalRecordException(ThermalRecordException.Reason.MALFORMED_RECORD, model,
                "Thermal data holds " + samples.length + " samples, too few for " + width + "x" + height + ".");
    }

    /**
     * The first plausible width dividing the samples after the header.
     */
    static Optional<Payload> regrid(int[] samples, int header) {
        int available = samples.length - header;
        if (header < 0 || available <= 0) {
            return Optional.empty();
        }
        for (int candidate : FlukeFormat.IrData.PLAUSIBLE_WIDTHS) {
            int rows = available / candidate;
            if (available % candidate == 0 && rows >= 1 && rows <= FlukeFormat.IrData.MAX_HEIGHT) {
                int[] counts = new int[available];
                System.arraycopy(samples, header, counts, 0, available);
                return Optional.of(new Payload(counts, candidate, rows, Provenance.FIXED_ARRAY_REGRIDDED));
            }
        }
        return Optional.empty();
    }

    /**
     * Scanned-blob source: the first length-delimited span whose size matches a candidate geometry,
     * with or without one row (or column) of header samples. Falls back to the tail of the buffer.
     *
     * @param data the blob.
     * @param sizes candidate sizes, highest priority first.
     * @param skip header convention.
     * @param model camera model for error reporting.
     * @throws ThermalRecordException if nothing fits.
     */
    public static Payload locateScanned(byte[] data, List<Size> sizes, HeaderSkip skip, String model) throws ThermalRecordException {
        if (sizes.isEmpty()) {
            throw new ThermalRecordException(ThermalRecordException.Reason.MISSING_PAYLOAD, model, "No candidate thermal image size.");
        }
        List<Span> spans = SubRecordScanner.scan(data);
        for (Span span : spans) {
            for (Size size : sizes) {
                long pixels = size.pixels();
                long header = skip.samples(size.getWidth(), size.getHeight());
                if (span.getLength() == pixels * 2) {
                    logger.log(Level.FINE, "Thermal blob {0} matches {1}", new Object[] { span, size });
                    return new Payload(samples(data, span.getOffset(), span.getLength()), size.getWidth(), size.getHeight(), Provenance.SCANNED_SPAN);
                }
                if (span.getLength() == (header + pixels) * 2) {
                    logger.log(Level.FINE, "Thermal blob {0} matches {1} after {2} header samples", new Object[] { span, size, header });
                    return new Payload(samples(data, span.getOffset() + (int) header * 2, span.getLength() - (int) header * 2),
                            size.getWidth(), size.getHeight(), Provenance.SCANNED_SPAN);
                }
            }
        }
        Size first = sizes.get(0);
        long bytes = first.pixels() * 2;
        if (first.pixels() > 0 && bytes <= data.length) {
            logger.log(Level.FINE, "No span of {0} spans matched, using the last {1} bytes", new Object[] { spans.size(), bytes });
            return new Payload(samples(data, data.length - (int) bytes, (int) bytes), first.getWidth(), first.getHeight(), Provenance.SCANNED_TAIL);
        }
        throw new ThermalRecordException(ThermalRecordException.Reason.MISSING_PAYLOAD, model,
                "No thermal blob of a known size found (" + spans.size() + " spans, sizes " + sizes + ").");
    }

}
