package org.keeber.imaging.fluke;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;
import org.keeber.imaging.fluke.CameraProfile.HeaderSkip;
import org.keeber.imaging.fluke.CameraProfile.Size;
import org.keeber.imaging.fluke.PayloadLocator.Payload;
import org.keeber.imaging.fluke.ThermalFrame.Provenance;
import org.keeber.imaging.fluke.ThermalRecord.ThermalRecordException;

public class PayloadLocatorTest {

    private static final int[] PIXELS = new int[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12 };

    private static int[] withHeader(int header, int[] pixels) {
        return PayloadLocator.samples(Fixtures.irData(header, pixels));
    }

    @Test
    public void samplesAreLittleEndianUnsigned() {
        assertArrayEquals(new int[] { 1, 0xFFFF, 0x1234 }, PayloadLocator.samples(new byte[] { 1, 0, -1, -1, 0x34, 0x12, 7 }));
    }

    @Test
    public void fixedArraySkipsOneRowOfHeader() throws Exception {
        Payload payload = PayloadLocator.locateFixed(withHeader(4, PIXELS), 4, 3, HeaderSkip.BY_WIDTH, "Ti300");
        assertArrayEquals(PIXELS, payload.getCounts());
        assertEquals(4, payload.getWidth());
        assertEquals(3, payload.getHeight());
        assertEquals(Provenance.FIXED_ARRAY, payload.getProvenance());
    }

    @Test
    public void fixedArrayCanSkipByHeight() throws Exception {
        Payload payload = PayloadLocator.locateFixed(withHeader(3, PIXELS), 4, 3, HeaderSkip.BY_HEIGHT, "Ti300");
        assertArrayEquals(PIXELS, payload.getCounts());
    }

    @Test
    public void fixedArrayIsRegriddedWhenShort() throws Exception {
        int[] samples = withHeader(320, Fixtures.filled(80 * 7, 9));
        Payload payload = PayloadLocator.locateFixed(samples, 320, 240, HeaderSkip.BY_WIDTH, "Ti300");
        assertEquals(80, payload.getWidth());
        assertEquals(7, payload.getHeight());
        assertEquals(560, payload.getCounts().length);
        assertEquals(Provenance.FIXED_ARRAY_REGRIDDED, payload.getProvenance());
    }

    @Test
    public void fixedArrayWithNoFittingGeometryIsMalformed() {
        try {
            PayloadLocator.locateFixed(new int[321], 320, 240, HeaderSkip.BY_WIDTH, "Ti300");
            fail("Expected malformed record");
        } catch (ThermalRecordException e) {
            assertEquals(ThermalRecordException.Reason.MALFORMED_RECORD, e.getReason());
        }
    }

    @Test
    public void fixedArrayWithOverflowingSizeIsMalformed() {
        try {
            PayloadLocator.locateFixed(withHeader(4, PIXELS), 46341, 46341, HeaderSkip.BY_WIDTH, "Ti300");
            fail("Expected malformed record");
        } catch (ThermalRecordException e) {
            assertEquals(ThermalRecordException.Reason.MALFORMED_RECORD, e.getReason());
        }
    }

    @Test
    public void fixedArrayWithoutSizeIsRegriddedWhole() throws Exception {
        Payload payload = PayloadLocator.locateFixed(Fixtures.filled(80 * 7, 3), 0, 0, HeaderSkip.BY_WIDTH, null);
        assertEquals(80, payload.getWidth());
        assertEquals(7, payload.getHeight());
        assertEquals(Provenance.FIXED_ARRAY_REGRIDDED, payload.getProvenance());
    }

    @Test
    public void fixedArrayWithoutAnySizeIsMissing() {
        try {
            PayloadLocator.locateFixed(new int[50], 0, 0, HeaderSkip.BY_WIDTH, null);
            fail("Expected missing payload");
        } catch (ThermalRecordException e) {
            assertEquals(ThermalRecordException.Reason.MISSING_PAYLOAD, e.getReason());
        }
    }

    @Test
    public void scannedSpanMatchesExactSize() throws Exception {
        Fixtures.Stream stream = new Fixtures.Stream();
        stream.varint(1, 5);
        stream.bytes(2, Fixtures.utf8("TiS75+"));
        stream.bytes(3, Fixtures.samples(PIXELS));
        Payload payload = PayloadLocator.locateScanned(stream.toByteArray(), List.of(new Size(4, 3)), HeaderSkip.BY_WIDTH, "TiS75+");
        assertArrayEquals(PIXELS, payload.getCounts());
        assertEquals(Provenance.SCANNED_SPAN, payload.getProvenance());
    }

    @Test
    public void scannedSpanMayCarryHeader() throws Exception {
        Fixtures.Stream stream = new Fixtures.Stream();
        stream.bytes(1, Fixtures.irData(4, PIXELS));
        Payload payload = PayloadLocator.locateScanned(stream.toByteArray(), List.of(new Size(4, 3)), HeaderSkip.BY_WIDTH, "TiS75+");
        assertArrayEquals(PIXELS, payload.getCounts());
    }

    @Test
    public void earlierSpanWinsOverHigherPrioritySize() throws Exception {
        Fixtures.Stream stream = new Fixtures.Stream();
        stream.bytes(1, Fixtures.samples(Fixtures.filled(2 * 3, 7)));
        stream.bytes(2, Fixtures.samples(PIXELS));
        Payload payload = PayloadLocator.locateScanned(stream.toByteArray(), List.of(new Size(4, 3), new Size(2, 3)), HeaderSkip.BY_WIDTH, null);
        assertEquals(2, payload.getWidth());
        assertArrayEquals(Fixtures.filled(6, 7), payload.getCounts());
    }

    @Test
    public void fallsBackToTailOfBlob() throws Exception {
        byte[] pixels = Fixtures.samples(PIXELS);
        byte[] data = new byte[10 + pixels.length];
        data[0] = 0x0B;     // unsupported wire type, nothing to scan
        System.arraycopy(pixels, 0, data, 10, pixels.length);
        Payload payload = PayloadLocator.locateScanned(data, List.of(new Size(4, 3)), HeaderSkip.BY_WIDTH, null);
        assertArrayEquals(PIXELS, payload.getCounts());
        assertEquals(Provenance.SCANNED_TAIL, payload.getProvenance());
    }

    @Test
    public void hugeCandidateSizeDoesNotOverflow() {
        byte[] data = new byte[64];
        data[0] = 0x0B;
        try {
            PayloadLocator.locateScanned(data, List.of(new Size(40000, 40000)), HeaderSkip.BY_WIDTH, "TiS75+");
            fail("Expected missing payload");
        } catch (ThermalRecordException e) {
            assertEquals(ThermalRecordException.Reason.MISSING_PAYLOAD, e.getReason());
        }
    }

    @Test
    public void blobTooSmallForAnySizeIsMissing() {
        byte[] data = new byte[10];
        data[0] = 0x0B;
        try {
            PayloadLocator.locateScanned(data, List.of(new Size(4, 3)), HeaderSkip.BY_WIDTH, "TiS75+");
            fail("Expected missing payload");
        } catch (ThermalRecordException e) {
            assertEquals(ThermalRecordException.Reason.MISSING_PAYLOAD, e.getReason());
            assertEquals("TiS75+", e.getModel());
        }
    }

}
