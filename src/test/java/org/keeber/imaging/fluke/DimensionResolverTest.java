package org.keeber.imaging.fluke;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.Test;
import org.keeber.imaging.fluke.CameraProfile.Size;
import org.keeber.imaging.fluke.DimensionResolver.DimensionCandidate;
import org.keeber.imaging.fluke.DimensionResolver.Source;

public class DimensionResolverTest {

    private static RawContainer withImages(Object... pathAndBytes) {
        return new RawContainer("test.is2", Fixtures.entries(pathAndBytes));
    }

    private static int[] embedded(int width, int height, int length) {
        int[] samples = new int[length];
        samples[FlukeFormat.IrData.Index.WIDTH] = width;
        samples[FlukeFormat.IrData.Index.HEIGHT] = height;
        return samples;
    }

    @Test
    public void filenameWinsWhenMetadataIsZero() {
        RawContainer container = withImages(
                "Images/Main/00A00078.jpg", new byte[500],
                "Images/Main/small.jpg", new byte[100]);
        DimensionCandidate best = DimensionResolver.resolve(new Metadata(), container, null, CameraProfiles.TI300);
        assertEquals(160, best.getWidth());
        assertEquals(120, best.getHeight());
        assertEquals(Source.FILENAME, best.getSource());
    }

    @Test
    public void filenameValuesOutsideHintRangeAreIgnored() {
        // 0x0080 x 0x0060 = 128 x 96, the height is below the accepted range
        RawContainer container = withImages("Images/Main/00800060.jpg", new byte[10]);
        DimensionCandidate best = DimensionResolver.resolve(new Metadata(), container, null, CameraProfiles.TI300);
        assertEquals(Source.PROFILE, best.getSource());
        assertEquals(new Size(320, 240), best.toSize());
        assertTrue(DimensionResolver.parseStem("00800060").isEmpty());
        assertEquals(Optional.of(new Size(128, 100)), DimensionResolver.parseStem("00800064"));
    }

    @Test
    public void onlyTheLargestImageIsConsidered() {
        RawContainer container = withImages(
                "Images/Main/00A00078.jpg", new byte[10],
                "Images/Main/photo.jpg", new byte[900]);
        assertTrue(DimensionResolver.fromFileName(container).isEmpty());
    }

    @Test
    public void metadataBeatsEveryOtherSource() {
        Metadata metadata = new Metadata().setIrWidth(384).setIrHeight(288);
        RawContainer container = withImages("Images/Main/00A00078.jpg", new byte[10]);
        DimensionCandidate best = DimensionResolver.resolve(metadata, container, embedded(200, 150, 40000), CameraProfiles.TI300);
        assertEquals(Source.METADATA, best.getSource());
        assertEquals(384, metadata.getIrWidth());
    }

    @Test
    public void genericMetadataSizeIsOverridable() {
        Metadata metadata = new Metadata().setIrWidth(640).setIrHeight(480).setVlWidth(640).setVlHeight(480);
        DimensionCandidate best = DimensionResolver.resolve(metadata, withImages(), embedded(200, 150, 40000), CameraProfiles.TI300);
        assertEquals(Source.EMBEDDED, best.getSource());
        assertEquals(640, metadata.getIrWidth());
        DimensionResolver.apply(metadata, best.getWidth(), best.getHeight());
        assertEquals(200, metadata.getIrWidth());
        assertEquals(150, metadata.getIrHeight());
        assertEquals(200, metadata.getVlWidth());
        assertEquals(150, metadata.getVlHeight());
    }

    @Test
    public void realVisibleSizeIsKept() {
        Metadata metadata = new Metadata().setVlWidth(1280).setVlHeight(960);
        DimensionCandidate best = DimensionResolver.resolve(metadata, withImages(), null, CameraProfiles.TI480P);
        DimensionResolver.apply(metadata, best.getWidth(), best.getHeight());
        assertEquals(640, metadata.getIrWidth());
        assertEquals(1280, metadata.getVlWidth());
    }

    @Test
    public void oversizedMetadataIsIgnored() {
        Metadata metadata = new Metadata().setIrWidth(46341).setIrHeight(46341);
        List<DimensionCandidate> candidates = DimensionResolver.candidates(metadata, withImages(), null, CameraProfiles.TI300);
        assertEquals(1, candidates.size());
        assertEquals(Source.PROFILE, candidates.get(0).getSource());
    }

    @Test
    public void embeddedHeaderMustFitTheBuffer() {
        assertTrue(DimensionResolver.fromEmbeddedHeader(embedded(7000, 7000, 400)).isEmpty());
        assertTrue(DimensionResolver.fromEmbeddedHeader(embedded(5000, 1, 6000)).isEmpty());
        assertTrue(DimensionResolver.fromEmbeddedHeader(new int[100]).isEmpty());
    }

    @Test
    public void candidatesAreOrderedByPriority() {
        Metadata metadata = new Metadata().setIrWidth(640).setIrHeight(480);
        RawContainer container = withImages("Images/Main/01800120.jpg", new byte[10]);
        List<DimensionCandidate> candidates = DimensionResolver.candidates(metadata, container, null, CameraProfiles.TIS75_PLUS);
        assertEquals(List.of(Source.FILENAME, Source.GENERIC_METADATA, Source.PROFILE),
                candidates.stream().map(DimensionCandidate::getSource).toList());
        assertEquals(List.of(new Size(384, 288), new Size(640, 480)), DimensionResolver.sizes(candidates));
    }

}
