package org.keeber.imaging.fluke;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.keeber.imaging.fluke.CameraProfile.Size;
import org.keeber.imaging.fluke.DimensionResolver.DimensionCandidate;
import org.keeber.imaging.fluke.PayloadLocator.Payload;
import org.keeber.imaging.fluke.ThermalRecord.ThermalRecordException;

import lombok.Getter;
import lombok.NonNull;

/**
 * Decodes a {@link RawContainer} into a {@link ThermalRecord}.
 *
 * Steps: detect the model, pick the profile, merge metadata, build the calibration table,
 * locate the raw counts, convert to °C. Instances hold no per-file state and may be shared
 * between threads.
 */
public class Is2Decoder {
    private static final Logger logger = Logger.getLogger(Is2Decoder.class.getName());

    @Getter private final CameraProfiles profiles;
    private final ModelDetector detector;

    public Is2Decoder() {
        this(CameraProfiles.getDefault());
    }

    public Is2Decoder(@NonNull CameraProfiles profiles) {
        this.profiles = profiles;
        this.detector = new ModelDetector(profiles);
    }

    public ThermalRecord decode(@NonNull RawContainer container) throws ThermalRecordException {
        byte[] cameraInfo = container.get(FlukeFormat.Paths.CAMERA_INFO).orElse(null);
        boolean hasFixedArray = container.contains(FlukeFormat.Paths.IR_DATA);
        boolean hasScannedBlob = container.contains(FlukeFormat.Paths.CAL_TEMP_DATA_REX);

        // Model: camera-info record first, then the JSON side-files
        Optional<String> detected = detector.detect(cameraInfo);
        if (detected.isEmpty()) {
            detected = modelFromJson(container);
        }
        CameraProfile profile = profiles.resolve(detected.orElse(null), hasFixedArray, hasScannedBlob);
        String model = detected.orElse(null);
        logger.log(Level.FINE, "{0}: model {1}, profile {2}", new Object[] { container.getFileName(), model, profile });

        // Metadata
        Metadata metadata = new Metadata();
        MetadataReader.readCameraInfo(metadata, profile, cameraInfo);
        MetadataReader.readJson(metadata, container.get(profile.getMetadataPath())
                .or(() -> container.get(FlukeFormat.Paths.IMAGE_PROPERTIES))
                .or(() -> container.get(FlukeFormat.Paths.METADATA))
                .orElse(null));
        byte[] imageInfo = container.get(profile.getImageInfoPath()).orElse(null);
        MetadataReader.readImageInfo(metadata, profile, imageInfo);
        if (metadata.getModel() == null || metadata.getModel().isEmpty()) {
            metadata.setModel(model != null ? model : profile.getCanonicalName());
        }

        // Calibration
        CalibrationTable table = CalibrationTable.build(container.get(profile.getCalibrationPath()).orElse(null),
                profile.acceptsPlaceholderCalibration(), model);

        // Raw counts
        byte[] thermal = container.get(profile.getThermalPath()).orElse(null);
        if (thermal == null) {
            throw new ThermalRecordException(ThermalRecordException.Reason.MISSING_PAYLOAD, model,
                    "No thermal data found (expected " + profile.getThermalPath() + ").");
        }
        Payload payload = locate(container, profile, metadata, thermal, model);
        DimensionResolver.apply(metadata, payload.getWidth(), payload.getHeight());

        // Temperatures
        RadiometricConverter converter = new RadiometricConverter(table)
                .setEmissivity(metadata.getEmissivity())
                .setTransmission(metadata.getTransmission())
                .setBackground(metadata.getBackgroundTemperature())
                .setRangeHint(MetadataReader.readRangeHint(profile, imageInfo).orElse(null))
                .setMetadataRange(metadata.getMinTemperature(), metadata.getMaxTemperature());
        ThermalFrame frame = new ThermalFrame(payload.getWidth(), payload.getHeight(), converter.convert(payload.getCounts()), payload.getProvenance());

        return new ThermalRecord(container.getFileName(), profile.getCanonicalName(), frame, metadata, table,
                container.list(FlukeFormat.Paths.THUMBNAILS, FlukeFormat.Paths.IMAGE_SUFFIX).stream().findFirst().map(RawContainer.Entry::getPath).orElse(null),
                container.largest(FlukeFormat.Paths.MAIN_IMAGES, FlukeFormat.Paths.IMAGE_SUFFIX).map(RawContainer.Entry::getPath).orElse(null));
    }

    private Payload locate(RawContainer container, CameraProfile profile, Metadata metadata, byte[] thermal, String model) throws ThermalRecordException {
        switch (profile.getThermalSource()) {
            case FIXED_ARRAY: {
                int[] samples = PayloadLocator.samples(thermal);
                DimensionCandidate size = DimensionResolver.resolve(metadata, container, samples, profile);
                return PayloadLocator.locateFixed(samples, size.getWidth(), size.getHeight(), profile.getHeaderSkip(), model);
            }
            case SCANNED_BLOB: {
                List<Size> sizes = DimensionResolver.sizes(DimensionResolver.candidates(metadata, container, null, profile));
                return PayloadLocator.locateScanned(thermal, sizes, profile.getHeaderSkip(), model);
            }
            default:
                throw new ThermalRecordException(ThermalRecordException.Reason.UNSUPPORTED_CAMERA, model,
                        "Unknown thermal source " + profile.getThermalSource() + ".");
        }
    }

    private static Optional<String> modelFromJson(RawContainer container) {
        Metadata probe = new Metadata();
        MetadataReader.readJson(probe, container.get(FlukeFormat.Paths.IMAGE_PROPERTIES)
                .or(() -> container.get(FlukeFormat.Paths.METADATA))
                .orElse(null));
        return Optional.ofNullable(probe.getModel()).filter(m -> !m.isBlank());
    }

}
