package org.keeber.imaging.fluke;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.keeber.imaging.fluke.CameraProfile.CameraInfoLayout;
import org.keeber.imaging.fluke.CameraProfile.FloatField;
import org.keeber.imaging.fluke.CameraProfile.ImageInfoLayout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Fills a {@link Metadata} from the three metadata sources of a container.
 *
 * Call order sets precedence: {@link #readCameraInfo}, then {@link #readJson} (overrides the
 * camera identity), then {@link #readImageInfo} (only fills radiometric fields still unset).
 * None of these fail: missing or short records are logged and skipped.
 */
public class MetadataReader {
    private static final Logger logger = Logger.getLogger(MetadataReader.class.getName());
    private static final ObjectMapper JSON = JsonMapper.builder().build();
    private static final List<Charset> ENCODINGS = List.of(
            StandardCharsets.UTF_8, StandardCharsets.UTF_16, StandardCharsets.ISO_8859_1, Charset.forName("windows-1252"));

    /**
     * Latin-1 identity strings at the profile's fixed byte ranges.
     */
    public static void readCameraInfo(Metadata metadata, CameraProfile profile, byte[] cameraInfo) {
        Optional<CameraInfoLayout> layout = profile.getCameraInfoLayout();
        if (cameraInfo == null || layout.isEmpty()) {
            return;
        }
        CameraInfoLayout l = layout.get();
        if (cameraInfo.length < l.getMinBytes()) {
            logger.log(Level.WARNING, "Camera info is {0} bytes, expected {1}; skipped", new Object[] { cameraInfo.length, l.getMinBytes() });
            return;
        }
        metadata.setManufacturer(latin1(cameraInfo, l.getManufacturerStart(), l.getManufacturerEnd()))
                .setModel(CameraProfiles.stripTrailing(latin1(cameraInfo, l.getModelStart(), l.getModelEnd()), FlukeFormat.CameraInfo.MODEL_PADDING))
                .setEngineSerial(latin1(cameraInfo, l.getEngineSerialStart(), l.getEngineSerialEnd()))
                .setCameraSerial(latin1(cameraInfo, l.getCameraSerialStart(), l.getCameraSerialEnd()));
    }

    /**
     * The JSON side-file. Keys are looked up through the alias lists in {@link FlukeFormat.MetadataKeys}.
     */
    public static void readJson(Metadata metadata, byte[] json) {
        Optional<JsonNode> parsed = parse(json);
        if (parsed.isEmpty()) {
            return;
        }
        JsonNode props = parsed.get();
        text(props, FlukeFormat.MetadataKeys.MAKE).ifPresent(metadata::setManufacturer);
        text(props, FlukeFormat.MetadataKeys.MODEL).ifPresent(metadata::setModel);
        text(props, FlukeFormat.MetadataKeys.SERIAL).ifPresent(serial -> {
            metadata.setCameraSerial(serial);
            if (metadata.getEngineSerial() == null || metadata.getEngineSerial().isEmpty()) {
                metadata.setEngineSerial(serial);
            }
        });
        text(props, FlukeFormat.MetadataKeys.LENS).ifPresent(metadata::setLens);
        text(props, FlukeFormat.MetadataKeys.LENS_SERIAL).ifPresent(metadata::setLensSerial);
        text(props, FlukeFormat.MetadataKeys.CAL_DATE).ifPresent(metadata::setCalibrationDate);
        text(props, FlukeFormat.MetadataKeys.CAPTURED).ifPresent(metadata::setCaptureDateTime);
        text(props, FlukeFormat.MetadataKeys.TITLE).ifPresent(metadata::setTitle);
        text(props, FlukeFormat.MetadataKeys.COMMENTS).ifPresent(metadata::setComments);
        number(props, FlukeFormat.MetadataKeys.IR_WIDTH).ifPresent(v -> metadata.setIrWidth(v.intValue()));
        number(props, FlukeFormat.MetadataKeys.IR_HEIGHT).ifPresent(v -> metadata.setIrHeight(v.intValue()));
        number(props, FlukeFormat.MetadataKeys.VL_WIDTH).ifPresent(v -> metadata.setVlWidth(v.intValue()));
        number(props, FlukeFormat.MetadataKeys.VL_HEIGHT).ifPresent(v -> metadata.setVlHeight(v.intValue()));
        number(props, FlukeFormat.MetadataKeys.MIN_TEMP).ifPresent(metadata::setMinTemperature);
        number(props, FlukeFormat.MetadataKeys.MAX_TEMP).ifPresent(metadata::setMaxTemperature);
        number(props, FlukeFormat.MetadataKeys.AVG_TEMP).ifPresent(metadata::setAvgTemperature);
        number(props, FlukeFormat.MetadataKeys.CENTER_TEMP).ifPresent(metadata::setCenterTemperature);
        number(props, FlukeFormat.MetadataKeys.BACKGROUND).ifPresent(metadata::setBackgroundTemperature);
        number(props, FlukeFormat.MetadataKeys.EMISSIVITY).filter(MetadataReader::isFraction).ifPresent(metadata::setEmissivity);
        number(props, FlukeFormat.MetadataKeys.TRANSMISSION).filter(MetadataReader::isFraction).ifPresent(metadata::setTransmission);
        metadata.setContainsAnnotations(flag(props, FlukeFormat.MetadataKeys.ANNOTATIONS))
                .setContainsAudio(flag(props, FlukeFormat.MetadataKeys.AUDIO))
                .setContainsCnxReadings(flag(props, FlukeFormat.MetadataKeys.CNX_READINGS));
    }

    /**
     * Emissivity, background and transmission from the image-info record, only where still unset.
     */
    public static void readImageInfo(Metadata metadata, CameraProfile profile, byte[] imageInfo) {
        if (imageInfo == null) {
            return;
        }
        ImageInfoLayout layout = profile.getImageInfoLayout();
        if (imageInfo.length < layout.getMinBytes()) {
            logger.log(Level.WARNING, "Image info is {0} bytes, expected {1}; skipped", new Object[] { imageInfo.length, layout.getMinBytes() });
            return;
        }
        ByteBuffer buffer = ByteBuffer.wrap(imageInfo).order(ByteOrder.LITTLE_ENDIAN);
        if (!metadata.hasEmissivity()) {
            float emissivity = buffer.getFloat(layout.getEmissivity().getOffset());
            if (isFraction(emissivity)) {
                metadata.setEmissivity((double) emissivity);
            }
        }
        if (!metadata.hasBackgroundTemperature()) {
            float background = buffer.getFloat(layout.getBackground().getOffset());
            if (Float.isFinite(background)) {
                metadata.setBackgroundTemperature((double) background);
            }
        }
        if (!metadata.hasTransmission()) {
            float transmission = buffer.getFloat(layout.getTransmission().getOffset());
            metadata.setTransmission(isFraction(transmission) ? transmission : FlukeFormat.Radiometry.DEFAULT_TRANSMISSION);
        }
    }

    /**
     * The (low, high) temperature range used to scale counts when there is no curve.
     *
     * @return the range when the profile declares one and the record holds an ordered finite pair.
     */
    public static Optional<double[]> readRangeHint(CameraProfile profile, byte[] imageInfo) {
        Optional<FloatField[]> range = profile.getImageInfoLayout().getRange();
        if (imageInfo == null || range.isEmpty() || imageInfo.length < profile.getImageInfoLayout().getMinBytes()) {
            return Optional.empty();
        }
        ByteBuffer buffer = ByteBuffer.wrap(imageInfo).order(ByteOrder.LITTLE_ENDIAN);
        float lo = buffer.getFloat(range.get()[0].getOffset());
        float hi = buffer.getFloat(range.get()[1].getOffset());
        if (!Float.isFinite(lo) || !Float.isFinite(hi) || lo >= hi) {
            return Optional.empty();
        }
        return Optional.of(new double[] { lo, hi });
    }

    /**
     * Decode the side-file trying each text encoding in turn.
     *
     * @return the root object, or empty if no encoding yields a JSON object.
     */
    static Optional<JsonNode> parse(byte[] json) {
        if (json == null || json.length == 0) {
            return Optional.empty();
        }
        for (Charset charset : ENCODINGS) {
            try {
                String text = charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(json)).toString();
                if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
                    text = text.substring(1);
                }
                JsonNode node = JSON.readTree(text);
                if (node != null && node.isObject()) {
                    return Optional.of(node);
                }
            } catch (CharacterCodingException | JsonProcessingException e) {
                logger.log(Level.FINE, "Metadata is not " + charset.name() + " JSON: " + e.getMessage());
            }
        }
        logger.log(Level.FINE, "Metadata could not be decoded with any encoding; ignored");
        return Optional.empty();
    }

    /**
     * First alias present in the object.
     */
    static Optional<JsonNode> first(JsonNode node, List<String> aliases) {
        return aliases.stream().map(node::get).filter(v -> v != null && !v.isNull()).findFirst();
    }

    static Optional<String> text(JsonNode node, List<String> aliases) {
        return first(node, aliases).map(JsonNode::asText).map(MetadataReader::unquote);
    }

    static Optional<Double> number(JsonNode node, List<String> aliases) {
        return first(node, aliases).flatMap(v -> {
            if (v.isNumber()) {
                return Optional.of(v.asDouble());
            }
            try {
                return Optional.of(Double.parseDouble(unquote(v.asText()).trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }).filter(Double::isFinite);
    }

    static boolean flag(JsonNode node, List<String> aliases) {
        return first(node, aliases).map(v -> v.isBoolean() ? v.asBoolean() : "true".equalsIgnoreCase(unquote(v.asText()).trim())).orElse(false);
    }

    static String unquote(String value) {
        String v = value;
        while (v.startsWith("\"")) {
            v = v.substring(1);
        }
        while (v.endsWith("\"")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }

    static boolean isFraction(double value) {
        return value > 0 && value <= 1;
    }

    private static String latin1(byte[] data, int start, int end) {
        return new String(data, start, end - start, StandardCharsets.ISO_8859_1).replace('\0', ' ').trim();
    }

}
