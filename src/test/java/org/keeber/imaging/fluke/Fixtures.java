package org.keeber.imaging.fluke;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builders for synthetic container content.
 */
class Fixtures {

    /**
     * A calibration blob with one tagged segment per {t_lo, t_hi, a, b, c} row, endpoints at the
     * standard offsets, preceded by a 32 byte preamble whose byte 18 is the range selector.
     */
    static byte[] calibration(float[]... segments) {
        return calibration(false, segments);
    }

    static byte[] calibration(boolean shifted, float[]... segments) {
        ByteBuffer buffer = ByteBuffer.allocate(32 + segments.length * (3 + 24) + 8).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(18, (byte) 1);
        buffer.position(32);
        for (float[] s : segments) {
            buffer.put(FlukeFormat.Calibration.MAGIC);
            int start = buffer.position();
            byte[] blank = new byte[24];
            Arrays.fill(blank, (byte) 0x15);
            buffer.put(blank);
            int lo = shifted ? FlukeFormat.Calibration.ShiftedIndex.T_LO : FlukeFormat.Calibration.Index.T_LO;
            int hi = shifted ? FlukeFormat.Calibration.ShiftedIndex.T_HI : FlukeFormat.Calibration.Index.T_HI;
            buffer.putFloat(start + lo, s[0]);
            buffer.putFloat(start + hi, s[1]);
            buffer.putFloat(start + FlukeFormat.Calibration.Index.A, s[2]);
            buffer.putFloat(start + FlukeFormat.Calibration.Index.B, s[3]);
            buffer.putFloat(start + FlukeFormat.Calibration.Index.C, s[4]);
        }
        return buffer.array();
    }

    /**
     * Little-endian uint16 samples.
     */
    static byte[] samples(int... values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (int v : values) {
            buffer.putShort((short) v);
        }
        return buffer.array();
    }

    static int[] filled(int length, int value) {
        int[] out = new int[length];
        Arrays.fill(out, value);
        return out;
    }

    /**
     * IR.data: a header of `header` zero samples followed by the pixels.
     */
    static byte[] irData(int header, int[] pixels) {
        int[] all = new int[header + pixels.length];
        System.arraycopy(pixels, 0, all, header, pixels.length);
        return samples(all);
    }

    /**
     * Classic camera info: Latin-1 strings at their fixed ranges.
     */
    static byte[] cameraInfo(String manufacturer, String model, String engineSerial, String serial) {
        byte[] out = new byte[130];
        put(out, FlukeFormat.CameraInfo.Index.MANUFACTURER, manufacturer);
        put(out, FlukeFormat.CameraInfo.Index.MODEL, model);
        put(out, FlukeFormat.CameraInfo.Index.ENGINE_SERIAL, engineSerial);
        put(out, FlukeFormat.CameraInfo.Index.CAMERA_SERIAL, serial);
        return out;
    }

    private static void put(byte[] out, int offset, String value) {
        byte[] b = value.getBytes(StandardCharsets.ISO_8859_1);
        System.arraycopy(b, 0, out, offset, b.length);
    }

    /**
     * Image info with floats at the given offsets.
     */
    static byte[] imageInfo(int length, Object... offsetAndValue) {
        ByteBuffer buffer = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < offsetAndValue.length; i += 2) {
            buffer.putFloat((Integer) offsetAndValue[i], ((Number) offsetAndValue[i + 1]).floatValue());
        }
        return buffer.array();
    }

    /**
     * A complete Ti300 container: 4x3 pixels of one count, curve {0, 100, 0.001, 2, 500},
     * emissivity 0.9, background 20 °C.
     */
    static Map<String, byte[]> classic(int count) {
        return entries(
                FlukeFormat.Paths.CAMERA_INFO, cameraInfo("Fluke", "Ti300", "E1234", "S5678"),
                FlukeFormat.Paths.CALIBRATION, calibration(new float[] { 0f, 100f, 0.001f, 2f, 500f }),
                FlukeFormat.Paths.IMAGE_PROPERTIES, utf8("{\"IRPROP_IR_SENSOR_WIDTH\":4,\"IRPROP_IR_SENSOR_HEIGHT\":3,"
                        + "\"IRPROP_THERMAL_IMAGE_EMISSIVITY\":0.9,\"IRPROP_THERMAL_IMAGE_BG_TEMP_C\":20,"
                        + "\"IRPROP_THERMAL_IMAGE_TRANSMISSIVITY\":1.0,\"IRPROP_THERMAL_IMAGE_CAPTURE_DATE_TIME\":\"2021-03-04 10:11:12\"}"),
                FlukeFormat.Paths.IR_DATA, irData(4, filled(12, count)),
                "Thumbnails/thumb.jpg", new byte[20],
                "Images/Main/photo.jpg", new byte[200]);
    }

    static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    static Map<String, byte[]> entries(Object... pathAndBytes) {
        Map<String, byte[]> map = new LinkedHashMap<>();
        for (int i = 0; i < pathAndBytes.length; i += 2) {
            map.put((String) pathAndBytes[i], (byte[]) pathAndBytes[i + 1]);
        }
        return map;
    }

    static byte[] zip(Map<String, byte[]> entries) throws IOException {
        ByteArrayOutputStream os = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(os)) {
            for (Map.Entry<String, byte[]> e : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(e.getKey()));
                zip.write(e.getValue());
                zip.closeEntry();
            }
        }
        return os.toByteArray();
    }

    /**
     * Writes a tag/value stream and remembers where length-delimited values start.
     */
    static class Stream {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        int size() {
            return out.size();
        }

        Stream varint(int field, long value) {
            key(field, FlukeFormat.SubRecord.WireType.VARINT);
            raw(value);
            return this;
        }

        Stream fixed32(int field, int value) {
            key(field, FlukeFormat.SubRecord.WireType.FIXED32);
            out.writeBytes(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(value).array());
            return this;
        }

        Stream fixed64(int field, long value) {
            key(field, FlukeFormat.SubRecord.WireType.FIXED64);
            out.writeBytes(ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array());
            return this;
        }

        /**
         * @return offset of the value within this stream.
         */
        int bytes(int field, byte[] value) {
            key(field, FlukeFormat.SubRecord.WireType.LENGTH_DELIMITED);
            raw(value.length);
            int offset = out.size();
            out.writeBytes(value);
            return offset;
        }

        byte[] toByteArray() {
            return out.toByteArray();
        }

        private void key(int field, int wireType) {
            raw(((long) field << 3) | wireType);
        }

        private void raw(long value) {
            long v = value;
            while ((v & ~0x7FL) != 0) {
                out.write((int) ((v & 0x7F) | 0x80));
                v >>>= 7;
            }
            out.write((int) v);
        }
    }

}
