package org.keeber.imaging.fluke;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Walks a length-delimited tag/value stream (protobuf wire format without a schema) and
 * collects the byte spans of every length-delimited field.
 *
 * Spans larger than {@link FlukeFormat.SubRecord#NESTED_THRESHOLD} are themselves scanned as
 * nested streams. Nesting is handled with a FIFO worklist: all spans of one level are reported
 * before the spans found inside them.
 */
public class SubRecordScanner {
    private static final Logger logger = Logger.getLogger(SubRecordScanner.class.getName());

    /**
     * A length-delimited value: absolute byte offset and length in the scanned buffer.
     */
    @Getter
    @RequiredArgsConstructor
    public static class Span {
        private final int offset;
        private final int length;
        private final int depth;

        @Override
        public boolean equals(Object o) {
            return o instanceof Span && ((Span) o).offset == offset && ((Span) o).length == length;
        }

        @Override
        public int hashCode() {
            return offset * 31 + length;
        }

        @Override
        public String toString() {
            return "[" + offset + "+" + length + "]";
        }
    }

    @RequiredArgsConstructor
    private static class Range {
        final int start, end, depth;
    }

    private final byte[] data;
    private int pos;

    private SubRecordScanner(byte[] data) {
        this.data = data;
    }

    /**
     * @param data the buffer to scan.
     * @return every length-delimited span found, top level first.
     */
    public static List<Span> scan(byte[] data) {
        return new SubRecordScanner(data).run();
    }

    private List<Span> run() {
        List<Span> spans = new ArrayList<>();
        Deque<Range> work = new ArrayDeque<>();
        work.add(new Range(0, data.length, 0));
        while (!work.isEmpty() && spans.size() < FlukeFormat.SubRecord.MAX_SPANS) {
            Range range = work.poll();
            pos = range.start;
            while (pos < range.end) {
                long key = readVarint(range.end);
                if (key < 0) {
                    break;
                }
                int wireType = (int) (key & 0x7);
                if (wireType == FlukeFormat.SubRecord.WireType.VARINT) {
                    if (readVarint(range.end) < 0) {
                        break;
                    }
                } else if (wireType == FlukeFormat.SubRecord.WireType.FIXED64) {
                    pos += 8;
                } else if (wireType == FlukeFormat.SubRecord.WireType.FIXED32) {
                    pos += 4;
                } else if (wireType == FlukeFormat.SubRecord.WireType.LENGTH_DELIMITED) {
                    long length = readVarint(range.end);
                    if (length < 0 || length > range.end - pos) {
                        break;
                    }
                    Span span = new Span(pos, (int) length, range.depth);
                    spans.add(span);
                    if (length > FlukeFormat.SubRecord.NESTED_THRESHOLD && range.depth < FlukeFormat.SubRecord.MAX_DEPTH) {
                        work.add(new Range(pos, pos + (int) length, range.depth + 1));
                    }
                    pos += (int) length;
                } else {
                    // Groups and unknown wire types: not a sub-record stream from here on
                    break;
                }
            }
        }
        logger.log(Level.FINE, "Scanned {0} bytes, {1} spans", new Object[] { data.length, spans.size() });
        return spans;
    }

    /**
     * Read a base-128 varint, least significant group first.
     *
     * @return the value, or -1 when it runs past the end or exceeds 63 bits.
     */
    private long readVarint(int end) {
        long value = 0;
        for (int shift = 0; shift < 63; shift += 7) {
            if (pos >= end) {
                return -1;
            }
            int b = data[pos++] & 0xff;
            value |= (long) (b & 0x7f) << shift;
            if ((b & 0x80) == 0) {
                return value;
            }
        }
        return -1;
    }

}
