package edu.stanford.futuredata.bitimport.encoder;

import org.roaringbitmap.longlong.Roaring64NavigableMap;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

// Writes a view bitmap in the server's 64-bit roaring layout, all little-endian:
//   cookie (uint32) | container count (uint32)
//   per container: key (uint64, value >>> 16) | type (uint16) | cardinality - 1 (uint16)
//   per container: absolute offset of its data (uint32)
//   container data: sorted uint16 values (array) or 1024 uint64 words (bitmap)
class RoaringViewFormat {

    static final int COOKIE = 12348;
    static final int HEADER_SIZE = 8;
    static final short ARRAY_CONTAINER = 1;
    static final short BITMAP_CONTAINER = 2;
    // Containers with more values than this are written as bitmaps.
    static final int ARRAY_MAX_SIZE = 4096;
    static final int BITMAP_WORDS = 1024;

    private static final int DESCRIPTOR_SIZE = 8 + 2 + 2 + 4;

    private RoaringViewFormat() {}

    static byte[] write(Roaring64NavigableMap bitmap) {
        List<Container> containers = containers(bitmap);
        int dataStart = HEADER_SIZE + containers.size() * DESCRIPTOR_SIZE;
        int size = dataStart;
        for (Container c : containers) {
            size += c.dataSize();
        }
        ByteBuffer buffer = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(COOKIE);
        buffer.putInt(containers.size());
        for (Container c : containers) {
            buffer.putLong(c.key);
            buffer.putShort(c.type());
            buffer.putShort((short) (c.values.length - 1));
        }
        int offset = dataStart;
        for (Container c : containers) {
            buffer.putInt(offset);
            offset += c.dataSize();
        }
        for (Container c : containers) {
            c.writeData(buffer);
        }
        return buffer.array();
    }

    private static List<Container> containers(Roaring64NavigableMap bitmap) {
        long[] values = bitmap.toArray();
        // Unsigned order: flip the sign bit, sort, flip back.
        for (int i = 0; i < values.length; i++) {
            values[i] ^= Long.MIN_VALUE;
        }
        Arrays.sort(values);
        for (int i = 0; i < values.length; i++) {
            values[i] ^= Long.MIN_VALUE;
        }
        List<Container> containers = new ArrayList<>();
        char[] lows = new char[1 << 16];
        int start = 0;
        while (start < values.length) {
            long key = values[start] >>> 16;
            int n = 0;
            int i = start;
            while (i < values.length && values[i] >>> 16 == key) {
                lows[n++] = (char) values[i];
                i++;
            }
            containers.add(new Container(key, Arrays.copyOf(lows, n)));
            start = i;
        }
        return containers;
    }

    private static class Container {
        final long key;
        final char[] values;

        Container(long key, char[] values) {
            this.key = key;
            this.values = values;
        }

        boolean isBitmap() {
            return values.length > ARRAY_MAX_SIZE;
        }

        short type() {
            return isBitmap() ? BITMAP_CONTAINER : ARRAY_CONTAINER;
        }

        int dataSize() {
            return isBitmap() ? BITMAP_WORDS * 8 : values.length * 2;
        }

        void writeData(ByteBuffer buffer) {
            if (isBitmap()) {
                long[] words = new long[BITMAP_WORDS];
                for (char v : values) {
                    words[v >>> 6] |= 1L << (v & 63);
                }
                for (long w : words) {
                    buffer.putLong(w);
                }
            } else {
                for (char v : values) {
                    buffer.putChar(v);
                }
            }
        }
    }
}
