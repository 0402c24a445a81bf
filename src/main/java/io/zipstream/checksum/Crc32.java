package io.zipstream.checksum;

import java.nio.ByteBuffer;
import java.util.zip.Checksum;

/**
 * Streaming CRC-32 over the reflected polynomial {@code 0xEDB88320}, the variant used by ZIP.
 * <p>
 * Chunked updates produce the same value as a single update over the concatenated bytes.
 * {@link #getValue()} does not change the running state, so it can be read at any point.
 */
public final class Crc32 implements Checksum {

    private static final int POLYNOMIAL = 0xEDB88320;
    private static final int SEED = 0xFFFFFFFF;

    private static final int[] TABLE = new int[256];

    static {
        for (int n = 0; n < TABLE.length; n++) {
            int c = n;
            for (int k = 0; k < 8; k++) {
                c = (c & 1) != 0 ? POLYNOMIAL ^ (c >>> 1) : c >>> 1;
            }
            TABLE[n] = c;
        }
    }

    private int state = SEED;

    public static long of(byte[] bytes) {
        Crc32 crc = new Crc32();
        crc.update(bytes, 0, bytes.length);
        return crc.getValue();
    }

    @Override
    public void update(int b) {
        state = TABLE[(state ^ b) & 0xFF] ^ (state >>> 8);
    }

    @Override
    public void update(byte[] b, int off, int len) {
        if (off < 0 || len < 0 || off > b.length - len) {
            throw new ArrayIndexOutOfBoundsException();
        }
        int crc = state;
        for (int i = off; i < off + len; i++) {
            crc = TABLE[(crc ^ b[i]) & 0xFF] ^ (crc >>> 8);
        }
        state = crc;
    }

    @Override
    public void update(ByteBuffer buffer) {
        int crc = state;
        while (buffer.hasRemaining()) {
            crc = TABLE[(crc ^ buffer.get()) & 0xFF] ^ (crc >>> 8);
        }
        state = crc;
    }

    @Override
    public long getValue() {
        return Integer.toUnsignedLong(~state);
    }

    @Override
    public void reset() {
        state = SEED;
    }
}
