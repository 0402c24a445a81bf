package io.zipstream.writer.compressor;

/**
 * Produces a raw DEFLATE stream (no zlib header or trailer) for an entry body.
 */
@FunctionalInterface
public interface Compressor {

    /**
     * @param data          the uncompressed payload
     * @param deflaterLevel a {@link java.util.zip.Deflater} level, {@code -1} meaning the default
     */
    byte[] compress(byte[] data, int deflaterLevel);
}
