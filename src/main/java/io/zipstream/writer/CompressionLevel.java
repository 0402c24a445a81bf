package io.zipstream.writer;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.zip.Deflater;

/**
 * How an entry body is encoded. {@link #STORED} writes the payload verbatim (method 0); the other
 * levels deflate it (method 8) with increasing effort.
 */
@Getter
@RequiredArgsConstructor
public enum CompressionLevel {
    STORED(ZipConstants.METHOD_STORED, Deflater.NO_COMPRESSION),
    FAST(ZipConstants.METHOD_DEFLATED, Deflater.BEST_SPEED),
    DEFAULT(ZipConstants.METHOD_DEFLATED, Deflater.DEFAULT_COMPRESSION),
    BEST(ZipConstants.METHOD_DEFLATED, Deflater.BEST_COMPRESSION);

    private final int method;
    private final int deflaterLevel;

    public boolean isCompressed() {
        return this != STORED;
    }
}
