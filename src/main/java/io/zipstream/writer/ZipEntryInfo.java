package io.zipstream.writer;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Metadata of one written entry, kept until the central directory is emitted.
 * Sizes, checksum, timestamp and offset are unsigned 32-bit values.
 */
@Getter
@RequiredArgsConstructor
public class ZipEntryInfo {
    private final byte[] fileNameBytes;
    private final int method;
    private final int dosTime;
    private final long crc;
    private final long compressedSize;
    private final long uncompressedSize;
    private final long localHeaderOffset;
}
