package io.zipstream.writer;

/**
 * Record signatures, fixed sizes and field limits of the (non-Zip64) ZIP format.
 */
final class ZipConstants {

    static final int LFH_SIG = 0x04034b50;
    static final int CFH_SIG = 0x02014b50;
    static final int EOCD_SIG = 0x06054b50;

    static final int LFH_SIZE = 30;
    static final int CFH_SIZE = 46;
    static final int EOCD_SIZE = 22;

    static final int VERSION = 20;
    static final int UTF8_NAMES_FLAG = 1 << 11;

    static final int METHOD_STORED = 0;
    static final int METHOD_DEFLATED = 8;

    static final int MAX_NAME_LENGTH = 0xFFFF;
    static final int MAX_ENTRIES = 0xFFFF;
    static final long MAX_SIZE_OR_OFFSET = 0xFFFFFFFFL;

    private ZipConstants() {
    }
}
