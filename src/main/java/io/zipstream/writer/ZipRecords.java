package io.zipstream.writer;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static io.zipstream.writer.ZipConstants.*;

/**
 * Byte layout of the three records this writer emits. All integers are little-endian.
 */
final class ZipRecords {

    private ZipRecords() {
    }

    static ByteBuffer localFileHeader(ZipEntryInfo entry) {
        byte[] name = entry.getFileNameBytes();
        ByteBuffer buffer = allocate(LFH_SIZE + name.length);
        buffer.putInt(LFH_SIG);
        buffer.putShort((short) VERSION);
        putEntryFields(buffer, entry);
        buffer.putShort((short) 0); // extra field length
        buffer.put(name);
        buffer.flip();
        return buffer;
    }

    static ByteBuffer centralDirectoryHeader(ZipEntryInfo entry) {
        byte[] name = entry.getFileNameBytes();
        ByteBuffer buffer = allocate(CFH_SIZE + name.length);
        buffer.putInt(CFH_SIG);
        buffer.putShort((short) VERSION); // made by
        buffer.putShort((short) VERSION); // needed to extract
        putEntryFields(buffer, entry);
        buffer.putShort((short) 0); // extra field length
        buffer.putShort((short) 0); // comment length
        buffer.putShort((short) 0); // disk number start
        buffer.putShort((short) 0); // internal attributes
        buffer.putInt(0); // external attributes
        buffer.putInt((int) entry.getLocalHeaderOffset());
        buffer.put(name);
        buffer.flip();
        return buffer;
    }

    static ByteBuffer endOfCentralDirectory(int entryCount, long centralDirectorySize, long centralDirectoryOffset) {
        ByteBuffer buffer = allocate(EOCD_SIZE);
        buffer.putInt(EOCD_SIG);
        buffer.putShort((short) 0); // this disk
        buffer.putShort((short) 0); // disk with the central directory
        buffer.putShort((short) entryCount); // entries on this disk
        buffer.putShort((short) entryCount); // total entries
        buffer.putInt((int) centralDirectorySize);
        buffer.putInt((int) centralDirectoryOffset);
        buffer.putShort((short) 0); // comment length
        buffer.flip();
        return buffer;
    }

    static long localFileHeaderSize(int nameLength) {
        return LFH_SIZE + (long) nameLength;
    }

    static long centralDirectoryHeaderSize(int nameLength) {
        return CFH_SIZE + (long) nameLength;
    }

    // flag, method, time, crc, sizes and name length; shared by local and central headers
    private static void putEntryFields(ByteBuffer buffer, ZipEntryInfo entry) {
        buffer.putShort((short) UTF8_NAMES_FLAG);
        buffer.putShort((short) entry.getMethod());
        buffer.putInt(entry.getDosTime());
        buffer.putInt((int) entry.getCrc());
        buffer.putInt((int) entry.getCompressedSize());
        buffer.putInt((int) entry.getUncompressedSize());
        buffer.putShort((short) entry.getFileNameBytes().length);
    }

    private static ByteBuffer allocate(long size) {
        return ByteBuffer.allocate((int) size).order(ByteOrder.LITTLE_ENDIAN);
    }
}
