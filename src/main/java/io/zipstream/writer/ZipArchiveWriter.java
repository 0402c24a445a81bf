package io.zipstream.writer;

import io.zipstream.checksum.Crc32;
import io.zipstream.time.CalendarDateTime;
import io.zipstream.writer.compressor.Compressor;
import io.zipstream.writer.compressor.DeflateCompressor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.ref.Cleaner;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import static io.zipstream.writer.ZipConstants.MAX_ENTRIES;
import static io.zipstream.writer.ZipConstants.MAX_NAME_LENGTH;
import static io.zipstream.writer.ZipConstants.MAX_SIZE_OR_OFFSET;

/**
 * Writes a ZIP archive entry by entry straight into an {@link ArchiveSink}.
 * <p>
 * Each {@link #addEntry} call emits the entry's local header and body immediately; only the
 * metadata needed for the central directory is retained. {@link #finish()} writes the central
 * directory and the end record. Use the writer in a try-with-resources block so the archive is
 * finished on every exit path:
 *
 * <pre>{@code
 * try (ZipArchiveWriter zip = new ZipArchiveWriter(ArchiveSinks.of(out))) {
 *     zip.addEntry("a.txt", bytes, CompressionLevel.DEFAULT)
 *        .addEntry("b.bin", other, CompressionLevel.STORED);
 * }
 * }</pre>
 * <p>
 * A writer that is dropped without being closed is finished by a cleaner as a last resort. Unlike
 * every other failure, a failure there does not abort: the cleaner thread has no caller to report
 * to, so the error is logged as fatal and the truncated output is left in the sink. Instances are
 * not thread-safe; overlapping calls (for example from inside the sink) are rejected with
 * {@link ZipArchiveException.Kind#INVALID_STATE}.
 */
@Slf4j
public class ZipArchiveWriter implements AutoCloseable {

    enum Status {
        IDLE,
        BUSY,
        CLOSED
    }

    private static final Cleaner CLEANER = Cleaner.create();

    private final Archive archive;
    private final Compressor compressor;
    private final Clock clock;
    private final Cleaner.Cleanable cleanable;

    public ZipArchiveWriter(ArchiveSink sink) {
        this(sink, new DeflateCompressor(), Clock.systemUTC());
    }

    public ZipArchiveWriter(ArchiveSink sink, Compressor compressor, Clock clock) {
        this.archive = new Archive(Objects.requireNonNull(sink, "sink"));
        this.compressor = Objects.requireNonNull(compressor, "compressor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cleanable = CLEANER.register(this, archive);
    }

    /**
     * Adds an entry stamped with the current time of this writer's clock. The name is encoded as
     * UTF-8.
     */
    public ZipArchiveWriter addEntry(String name, byte[] payload, CompressionLevel level) throws ZipArchiveException {
        return addEntry(name.getBytes(StandardCharsets.UTF_8), payload, level, clock.instant());
    }

    public ZipArchiveWriter addEntry(String name, byte[] payload, CompressionLevel level, Instant lastModified) throws ZipArchiveException {
        return addEntry(name.getBytes(StandardCharsets.UTF_8), payload, level, lastModified);
    }

    /**
     * Compresses the payload as requested, then writes the local file header and the body.
     *
     * @param name         entry name exactly as stored; may be empty. The array is copied
     * @param payload      uncompressed entry content
     * @param level        {@link CompressionLevel#STORED} or a deflate level
     * @param lastModified modification time; before 1980 it is stored as zero
     * @return this writer
     * @throws ZipArchiveException {@code INVALID_STATE} if the writer is busy or closed,
     *                             {@code SIZE_LIMIT_EXCEEDED} if the entry does not fit the format
     *                             (nothing is written), {@code IO_ERROR} if the sink fails
     */
    public ZipArchiveWriter addEntry(byte[] name, byte[] payload, CompressionLevel level, Instant lastModified) throws ZipArchiveException {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(lastModified, "lastModified");

        archive.acquire("add an entry to");
        try {
            byte[] body = level.isCompressed() ? compressor.compress(payload, level.getDeflaterLevel()) : payload;
            ZipEntryInfo entry = new ZipEntryInfo(
                    name.clone(),
                    level.getMethod(),
                    CalendarDateTime.of(lastModified).toDosTimestamp(),
                    Crc32.of(payload),
                    body.length,
                    payload.length,
                    archive.offset);
            archive.append(entry, body);
        } finally {
            archive.release(false);
        }
        return this;
    }

    /**
     * Writes the central directory and the end of central directory record. The writer is closed
     * afterwards; calling this again fails with {@code INVALID_STATE}.
     */
    public void finish() throws ZipArchiveException {
        archive.acquire("finish");
        archive.finish();
    }

    /**
     * Finishes the archive if that has not happened yet. Closing an already finished writer does
     * nothing. The sink is left open.
     */
    @Override
    public void close() throws ZipArchiveException {
        try {
            if (archive.status.get() == Status.IDLE) {
                finish();
            }
        } finally {
            archive.released = true;
            cleanable.clean();
        }
    }

    public int getEntryCount() {
        return archive.entries.size();
    }

    /**
     * @return bytes handed to the sink by completed records so far
     */
    public long getBytesWritten() {
        return archive.offset;
    }

    public boolean isClosed() {
        return archive.status.get() == Status.CLOSED;
    }

    /**
     * Archive state shared with the cleaner; it must never reference the enclosing writer.
     */
    private static final class Archive implements Runnable {
        private final ArchiveSink sink;
        private final List<ZipEntryInfo> entries = new ArrayList<>();
        private final AtomicReference<Status> status = new AtomicReference<>(Status.IDLE);
        private long offset;
        private boolean failed;
        private volatile boolean released;

        private Archive(ArchiveSink sink) {
            this.sink = sink;
        }

        private void acquire(String action) throws ZipArchiveException {
            if (!status.compareAndSet(Status.IDLE, Status.BUSY)) {
                throw ZipArchiveException.invalidState("Cannot " + action + " an archive that is " + status.get());
            }
        }

        // a failed write leaves the archive corrupt, so the writer stays busy for good
        private void release(boolean finished) {
            if (finished) {
                status.set(Status.CLOSED);
            } else if (!failed) {
                status.set(Status.IDLE);
            }
        }

        private void append(ZipEntryInfo entry, byte[] body) throws ZipArchiveException {
            int nameLength = entry.getFileNameBytes().length;
            if (nameLength > MAX_NAME_LENGTH) {
                throw sizeLimit("Entry name is " + nameLength + " bytes, the limit is " + MAX_NAME_LENGTH);
            }
            if (entry.getUncompressedSize() > MAX_SIZE_OR_OFFSET || entry.getCompressedSize() > MAX_SIZE_OR_OFFSET) {
                throw sizeLimit("Entry size " + entry.getUncompressedSize() + " (" + entry.getCompressedSize()
                        + " compressed) does not fit in 32 bits");
            }
            if (entries.size() >= MAX_ENTRIES) {
                throw sizeLimit("Archive already holds " + entries.size() + " entries, the limit is " + MAX_ENTRIES);
            }
            long next = offset + ZipRecords.localFileHeaderSize(nameLength) + body.length;
            if (next > MAX_SIZE_OR_OFFSET) {
                throw sizeLimit("Archive would grow to " + next + " bytes, beyond the 4 GiB offset limit");
            }

            write(ZipRecords.localFileHeader(entry));
            write(ByteBuffer.wrap(body));
            offset = next;
            entries.add(entry);
            log.debug("Added entry #{} at offset {}: {} bytes, {} stored, method {}",
                    entries.size(), entry.getLocalHeaderOffset(), entry.getUncompressedSize(),
                    entry.getCompressedSize(), entry.getMethod());
        }

        private void finish() throws ZipArchiveException {
            boolean finished = false;
            try {
                long centralDirectoryOffset = offset;
                long centralDirectorySize = 0;
                for (ZipEntryInfo entry : entries) {
                    centralDirectorySize += ZipRecords.centralDirectoryHeaderSize(entry.getFileNameBytes().length);
                }
                if (centralDirectoryOffset + centralDirectorySize > MAX_SIZE_OR_OFFSET) {
                    throw sizeLimit("Central directory of " + centralDirectorySize + " bytes at offset "
                            + centralDirectoryOffset + " does not fit in 32 bits");
                }

                for (ZipEntryInfo entry : entries) {
                    write(ZipRecords.centralDirectoryHeader(entry));
                    offset += ZipRecords.centralDirectoryHeaderSize(entry.getFileNameBytes().length);
                }
                write(ZipRecords.endOfCentralDirectory(entries.size(), centralDirectorySize, centralDirectoryOffset));
                offset += ZipConstants.EOCD_SIZE;
                finished = true;
                log.debug("Finished archive: {} entries, central directory of {} bytes at offset {}",
                        entries.size(), centralDirectorySize, centralDirectoryOffset);
            } finally {
                release(finished);
            }
        }

        private void write(ByteBuffer buffer) throws ZipArchiveException {
            boolean ok = false;
            try {
                sink.write(buffer);
                ok = true;
            } catch (IOException e) {
                log.warn("Archive sink failed after {} bytes, the archive is incomplete", offset, e);
                throw new ZipArchiveException(ZipArchiveException.Kind.IO_ERROR,
                        "Failed to write archive at offset " + offset, e);
            } finally {
                failed |= !ok;
            }
        }

        private ZipArchiveException sizeLimit(String message) {
            log.warn(message);
            return ZipArchiveException.sizeLimit(message);
        }

        /**
         * Cleaner action: finishes an archive whose writer became unreachable while idle.
         */
        @Override
        public void run() {
            if (released || !status.compareAndSet(Status.IDLE, Status.BUSY)) {
                return;
            }
            log.warn("Archive writer was discarded without being closed, finishing {} entries", entries.size());
            try {
                finish();
            } catch (ZipArchiveException | RuntimeException e) {
                log.error("FATAL: could not finish discarded archive, the output is truncated", e);
            }
        }
    }
}
