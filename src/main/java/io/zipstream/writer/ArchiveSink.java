package io.zipstream.writer;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Destination of archive bytes. Writes arrive strictly in archive order.
 * <p>
 * Implementations consume all remaining bytes of the buffer or throw. The sink is owned by the
 * caller; the writer never closes it.
 */
@FunctionalInterface
public interface ArchiveSink {
    void write(ByteBuffer buffer) throws IOException;
}
