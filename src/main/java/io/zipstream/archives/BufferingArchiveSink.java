package io.zipstream.archives;

import io.zipstream.writer.ArchiveSink;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the buffers a writer produces until the reactive pipeline drains them downstream.
 */
class BufferingArchiveSink implements ArchiveSink {

    private List<ByteBuffer> pending = new ArrayList<>();

    @Override
    public void write(ByteBuffer buffer) {
        pending.add(copyByteBuffer(buffer));
    }

    List<ByteBuffer> drain() {
        List<ByteBuffer> drained = pending;
        pending = new ArrayList<>();
        return drained;
    }

    private ByteBuffer copyByteBuffer(ByteBuffer original) {
        ByteBuffer copy = ByteBuffer.allocate(original.remaining());
        copy.put(original);
        copy.flip();
        return copy;
    }
}
