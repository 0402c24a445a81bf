package io.zipstream.writer;

import java.io.OutputStream;
import java.nio.channels.WritableByteChannel;

public final class ArchiveSinks {

    private ArchiveSinks() {
    }

    public static ArchiveSink of(OutputStream out) {
        return buffer -> {
            if (buffer.hasArray()) {
                int length = buffer.remaining();
                out.write(buffer.array(), buffer.arrayOffset() + buffer.position(), length);
                buffer.position(buffer.position() + length);
            } else {
                byte[] bytes = new byte[buffer.remaining()];
                buffer.get(bytes);
                out.write(bytes);
            }
        };
    }

    public static ArchiveSink of(WritableByteChannel channel) {
        return buffer -> {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        };
    }
}
