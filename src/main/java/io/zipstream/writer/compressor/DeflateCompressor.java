package io.zipstream.writer.compressor;

import java.io.ByteArrayOutputStream;
import java.util.zip.Deflater;

public class DeflateCompressor implements Compressor {

    private static final int CHUNK_SIZE = 8192;

    @Override
    public byte[] compress(byte[] data, int deflaterLevel) {
        final Deflater deflater = new Deflater(deflaterLevel, true);
        try {
            deflater.setInput(data);
            deflater.finish();

            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
            byte[] chunk = new byte[CHUNK_SIZE];
            while (!deflater.finished()) {
                int bytesCompressed = deflater.deflate(chunk);
                out.write(chunk, 0, bytesCompressed);
            }
            return out.toByteArray();
        } finally {
            deflater.end(); // Clean up native resources
        }
    }
}
