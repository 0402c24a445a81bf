package io.zipstream.archives;

import io.zipstream.writer.ZipArchiveException;
import io.zipstream.writer.ZipArchiveWriter;
import io.zipstream.writer.compressor.Compressor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Service
public class ArchiveService {

    private final Compressor compressor;
    private final Clock clock;

    public ArchiveService(Compressor compressor, Clock clock) {
        this.compressor = compressor;
        this.clock = clock;
    }

    /**
     * Streams a ZIP archive of the given entries. Every subscription builds its own archive:
     * [Local File Header, Body] per entry as it arrives, then the central directory once the
     * entry stream completes.
     */
    public Flux<ByteBuffer> createZipStream(Flux<ArchiveEntry> entries) {
        return Flux.defer(() -> {
            BufferingArchiveSink sink = new BufferingArchiveSink();
            ZipArchiveWriter writer = new ZipArchiveWriter(sink, compressor, clock);
            AtomicLong entryCount = new AtomicLong();
            log.info("Starting archive stream");

            // concatMap keeps exactly one writer call in flight
            Flux<ByteBuffer> entryStreams = entries
                    .concatMap(entry -> Mono.fromCallable(() -> {
                        writer.addEntry(entry.name(), entry.content(), entry.level());
                        entryCount.incrementAndGet();
                        return sink.drain();
                    }).flatMapIterable(buffers -> buffers));

            // Subscribed to only after every entry has been written.
            Mono<ByteBuffer> centralDirectory = Mono.fromCallable(() -> {
                writer.finish();
                ByteBuffer tail = concat(sink.drain());
                log.info("Archive stream complete: {} entries, {} bytes", entryCount.get(), writer.getBytesWritten());
                return tail;
            });

            return entryStreams.concatWith(centralDirectory)
                    .doOnError(e -> log.warn("Archive stream failed after {} entries: {}", entryCount.get(), e.getMessage()))
                    .doFinally(signal -> release(writer));
        });
    }

    // An abandoned stream (error or cancel) leaves the writer idle; close it so the cleaner has nothing to do.
    private void release(ZipArchiveWriter writer) {
        try {
            writer.close();
        } catch (ZipArchiveException e) {
            log.debug("Discarded archive could not be closed: {}", e.getMessage());
        }
    }

    private ByteBuffer concat(List<ByteBuffer> buffers) {
        int totalSize = buffers.stream().mapToInt(ByteBuffer::remaining).sum();
        ByteBuffer combinedBuffer = ByteBuffer.allocate(totalSize);
        buffers.forEach(combinedBuffer::put);
        combinedBuffer.flip();
        return combinedBuffer;
    }
}
