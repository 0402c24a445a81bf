package io.zipstream.archives;

import io.zipstream.shared.config.ArchiveProperties;
import io.zipstream.writer.CompressionLevel;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * REST Controller that zips uploaded files into a streamed archive download.
 */
@RestController
@RequestMapping("/api/archives")
public class ArchivesController {

    private final ArchiveService archiveService;
    private final ArchiveProperties archiveProperties;

    public ArchivesController(ArchiveService archiveService, ArchiveProperties archiveProperties) {
        this.archiveService = archiveService;
        this.archiveProperties = archiveProperties;
    }

    /**
     * Packs every uploaded {@code files} part into one ZIP, in upload order.
     *
     * @param files   the multipart file parts
     * @param level   compression level for all entries, defaults to {@code archive.default-level}
     * @param zipName name offered to the client, defaults to {@code archive.default-name}
     * @return the archive as a byte stream
     */
    @PostMapping(value = "/download-zip", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<Flux<ByteBuffer>>> downloadFilesAsZip(
            @RequestPart("files") Flux<FilePart> files,
            @RequestParam(required = false) CompressionLevel level,
            @RequestParam(required = false) String zipName) {

        CompressionLevel entryLevel = Objects.requireNonNullElse(level, archiveProperties.getDefaultLevel());
        String fileName = Objects.requireNonNullElse(zipName, archiveProperties.getDefaultName());

        // Every upload is read and size-checked before the first archive byte goes out.
        Flux<ArchiveEntry> entries = files.concatMap(filePart -> toEntry(filePart, entryLevel))
                .collectList()
                .flatMapMany(Flux::fromIterable);
        Flux<ByteBuffer> zipStream = archiveService.createZipStream(entries);

        return Mono.just(ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .body(zipStream));
    }

    private Mono<ArchiveEntry> toEntry(FilePart filePart, CompressionLevel level) {
        long maxEntrySize = archiveProperties.getMaxEntrySize();
        return DataBufferUtils.join(filePart.content(), (int) Math.min(Integer.MAX_VALUE, maxEntrySize))
                .onErrorMap(DataBufferLimitException.class, e -> new EntryTooLargeException(filePart.filename(), maxEntrySize))
                .map(dataBuffer -> new ArchiveEntry(filePart.filename(), readAndRelease(dataBuffer), level))
                .defaultIfEmpty(new ArchiveEntry(filePart.filename(), new byte[0], level));
    }

    private static byte[] readAndRelease(DataBuffer dataBuffer) {
        try {
            byte[] bytes = new byte[dataBuffer.readableByteCount()];
            dataBuffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(dataBuffer);
        }
    }
}
