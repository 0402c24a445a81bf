package io.zipstream.shared.config;

import io.zipstream.writer.CompressionLevel;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ArchiveProperties {
    @Builder.Default
    private CompressionLevel defaultLevel = CompressionLevel.DEFAULT;
    @Builder.Default
    private String defaultName = "archive.zip";
    private long maxEntrySize;
}
