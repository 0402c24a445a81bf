package io.zipstream.shared.config;

import io.zipstream.writer.CompressionLevel;
import io.zipstream.writer.compressor.Compressor;
import io.zipstream.writer.compressor.DeflateCompressor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.time.Clock;

@Configuration
public class ArchiveConfig {

    @Bean
    ArchiveProperties archiveProperties(@Value("${archive.default-level:DEFAULT}") CompressionLevel defaultLevel,
                                        @Value("${archive.default-name:archive.zip}") String defaultName,
                                        @Value("${archive.max-entry-size:64MB}") DataSize maxEntrySize) {
        return ArchiveProperties.builder()
                .defaultLevel(defaultLevel)
                .defaultName(defaultName)
                .maxEntrySize(maxEntrySize.toBytes())
                .build();
    }

    @Bean
    public Compressor compressor() {
        return new DeflateCompressor();
    }

    // ZIP timestamps carry no zone, entries are stamped in UTC
    @Bean
    public Clock archiveClock() {
        return Clock.systemUTC();
    }
}
