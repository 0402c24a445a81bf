package io.zipstream.archives;

import io.zipstream.writer.CompressionLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ActiveProfiles("test")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class ArchiveServiceIntegrationTest {

    @MockitoBean
    private Clock clock;

    @Autowired
    private ArchiveService archiveService;

    @Test
    @DisplayName("the wired service stamps entries with the application clock")
    void createZipStream_usesApplicationClock() {
        // --- Arrange ---
        when(clock.instant()).thenReturn(Instant.parse("2000-03-12T05:04:01Z"));
        Flux<ArchiveEntry> entries = Flux.just(
                new ArchiveEntry("report.txt", "quarterly numbers".getBytes(StandardCharsets.UTF_8), CompressionLevel.DEFAULT));

        // --- Act ---
        Mono<byte[]> zipBytes = archiveService.createZipStream(entries)
                .collectList()
                .map(ArchiveServiceTest::aggregateBuffers);

        // --- Assert ---
        StepVerifier.create(zipBytes)
                .assertNext(zip -> {
                    assertThat(ArchiveServiceTest.unzip(zip)).containsEntry("report.txt", "quarterly numbers");
                    assertThat(firstEntry(zip).getMethod()).isEqualTo(ZipEntry.DEFLATED);
                    // DOS time 678176896, little-endian at offset 10 of the local header
                    assertThat(zip[10] & 0xFF | (zip[11] & 0xFF) << 8 | (zip[12] & 0xFF) << 16 | (zip[13] & 0xFF) << 24)
                            .isEqualTo(678176896);
                })
                .verifyComplete();
    }

    private static ZipEntry firstEntry(byte[] zip) {
        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(zip))) {
            return zis.getNextEntry();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
