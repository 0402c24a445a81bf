package io.zipstream.archives;

import io.zipstream.shared.config.ArchiveConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.context.annotation.Import;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;
import reactor.core.publisher.Flux;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ActiveProfiles("test")
@WebFluxTest(ArchivesController.class)
@Import(ArchiveConfig.class)
class ArchivesControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockitoBean
    private ArchiveService archiveService;

    private static MultipartBodyBuilder twoFiles() {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("files", new ByteArrayResource("first".getBytes(StandardCharsets.UTF_8)))
                .header(HttpHeaders.CONTENT_DISPOSITION, "form-data; name=files; filename=a.txt");
        builder.part("files", new ByteArrayResource("second".getBytes(StandardCharsets.UTF_8)))
                .header(HttpHeaders.CONTENT_DISPOSITION, "form-data; name=files; filename=b.txt");
        return builder;
    }

    // Echoes "name:level:size;" per entry so the test can see what the controller handed over.
    private void describeEntries() {
        when(archiveService.createZipStream(any())).thenAnswer(invocation -> {
            Flux<ArchiveEntry> entries = invocation.getArgument(0);
            return entries.map(entry -> ByteBuffer.wrap(
                    (entry.name() + ":" + entry.level() + ":" + entry.content().length + ";").getBytes(StandardCharsets.UTF_8)));
        });
    }

    @Test
    @DisplayName("POST /download-zip should hand the uploads to the service and stream its bytes back")
    void downloadFilesAsZip_success() {
        // --- Arrange ---
        String fakeZipContent = "this-is-fake-zip-data";
        byte[] fakeBytes = fakeZipContent.getBytes(StandardCharsets.UTF_8);
        when(archiveService.createZipStream(any())).thenReturn(Flux.just(ByteBuffer.wrap(fakeBytes)));
        String customZipName = "my-archive.zip";

        // --- Act & Assert ---
        webTestClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/archives/download-zip")
                        .queryParam("zipName", customZipName)
                        .build())
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(twoFiles().build()))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentType(MediaType.APPLICATION_OCTET_STREAM)
                .expectHeader().valueEquals(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + customZipName + "\"")
                .expectBody(byte[].class).isEqualTo(fakeBytes);
    }

    @Test
    @DisplayName("configured defaults apply when no level or name is requested")
    void downloadFilesAsZip_usesConfiguredDefaults() {
        describeEntries();

        webTestClient.post().uri("/api/archives/download-zip")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(twoFiles().build()))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"test-archive.zip\"")
                .expectBody(String.class).isEqualTo("a.txt:STORED:5;b.txt:STORED:6;");
    }

    @Test
    @DisplayName("the level parameter applies to every entry")
    void downloadFilesAsZip_withLevel() {
        describeEntries();

        webTestClient.post().uri("/api/archives/download-zip?level=BEST")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(twoFiles().build()))
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("a.txt:BEST:5;b.txt:BEST:6;");
    }

    @Test
    @DisplayName("an unknown level is a bad request")
    void downloadFilesAsZip_unknownLevel() {
        webTestClient.post().uri("/api/archives/download-zip?level=ULTRA")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(twoFiles().build()))
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(archiveService);
    }

    @Test
    @DisplayName("an upload above archive.max-entry-size is rejected with 413")
    void downloadFilesAsZip_entryTooLarge() {
        describeEntries();
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("files", new ByteArrayResource(new byte[2048]))
                .header(HttpHeaders.CONTENT_DISPOSITION, "form-data; name=files; filename=big.bin");

        webTestClient.post().uri("/api/archives/download-zip")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange()
                .expectStatus().isEqualTo(413);
    }
}
