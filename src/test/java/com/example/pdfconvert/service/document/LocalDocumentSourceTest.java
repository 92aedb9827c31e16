package com.example.pdfconvert.service.document;

import com.example.pdfconvert.dto.DocumentSummary;
import com.example.pdfconvert.exception.DocumentNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalDocumentSourceTest {

    @TempDir
    Path tempDir;

    private Path storageDir;
    private LocalDocumentSource source;

    @BeforeEach
    void setUp() {
        storageDir = tempDir.resolve("documents");
        source = new LocalDocumentSource(storageDir.toString());
        source.init();
    }

    private void write(String name, String content, Instant modified) throws IOException {
        Path file = storageDir.resolve(name);
        Files.writeString(file, content);
        Files.setLastModifiedTime(file, FileTime.from(modified));
    }

    @Test
    void initCreatesStorageDirectory() {
        assertThat(Files.isDirectory(storageDir)).isTrue();
    }

    @Test
    void fetchReturnsStoredBytes() throws IOException {
        write("report.pdf", "%PDF-1.7 body", Instant.now());

        assertThat(source.fetch("report.pdf")).isEqualTo("%PDF-1.7 body".getBytes());
    }

    @Test
    void fetchRejectsUnknownAndEscapingIds() throws IOException {
        Files.writeString(tempDir.resolve("outside.pdf"), "secret");

        assertThatThrownBy(() -> source.fetch("missing.pdf"))
                .isInstanceOf(DocumentNotFoundException.class)
                .satisfies(e -> assertThat(((DocumentNotFoundException) e).getDocumentId()).isEqualTo("missing.pdf"));
        assertThatThrownBy(() -> source.fetch("../outside.pdf")).isInstanceOf(DocumentNotFoundException.class);
        assertThatThrownBy(() -> source.fetch("")).isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    void searchMatchesPdfNamesNewestFirst() throws IOException {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        write("Quarterly-Report.pdf", "a", now.minusSeconds(60));
        write("annual-report.pdf", "bb", now);
        write("report-notes.txt", "c", now);
        write("invoice.pdf", "d", now);

        List<DocumentSummary> results = source.search("REPORT", 10);

        assertThat(results).extracting(DocumentSummary::getName)
                .containsExactly("annual-report.pdf", "Quarterly-Report.pdf");
        assertThat(results.get(0).getSize()).isEqualTo(2L);
        assertThat(results.get(0).getMimeType()).isEqualTo("application/pdf");
        assertThat(results.get(0).getId()).isEqualTo("annual-report.pdf");
    }

    @Test
    void searchHonoursLimit() throws IOException {
        for (int i = 0; i < 15; i++) {
            write("doc-" + i + ".pdf", "x", Instant.now());
        }

        assertThat(source.search("", 3)).hasSize(3);
        assertThat(source.search(null, 0)).hasSize(LocalDocumentSource.DEFAULT_MAX_FILES);
    }

    @Test
    void storeWritesPdfAndRejectsOtherFiles() {
        DocumentSummary stored = source.store("upload.pdf", "%PDF-1.4".getBytes());

        assertThat(stored.getName()).isEqualTo("upload.pdf");
        assertThat(source.fetch("upload.pdf")).isEqualTo("%PDF-1.4".getBytes());
        assertThatThrownBy(() -> source.store("notes.txt", new byte[] {1}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void storeKeepsOnlyTheFileName() {
        source.store("../../evil.pdf", "%PDF".getBytes());

        assertThat(Files.exists(storageDir.resolve("evil.pdf"))).isTrue();
    }
}
