package com.example.pdfconvert.service.document;

import com.example.pdfconvert.dto.DocumentSummary;
import com.example.pdfconvert.exception.DocumentNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Document source backed by a directory of PDF files. A document's id is its file name.
 */
@Service
public class LocalDocumentSource implements DocumentSource {

    private static final Logger logger = LoggerFactory.getLogger(LocalDocumentSource.class);

    static final int DEFAULT_MAX_FILES = 10;
    private static final String PDF_MIME_TYPE = "application/pdf";

    private final Path storageDir;

    public LocalDocumentSource(@Value("${document.storage.dir:documents}") String storageDir) {
        this.storageDir = Paths.get(storageDir).toAbsolutePath().normalize();
    }

    @PostConstruct
    public void init() {
        try {
            if (!Files.exists(storageDir)) {
                Files.createDirectories(storageDir);
            }
            logger.info("Document storage directory: {}", storageDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create document storage directory " + storageDir, e);
        }
    }

    @Override
    public byte[] fetch(String documentId) {
        Path file = resolve(documentId);
        try {
            byte[] content = Files.readAllBytes(file);
            logger.debug("Read document {} ({} bytes)", documentId, content.length);
            return content;
        } catch (NoSuchFileException e) {
            throw new DocumentNotFoundException(documentId, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading document " + documentId, e);
        }
    }

    @Override
    public List<DocumentSummary> search(String query, int maxFiles) {
        int limit = maxFiles > 0 ? maxFiles : DEFAULT_MAX_FILES;
        String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);

        try (Stream<Path> files = Files.list(storageDir)) {
            List<Path> matches = files
                .filter(path -> Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS))
                .filter(path -> isPdf(path.getFileName().toString()))
                .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).contains(needle))
                .collect(Collectors.toList());

            List<DocumentSummary> results = new ArrayList<>();
            for (Path path : matches) {
                results.add(summarize(path));
            }
            results.sort(Comparator.comparing(DocumentSummary::getModifiedTime).reversed()
                .thenComparing(DocumentSummary::getName));
            return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
        } catch (IOException e) {
            throw new UncheckedIOException("Error searching documents in " + storageDir, e);
        }
    }

    /**
     * Saves an uploaded PDF, replacing any document with the same name.
     *
     * @return the stored document's summary
     */
    public DocumentSummary store(String fileName, byte[] content) {
        if (fileName == null || !isPdf(fileName)) {
            throw new IllegalArgumentException("Only PDF files can be stored: " + fileName);
        }
        Path target = storageDir.resolve(Paths.get(fileName).getFileName().toString()).normalize();
        if (!target.getParent().equals(storageDir)) {
            throw new IllegalArgumentException("Invalid file name: " + fileName);
        }
        try {
            Path temp = Files.createTempFile(storageDir, "upload-", ".tmp");
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            logger.info("Stored document {} ({} bytes)", target.getFileName(), content.length);
            return summarize(target);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not store document " + fileName, e);
        }
    }

    private Path resolve(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new DocumentNotFoundException(String.valueOf(documentId));
        }
        Path file = storageDir.resolve(documentId).normalize();
        // ids may not escape the storage directory
        if (!storageDir.equals(file.getParent()) || !Files.isRegularFile(file)) {
            throw new DocumentNotFoundException(documentId);
        }
        return file;
    }

    private DocumentSummary summarize(Path path) throws IOException {
        String name = path.getFileName().toString();
        return new DocumentSummary(name, name, Files.size(path),
                Files.getLastModifiedTime(path).toInstant(), PDF_MIME_TYPE);
    }

    private static boolean isPdf(String fileName) {
        return fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }
}
