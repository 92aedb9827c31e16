package com.example.pdfconvert.support;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Builds small PDFs in memory for tests.
 */
public final class TestPdfs {

    private TestPdfs() {
    }

    /**
     * A PDF whose page {@code i} is {@code 144 * (i + 1)} points wide and 288 points tall,
     * so each page renders to a distinct width (300, 600, 900 px at 150 DPI).
     */
    public static byte[] withPages(int pageCount) {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (int i = 0; i < pageCount; i++) {
                document.addPage(new PDPage(new PDRectangle(144f * (i + 1), 288f)));
            }
            document.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
