package com.example.pdfconvert.service.conversion;

import com.example.pdfconvert.exception.DecodeException;
import com.example.pdfconvert.exception.EncodeException;
import com.example.pdfconvert.model.PageImage;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renders PDF pages to PNG images. Stateless; safe to share between threads.
 */
@Service
public class PdfRasterizer {

    private static final Logger logger = LoggerFactory.getLogger(PdfRasterizer.class);

    /**
     * Renders every page of {@code pdfBytes} at {@code dpi}, in document order.
     * Callers choose the resolution; no default is applied here.
     *
     * @throws IllegalArgumentException if {@code dpi} is not positive
     * @throws DecodeException if the bytes are not a readable PDF
     * @throws EncodeException if any page fails to encode; no partial result is returned
     */
    public List<PageImage> render(byte[] pdfBytes, float dpi) {
        if (!(dpi > 0)) {
            throw new IllegalArgumentException("DPI must be positive: " + dpi);
        }
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new DecodeException("Failed to open PDF: document is empty");
        }

        try (PDDocument document = loadDocument(pdfBytes)) {
            int pageCount = document.getNumberOfPages();
            PDFRenderer renderer = new PDFRenderer(document);
            List<PageImage> images = new ArrayList<>(pageCount);

            for (int pageIndex = 0; pageIndex < pageCount; pageIndex++) {
                BufferedImage image = renderPage(renderer, pageIndex, dpi);
                images.add(new PageImage(pageIndex, image.getWidth(), image.getHeight(), encodePng(image, pageIndex)));
            }

            logger.info("Rendered {} pages at {} DPI", pageCount, dpi);
            return Collections.unmodifiableList(images);
        } catch (IOException e) {
            // only close() can get here
            logger.warn("Error closing PDF document: {}", e.getMessage());
            throw new DecodeException("Failed to close PDF: " + e.getMessage(), e);
        }
    }

    private PDDocument loadDocument(byte[] pdfBytes) {
        try {
            return Loader.loadPDF(pdfBytes);
        } catch (IOException e) {
            logger.warn("Failed to open PDF ({} bytes): {}", pdfBytes.length, e.getMessage());
            throw new DecodeException("Failed to open PDF: " + e.getMessage(), e);
        }
    }

    private BufferedImage renderPage(PDFRenderer renderer, int pageIndex, float dpi) {
        try {
            return renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
        } catch (IOException e) {
            throw new DecodeException("Failed to render page " + (pageIndex + 1) + ": " + e.getMessage(), e);
        }
    }

    private byte[] encodePng(BufferedImage image, int pageIndex) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", out)) {
                throw new EncodeException("No PNG writer available for page " + (pageIndex + 1));
            }
        } catch (IOException e) {
            throw new EncodeException("Failed to encode page " + (pageIndex + 1) + " as PNG: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }
}
