package com.certextract.infrastructure.extraction.format;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rasterizes leading PDF pages for QR scanning and vision models.
 */
@Slf4j
@Component
public class PdfPageRenderer {

    public List<BufferedImage> render(byte[] pdf, int maxPages, float dpi) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            PDFRenderer renderer = new PDFRenderer(document);
            int pages = Math.min(maxPages, document.getNumberOfPages());
            List<BufferedImage> images = new ArrayList<>(pages);
            for (int page = 0; page < pages; page++) {
                images.add(renderer.renderImageWithDPI(page, dpi, ImageType.RGB));
            }
            return images;
        }
    }

    /**
     * Producer or creator recorded in the PDF's document information, if any.
     */
    public Optional<String> generatingSoftware(byte[] pdf) {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            PDDocumentInformation info = document.getDocumentInformation();
            if (info == null) return Optional.empty();
            String producer = info.getProducer();
            String creator = info.getCreator();
            if (creator != null && !creator.isBlank()) return Optional.of(creator.trim());
            if (producer != null && !producer.isBlank()) return Optional.of(producer.trim());
            return Optional.empty();
        } catch (IOException e) {
            log.debug("[Format] No readable PDF metadata: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public static byte[] toPng(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("PNG encoding failed", e);
        }
    }
}
