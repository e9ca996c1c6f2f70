package com.certextract.infrastructure.ai;

import com.certextract.domain.extraction.model.AdapterInput;
import com.certextract.infrastructure.extraction.format.PdfPageRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Prepares the images a vision model sees: uploaded images as-is, PDFs rendered page by page.
 * Each modality carries its own empirical confidence ceiling.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VisionPages {

    static final double IMAGE_CONFIDENCE_CEILING = 0.85;
    static final double RENDERED_PDF_CONFIDENCE_CEILING = 0.80;

    public record PageImage(String mimeType, String base64) {
        public String dataUrl() {
            return "data:" + mimeType + ";base64," + base64;
        }
    }

    public record Prepared(List<PageImage> images, double confidenceCeiling) {}

    private final PdfPageRenderer pageRenderer;

    @Value("${extraction.vision.max-pages:3}")
    private int maxPages;

    @Value("${extraction.vision.render-dpi:120}")
    private float renderDpi;

    public Prepared prepare(AdapterInput input) {
        if (input.content() == null || input.content().length == 0 || input.analysis() == null) {
            return new Prepared(List.of(), 0.0);
        }
        if (input.isImage()) {
            String mime = input.mimeType() != null && input.mimeType().startsWith("image/") ? input.mimeType() : "image/png";
            return new Prepared(List.of(new PageImage(mime, encode(input.content()))), IMAGE_CONFIDENCE_CEILING);
        }
        if (input.analysis().format().isPdf()) {
            try {
                List<PageImage> pages = new ArrayList<>();
                for (BufferedImage page : pageRenderer.render(input.content(), maxPages, renderDpi)) {
                    pages.add(new PageImage("image/png", encode(PdfPageRenderer.toPng(page))));
                }
                return new Prepared(pages, RENDERED_PDF_CONFIDENCE_CEILING);
            } catch (IOException e) {
                log.warn("[Vision] Could not render PDF pages for {}: {}", input.filename(), e.getMessage());
                return new Prepared(List.of(), 0.0);
            }
        }
        return new Prepared(List.of(), 0.0);
    }

    private static String encode(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }
}
