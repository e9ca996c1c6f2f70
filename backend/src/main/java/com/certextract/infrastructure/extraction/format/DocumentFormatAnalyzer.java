package com.certextract.infrastructure.extraction.format;

import com.certextract.domain.extraction.model.DocumentClassification;
import com.certextract.domain.extraction.model.DocumentFormat;
import com.certextract.domain.extraction.model.FormatAnalysis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Local, network-free classification of an incoming document. Corrupt input never throws;
 * it comes back as {@link DocumentClassification#UNREADABLE} with zero text quality.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentFormatAnalyzer {

    private static final Map<String, DocumentFormat> MIME_TO_FORMAT = Map.ofEntries(
            Map.entry("application/pdf", DocumentFormat.PDF_NATIVE),
            Map.entry("application/vnd.openxmlformats-officedocument.wordprocessingml.document", DocumentFormat.DOCX),
            Map.entry("application/msword", DocumentFormat.DOCX),
            Map.entry("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", DocumentFormat.XLSX),
            Map.entry("application/vnd.ms-excel", DocumentFormat.XLSX),
            Map.entry("text/csv", DocumentFormat.CSV),
            Map.entry("text/html", DocumentFormat.HTML),
            Map.entry("text/plain", DocumentFormat.TXT),
            Map.entry("message/rfc822", DocumentFormat.EMAIL),
            Map.entry("application/vnd.ms-outlook", DocumentFormat.EMAIL),
            Map.entry("image/jpeg", DocumentFormat.IMAGE),
            Map.entry("image/png", DocumentFormat.IMAGE),
            Map.entry("image/tiff", DocumentFormat.IMAGE),
            Map.entry("image/heic", DocumentFormat.IMAGE),
            Map.entry("image/webp", DocumentFormat.IMAGE)
    );

    private static final Map<String, DocumentFormat> EXTENSION_TO_FORMAT = Map.ofEntries(
            Map.entry("pdf", DocumentFormat.PDF_NATIVE),
            Map.entry("docx", DocumentFormat.DOCX),
            Map.entry("doc", DocumentFormat.DOCX),
            Map.entry("xlsx", DocumentFormat.XLSX),
            Map.entry("xls", DocumentFormat.XLSX),
            Map.entry("csv", DocumentFormat.CSV),
            Map.entry("html", DocumentFormat.HTML),
            Map.entry("htm", DocumentFormat.HTML),
            Map.entry("txt", DocumentFormat.TXT),
            Map.entry("eml", DocumentFormat.EMAIL),
            Map.entry("msg", DocumentFormat.EMAIL),
            Map.entry("jpg", DocumentFormat.IMAGE),
            Map.entry("jpeg", DocumentFormat.IMAGE),
            Map.entry("png", DocumentFormat.IMAGE),
            Map.entry("tiff", DocumentFormat.IMAGE),
            Map.entry("tif", DocumentFormat.IMAGE),
            Map.entry("heic", DocumentFormat.IMAGE),
            Map.entry("webp", DocumentFormat.IMAGE)
    );

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final CertificateTypeDetector typeDetector;

    public FormatAnalysis analyse(byte[] content, String mimeType, String filename) {
        DocumentFormat format = detectFormat(mimeType, filename);

        if (content == null || content.length == 0) {
            log.warn("[Format] Empty document: {}", filename);
            return unreadable(format, filename);
        }

        return switch (format) {
            case PDF_NATIVE, PDF_SCANNED, PDF_HYBRID -> analysePdf(content, filename);
            case IMAGE -> new FormatAnalysis(DocumentFormat.IMAGE, DocumentClassification.STRUCTURED_CERTIFICATE,
                    1, false, true, false, 0.0, null, typeDetector.detectFromFilename(filename));
            case TXT, CSV, HTML -> analysePlainText(format, content, filename);
            case DOCX, XLSX, EMAIL -> new FormatAnalysis(format,
                    format == DocumentFormat.XLSX ? DocumentClassification.SPREADSHEET : DocumentClassification.UNKNOWN,
                    1, true, false, false, 0.5, null, typeDetector.detectFromFilename(filename));
        };
    }

    DocumentFormat detectFormat(String mimeType, String filename) {
        DocumentFormat fromMime = mimeType == null ? null : MIME_TO_FORMAT.get(mimeType.toLowerCase(Locale.ROOT));
        if (fromMime != null && fromMime != DocumentFormat.PDF_NATIVE) {
            return fromMime;
        }
        if (filename != null && filename.contains(".")) {
            String extension = filename.substring(filename.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
            DocumentFormat fromExtension = EXTENSION_TO_FORMAT.get(extension);
            if (fromExtension != null) {
                return fromExtension;
            }
        }
        return DocumentFormat.PDF_NATIVE;
    }

    private FormatAnalysis analysePdf(byte[] content, String filename) {
        try (PDDocument document = Loader.loadPDF(content)) {
            int pageCount = Math.max(1, document.getNumberOfPages());
            String text = new PDFTextStripper().getText(document);
            String trimmed = text == null ? "" : text.trim();

            double avgCharsPerPage = (double) trimmed.length() / pageCount;
            long meaningfulWords = Arrays.stream(WHITESPACE.split(trimmed))
                    .filter(w -> w.length() > 2)
                    .count();
            double textQuality = Math.min(1.0,
                    (avgCharsPerPage / 500.0) * (meaningfulWords / (pageCount * 50.0)));

            boolean isScanned = avgCharsPerPage < 50 || textQuality < 0.1;
            boolean hasTextLayer = trimmed.length() > 100;
            boolean isHybrid = avgCharsPerPage >= 50 && avgCharsPerPage <= 100;

            DocumentFormat format = isScanned
                    ? DocumentFormat.PDF_SCANNED
                    : isHybrid ? DocumentFormat.PDF_HYBRID : DocumentFormat.PDF_NATIVE;

            String detectedType = typeDetector.detect(trimmed);
            if (detectedType == null) {
                detectedType = typeDetector.detectFromFilename(filename);
            }

            log.info("[Format] PDF analysed - pages: {}, avgChars: {}, quality: {}, format: {}, type: {}",
                    pageCount, Math.round(avgCharsPerPage), String.format(Locale.ROOT, "%.2f", textQuality), format, detectedType);

            return new FormatAnalysis(format, typeDetector.classify(trimmed, detectedType), pageCount,
                    hasTextLayer, isScanned, isHybrid, textQuality,
                    trimmed.isEmpty() ? null : trimmed, detectedType);
        } catch (IOException | RuntimeException e) {
            log.warn("[Format] Unreadable PDF {}: {}", filename, e.getMessage());
            return unreadable(DocumentFormat.PDF_SCANNED, filename);
        }
    }

    private FormatAnalysis analysePlainText(DocumentFormat format, byte[] content, String filename) {
        String text = new String(content, StandardCharsets.UTF_8);
        if (format == DocumentFormat.HTML) {
            text = HTML_TAG.matcher(text).replaceAll(" ");
        }
        text = text.trim();
        String detectedType = typeDetector.detect(text);
        if (detectedType == null) {
            detectedType = typeDetector.detectFromFilename(filename);
        }
        DocumentClassification classification = format == DocumentFormat.CSV
                ? DocumentClassification.SPREADSHEET
                : typeDetector.classify(text, detectedType);
        return new FormatAnalysis(format, classification, 1, !text.isEmpty(), false, false,
                text.isEmpty() ? 0.0 : 1.0, text.isEmpty() ? null : text, detectedType);
    }

    private FormatAnalysis unreadable(DocumentFormat format, String filename) {
        return new FormatAnalysis(format, DocumentClassification.UNREADABLE, 0, false, true, false,
                0.0, null, typeDetector.detectFromFilename(filename));
    }
}
