package com.certextract.infrastructure.extraction.qr;

import com.certextract.infrastructure.extraction.format.PdfPageRenderer;
import com.google.zxing.BarcodeFormat;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.multi.qrcode.QRCodeMultiReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds QR codes in images and in the first pages of PDFs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QrCodeScanner {

    static final int MAX_PDF_PAGES = 3;
    private static final float RENDER_DPI = 150f;

    private static final Map<DecodeHintType, Object> HINTS = new EnumMap<>(Map.of(
            DecodeHintType.TRY_HARDER, Boolean.TRUE,
            DecodeHintType.POSSIBLE_FORMATS, List.of(BarcodeFormat.QR_CODE)
    ));

    private final PdfPageRenderer pageRenderer;

    public List<String> scanImage(byte[] content) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(content));
            if (image == null) {
                log.debug("[QR] Image format not decodable by ImageIO");
                return List.of();
            }
            return decode(image);
        } catch (IOException e) {
            log.warn("[QR] Image scan failed: {}", e.getMessage());
            return List.of();
        }
    }

    public List<String> scanPdf(byte[] content) {
        try {
            Set<String> found = new LinkedHashSet<>();
            for (BufferedImage page : pageRenderer.render(content, MAX_PDF_PAGES, RENDER_DPI)) {
                found.addAll(decode(page));
            }
            return new ArrayList<>(found);
        } catch (IOException e) {
            log.warn("[QR] PDF scan failed: {}", e.getMessage());
            return List.of();
        }
    }

    List<String> decode(BufferedImage image) {
        BinaryBitmap bitmap = new BinaryBitmap(new HybridBinarizer(new BufferedImageLuminanceSource(image)));
        try {
            Result[] results = new QRCodeMultiReader().decodeMultiple(bitmap, HINTS);
            List<String> payloads = new ArrayList<>();
            for (Result result : results) {
                if (result.getText() != null && !result.getText().isBlank()) {
                    payloads.add(result.getText().trim());
                }
            }
            return payloads;
        } catch (NotFoundException e) {
            return List.of();
        }
    }
}
