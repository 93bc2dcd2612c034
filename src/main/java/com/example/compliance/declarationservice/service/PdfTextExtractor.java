package com.example.compliance.declarationservice.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts text from declaration files. PDFs are read page by page and a page
 * that cannot be read contributes an empty string; other content is decoded
 * as UTF-8 text.
 */
@Slf4j
@Component
public class PdfTextExtractor {

    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);

    public String extractText(byte[] content) {
        if (content == null || content.length == 0) return "";
        if (!isPdf(content)) {
            return new String(content, StandardCharsets.UTF_8);
        }
        try (PDDocument doc = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            List<String> pages = new ArrayList<>();
            for (int page = 1; page <= doc.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                try {
                    pages.add(stripper.getText(doc));
                } catch (IOException | RuntimeException e) {
                    log.warn("Could not read page {}: {}", page, e.getMessage());
                    pages.add("");
                }
            }
            return String.join("\n", pages);
        } catch (IOException e) {
            log.error("Failed to extract PDF text: {}", e.getMessage());
            return "";
        }
    }

    static boolean isPdf(byte[] content) {
        if (content.length < PDF_MAGIC.length) return false;
        for (int i = 0; i < PDF_MAGIC.length; i++) {
            if (content[i] != PDF_MAGIC[i]) return false;
        }
        return true;
    }
}
