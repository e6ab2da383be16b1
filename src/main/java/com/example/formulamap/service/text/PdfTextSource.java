package com.example.formulamap.service.text;

import com.example.formulamap.dto.DocumentText;
import org.apache.commons.lang3.StringUtils;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineNode;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads PDF text page by page with PDFBox. Pages are separated by a form feed so the
 * segmenter can track page numbers, and outline (bookmark) titles become section hints.
 */
@Component
public class PdfTextSource implements TextSource {

    private static final Logger logger = LoggerFactory.getLogger(PdfTextSource.class);

    @Value("${formula.pdf.max-pages:500}")
    private int maxPages = 500;

    @Override
    public String getName() {
        return "pdf";
    }

    @Override
    public boolean supports(String fileName, String contentType) {
        if ("application/pdf".equalsIgnoreCase(contentType)) {
            return true;
        }
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    @Override
    public DocumentText read(byte[] content, String fileName) {
        if (content == null || content.length == 0) {
            throw new DocumentReadException("Empty PDF upload: " + fileName);
        }

        try (PDDocument document = Loader.loadPDF(content)) {
            int totalPages = document.getNumberOfPages();
            int pages = Math.min(totalPages, maxPages);
            if (pages < totalPages) {
                logger.warn("{} has {} pages, reading the first {}", fileName, totalPages, pages);
            }

            PDFTextStripper stripper = new PDFTextStripper();
            StringBuilder text = new StringBuilder();
            for (int pageNum = 1; pageNum <= pages; pageNum++) {
                stripper.setStartPage(pageNum);
                stripper.setEndPage(pageNum);
                if (pageNum > 1) {
                    text.append('\f');
                }
                text.append(stripper.getText(document));
            }

            DocumentText result = new DocumentText(text.toString());
            result.setPageCount(totalPages);
            result.setTitle(metadataTitle(document));
            result.setSectionHints(outlineTitles(document));

            logger.info("📄 Read {} pages ({} chars, {} outline entries) from {}",
                pages, text.length(), result.getSectionHints().size(), fileName);
            return result;
        } catch (IOException e) {
            throw new DocumentReadException("Could not read PDF " + fileName + ": " + e.getMessage(), e);
        }
    }

    private static String metadataTitle(PDDocument document) {
        PDDocumentInformation info = document.getDocumentInformation();
        return info != null ? StringUtils.trimToNull(info.getTitle()) : null;
    }

    private static List<String> outlineTitles(PDDocument document) {
        List<String> titles = new ArrayList<>();
        PDDocumentOutline outline = document.getDocumentCatalog().getDocumentOutline();
        if (outline != null) {
            collectTitles(outline, titles);
        }
        return titles;
    }

    private static void collectTitles(PDOutlineNode node, List<String> titles) {
        for (PDOutlineItem item : node.children()) {
            if (StringUtils.isNotBlank(item.getTitle())) {
                titles.add(item.getTitle().trim());
            }
            collectTitles(item, titles);
        }
    }
}
