package com.example.formulamap.service.text;

import com.example.formulamap.dto.DocumentText;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

@Component
public class PlainTextSource implements TextSource {

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public boolean supports(String fileName, String contentType) {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("text/")) {
            return true;
        }
        if (fileName == null) {
            return false;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".txt") || lower.endsWith(".tex") || lower.endsWith(".md");
    }

    @Override
    public DocumentText read(byte[] content, String fileName) {
        if (content == null) {
            throw new DocumentReadException("No content in " + fileName);
        }
        // BOM would otherwise end up in the first heading
        String text = new String(content, StandardCharsets.UTF_8).replace("\uFEFF", "").replace("\r\n", "\n");
        return new DocumentText(text);
    }
}
