package com.example.formulamap.service.text;

import com.example.formulamap.dto.DocumentText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Picks the text source for an upload by file name and content type.
 */
@Service
public class TextSourceResolver {

    private static final Logger logger = LoggerFactory.getLogger(TextSourceResolver.class);

    @Autowired
    private List<TextSource> sources;

    public DocumentText read(byte[] content, String fileName, String contentType) {
        for (TextSource source : sources) {
            if (source.supports(fileName, contentType)) {
                logger.debug("Reading {} with the {} source", fileName, source.getName());
                return source.read(content, fileName);
            }
        }
        throw new DocumentReadException("Unsupported document type: " + fileName
            + (contentType != null ? " (" + contentType + ")" : ""));
    }
}
