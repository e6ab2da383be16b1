package com.example.formulamap.service.text;

import com.example.formulamap.dto.DocumentText;

/**
 * Produces plain document text from raw uploaded bytes.
 */
public interface TextSource {

    String getName();

    boolean supports(String fileName, String contentType);

    /**
     * @throws DocumentReadException when the bytes are not a readable document of this kind
     */
    DocumentText read(byte[] content, String fileName);
}
