package com.adlanda.ragassistant.model;

import com.adlanda.ragassistant.exception.UnsupportedFormatException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Document formats accepted for ingestion, keyed by file extension.
 */
public enum DocumentFormat {

    PDF("pdf"),
    DOCX("docx"),
    DOC("doc");

    private final String extension;

    DocumentFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Resolves the format from a file name's extension (case-insensitive).
     *
     * @throws UnsupportedFormatException if the extension is missing or not supported
     */
    public static DocumentFormat fromFileName(String fileName) {
        if (fileName == null) {
            throw new UnsupportedFormatException("File name is required to determine the document type");
        }
        int dot = fileName.lastIndexOf('.');
        return fromExtension(dot >= 0 ? fileName.substring(dot + 1) : "");
    }

    /**
     * Resolves the format from a bare extension such as {@code "pdf"}.
     *
     * @throws UnsupportedFormatException if the extension is not supported
     */
    public static DocumentFormat fromExtension(String extension) {
        String ext = extension != null ? extension.toLowerCase(Locale.ROOT) : "";

        return Arrays.stream(values())
                .filter(format -> format.extension.equals(ext))
                .findFirst()
                .orElseThrow(() -> new UnsupportedFormatException(
                        "Unsupported document type: ." + ext + ". Only PDF, DOCX, and DOC are supported."));
    }
}
