package com.example.AlignAi.exception;

import org.apache.commons.lang3.StringUtils;

public class DocumentNotFoundException extends RuntimeException {

    public DocumentNotFoundException(String label, String documentId) {
        super(StringUtils.defaultIfEmpty(StringUtils.capitalize(label), "Document") + " not found: " + documentId);
    }
}
