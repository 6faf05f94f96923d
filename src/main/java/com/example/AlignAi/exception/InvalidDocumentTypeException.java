package com.example.AlignAi.exception;

import com.example.AlignAi.model.DocumentType;

public class InvalidDocumentTypeException extends RuntimeException {

    public InvalidDocumentTypeException(String documentId, DocumentType expected, DocumentType actual) {
        super("Document " + documentId + " is a " + actual.label() + ", expected a " + expected.label());
    }
}
