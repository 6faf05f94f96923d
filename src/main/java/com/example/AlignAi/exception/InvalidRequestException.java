package com.example.AlignAi.exception;

/**
 * Request rejected before any processing: empty or oversized text, bad paging, unreadable upload.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
