package com.tony.baseballStats.exception;

public class ReferenceMissingException extends RuntimeException {

    public ReferenceMissingException(String kind, Long externalId) {
        super(kind + " " + externalId + " absent(e) du mapping de l'unité");
    }
}
