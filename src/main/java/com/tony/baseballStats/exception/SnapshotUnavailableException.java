package com.tony.baseballStats.exception;

/**
 * L'API source n'a pas pu fournir les données d'un snapshot (erreur HTTP, timeout...).
 */
public class SnapshotUnavailableException extends RuntimeException {

    public SnapshotUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
