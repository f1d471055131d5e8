package com.tony.baseballStats.exception;

/**
 * La ligne qu'on vient d'insérer (ou qui existait déjà) est introuvable :
 * la base est incohérente, l'unité entière doit être annulée.
 */
public class IntegrityException extends RuntimeException {

    public IntegrityException(String table, Long externalId) {
        super("Aucune ligne dans " + table + " pour l'id API " + externalId + " après insertion");
    }
}
