package com.statuswatch.core.status;

import java.util.NoSuchElementException;

/**
 * Thrown when a status projection names a machine, application or unit that the document
 * does not contain.
 */
public class NoSuchEntityException extends NoSuchElementException {

    private final String entity;

    public NoSuchEntityException(String entity) {
        super("No such entity in status: " + entity);
        this.entity = entity;
    }

    public String entity() {
        return entity;
    }
}
