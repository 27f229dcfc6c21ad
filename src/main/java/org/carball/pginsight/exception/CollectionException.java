package org.carball.pginsight.exception;

import lombok.Getter;

/**
 * Collection could not proceed at all, e.g. the primary connection was refused.
 */
@Getter
public class CollectionException extends RuntimeException {

    private final String operation;

    public CollectionException(String operation, Throwable cause) {
        super(String.format("collection error in %s: %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }
}
