package org.carball.pginsight.model.collection;

import org.carball.pginsight.exception.QueryFailedException;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of collecting one data point. Lets callers tell "no data" apart from
 * "not attempted" while every failure still degrades instead of aborting the run.
 */
public final class CollectionResult<T> {

    public enum Status {
        COLLECTED,
        UNAVAILABLE,
        FAILED,
        SKIPPED
    }

    private final Status status;
    private final T value;
    private final QueryFailedException error;
    private final String reason;

    private CollectionResult(Status status, T value, QueryFailedException error, String reason) {
        this.status = status;
        this.value = value;
        this.error = error;
        this.reason = reason;
    }

    public static <T> CollectionResult<T> collected(T value) {
        return new CollectionResult<>(Status.COLLECTED, value, null, null);
    }

    public static <T> CollectionResult<T> unavailable(String reason) {
        return new CollectionResult<>(Status.UNAVAILABLE, null, null, reason);
    }

    public static <T> CollectionResult<T> failed(QueryFailedException error) {
        return new CollectionResult<>(Status.FAILED, null, error, error.getMessage());
    }

    public static <T> CollectionResult<T> skipped(String reason) {
        return new CollectionResult<>(Status.SKIPPED, null, null, reason);
    }

    public Status status() {
        return status;
    }

    public boolean isCollected() {
        return status == Status.COLLECTED;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public T orElse(T fallback) {
        return isCollected() && value != null ? value : fallback;
    }

    public Optional<QueryFailedException> error() {
        return Optional.ofNullable(error);
    }

    public String reason() {
        return reason;
    }

    public <R> CollectionResult<R> map(Function<T, R> mapper) {
        if (isCollected()) {
            return collected(mapper.apply(value));
        }
        return new CollectionResult<>(status, null, error, reason);
    }

    @Override
    public String toString() {
        return isCollected() ? "COLLECTED(" + value + ")" : status + "(" + reason + ")";
    }
}
