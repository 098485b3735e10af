package org.carball.tuner.model.recommendation;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one missing-index statement. Only {@code CREATED} and {@code FAILED} occur when executing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndexAction(String command, Status status, String error) {

    public enum Status {
        SUGGESTED,
        CREATED,
        FAILED
    }

    public static IndexAction suggested(String command) {
        return new IndexAction(command, Status.SUGGESTED, null);
    }

    public static IndexAction created(String command) {
        return new IndexAction(command, Status.CREATED, null);
    }

    public static IndexAction failed(String command, String error) {
        return new IndexAction(command, Status.FAILED, error);
    }
}
