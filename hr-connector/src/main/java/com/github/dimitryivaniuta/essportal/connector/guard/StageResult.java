package com.github.dimitryivaniuta.essportal.connector.guard;

import org.springframework.http.HttpStatus;

/**
 * Outcome of a single {@link GuardStage}: carry on with the context, or stop with a status.
 */
public record StageResult(GuardContext context, HttpStatus rejectStatus, String message) {

    public static StageResult proceed(final GuardContext context) {
        return new StageResult(context, null, null);
    }

    public static StageResult reject(final GuardContext context, final HttpStatus status, final String message) {
        return new StageResult(context, status, message);
    }

    public boolean rejected() {
        return rejectStatus != null;
    }
}
