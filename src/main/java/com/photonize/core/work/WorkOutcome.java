package com.photonize.core.work;

import java.util.concurrent.CancellationException;

/**
 * Result of one work item, as carried through a {@link CompletionInbox}.
 */
public record WorkOutcome<T>(T payload, Throwable error) {

    public static <T> WorkOutcome<T> completed(T payload) {
        return new WorkOutcome<>(payload, null);
    }

    public static <T> WorkOutcome<T> failed(T payload, Throwable error) {
        return new WorkOutcome<>(payload, error);
    }

    public boolean succeeded() {
        return error == null;
    }

    public boolean cancelled() {
        return error instanceof CancellationException;
    }
}
