package com.photonize.core.rename;

import java.util.Optional;

/**
 * Outcome of {@link BatchRenamer#rename}. On failure, {@code failure} tells the kind and
 * {@code offendingFile} names the file involved when there is one.
 */
public record RenameResult(boolean success,
                           int movedCount,
                           String message,
                           RenameFailure failure,
                           String offendingFile,
                           Throwable cause) {

    static RenameResult moved(int movedCount) {
        return new RenameResult(true, movedCount, "Successfully renamed " + movedCount + " file(s).", null, null, null);
    }

    static RenameResult failed(RenameFailure failure, String message) {
        return new RenameResult(false, 0, message, failure, null, null);
    }

    static RenameResult failed(RenameFailure failure, String message, String offendingFile, int movedCount, Throwable cause) {
        return new RenameResult(false, movedCount, message, failure, offendingFile, cause);
    }

    public Optional<RenameFailure> failureKind() {
        return Optional.ofNullable(failure);
    }
}
