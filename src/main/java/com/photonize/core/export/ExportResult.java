package com.photonize.core.export;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Counts and message for a batch export or upscale. {@code success} means at least one file was written.
 */
public record ExportResult(boolean success,
                           int succeeded,
                           int skipped,
                           List<String> failures,
                           int total,
                           Path outputFolder,
                           String message) {

    public ExportResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    static ExportResult failed(String message) {
        return new ExportResult(false, 0, 0, List.of(), 0, null, message);
    }

    public int failedCount() {
        return failures.size();
    }

    /**
     * Builds the user-facing summary, e.g. {@code "Export complete: 3 exported, 1 failed of 4 photo(s)."}.
     *
     * @param operation noun used in the partial summary ("Export", "Upscale")
     * @param pastTense verb used for successes ("exported", "upscaled")
     * @param target    trailing description for the full-success sentence, e.g. "to PNG format"
     */
    static ExportResult summarize(String operation,
                                  String pastTense,
                                  String target,
                                  int succeeded,
                                  int skipped,
                                  List<String> failures,
                                  int total,
                                  Path outputFolder) {
        String message;
        if (succeeded == total) {
            message = "Successfully " + pastTense + " " + succeeded + " photo(s) " + target + " in '" + outputFolder + "'";
        } else if (succeeded > 0 || skipped > 0) {
            List<String> parts = new ArrayList<>();
            if (succeeded > 0) {
                parts.add(succeeded + " " + pastTense);
            }
            if (skipped > 0) {
                parts.add(skipped + " skipped");
            }
            if (!failures.isEmpty()) {
                parts.add(failures.size() + " failed");
            }
            message = operation + " complete: " + String.join(", ", parts) + " of " + total + " photo(s).";
            if (!failures.isEmpty()) {
                message += "\n\nFailed files:\n" + String.join("\n", failures);
            }
        } else {
            message = "Failed to " + operation.toLowerCase(java.util.Locale.ROOT) + " photos:\n" + String.join("\n", failures);
        }
        return new ExportResult(succeeded > 0, succeeded, skipped, failures, total, outputFolder, message);
    }
}
