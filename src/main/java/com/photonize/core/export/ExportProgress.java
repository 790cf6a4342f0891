package com.photonize.core.export;

/**
 * Progress sink. Called from worker threads.
 */
@FunctionalInterface
public interface ExportProgress {
    ExportProgress NONE = (current, total, status) -> { };

    void report(int current, int total, String status);
}
