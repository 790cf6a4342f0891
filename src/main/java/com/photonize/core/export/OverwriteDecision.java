package com.photonize.core.export;

/**
 * Answer from the caller when some outputs already exist.
 */
public enum OverwriteDecision {
    OVERWRITE_ALL,
    SKIP_EXISTING,
    CANCEL
}
