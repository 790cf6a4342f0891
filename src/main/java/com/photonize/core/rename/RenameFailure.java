package com.photonize.core.rename;

/**
 * Why a rename or import did not go through.
 */
public enum RenameFailure {
    /** Prefix empty, blank, or holding a character no filesystem accepts. */
    INVALID_PREFIX,
    /** Nothing renamable was given. */
    NO_WORK,
    /** A target name is held by a file outside the batch. Nothing was touched. */
    NAME_CONFLICT,
    /** A move failed part way; some files may be left under temporary names. */
    IO_FAILURE
}
