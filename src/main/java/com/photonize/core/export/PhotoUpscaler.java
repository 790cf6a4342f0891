package com.photonize.core.export;

import com.photonize.core.work.CancellationSignal;

import java.io.IOException;
import java.nio.file.Path;

/**
 * External AI upscaler. Implementations write {@code <outputFolder>/<input file name>}.
 */
public interface PhotoUpscaler {

    boolean isAvailable();

    /**
     * Where the tool is expected to live, for error messages.
     */
    String location();

    UpscaleOutcome upscale(Path input, Path outputFolder, CancellationSignal signal)
            throws IOException, InterruptedException;
}
