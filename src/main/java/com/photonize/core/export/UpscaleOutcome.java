package com.photonize.core.export;

import java.nio.file.Path;

public record UpscaleOutcome(boolean success, Path output, int exitCode, String detail) {

    public static UpscaleOutcome succeeded(Path output) {
        return new UpscaleOutcome(true, output, 0, "");
    }

    public static UpscaleOutcome failed(int exitCode, String detail) {
        return new UpscaleOutcome(false, null, exitCode, detail == null ? "" : detail);
    }
}
