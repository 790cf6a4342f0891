package com.photonize.core.export;

import com.photonize.core.model.PhotoEntry;
import com.photonize.core.work.CancellationSignal;
import com.photonize.logging.AppLogger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Runs a command-line upscaler once per photo:
 * {@code <exe> --output <folder> --compression 2 --format <ext> <input>}.
 */
public final class ProcessPhotoUpscaler implements PhotoUpscaler {
    private static final Logger LOGGER = AppLogger.get();

    private final Path executable;

    public ProcessPhotoUpscaler(Path executable) {
        if (executable == null) {
            throw new IllegalArgumentException("executable is required");
        }
        this.executable = executable.toAbsolutePath();
    }

    @Override
    public boolean isAvailable() {
        return Files.isRegularFile(executable) && Files.isExecutable(executable);
    }

    @Override
    public String location() {
        return executable.toString();
    }

    List<String> command(Path input, Path outputFolder) {
        String format = PhotoEntry.lowerExtensionOf(input);
        if (format.startsWith(".")) {
            format = format.substring(1);
        }
        if (format.isEmpty()) {
            format = "png";
        }
        return List.of(executable.toString(),
                "--output", outputFolder.toAbsolutePath().toString(),
                "--compression", "2",
                "--format", format.toLowerCase(Locale.ROOT),
                input.toAbsolutePath().toString());
    }

    @Override
    public UpscaleOutcome upscale(Path input, Path outputFolder, CancellationSignal signal)
            throws IOException, InterruptedException {
        CancellationSignal cancel = signal == null ? CancellationSignal.none() : signal;
        cancel.throwIfCancelled();

        ProcessBuilder builder = new ProcessBuilder(command(input, outputFolder));
        if (executable.getParent() != null) {
            builder.directory(executable.getParent().toFile());
        }
        builder.redirectErrorStream(true);
        Process process = builder.start();
        String output;
        int exitCode;
        try (CancellationSignal.Registration ignored = cancel.onCancel(process::destroyForcibly);
             InputStream in = process.getInputStream()) {
            output = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            exitCode = process.waitFor();
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            throw ex;
        }
        cancel.throwIfCancelled();

        if (exitCode != 0) {
            LOGGER.warning(() -> "Upscaler exited with " + exitCode + " for " + input.getFileName());
            return UpscaleOutcome.failed(exitCode, output.isEmpty() ? "exit code " + exitCode : output);
        }
        Path produced = outputFolder.resolve(input.getFileName());
        if (!Files.exists(produced)) {
            return UpscaleOutcome.failed(exitCode, "Upscaler reported success but wrote no " + produced.getFileName());
        }
        return UpscaleOutcome.succeeded(produced);
    }
}
