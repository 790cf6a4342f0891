package com.photonize.cli;

import com.photonize.config.ConfigService;
import com.photonize.core.export.ExportFormat;
import com.photonize.core.export.ExportResult;
import com.photonize.core.export.ImageExporter;
import com.photonize.core.export.OverwriteDecision;
import com.photonize.core.export.ProcessPhotoUpscaler;
import com.photonize.core.export.UpscaleService;
import com.photonize.core.fs.PhotoLibrary;
import com.photonize.core.importer.ImportResult;
import com.photonize.core.importer.PhotoImporter;
import com.photonize.core.merge.ImportMode;
import com.photonize.core.model.PhotoBatch;
import com.photonize.core.rename.BatchRenamer;
import com.photonize.core.rename.PrefixDetector;
import com.photonize.core.rename.RenameResult;
import com.photonize.logging.AppLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line front end for renaming, importing, exporting and upscaling a photo folder.
 */
public final class PhotonizeTool {
    private static final Logger LOGGER = AppLogger.get();

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private static final String USAGE_TEXT = String.join(System.lineSeparator(),
            "Usage:",
            "  rename  <dir> [prefix]",
            "  import  <dir> <prefix> <append|distribute> <file>...",
            "  export  <dir> <webp|png|jpg|pdf> [overwrite|skip|cancel]",
            "  upscale <dir> [overwrite|skip|cancel]",
            "  next    <dir> <prefix>");

    private final PrintStream out;
    private final PrintStream err;
    private final ConfigService config;

    PhotonizeTool(PrintStream out, PrintStream err, ConfigService config) {
        this.out = out;
        this.err = err;
        this.config = config;
    }

    public static void main(String[] args) {
        int code = new PhotonizeTool(System.out, System.err, ConfigService.getInstance()).run(args);
        System.exit(code);
    }

    int run(String[] args) {
        if (args == null || args.length < 2) {
            err.println(USAGE_TEXT);
            return USAGE;
        }
        String command = args[0].toLowerCase(Locale.ROOT);
        Path dir = Path.of(args[1]).toAbsolutePath().normalize();
        List<String> rest = Arrays.asList(args).subList(2, args.length);
        try {
            switch (command) {
                case "rename":
                    return rename(dir, rest);
                case "import":
                    return importFiles(dir, rest);
                case "export":
                    return export(dir, rest);
                case "upscale":
                    return upscale(dir, rest);
                case "next":
                    return next(dir, rest);
                default:
                    err.println("Unknown command: " + args[0]);
                    err.println(USAGE_TEXT);
                    return USAGE;
            }
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            err.println(USAGE_TEXT);
            return USAGE;
        } catch (IOException ex) {
            LOGGER.log(Level.SEVERE, "Cannot read " + dir, ex);
            err.println("Cannot read " + dir + ": " + ex.getMessage());
            return FAILED;
        }
    }

    private int rename(Path dir, List<String> rest) throws IOException {
        PhotoBatch batch = new PhotoLibrary().load(dir);
        String prefix = rest.isEmpty() ? PrefixDetector.detectCommonPrefix(batch.files()) : rest.get(0);
        if (prefix == null || prefix.isBlank()) {
            err.println("No common prefix found; pass one explicitly.");
            return FAILED;
        }
        RenameResult result = new BatchRenamer().rename(batch.files(), prefix);
        return report(result.success(), result.message());
    }

    private int importFiles(Path dir, List<String> rest) throws IOException {
        if (rest.size() < 3) {
            throw new IllegalArgumentException("import needs a prefix, a mode and at least one file");
        }
        String prefix = rest.get(0);
        ImportMode mode = ImportMode.parse(rest.get(1));
        List<Path> sources = new ArrayList<>();
        for (String file : rest.subList(2, rest.size())) {
            sources.add(Path.of(file));
        }
        PhotoBatch batch = new PhotoLibrary().load(dir);
        ImportResult result = new PhotoImporter().importFiles(sources, batch, dir, prefix, mode);
        return report(result.success(), result.message());
    }

    private int export(Path dir, List<String> rest) throws IOException {
        if (rest.isEmpty()) {
            throw new IllegalArgumentException("export needs a format");
        }
        ExportFormat format = ExportFormat.parse(rest.get(0));
        OverwriteDecision decision = parseDecision(rest.size() > 1 ? rest.get(1) : null);
        PhotoBatch batch = new PhotoLibrary().load(dir);
        ImageExporter exporter = new ImageExporter(config.getWorkerCount(), config.getStaggerDelay());
        ExportResult result = exporter.export(batch.files(), dir, format, existing -> decision,
                (current, total, status) -> out.println("[" + current + "/" + total + "] " + status));
        return report(result.success(), result.message());
    }

    private int upscale(Path dir, List<String> rest) throws IOException {
        OverwriteDecision decision = parseDecision(rest.isEmpty() ? null : rest.get(0));
        Optional<Path> executable = config.getUpscalerExecutable();
        if (executable.isEmpty()) {
            err.println("No upscaler configured; set -Dphotonize.upscaler=<path>.");
            return FAILED;
        }
        PhotoBatch batch = new PhotoLibrary().load(dir);
        UpscaleService service = new UpscaleService(new ProcessPhotoUpscaler(executable.get()));
        ExportResult result = service.upscale(batch.files(), dir, existing -> decision,
                (current, total, status) -> out.println("[" + current + "/" + total + "] " + status));
        return report(result.success(), result.message());
    }

    private int next(Path dir, List<String> rest) throws IOException {
        if (rest.isEmpty()) {
            throw new IllegalArgumentException("next needs a prefix");
        }
        out.println(PrefixDetector.nextAvailableNumber(dir, rest.get(0)));
        return OK;
    }

    static OverwriteDecision parseDecision(String value) {
        if (value == null) {
            return OverwriteDecision.OVERWRITE_ALL;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "overwrite":
                return OverwriteDecision.OVERWRITE_ALL;
            case "skip":
                return OverwriteDecision.SKIP_EXISTING;
            case "cancel":
                return OverwriteDecision.CANCEL;
            default:
                throw new IllegalArgumentException("Unknown overwrite choice: " + value);
        }
    }

    private int report(boolean success, String message) {
        (success ? out : err).println(message);
        return success ? OK : FAILED;
    }
}
