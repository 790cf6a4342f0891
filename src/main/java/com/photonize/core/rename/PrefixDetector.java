package com.photonize.core.rename;

import com.photonize.core.model.PhotoEntry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Guesses a rename prefix from existing file names and inspects numbering already on disk.
 */
public final class PrefixDetector {

    private PrefixDetector() {
    }

    /**
     * Longest common prefix of the photo stems, trimmed of trailing digits, dashes, underscores and
     * spaces. Folders are ignored. Returns {@code ""} when there are no photos.
     */
    public static String detectCommonPrefix(List<PhotoEntry> entries) {
        List<String> stems = entries == null ? List.of() : entries.stream()
            .filter(e -> !e.isContainer())
            .map(PhotoEntry::stem)
            .toList();
        if (stems.isEmpty()) {
            return "";
        }
        String common = stems.get(0);
        for (int i = 1; i < stems.size() && !common.isEmpty(); i++) {
            common = commonPrefix(common, stems.get(i));
        }
        return trimTrailingNumbersAndSeparators(common);
    }

    /**
     * True when every photo is already named {@code prefix-<digits>} (prefix compared ignoring case).
     */
    public static boolean alreadyUsesPrefix(List<PhotoEntry> entries, String prefix) {
        if (prefix == null || prefix.isBlank() || entries == null) {
            return false;
        }
        List<PhotoEntry> photos = entries.stream().filter(e -> !e.isContainer()).toList();
        if (photos.isEmpty()) {
            return false;
        }
        String lead = (prefix + "-").toLowerCase(Locale.ROOT);
        for (PhotoEntry photo : photos) {
            String stem = photo.stem();
            if (!stem.toLowerCase(Locale.ROOT).startsWith(lead)) {
                return false;
            }
            String suffix = stem.substring(lead.length());
            if (suffix.isEmpty() || !suffix.chars().allMatch(Character::isDigit)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Smallest number n >= 1 for which no {@code prefix-nnnnn.*} file exists in {@code directory}.
     */
    public static int nextAvailableNumber(Path directory, String prefix) throws IOException {
        if (directory == null || !Files.isDirectory(directory)) {
            return 1;
        }
        Pattern pattern = Pattern.compile("^" + Pattern.quote(prefix) + "-(\\d{5})\\.(.+)$");
        Set<Integer> taken = new HashSet<>();
        try (Stream<Path> stream = Files.list(directory)) {
            stream.map(Path::getFileName)
                .map(String::valueOf)
                .forEach(name -> {
                    Matcher m = pattern.matcher(name);
                    if (m.matches()) {
                        taken.add(Integer.parseInt(m.group(1)));
                    }
                });
        }
        int next = 1;
        while (taken.contains(next)) {
            next++;
        }
        return next;
    }

    static String commonPrefix(String a, String b) {
        int limit = Math.min(a.length(), b.length());
        int i = 0;
        while (i < limit && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return a.substring(0, i);
    }

    static String trimTrailingNumbersAndSeparators(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        int end = value.length();
        while (end > 0) {
            char c = value.charAt(end - 1);
            if (Character.isDigit(c) || c == '-' || c == '_' || Character.isWhitespace(c)) {
                end--;
            } else {
                break;
            }
        }
        return value.substring(0, end);
    }
}
