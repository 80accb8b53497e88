package io.poolflow.runner;

import io.poolflow.config.ByteSizes;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Job list for a static run. One job per line: {@code <cost> <command> [args...]}, whitespace
 * separated. Blank lines and lines starting with {@code #} are skipped.
 */
public final class JobFile {
    public record Entry(int line, long cost, List<String> argv) {}

    private JobFile() {}

    public static List<Entry> read(Path file) throws IOException {
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    public static List<Entry> parse(List<String> lines) {
        List<Entry> out = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split("\\s+");
            if (parts.length < 2) {
                throw new IllegalArgumentException("line " + (i + 1) + ": expected '<cost> <command...>', got '" + line + "'");
            }
            long cost;
            try {
                cost = ByteSizes.parse(parts[0]);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("line " + (i + 1) + ": " + e.getMessage(), e);
            }
            out.add(new Entry(i + 1, cost, List.copyOf(Arrays.asList(parts).subList(1, parts.length))));
        }
        return out;
    }
}
