package com.leo.positioning.spectrum;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the latest spectrum sample from a file written by an external receiver.
 *
 * <p>The file holds one sample per line as comma-separated magnitudes; only the last non-blank
 * line is used. Negative magnitudes are clamped to zero. An unreadable, empty or malformed file
 * yields an empty sample and a warning.
 */
@Slf4j
public class FileSpectrumSource implements SpectrumSource {

  private final Path path;

  public FileSpectrumSource(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public List<Integer> sample() {
    List<String> lines;
    try {
      lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.warn("Failed to read spectrum file {}: {}", path, e.getMessage());
      return List.of();
    }

    String last = null;
    for (int i = lines.size() - 1; i >= 0; i--) {
      if (!lines.get(i).isBlank()) {
        last = lines.get(i);
        break;
      }
    }
    if (last == null) {
      log.warn("Spectrum file {} contains no samples", path);
      return List.of();
    }

    try {
      return parse(last);
    } catch (NumberFormatException e) {
      log.warn("Malformed spectrum sample in {}: {}", path, e.getMessage());
      return List.of();
    }
  }

  @Override
  public String getName() {
    return "LIVE";
  }

  static List<Integer> parse(String line) {
    String[] fields = line.split(",");
    List<Integer> magnitudes = new ArrayList<>(fields.length);
    for (String field : fields) {
      String value = field.trim();
      if (value.isEmpty()) {
        continue;
      }
      long magnitude = Math.round(Double.parseDouble(value));
      magnitudes.add((int) Math.max(0L, Math.min(Integer.MAX_VALUE, magnitude)));
    }
    return List.copyOf(magnitudes);
  }
}
