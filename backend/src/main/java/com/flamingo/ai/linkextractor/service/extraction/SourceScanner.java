package com.flamingo.ai.linkextractor.service.extraction;

import com.flamingo.ai.linkextractor.config.LinkExtractorConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Finds dated note files ({@code YYYY-MM-DD.<ext>}) below a notes root. */
@Component
@Slf4j
public class SourceScanner {

  private static final Comparator<SourceFile> NEWEST_FIRST =
      Comparator.comparing((SourceFile f) -> f.path().getFileName().toString())
          .thenComparing(f -> f.path().toString())
          .reversed();

  private final Pattern fileNamePattern;

  public SourceScanner(LinkExtractorConfig config) {
    String extension = Pattern.quote(config.getSource().getFileExtension());
    this.fileNamePattern = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}\\." + extension + "$");
  }

  /**
   * Scans the tree below {@code root}.
   *
   * @param root the notes root
   * @param dateFrom inclusive lower bound as ISO date, or {@code null}
   * @param dateTo inclusive upper bound as ISO date, or {@code null}
   * @return matching files, newest date first
   * @throws IllegalArgumentException if a bound is not a valid ISO date
   */
  public List<SourceFile> scan(Path root, String dateFrom, String dateTo) {
    LocalDate from = parseBound("dateFrom", dateFrom);
    LocalDate to = parseBound("dateTo", dateTo);

    if (!Files.isDirectory(root)) {
      log.warn("Notes directory {} does not exist, nothing to scan", root);
      return List.of();
    }

    try (Stream<Path> paths = Files.walk(root)) {
      List<SourceFile> files =
          paths
              .filter(Files::isRegularFile)
              .filter(path -> fileNamePattern.matcher(path.getFileName().toString()).matches())
              .map(path -> dateOf(path).map(date -> new SourceFile(path, date)))
              .flatMap(Optional::stream)
              .filter(file -> from == null || !file.date().isBefore(from))
              .filter(file -> to == null || !file.date().isAfter(to))
              .sorted(NEWEST_FIRST)
              .toList();
      log.info("Found {} note files under {}", files.size(), root);
      return files;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to scan " + root, e);
    }
  }

  /** Date encoded in a note file name; empty for names like {@code 2025-13-40.md}. */
  static Optional<LocalDate> dateOf(Path path) {
    String name = path.getFileName().toString();
    try {
      return Optional.of(
          LocalDate.of(
              Integer.parseInt(name.substring(0, 4)),
              Integer.parseInt(name.substring(5, 7)),
              Integer.parseInt(name.substring(8, 10))));
    } catch (DateTimeException | NumberFormatException | IndexOutOfBoundsException e) {
      log.debug("Skipping {}: not a calendar date", name);
      return Optional.empty();
    }
  }

  private static LocalDate parseBound(String name, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException(name + " must be an ISO date (YYYY-MM-DD): " + value, e);
    }
  }
}
