package com.flamingo.ai.linkextractor.service.extraction;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * A dated note file discovered under the notes root.
 *
 * @param path location of the file; its identity
 * @param date the date encoded in the file name
 */
public record SourceFile(Path path, LocalDate date) {}
