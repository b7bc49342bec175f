package io.streamstat.sketch;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Dataset files hold one element per line, UTF-8 encoded, without header.
 */
public final class Datasets
{
  private Datasets()
  {
  }

  public static void write(Path file, Iterable<String> elements) throws IOException
  {
    try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      for (String element : elements) {
        writer.write(element);
        writer.write('\n');
      }
    }
  }

  /**
   * Lazily streams the elements of {@code file}, trimming each line and skipping blank ones.
   * The stream must be closed. I/O errors while reading surface as {@link java.io.UncheckedIOException}.
   */
  public static Stream<String> stream(Path file) throws IOException
  {
    return Files.lines(file, StandardCharsets.UTF_8)
        .map(String::strip)
        .filter(line -> !line.isEmpty());
  }

  public static List<String> read(Path file) throws IOException
  {
    try (Stream<String> lines = stream(file)) {
      return lines.collect(Collectors.toList());
    }
  }
}
