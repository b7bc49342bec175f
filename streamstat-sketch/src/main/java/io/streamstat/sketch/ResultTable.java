package io.streamstat.sketch;

import com.google.common.collect.ImmutableList;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Collects {@link ResultRow}s and writes them as a tab separated report.
 */
public class ResultTable
{
  static final String HEADER = "Dataset\tEstimator\tMetric\tEstimate\tTruth\tErrorPct\n";

  private final List<ResultRow> rows = new ArrayList<>();

  public void add(ResultRow row)
  {
    rows.add(row);
  }

  public void addAll(Iterable<ResultRow> newRows)
  {
    for (ResultRow row : newRows) {
      rows.add(row);
    }
  }

  public List<ResultRow> rows()
  {
    return ImmutableList.copyOf(rows);
  }

  public void writeTo(Writer writer) throws IOException
  {
    writer.write(HEADER);
    for (ResultRow row : rows) {
      writer.write(String.format(
          Locale.ROOT,
          "%s\t%s\t%s\t%.3f\t%.3f\t%.3f\n",
          row.dataset,
          row.estimator,
          row.metric,
          row.estimate,
          row.truth,
          row.errorPct()
      ));
    }
  }

  public void writeTo(Path outFile) throws IOException
  {
    try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
      writeTo(writer);
    }
  }
}
