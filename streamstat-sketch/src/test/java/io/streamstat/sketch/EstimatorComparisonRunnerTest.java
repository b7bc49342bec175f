package io.streamstat.sketch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EstimatorComparisonRunnerTest
{
  @TempDir
  Path tempDir;

  @Test
  void testGenerateThenCompare() throws Exception
  {
    Path dataset = tempDir.resolve("dataset_10k.txt");
    EstimatorComparisonRunner.generate(10_000, dataset, new VisitorDatasetGenerator(8));
    assertThat(Datasets.read(dataset)).hasSize(10_000);

    ResultTable table = EstimatorComparisonRunner.compare(dataset, Arrays.asList("hll10", "sbf4x20000"));
    assertThat(table.rows()).hasSize(4);
    assertThat(table.rows()).allMatch(r -> r.dataset().equals("dataset_10k"));
  }

  @Test
  void testMainWritesReport() throws Exception
  {
    Path dataset = tempDir.resolve("visits.txt");
    Path report = tempDir.resolve("report.tsv");
    EstimatorComparisonRunner.main(new String[] {"generate", "2000", dataset.toString(), "4"});
    EstimatorComparisonRunner.main(new String[] {"compare", dataset.toString(), "hll8", "--out", report.toString()});

    List<String> lines = Files.readAllLines(report, StandardCharsets.UTF_8);
    assertThat(lines).hasSize(3);
    assertThat(lines.get(0)).isEqualTo("Dataset\tEstimator\tMetric\tEstimate\tTruth\tErrorPct");
    assertThat(lines.get(1)).startsWith("visits\thll8\tcardinality\t");
    assertThat(lines.get(2)).startsWith("visits\thll8\tcardinality_raw\t");
  }

  @Test
  void testNames()
  {
    assertThat(EstimatorComparisonRunner.datasetName(Paths.get("data", "dataset_1m.txt"))).isEqualTo("dataset_1m");
    assertThat(EstimatorComparisonRunner.datasetName(Paths.get("plain"))).isEqualTo("plain");
    assertThat(EstimatorComparisonRunner.defaultReportFile(Paths.get("dataset_1m.txt"), Arrays.asList("hll14", "sbf3x1024")))
        .isEqualTo(Paths.get("compare_dataset_1m_hll14_sbf3x1024.tsv"));
  }
}
