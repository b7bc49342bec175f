package io.streamstat.sketch;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

public class EstimatorComparisonRunner
{
  private static final Logger LOG = LoggerFactory.getLogger(EstimatorComparisonRunner.class);

  private static final String USAGE = "Arguments: generate <elements> <outFile> [<seed>]"
      + " | compare <datasetFile> <estimator>.. [--out <outFile>]";

  static void generate(int elements, Path outFile, VisitorDatasetGenerator generator) throws IOException
  {
    Stopwatch stopwatch = Stopwatch.createStarted();
    Datasets.write(outFile, generator.generate(elements));
    LOG.info("Wrote {} elements to {} in {}", elements, outFile, stopwatch);
  }

  static ResultTable compare(Path datasetFile, List<String> estimatorNames) throws IOException
  {
    EstimatorComparison comparison = new EstimatorComparison(estimatorNames);
    ResultTable table = new ResultTable();
    try (Stream<String> elements = Datasets.stream(datasetFile)) {
      table.addAll(comparison.run(datasetName(datasetFile), elements.iterator()));
    }
    return table;
  }

  static String datasetName(Path datasetFile)
  {
    String fileName = datasetFile.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }

  static Path defaultReportFile(Path datasetFile, List<String> estimatorNames)
  {
    return Paths.get(String.format("compare_%s_%s.tsv", datasetName(datasetFile), Joiner.on("_").join(estimatorNames)));
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 1) {
      exitWithUsage();
    }

    if (args[0].equals("generate")) {
      if (args.length < 3 || args.length > 4) {
        exitWithUsage();
      }
      final int elements = Integer.parseInt(args[1]);
      final Path outFile = Paths.get(args[2]);
      VisitorDatasetGenerator generator = args.length == 4
          ? new VisitorDatasetGenerator(Long.parseLong(args[3]))
          : new VisitorDatasetGenerator();
      generate(elements, outFile, generator);
      return;
    }

    if (args[0].equals("compare")) {
      if (args.length < 3) {
        exitWithUsage();
      }
      final Path datasetFile = Paths.get(args[1]);
      List<String> estimatorNames = new ArrayList<>(Arrays.asList(args).subList(2, args.length));
      Path outFile = null;
      int outFlag = estimatorNames.indexOf("--out");
      if (outFlag >= 0) {
        if (outFlag != estimatorNames.size() - 2) {
          exitWithUsage();
        }
        outFile = Paths.get(estimatorNames.get(outFlag + 1));
        estimatorNames = estimatorNames.subList(0, outFlag);
      }
      if (estimatorNames.isEmpty()) {
        exitWithUsage();
      }
      if (outFile == null) {
        outFile = defaultReportFile(datasetFile, estimatorNames);
      }

      ResultTable table = compare(datasetFile, estimatorNames);
      LOG.info("Writing results to {}", outFile);
      table.writeTo(outFile);
      return;
    }

    exitWithUsage();
  }

  private static void exitWithUsage()
  {
    System.err.println(USAGE);
    System.exit(1);
  }
}
