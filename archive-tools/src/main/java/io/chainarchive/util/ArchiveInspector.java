package io.chainarchive.util;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import io.chainarchive.Constants;
import io.chainarchive.write.file.PathInputFile;

/**
 * Prints a JSON summary of every finished Parquet file under an archive directory.
 */
public class ArchiveInspector {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  public static void main(String[] args) throws IOException, ParseException {
    Options options = new Options();
    options.addOption("p", "path", true, "Path to the archive root or one record kind directory");

    if (args.length == 0) {
      HelpFormatter formatter = new HelpFormatter();
      formatter.printHelp("archive-inspector", options);
      return;
    }

    CommandLineParser parser = new DefaultParser();
    CommandLine cmd = parser.parse(options, args);
    Path path = Paths.get(cmd.getOptionValue("p"));
    if (!Files.isDirectory(path))
      throw new IllegalArgumentException(path + " should be a directory");
    print(inspect(path), System.out);
  }

  public static void print(List<FileSummary> summaries, PrintStream out) throws IOException {
    out.println(OBJECT_MAPPER.writeValueAsString(summaries));
  }

  /**
   * Summarizes the finished files found in {@code root} and its direct sub directories, in path order.
   * In progress files are ignored.
   */
  public static List<FileSummary> inspect(Path root) throws IOException {
    List<FileSummary> summaries = new ArrayList<>();
    for (Path file : listParquetFiles(root))
      summaries.add(summarize(file));
    return summaries;
  }

  public static FileSummary summarize(Path file) throws IOException {
    try (ParquetFileReader reader = ParquetFileReader.open(new PathInputFile(file))) {
      ParquetMetadata footer = reader.getFooter();
      Map<String, String> keyValues = footer.getFileMetaData().getKeyValueMetaData();
      FileSummary summary = new FileSummary();
      summary.file = file.toString();
      summary.kind = keyValues.get(Constants.RECORD_KIND_KEY);
      summary.blockRange = keyValues.get(Constants.BLOCK_RANGE_KEY);
      summary.createdBy = keyValues.get(Constants.CREATED_BY_KEY);
      summary.rowsPerGroup = new ArrayList<>();
      for (BlockMetaData block : footer.getBlocks()) {
        summary.rowsPerGroup.add(block.getRowCount());
        summary.totalRows += block.getRowCount();
      }
      summary.rowGroups = footer.getBlocks().size();
      summary.schema = footer.getFileMetaData().getSchema().toString();
      return summary;
    }
  }

  static List<Path> listParquetFiles(Path root) throws IOException {
    try (Stream<Path> stream = Files.walk(root, 2)) {
      return stream
          .filter(Files::isRegularFile)
          .filter(file -> file.getFileName().toString().endsWith(Constants.PARQUET_EXTENSION))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  @JsonInclude(value = Include.NON_NULL)
  public static class FileSummary {
    private String file;
    private String kind;
    private String blockRange;
    private String createdBy;
    private int rowGroups;
    private List<Long> rowsPerGroup;
    private long totalRows;
    private String schema;

    public String getFile() {
      return file;
    }

    public String getKind() {
      return kind;
    }

    @JsonProperty("block_range")
    public String getBlockRange() {
      return blockRange;
    }

    @JsonProperty("created_by")
    public String getCreatedBy() {
      return createdBy;
    }

    @JsonProperty("row_groups")
    public int getRowGroups() {
      return rowGroups;
    }

    @JsonProperty("rows_per_group")
    public List<Long> getRowsPerGroup() {
      return rowsPerGroup;
    }

    @JsonProperty("total_rows")
    public long getTotalRows() {
      return totalRows;
    }

    public String getSchema() {
      return schema;
    }
  }
}
