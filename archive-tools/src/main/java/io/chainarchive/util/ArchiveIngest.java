package io.chainarchive.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainarchive.error.ArchiveException;
import io.chainarchive.io.Compression;
import io.chainarchive.write.ArchiveConfig;
import io.chainarchive.write.ArchiveWriter;
import io.chainarchive.write.batch.IdentifierOrder;
import io.chainarchive.write.rotation.FileNaming;

/**
 * Reads newline delimited JSON blocks from stdin (or a file) and archives them into Parquet files.
 */
public class ArchiveIngest {
  private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveIngest.class);
  static final int OK = 0;
  static final int FAILED = 1;
  static final int USAGE = 2;

  public static void main(String[] args) {
    System.exit(run(args, System.in));
  }

  static Options options() {
    Options options = new Options();
    options.addOption("o", "out-dir", true, "Root directory of the archive, one sub directory per record kind");
    options.addOption("c", "config", true, "JSON config file, command line options override its values");
    options.addOption("i", "input", true, "Input file of newline delimited JSON blocks, stdin when absent");
    options.addOption("f", "rows-per-file", true, "Rows written to a file before it is rotated");
    options.addOption("g", "rows-per-row-group", true, "Rows buffered before a row group is flushed");
    options.addOption("q", "queue-capacity", true, "Submissions queued per record kind before the producer blocks");
    options.addOption(null, "capacity", true, "Sets both rows-per-file and rows-per-row-group");
    options.addOption(null, "compression", true, "none, snappy or zstd");
    options.addOption(null, "naming", true, "block_height or sequence");
    options.addOption(null, "numeric-id-sort", false, "Order derived records by the block height prefix of their id");
    options.addOption(null, "no-flush-on-close", false, "Discard buffered rows instead of flushing them on shutdown");
    options.addOption(null, "skip-invalid", false, "Skip records with a malformed identifier or an unencodable field instead of failing");
    options.addOption(null, "metadata", false, "Store runtime metadata in a sqlite sidecar");
    options.addOption("h", "help", false, "Print this help");
    return options;
  }

  /**
   * @return {@link #OK}, {@link #FAILED} when the archive run failed or {@link #USAGE} on invalid arguments.
   */
  static int run(String[] args, InputStream stdin) {
    Options options = options();
    ArchiveConfig config;
    CommandLine cmd;
    try {
      CommandLineParser parser = new DefaultParser();
      cmd = parser.parse(options, args);
      if (cmd.hasOption("h")) {
        printHelp(options);
        return OK;
      }
      config = toConfig(cmd);
      config.validate();
    } catch (ParseException | IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printHelp(options);
      return USAGE;
    } catch (IOException e) {
      System.err.println("Unable to read config: " + e.getMessage());
      return USAGE;
    }

    InputStream in = stdin;
    try {
      if (cmd.hasOption("i"))
        in = Files.newInputStream(Paths.get(cmd.getOptionValue("i")));
      ArchiveWriter writer = new ArchiveWriter(config);
      writer.ingest(in);
      return OK;
    } catch (IOException | ArchiveException e) {
      LOGGER.error("Archive run failed", e);
      return FAILED;
    } catch (RuntimeException e) {
      LOGGER.error("Archive run failed unexpectedly", e);
      return FAILED;
    } finally {
      if (in != stdin)
        closeQuietly(in);
    }
  }

  static ArchiveConfig toConfig(CommandLine cmd) throws IOException {
    ArchiveConfig config = cmd.hasOption("c") ? ArchiveConfig.load(Paths.get(cmd.getOptionValue("c"))) : new ArchiveConfig();
    if (cmd.hasOption("o"))
      config.setOutDir(cmd.getOptionValue("o"));
    if (cmd.hasOption("capacity"))
      config.withCapacity(intValue(cmd, "capacity"));
    if (cmd.hasOption("f"))
      config.setRowsPerFile(intValue(cmd, "f"));
    if (cmd.hasOption("g"))
      config.setRowsPerRowGroup(intValue(cmd, "g"));
    if (cmd.hasOption("q"))
      config.setQueueCapacity(intValue(cmd, "q"));
    if (cmd.hasOption("compression")) {
      Compression compression = Compression.getCompression(cmd.getOptionValue("compression"));
      if (compression == null)
        throw new IllegalArgumentException("Unsupported compression " + cmd.getOptionValue("compression"));
      config.setCompression(compression);
    }
    if (cmd.hasOption("naming")) {
      FileNaming naming = FileNaming.getFileNaming(cmd.getOptionValue("naming"));
      if (naming == null)
        throw new IllegalArgumentException("Unsupported file naming " + cmd.getOptionValue("naming"));
      config.setFileNaming(naming);
    }
    if (cmd.hasOption("numeric-id-sort"))
      config.setIdentifierOrder(IdentifierOrder.NUMERIC_PREFIX);
    if (cmd.hasOption("no-flush-on-close"))
      config.setFlushOnClose(false);
    if (cmd.hasOption("skip-invalid"))
      config.setSkipInvalidRecords(true);
    if (cmd.hasOption("metadata"))
      config.setMetadata(true);
    return config;
  }

  private static int intValue(CommandLine cmd, String option) {
    String value = cmd.getOptionValue(option);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Option " + option + " expects an integer but was " + value);
    }
  }

  private static void printHelp(Options options) {
    HelpFormatter formatter = new HelpFormatter();
    formatter.printHelp("archive-ingest", options);
  }

  private static void closeQuietly(InputStream in) {
    try {
      in.close();
    } catch (IOException e) {
      LOGGER.warn("Unable to close input", e);
    }
  }
}
