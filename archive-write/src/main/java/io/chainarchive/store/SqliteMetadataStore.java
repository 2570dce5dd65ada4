package io.chainarchive.store;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainarchive.entity.Metadata;
import io.chainarchive.error.ArchiveIOException;
import io.chainarchive.error.EncodingException;

/**
 * Keeps metadata rows in a SQLite database file. Rows are only ever inserted.
 */
public class SqliteMetadataStore implements MetadataStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(SqliteMetadataStore.class);
  private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS metadata ("
      + "id varchar primary key, "
      + "spec_name varchar not null, "
      + "spec_version integer, "
      + "block_height integer not null, "
      + "block_hash char(66) not null, "
      + "hex varchar not null)";
  private static final String INSERT = "INSERT INTO metadata VALUES (?, ?, ?, ?, ?, ?)";

  private final Path path;
  private final Connection connection;
  private final PreparedStatement insert;

  public SqliteMetadataStore(Path path) {
    this.path = path;
    Connection opened = null;
    try {
      opened = DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath());
      try (Statement statement = opened.createStatement()) {
        statement.executeUpdate(CREATE_TABLE);
      }
      this.insert = opened.prepareStatement(INSERT);
      this.connection = opened;
    } catch (SQLException e) {
      ArchiveIOException failure = new ArchiveIOException("Unable to open metadata store " + path, e);
      if (opened != null) {
        try {
          opened.close();
        } catch (SQLException closeFailure) {
          failure.addSuppressed(closeFailure);
        }
      }
      throw failure;
    }
    LOGGER.info("Opened metadata store {}", path);
  }

  public Path getPath() {
    return path;
  }

  @Override
  public synchronized void insert(Metadata metadata) {
    check(metadata.getSpecName(), "spec_name");
    check(metadata.getBlockHeight(), "block_height");
    check(metadata.getBlockHash(), "block_hash");
    check(metadata.getHex(), "hex");
    try {
      insert.setString(1, metadata.resolveId());
      insert.setString(2, metadata.getSpecName());
      if (metadata.getSpecVersion() == null)
        insert.setNull(3, Types.INTEGER);
      else
        insert.setInt(3, metadata.getSpecVersion());
      insert.setInt(4, metadata.getBlockHeight());
      insert.setString(5, metadata.getBlockHash());
      insert.setString(6, metadata.getHex());
      insert.executeUpdate();
    } catch (SQLException e) {
      throw new ArchiveIOException("Unable to insert metadata " + metadata.resolveId() + " into " + path, e);
    }
    LOGGER.debug("Stored metadata {}", metadata);
  }

  private static void check(Object value, String field) {
    if (value == null)
      throw new EncodingException(field, "Metadata is missing " + field);
  }

  @Override
  public synchronized void close() {
    try {
      insert.close();
      connection.close();
    } catch (SQLException e) {
      throw new ArchiveIOException("Unable to close metadata store " + path, e);
    }
  }
}
