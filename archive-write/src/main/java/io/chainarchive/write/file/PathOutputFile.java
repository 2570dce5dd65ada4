package io.chainarchive.write.file;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;

/**
 * A Parquet {@link OutputFile} on the local file system without going through a Hadoop FileSystem.
 */
public class PathOutputFile implements OutputFile {
  private static final int BUFFER_SIZE = 64 * 1024;
  private final Path path;
  private PathPositionOutputStream stream;

  public PathOutputFile(Path path) {
    this.path = path;
  }

  public Path getFilePath() {
    return path;
  }

  @Override
  public PositionOutputStream create(long blockSizeHint) throws IOException {
    stream = new PathPositionOutputStream(Files.newOutputStream(path, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE));
    return stream;
  }

  @Override
  public PositionOutputStream createOrOverwrite(long blockSizeHint) throws IOException {
    stream = new PathPositionOutputStream(Files.newOutputStream(path, StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE));
    return stream;
  }

  @Override
  public boolean supportsBlockSize() {
    return false;
  }

  @Override
  public long defaultBlockSize() {
    return 0;
  }

  /**
   * Closes the stream handed out by {@link #create(long)} if there is one.
   */
  void closeStream() throws IOException {
    if (stream != null)
      stream.close();
  }

  private static class PathPositionOutputStream extends PositionOutputStream {
    private final OutputStream out;
    private long position;
    private boolean closed;

    PathPositionOutputStream(OutputStream out) {
      this.out = new BufferedOutputStream(out, BUFFER_SIZE);
    }

    @Override
    public long getPos() {
      return position;
    }

    @Override
    public void write(int b) throws IOException {
      out.write(b);
      position++;
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      out.write(b, off, len);
      position += len;
    }

    @Override
    public void flush() throws IOException {
      out.flush();
    }

    @Override
    public void close() throws IOException {
      if (closed)
        return;
      closed = true;
      out.close();
    }
  }
}
