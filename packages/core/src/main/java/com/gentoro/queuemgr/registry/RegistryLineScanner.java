package com.gentoro.queuemgr.registry;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Sequential reader over the lines of a registry file that keeps track of byte offsets, so a
 * damaged tail can be cut off at an exact line boundary.
 */
final class RegistryLineScanner implements Closeable {

  /**
   * One physical line.
   *
   * @param number 1-based line number
   * @param offset byte offset of the first character
   * @param text line content without the separator
   * @param terminated whether the line ended with {@code '\n'}; only the final line can be
   *     unterminated
   */
  record Line(long number, long offset, String text, boolean terminated) {}

  private final InputStream in;
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream(512);
  private long position;
  private long lineNumber;
  private Line lookahead;
  private boolean eof;

  RegistryLineScanner(Path path) throws IOException {
    this.in = new BufferedInputStream(Files.newInputStream(path), 64 * 1024);
  }

  /** Next line, or {@code null} at end of file. */
  Line next() throws IOException {
    if (lookahead != null) {
      Line l = lookahead;
      lookahead = null;
      return l;
    }
    return read();
  }

  /** Whether another line follows the one most recently returned by {@link #next()}. */
  boolean hasMore() throws IOException {
    if (lookahead == null) {
      lookahead = read();
    }
    return lookahead != null;
  }

  private Line read() throws IOException {
    if (eof) return null;
    buffer.reset();
    long start = position;
    int b;
    while ((b = in.read()) != -1) {
      position++;
      if (b == '\n') {
        return new Line(++lineNumber, start, decode(), true);
      }
      buffer.write(b);
    }
    eof = true;
    if (buffer.size() == 0) return null;
    return new Line(++lineNumber, start, decode(), false);
  }

  private String decode() {
    String s = buffer.toString(StandardCharsets.UTF_8);
    return s.endsWith("\r") ? s.substring(0, s.length() - 1) : s;
  }

  /** Total bytes consumed so far. */
  long position() {
    return position;
  }

  @Override
  public void close() throws IOException {
    in.close();
  }
}
