package com.gentoro.queuemgr.jobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.queuemgr.exception.ResultRejectedException;
import com.gentoro.queuemgr.logging.LoggingService;
import com.gentoro.queuemgr.utility.JacksonUtility;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import org.slf4j.Logger;

/**
 * Validation gate every job result passes before it is committed.
 *
 * <p>A value is accepted when it serializes to JSON and the serialized form does not exceed {@code
 * maxBytes}. Serialization streams into a bounded buffer that aborts as soon as the ceiling is
 * crossed, so an oversized value never costs more than {@code maxBytes} of memory. Results above
 * {@code warnBytes} are accepted with a warning. Rejected values are never partially stored.
 */
public final class ResultGuard {
  private static final Logger log = LoggingService.getLogger(ResultGuard.class);

  public static final long DEFAULT_WARN_BYTES = 10L * 1024 * 1024;
  public static final long DEFAULT_MAX_BYTES = 50L * 1024 * 1024;

  private final ObjectMapper mapper;
  private final long warnBytes;
  private final long maxBytes;

  public ResultGuard(long warnBytes, long maxBytes) {
    this(JacksonUtility.getJsonMapper(), warnBytes, maxBytes);
  }

  public ResultGuard(ObjectMapper mapper, long warnBytes, long maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (warnBytes > maxBytes) {
      throw new IllegalArgumentException("warnBytes must not exceed maxBytes");
    }
    this.mapper = mapper;
    this.warnBytes = warnBytes;
    this.maxBytes = maxBytes;
  }

  public long warnBytes() {
    return warnBytes;
  }

  public long maxBytes() {
    return maxBytes;
  }

  /** Check {@code value}; {@code null} (and JSON null) is an empty, accepted result. */
  public GuardVerdict validate(Object value) {
    if (value == null || value instanceof JsonNode node && node.isNull()) {
      return GuardVerdict.accepted(null, 0L);
    }

    BoundedBuffer buffer = new BoundedBuffer(maxBytes);
    try {
      mapper.writeValue(buffer, value);
    } catch (IOException e) {
      if (isCeilingHit(e)) {
        return GuardVerdict.rejected(
            new ResultRejectedException(
                ResultRejectedException.Reason.OVERSIZED,
                "Result exceeds the hard limit of " + maxBytes + " bytes"));
      }
      return GuardVerdict.rejected(
          new ResultRejectedException(
              ResultRejectedException.Reason.NON_SERIALIZABLE,
              "Result is not serializable: " + describe(e),
              e));
    } catch (RuntimeException e) {
      return GuardVerdict.rejected(
          new ResultRejectedException(
              ResultRejectedException.Reason.NON_SERIALIZABLE,
              "Result is not serializable: " + e.getMessage(),
              e));
    }

    long size = buffer.size();
    if (size > warnBytes) {
      log.warn(
          "Result of {} bytes is above the warning threshold of {} bytes; consider sampling or"
              + " paginating upstream",
          size,
          warnBytes);
    }
    try {
      return GuardVerdict.accepted(mapper.readTree(buffer.toByteArray()), size);
    } catch (IOException e) {
      return GuardVerdict.rejected(
          new ResultRejectedException(
              ResultRejectedException.Reason.NON_SERIALIZABLE,
              "Result does not read back as JSON: " + describe(e),
              e));
    }
  }

  private static boolean isCeilingHit(Throwable t) {
    for (Throwable c = t; c != null; c = c.getCause()) {
      if (c instanceof CeilingExceeded) return true;
    }
    return false;
  }

  private static String describe(IOException e) {
    return e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
  }

  /** Signals that the serialized form crossed the hard ceiling. */
  private static final class CeilingExceeded extends IOException {
    CeilingExceeded(long limit) {
      super("Serialized result exceeds " + limit + " bytes");
    }
  }

  /** Collects serialized bytes and fails once more than {@code limit} would be held. */
  private static final class BoundedBuffer extends OutputStream {
    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream(8192);
    private final long limit;

    BoundedBuffer(long limit) {
      this.limit = limit;
    }

    @Override
    public void write(int b) throws IOException {
      ensureRoom(1);
      bytes.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      ensureRoom(len);
      bytes.write(b, off, len);
    }

    private void ensureRoom(int len) throws CeilingExceeded {
      if (bytes.size() + (long) len > limit) {
        throw new CeilingExceeded(limit);
      }
    }

    long size() {
      return bytes.size();
    }

    byte[] toByteArray() {
      return bytes.toByteArray();
    }
  }
}
