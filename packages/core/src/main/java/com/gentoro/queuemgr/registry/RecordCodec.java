package com.gentoro.queuemgr.registry;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonEOFException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.gentoro.queuemgr.exception.DecodeException;
import com.gentoro.queuemgr.exception.StorageException;
import com.gentoro.queuemgr.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;

/**
 * Converts a {@link JobRecord} to and from one line of JSON.
 *
 * <p>An encoded record never contains a raw line break (JSON escapes them inside strings), so each
 * line of the registry file can be decoded on its own. Decoding separates syntactically broken
 * input ({@link DecodeException.Kind#CORRUPT}) from well-formed lines that do not describe a valid
 * record ({@link DecodeException.Kind#INVALID}).
 */
public final class RecordCodec {
  private final ObjectWriter writer;
  private final ObjectReader reader;

  public RecordCodec() {
    this(JacksonUtility.getJsonMapper());
  }

  public RecordCodec(ObjectMapper mapper) {
    this.writer = mapper.writerFor(JobRecord.class);
    this.reader =
        mapper
            .readerFor(JobRecord.class)
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .with(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
  }

  /** Encode without the trailing line separator. */
  public String encode(JobRecord record) {
    try {
      return writer.writeValueAsString(record);
    } catch (JsonProcessingException e) {
      throw new StorageException("Failed to encode job record " + record.jobId(), e);
    }
  }

  /** Number of bytes the record occupies on disk, line separator included. */
  public long encodedSize(JobRecord record) {
    return encode(record).getBytes(StandardCharsets.UTF_8).length + 1L;
  }

  public JobRecord decode(String line) {
    if (line == null || line.isBlank()) {
      throw new DecodeException(DecodeException.Kind.CORRUPT, "Empty registry line");
    }
    JobRecord record;
    try {
      record = reader.readValue(line);
    } catch (JsonEOFException e) {
      throw new DecodeException(DecodeException.Kind.CORRUPT, "Truncated registry line", e);
    } catch (JsonParseException e) {
      throw new DecodeException(
          DecodeException.Kind.CORRUPT, "Malformed registry line: " + e.getOriginalMessage(), e);
    } catch (JsonProcessingException e) {
      throw new DecodeException(
          DecodeException.Kind.INVALID, "Invalid job record: " + e.getOriginalMessage(), e);
    }
    if (record == null) {
      throw new DecodeException(DecodeException.Kind.INVALID, "Registry line holds JSON null");
    }
    String violation = record.invariantViolation().orElse(null);
    if (violation != null) {
      throw new DecodeException(
          DecodeException.Kind.INVALID,
          "Invalid job record '" + record.jobId() + "': " + violation);
    }
    return record;
  }
}
