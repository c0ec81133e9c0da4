package io.b2mash.roaf.record;

import io.b2mash.roaf.exception.InvalidRawRecordException;
import java.io.InputStream;
import java.util.Map;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads a Dataverse entity payload (as returned by the Web API with {@code $expand}ed relations)
 * into a {@link RawRecord}. OData annotations such as {@code @odata.etag} are kept like any other
 * unknown key.
 */
@Component
public class RawRecordReader {

  private static final TypeReference<Map<String, Object>> FIELDS_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public RawRecordReader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public RawRecord read(String json) {
    if (json == null || json.isBlank()) {
      throw new InvalidRawRecordException("Source payload is empty", null);
    }
    try {
      Map<String, Object> fields = objectMapper.readValue(json, FIELDS_TYPE);
      if (fields == null) {
        throw new InvalidRawRecordException("Source payload is empty", null);
      }
      return RawRecord.of(fields);
    } catch (JacksonException e) {
      throw new InvalidRawRecordException("Source payload is not a JSON object", e);
    }
  }

  public RawRecord read(InputStream json) {
    try {
      Map<String, Object> fields = objectMapper.readValue(json, FIELDS_TYPE);
      if (fields == null) {
        throw new InvalidRawRecordException("Source payload is empty", null);
      }
      return RawRecord.of(fields);
    } catch (JacksonException e) {
      throw new InvalidRawRecordException("Source payload is not a JSON object", e);
    }
  }
}
