package io.b2mash.roaf.record;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import tools.jackson.databind.json.JsonMapper;

/** Fixture access for tests: JSON records under {@code src/test/resources/records}. */
public final class TestRecords {

  public static final String FULL = "authorised-individual.json";
  public static final String MINIMAL = "minimal.json";

  private static final RawRecordReader READER = new RawRecordReader(JsonMapper.builder().build());

  private TestRecords() {}

  public static RawRecord load(String name) {
    try (InputStream in = TestRecords.class.getResourceAsStream("/records/" + name)) {
      if (in == null) {
        throw new IllegalArgumentException("No fixture " + name);
      }
      return READER.read(in);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** The fixture with some fields replaced or added. */
  public static RawRecord with(String name, Map<String, Object> overrides) {
    var fields = new LinkedHashMap<String, Object>(load(name).asMap());
    fields.putAll(overrides);
    return RawRecord.of(fields);
  }

  /** The fixture with the given fields removed. */
  public static RawRecord without(String name, String... removed) {
    var fields = new LinkedHashMap<String, Object>(load(name).asMap());
    for (String field : removed) {
      fields.remove(field);
    }
    return RawRecord.of(fields);
  }
}
