package io.b2mash.roaf.record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over one Dataverse entity as delivered by the source system: a keyed bag of
 * primitives and nested arrays of further bags. Unknown keys are retained but never required.
 *
 * <p>Accessors are lenient. A missing key, a {@code null} value and a value of the wrong JSON type
 * all read as "not set" rather than failing, because the source system is authoritative and may
 * legitimately omit any optional field. Field names come from {@link AuthorisedIndividualFields}.
 *
 * <p>Nested arrays and objects are copied on construction and exposed unmodifiable.
 */
public final class RawRecord {

  private static final RawRecord EMPTY = new RawRecord(Map.of());

  private final Map<String, Object> fields;

  private RawRecord(Map<String, Object> fields) {
    this.fields = fields;
  }

  public static RawRecord of(Map<String, ?> fields) {
    if (fields == null || fields.isEmpty()) {
      return EMPTY;
    }
    return new RawRecord(freeze(fields));
  }

  /** Copies nested arrays and objects too, so the record cannot change after construction. */
  private static Map<String, Object> freeze(Map<?, ?> fields) {
    var copy = new LinkedHashMap<String, Object>();
    fields.forEach((key, value) -> copy.put(String.valueOf(key), freezeValue(value)));
    return Collections.unmodifiableMap(copy);
  }

  private static Object freezeValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return freeze(map);
    }
    if (value instanceof List<?> list) {
      var copy = new ArrayList<Object>(list.size());
      for (Object item : list) {
        copy.add(freezeValue(item));
      }
      // List.copyOf rejects the null elements a source array may hold
      return Collections.unmodifiableList(copy);
    }
    return value;
  }

  public static RawRecord empty() {
    return EMPTY;
  }

  /** Returns true when the field is present with a non-null value. */
  public boolean has(String field) {
    return fields.get(field) != null;
  }

  /** Returns the untyped value, or null. */
  public Object raw(String field) {
    return fields.get(field);
  }

  /**
   * Returns the value as text. Strings pass through; numbers and booleans are rendered with
   * {@link String#valueOf(Object)}; nested objects and arrays read as absent.
   */
  public Optional<String> text(String field) {
    Object value = fields.get(field);
    if (value instanceof String s) {
      return Optional.of(s);
    }
    if (value instanceof Number || value instanceof Boolean) {
      return Optional.of(String.valueOf(value));
    }
    return Optional.empty();
  }

  /** Text value or the empty string; an empty string in the source also reads as empty. */
  public String textOrEmpty(String field) {
    return text(field).orElse("");
  }

  /** Text value, or null when absent or empty. For optional fields unrelated to any flag. */
  public String textOrNull(String field) {
    return text(field).filter(value -> !value.isEmpty()).orElse(null);
  }

  /**
   * Boolean identity check: only a JSON {@code true} counts. The strings {@code "true"} and
   * {@code "1"} do not, matching how Dataverse serializes two-option fields.
   */
  public boolean isTrue(String field) {
    return Boolean.TRUE.equals(fields.get(field));
  }

  /**
   * Returns the calendar date part of an ISO-8601 value ({@code 2025-12-25T00:00:00Z} reads as
   * {@code 2025-12-25}). Blank values read as absent.
   */
  public Optional<String> date(String field) {
    return text(field)
        .map(String::trim)
        .map(value -> value.indexOf('T') >= 0 ? value.substring(0, value.indexOf('T')) : value)
        .filter(value -> !value.isEmpty());
  }

  /** Date part of the first field that holds one, or the empty string. */
  public String dateOrEmpty(String field, String... alternatives) {
    Optional<String> date = date(field);
    for (String alternative : alternatives) {
      if (date.isPresent()) {
        break;
      }
      date = date(alternative);
    }
    return date.orElse("");
  }

  public String dateOrNull(String field) {
    return date(field).orElse(null);
  }

  /** Returns the picklist code (number or string), or null when unset or of another type. */
  public Object code(String field) {
    Object value = fields.get(field);
    if (value instanceof Number || value instanceof String) {
      return value;
    }
    return null;
  }

  /** Returns true when the field holds a picklist code. */
  public boolean hasCode(String field) {
    return code(field) != null;
  }

  /** Returns true when the field holds a JSON array with at least one element. */
  public boolean hasItems(String field) {
    return fields.get(field) instanceof List<?> items && !items.isEmpty();
  }

  /** Primary identifier of the entity, if present and not blank. */
  public Optional<String> primaryId(String idField) {
    return text(idField).map(String::trim).filter(id -> !id.isEmpty());
  }

  public Map<String, Object> asMap() {
    return fields;
  }

  public int size() {
    return fields.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof RawRecord other && fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "RawRecord" + fields.keySet();
  }
}
