package io.b2mash.roaf.collection;

import io.b2mash.roaf.record.RawRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a related-entity array 1:1 into an ordered output list. Output order and cardinality always
 * match the input; the item mapper may not filter or reorder.
 *
 * <p>A relationship serialized as null, omitted entirely, or delivered with a non-array value
 * yields an empty list. These are shape drifts in the source, not errors.
 */
public final class RepeatingCollectionMapper {

  private static final Logger log = LoggerFactory.getLogger(RepeatingCollectionMapper.class);

  private RepeatingCollectionMapper() {}

  public static <T> List<T> mapCollection(Object rawItems, Function<RawRecord, T> itemMapper) {
    Objects.requireNonNull(itemMapper, "itemMapper");
    if (rawItems == null) {
      return List.of();
    }
    if (!(rawItems instanceof List<?> items)) {
      log.debug(
          "Expected an array of related records but got {}, mapping as empty",
          rawItems.getClass().getSimpleName());
      return List.of();
    }

    var mapped = new ArrayList<T>(items.size());
    for (int i = 0; i < items.size(); i++) {
      mapped.add(itemMapper.apply(toRecord(items.get(i), i)));
    }
    return Collections.unmodifiableList(mapped);
  }

  /** Maps the array held by {@code field} of {@code parent}. */
  public static <T> List<T> mapCollection(
      RawRecord parent, String field, Function<RawRecord, T> itemMapper) {
    return mapCollection(parent.raw(field), itemMapper);
  }

  @SuppressWarnings("unchecked")
  private static RawRecord toRecord(Object item, int index) {
    if (item instanceof Map<?, ?> fields) {
      return RawRecord.of((Map<String, ?>) fields);
    }
    log.debug("Related record at index {} is not an object, mapping with defaults", index);
    return RawRecord.empty();
  }
}
