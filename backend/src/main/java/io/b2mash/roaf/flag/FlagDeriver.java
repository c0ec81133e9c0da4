package io.b2mash.roaf.flag;

import io.b2mash.roaf.record.RawRecord;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evaluates every {@link ConditionFlag} against a raw record. Total over all record shapes: an
 * absent field is a valid input and evaluates to {@code false}.
 */
@Component
public class FlagDeriver {

  private static final Logger log = LoggerFactory.getLogger(FlagDeriver.class);

  public ConditionFlags deriveFlags(RawRecord record) {
    Objects.requireNonNull(record, "record");
    if (log.isDebugEnabled()) {
      var drivers = new LinkedHashMap<String, Object>();
      for (ConditionFlag flag : ConditionFlag.values()) {
        drivers.put(flag.sourceField(), describe(record.raw(flag.sourceField())));
      }
      log.debug("Flag driver values {}", drivers);
    }
    var values = new EnumMap<ConditionFlag, Boolean>(ConditionFlag.class);
    for (ConditionFlag flag : ConditionFlag.values()) {
      values.put(flag, flag.evaluate(record));
    }
    var flags = ConditionFlags.of(values);
    log.info("Derived condition flags {}", flags.asMap());
    return flags;
  }

  /** Arrays are summarized by size; related rows can be large. */
  private static Object describe(Object value) {
    if (value instanceof List<?> items) {
      return "[" + items.size() + " items]";
    }
    return value;
  }
}
