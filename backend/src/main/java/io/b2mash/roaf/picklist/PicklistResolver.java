package io.b2mash.roaf.picklist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single entry point for turning option-set codes into display labels. Resolution never throws: a
 * null or unknown code yields the table's {@link FallbackPolicy} and an unknown code is logged at
 * debug level as a soft data gap.
 */
@Component
public class PicklistResolver {

  private static final Logger log = LoggerFactory.getLogger(PicklistResolver.class);

  private final PicklistRegistry registry;

  public PicklistResolver(PicklistRegistry registry) {
    this.registry = registry;
  }

  public String resolve(PicklistFamily family, Object code) {
    return resolve(registry.table(family), code);
  }

  public static String resolve(PicklistTable table, Object code) {
    if (code == null) {
      return table.fallback().label();
    }
    return table
        .find(code)
        .orElseGet(
            () -> {
              log.debug(
                  "Unknown {} code {}, using fallback '{}'",
                  table.family(),
                  code,
                  table.fallback().label());
              return table.fallback().label();
            });
  }
}
