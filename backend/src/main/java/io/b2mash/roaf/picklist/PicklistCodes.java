package io.b2mash.roaf.picklist;

import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes option-set codes so that {@code 356960241}, {@code 356960241L}, {@code 356960241.0}
 * and {@code " 356960241 "} all address the same table entry. Non-numeric string codes are
 * trimmed and kept as-is.
 *
 * <p>Numbers with more than {@value #MAX_DIGITS} integer or fraction digits cannot be an option-set
 * value. They are kept in their raw form, so they resolve as unknown codes.
 */
public final class PicklistCodes {

  private static final Logger log = LoggerFactory.getLogger(PicklistCodes.class);

  static final int MAX_DIGITS = 19;

  private PicklistCodes() {}

  public static Optional<String> normalize(Object code) {
    if (code == null) {
      return Optional.empty();
    }
    if (code instanceof Number number) {
      return normalizeNumber(number);
    }
    if (code instanceof String s) {
      String trimmed = s.trim();
      if (trimmed.isEmpty()) {
        return Optional.empty();
      }
      BigDecimal value;
      try {
        value = new BigDecimal(trimmed);
      } catch (NumberFormatException e) {
        return Optional.of(trimmed);
      }
      return Optional.of(canonical(value).orElse(trimmed));
    }
    return Optional.empty();
  }

  private static Optional<String> normalizeNumber(Number number) {
    if (number instanceof Double d && (d.isNaN() || d.isInfinite())) {
      return Optional.empty();
    }
    if (number instanceof Float f && (f.isNaN() || f.isInfinite())) {
      return Optional.empty();
    }
    String text = number.toString();
    return Optional.of(canonical(new BigDecimal(text)).orElse(text));
  }

  private static Optional<String> canonical(BigDecimal value) {
    BigDecimal stripped = value.stripTrailingZeros();
    long integerDigits = (long) stripped.precision() - stripped.scale();
    if (integerDigits > MAX_DIGITS || stripped.scale() > MAX_DIGITS) {
      log.debug("Ignoring out-of-range option-set code {}", abbreviate(value));
      return Optional.empty();
    }
    if (stripped.scale() < 0) {
      stripped = stripped.setScale(0);
    }
    return Optional.of(stripped.toPlainString());
  }

  private static String abbreviate(BigDecimal value) {
    String text = value.toString();
    return text.length() <= 40 ? text : text.substring(0, 40) + "...";
  }
}
