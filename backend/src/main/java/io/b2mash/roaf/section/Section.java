package io.b2mash.roaf.section;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A flag-gated region of the canonical document: either fully populated or absent. There is no
 * partially populated state, and an absent section's builder is never run.
 *
 * @param <T> section payload
 */
public sealed interface Section<T> permits Section.Present, Section.Absent {

  /**
   * Runs {@code builder} only when {@code flag} is true.
   *
   * @throws NullPointerException if the builder returns null
   */
  static <T> Section<T> compose(boolean flag, Supplier<? extends T> builder) {
    if (!flag) {
      return absent();
    }
    return new Present<>(builder.get());
  }

  static <T> Section<T> present(T value) {
    return new Present<>(value);
  }

  @SuppressWarnings("unchecked")
  static <T> Section<T> absent() {
    return (Section<T>) Absent.INSTANCE;
  }

  boolean isPresent();

  /** Payload, or null for an absent section. Intended for the render-context boundary only. */
  T orNull();

  default Optional<T> toOptional() {
    return Optional.ofNullable(orNull());
  }

  default <R> Section<R> map(Function<? super T, ? extends R> mapper) {
    return isPresent() ? new Present<>(mapper.apply(orNull())) : absent();
  }

  record Present<T>(T value) implements Section<T> {

    public Present {
      Objects.requireNonNull(value, "present section value");
    }

    @Override
    public boolean isPresent() {
      return true;
    }

    @Override
    public T orNull() {
      return value;
    }
  }

  record Absent<T>() implements Section<T> {

    private static final Absent<?> INSTANCE = new Absent<>();

    @Override
    public boolean isPresent() {
      return false;
    }

    @Override
    public T orNull() {
      return null;
    }
  }
}
