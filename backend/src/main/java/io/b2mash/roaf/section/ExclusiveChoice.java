package io.b2mash.roaf.section;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Two output fields governed by one flag, of which exactly one is populated: the {@code whenTrue}
 * side when the flag is set, the {@code whenFalse} side otherwise. Both sides are decided by the
 * same {@link #select} call.
 *
 * @param <A> value populated when the flag is true
 * @param <B> value populated when the flag is false
 */
public sealed interface ExclusiveChoice<A, B>
    permits ExclusiveChoice.WhenTrue, ExclusiveChoice.WhenFalse {

  static <A, B> ExclusiveChoice<A, B> select(
      boolean flag, Supplier<? extends A> whenTrue, Supplier<? extends B> whenFalse) {
    if (flag) {
      return new WhenTrue<>(whenTrue.get());
    }
    return new WhenFalse<>(whenFalse.get());
  }

  /** The governing flag. */
  boolean flag();

  A whenTrueOrNull();

  B whenFalseOrNull();

  record WhenTrue<A, B>(A value) implements ExclusiveChoice<A, B> {

    public WhenTrue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean flag() {
      return true;
    }

    @Override
    public A whenTrueOrNull() {
      return value;
    }

    @Override
    public B whenFalseOrNull() {
      return null;
    }
  }

  record WhenFalse<A, B>(B value) implements ExclusiveChoice<A, B> {

    public WhenFalse {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean flag() {
      return false;
    }

    @Override
    public A whenTrueOrNull() {
      return null;
    }

    @Override
    public B whenFalseOrNull() {
      return value;
    }
  }
}
