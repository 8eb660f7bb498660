package com.obsidiandynamics.choicetree.util;

import java.util.function.*;

public final class Assert {
  private Assert() {}

  public static void that(boolean condition) {
    that(condition, () -> "");
  }

  public static Supplier<String> withMessage(String message) {
    return () -> message;
  }

  public static void isNotNull(Object obj, Supplier<String> messageBuilder) {
    that(obj != null, AssertionError::new, messageBuilder);
  }

  public static void that(boolean condition, Supplier<String> messageBuilder) {
    that(condition, AssertionError::new, messageBuilder);
  }

  /**
   *  Verifies a caller-supplied argument, raising an {@link IllegalArgumentException} on failure.
   *
   *  @param condition The condition that must hold.
   *  @param messageBuilder Builds the failure message; only invoked if the condition fails.
   */
  public static void argument(boolean condition, Supplier<String> messageBuilder) {
    that(condition, IllegalArgumentException::new, messageBuilder);
  }

  public static <X extends Throwable> void that(boolean condition, Function<String, X> errorMaker, Supplier<String> messageBuilder) throws X {
    if (! condition) {
      throw errorMaker.apply(messageBuilder.get());
    }
  }
}
