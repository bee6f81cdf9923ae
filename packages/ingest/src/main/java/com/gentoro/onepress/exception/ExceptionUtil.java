package com.gentoro.onepress.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. If the throwable is a {@link
   * OnePressException}, its code is kept and its {@code file} or {@code path} context entry
   * becomes the location.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof OnePressException ex) {
      Map<String, Object> context = new LinkedHashMap<>(ex.getContext());
      String location = null;
      for (String key : ErrorDetails.LOCATION_KEYS) {
        Object value = context.remove(key);
        if (location == null && value != null) {
          location = value.toString();
        }
      }
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          ex.getCode(),
          safeMessage(ex.getMessage()),
          location,
          Collections.unmodifiableMap(context));
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        OnePressErrorCode.UNKNOWN,
        safeMessage(t.getMessage()),
        null,
        Map.of());
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  /**
   * Returns {@code t} unchanged when it already is a {@link OnePressException}, otherwise wraps it
   * with {@code supplier}. Meant for {@code throw ExceptionUtil.rethrowIfUnchecked(e, ...)}.
   */
  public static OnePressException rethrowIfUnchecked(
      Throwable t, Function<Throwable, OnePressException> supplier) {
    if (t instanceof OnePressException ex) {
      return ex;
    }
    return supplier.apply(t);
  }
}
