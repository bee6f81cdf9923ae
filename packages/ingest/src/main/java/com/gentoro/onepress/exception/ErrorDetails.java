package com.gentoro.onepress.exception;

import java.util.List;
import java.util.Map;

/**
 * What the command line reports about a failed run.
 *
 * @param type simple name of the exception class.
 * @param code error code; {@link OnePressErrorCode#UNKNOWN} for errors raised outside the pipeline.
 * @param message exception message, never {@code null}.
 * @param location file or directory the failure is about, or {@code null} when it concerns no
 *     single path (bad settings, for example).
 * @param context remaining context entries.
 */
public record ErrorDetails(
    String type,
    OnePressErrorCode code,
    String message,
    String location,
    Map<String, Object> context) {

  /** Context keys that name the path a failure is about, in lookup order. */
  static final List<String> LOCATION_KEYS = List.of("file", "path");

  public boolean hasLocation() {
    return location != null;
  }
}
