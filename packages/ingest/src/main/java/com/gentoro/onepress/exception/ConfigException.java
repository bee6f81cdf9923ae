package com.gentoro.onepress.exception;

import java.util.Map;

/** Invalid or missing ingestion parameter. Raised before any file is touched. */
public class ConfigException extends OnePressException {
  public ConfigException(String message) {
    super(OnePressErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Map<String, ?> context) {
    super(OnePressErrorCode.CONFIGURATION_ERROR, message, context);
  }

  public ConfigException(String message, Throwable cause) {
    super(OnePressErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
