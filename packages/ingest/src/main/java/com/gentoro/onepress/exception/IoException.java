package com.gentoro.onepress.exception;

import java.util.Map;

/** Filesystem access failed (listing, reading, stat). */
public class IoException extends OnePressException {
  public IoException(String message) {
    super(OnePressErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(OnePressErrorCode.IO_ERROR, message, cause);
  }

  public IoException(String message, Map<String, ?> context) {
    super(OnePressErrorCode.IO_ERROR, message, context);
  }

  public IoException(String message, Map<String, ?> context, Throwable cause) {
    super(OnePressErrorCode.IO_ERROR, message, context, cause);
  }
}
