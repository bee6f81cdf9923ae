package com.gentoro.onepress.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends OnePressException {
  public SerializationException(String message, Throwable cause) {
    super(OnePressErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
