package com.gentoro.onepress.exception;

/** Operation invoked while the component is in the wrong lifecycle state. */
public class StateException extends OnePressException {
  public StateException(String message) {
    super(OnePressErrorCode.FAILED_PRECONDITION, message);
  }
}
