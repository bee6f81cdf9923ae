package com.gentoro.onepress;

import com.gentoro.onepress.exception.ErrorDetails;
import com.gentoro.onepress.exception.ExceptionUtil;
import com.gentoro.onepress.exception.OnePressException;

public class OnePressApp {

  private static final org.slf4j.Logger log =
      com.gentoro.onepress.logging.LoggingService.getLogger(OnePressApp.class);

  public static void main(String[] args) {
    try {
      new OnePress(args).run();
    } catch (OnePressException e) {
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      if (details.hasLocation()) {
        log.error(
            "Ingestion failed [{}] at {}: {}",
            details.code(),
            details.location(),
            details.message(),
            e);
      } else {
        log.error(
            "Ingestion failed [{}]: {} {}",
            details.code(),
            details.message(),
            details.context(),
            e);
      }
      System.exit(1);
    } catch (Exception e) {
      log.error("Application failed", e);
      System.exit(2);
    }
  }
}
