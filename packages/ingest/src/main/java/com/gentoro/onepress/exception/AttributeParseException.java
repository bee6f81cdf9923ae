package com.gentoro.onepress.exception;

import java.util.Map;

/**
 * Malformed attribute document, either a sidecar {@code .meta} file or a frontmatter block. The
 * offending file is available as {@link #getFile()} and under the {@code file} context key.
 */
public class AttributeParseException extends OnePressException {
  private final String file;

  public AttributeParseException(String file, String message) {
    super(OnePressErrorCode.ATTRIBUTE_PARSE_ERROR, message, Map.of("file", file));
    this.file = file;
  }

  public AttributeParseException(String file, String message, Throwable cause) {
    super(OnePressErrorCode.ATTRIBUTE_PARSE_ERROR, message, Map.of("file", file), cause);
    this.file = file;
  }

  public String getFile() {
    return file;
  }
}
