/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

/**
 * Base class for all errors that abort the conversion of one acquisition.
 * The offending header field or axis name is always recorded; the source
 * file is attached by whichever component first knows it.
 */
public class ConversionException extends RuntimeException {

  private final String field;
  private String source;

  /**
   * @param field offending header field or axis name, may be null
   * @param message description of the problem
   */
  public ConversionException(String field, String message) {
    super(message);
    this.field = field;
  }

  /**
   * @param field offending header field or axis name, may be null
   * @param message description of the problem
   * @param cause underlying exception
   */
  public ConversionException(String field, String message, Throwable cause) {
    super(message, cause);
    this.field = field;
  }

  /**
   * @return offending header field or axis name, or null
   */
  public String getField() {
    return field;
  }

  /**
   * @return name of the file being converted, or null if not yet known
   */
  public String getSource() {
    return source;
  }

  /**
   * Record the file being converted.  Only the first call has any effect.
   *
   * @param fileName name of the file being converted
   * @return this exception, for rethrowing
   */
  public ConversionException attachSource(String fileName) {
    if (source == null) {
      source = fileName;
    }
    return this;
  }

  @Override
  public String getMessage() {
    StringBuilder sb = new StringBuilder();
    if (source != null) {
      sb.append(source).append(": ");
    }
    if (field != null) {
      sb.append("[").append(field).append("] ");
    }
    sb.append(super.getMessage());
    return sb.toString();
  }

}
