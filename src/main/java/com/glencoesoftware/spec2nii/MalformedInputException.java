/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

/**
 * A required header field is missing, or the acquisition does not follow
 * the expected axis convention (axis 0 must be the time axis).
 */
public class MalformedInputException extends ConversionException {

  /**
   * @param field offending header field or axis name
   * @param message description of the problem
   */
  public MalformedInputException(String field, String message) {
    super(field, message);
  }

  /**
   * @param field offending header field or axis name
   * @param message description of the problem
   * @param cause underlying parse error
   */
  public MalformedInputException(String field, String message,
    Throwable cause)
  {
    super(field, message, cause);
  }

}
