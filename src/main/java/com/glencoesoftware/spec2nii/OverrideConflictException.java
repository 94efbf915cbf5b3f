/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

/**
 * A user supplied dimension override cannot be applied unambiguously
 * to the current axis order.
 */
public class OverrideConflictException extends ConversionException {

  /**
   * @param field offending header field or axis name
   * @param message description of the problem
   */
  public OverrideConflictException(String field, String message) {
    super(field, message);
  }

}
