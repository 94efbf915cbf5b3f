/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

/**
 * A standard header extension key was given a value of the wrong type,
 * or a user-defined key collides with a standard key.
 */
public class SchemaViolationException extends ConversionException {

  /**
   * @param field offending header field or axis name
   * @param message description of the problem
   */
  public SchemaViolationException(String field, String message) {
    super(field, message);
  }

}
