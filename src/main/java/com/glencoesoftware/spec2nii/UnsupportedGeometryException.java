/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

/**
 * Geometry fields describe a volume that cannot be turned into an affine,
 * e.g. a zero-length slice normal or a non-positive field of view.
 */
public class UnsupportedGeometryException extends ConversionException {

  /**
   * @param field offending header field or axis name
   * @param message description of the problem
   */
  public UnsupportedGeometryException(String field, String message) {
    super(field, message);
  }

}
