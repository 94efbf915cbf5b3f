/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import com.google.common.math.DoubleMath;

/**
 * Main orientation of a slice, as determined from its normal vector.
 */
public enum SliceOrientation {
  TRANSVERSE,
  CORONAL,
  SAGITTAL;

  /** Tolerance used when comparing normal vector components. */
  private static final double TOLERANCE = 1e-4;

  /**
   * Find the dominant component of a normal vector.
   * When components are (almost) equal, transverse wins over coronal
   * and coronal wins over sagittal.
   *
   * @param sag sagittal component
   * @param cor coronal component
   * @param tra transverse component
   * @return the main orientation
   */
  public static SliceOrientation classify(double sag, double cor, double tra)
  {
    double absSag = Math.abs(sag);
    double absCor = Math.abs(cor);
    double absTra = Math.abs(tra);
    if (atLeast(absTra, absSag) && atLeast(absTra, absCor)) {
      return TRANSVERSE;
    }
    if (atLeast(absCor, absSag)) {
      return CORONAL;
    }
    return SAGITTAL;
  }

  private static boolean atLeast(double a, double b) {
    return a > b || DoubleMath.fuzzyEquals(a, b, TOLERANCE);
  }

}
