/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

/**
 * Dimension tag vocabulary of the NIfTI-MRS standard.
 */
public final class DimensionTags {

  /** Pseudo-tag for the time/frequency axis; never written as dim_N. */
  public static final String TIME = "time";

  public static final String COIL = "DIM_COIL";
  public static final String DYN = "DIM_DYN";
  public static final String INDIRECT_0 = "DIM_INDIRECT_0";
  public static final String INDIRECT_1 = "DIM_INDIRECT_1";
  public static final String INDIRECT_2 = "DIM_INDIRECT_2";
  public static final String PHASE_CYCLE = "DIM_PHASE_CYCLE";
  public static final String EDIT = "DIM_EDIT";
  public static final String MEAS = "DIM_MEAS";

  /** Prefix of tags given to axes without a known meaning. */
  public static final String USER_PREFIX = "DIM_USER_";

  private DimensionTags() {
  }

  /**
   * @param counter zero-based unknown axis counter
   * @return tag for the counter-th unknown axis
   */
  public static String user(int counter) {
    return USER_PREFIX + counter;
  }

}
