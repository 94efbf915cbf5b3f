/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import java.util.Arrays;

/**
 * One NIfTI-MRS image ready to be written: data shaped
 * [x, y, z, time, dim5, dim6, dim7] (trailing dimensions optional),
 * affine, dwell time and header extension.
 */
public final class OutputContainer {

  /** Minimum number of dimensions: three spatial plus time. */
  public static final int MIN_RANK = 4;

  /** Maximum number of dimensions supported by NIfTI. */
  public static final int MAX_RANK = 7;

  private final String name;
  private final ComplexArray data;
  private final AffineTransform affine;
  private final double dwellTime;
  private final HeaderExtension header;

  /**
   * @param name output identifier, used as the file base name
   * @param data array of rank 4 to 7
   * @param affine voxel to scanner transform
   * @param dwellTime dwell time in seconds
   * @param header header extension
   */
  public OutputContainer(String name, ComplexArray data,
    AffineTransform affine, double dwellTime, HeaderExtension header)
  {
    if (data.getRank() < MIN_RANK || data.getRank() > MAX_RANK) {
      throw new IllegalArgumentException(String.format(
        "Expected %d to %d dimensions, found %s", MIN_RANK, MAX_RANK,
        Arrays.toString(data.getShape())));
    }
    if (header.getDimTagCount() != data.getRank() - MIN_RANK) {
      throw new IllegalArgumentException(String.format(
        "%d dimension tags do not match shape %s", header.getDimTagCount(),
        Arrays.toString(data.getShape())));
    }
    this.name = name;
    this.data = data;
    this.affine = affine;
    this.dwellTime = dwellTime;
    this.header = header;
  }

  public String getName() {
    return name;
  }

  public ComplexArray getData() {
    return data;
  }

  public AffineTransform getAffine() {
    return affine;
  }

  public double getDwellTime() {
    return dwellTime;
  }

  public HeaderExtension getHeader() {
    return header;
  }

  /**
   * @return copy of the data shape
   */
  public int[] getShape() {
    return data.getShape();
  }

  @Override
  public String toString() {
    return name + " " + Arrays.toString(data.getShape());
  }

}
