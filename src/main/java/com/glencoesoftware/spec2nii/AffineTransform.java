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
 * Immutable 4x4 affine mapping voxel indexes to scanner space (mm).
 */
public final class AffineTransform {

  private final double[][] matrix;

  /**
   * @param rows four rows of four values each; copied, with -0.0 stored
   *             as 0.0
   */
  public AffineTransform(double[][] rows) {
    if (rows.length != 4) {
      throw new IllegalArgumentException("Affine must have 4 rows");
    }
    matrix = new double[4][];
    for (int r=0; r<4; r++) {
      if (rows[r].length != 4) {
        throw new IllegalArgumentException("Affine must have 4 columns");
      }
      matrix[r] = new double[4];
      for (int c=0; c<4; c++) {
        matrix[r][c] = rows[r][c] + 0.0;
      }
    }
  }

  /**
   * @param values 16 values in row-major order
   * @return new affine
   */
  public static AffineTransform fromRowMajor(double... values) {
    if (values.length != 16) {
      throw new IllegalArgumentException(
        "Expected 16 affine values, found " + values.length);
    }
    double[][] rows = new double[4][];
    for (int r=0; r<4; r++) {
      rows[r] = Arrays.copyOfRange(values, 4 * r, 4 * r + 4);
    }
    return new AffineTransform(rows);
  }

  /**
   * @param diagonal the four diagonal values
   * @return diagonal affine with zero translation
   */
  public static AffineTransform diagonal(double... diagonal) {
    double[][] rows = new double[4][4];
    for (int i=0; i<4; i++) {
      rows[i][i] = diagonal[i];
    }
    return new AffineTransform(rows);
  }

  /**
   * @param row row index
   * @param col column index
   * @return matrix element
   */
  public double get(int row, int col) {
    return matrix[row][col];
  }

  /**
   * @param row row index
   * @return copy of the row
   */
  public double[] getRow(int row) {
    return matrix[row].clone();
  }

  /**
   * @return copy of the matrix
   */
  public double[][] toArray() {
    double[][] copy = new double[4][];
    for (int r=0; r<4; r++) {
      copy[r] = matrix[r].clone();
    }
    return copy;
  }

  /**
   * @return length of each of the three spatial columns (voxel size in mm)
   */
  public double[] getVoxelSize() {
    double[] size = new double[3];
    for (int c=0; c<3; c++) {
      size[c] = Math.sqrt(matrix[0][c] * matrix[0][c] +
        matrix[1][c] * matrix[1][c] + matrix[2][c] * matrix[2][c]);
    }
    return size;
  }

  /**
   * Negate rows 0 and 1, converting between LPS (DICOM) and RAS (NIfTI)
   * patient space.
   *
   * @return flipped copy
   */
  public AffineTransform flipXY() {
    double[][] rows = toArray();
    for (int r=0; r<2; r++) {
      for (int c=0; c<4; c++) {
        rows[r][c] = 0.0 - rows[r][c];
      }
    }
    return new AffineTransform(rows);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AffineTransform)) {
      return false;
    }
    return Arrays.deepEquals(matrix, ((AffineTransform) o).matrix);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(matrix);
  }

  @Override
  public String toString() {
    return Arrays.deepToString(matrix);
  }

}
