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
 * Immutable n-dimensional array of complex doubles.
 * <p>
 * Values are stored in row-major order (last index varies fastest) with
 * real and imaginary parts interleaved, so the backing array holds twice
 * as many doubles as there are elements.
 */
public final class ComplexArray {

  private final int[] shape;
  private final double[] data;

  /**
   * Create a zero-filled array.
   *
   * @param shape axis lengths, each at least 1
   */
  public ComplexArray(int... shape) {
    this(shape, new double[2 * count(shape)]);
  }

  /**
   * Create an array from interleaved real/imaginary values.
   *
   * @param shape axis lengths, each at least 1
   * @param interleaved real/imaginary pairs in row-major order;
   *                    the array is copied
   */
  public ComplexArray(int[] shape, double[] interleaved) {
    if (shape.length == 0) {
      throw new IllegalArgumentException("Array must have at least one axis");
    }
    if (interleaved.length != 2 * count(shape)) {
      throw new IllegalArgumentException(String.format(
        "Expected %d values for shape %s, found %d",
        2 * count(shape), Arrays.toString(shape), interleaved.length));
    }
    this.shape = shape.clone();
    this.data = interleaved.clone();
  }

  /**
   * Create a one-dimensional array from separate real and imaginary parts.
   *
   * @param real real parts
   * @param imaginary imaginary parts, same length as real
   * @return new array of shape [real.length]
   */
  public static ComplexArray of(double[] real, double[] imaginary) {
    if (real.length != imaginary.length) {
      throw new IllegalArgumentException(
        "Real and imaginary parts differ in length");
    }
    double[] interleaved = new double[2 * real.length];
    for (int i=0; i<real.length; i++) {
      interleaved[2 * i] = real[i];
      interleaved[2 * i + 1] = imaginary[i];
    }
    return new ComplexArray(new int[] {real.length}, interleaved);
  }

  private static int count(int[] shape) {
    long total = 1;
    for (int len : shape) {
      if (len < 1) {
        throw new IllegalArgumentException(
          "Invalid axis length in shape " + Arrays.toString(shape));
      }
      total *= len;
    }
    if (total > Integer.MAX_VALUE / 2) {
      throw new IllegalArgumentException(
        "Array too large: " + Arrays.toString(shape));
    }
    return (int) total;
  }

  /**
   * @return number of axes
   */
  public int getRank() {
    return shape.length;
  }

  /**
   * @return copy of the axis lengths
   */
  public int[] getShape() {
    return shape.clone();
  }

  /**
   * @param axis axis index
   * @return length of the given axis
   */
  public int getLength(int axis) {
    return shape[axis];
  }

  /**
   * @return total number of complex elements
   */
  public int getSize() {
    return data.length / 2;
  }

  /**
   * @param index one index per axis
   * @return real part at the given position
   */
  public double getReal(int... index) {
    return data[2 * offset(index)];
  }

  /**
   * @param index one index per axis
   * @return imaginary part at the given position
   */
  public double getImaginary(int... index) {
    return data[2 * offset(index) + 1];
  }

  /**
   * @param flat row-major element index
   * @return real part of the element
   */
  public double getRealAt(int flat) {
    return data[2 * flat];
  }

  /**
   * @param flat row-major element index
   * @return imaginary part of the element
   */
  public double getImaginaryAt(int flat) {
    return data[2 * flat + 1];
  }

  private int offset(int[] index) {
    if (index.length != shape.length) {
      throw new IllegalArgumentException(String.format(
        "Expected %d indexes, found %d", shape.length, index.length));
    }
    int offset = 0;
    for (int i=0; i<shape.length; i++) {
      if (index[i] < 0 || index[i] >= shape[i]) {
        throw new IndexOutOfBoundsException(String.format(
          "Index %d out of range for axis %d of length %d",
          index[i], i, shape[i]));
      }
      offset = offset * shape[i] + index[i];
    }
    return offset;
  }

  /**
   * @return copy of the interleaved real/imaginary values
   */
  public double[] toInterleaved() {
    return data.clone();
  }

  /**
   * Return a view of the same values with a different shape.
   *
   * @param newShape axis lengths with the same element count
   * @return reshaped array
   */
  public ComplexArray reshape(int... newShape) {
    if (count(newShape) != getSize()) {
      throw new IllegalArgumentException(String.format(
        "Cannot reshape %s to %s", Arrays.toString(shape),
        Arrays.toString(newShape)));
    }
    return new ComplexArray(newShape, data);
  }

  /**
   * Prepend singleton axes.
   *
   * @param count number of singleton axes to add in front
   * @return padded array
   */
  public ComplexArray padLeading(int count) {
    int[] newShape = new int[shape.length + count];
    Arrays.fill(newShape, 0, count, 1);
    System.arraycopy(shape, 0, newShape, count, shape.length);
    return reshape(newShape);
  }

  /**
   * Insert a singleton axis.
   *
   * @param position index of the new axis in the result
   * @return array with one more axis
   */
  public ComplexArray insertAxis(int position) {
    if (position < 0 || position > shape.length) {
      throw new IndexOutOfBoundsException("Invalid axis position " + position);
    }
    int[] newShape = new int[shape.length + 1];
    System.arraycopy(shape, 0, newShape, 0, position);
    newShape[position] = 1;
    System.arraycopy(shape, position, newShape, position + 1,
      shape.length - position);
    return reshape(newShape);
  }

  /**
   * Reorder axes.  Axis i of the result is axis order[i] of this array.
   *
   * @param order permutation of 0..rank-1
   * @return permuted array
   */
  public ComplexArray permute(int... order) {
    if (order.length != shape.length) {
      throw new IllegalArgumentException(
        "Permutation " + Arrays.toString(order) + " does not match rank " +
        shape.length);
    }
    boolean[] seen = new boolean[shape.length];
    boolean identity = true;
    int[] newShape = new int[shape.length];
    for (int i=0; i<order.length; i++) {
      if (order[i] < 0 || order[i] >= shape.length || seen[order[i]]) {
        throw new IllegalArgumentException(
          "Invalid permutation " + Arrays.toString(order));
      }
      seen[order[i]] = true;
      identity &= order[i] == i;
      newShape[i] = shape[order[i]];
    }
    if (identity) {
      return this;
    }

    int[] strides = strides(shape);
    double[] result = new double[data.length];
    int[] index = new int[shape.length];
    for (int flat=0; flat<getSize(); flat++) {
      int source = 0;
      for (int i=0; i<index.length; i++) {
        source += index[i] * strides[order[i]];
      }
      result[2 * flat] = data[2 * source];
      result[2 * flat + 1] = data[2 * source + 1];
      increment(index, newShape);
    }
    return new ComplexArray(newShape, result);
  }

  /**
   * Fix the trailing axes at the given indexes, keeping the leading ones.
   *
   * @param fixed one index for each axis from rank - fixed.length onwards
   * @return array of rank - fixed.length axes
   */
  public ComplexArray sliceTrailing(int... fixed) {
    int keep = shape.length - fixed.length;
    if (keep < 1) {
      throw new IllegalArgumentException("Cannot fix all axes");
    }
    int[] newShape = Arrays.copyOf(shape, keep);
    int block = count(newShape);
    int trailing = getSize() / block;
    int offset = 0;
    for (int i=0; i<fixed.length; i++) {
      int len = shape[keep + i];
      if (fixed[i] < 0 || fixed[i] >= len) {
        throw new IndexOutOfBoundsException(String.format(
          "Index %d out of range for axis %d of length %d",
          fixed[i], keep + i, len));
      }
      offset = offset * len + fixed[i];
    }
    // fixed axes vary fastest, so the kept elements are strided
    double[] result = new double[2 * block];
    for (int k=0; k<block; k++) {
      int source = k * trailing + offset;
      result[2 * k] = data[2 * source];
      result[2 * k + 1] = data[2 * source + 1];
    }
    return new ComplexArray(newShape, result);
  }

  /**
   * @return complex conjugate of every element
   */
  public ComplexArray conjugate() {
    double[] result = data.clone();
    for (int i=1; i<result.length; i+=2) {
      result[i] = -result[i];
    }
    return new ComplexArray(shape, result);
  }

  private static int[] strides(int[] shape) {
    int[] strides = new int[shape.length];
    int stride = 1;
    for (int i=shape.length - 1; i>=0; i--) {
      strides[i] = stride;
      stride *= shape[i];
    }
    return strides;
  }

  /**
   * Advance a row-major index in place.
   *
   * @param index current index, updated
   * @param shape axis lengths
   * @return false once the index wraps back to all zeros
   */
  static boolean increment(int[] index, int[] shape) {
    for (int i=index.length - 1; i>=0; i--) {
      index[i]++;
      if (index[i] < shape[i]) {
        return true;
      }
      index[i] = 0;
    }
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ComplexArray)) {
      return false;
    }
    ComplexArray other = (ComplexArray) o;
    return Arrays.equals(shape, other.shape) && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "ComplexArray" + Arrays.toString(shape);
  }

}
