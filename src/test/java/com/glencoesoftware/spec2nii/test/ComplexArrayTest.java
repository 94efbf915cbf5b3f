/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii.test;

import com.glencoesoftware.spec2nii.ComplexArray;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class ComplexArrayTest {

  private static ComplexArray sample() {
    double[] re = new double[24];
    double[] im = new double[24];
    for (int i=0; i<re.length; i++) {
      re[i] = i;
      im[i] = 100 + i;
    }
    return ComplexArray.of(re, im).reshape(2, 3, 4);
  }

  @Test
  public void testIndexing() {
    ComplexArray a = sample();
    assertEquals(3, a.getRank());
    assertEquals(24, a.getSize());
    assertEquals(4, a.getLength(2));
    assertEquals(1 * 12 + 2 * 4 + 3, a.getReal(1, 2, 3));
    assertEquals(100 + 1 * 12 + 2 * 4 + 3, a.getImaginary(1, 2, 3));
  }

  @Test
  public void testPermute() {
    ComplexArray a = sample();
    ComplexArray p = a.permute(2, 0, 1);
    assertArrayEquals(new int[] {4, 2, 3}, p.getShape());
    for (int i=0; i<2; i++) {
      for (int j=0; j<3; j++) {
        for (int k=0; k<4; k++) {
          assertEquals(a.getReal(i, j, k), p.getReal(k, i, j));
          assertEquals(a.getImaginary(i, j, k), p.getImaginary(k, i, j));
        }
      }
    }
    assertSame(a, a.permute(0, 1, 2));
    assertThrows(IllegalArgumentException.class, () -> a.permute(0, 0, 1));
  }

  @Test
  public void testSingletonAxes() {
    ComplexArray a = sample();
    assertArrayEquals(new int[] {1, 1, 1, 2, 3, 4},
      a.padLeading(3).getShape());
    assertArrayEquals(new int[] {2, 3, 1, 4}, a.insertAxis(2).getShape());
    assertArrayEquals(new int[] {2, 3, 4, 1}, a.insertAxis(3).getShape());
    assertEquals(a.getReal(1, 2, 3), a.insertAxis(2).getReal(1, 2, 0, 3));
  }

  @Test
  public void testSliceTrailing() {
    ComplexArray a = sample();
    ComplexArray s = a.sliceTrailing(2);
    assertArrayEquals(new int[] {2, 3}, s.getShape());
    assertEquals(a.getReal(1, 1, 2), s.getReal(1, 1));

    ComplexArray t = a.sliceTrailing(1, 3);
    assertArrayEquals(new int[] {2}, t.getShape());
    assertEquals(a.getImaginary(1, 1, 3), t.getImaginary(1));
    assertThrows(IndexOutOfBoundsException.class, () -> a.sliceTrailing(4));
  }

  /**
   * Every slice over the trailing axes holds the elements with those
   * trailing indexes.
   */
  @Test
  public void testSliceTrailingAllIndexes() {
    ComplexArray a = sample().reshape(2, 2, 2, 3);
    for (int j=0; j<2; j++) {
      for (int k=0; k<3; k++) {
        ComplexArray s = a.sliceTrailing(j, k);
        assertArrayEquals(new int[] {2, 2}, s.getShape());
        for (int x=0; x<2; x++) {
          for (int y=0; y<2; y++) {
            assertEquals(a.getReal(x, y, j, k), s.getReal(x, y));
            assertEquals(a.getImaginary(x, y, j, k), s.getImaginary(x, y));
          }
        }
      }
    }
  }

  @Test
  public void testConjugate() {
    ComplexArray a = sample();
    ComplexArray c = a.conjugate();
    assertEquals(a.getReal(0, 1, 2), c.getReal(0, 1, 2));
    assertEquals(-a.getImaginary(0, 1, 2), c.getImaginary(0, 1, 2));
    assertEquals(a, c.conjugate());
  }

}
