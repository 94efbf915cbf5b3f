/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resolved order and tags of all non-time axes of one acquisition.
 */
public final class DimensionPlan {

  /** Permutation entry marking an axis that is absent from the source. */
  public static final int INSERTED = -1;

  private final List<String> axisNames;
  private final List<String> tags;
  private final int[] permutation;

  /**
   * @param axisNames vendor axis names in output order
   * @param tags dimension tags in output order
   * @param permutation for each output axis, the index of the source axis
   *                    in the raw array (time axis is 0), or
   *                    {@link #INSERTED}
   */
  public DimensionPlan(List<String> axisNames, List<String> tags,
    int[] permutation)
  {
    if (axisNames.size() != tags.size() ||
      tags.size() != permutation.length)
    {
      throw new IllegalArgumentException(
        "Axis names, tags and permutation must have the same length");
    }
    this.axisNames = Collections.unmodifiableList(
      new ArrayList<String>(axisNames));
    this.tags = Collections.unmodifiableList(new ArrayList<String>(tags));
    this.permutation = permutation.clone();
  }

  /**
   * @return vendor axis names in output order
   */
  public List<String> getAxisNames() {
    return axisNames;
  }

  /**
   * @return dimension tags in output order
   */
  public List<String> getTags() {
    return tags;
  }

  /**
   * @return source axis for each output axis, see {@link #INSERTED}
   */
  public int[] getPermutation() {
    return permutation.clone();
  }

  /**
   * Reorder a raw array to match this plan.  The time axis stays first;
   * inserted axes become singletons.
   *
   * @param raw array with the time axis first and one axis per vendor name
   * @return reordered array of rank 1 + number of planned axes
   */
  public ComplexArray apply(ComplexArray raw) {
    List<Integer> order = new ArrayList<Integer>();
    order.add(0);
    for (int source : permutation) {
      if (source != INSERTED) {
        order.add(source);
      }
    }
    if (order.size() != raw.getRank()) {
      throw new IllegalArgumentException(String.format(
        "Plan covers %d axes, array has %d", order.size(), raw.getRank()));
    }
    int[] axes = new int[order.size()];
    for (int i=0; i<axes.length; i++) {
      axes[i] = order.get(i);
    }
    ComplexArray result = raw.permute(axes);
    for (int i=0; i<permutation.length; i++) {
      if (permutation[i] == INSERTED) {
        result = result.insertAxis(i + 1);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return "axes=" + axisNames + ", tags=" + tags;
  }

}
