/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * User requested changes to the default dimension order and tags.
 * Axis names may be requested for the first three non-time positions
 * (NIfTI dims 5 to 7); explicit tags may be given for any position.
 */
public final class DimensionOverrides {

  /** Number of positions that accept an axis name override. */
  public static final int MAX_AXIS_OVERRIDES = 3;

  private static final DimensionOverrides NONE =
    new DimensionOverrides(new String[MAX_AXIS_OVERRIDES],
      new TreeMap<Integer, String>());

  private final String[] axes;
  private final Map<Integer, String> tags;

  private DimensionOverrides(String[] axes, Map<Integer, String> tags) {
    this.axes = axes;
    this.tags = tags;
  }

  /**
   * @return overrides that change nothing
   */
  public static DimensionOverrides none() {
    return NONE;
  }

  /**
   * Request that a vendor axis be placed at the given position.
   *
   * @param position output position, 0 to 2
   * @param axisName vendor axis name, or null to clear the request
   * @return new overrides
   */
  public DimensionOverrides withAxis(int position, String axisName) {
    if (position < 0 || position >= MAX_AXIS_OVERRIDES) {
      throw new OverrideConflictException(axisName,
        "Axis overrides are only supported for positions 0 to " +
        (MAX_AXIS_OVERRIDES - 1) + ", found " + position);
    }
    String[] newAxes = axes.clone();
    newAxes[position] = axisName;
    return new DimensionOverrides(newAxes, tags);
  }

  /**
   * Replace the tag computed for the given position.
   *
   * @param position output position, starting at 0
   * @param tag dimension tag, or null to clear the request
   * @return new overrides
   */
  public DimensionOverrides withTag(int position, String tag) {
    TreeMap<Integer, String> newTags = new TreeMap<Integer, String>(tags);
    if (tag == null) {
      newTags.remove(position);
    }
    else {
      newTags.put(position, tag);
    }
    return new DimensionOverrides(axes, newTags);
  }

  /**
   * @param position output position, 0 to 2
   * @return requested axis name, or null
   */
  public String getAxis(int position) {
    return axes[position];
  }

  /**
   * @return explicit tags keyed by output position, in position order
   */
  public Map<Integer, String> getTags() {
    return Collections.unmodifiableMap(tags);
  }

  @Override
  public String toString() {
    return "axes=" + Arrays.toString(axes) + ", tags=" + tags;
  }

}
