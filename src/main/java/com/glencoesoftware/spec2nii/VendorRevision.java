/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Vendor software revisions, each selecting a default mapping from vendor
 * axis name to dimension tag.
 * <p>
 * Siemens VB stores spatial x, y, z as Lin, Phs, Seg and uses Set as the
 * repetition direction; VD/VE uses Lin, Par, Seg and Ave.  Some CMRR
 * sequences on VE still follow the VB layout, so both map Set and Rep.
 */
public enum VendorRevision {
  vb(ImmutableMap.<String, String>builder()
    .put("Col", DimensionTags.TIME)
    .put("Lin", "x")
    .put("Phs", "y")
    .put("Seg", "z")
    .put("Cha", DimensionTags.COIL)
    .put("Set", DimensionTags.DYN)
    .put("Rep", DimensionTags.DYN)
    .build()),
  vd(ImmutableMap.<String, String>builder()
    .put("Col", DimensionTags.TIME)
    .put("Lin", "x")
    .put("Par", "y")
    .put("Seg", "z")
    .put("Cha", DimensionTags.COIL)
    .put("Ave", DimensionTags.DYN)
    .put("Set", DimensionTags.DYN)
    .put("Rep", DimensionTags.DYN)
    .put("Eco", DimensionTags.EDIT)
    .build());

  /** Vendor name of the time/frequency axis, always axis 0. */
  public static final String TIME_AXIS = "Col";

  private final Map<String, String> defaultTags;

  private VendorRevision(Map<String, String> defaultTags) {
    this.defaultTags = defaultTags;
  }

  /**
   * @param axisName vendor axis name
   * @return default tag for the axis, or null if the name is unknown
   */
  public String getDefaultTag(String axisName) {
    return defaultTags.get(axisName);
  }

  /**
   * Look up a revision from a vendor software version string, such as
   * "vb", "VB17A" or "vd13".  VE software shares the VD layout.
   *
   * @param version software version string
   * @return matching revision
   * @throws MalformedInputException if no revision matches
   */
  public static VendorRevision fromVersion(String version) {
    if (version != null) {
      String prefix = version.trim().toLowerCase();
      if (prefix.startsWith("vb")) {
        return vb;
      }
      if (prefix.startsWith("vd") || prefix.startsWith("ve")) {
        return vd;
      }
    }
    throw new MalformedInputException("softwareVersion",
      "Unsupported software revision: " + version);
  }
}
