/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps vendor axis names to NIfTI-MRS dimension tags and applies user
 * overrides to the resulting order.
 */
public final class DimensionResolver {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(DimensionResolver.class);

  private final VendorRevision revision;

  /** Unknown axis name to DIM_USER_n tag, in first-seen order. */
  private final Map<String, String> unknownTags =
    new LinkedHashMap<String, String>();

  private DimensionResolver(VendorRevision revision) {
    this.revision = revision;
  }

  /**
   * Resolve the dimension plan of one acquisition.
   *
   * @param axisNames vendor names of every axis of the raw array;
   *                  the first must be the time axis
   * @param revision vendor revision selecting the default tags
   * @param overrides user requested axis order and tag changes
   * @return resolved plan covering every axis except the time axis
   * @throws MalformedInputException if axis 0 is not the time axis or an
   *         axis name is repeated
   * @throws OverrideConflictException if the overrides cannot be applied
   */
  public static DimensionPlan resolve(List<String> axisNames,
    VendorRevision revision, DimensionOverrides overrides)
  {
    return new DimensionResolver(revision).plan(axisNames, overrides);
  }

  private DimensionPlan plan(List<String> axisNames,
    DimensionOverrides overrides)
  {
    if (axisNames.isEmpty() ||
      !VendorRevision.TIME_AXIS.equals(axisNames.get(0)))
    {
      String first = axisNames.isEmpty() ? null : axisNames.get(0);
      throw new MalformedInputException(first,
        VendorRevision.TIME_AXIS +
        " is expected to be the first dimension, found " + first);
    }

    List<String> order = new ArrayList<String>();
    List<String> tags = new ArrayList<String>();
    List<Integer> sources = new ArrayList<Integer>();
    for (int i=1; i<axisNames.size(); i++) {
      String name = axisNames.get(i);
      if (order.contains(name) || VendorRevision.TIME_AXIS.equals(name)) {
        throw new MalformedInputException(name, "Repeated axis name");
      }
      order.add(name);
      tags.add(tagFor(name));
      sources.add(i);
    }

    Set<String> requested = new HashSet<String>();
    for (int pos=0; pos<DimensionOverrides.MAX_AXIS_OVERRIDES; pos++) {
      String name = overrides.getAxis(pos);
      if (name == null) {
        continue;
      }
      if (VendorRevision.TIME_AXIS.equals(name)) {
        throw new OverrideConflictException(name,
          "The time axis cannot be moved");
      }
      if (!requested.add(name)) {
        throw new OverrideConflictException(name,
          "Axis requested for more than one position");
      }
      int current = order.indexOf(name);
      if (current >= 0) {
        if (pos >= order.size()) {
          throw new OverrideConflictException(name, String.format(
            "Cannot move axis to position %d of %d", pos, order.size()));
        }
        swap(order, pos, current);
        swap(tags, pos, current);
        swap(sources, pos, current);
      }
      else {
        if (pos > order.size()) {
          throw new OverrideConflictException(name, String.format(
            "Cannot insert axis at position %d of %d", pos, order.size()));
        }
        LOGGER.info("Axis {} not present; inserting singleton at {}",
          name, pos);
        order.add(pos, name);
        tags.add(pos, tagFor(name));
        sources.add(pos, DimensionPlan.INSERTED);
      }
    }

    for (Map.Entry<Integer, String> tag : overrides.getTags().entrySet()) {
      int pos = tag.getKey();
      if (pos < 0 || pos >= tags.size()) {
        throw new OverrideConflictException(tag.getValue(), String.format(
          "Cannot set tag of position %d; only %d axes", pos, tags.size()));
      }
      tags.set(pos, tag.getValue());
    }

    int[] permutation = new int[sources.size()];
    for (int i=0; i<permutation.length; i++) {
      permutation[i] = sources.get(i);
    }
    DimensionPlan plan = new DimensionPlan(order, tags, permutation);
    LOGGER.debug("Resolved dimensions: {}", plan);
    return plan;
  }

  private String tagFor(String name) {
    String tag = revision.getDefaultTag(name);
    if (tag != null) {
      return tag;
    }
    String unknown = unknownTags.get(name);
    if (unknown == null) {
      unknown = DimensionTags.user(unknownTags.size());
      unknownTags.put(name, unknown);
      LOGGER.debug("Unknown axis {} tagged {}", name, unknown);
    }
    return unknown;
  }

  private static <T> void swap(List<T> list, int a, int b) {
    T tmp = list.get(a);
    list.set(a, list.get(b));
    list.set(b, tmp);
  }

}
