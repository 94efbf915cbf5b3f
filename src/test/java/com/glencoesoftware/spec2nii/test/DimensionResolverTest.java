/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii.test;

import java.util.Arrays;
import java.util.List;

import com.glencoesoftware.spec2nii.ComplexArray;
import com.glencoesoftware.spec2nii.DimensionOverrides;
import com.glencoesoftware.spec2nii.DimensionPlan;
import com.glencoesoftware.spec2nii.DimensionResolver;
import com.glencoesoftware.spec2nii.DimensionTags;
import com.glencoesoftware.spec2nii.MalformedInputException;
import com.glencoesoftware.spec2nii.OverrideConflictException;
import com.glencoesoftware.spec2nii.VendorRevision;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DimensionResolverTest {

  /**
   * Set logging to warn before all methods.
   */
  @BeforeEach
  public void setup() {
    ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
      LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.WARN);
  }

  private static DimensionPlan resolve(VendorRevision revision,
    DimensionOverrides overrides, String... names)
  {
    return DimensionResolver.resolve(Arrays.asList(names), revision,
      overrides);
  }

  /**
   * Known axes take the default tags of the revision.
   */
  @Test
  public void testDefaultTags() {
    DimensionPlan plan = resolve(VendorRevision.vd,
      DimensionOverrides.none(), "Col", "Cha", "Set");
    assertEquals(Arrays.asList("Cha", "Set"), plan.getAxisNames());
    assertEquals(Arrays.asList(DimensionTags.COIL, DimensionTags.DYN),
      plan.getTags());
    assertArrayEquals(new int[] {1, 2}, plan.getPermutation());
  }

  /**
   * Moving an axis to the front swaps it with the occupant, tags and all.
   */
  @Test
  public void testSwap() {
    DimensionPlan plan = resolve(VendorRevision.vd,
      DimensionOverrides.none().withAxis(0, "Set"), "Col", "Cha", "Set");
    assertEquals(Arrays.asList("Set", "Cha"), plan.getAxisNames());
    assertEquals(Arrays.asList(DimensionTags.DYN, DimensionTags.COIL),
      plan.getTags());
    assertArrayEquals(new int[] {2, 1}, plan.getPermutation());
  }

  /**
   * The reordered array follows the plan.
   */
  @Test
  public void testApply() {
    ComplexArray raw = new ComplexArray(4, 2, 3);
    DimensionPlan plan = resolve(VendorRevision.vd,
      DimensionOverrides.none().withAxis(0, "Set"), "Col", "Cha", "Set");
    ComplexArray reordered = plan.apply(raw);
    assertArrayEquals(new int[] {4, 3, 2}, reordered.getShape());
  }

  /**
   * Unknown axes are counted in first-seen order.
   */
  @Test
  public void testUnknownAxes() {
    DimensionPlan plan = resolve(VendorRevision.vb,
      DimensionOverrides.none(), "Col", "Ida", "Cha", "Idb", "Ide");
    assertEquals(Arrays.asList(DimensionTags.user(0), DimensionTags.COIL,
      DimensionTags.user(1), DimensionTags.user(2)), plan.getTags());
    assertEquals("DIM_USER_0", plan.getTags().get(0));
  }

  /**
   * Revisions disagree about Ave and Eco.
   */
  @Test
  public void testRevisionTables() {
    List<String> vb = resolve(VendorRevision.vb, DimensionOverrides.none(),
      "Col", "Ave", "Eco").getTags();
    List<String> vd = resolve(VendorRevision.vd, DimensionOverrides.none(),
      "Col", "Ave", "Eco").getTags();
    assertEquals(Arrays.asList("DIM_USER_0", "DIM_USER_1"), vb);
    assertEquals(Arrays.asList(DimensionTags.DYN, DimensionTags.EDIT), vd);
    assertEquals(VendorRevision.vd, VendorRevision.fromVersion("VE11C"));
    assertEquals(VendorRevision.vb, VendorRevision.fromVersion("vb17"));
    assertThrows(MalformedInputException.class,
      () -> VendorRevision.fromVersion("xa20"));
  }

  /**
   * An override naming an absent axis inserts a singleton axis.
   */
  @Test
  public void testInsertAbsentAxis() {
    DimensionPlan plan = resolve(VendorRevision.vd,
      DimensionOverrides.none().withAxis(1, "Rep"), "Col", "Cha", "Set");
    assertEquals(Arrays.asList("Cha", "Rep", "Set"), plan.getAxisNames());
    assertEquals(Arrays.asList(DimensionTags.COIL, DimensionTags.DYN,
      DimensionTags.DYN), plan.getTags());
    assertArrayEquals(new int[] {1, DimensionPlan.INSERTED, 2},
      plan.getPermutation());

    ComplexArray reordered = plan.apply(new ComplexArray(8, 2, 3));
    assertArrayEquals(new int[] {8, 2, 1, 3}, reordered.getShape());

    DimensionPlan unknown = resolve(VendorRevision.vd,
      DimensionOverrides.none().withAxis(0, "Foo"), "Col", "Cha");
    assertEquals(Arrays.asList("DIM_USER_0", DimensionTags.COIL),
      unknown.getTags());
  }

  /**
   * Explicit tags are applied after reordering.
   */
  @Test
  public void testTagOverride() {
    DimensionPlan plan = resolve(VendorRevision.vd,
      DimensionOverrides.none().withAxis(0, "Set")
        .withTag(1, DimensionTags.MEAS),
      "Col", "Cha", "Set");
    assertEquals(Arrays.asList(DimensionTags.DYN, DimensionTags.MEAS),
      plan.getTags());
  }

  /**
   * Conflicting overrides are rejected.
   */
  @Test
  public void testConflicts() {
    assertThrows(OverrideConflictException.class, () -> resolve(
      VendorRevision.vd, DimensionOverrides.none().withAxis(0, "Col"),
      "Col", "Cha"));
    assertThrows(OverrideConflictException.class, () -> resolve(
      VendorRevision.vd,
      DimensionOverrides.none().withAxis(0, "Set").withAxis(1, "Set"),
      "Col", "Cha", "Set"));
    assertThrows(OverrideConflictException.class, () -> resolve(
      VendorRevision.vd, DimensionOverrides.none().withTag(2, "DIM_DYN"),
      "Col", "Cha"));
    assertThrows(OverrideConflictException.class,
      () -> DimensionOverrides.none().withAxis(3, "Cha"));
  }

  /**
   * The first axis must be the time axis.
   */
  @Test
  public void testTimeAxisFirst() {
    MalformedInputException e = assertThrows(MalformedInputException.class,
      () -> resolve(VendorRevision.vd, DimensionOverrides.none(),
        "Cha", "Col"));
    assertEquals("Cha", e.getField());
    assertThrows(MalformedInputException.class,
      () -> resolve(VendorRevision.vd, DimensionOverrides.none(),
        "Col", "Cha", "Cha"));
  }

}
