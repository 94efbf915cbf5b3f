/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii.test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.glencoesoftware.spec2nii.DimensionTags;
import com.glencoesoftware.spec2nii.HeaderExtension;
import com.glencoesoftware.spec2nii.SchemaViolationException;
import com.glencoesoftware.spec2nii.StandardKey;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class HeaderExtensionTest {

  private static final Clock CLOCK =
    Clock.fixed(Instant.parse("2021-03-04T05:06:07.089Z"), ZoneOffset.UTC);

  /**
   * Set logging to warn before all methods.
   */
  @BeforeEach
  public void setup() {
    ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
      LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.WARN);
  }

  private static HeaderExtension.Builder populated() {
    return new HeaderExtension.Builder(123.2, "1H")
      .setStandard(StandardKey.ECHO_TIME, 0.03)
      .setStandard(StandardKey.REPETITION_TIME, 2)
      .setStandard(StandardKey.MANUFACTURER, "Siemens")
      .setStandard(StandardKey.WATER_SUPPRESSED, true)
      .setStandard(StandardKey.K_SPACE, Arrays.asList(false, false, false))
      .setUser("PulseSequenceFile", "%CustomerSeq%\\svs_se",
        "Sequence binary path.")
      .setUser("Averages", Arrays.asList(1, 2, 3), "Average indices.")
      .setDimInfo(0, DimensionTags.COIL)
      .setDimInfo(1, DimensionTags.DYN, "Dynamic averages")
      .setOriginalFile("/data/scans/meas_MID123.dat")
      .setClock(CLOCK);
  }

  /**
   * Serializing the parsed header gives the same text and an equal header.
   */
  @Test
  public void testRoundTrip() throws Exception {
    HeaderExtension header = populated().build();
    String json = header.toJson();
    HeaderExtension parsed = HeaderExtension.fromJson(json);
    assertEquals(header, parsed);
    assertEquals(json, parsed.toJson());
    assertEquals(header.toPrettyJson(), parsed.toPrettyJson());
  }

  /**
   * Key order is required fields, dimension tags, standard, then user keys.
   */
  @Test
  public void testKeyOrder() throws Exception {
    ObjectMapper mapper = new ObjectMapper();
    JsonNode root = mapper.readTree(populated().build().toJson());
    List<String> keys = new ArrayList<String>();
    root.fieldNames().forEachRemaining(keys::add);
    assertEquals(Arrays.asList("SpectrometerFrequency", "ResonantNucleus",
      "dim_5", "dim_6", "dim_6_info", "EchoTime", "RepetitionTime",
      "Manufacturer", "WaterSuppressed", "kSpace", "OriginalFile",
      "ConversionMethod", "ConversionTime", "PulseSequenceFile",
      "Averages"), keys);

    assertEquals(123.2, root.get("SpectrometerFrequency").get(0).asDouble());
    assertEquals("1H", root.get("ResonantNucleus").get(0).asText());
    assertEquals("meas_MID123.dat", root.get("OriginalFile").get(0).asText());
    assertEquals("Sequence binary path.",
      root.get("PulseSequenceFile").get("Description").asText());
    assertEquals(3, root.get("Averages").get("Value").size());
  }

  /**
   * Provenance is stamped on build.
   */
  @Test
  public void testProvenance() {
    HeaderExtension header = populated().build();
    assertEquals("2021-03-04T05:06:07.089",
      header.getStandard(StandardKey.CONVERSION_TIME));
    assertEquals(HeaderExtension.getConversionMethod(),
      header.getStandard(StandardKey.CONVERSION_METHOD));
    assertTrue(((String) header.getStandard(StandardKey.CONVERSION_METHOD))
      .startsWith("spec2nii v"));
    assertEquals(Collections.singletonList("meas_MID123.dat"),
      header.getStandard(StandardKey.ORIGINAL_FILE));
    assertThrows(IllegalStateException.class,
      () -> new HeaderExtension.Builder(123.2, "1H").build());
  }

  /**
   * Accessors expose what was set.
   */
  @Test
  public void testAccessors() {
    HeaderExtension header = populated().build();
    assertEquals(123.2, header.getSpectrometerFrequency());
    assertEquals("1H", header.getResonantNucleus());
    assertEquals(2, header.getDimTagCount());
    assertEquals(DimensionTags.COIL, header.getDimTag(0));
    assertNull(header.getDimInfo(0));
    assertEquals("Dynamic averages", header.getDimInfo(1));
    assertEquals(2.0, header.getStandard(StandardKey.REPETITION_TIME));
    assertEquals(Arrays.asList("PulseSequenceFile", "Averages"),
      header.getUserKeys());
    assertEquals("Average indices.", header.getUserDescription("Averages"));
    Map<String, Object> map = header.toMap();
    assertEquals(Collections.singletonList(123.2),
      map.get("SpectrometerFrequency"));
  }

  /**
   * Values must match the type required by their key.
   */
  @Test
  public void testSchemaViolation() {
    HeaderExtension.Builder builder = new HeaderExtension.Builder(297.2, "1H");
    SchemaViolationException e = assertThrows(SchemaViolationException.class,
      () -> builder.setStandard(StandardKey.ECHO_TIME, "thirty"));
    assertEquals("EchoTime", e.getField());
    assertThrows(SchemaViolationException.class,
      () -> builder.setStandard(StandardKey.WATER_SUPPRESSED, 1));
    assertThrows(SchemaViolationException.class,
      () -> builder.setStandard(StandardKey.MANUFACTURER, 3.0));
    assertThrows(SchemaViolationException.class,
      () -> builder.setStandard(StandardKey.ECHO_TIME, Double.NaN));
    assertThrows(SchemaViolationException.class,
      () -> builder.setStandard(StandardKey.SPECTROMETER_FREQUENCY,
        Collections.singletonList(300.0)));
    assertThrows(SchemaViolationException.class,
      () -> builder.setDimInfo(3, DimensionTags.DYN));
    assertThrows(SchemaViolationException.class,
      () -> new HeaderExtension.Builder(0, "1H"));
    assertThrows(SchemaViolationException.class,
      () -> new HeaderExtension.Builder(123.2, ""));
  }

  /**
   * User keys cannot shadow standard or dimension keys.
   */
  @Test
  public void testUserKeyCollision() {
    HeaderExtension.Builder builder = new HeaderExtension.Builder(123.2, "1H");
    SchemaViolationException e = assertThrows(SchemaViolationException.class,
      () -> builder.setUser("EchoTime", 0.03, "Echo time."));
    assertEquals("EchoTime", e.getField());
    assertThrows(SchemaViolationException.class,
      () -> builder.setUser("dim_5", "DIM_COIL", "Tag."));
    assertThrows(SchemaViolationException.class,
      () -> builder.setUser("Custom", 1, null));
  }

  /**
   * Dimension information written before its tag is kept.
   */
  @Test
  public void testParseInfoBeforeTag() throws Exception {
    HeaderExtension parsed = HeaderExtension.fromJson("{" +
      "\"SpectrometerFrequency\":[123.2],\"ResonantNucleus\":[\"1H\"]," +
      "\"dim_5_info\":\"coil info\",\"dim_5\":\"DIM_COIL\"," +
      "\"OriginalFile\":[\"svs.dat\"]," +
      "\"ConversionMethod\":\"other v1\"," +
      "\"ConversionTime\":\"2020-01-01T00:00:00.000\"}");
    assertEquals(DimensionTags.COIL, parsed.getDimTag(0));
    assertEquals("coil info", parsed.getDimInfo(0));
    assertEquals("other v1",
      parsed.getStandard(StandardKey.CONVERSION_METHOD));
  }

  /**
   * Parsing does not invent provenance.
   */
  @Test
  public void testParseMissingProvenance() {
    SchemaViolationException e = assertThrows(SchemaViolationException.class,
      () -> HeaderExtension.fromJson("{" +
        "\"SpectrometerFrequency\":[123.2],\"ResonantNucleus\":[\"1H\"]," +
        "\"OriginalFile\":[\"svs.dat\"]," +
        "\"ConversionMethod\":\"other v1\"}"));
    assertEquals("ConversionTime", e.getField());
  }

  /**
   * Parsing rejects headers missing required keys.
   */
  @Test
  public void testParseMissingKeys() {
    assertThrows(SchemaViolationException.class,
      () -> HeaderExtension.fromJson("{\"ResonantNucleus\":[\"1H\"]}"));
    assertThrows(SchemaViolationException.class,
      () -> HeaderExtension.fromJson(
        "{\"SpectrometerFrequency\":[123.2],\"ResonantNucleus\":[\"1H\"]}"));
  }

}
