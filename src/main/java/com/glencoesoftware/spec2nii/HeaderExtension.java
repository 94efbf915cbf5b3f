/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

/**
 * Immutable NIfTI-MRS header extension.
 * <p>
 * Instances are created with a {@link Builder}, which validates standard
 * keys as they are set and stamps conversion provenance on build.
 * JSON output is deterministic: required fields first, then dimension
 * tags, standard keys and user keys, each group in insertion order.
 */
public final class HeaderExtension {

  /** Name written to ConversionMethod. */
  public static final String TOOL_NAME = "spec2nii";

  /** Number of NIfTI dimensions (5 to 7) that can carry a tag. */
  public static final int MAX_TAGGED_DIMS = 3;

  /** NIfTI index of the first tagged dimension. */
  public static final int FIRST_TAGGED_DIM = 5;

  private static final String VALUE = "Value";
  private static final String DESCRIPTION = "Description";

  private static final Pattern DIM_KEY =
    Pattern.compile("dim_([5-7])(_info)?");

  private static final DateTimeFormatter TIMESTAMP =
    DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");

  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Keys a parsed header must already carry; never stamped on parse. */
  private static final List<StandardKey> PROVENANCE = ImmutableList.of(
    StandardKey.ORIGINAL_FILE, StandardKey.CONVERSION_METHOD,
    StandardKey.CONVERSION_TIME);

  private final double spectrometerFrequency;
  private final String resonantNucleus;
  private final Map<Integer, String> dimTags;
  private final Map<Integer, String> dimInfo;
  private final Map<StandardKey, Object> standard;
  private final Map<String, UserValue> user;

  private HeaderExtension(Builder builder) {
    spectrometerFrequency = builder.spectrometerFrequency;
    resonantNucleus = builder.resonantNucleus;
    dimTags = Collections.unmodifiableMap(
      new TreeMap<Integer, String>(builder.dimTags));
    dimInfo = Collections.unmodifiableMap(
      new TreeMap<Integer, String>(builder.dimInfo));
    standard = Collections.unmodifiableMap(
      new LinkedHashMap<StandardKey, Object>(builder.standard));
    user = Collections.unmodifiableMap(
      new LinkedHashMap<String, UserValue>(builder.user));
  }

  /**
   * @return tool name and version, as written to ConversionMethod
   */
  public static String getConversionMethod() {
    return TOOL_NAME + " v" + getToolVersion();
  }

  /**
   * @return implementation version from the jar manifest,
   *         or "development" when not running from a jar
   */
  public static String getToolVersion() {
    return Optional.ofNullable(
      HeaderExtension.class.getPackage().getImplementationVersion()
      ).orElse("development");
  }

  /**
   * @return spectrometer frequency in MHz
   */
  public double getSpectrometerFrequency() {
    return spectrometerFrequency;
  }

  /**
   * @return resonant nucleus, e.g. "1H"
   */
  public String getResonantNucleus() {
    return resonantNucleus;
  }

  /**
   * @param key standard key
   * @return normalized value, or null if not set
   */
  public Object getStandard(StandardKey key) {
    return standard.get(key);
  }

  /**
   * @return standard keys that have a value, in insertion order
   */
  public List<StandardKey> getStandardKeys() {
    return new ArrayList<StandardKey>(standard.keySet());
  }

  /**
   * @param key user defined key
   * @return value, or null if not set
   */
  public Object getUserValue(String key) {
    UserValue v = user.get(key);
    return v == null ? null : v.value;
  }

  /**
   * @param key user defined key
   * @return description, or null if not set
   */
  public String getUserDescription(String key) {
    UserValue v = user.get(key);
    return v == null ? null : v.description;
  }

  /**
   * @return user defined keys, in insertion order
   */
  public List<String> getUserKeys() {
    return new ArrayList<String>(user.keySet());
  }

  /**
   * @param index zero-based tagged dimension (0 is NIfTI dim 5)
   * @return tag, or null if not set
   */
  public String getDimTag(int index) {
    return dimTags.get(index);
  }

  /**
   * @param index zero-based tagged dimension (0 is NIfTI dim 5)
   * @return free-text information, or null if not set
   */
  public String getDimInfo(int index) {
    return dimInfo.get(index);
  }

  /**
   * @return number of tagged dimensions
   */
  public int getDimTagCount() {
    return dimTags.size();
  }

  /**
   * @return ordered map of every key as it appears in JSON
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    map.put(StandardKey.SPECTROMETER_FREQUENCY.getKey(),
      Collections.singletonList(spectrometerFrequency));
    map.put(StandardKey.RESONANT_NUCLEUS.getKey(),
      Collections.singletonList(resonantNucleus));
    for (Map.Entry<Integer, String> tag : dimTags.entrySet()) {
      String key = dimKey(tag.getKey());
      map.put(key, tag.getValue());
      String info = dimInfo.get(tag.getKey());
      if (info != null) {
        map.put(key + "_info", info);
      }
    }
    for (Map.Entry<StandardKey, Object> entry : standard.entrySet()) {
      map.put(entry.getKey().getKey(), entry.getValue());
    }
    for (Map.Entry<String, UserValue> entry : user.entrySet()) {
      Map<String, Object> value = new LinkedHashMap<String, Object>();
      value.put(VALUE, entry.getValue().value);
      value.put(DESCRIPTION, entry.getValue().description);
      map.put(entry.getKey(), value);
    }
    return map;
  }

  /**
   * @return compact JSON representation
   */
  public String toJson() {
    try {
      return MAPPER.writeValueAsString(toMap());
    }
    catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * @return indented JSON representation, suitable for a sidecar file
   */
  public String toPrettyJson() {
    try {
      return MAPPER.writerWithDefaultPrettyPrinter()
        .writeValueAsString(toMap());
    }
    catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Parse a header extension previously written by {@link #toJson()}.
   *
   * @param json JSON text
   * @return parsed header extension
   * @throws IOException if the text is not valid JSON
   * @throws SchemaViolationException if required keys, including the
   *         provenance keys, are missing or any value does not match the
   *         schema
   */
  public static HeaderExtension fromJson(String json) throws IOException {
    Map<String, Object> map = MAPPER.readValue(json,
      new TypeReference<LinkedHashMap<String, Object>>() { });

    Double frequency = (Double) single(map,
      StandardKey.SPECTROMETER_FREQUENCY);
    String nucleus = (String) single(map, StandardKey.RESONANT_NUCLEUS);
    Builder builder = new Builder(frequency, nucleus);

    for (Map.Entry<String, Object> entry : map.entrySet()) {
      String key = entry.getKey();
      Object value = entry.getValue();
      StandardKey standardKey = StandardKey.fromKey(key);
      Matcher dim = DIM_KEY.matcher(key);
      if (standardKey == StandardKey.SPECTROMETER_FREQUENCY ||
        standardKey == StandardKey.RESONANT_NUCLEUS)
      {
        continue;
      }
      else if (dim.matches()) {
        int index = Integer.parseInt(dim.group(1)) - FIRST_TAGGED_DIM;
        if (!(value instanceof String)) {
          throw new SchemaViolationException(key, "Expected a string");
        }
        if (dim.group(2) == null) {
          // keep info parsed before its tag
          builder.setDimInfo(index, (String) value, builder.dimInfo.get(index));
        }
        else {
          builder.dimInfo.put(index, (String) value);
        }
      }
      else if (standardKey != null) {
        builder.setStandard(standardKey, value);
      }
      else {
        if (!(value instanceof Map) ||
          !((Map<?, ?>) value).containsKey(VALUE) ||
          !(((Map<?, ?>) value).get(DESCRIPTION) instanceof String))
        {
          throw new SchemaViolationException(key,
            "User defined keys must hold " + VALUE + " and " + DESCRIPTION);
        }
        Map<?, ?> userValue = (Map<?, ?>) value;
        builder.setUser(key, userValue.get(VALUE),
          (String) userValue.get(DESCRIPTION));
      }
    }
    for (Integer index : builder.dimInfo.keySet()) {
      if (!builder.dimTags.containsKey(index)) {
        throw new SchemaViolationException(dimKey(index) + "_info",
          "Dimension information without a tag");
      }
    }
    for (StandardKey provenance : PROVENANCE) {
      if (!builder.standard.containsKey(provenance)) {
        throw new SchemaViolationException(provenance.getKey(),
          "Missing required key");
      }
    }
    return builder.build();
  }

  private static Object single(Map<String, Object> map, StandardKey key) {
    Object value = key.getType().normalize(map.get(key.getKey()));
    if (value == null || ((List<?>) value).size() != 1) {
      throw new SchemaViolationException(key.getKey(),
        "Expected a list with one element");
    }
    return ((List<?>) value).get(0);
  }

  private static String dimKey(int index) {
    return "dim_" + (index + FIRST_TAGGED_DIM);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HeaderExtension)) {
      return false;
    }
    HeaderExtension other = (HeaderExtension) o;
    return Double.compare(spectrometerFrequency,
        other.spectrometerFrequency) == 0 &&
      resonantNucleus.equals(other.resonantNucleus) &&
      dimTags.equals(other.dimTags) &&
      dimInfo.equals(other.dimInfo) &&
      new ArrayList<Object>(standard.entrySet()).equals(
        new ArrayList<Object>(other.standard.entrySet())) &&
      new ArrayList<Object>(user.entrySet()).equals(
        new ArrayList<Object>(other.user.entrySet()));
  }

  @Override
  public int hashCode() {
    return Objects.hash(spectrometerFrequency, resonantNucleus, dimTags,
      dimInfo, standard, user);
  }

  @Override
  public String toString() {
    return toJson();
  }

  private static final class UserValue {
    private final Object value;
    private final String description;

    private UserValue(Object value, String description) {
      this.value = value;
      this.description = description;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof UserValue)) {
        return false;
      }
      UserValue other = (UserValue) o;
      return Objects.equals(value, other.value) &&
        description.equals(other.description);
    }

    @Override
    public int hashCode() {
      return Objects.hash(value, description);
    }
  }

  /**
   * Accumulates header extension fields.  Not thread safe.
   */
  public static final class Builder {

    private final double spectrometerFrequency;
    private final String resonantNucleus;
    private final Map<Integer, String> dimTags =
      new TreeMap<Integer, String>();
    private final Map<Integer, String> dimInfo =
      new TreeMap<Integer, String>();
    private final Map<StandardKey, Object> standard =
      new LinkedHashMap<StandardKey, Object>();
    private final Map<String, UserValue> user =
      new LinkedHashMap<String, UserValue>();
    private String originalFile;
    private Clock clock = Clock.systemDefaultZone();

    /**
     * @param spectrometerFrequency spectrometer frequency in MHz
     * @param resonantNucleus resonant nucleus, e.g. "1H"
     * @throws SchemaViolationException if the frequency is not a positive
     *         finite number or the nucleus is empty
     */
    public Builder(double spectrometerFrequency, String resonantNucleus) {
      if (!Double.isFinite(spectrometerFrequency) ||
        spectrometerFrequency <= 0)
      {
        throw new SchemaViolationException(
          StandardKey.SPECTROMETER_FREQUENCY.getKey(),
          "Expected a positive frequency, found " + spectrometerFrequency);
      }
      if (resonantNucleus == null || resonantNucleus.trim().isEmpty()) {
        throw new SchemaViolationException(
          StandardKey.RESONANT_NUCLEUS.getKey(), "Nucleus not specified");
      }
      this.spectrometerFrequency = spectrometerFrequency;
      this.resonantNucleus = resonantNucleus;
    }

    /**
     * Set a standard key.
     *
     * @param key standard key
     * @param value value of the type required by the key
     * @return this builder
     * @throws SchemaViolationException if the value has the wrong type or
     *         the key is one of the required constructor fields
     */
    public Builder setStandard(StandardKey key, Object value) {
      if (key == StandardKey.SPECTROMETER_FREQUENCY ||
        key == StandardKey.RESONANT_NUCLEUS)
      {
        throw new SchemaViolationException(key.getKey(),
          "Set only on construction");
      }
      Object normalized = key.getType().normalize(value);
      if (normalized == null) {
        throw new SchemaViolationException(key.getKey(), String.format(
          "Expected %s, found %s", key.getType(),
          value == null ? "null" : value.getClass().getSimpleName()));
      }
      standard.put(key, normalized);
      return this;
    }

    /**
     * Set a user defined key.
     *
     * @param key key name, must not be a standard key or a dimension key
     * @param value any JSON representable value
     * @param description human readable description of the value
     * @return this builder
     * @throws SchemaViolationException if the key is reserved or the value
     *         cannot be represented in JSON
     */
    public Builder setUser(String key, Object value, String description) {
      if (key == null || StandardKey.fromKey(key) != null ||
        DIM_KEY.matcher(key).matches())
      {
        throw new SchemaViolationException(key,
          "Reserved key cannot be user defined");
      }
      if (description == null) {
        throw new SchemaViolationException(key, "Description is required");
      }
      Object normalized;
      try {
        normalized = MAPPER.readValue(MAPPER.writeValueAsString(value),
          Object.class);
      }
      catch (JsonProcessingException e) {
        throw new SchemaViolationException(key,
          "Value cannot be represented in JSON: " + e.getMessage());
      }
      user.put(key, new UserValue(normalized, description));
      return this;
    }

    /**
     * Set the tag of a non-time dimension.
     *
     * @param index zero-based tagged dimension (0 is NIfTI dim 5)
     * @param tag dimension tag
     * @return this builder
     */
    public Builder setDimInfo(int index, String tag) {
      return setDimInfo(index, tag, null);
    }

    /**
     * Set the tag and free-text information of a non-time dimension.
     *
     * @param index zero-based tagged dimension (0 is NIfTI dim 5)
     * @param tag dimension tag
     * @param info free-text information, may be null
     * @return this builder
     */
    public Builder setDimInfo(int index, String tag, String info) {
      if (index < 0 || index >= MAX_TAGGED_DIMS) {
        throw new SchemaViolationException(dimKey(index),
          "Only dimensions 5 to 7 can be tagged");
      }
      if (tag == null) {
        throw new SchemaViolationException(dimKey(index), "Missing tag");
      }
      dimTags.put(index, tag);
      if (info == null) {
        dimInfo.remove(index);
      }
      else {
        dimInfo.put(index, info);
      }
      return this;
    }

    /**
     * @param path path or name of the converted file; only the base name
     *             is recorded
     * @return this builder
     */
    public Builder setOriginalFile(String path) {
      originalFile = Paths.get(path).getFileName().toString();
      return this;
    }

    /**
     * @param clock clock used for the ConversionTime stamp
     * @return this builder
     */
    public Builder setClock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Stamp provenance and create the immutable header extension.
     * ConversionMethod and ConversionTime are only added if not already
     * set; OriginalFile is taken from {@link #setOriginalFile(String)}.
     *
     * @return header extension
     * @throws IllegalStateException if no original file is known
     */
    public HeaderExtension build() {
      if (originalFile != null) {
        standard.put(StandardKey.ORIGINAL_FILE,
          Collections.singletonList(originalFile));
      }
      else if (!standard.containsKey(StandardKey.ORIGINAL_FILE)) {
        throw new IllegalStateException("Original file not set");
      }
      standard.putIfAbsent(StandardKey.CONVERSION_METHOD,
        getConversionMethod());
      standard.putIfAbsent(StandardKey.CONVERSION_TIME,
        LocalDateTime.now(clock).format(TIMESTAMP));
      return new HeaderExtension(this);
    }
  }

}
