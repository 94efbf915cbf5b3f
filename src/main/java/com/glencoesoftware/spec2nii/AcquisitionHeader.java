/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import java.util.Map;

import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

/**
 * Immutable vendor header, as key/value pairs grouped into sections.
 * For TWIX data the sections are "MeasYaps", "Meas", "Dicom", "Phoenix"
 * and "Config"; keys are dot separated paths such as
 * "sSpecPara.sVoI.dThickness".
 */
public final class AcquisitionHeader {

  private final Table<String, String, Object> fields;

  private AcquisitionHeader(Table<String, String, Object> fields) {
    this.fields = fields;
  }

  /**
   * @return a builder for a new header
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @param section section name
   * @param path key within the section
   * @return true if the key is present
   */
  public boolean contains(String section, String path) {
    return fields.contains(section, path);
  }

  /**
   * @param section section name
   * @param path key within the section
   * @return raw value, or null if absent
   */
  public Object get(String section, String path) {
    return fields.get(section, path);
  }

  /**
   * @param section section name
   * @return all keys and values of the section
   */
  public Map<String, Object> getSection(String section) {
    return fields.row(section);
  }

  @Override
  public String toString() {
    return fields.toString();
  }

  /**
   * Collects header fields.
   */
  public static final class Builder {
    private final ImmutableTable.Builder<String, String, Object> fields =
      ImmutableTable.builder();

    private Builder() {
    }

    /**
     * @param section section name
     * @param path key within the section
     * @param value field value, not null
     * @return this builder
     */
    public Builder put(String section, String path, Object value) {
      fields.put(section, path, value);
      return this;
    }

    /**
     * @param section section name
     * @param values keys and values to add to the section
     * @return this builder
     */
    public Builder putAll(String section, Map<String, ?> values) {
      for (Map.Entry<String, ?> entry : values.entrySet()) {
        fields.put(section, entry.getKey(), entry.getValue());
      }
      return this;
    }

    /**
     * @return immutable header
     */
    public AcquisitionHeader build() {
      return new AcquisitionHeader(fields.build());
    }
  }

}
