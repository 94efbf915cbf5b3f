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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Keys defined by the NIfTI-MRS header extension standard, with the type
 * each value must have.
 */
public enum StandardKey {
  SPECTROMETER_FREQUENCY("SpectrometerFrequency", ValueType.FLOAT_LIST),
  RESONANT_NUCLEUS("ResonantNucleus", ValueType.STRING_LIST),

  // MRS specific
  ECHO_TIME("EchoTime", ValueType.FLOAT),
  REPETITION_TIME("RepetitionTime", ValueType.FLOAT),
  INVERSION_TIME("InversionTime", ValueType.FLOAT),
  MIXING_TIME("MixingTime", ValueType.FLOAT),
  EXCITATION_FLIP_ANGLE("ExcitationFlipAngle", ValueType.FLOAT),
  TX_OFFSET("TxOffset", ValueType.FLOAT),
  VOI("VOI", ValueType.FLOAT_MATRIX),
  WATER_SUPPRESSED("WaterSuppressed", ValueType.BOOLEAN),
  WATER_SUPPRESSION_TYPE("WaterSuppressionType", ValueType.STRING),
  SEQUENCE_TRIGGERED("SequenceTriggered", ValueType.BOOLEAN),

  // scanner
  MANUFACTURER("Manufacturer", ValueType.STRING),
  MANUFACTURERS_MODEL_NAME("ManufacturersModelName", ValueType.STRING),
  DEVICE_SERIAL_NUMBER("DeviceSerialNumber", ValueType.STRING),
  SOFTWARE_VERSIONS("SoftwareVersions", ValueType.STRING),
  INSTITUTION_NAME("InstitutionName", ValueType.STRING),
  INSTITUTION_ADDRESS("InstitutionAddress", ValueType.STRING),
  TX_COIL("TxCoil", ValueType.STRING),
  RX_COIL("RxCoil", ValueType.STRING),

  // sequence
  SEQUENCE_NAME("SequenceName", ValueType.STRING),
  PROTOCOL_NAME("ProtocolName", ValueType.STRING),

  // subject
  PATIENT_POSITION("PatientPosition", ValueType.STRING),
  PATIENT_NAME("PatientName", ValueType.STRING),
  PATIENT_ID("PatientID", ValueType.STRING),
  PATIENT_WEIGHT("PatientWeight", ValueType.FLOAT),
  PATIENT_DOB("PatientDoB", ValueType.STRING),
  PATIENT_SEX("PatientSex", ValueType.STRING),

  // provenance
  CONVERSION_METHOD("ConversionMethod", ValueType.STRING),
  CONVERSION_TIME("ConversionTime", ValueType.STRING),
  ORIGINAL_FILE("OriginalFile", ValueType.STRING_LIST),

  // spatial
  K_SPACE("kSpace", ValueType.BOOLEAN_LIST);

  private static final Map<String, StandardKey> BY_KEY =
    new HashMap<String, StandardKey>();

  static {
    for (StandardKey key : values()) {
      BY_KEY.put(key.getKey(), key);
    }
  }

  private final String key;
  private final ValueType type;

  private StandardKey(String key, ValueType type) {
    this.key = key;
    this.type = type;
  }

  /**
   * @return key as written to the header extension
   */
  public String getKey() {
    return key;
  }

  /**
   * @return required value type
   */
  public ValueType getType() {
    return type;
  }

  /**
   * @param key key as written to the header extension
   * @return matching standard key, or null if the key is not standard
   */
  public static StandardKey fromKey(String key) {
    return BY_KEY.get(key);
  }

  @Override
  public String toString() {
    return key;
  }

  /**
   * Value types allowed in the standard.
   */
  public enum ValueType {
    FLOAT,
    STRING,
    BOOLEAN,
    FLOAT_LIST,
    STRING_LIST,
    BOOLEAN_LIST,
    FLOAT_MATRIX;

    /**
     * Check a value against this type.  Numbers are widened to Double and
     * lists are copied into unmodifiable lists.
     *
     * @param value candidate value
     * @return normalized value, or null if the value has the wrong type
     */
    public Object normalize(Object value) {
      switch (this) {
        case FLOAT:
          return toDouble(value);
        case STRING:
          return value instanceof String ? value : null;
        case BOOLEAN:
          return value instanceof Boolean ? value : null;
        case FLOAT_LIST:
          return listOf(value, FLOAT);
        case STRING_LIST:
          return listOf(value, STRING);
        case BOOLEAN_LIST:
          return listOf(value, BOOLEAN);
        case FLOAT_MATRIX:
          return listOf(value, FLOAT_LIST);
        default:
          return null;
      }
    }

    private static Double toDouble(Object value) {
      if (value instanceof Number) {
        double d = ((Number) value).doubleValue();
        return Double.isFinite(d) ? d : null;
      }
      return null;
    }

    private static List<Object> listOf(Object value, ValueType element) {
      if (!(value instanceof List)) {
        return null;
      }
      List<Object> copy = new ArrayList<Object>();
      for (Object item : (List<?>) value) {
        Object normalized = element.normalize(item);
        if (normalized == null) {
          return null;
        }
        copy.add(normalized);
      }
      return Collections.unmodifiableList(copy);
    }
  }

}
