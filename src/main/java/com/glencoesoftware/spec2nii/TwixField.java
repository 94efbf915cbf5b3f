/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

/**
 * Every TWIX header field used during conversion, with its location,
 * default and type.  Fields without a default are either required
 * (missing is an error) or optional (missing yields null).
 */
public enum TwixField {
  // geometry
  NORMAL_SAG(Section.MEAS_YAPS, "sSpecPara.sVoI.sNormal.dSag", 0.0),
  NORMAL_COR(Section.MEAS_YAPS, "sSpecPara.sVoI.sNormal.dCor", 0.0),
  NORMAL_TRA(Section.MEAS_YAPS, "sSpecPara.sVoI.sNormal.dTra", 0.0),
  IN_PLANE_ROTATION(Section.MEAS_YAPS, "sSpecPara.sVoI.dInPlaneRot", 0.0),
  READOUT_FOV(Section.MEAS_YAPS, "sSpecPara.sVoI.dReadoutFOV",
    Type.DOUBLE, true),
  PHASE_FOV(Section.MEAS_YAPS, "sSpecPara.sVoI.dPhaseFOV", Type.DOUBLE, true),
  THICKNESS(Section.MEAS_YAPS, "sSpecPara.sVoI.dThickness",
    Type.DOUBLE, true),
  POSITION_SAG(Section.MEAS_YAPS, "sSpecPara.sVoI.sPosition.dSag", 0.0),
  POSITION_COR(Section.MEAS_YAPS, "sSpecPara.sVoI.sPosition.dCor", 0.0),
  POSITION_TRA(Section.MEAS_YAPS, "sSpecPara.sVoI.sPosition.dTra", 0.0),
  TABLE_POSITION_SAG(Section.MEAS_YAPS, "lScanRegionPosSag", 0.0),
  TABLE_POSITION_COR(Section.MEAS_YAPS, "lScanRegionPosCor", 0.0),
  TABLE_POSITION_TRA(Section.MEAS_YAPS, "lScanRegionPosTra", 0.0),
  MATRIX_SIZE_SLICE(Section.MEAS, "lFinalMatrixSizeSlice", 0),
  MATRIX_SIZE_PHASE(Section.MEAS, "lFinalMatrixSizePhase", 0),
  MATRIX_SIZE_READ(Section.MEAS, "lFinalMatrixSizeRead", 0),

  // timing
  DWELL_TIME(Section.MEAS_YAPS, "sRXSPEC.alDwellTime.0", Type.DOUBLE, true),
  ECHO_TIME(Section.PHOENIX, "alTE.0", Type.DOUBLE, true),
  TR_TIME(Section.MEAS, "TR_Time", Type.DOUBLE, false),
  TR(Section.MEAS, "TR", Type.DOUBLE, false),
  TI_TIME(Section.MEAS, "TI_Time", Type.DOUBLE, false),
  FLIP_ANGLE(Section.MEAS, "FlipAngle", Type.DOUBLE, true),
  DELTA_FREQUENCY(Section.MEAS, "dDeltaFrequency", 0.0),

  // spectrometer
  FREQUENCY(Section.MEAS, "Frequency", Type.DOUBLE, true),
  NUCLEUS(Section.MEAS, "ResonantNucleus", Type.STRING, true),

  // scanner
  MANUFACTURER(Section.DICOM, "Manufacturer", Type.STRING, false),
  MODEL_NAME(Section.DICOM, "ManufacturersModelName", Type.STRING, false),
  SERIAL_NUMBER(Section.DICOM, "DeviceSerialNumber", Type.STRING, false),
  SOFTWARE_VERSIONS(Section.DICOM, "SoftwareVersions", Type.STRING, false),
  INSTITUTION_NAME(Section.DICOM, "InstitutionName", Type.STRING, false),
  INSTITUTION_ADDRESS(Section.DICOM, "InstitutionAddress", Type.STRING,
    false),
  RX_COIL(Section.MEAS_YAPS,
    "sCoilSelectMeas.aRxCoilSelectData.0.asList.0.sCoilElementID.tCoilID",
    Type.STRING, false),
  RX_COIL_ALTERNATE(Section.MEAS_YAPS,
    "asCoilSelectMeas.0.asList.0.sCoilElementID.tCoilID",
    Type.STRING, false),

  // sequence
  SEQUENCE_NAME(Section.MEAS, "tSequenceString", Type.STRING, false),
  PROTOCOL_NAME(Section.DICOM, "tProtocolName", Type.STRING, false),
  SEQUENCE_FILE(Section.CONFIG, "SequenceFileName", Type.STRING, false),
  ICE_PROGRAM(Section.MEAS, "tICEProgramName", Type.STRING, false),

  // patient
  PATIENT_POSITION(Section.MEAS, "PatientPosition", Type.STRING, false),
  PATIENT_NAME(Section.MEAS, "PatientName", Type.STRING, false),
  PATIENT_WEIGHT(Section.MEAS, "flUsedPatientWeight", Type.DOUBLE, false),
  PATIENT_BIRTH_DAY(Section.MEAS, "PatientBirthDay", Type.STRING, false),
  PATIENT_SEX(Section.MEAS, "PatientSex", Type.INTEGER, false);

  /**
   * Header section names.
   */
  public static final class Section {
    public static final String MEAS_YAPS = "MeasYaps";
    public static final String MEAS = "Meas";
    public static final String DICOM = "Dicom";
    public static final String PHOENIX = "Phoenix";
    public static final String CONFIG = "Config";

    private Section() {
    }
  }

  private enum Type {
    DOUBLE,
    INTEGER,
    STRING
  }

  private final String section;
  private final String path;
  private final Type type;
  private final boolean required;
  private final Object defaultValue;

  private TwixField(String section, String path, double defaultValue) {
    this(section, path, Type.DOUBLE, false, defaultValue);
  }

  private TwixField(String section, String path, int defaultValue) {
    this(section, path, Type.INTEGER, false, defaultValue);
  }

  private TwixField(String section, String path, Type type,
    boolean required)
  {
    this(section, path, type, required, null);
  }

  private TwixField(String section, String path, Type type,
    boolean required, Object defaultValue)
  {
    this.section = section;
    this.path = path;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
  }

  public String getSection() {
    return section;
  }

  public String getPath() {
    return path;
  }

  /**
   * @param header vendor header
   * @return true if the field is present and not empty
   */
  public boolean isPresent(AcquisitionHeader header) {
    Object value = header.get(section, path);
    return value != null && !"".equals(value);
  }

  /**
   * Extract this field.  Empty strings are treated as missing, numbers
   * given as strings are parsed.
   *
   * @param header vendor header
   * @return Double, Integer or String value, the default when missing,
   *         or null for a missing optional field
   * @throws MalformedInputException if a required field is missing or the
   *         value cannot be converted to the field type
   */
  public Object extract(AcquisitionHeader header) {
    if (!isPresent(header)) {
      if (required) {
        throw new MalformedInputException(toString(),
          "Required header field is missing");
      }
      return defaultValue;
    }
    Object value = header.get(section, path);
    try {
      switch (type) {
        case DOUBLE:
          return value instanceof Number ?
            ((Number) value).doubleValue() :
            Double.parseDouble(value.toString().trim());
        case INTEGER:
          return value instanceof Number ?
            ((Number) value).intValue() :
            Integer.parseInt(value.toString().trim());
        default:
          return value.toString();
      }
    }
    catch (NumberFormatException e) {
      throw new MalformedInputException(toString(),
        "Cannot convert '" + value + "' to " + type, e);
    }
  }

  /**
   * @param header vendor header
   * @return value as a double, or null for a missing optional field
   */
  public Double getDouble(AcquisitionHeader header) {
    checkType(Type.DOUBLE);
    return (Double) extract(header);
  }

  /**
   * @param header vendor header
   * @return value as an integer, or null for a missing optional field
   */
  public Integer getInteger(AcquisitionHeader header) {
    checkType(Type.INTEGER);
    return (Integer) extract(header);
  }

  /**
   * @param header vendor header
   * @return value as a string, or null for a missing optional field
   */
  public String getString(AcquisitionHeader header) {
    checkType(Type.STRING);
    return (String) extract(header);
  }

  private void checkType(Type expected) {
    if (type != expected) {
      throw new IllegalStateException(name() + " is not of type " + expected);
    }
  }

  @Override
  public String toString() {
    return section + ":" + path;
  }
}
