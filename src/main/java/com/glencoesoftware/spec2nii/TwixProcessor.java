/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts Siemens TWIX single voxel spectroscopy acquisitions.
 * The raw file must already have been decoded into a
 * {@link RawAcquisition} with squeezed dimensions.
 */
public final class TwixProcessor {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(TwixProcessor.class);

  private TwixProcessor() {
  }

  /**
   * Convert one acquisition.
   *
   * @param acquisition decoded TWIX data and header
   * @param baseName output base name, or null to derive it from the
   *                 source file name
   * @param overrides user requested dimension order and tags
   * @return containers in output order
   * @throws ConversionException if the acquisition cannot be converted;
   *         the source file name is attached
   */
  public static List<OutputContainer> process(RawAcquisition acquisition,
    String baseName, DimensionOverrides overrides)
  {
    String fileName = acquisition.getFileName();
    try {
      AcquisitionHeader header = acquisition.getHeader();
      int voxels = voxelCount(header);
      if (voxels > 1) {
        throw new UnsupportedGeometryException(
          TwixField.MATRIX_SIZE_SLICE.getPath(),
          "MRSI data (" + voxels + " voxels) is not supported");
      }
      return processSvs(acquisition, baseName, overrides);
    }
    catch (ConversionException e) {
      throw e.attachSource(fileName);
    }
  }

  /**
   * Total number of voxels.  Unlocalized data and sequences that leave the
   * matrix size fields empty count as a single voxel.
   *
   * @param header TWIX header
   * @return number of voxels
   */
  static int voxelCount(AcquisitionHeader header) {
    int slice = TwixField.MATRIX_SIZE_SLICE.getInteger(header);
    int phase = TwixField.MATRIX_SIZE_PHASE.getInteger(header);
    int read = TwixField.MATRIX_SIZE_READ.getInteger(header);
    if (phase != 0 && read != 0) {
      return Math.max(slice, 1) * phase * read;
    }
    if (slice != 0) {
      return slice;
    }
    return 1;
  }

  private static List<OutputContainer> processSvs(RawAcquisition acquisition,
    String baseName, DimensionOverrides overrides)
  {
    Slf4JStopWatch t0 = new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
    ComplexArray data = acquisition.getData();
    LOGGER.info("Found data of size {}", Arrays.toString(data.getShape()));

    // match the phase convention of NIfTI-MRS
    data = data.conjugate();

    AcquisitionHeader header = acquisition.getHeader();
    AffineTransform affine =
      OrientationEngine.calculate(orientationFrame(header));
    double dwellTime = TwixField.DWELL_TIME.getDouble(header) / 1e9;
    HeaderExtension.Builder meta =
      extractMetadata(header, acquisition.getFileName());

    DimensionPlan plan = DimensionResolver.resolve(
      acquisition.getAxisNames(), acquisition.getRevision(), overrides);
    ComplexArray reordered = plan.apply(data);

    String mainName = baseName;
    if (mainName == null) {
      mainName = Paths.get(acquisition.getFileName()).getFileName()
        .toString().split("\\.")[0];
    }
    List<OutputContainer> containers = Assembler.assemble(reordered,
      plan.getTags(), affine, dwellTime, meta, mainName);
    t0.stop("processSvs");
    return containers;
  }

  /**
   * Read the voxel geometry.  The table position is added to the
   * voxel position.
   *
   * @param header TWIX header
   * @return geometry of the voxel
   */
  static OrientationFrame orientationFrame(AcquisitionHeader header) {
    double[] normal = {
      TwixField.NORMAL_SAG.getDouble(header),
      TwixField.NORMAL_COR.getDouble(header),
      TwixField.NORMAL_TRA.getDouble(header)
    };
    double[] position = {
      TwixField.POSITION_SAG.getDouble(header) +
        TwixField.TABLE_POSITION_SAG.getDouble(header),
      TwixField.POSITION_COR.getDouble(header) +
        TwixField.TABLE_POSITION_COR.getDouble(header),
      TwixField.POSITION_TRA.getDouble(header) +
        TwixField.TABLE_POSITION_TRA.getDouble(header)
    };
    return new OrientationFrame(normal,
      TwixField.IN_PLANE_ROTATION.getDouble(header),
      TwixField.PHASE_FOV.getDouble(header),
      TwixField.READOUT_FOV.getDouble(header),
      TwixField.THICKNESS.getDouble(header),
      position);
  }

  /**
   * Fill the header extension from the TWIX header.
   *
   * @param header TWIX header
   * @param originalFile name of the source file
   * @return populated header extension builder; dimension tags are not set
   */
  static HeaderExtension.Builder extractMetadata(AcquisitionHeader header,
    String originalFile)
  {
    HeaderExtension.Builder meta = new HeaderExtension.Builder(
      TwixField.FREQUENCY.getDouble(header) / 1e6,
      TwixField.NUCLEUS.getString(header));

    meta.setStandard(StandardKey.ECHO_TIME,
      TwixField.ECHO_TIME.getDouble(header) * 1e-6);
    Double tr = TwixField.TR_TIME.getDouble(header);
    if (tr == null) {
      tr = TwixField.TR.getDouble(header);
    }
    if (tr == null) {
      throw new MalformedInputException(TwixField.TR.toString(),
        "Repetition time is missing");
    }
    meta.setStandard(StandardKey.REPETITION_TIME, tr / 1e6);
    Double ti = TwixField.TI_TIME.getDouble(header);
    if (ti != null) {
      meta.setStandard(StandardKey.INVERSION_TIME, ti / 1e6);
    }
    meta.setStandard(StandardKey.EXCITATION_FLIP_ANGLE,
      TwixField.FLIP_ANGLE.getDouble(header));
    meta.setStandard(StandardKey.TX_OFFSET,
      TwixField.DELTA_FREQUENCY.getDouble(header));

    setIfPresent(meta, StandardKey.MANUFACTURER, TwixField.MANUFACTURER,
      header);
    setIfPresent(meta, StandardKey.MANUFACTURERS_MODEL_NAME,
      TwixField.MODEL_NAME, header);
    setIfPresent(meta, StandardKey.DEVICE_SERIAL_NUMBER,
      TwixField.SERIAL_NUMBER, header);
    setIfPresent(meta, StandardKey.SOFTWARE_VERSIONS,
      TwixField.SOFTWARE_VERSIONS, header);
    setIfPresent(meta, StandardKey.INSTITUTION_NAME,
      TwixField.INSTITUTION_NAME, header);
    setIfPresent(meta, StandardKey.INSTITUTION_ADDRESS,
      TwixField.INSTITUTION_ADDRESS, header);
    if (TwixField.RX_COIL.isPresent(header)) {
      setIfPresent(meta, StandardKey.RX_COIL, TwixField.RX_COIL, header);
    }
    else {
      setIfPresent(meta, StandardKey.RX_COIL, TwixField.RX_COIL_ALTERNATE,
        header);
    }

    setIfPresent(meta, StandardKey.SEQUENCE_NAME, TwixField.SEQUENCE_NAME,
      header);
    setIfPresent(meta, StandardKey.PROTOCOL_NAME, TwixField.PROTOCOL_NAME,
      header);

    setIfPresent(meta, StandardKey.PATIENT_POSITION,
      TwixField.PATIENT_POSITION, header);
    setIfPresent(meta, StandardKey.PATIENT_NAME, TwixField.PATIENT_NAME,
      header);
    Double weight = TwixField.PATIENT_WEIGHT.getDouble(header);
    if (weight != null) {
      meta.setStandard(StandardKey.PATIENT_WEIGHT, weight);
    }
    setIfPresent(meta, StandardKey.PATIENT_DOB, TwixField.PATIENT_BIRTH_DAY,
      header);
    Integer sex = TwixField.PATIENT_SEX.getInteger(header);
    if (sex != null) {
      meta.setStandard(StandardKey.PATIENT_SEX, patientSex(sex));
    }

    meta.setStandard(StandardKey.K_SPACE, Arrays.asList(false, false, false));
    meta.setOriginalFile(originalFile);

    String sequenceFile = TwixField.SEQUENCE_FILE.getString(header);
    if (sequenceFile != null) {
      meta.setUser("PulseSequenceFile", sequenceFile, "Sequence binary path.");
    }
    String iceProgram = TwixField.ICE_PROGRAM.getString(header);
    if (iceProgram != null) {
      meta.setUser("IceProgramFile", iceProgram,
        "Reconstruction binary path.");
    }
    return meta;
  }

  private static void setIfPresent(HeaderExtension.Builder meta,
    StandardKey key, TwixField field, AcquisitionHeader header)
  {
    String value = field.getString(header);
    if (value != null) {
      meta.setStandard(key, value);
    }
  }

  private static String patientSex(int code) {
    switch (code) {
      case 1:
        return "M";
      case 2:
        return "F";
      default:
        return "O";
    }
  }

}
