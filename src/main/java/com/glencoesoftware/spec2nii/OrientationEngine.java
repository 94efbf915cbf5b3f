/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calculates NIfTI affines from vendor geometry.
 * <p>
 * The phase/readout basis follows the Siemens convention of deriving both
 * directions from the slice normal and the in-plane rotation; the affine
 * itself is assembled the way dcm2niix does from the equivalent DICOM
 * ImageOrientationPatient, ImagePositionPatient and PixelSpacing.
 */
public final class OrientationEngine {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(OrientationEngine.class);

  /** Voxel size used when the source has no spatial localization. */
  public static final double UNLOCALIZED_VOXEL_SIZE = 10000;

  private OrientationEngine() {
  }

  /**
   * Compute the affine of a localized volume.
   *
   * @param frame vendor geometry
   * @return affine in NIfTI (RAS) convention
   * @throws UnsupportedGeometryException if the normal has zero length,
   *         any field of view or the thickness is not positive,
   *         or any value is not finite
   */
  public static AffineTransform calculate(OrientationFrame frame) {
    double[] normal = normalize(frame.getNormal());
    double phi = frame.getInPlaneRotation();
    requireFinite("inPlaneRotation", phi);
    requirePositive("phaseFov", frame.getPhaseFov());
    requirePositive("readoutFov", frame.getReadoutFov());
    requirePositive("sliceThickness", frame.getSliceThickness());
    double[] position = frame.getPosition();
    for (double p : position) {
      requireFinite("position", p);
    }

    double[][] prs = phaseReadout(normal, phi);
    double[] phase = prs[0];
    double[] readout = prs[1];

    // DICOM row cosines run along readout, column cosines along phase
    double[] row = readout;
    double[] col = phase;
    double[] slice = cross(row, col);
    double[] spacing = {
      frame.getPhaseFov(), frame.getReadoutFov(), frame.getSliceThickness()
    };

    double[][] q = new double[4][4];
    for (int i=0; i<3; i++) {
      q[i][0] = row[i] * spacing[0];
      q[i][1] = col[i] * spacing[1];
      q[i][2] = slice[i] * spacing[2];
      q[i][3] = position[i];
    }
    q[3][3] = 1;

    AffineTransform affine = new AffineTransform(q).flipXY();
    LOGGER.debug("row cosines {}, column cosines {}, position {}",
      row, col, position);
    LOGGER.debug("affine {}", affine);
    return affine;
  }

  /**
   * @return affine used when spatial position is undefined
   */
  public static AffineTransform unlocalized() {
    return fromPatientSpace(AffineTransform.diagonal(UNLOCALIZED_VOXEL_SIZE,
      UNLOCALIZED_VOXEL_SIZE, UNLOCALIZED_VOXEL_SIZE, 1));
  }

  /**
   * Convert an affine given in DICOM (LPS) patient space, e.g. one read
   * from a user supplied file, to NIfTI convention.
   *
   * @param patientSpace affine in LPS convention
   * @return affine in RAS convention
   */
  public static AffineTransform fromPatientSpace(AffineTransform patientSpace)
  {
    for (int r=0; r<4; r++) {
      for (int c=0; c<4; c++) {
        requireFinite("affine", patientSpace.get(r, c));
      }
    }
    return patientSpace.flipXY();
  }

  /**
   * Derive the phase encode and readout directions of a slice.
   *
   * @param normal unit slice normal (sag, cor, tra)
   * @param phi in-plane rotation in radians
   * @return two unit vectors: phase direction, then readout direction
   */
  static double[][] phaseReadout(double[] normal, double phi) {
    double sag = normal[0];
    double cor = normal[1];
    double tra = normal[2];
    double[] phase = new double[3];
    switch (SliceOrientation.classify(sag, cor, tra)) {
      case TRANSVERSE: {
        double norm = Math.sqrt(cor * cor + tra * tra);
        phase[1] = tra / norm;
        phase[2] = -cor / norm;
        break;
      }
      case CORONAL: {
        double norm = Math.sqrt(sag * sag + cor * cor);
        phase[0] = cor / norm;
        phase[1] = -sag / norm;
        break;
      }
      default: {
        double norm = Math.sqrt(sag * sag + cor * cor);
        phase[0] = -cor / norm;
        phase[1] = sag / norm;
        break;
      }
    }

    double[] readout = cross(normal, phase);
    if (phi != 0) {
      double cos = Math.cos(phi);
      double sin = Math.sin(phi);
      for (int i=0; i<3; i++) {
        phase[i] = cos * phase[i] - sin * readout[i];
      }
      readout = cross(normal, phase);
    }
    return new double[][] {phase, readout};
  }

  private static double[] normalize(double[] v) {
    for (double c : v) {
      if (!Double.isFinite(c)) {
        throw new UnsupportedGeometryException("sliceNormal",
          "Slice normal contains a non-finite component");
      }
    }
    double norm = Math.sqrt(v[0] * v[0] + v[1] * v[1] + v[2] * v[2]);
    if (norm == 0) {
      throw new UnsupportedGeometryException("sliceNormal",
        "Slice normal has zero length");
    }
    return new double[] {v[0] / norm, v[1] / norm, v[2] / norm};
  }

  static double[] cross(double[] a, double[] b) {
    return new double[] {
      a[1] * b[2] - a[2] * b[1],
      a[2] * b[0] - a[0] * b[2],
      a[0] * b[1] - a[1] * b[0]
    };
  }

  private static void requirePositive(String field, double value) {
    requireFinite(field, value);
    if (value <= 0) {
      throw new UnsupportedGeometryException(field,
        "Expected a positive value, found " + value);
    }
  }

  private static void requireFinite(String field, double value) {
    if (!Double.isFinite(value)) {
      throw new UnsupportedGeometryException(field,
        "Expected a finite value, found " + value);
    }
  }

}
