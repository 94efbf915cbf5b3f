/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

/**
 * Vendor geometry of a single localized volume, in DICOM patient space
 * (sagittal, coronal, transverse components).
 */
public class OrientationFrame {

  private final double[] normal;
  private final double inPlaneRotation;
  private final double phaseFov;
  private final double readoutFov;
  private final double sliceThickness;
  private final double[] position;

  /**
   * @param normal slice normal (sag, cor, tra); need not be unit length
   * @param inPlaneRotation in-plane rotation in radians
   * @param phaseFov phase encode field of view in mm
   * @param readoutFov readout field of view in mm
   * @param sliceThickness slice thickness in mm
   * @param position volume position (sag, cor, tra) in mm, including
   *                 any table position offset
   */
  public OrientationFrame(double[] normal, double inPlaneRotation,
    double phaseFov, double readoutFov, double sliceThickness,
    double[] position)
  {
    if (normal.length != 3 || position.length != 3) {
      throw new IllegalArgumentException(
        "Normal and position must have three components");
    }
    this.normal = normal.clone();
    this.inPlaneRotation = inPlaneRotation;
    this.phaseFov = phaseFov;
    this.readoutFov = readoutFov;
    this.sliceThickness = sliceThickness;
    this.position = position.clone();
  }

  public double[] getNormal() {
    return normal.clone();
  }

  public double getInPlaneRotation() {
    return inPlaneRotation;
  }

  public double getPhaseFov() {
    return phaseFov;
  }

  public double getReadoutFov() {
    return readoutFov;
  }

  public double getSliceThickness() {
    return sliceThickness;
  }

  public double[] getPosition() {
    return position.clone();
  }

}
