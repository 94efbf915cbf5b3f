/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes output containers as single file NIfTI-2 images with the
 * NIfTI-MRS header extension.
 * <p>
 * Data is written little-endian as COMPLEX128 in NIfTI order (first index
 * varying fastest).  Both qform and sform are set from the affine.
 */
public final class NiftiMrsWriter {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(NiftiMrsWriter.class);

  /** Size of a NIfTI-2 header. */
  public static final int HEADER_SIZE = 540;

  /** Extension code registered for NIfTI-MRS. */
  public static final int ECODE_MRS = 44;

  /** Intent name identifying the NIfTI-MRS version. */
  public static final String INTENT_NAME = "mrs_v0_2";

  public static final short DT_COMPLEX128 = 1792;

  private static final byte[] MAGIC = {
    'n', '+', '2', 0, '\r', '\n', 032, '\n'
  };

  private static final int XFORM_SCANNER_ANAT = 1;
  private static final int UNITS_MM = 2;
  private static final int UNITS_SEC = 8;

  private NiftiMrsWriter() {
  }

  /**
   * @param container container to write
   * @param file destination, normally ending in ".nii"
   * @throws IOException if the file cannot be written
   */
  public static void write(OutputContainer container, Path file)
    throws IOException
  {
    byte[] json = container.getHeader().toJson()
      .getBytes(StandardCharsets.UTF_8);
    int esize = (8 + json.length + 15) / 16 * 16;
    long voxOffset = HEADER_SIZE + 4 + esize;

    ByteBuffer header = ByteBuffer.allocate((int) voxOffset)
      .order(ByteOrder.LITTLE_ENDIAN);
    writeHeader(header, container, voxOffset);

    header.position(HEADER_SIZE);
    header.put(new byte[] {1, 0, 0, 0});
    header.putInt(esize);
    header.putInt(ECODE_MRS);
    header.put(json);

    // NIfTI order is the row-major order of the reversed axes
    ComplexArray data = container.getData();
    int rank = data.getRank();
    int[] reversed = new int[rank];
    for (int i=0; i<rank; i++) {
      reversed[i] = rank - 1 - i;
    }
    double[] values = data.permute(reversed).toInterleaved();

    try (OutputStream out =
      new BufferedOutputStream(Files.newOutputStream(file)))
    {
      out.write(header.array());
      ByteBuffer chunk = ByteBuffer.allocate(8 * 1024)
        .order(ByteOrder.LITTLE_ENDIAN);
      for (double v : values) {
        if (!chunk.hasRemaining()) {
          out.write(chunk.array(), 0, chunk.position());
          chunk.clear();
        }
        chunk.putDouble(v);
      }
      out.write(chunk.array(), 0, chunk.position());
    }
    LOGGER.info("Wrote {} {}", file, container);
  }

  private static void writeHeader(ByteBuffer buf, OutputContainer container,
    long voxOffset)
  {
    int[] shape = container.getShape();
    AffineTransform affine = container.getAffine();
    double[] quatern = quaternion(affine);

    buf.putInt(0, HEADER_SIZE);
    for (int i=0; i<MAGIC.length; i++) {
      buf.put(4 + i, MAGIC[i]);
    }
    buf.putShort(12, DT_COMPLEX128);
    buf.putShort(14, (short) 128);

    buf.putLong(16, shape.length);
    for (int i=0; i<7; i++) {
      buf.putLong(24 + 8 * i, i < shape.length ? shape[i] : 1);
    }

    double[] pixdim = new double[8];
    pixdim[0] = quatern[6];
    pixdim[1] = quatern[7];
    pixdim[2] = quatern[8];
    pixdim[3] = quatern[9];
    pixdim[4] = container.getDwellTime();
    for (int i=5; i<8; i++) {
      pixdim[i] = 1;
    }
    for (int i=0; i<8; i++) {
      buf.putDouble(104 + 8 * i, pixdim[i]);
    }
    buf.putLong(168, voxOffset);
    buf.putDouble(176, 1);
    putString(buf, 240, 80, HeaderExtension.getConversionMethod());

    buf.putInt(344, XFORM_SCANNER_ANAT);
    buf.putInt(348, XFORM_SCANNER_ANAT);
    for (int i=0; i<6; i++) {
      buf.putDouble(352 + 8 * i, quatern[i]);
    }
    for (int r=0; r<3; r++) {
      for (int c=0; c<4; c++) {
        buf.putDouble(400 + 32 * r + 8 * c, affine.get(r, c));
      }
    }
    buf.putInt(500, UNITS_MM | UNITS_SEC);
    putString(buf, 508, 16, INTENT_NAME);
  }

  private static void putString(ByteBuffer buf, int offset, int length,
    String value)
  {
    byte[] bytes = value.getBytes(StandardCharsets.US_ASCII);
    for (int i=0; i<Math.min(bytes.length, length - 1); i++) {
      buf.put(offset + i, bytes[i]);
    }
  }

  /**
   * Convert an affine to NIfTI quaternion parameters, following
   * nifti_mat44_to_quatern.  The rotation part is assumed orthogonal.
   *
   * @param affine affine to convert
   * @return quatern_b, quatern_c, quatern_d, qoffset_x, qoffset_y,
   *         qoffset_z, qfac, dx, dy, dz
   */
  static double[] quaternion(AffineTransform affine) {
    double[][] r = new double[3][3];
    double[] size = affine.getVoxelSize();
    for (int c=0; c<3; c++) {
      if (size[c] == 0) {
        size[c] = 1;
        r[c][c] = 1;
        continue;
      }
      for (int row=0; row<3; row++) {
        r[row][c] = affine.get(row, c) / size[c];
      }
    }

    double det = r[0][0] * (r[1][1] * r[2][2] - r[1][2] * r[2][1]) -
      r[0][1] * (r[1][0] * r[2][2] - r[1][2] * r[2][0]) +
      r[0][2] * (r[1][0] * r[2][1] - r[1][1] * r[2][0]);
    double qfac = 1;
    if (det < 0) {
      qfac = -1;
      for (int row=0; row<3; row++) {
        r[row][2] = -r[row][2];
      }
    }

    double a = r[0][0] + r[1][1] + r[2][2] + 1;
    double b;
    double c;
    double d;
    if (a > 0.5) {
      a = 0.5 * Math.sqrt(a);
      b = 0.25 * (r[2][1] - r[1][2]) / a;
      c = 0.25 * (r[0][2] - r[2][0]) / a;
      d = 0.25 * (r[1][0] - r[0][1]) / a;
    }
    else {
      double xd = 1 + r[0][0] - (r[1][1] + r[2][2]);
      double yd = 1 + r[1][1] - (r[0][0] + r[2][2]);
      double zd = 1 + r[2][2] - (r[0][0] + r[1][1]);
      if (xd > 1) {
        b = 0.5 * Math.sqrt(xd);
        c = 0.25 * (r[0][1] + r[1][0]) / b;
        d = 0.25 * (r[0][2] + r[2][0]) / b;
        a = 0.25 * (r[2][1] - r[1][2]) / b;
      }
      else if (yd > 1) {
        c = 0.5 * Math.sqrt(yd);
        b = 0.25 * (r[0][1] + r[1][0]) / c;
        d = 0.25 * (r[1][2] + r[2][1]) / c;
        a = 0.25 * (r[0][2] - r[2][0]) / c;
      }
      else {
        d = 0.5 * Math.sqrt(zd);
        b = 0.25 * (r[0][2] + r[2][0]) / d;
        c = 0.25 * (r[1][2] + r[2][1]) / d;
        a = 0.25 * (r[1][0] - r[0][1]) / d;
      }
      if (a < 0) {
        b = -b;
        c = -c;
        d = -d;
      }
    }
    return new double[] {
      b, c, d, affine.get(0, 3), affine.get(1, 3), affine.get(2, 3),
      qfac, size[0], size[1], size[2]
    };
  }

}
