/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Enumeration that backs the format parameter.  Each instance converts an
 * input file to output containers using the options of a
 * {@link Converter}.
 */
public enum InputFormat {
  /** Two whitespace separated columns: real, imaginary. */
  text {
    List<OutputContainer> convert(Converter converter) throws IOException {
      Path input = converter.getInput();
      ComplexArray data = TextReader.read(input);
      Double bandwidth = converter.getBandwidth();
      Double frequency = converter.getImagingFrequency();
      if (bandwidth == null) {
        throw new MalformedInputException("bandwidth",
          "Bandwidth must be specified for text input");
      }
      if (frequency == null) {
        throw new MalformedInputException("imagingfreq",
          "Imaging frequency must be specified for text input");
      }
      HeaderExtension.Builder meta =
        new HeaderExtension.Builder(frequency, converter.getNucleus())
        .setOriginalFile(input.toString());
      return single(converter, data, 1.0 / bandwidth, meta);
    }
  },
  /** LCModel .RAW or .H2O file. */
  lcm {
    List<OutputContainer> convert(Converter converter) throws IOException {
      LcmRawReader reader = new LcmRawReader(converter.getInput());
      reader.read();
      LcmRawHeader header = reader.getHeader();
      if (header.centralFrequency == null) {
        throw new MalformedInputException("HZPPPM",
          "Central frequency not found in header");
      }
      if (header.dwellTime == null) {
        throw new MalformedInputException("DELTAT",
          "Dwell time not found in header");
      }
      HeaderExtension.Builder meta = new HeaderExtension.Builder(
        header.centralFrequency / 1e6, converter.getNucleus())
        .setOriginalFile(converter.getInput().toString());
      if (header.echoTime != null) {
        meta.setStandard(StandardKey.ECHO_TIME, header.echoTime);
      }
      return single(converter, reader.getData(), header.dwellTime, meta);
    }
  };

  /**
   * Convert the converter's input file.
   *
   * @param converter source of the input path and conversion options
   * @return output containers
   * @throws IOException if the input cannot be read
   */
  abstract List<OutputContainer> convert(Converter converter)
    throws IOException;

  /**
   * Assemble a single FID with no extra dimensions.
   */
  private static List<OutputContainer> single(Converter converter,
    ComplexArray fid, double dwellTime, HeaderExtension.Builder meta)
    throws IOException
  {
    AffineTransform affine = converter.readAffine();
    if (affine == null) {
      affine = OrientationEngine.unlocalized();
    }
    else {
      affine = OrientationEngine.fromPatientSpace(affine);
    }
    return Assembler.assemble(fid, Collections.<String>emptyList(),
      affine, dwellTime, meta, converter.getBaseName());
  }
}
