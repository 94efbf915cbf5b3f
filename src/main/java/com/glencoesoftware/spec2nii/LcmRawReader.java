/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reader for LCModel .RAW and .H2O files.
 * <p>
 * The file holds one or more Fortran namelists (from a line containing
 * '$' to a line containing '$END') followed by the FID as alternating
 * real and imaginary values.  Only one FID per file is supported.
 */
public class LcmRawReader {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(LcmRawReader.class);

  private static final String NUMBER =
    "([-+]?(?:[0-9]+\\.?[0-9]*|\\.[0-9]+)(?:[eEdD][-+]?[0-9]+)?)";

  private static final Pattern FIELD = Pattern.compile(
    "(hzpppm|dwelltime|deltat|badelt|echot)\\s*[=\\s]\\s*" + NUMBER,
    Pattern.CASE_INSENSITIVE);

  private final Path file;
  private final boolean conjugate;
  private ComplexArray data;
  private LcmRawHeader header;

  /**
   * Create a reader that conjugates the data, as required to match the
   * NIfTI-MRS phase convention.
   *
   * @param file .RAW or .H2O file
   */
  public LcmRawReader(Path file) {
    this(file, true);
  }

  /**
   * @param file .RAW or .H2O file
   * @param conjugate true to conjugate the data after reading
   */
  public LcmRawReader(Path file, boolean conjugate) {
    this.file = file;
    this.conjugate = conjugate;
  }

  /**
   * Read the header and data.
   *
   * @throws IOException if the file cannot be read
   * @throws MalformedInputException if a value cannot be parsed or the
   *         data does not hold complete real/imaginary pairs
   */
  public void read() throws IOException {
    List<String> headerLines = new ArrayList<String>();
    List<Double> values = new ArrayList<Double>();
    boolean inHeader = false;
    try (BufferedReader reader =
      Files.newBufferedReader(file, StandardCharsets.UTF_8))
    {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.indexOf('$') >= 0) {
          inHeader = true;
        }
        if (inHeader) {
          headerLines.add(line);
          if (line.toUpperCase(Locale.ROOT).contains("$END")) {
            inHeader = false;
          }
          continue;
        }
        for (String token : line.trim().split("\\s+")) {
          if (token.isEmpty()) {
            continue;
          }
          try {
            values.add(parseNumber(token));
          }
          catch (NumberFormatException e) {
            throw new MalformedInputException("line " + lineNumber,
              "Not a number: " + token, e);
          }
        }
      }
    }

    if (values.isEmpty() || values.size() % 2 != 0) {
      throw new MalformedInputException(null, String.format(
        "Expected real/imaginary pairs, found %d values", values.size()));
    }
    double[] interleaved = new double[values.size()];
    for (int i=0; i<interleaved.length; i++) {
      interleaved[i] = values.get(i);
    }
    data = new ComplexArray(new int[] {interleaved.length / 2}, interleaved);
    if (conjugate) {
      data = data.conjugate();
    }
    header = parseHeader(headerLines);
    LOGGER.debug("Read {} points from {}; {}", data.getSize(), file, header);
  }

  /**
   * @return complex FID; only valid after {@link #read()}
   */
  public ComplexArray getData() {
    return data;
  }

  /**
   * @return parsed header; only valid after {@link #read()}
   */
  public LcmRawHeader getHeader() {
    return header;
  }

  /**
   * Extract central frequency, dwell time and echo time.  When a field
   * appears more than once the last value wins.
   *
   * @param lines namelist lines
   * @return parsed header
   */
  static LcmRawHeader parseHeader(List<String> lines) {
    LcmRawHeader parsed = new LcmRawHeader();
    for (String line : lines) {
      Matcher m = FIELD.matcher(line);
      while (m.find()) {
        String key = m.group(1).toLowerCase(Locale.ROOT);
        double value;
        try {
          value = parseNumber(m.group(2));
        }
        catch (NumberFormatException e) {
          throw new MalformedInputException(key.toUpperCase(Locale.ROOT),
            "Not a number: " + m.group(2), e);
        }
        switch (key) {
          case "hzpppm":
            parsed.centralFrequency = value * 1e6;
            break;
          case "echot":
            parsed.echoTime = value / 1e3;
            break;
          default:
            parsed.dwellTime = value;
            parsed.bandwidth = 1 / value;
            break;
        }
      }
    }
    return parsed;
  }

  /**
   * Parse a number that may use a Fortran 'D' exponent.
   */
  private static double parseNumber(String token) {
    return Double.parseDouble(token.replace('d', 'e').replace('D', 'E'));
  }

}
