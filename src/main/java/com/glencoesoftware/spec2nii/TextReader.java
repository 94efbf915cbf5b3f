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

/**
 * Reads an FID stored as whitespace separated text columns:
 * real part, then imaginary part.  Text following '#' is ignored.
 */
public final class TextReader {

  private TextReader() {
  }

  /**
   * @param file text file
   * @return one-dimensional complex array, one element per row
   * @throws IOException if the file cannot be read
   * @throws MalformedInputException if a row has fewer than two numeric
   *         columns or the file holds no data
   */
  public static ComplexArray read(Path file) throws IOException {
    List<Double> real = new ArrayList<Double>();
    List<Double> imaginary = new ArrayList<Double>();
    try (BufferedReader reader =
      Files.newBufferedReader(file, StandardCharsets.UTF_8))
    {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        int comment = line.indexOf('#');
        if (comment >= 0) {
          line = line.substring(0, comment);
        }
        line = line.trim();
        if (line.isEmpty()) {
          continue;
        }
        String[] columns = line.split("[\\s,]+");
        if (columns.length < 2) {
          throw new MalformedInputException("line " + lineNumber,
            "Expected real and imaginary columns");
        }
        try {
          real.add(Double.parseDouble(columns[0]));
          imaginary.add(Double.parseDouble(columns[1]));
        }
        catch (NumberFormatException e) {
          throw new MalformedInputException("line " + lineNumber,
            "Not a number: " + line, e);
        }
      }
    }
    if (real.isEmpty()) {
      throw new MalformedInputException(null, "No data found");
    }
    double[] re = new double[real.size()];
    double[] im = new double[imaginary.size()];
    for (int i=0; i<re.length; i++) {
      re[i] = real.get(i);
      im[i] = imaginary.get(i);
    }
    return ComplexArray.of(re, im);
  }

}
