/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii.test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import com.glencoesoftware.spec2nii.ComplexArray;
import com.glencoesoftware.spec2nii.LcmRawHeader;
import com.glencoesoftware.spec2nii.LcmRawReader;
import com.glencoesoftware.spec2nii.MalformedInputException;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class LcmRawReaderTest {

  Path tmp;

  /**
   * Set logging to warn before all methods.
   *
   * @param tmp temporary directory for input files
   */
  @BeforeEach
  public void setup(@TempDir Path tmp) {
    this.tmp = tmp;
    ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
      LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.WARN);
  }

  private Path write(String name, String... lines) throws Exception {
    Path file = tmp.resolve(name);
    Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
    return file;
  }

  /**
   * Header values are converted to SI units and the data conjugated.
   */
  @Test
  public void testRead() throws Exception {
    Path file = write("svs.RAW",
      " $SEQPAR",
      " ECHOT = 30.0",
      " HZPPPM 128.0",
      " SEQ = 'PRESS'",
      " $END",
      " $NMID ID='svs', FMTDAT='(2E16.6)'",
      " VOLUME=8.0 TRAMP=1.0",
      " DELTAT 0.0002",
      " $END",
      "  1.0E+00  2.0E+00",
      "  3.0E+00 -4.0E+00",
      "  5.0D+00  6.0D+00");
    LcmRawReader reader = new LcmRawReader(file);
    reader.read();

    LcmRawHeader header = reader.getHeader();
    assertEquals(128e6, header.centralFrequency, 1e-3);
    assertEquals(0.0002, header.dwellTime, 1e-12);
    assertEquals(5000, header.bandwidth, 1e-9);
    assertEquals(0.03, header.echoTime, 1e-12);

    ComplexArray data = reader.getData();
    assertArrayEquals(new int[] {3}, data.getShape());
    assertEquals(1, data.getReal(0));
    assertEquals(-2, data.getImaginary(0));
    assertEquals(4, data.getImaginary(1));
    assertEquals(5, data.getReal(2));
  }

  /**
   * Conjugation can be switched off.
   */
  @Test
  public void testNoConjugate() throws Exception {
    Path file = write("svs.H2O", "$NMID DELTAT=5.0E-04 $END", "1 2", "3 4");
    LcmRawReader reader = new LcmRawReader(file, false);
    reader.read();
    assertEquals(2, reader.getData().getImaginary(0));
    assertEquals(0.0005, reader.getHeader().dwellTime, 1e-12);
    assertNull(reader.getHeader().centralFrequency);
  }

  /**
   * Data must hold complete real/imaginary pairs.
   */
  @Test
  public void testOddValueCount() throws Exception {
    Path file = write("odd.RAW", "$NMID $END", "1 2 3");
    LcmRawReader reader = new LcmRawReader(file);
    assertThrows(MalformedInputException.class, () -> reader.read());

    Path text = write("bad.RAW", "$NMID $END", "1 x");
    MalformedInputException e = assertThrows(MalformedInputException.class,
      () -> new LcmRawReader(text).read());
    assertEquals("line 2", e.getField());
  }

}
