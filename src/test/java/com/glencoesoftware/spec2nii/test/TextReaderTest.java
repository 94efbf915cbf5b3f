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
import com.glencoesoftware.spec2nii.MalformedInputException;
import com.glencoesoftware.spec2nii.TextReader;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TextReaderTest {

  @TempDir
  Path tmp;

  @Test
  public void testColumns() throws Exception {
    Path file = tmp.resolve("fid.txt");
    Files.write(file, Arrays.asList(
      "# exported FID",
      "1.0 -1.0",
      "",
      "2.5,3.5  # trailing comment",
      "\t-4e-3\t5.0\t0"), StandardCharsets.UTF_8);
    ComplexArray data = TextReader.read(file);
    assertArrayEquals(new int[] {3}, data.getShape());
    assertEquals(-1.0, data.getImaginary(0));
    assertEquals(2.5, data.getReal(1));
    assertEquals(-4e-3, data.getReal(2));
    assertEquals(5.0, data.getImaginary(2));
  }

  @Test
  public void testMalformed() throws Exception {
    Path single = tmp.resolve("single.txt");
    Files.write(single, Arrays.asList("1.0 2.0", "3.0"),
      StandardCharsets.UTF_8);
    MalformedInputException e = assertThrows(MalformedInputException.class,
      () -> TextReader.read(single));
    assertEquals("line 2", e.getField());

    Path empty = tmp.resolve("empty.txt");
    Files.write(empty, Arrays.asList("# nothing"), StandardCharsets.UTF_8);
    assertThrows(MalformedInputException.class, () -> TextReader.read(empty));
  }

}
