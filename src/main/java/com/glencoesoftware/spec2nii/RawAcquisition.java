/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Complex data and header of one acquisition, as extracted from a vendor
 * file.  Axis 0 of the data is the time/frequency axis; every axis has a
 * vendor name.
 */
public final class RawAcquisition {

  private final ComplexArray data;
  private final List<String> axisNames;
  private final VendorRevision revision;
  private final AcquisitionHeader header;
  private final String fileName;

  /**
   * @param data complex data, time axis first
   * @param axisNames vendor name of each axis of the data
   * @param revision vendor software revision
   * @param header vendor header fields
   * @param fileName name of the source file
   */
  public RawAcquisition(ComplexArray data, List<String> axisNames,
    VendorRevision revision, AcquisitionHeader header, String fileName)
  {
    if (axisNames.size() != data.getRank()) {
      throw new MalformedInputException(null, String.format(
        "%d axis names %s for data of shape %s", axisNames.size(), axisNames,
        Arrays.toString(data.getShape()))).attachSource(fileName);
    }
    this.data = data;
    this.axisNames = Collections.unmodifiableList(
      new ArrayList<String>(axisNames));
    this.revision = revision;
    this.header = header;
    this.fileName = fileName;
  }

  public ComplexArray getData() {
    return data;
  }

  public List<String> getAxisNames() {
    return axisNames;
  }

  public VendorRevision getRevision() {
    return revision;
  }

  public AcquisitionHeader getHeader() {
    return header;
  }

  public String getFileName() {
    return fileName;
  }

}
