/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

/**
 * Fields of interest from the namelist header of an LCModel .RAW file.
 * Fields that were not present are null.
 */
public class LcmRawHeader {

  /** Central frequency in Hz, from HZPPPM. */
  public Double centralFrequency;

  /** Dwell time in seconds, from DWELLTIME, DELTAT or BADELT. */
  public Double dwellTime;

  /** Reciprocal of the dwell time, in Hz. */
  public Double bandwidth;

  /** Echo time in seconds, from ECHOT (given in ms). */
  public Double echoTime;

  @Override
  public String toString() {
    return "centralFrequency=" + centralFrequency +
      ", dwellTime=" + dwellTime + ", echoTime=" + echoTime;
  }

}
