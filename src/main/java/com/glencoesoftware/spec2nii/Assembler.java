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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a reordered acquisition into NIfTI-MRS output containers.
 * <p>
 * The reordered array has the time axis first followed by one axis per
 * dimension tag.  Three singleton spatial axes are prepended; NIfTI
 * supports three tagged dimensions, so any axes beyond those are
 * enumerated and written to separate containers.
 */
public final class Assembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(Assembler.class);

  /** Spatial axes prepended to every container. */
  private static final int SPATIAL_AXES = 3;

  /** Time axis plus the tagged dimensions kept in each container. */
  private static final int KEPT_AXES = 1 + HeaderExtension.MAX_TAGGED_DIMS;

  private Assembler() {
  }

  /**
   * Assemble output containers.  Either every container is returned or an
   * exception is thrown.
   *
   * @param reordered data with the time axis first
   * @param tags one tag per non-time axis of the data
   * @param affine voxel to scanner transform shared by all containers
   * @param dwellTime dwell time in seconds
   * @param meta header extension fields; tags of the kept dimensions are
   *             added before the header is built once and shared
   * @param baseName output name, extended with "_&lt;tag&gt;&lt;index&gt;" for
   *                 each enumerated axis
   * @return containers in row-major order of the enumerated axes
   * @throws MalformedInputException if the dwell time is not a positive
   *         finite number
   */
  public static List<OutputContainer> assemble(ComplexArray reordered,
    List<String> tags, AffineTransform affine, double dwellTime,
    HeaderExtension.Builder meta, String baseName)
  {
    int rank = reordered.getRank();
    if (tags.size() != rank - 1) {
      throw new IllegalArgumentException(String.format(
        "%d tags for %d non-time axes", tags.size(), rank - 1));
    }
    if (!Double.isFinite(dwellTime) || dwellTime <= 0) {
      throw new MalformedInputException("dwellTime",
        "Expected a positive dwell time, found " + dwellTime);
    }

    int kept = Math.min(rank, KEPT_AXES);
    for (int i=0; i<kept - 1; i++) {
      meta.setDimInfo(i, tags.get(i));
    }
    HeaderExtension header = meta.build();

    List<OutputContainer> containers = new ArrayList<OutputContainer>();
    if (rank <= KEPT_AXES) {
      containers.add(new OutputContainer(baseName,
        reordered.padLeading(SPATIAL_AXES), affine, dwellTime, header));
    }
    else {
      int[] shape = reordered.getShape();
      int[] enumerated = Arrays.copyOfRange(shape, KEPT_AXES, rank);
      int[] index = new int[enumerated.length];
      LOGGER.info("Splitting {} into containers over axes {} ({})",
        Arrays.toString(shape), tags.subList(KEPT_AXES - 1, rank - 1),
        Arrays.toString(enumerated));
      do {
        StringBuilder name = new StringBuilder(baseName);
        for (int i=0; i<index.length; i++) {
          name.append(String.format("_%s%03d",
            tags.get(KEPT_AXES - 1 + i), index[i]));
        }
        ComplexArray slice =
          reordered.sliceTrailing(index).padLeading(SPATIAL_AXES);
        containers.add(new OutputContainer(name.toString(), slice, affine,
          dwellTime, header));
      } while (ComplexArray.increment(index, enumerated));
    }
    LOGGER.debug("Assembled {} container(s)", containers.size());
    return Collections.unmodifiableList(containers);
  }

}
