/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import me.tongfei.progressbar.DelegatingProgressBarConsumer;
import me.tongfei.progressbar.ProgressBar;
import me.tongfei.progressbar.ProgressBarBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProgressBarListener implements IProgressListener {

  // not a typo - the progress bar consumes Converter's logging output
  private static final Logger LOGGER = LoggerFactory.getLogger(Converter.class);

  private String logLevel;
  private ProgressBar pb;

  /**
   * Create a new progress listener that displays a progress bar.
   *
   * @param level logging level
   */
  public ProgressBarListener(String level) {
    logLevel = level;
  }

  @Override
  public void notifyStart(int containerCount) {
    ProgressBarBuilder builder = new ProgressBarBuilder()
      .setInitialMax(containerCount)
      .setTaskName("Writing");

    if (!(logLevel.equalsIgnoreCase("OFF") ||
      logLevel.equalsIgnoreCase("ERROR") ||
      logLevel.equalsIgnoreCase("WARN")))
    {
      builder.setConsumer(new DelegatingProgressBarConsumer(LOGGER::trace));
    }
    pb = builder.build();
  }

  @Override
  public void notifyContainerStart(int index, String name) {
    if (pb != null) {
      pb.setExtraMessage(name);
    }
  }

  @Override
  public void notifyContainerEnd(int index, String name) {
    if (pb != null) {
      pb.step();
    }
  }

  @Override
  public void notifyEnd() {
    if (pb != null) {
      pb.close();
      pb = null;
    }
  }

}
