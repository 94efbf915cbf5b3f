/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

public class NoOpProgressListener implements IProgressListener {

  @Override
  public void notifyStart(int containerCount) {
  }

  @Override
  public void notifyContainerStart(int index, String name) {
  }

  @Override
  public void notifyContainerEnd(int index, String name) {
  }

  @Override
  public void notifyEnd() {
  }

}
