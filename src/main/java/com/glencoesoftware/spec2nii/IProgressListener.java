/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.spec2nii;

import java.util.EventListener;

public interface IProgressListener extends EventListener {

  /**
   * Indicates the total number of containers to be written for the
   * current input file.
   *
   * @param containerCount total number of containers
   */
  void notifyStart(int containerCount);

  /**
   * Indicates that the given container is about to be written.
   *
   * @param index container index
   * @param name container output name
   */
  void notifyContainerStart(int index, String name);

  /**
   * Indicates that the given container has been written.
   *
   * @param index container index
   * @param name container output name
   */
  void notifyContainerEnd(int index, String name);

  /**
   * Indicates that all containers have been written.
   */
  void notifyEnd();

}
