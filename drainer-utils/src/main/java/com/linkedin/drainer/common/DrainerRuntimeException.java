/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.common;

/**
 * Common drainer exception for all unchecked exceptions
 */
public class DrainerRuntimeException extends RuntimeException {
  private static final long serialVersionUID = 1;

  /**
   * Constructor for DrainerRuntimeException
   */
  public DrainerRuntimeException() {
    super();
  }

  /**
   * Constructor for DrainerRuntimeException
   * @param message Exception message
   * @param cause Exception cause
   */
  public DrainerRuntimeException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Constructor for DrainerRuntimeException
   * @param message Exception message
   */
  public DrainerRuntimeException(String message) {
    super(message);
  }

  /**
   * Constructor for DrainerRuntimeException
   * @param cause Exception cause
   */
  public DrainerRuntimeException(Throwable cause) {
    super(cause);
  }
}
