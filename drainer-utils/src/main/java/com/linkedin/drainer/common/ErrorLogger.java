/**
 *  Copyright 2019 LinkedIn Corporation. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.linkedin.drainer.common;

import java.util.function.BiFunction;

import org.slf4j.Logger;


/**
 * Helper utility methods for error logging.
 */
public final class ErrorLogger {

  private ErrorLogger() {
  }

  /**
   * Log the error and build the exception the caller should throw, e.g.
   * {@code throw ErrorLogger.logAndWrap(LOG, msg, e, DrainerRuntimeException::new)}.
   * @param log logger object
   * @param msg error message
   * @param t inner exception, may be null
   * @param factory creates the exception from the message and the (possibly null) cause
   * @return the exception to throw
   */
  public static <E extends RuntimeException> E logAndWrap(Logger log, String msg, Throwable t,
      BiFunction<String, Throwable, E> factory) {
    if (t != null) {
      log.error(msg, t);
    } else {
      log.error(msg);
    }
    return factory.apply(msg, t);
  }
}
