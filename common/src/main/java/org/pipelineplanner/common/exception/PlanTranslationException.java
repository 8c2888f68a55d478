/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.common.exception;

/** Base class of the failures raised while turning a serialized plan into segments. */
public class PlanTranslationException extends RuntimeException {

  public PlanTranslationException(String message) {
    super(message);
  }

  public PlanTranslationException(String message, Throwable cause) {
    super(message, cause);
  }
}
