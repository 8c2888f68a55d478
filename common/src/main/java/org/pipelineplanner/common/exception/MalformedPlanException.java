/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.common.exception;

/**
 * Thrown when the plan container itself is unusable: unparseable bytes, a missing or duplicated
 * root relation, or a relation tree nested deeper than the planner accepts.
 */
public class MalformedPlanException extends PlanTranslationException {

  public MalformedPlanException(String message) {
    super(message);
  }

  public MalformedPlanException(String message, Throwable cause) {
    super(message, cause);
  }
}
