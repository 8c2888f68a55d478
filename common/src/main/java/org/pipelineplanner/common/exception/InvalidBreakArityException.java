/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.common.exception;

/** A pipeline break was built without any input subplan. */
public class InvalidBreakArityException extends PlanTranslationException {

  public InvalidBreakArityException(String operator) {
    super("Pipeline break requires at least one input subplan: " + operator);
  }
}
