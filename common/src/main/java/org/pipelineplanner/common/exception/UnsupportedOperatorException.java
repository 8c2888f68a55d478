/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.common.exception;

import lombok.Getter;

/**
 * Thrown when a relation has no registered translation, e.g. a Substrait extension relation that
 * has no operator counterpart. Aborts the whole translation.
 */
@Getter
public class UnsupportedOperatorException extends PlanTranslationException {

  /** Name of the relation kind that could not be translated. */
  private final String relationKind;

  public UnsupportedOperatorException(String relationKind) {
    this(relationKind, "No translation for relation kind: " + relationKind);
  }

  public UnsupportedOperatorException(String relationKind, String message) {
    super(message);
    this.relationKind = relationKind;
  }
}
