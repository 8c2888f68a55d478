/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

import io.substrait.proto.Rel;
import java.util.List;

/**
 * Base class of the operators a Substrait relation translates to.
 *
 * <p>An operator is a read-only view over exactly one relation message plus whatever metadata can
 * be derived from it (a display name for leaf operators). Operators never modify the relation they
 * wrap. Two operators are equal when they have the same type and wrap equal relation messages.
 */
public abstract class Operator {

  /** Returns the type of this operator, which determines its pipeline role. */
  public abstract OperatorType getType();

  /** Returns the child relations of the wrapped relation, in declaration order. */
  public abstract List<Rel> getInputs();

  /** Returns a short diagnostic rendering of this operator. */
  public abstract String describe();

  /**
   * Returns the identity name of this operator, or null if the operator has none. Only leaf
   * operators carry a name; the segments above them derive theirs from their children.
   */
  public String getName() {
    return null;
  }

  public PipelineRole getRole() {
    return getType().getRole();
  }

  @Override
  public String toString() {
    return describe();
  }
}
