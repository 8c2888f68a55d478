/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

import io.substrait.proto.ReadRel;
import io.substrait.proto.Rel;
import java.util.List;
import java.util.Locale;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Operator representing a Substrait read relation.
 *
 * <p>Named after the referenced table, its name components joined with {@code /}. Reads without a
 * named table (virtual tables, local files, extension tables) are named after their read type.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class ReadOperator extends Operator {

  private final ReadRel relation;

  private final String name;

  public ReadOperator(ReadRel relation) {
    this.relation = relation;
    this.name =
        relation.hasNamedTable()
            ? String.join("/", relation.getNamedTable().getNamesList())
            : getReadType();
  }

  /** Returns the read type tag in lower case, e.g. {@code named_table} or {@code virtual_table}. */
  public String getReadType() {
    return relation.getReadTypeCase().name().toLowerCase(Locale.ROOT);
  }

  @Override
  public OperatorType getType() {
    return OperatorType.READ;
  }

  @Override
  public List<Rel> getInputs() {
    return List.of();
  }

  @Override
  public String describe() {
    return String.format("Read(%s)", getReadType());
  }
}
