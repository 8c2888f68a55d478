/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.operator;

import io.substrait.proto.ExtensionLeafRel;
import io.substrait.proto.Rel;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.pipelineplanner.proto.PartitionSourceRel;

/**
 * Operator representing a read of one partition of a domain. The partition address travels as a
 * {@link PartitionSourceRel} packed into the detail of a Substrait extension leaf relation.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class PartitionSourceOperator extends Operator {

  private final ExtensionLeafRel relation;

  /** Partition address unpacked from the relation detail. */
  private final PartitionSourceRel partitionSource;

  public PartitionSourceOperator(ExtensionLeafRel relation, PartitionSourceRel partitionSource) {
    this.relation = relation;
    this.partitionSource = partitionSource;
  }

  public String getDomain() {
    return partitionSource.getDomain();
  }

  public String getPartition() {
    return partitionSource.getPartition();
  }

  @Override
  public String getName() {
    return getDomain() + "/" + getPartition();
  }

  @Override
  public OperatorType getType() {
    return OperatorType.PARTITION_SOURCE;
  }

  @Override
  public List<Rel> getInputs() {
    return List.of();
  }

  @Override
  public String describe() {
    return String.format("PartitionSource(%s)", getName());
  }
}
