/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import io.substrait.proto.Plan;
import io.substrait.proto.PlanRel;
import io.substrait.proto.RelRoot;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.pipelineplanner.common.exception.MalformedPlanException;
import org.pipelineplanner.planner.segment.SegmentPlan;
import org.pipelineplanner.planner.segment.SegmentPlanValidator;
import org.pipelineplanner.planner.segment.SegmentPlans;

/**
 * A translated query: the serialized Substrait plan, the parsed plan and the root of the segment
 * tree built from it.
 *
 * <p>Operators of the segment tree only reference relations of the parsed plan, so this handle
 * keeps the parsed plan reachable for as long as the segments are. Equality and hash code are
 * defined over the segment tree alone: two handles built from different bytes that translate to
 * the same tree are equal. The root segment is sealed on construction and can't be extended
 * afterwards.
 */
@Log4j2
public class QueryPlan {

  /** Nesting besides the relation levels: plan, plan relation, root and expressions. */
  private static final int PLAN_NESTING_HEADROOM = 100;

  private final byte[] planBytes;

  @Getter private final Plan substraitPlan;

  @Getter private final SegmentPlan root;

  QueryPlan(byte[] planBytes, Plan substraitPlan, SegmentPlan root) {
    this.planBytes = planBytes.clone();
    this.substraitPlan = substraitPlan;
    this.root = SegmentPlans.seal(root);
  }

  /** Parses and translates a serialized Substrait plan with default settings. */
  public static QueryPlan fromBytes(byte[] planBytes) {
    return fromBytes(planBytes, new SubstraitTranslator());
  }

  /**
   * Parses a serialized Substrait plan and translates its single root relation.
   *
   * @param planBytes serialized {@link Plan}
   * @param translator translator to use
   * @return the translated plan
   * @throws MalformedPlanException if the bytes can't be parsed or the plan doesn't have exactly
   *     one root relation
   */
  public static QueryPlan fromBytes(byte[] planBytes, SubstraitTranslator translator) {
    Plan substraitPlan;
    try {
      CodedInputStream input = CodedInputStream.newInstance(planBytes);
      input.setRecursionLimit(recursionLimit(translator.getMaxPlanDepth()));
      substraitPlan = Plan.parser().parseFrom(input);
    } catch (InvalidProtocolBufferException e) {
      throw new MalformedPlanException("Cannot parse Substrait plan", e);
    }

    RelRoot planRoot = findRoot(substraitPlan);
    SegmentPlan root = translator.translate(planRoot.getInput());
    return new QueryPlan(planBytes, substraitPlan, root);
  }

  /**
   * Protobuf nesting allowed while parsing a plan of the given relation depth. Each relation level
   * nests two messages, the {@code Rel} and its typed relation.
   */
  private static int recursionLimit(int maxPlanDepth) {
    return 2 * maxPlanDepth + PLAN_NESTING_HEADROOM;
  }

  /** A plan may hold many relation trees but exactly one of them must be the root. */
  private static RelRoot findRoot(Plan substraitPlan) {
    List<RelRoot> roots = new ArrayList<>();
    for (int i = 0; i < substraitPlan.getRelationsCount(); i++) {
      PlanRel relation = substraitPlan.getRelations(i);
      if (relation.hasRoot()) {
        roots.add(relation.getRoot());
      } else {
        log.debug("Skipping non-root relation {}", i);
      }
    }

    if (roots.size() != 1) {
      throw new MalformedPlanException(
          "Substrait plan must have exactly one root relation, found " + roots.size());
    }
    return roots.get(0);
  }

  /** Returns a copy of the serialized plan this handle was built from. */
  public byte[] getPlanBytes() {
    return planBytes.clone();
  }

  /** Renders the segment tree, see {@link SegmentPlan#explain()}. */
  public String explain() {
    return root.explain();
  }

  /** Returns the violations of the segment tree invariants, empty if there are none. */
  public List<String> validate() {
    return SegmentPlanValidator.validate(root);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QueryPlan)) {
      return false;
    }
    return root.equals(((QueryPlan) o).root);
  }

  @Override
  public int hashCode() {
    int planHash = root.hashCode();
    log.debug("Hash of QueryPlan: {}", planHash);
    return planHash;
  }

  @Override
  public String toString() {
    return "QueryPlan{root=" + root.describe() + '}';
  }
}
