/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner;

import io.substrait.proto.Rel;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.pipelineplanner.common.exception.MalformedPlanException;
import org.pipelineplanner.common.setting.PlannerSettings;
import org.pipelineplanner.planner.operator.Operator;
import org.pipelineplanner.planner.operator.OperatorFactory;
import org.pipelineplanner.planner.segment.PipelineSegment;
import org.pipelineplanner.planner.segment.SegmentPlan;
import org.pipelineplanner.planner.segment.SegmentPlans;

/**
 * Translates a Substrait relation tree into a tree of pipeline and break segments.
 *
 * <p>Each relation is turned into an operator and classified by its pipeline role:
 *
 * <ul>
 *   <li><strong>SOURCE</strong> (read, partition source): starts a new leaf pipeline
 *   <li><strong>STREAMING</strong> (filter, projection, limit, sort): extends the pipeline of its
 *       input in place, or starts a pipeline on top of it when the input is a break
 *   <li><strong>BLOCKING</strong> (aggregation, joins, set operations): breaks the pipeline, one
 *       subplan per input
 * </ul>
 *
 * <p>For example:
 *
 * <pre>
 * Join                              BreakSegment(a.b) &lt;Join&gt;
 *   Filter                            PipelineSegment(a) &lt;Read&gt; [Filter]
 *     Read(a)              =&gt;         PipelineSegment(b) &lt;Read&gt; []
 *   Read(b)
 * </pre>
 *
 * <p>The translator holds no per-call state; sibling subtrees are translated independently and a
 * single instance can be shared.
 */
@Log4j2
public class SubstraitTranslator {

  private final OperatorFactory operatorFactory;

  private final int maxPlanDepth;

  public SubstraitTranslator() {
    this(PlannerSettings.defaults());
  }

  public SubstraitTranslator(PlannerSettings settings) {
    this(new OperatorFactory(settings), settings.getMaxPlanDepth());
  }

  SubstraitTranslator(OperatorFactory operatorFactory, int maxPlanDepth) {
    this.operatorFactory = operatorFactory;
    this.maxPlanDepth = maxPlanDepth;
  }

  /** Returns the deepest relation nesting this translator accepts. */
  public int getMaxPlanDepth() {
    return maxPlanDepth;
  }

  /**
   * Translates the relation tree rooted at the given relation.
   *
   * @param relation root relation, usually the input of a Substrait plan root
   * @return the root segment
   * @throws org.pipelineplanner.common.exception.PlanTranslationException if any relation of the
   *     tree cannot be translated; no partial plan is returned
   */
  public SegmentPlan translate(Rel relation) {
    return translate(relation, 1);
  }

  private SegmentPlan translate(Rel relation, int depth) {
    if (depth > maxPlanDepth) {
      throw new MalformedPlanException(
          "Relation tree is nested deeper than the allowed " + maxPlanDepth + " levels");
    }

    Operator operator = operatorFactory.create(relation);
    log.info("Translating {} as {}", relation.getRelTypeCase(), operator.getRole());

    return switch (operator.getRole()) {
      case SOURCE -> startPipeline(operator);
      case STREAMING -> extendPipeline(operator, depth);
      case BLOCKING -> breakPipeline(operator, depth);
    };
  }

  private SegmentPlan startPipeline(Operator source) {
    return SegmentPlans.newPipeline(source);
  }

  private SegmentPlan extendPipeline(Operator operator, int depth) {
    SegmentPlan subplan = translate(operator.getInputs().get(0), depth + 1);

    if (subplan instanceof PipelineSegment) {
      log.debug("Extending pipeline {} with {}", subplan.getName(), operator.describe());
      return ((PipelineSegment) subplan).append(operator);
    }

    log.debug("Starting pipeline over break {} with {}", subplan.getName(), operator.describe());
    return SegmentPlans.newPipeline(List.of(operator), subplan.getName(), List.of(subplan));
  }

  private SegmentPlan breakPipeline(Operator operator, int depth) {
    List<SegmentPlan> subplans = new ArrayList<>();
    for (Rel input : operator.getInputs()) {
      subplans.add(translate(input, depth + 1));
    }

    log.debug("Breaking pipeline at {} over {} subplans", operator.describe(), subplans.size());
    return SegmentPlans.newBreak(operator, subplans);
  }
}
