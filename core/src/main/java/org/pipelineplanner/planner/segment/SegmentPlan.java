/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.planner.segment;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A node of the segmented plan tree: either a {@link PipelineSegment} or a {@link BreakSegment}.
 *
 * <p>Children are fixed at construction. Passing a segment as a child attaches it to its parent,
 * and handing a root to a query plan seals it the same way. An attached segment is never modified
 * again and cannot be attached a second time. Equality is structural over kind, name, operators
 * and children.
 */
@EqualsAndHashCode
public abstract class SegmentPlan {

  private static final String INDENT = "  ";

  @Getter private final String name;

  @Getter private final List<SegmentPlan> children;

  @EqualsAndHashCode.Exclude private boolean attached;

  protected SegmentPlan(String name, List<SegmentPlan> children) {
    this.name = name;
    this.children = ImmutableList.copyOf(children);
    checkDetached(this.children);
    this.children.forEach(SegmentPlan::attach);
  }

  /**
   * Fails unless every given segment is free to become a child: not attached yet and listed only
   * once. Runs before any segment is attached so a rejected plan leaves its inputs reusable.
   */
  private static void checkDetached(List<SegmentPlan> segments) {
    Set<SegmentPlan> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (SegmentPlan segment : segments) {
      if (segment.isAttached()) {
        throw new IllegalStateException(
            "Segment " + segment.getName() + " is already a child of another plan");
      }
      if (!seen.add(segment)) {
        throw new IllegalStateException("Segment " + segment.getName() + " is listed twice");
      }
    }
  }

  /** Returns true once this segment has become the child of another segment or been sealed. */
  public boolean isAttached() {
    return attached;
  }

  public boolean isLeaf() {
    return children.isEmpty();
  }

  public abstract <R, C> R accept(SegmentPlanVisitor<R, C> visitor, C context);

  /** One-line rendering of this segment without its children. */
  public abstract String describe();

  /**
   * Renders this segment and its subplans as an indented multi-line tree, children one level
   * deeper than their parent.
   */
  public String explain() {
    StringBuilder builder = new StringBuilder();
    explain(builder, 0);
    return builder.toString();
  }

  private void explain(StringBuilder builder, int depth) {
    if (builder.length() > 0) {
      builder.append('\n');
    }
    builder.append(Strings.repeat(INDENT, depth)).append(describe());
    for (SegmentPlan child : children) {
      child.explain(builder, depth + 1);
    }
  }

  void attach() {
    if (attached) {
      throw new IllegalStateException("Segment " + name + " is already a child of another plan");
    }
    attached = true;
  }

  @Override
  public String toString() {
    return describe();
  }
}
