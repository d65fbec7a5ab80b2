/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.xbrl.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/** A node of a presentation tree. */
public final class PresentationNode {
  private final String elementId;
  private final @Nullable String parent;
  private final ImmutableList<String> children;
  private final double order;
  private final @Nullable String preferredLabel;
  private final int depth;
  private final boolean isAbstract;
  private final @Nullable String standardLabel;
  private final ImmutableMap<String, String> labels;

  public PresentationNode(String elementId, @Nullable String parent, List<String> children,
      double order, @Nullable String preferredLabel, int depth, boolean isAbstract,
      @Nullable String standardLabel, Map<String, String> labels) {
    this.elementId = elementId;
    this.parent = parent;
    this.children = ImmutableList.copyOf(children);
    this.order = order;
    this.preferredLabel = preferredLabel;
    this.depth = depth;
    this.isAbstract = isAbstract;
    this.standardLabel = standardLabel;
    this.labels = ImmutableMap.copyOf(labels);
  }

  public String getElementId() { return elementId; }
  public @Nullable String getParent() { return parent; }
  public List<String> getChildren() { return children; }
  public double getOrder() { return order; }
  public @Nullable String getPreferredLabel() { return preferredLabel; }
  public int getDepth() { return depth; }
  public boolean isAbstract() { return isAbstract; }
  public @Nullable String getStandardLabel() { return standardLabel; }
  public Map<String, String> getLabels() { return labels; }

  /**
   * Label to show for this position in the tree. Tries, in order, the preferred
   * label role, the terse label, the standard label, any label, then the element id.
   */
  public String getDisplayLabel() {
    if (preferredLabel != null && labels.containsKey(preferredLabel)) {
      return labels.get(preferredLabel);
    }
    if (labels.containsKey(LabelRoles.TERSE)) {
      return labels.get(LabelRoles.TERSE);
    }
    if (standardLabel != null && !standardLabel.isEmpty()) {
      return standardLabel;
    }
    if (!labels.isEmpty()) {
      return labels.values().iterator().next();
    }
    return elementId;
  }

  @Override public String toString() {
    return String.format("PresentationNode{id='%s', depth=%d, children=%d}",
        elementId, depth, children.size());
  }
}
