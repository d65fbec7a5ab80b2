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

import org.apache.calcite.adapter.xbrl.ElementIds;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/** Calculation network of one extended-link role. */
public final class CalculationTree {
  private final String roleUri;
  private final String definition;
  private final ImmutableList<String> rootElementIds;
  private final ImmutableMap<String, CalculationNode> nodes;

  public CalculationTree(String roleUri, String definition, List<String> rootElementIds,
      Map<String, CalculationNode> nodes) {
    this.roleUri = roleUri;
    this.definition = definition;
    this.rootElementIds = ImmutableList.copyOf(rootElementIds);
    this.nodes = ImmutableMap.copyOf(nodes);
  }

  public String getRoleUri() { return roleUri; }
  public String getDefinition() { return definition; }

  public String getRootElementId() {
    return rootElementIds.get(0);
  }

  public List<String> getRootElementIds() { return rootElementIds; }
  public Map<String, CalculationNode> getNodes() { return nodes; }

  public @Nullable CalculationNode getNode(String elementId) {
    return nodes.get(ElementIds.normalize(elementId));
  }

  @Override public String toString() {
    return String.format("CalculationTree{role='%s', nodes=%d}", roleUri, nodes.size());
  }
}
