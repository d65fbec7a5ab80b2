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
package org.apache.calcite.adapter.xbrl.parser;

import org.apache.calcite.adapter.xbrl.model.CalculationNode;
import org.apache.calcite.adapter.xbrl.model.CalculationTree;
import org.apache.calcite.adapter.xbrl.model.ElementCatalog;
import org.apache.calcite.adapter.xbrl.model.ElementCatalogEntry;
import org.apache.calcite.adapter.xbrl.model.PresentationNode;
import org.apache.calcite.adapter.xbrl.model.PresentationTree;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds presentation and calculation trees for one role from its arcs.
 *
 * <p>Roots are elements that appear as an arc source but never as a target.
 * Children are visited in ascending {@code order}; an element reached a second
 * time (a shared child or a cycle in malformed input) is not expanded again.
 */
public final class TreeBuilder {

  private TreeBuilder() {
  }

  /** Elements that are {@code from} in some arc and {@code to} in none, in arc order. */
  public static List<String> findRoots(List<Arc> arcs) {
    Set<String> targets = new HashSet<>();
    for (Arc arc : arcs) {
      targets.add(arc.getTo());
    }
    Set<String> roots = new LinkedHashSet<>();
    for (Arc arc : arcs) {
      if (!targets.contains(arc.getFrom())) {
        roots.add(arc.getFrom());
      }
    }
    return new ArrayList<>(roots);
  }

  /** Outgoing arcs per source element, each list sorted by order. */
  static ListMultimap<String, Arc> childArcs(List<Arc> arcs) {
    List<Arc> sorted = new ArrayList<>(arcs);
    sorted.sort(Comparator.comparingDouble(Arc::getOrder));
    ListMultimap<String, Arc> children = ArrayListMultimap.create();
    for (Arc arc : sorted) {
      children.put(arc.getFrom(), arc);
    }
    return children;
  }

  /**
   * Builds the presentation tree of a role.
   *
   * @return the tree, or null when the arcs have no root
   */
  public static @Nullable PresentationTree buildPresentationTree(String roleUri,
      String definition, List<Arc> arcs, ElementCatalog catalog) {
    List<String> roots = findRoots(arcs);
    if (roots.isEmpty()) {
      return null;
    }
    ListMultimap<String, Arc> children = childArcs(arcs);
    Map<String, PresentationNode> nodes = new LinkedHashMap<>();
    for (String root : roots) {
      addPresentationNode(root, null, null, 0, children, catalog, nodes);
    }
    return new PresentationTree(roleUri, definition, roots, nodes);
  }

  private static void addPresentationNode(String elementId, @Nullable Arc via,
      @Nullable String parent, int depth, ListMultimap<String, Arc> childArcs,
      ElementCatalog catalog, Map<String, PresentationNode> nodes) {
    if (nodes.containsKey(elementId)) {
      return;
    }
    List<Arc> arcs = childArcs.get(elementId);
    List<String> childIds = new ArrayList<>(arcs.size());
    for (Arc arc : arcs) {
      childIds.add(arc.getTo());
    }
    ElementCatalogEntry entry = catalog.get(elementId);
    String standardLabel = entry != null && entry.getStandardLabel() != null
        ? entry.getStandardLabel()
        : elementId;
    nodes.put(elementId,
        new PresentationNode(elementId, parent, childIds,
            via == null ? 0.0 : via.getOrder(),
            via == null ? null : via.getPreferredLabel(),
            depth, isAbstract(elementId, entry), standardLabel,
            entry == null ? ImmutableMap.<String, String>of() : entry.getLabels()));
    for (Arc arc : arcs) {
      addPresentationNode(arc.getTo(), arc, elementId, depth + 1, childArcs, catalog, nodes);
    }
  }

  /**
   * Abstract flag from the catalog; an element missing from the catalog is
   * treated as abstract when its name ends in {@code Abstract}.
   */
  static boolean isAbstract(String elementId, @Nullable ElementCatalogEntry entry) {
    if (entry != null && !entry.getDataType().isEmpty()) {
      return entry.isAbstract();
    }
    return elementId.endsWith("Abstract");
  }

  /**
   * Builds the calculation tree of a role.
   *
   * @return the tree, or null when the arcs have no root
   */
  public static @Nullable CalculationTree buildCalculationTree(String roleUri,
      String definition, List<Arc> arcs, ElementCatalog catalog) {
    List<String> roots = findRoots(arcs);
    if (roots.isEmpty()) {
      return null;
    }
    ListMultimap<String, Arc> children = childArcs(arcs);
    Map<String, CalculationNode> nodes = new LinkedHashMap<>();
    for (String root : roots) {
      addCalculationNode(root, null, null, children, catalog, nodes);
    }
    return new CalculationTree(roleUri, definition, roots, nodes);
  }

  private static void addCalculationNode(String elementId, @Nullable Arc via,
      @Nullable String parent, ListMultimap<String, Arc> childArcs, ElementCatalog catalog,
      Map<String, CalculationNode> nodes) {
    if (nodes.containsKey(elementId)) {
      return;
    }
    List<Arc> arcs = childArcs.get(elementId);
    List<String> childIds = new ArrayList<>(arcs.size());
    for (Arc arc : arcs) {
      childIds.add(arc.getTo());
    }
    ElementCatalogEntry entry = catalog.get(elementId);
    nodes.put(elementId,
        new CalculationNode(elementId, parent, childIds,
            via == null ? 1.0 : via.getWeight(),
            via == null ? 0.0 : via.getOrder(),
            entry == null ? null : entry.getBalance(),
            entry == null ? null : entry.getPeriodType()));
    for (Arc arc : arcs) {
      addCalculationNode(arc.getTo(), arc, elementId, childArcs, catalog, nodes);
    }
  }
}
