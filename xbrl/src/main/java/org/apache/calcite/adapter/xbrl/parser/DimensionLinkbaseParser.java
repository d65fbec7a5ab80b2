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

import org.apache.calcite.adapter.xbrl.model.Axis;
import org.apache.calcite.adapter.xbrl.model.DimensionModel;
import org.apache.calcite.adapter.xbrl.model.Domain;
import org.apache.calcite.adapter.xbrl.model.ElementCatalog;
import org.apache.calcite.adapter.xbrl.model.Table;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds axes, domains and hypercube tables from definition-linkbase arcs.
 *
 * <p>Arcs are classified by arcrole. {@code hypercube-dimension} attaches axes
 * to a table, {@code dimension-domain} gives an axis its domain,
 * {@code domain-member} lists members (recursively), {@code dimension-default}
 * names an axis's default member, and {@code all} ties a table to the line
 * items of a role. A table without axes is discarded.
 */
public class DimensionLinkbaseParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(DimensionLinkbaseParser.class);

  public DimensionModel build(Map<String, List<Arc>> arcsByRole, ElementCatalog catalog) {
    Map<String, AxisState> axes = new LinkedHashMap<>();
    Set<String> domainRoots = new LinkedHashSet<>();
    ListMultimap<String, String> members = ArrayListMultimap.create();
    ListMultimap<String, Table> tables = ArrayListMultimap.create();

    for (Map.Entry<String, List<Arc>> role : arcsByRole.entrySet()) {
      List<Arc> arcs = new ArrayList<>(role.getValue());
      arcs.sort(Comparator.comparingDouble(Arc::getOrder));
      Map<String, List<String>> hypercubeAxes = new LinkedHashMap<>();
      List<Arc> allArcs = new ArrayList<>();

      for (Arc arc : arcs) {
        String arcrole = arc.getArcrole();
        if (XbrlNamespaces.ARCROLE_HYPERCUBE_DIMENSION.equals(arcrole)) {
          List<String> tableAxes =
              hypercubeAxes.computeIfAbsent(arc.getFrom(), k -> new ArrayList<>());
          if (!tableAxes.contains(arc.getTo())) {
            tableAxes.add(arc.getTo());
          }
          axes.computeIfAbsent(arc.getTo(), k -> new AxisState());
        } else if (XbrlNamespaces.ARCROLE_DIMENSION_DOMAIN.equals(arcrole)) {
          axes.computeIfAbsent(arc.getFrom(), k -> new AxisState()).domainId = arc.getTo();
          domainRoots.add(arc.getTo());
        } else if (XbrlNamespaces.ARCROLE_DOMAIN_MEMBER.equals(arcrole)) {
          if (!members.containsEntry(arc.getFrom(), arc.getTo())) {
            members.put(arc.getFrom(), arc.getTo());
          }
        } else if (XbrlNamespaces.ARCROLE_DIMENSION_DEFAULT.equals(arcrole)) {
          axes.computeIfAbsent(arc.getFrom(), k -> new AxisState()).defaultMemberId =
              arc.getTo();
        } else if (XbrlNamespaces.ARCROLE_ALL.equals(arcrole)) {
          allArcs.add(arc);
        }
      }

      for (Arc arc : allArcs) {
        Table table = toTable(arc, role.getKey(), hypercubeAxes, catalog);
        if (table != null) {
          tables.put(role.getKey(), table);
        }
      }
    }

    Map<String, Axis> axisMap = new LinkedHashMap<>();
    for (Map.Entry<String, AxisState> e : axes.entrySet()) {
      axisMap.put(e.getKey(),
          new Axis(e.getKey(), catalog.labelOf(e.getKey()), e.getValue().domainId,
              e.getValue().defaultMemberId));
    }
    Map<String, Domain> domains = buildDomains(domainRoots, members, catalog);
    LOGGER.debug("Built {} axes, {} domains and {} tables", axisMap.size(), domains.size(),
        tables.size());
    return new DimensionModel(axisMap, domains, tables);
  }

  /**
   * An {@code all} arc runs from the line items to the hypercube; some filers
   * write it the other way round, so either end may be the table.
   */
  private static @Nullable Table toTable(Arc arc, String roleUri,
      Map<String, List<String>> hypercubeAxes, ElementCatalog catalog) {
    String tableId;
    String lineItems;
    if (hypercubeAxes.containsKey(arc.getTo())) {
      tableId = arc.getTo();
      lineItems = arc.getFrom();
    } else if (hypercubeAxes.containsKey(arc.getFrom())) {
      tableId = arc.getFrom();
      lineItems = arc.getTo();
    } else {
      return null;
    }
    return new Table(tableId, catalog.labelOf(tableId), roleUri, hypercubeAxes.get(tableId),
        ImmutableList.of(lineItems), arc.isClosed());
  }

  /** Domains reachable from axis domains; members with members of their own become domains. */
  private static Map<String, Domain> buildDomains(Set<String> roots,
      ListMultimap<String, String> members, ElementCatalog catalog) {
    Map<String, Domain> domains = new LinkedHashMap<>();
    Deque<String[]> queue = new ArrayDeque<>();
    for (String root : roots) {
      queue.add(new String[] {root, null});
    }
    while (!queue.isEmpty()) {
      String[] next = queue.poll();
      String id = next[0];
      if (domains.containsKey(id)) {
        continue;
      }
      List<String> children = members.get(id);
      domains.put(id, new Domain(id, catalog.labelOf(id), children, next[1]));
      for (String child : children) {
        if (members.containsKey(child)) {
          queue.add(new String[] {child, id});
        }
      }
    }
    return domains;
  }

  /** Mutable axis properties collected across arcs. */
  private static final class AxisState {
    @Nullable String domainId;
    @Nullable String defaultMemberId;
  }
}
