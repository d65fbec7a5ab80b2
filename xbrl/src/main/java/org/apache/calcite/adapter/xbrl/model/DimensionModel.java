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

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/** Axes, domains and tables read from the definition linkbase. */
public final class DimensionModel {
  private final ImmutableMap<String, Axis> axes;
  private final ImmutableMap<String, Domain> domains;
  private final ImmutableListMultimap<String, Table> tablesByRole;

  public DimensionModel(Map<String, Axis> axes, Map<String, Domain> domains,
      ListMultimap<String, Table> tablesByRole) {
    this.axes = ImmutableMap.copyOf(axes);
    this.domains = ImmutableMap.copyOf(domains);
    this.tablesByRole = ImmutableListMultimap.copyOf(tablesByRole);
  }

  public static DimensionModel empty() {
    return new DimensionModel(ImmutableMap.of(), ImmutableMap.of(),
        ImmutableListMultimap.of());
  }

  public @Nullable Axis getAxis(String elementId) {
    return axes.get(ElementIds.normalize(elementId));
  }

  public @Nullable Domain getDomain(String elementId) {
    return domains.get(ElementIds.normalize(elementId));
  }

  public Map<String, Axis> getAxes() { return axes; }
  public Map<String, Domain> getDomains() { return domains; }

  public List<Table> getTables(String roleUri) {
    return tablesByRole.get(roleUri);
  }

  public ListMultimap<String, Table> getTablesByRole() {
    return tablesByRole;
  }

  /** Whether any table of {@code roleUri} declares {@code dimensionId} as one of its axes. */
  public boolean isAxisOfRole(String roleUri, String dimensionId) {
    String normalized = ElementIds.normalize(dimensionId);
    for (Table table : tablesByRole.get(roleUri)) {
      if (table.getAxes().contains(normalized)) {
        return true;
      }
    }
    return false;
  }
}
