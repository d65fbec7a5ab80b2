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
package org.apache.calcite.adapter.xbrl.statement;

import org.apache.calcite.adapter.xbrl.model.LineItem;
import org.apache.calcite.adapter.xbrl.model.StatementType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * A resolved statement of one filing: its line items plus the periods those
 * items carry values for, most recent first.
 */
public final class StatementData {
  private final String role;
  private final String definition;
  private final @Nullable StatementType type;
  private final ImmutableList<LineItem> lineItems;
  private final ImmutableMap<String, String> periods;

  public StatementData(String role, String definition, @Nullable StatementType type,
      List<LineItem> lineItems, Map<String, String> periods) {
    this.role = role;
    this.definition = definition;
    this.type = type;
    this.lineItems = ImmutableList.copyOf(lineItems);
    this.periods = ImmutableMap.copyOf(periods);
  }

  public String getRole() { return role; }
  public String getDefinition() { return definition; }
  public @Nullable StatementType getType() { return type; }
  public List<LineItem> getLineItems() { return lineItems; }

  /** Period key to display label. */
  public Map<String, String> getPeriods() { return periods; }

  @Override public String toString() {
    return String.format("StatementData{role='%s', items=%d, periods=%s}",
        role, lineItems.size(), periods.keySet());
  }
}
