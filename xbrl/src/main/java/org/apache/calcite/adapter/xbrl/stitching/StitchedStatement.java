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
package org.apache.calcite.adapter.xbrl.stitching;

import org.apache.calcite.adapter.xbrl.model.StatementType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/** A statement combined across filings. */
public final class StitchedStatement {
  private final @Nullable StatementType type;
  private final ImmutableMap<String, String> periods;
  private final ImmutableList<StitchedRow> rows;

  StitchedStatement(@Nullable StatementType type, Map<String, String> periods,
      List<StitchedRow> rows) {
    this.type = type;
    this.periods = ImmutableMap.copyOf(periods);
    this.rows = ImmutableList.copyOf(rows);
  }

  public @Nullable StatementType getType() {
    return type;
  }

  /** Selected period keys, most recent first, with their display labels. */
  public Map<String, String> getPeriods() {
    return periods;
  }

  public List<String> getPeriodKeys() {
    return periods.keySet().asList();
  }

  public List<StitchedRow> getRows() {
    return rows;
  }

  public @Nullable StitchedRow getRow(String label) {
    for (StitchedRow row : rows) {
      if (row.getLabel().equals(label)) {
        return row;
      }
    }
    return null;
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  @Override public String toString() {
    return String.format("StitchedStatement{type=%s, periods=%s, rows=%d}",
        type, periods.keySet(), rows.size());
  }
}
