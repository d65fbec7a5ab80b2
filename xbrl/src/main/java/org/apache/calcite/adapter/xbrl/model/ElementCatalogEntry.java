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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Declared metadata of one taxonomy element: type, period type, balance,
 * abstract flag and its labels keyed by label role.
 */
public final class ElementCatalogEntry {
  public static final String INSTANT = "instant";
  public static final String DURATION = "duration";

  private final String elementId;
  private final String dataType;
  private final String periodType;
  private final @Nullable String balance;
  private final boolean isAbstract;
  private final ImmutableMap<String, String> labels;

  public ElementCatalogEntry(String elementId, String dataType, String periodType,
      @Nullable String balance, boolean isAbstract, Map<String, String> labels) {
    this.elementId = elementId;
    this.dataType = dataType;
    this.periodType = periodType;
    this.balance = balance;
    this.isAbstract = isAbstract;
    this.labels = ImmutableMap.copyOf(labels);
  }

  public String getElementId() { return elementId; }
  public String getDataType() { return dataType; }
  public String getPeriodType() { return periodType; }
  public @Nullable String getBalance() { return balance; }
  public boolean isAbstract() { return isAbstract; }
  public Map<String, String> getLabels() { return labels; }

  public @Nullable String getLabel(String role) {
    return labels.get(role);
  }

  public @Nullable String getStandardLabel() {
    return labels.get(LabelRoles.STANDARD);
  }

  @Override public String toString() {
    return String.format("ElementCatalogEntry{id='%s', type='%s', periodType='%s', balance=%s}",
        elementId, dataType, periodType, balance);
  }
}
