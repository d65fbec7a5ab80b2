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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/** A node of a calculation tree; {@code weight} is the signed roll-up weight of its arc. */
public final class CalculationNode {
  private final String elementId;
  private final @Nullable String parent;
  private final ImmutableList<String> children;
  private final double weight;
  private final double order;
  private final @Nullable String balance;
  private final @Nullable String periodType;

  public CalculationNode(String elementId, @Nullable String parent, List<String> children,
      double weight, double order, @Nullable String balance, @Nullable String periodType) {
    this.elementId = elementId;
    this.parent = parent;
    this.children = ImmutableList.copyOf(children);
    this.weight = weight;
    this.order = order;
    this.balance = balance;
    this.periodType = periodType;
  }

  public String getElementId() { return elementId; }
  public @Nullable String getParent() { return parent; }
  public List<String> getChildren() { return children; }
  public double getWeight() { return weight; }
  public double getOrder() { return order; }
  public @Nullable String getBalance() { return balance; }
  public @Nullable String getPeriodType() { return periodType; }

  @Override public String toString() {
    return String.format("CalculationNode{id='%s', weight=%s}", elementId, weight);
  }
}
