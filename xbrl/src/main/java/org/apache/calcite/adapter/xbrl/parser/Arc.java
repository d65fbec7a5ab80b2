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

import org.checkerframework.checker.nullness.qual.Nullable;

/** A relationship arc with both locators already resolved to normalized element ids. */
public final class Arc {
  private final String from;
  private final String to;
  private final @Nullable String arcrole;
  private final double order;
  private final double weight;
  private final @Nullable String preferredLabel;
  private final boolean closed;

  public Arc(String from, String to, @Nullable String arcrole, double order, double weight,
      @Nullable String preferredLabel, boolean closed) {
    this.from = from;
    this.to = to;
    this.arcrole = arcrole;
    this.order = order;
    this.weight = weight;
    this.preferredLabel = preferredLabel;
    this.closed = closed;
  }

  /** An arc with no arcrole, label or weight of its own. */
  public static Arc of(String from, String to, double order) {
    return new Arc(from, to, null, order, 1.0, null, false);
  }

  public String getFrom() { return from; }
  public String getTo() { return to; }
  public @Nullable String getArcrole() { return arcrole; }
  public double getOrder() { return order; }
  public double getWeight() { return weight; }
  public @Nullable String getPreferredLabel() { return preferredLabel; }
  public boolean isClosed() { return closed; }

  @Override public String toString() {
    return from + " -> " + to + " (order " + order + ")";
  }
}
