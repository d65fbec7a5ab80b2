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

import org.checkerframework.checker.nullness.qual.Nullable;

/** A dimension (axis) of a hypercube. */
public final class Axis {
  private final String elementId;
  private final String label;
  private final @Nullable String domainId;
  private final @Nullable String defaultMemberId;

  public Axis(String elementId, String label, @Nullable String domainId,
      @Nullable String defaultMemberId) {
    this.elementId = elementId;
    this.label = label;
    this.domainId = domainId;
    this.defaultMemberId = defaultMemberId;
  }

  public String getElementId() { return elementId; }
  public String getLabel() { return label; }
  public @Nullable String getDomainId() { return domainId; }
  public @Nullable String getDefaultMemberId() { return defaultMemberId; }

  @Override public String toString() {
    return "Axis{" + elementId + " -> " + domainId + "}";
  }
}
