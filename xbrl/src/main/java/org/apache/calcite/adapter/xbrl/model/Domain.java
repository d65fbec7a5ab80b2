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

/** A domain, or a member that has members of its own, with its ordered members. */
public final class Domain {
  private final String elementId;
  private final String label;
  private final ImmutableList<String> members;
  private final @Nullable String parent;

  public Domain(String elementId, String label, List<String> members, @Nullable String parent) {
    this.elementId = elementId;
    this.label = label;
    this.members = ImmutableList.copyOf(members);
    this.parent = parent;
  }

  public String getElementId() { return elementId; }
  public String getLabel() { return label; }
  public List<String> getMembers() { return members; }
  public @Nullable String getParent() { return parent; }

  @Override public String toString() {
    return "Domain{" + elementId + ", members=" + members + "}";
  }
}
