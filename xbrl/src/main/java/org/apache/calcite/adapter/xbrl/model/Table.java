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

import java.util.List;

/** A hypercube: the axes that qualify a set of line items within one role. */
public final class Table {
  private final String elementId;
  private final String label;
  private final String roleUri;
  private final ImmutableList<String> axes;
  private final ImmutableList<String> lineItems;
  private final boolean closed;

  public Table(String elementId, String label, String roleUri, List<String> axes,
      List<String> lineItems, boolean closed) {
    this.elementId = elementId;
    this.label = label;
    this.roleUri = roleUri;
    this.axes = ImmutableList.copyOf(axes);
    this.lineItems = ImmutableList.copyOf(lineItems);
    this.closed = closed;
  }

  public String getElementId() { return elementId; }
  public String getLabel() { return label; }
  public String getRoleUri() { return roleUri; }
  public List<String> getAxes() { return axes; }
  public List<String> getLineItems() { return lineItems; }
  public boolean isClosed() { return closed; }

  @Override public String toString() {
    return String.format("Table{id='%s', role='%s', axes=%s}", elementId, roleUri, axes);
  }
}
