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

/** A {@code link:roleType} declaration from a schema. */
public final class RoleType {
  private final String roleUri;
  private final String id;
  private final String definition;
  private final ImmutableList<String> usedOn;

  public RoleType(String roleUri, String id, String definition, List<String> usedOn) {
    this.roleUri = roleUri;
    this.id = id;
    this.definition = definition;
    this.usedOn = ImmutableList.copyOf(usedOn);
  }

  public String getRoleUri() { return roleUri; }
  public String getId() { return id; }
  public String getDefinition() { return definition; }
  public List<String> getUsedOn() { return usedOn; }
}
