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

import org.apache.calcite.adapter.xbrl.model.RoleType;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;

import org.w3c.dom.Element;

import java.util.List;
import java.util.Map;

/**
 * Role types and extended links found inside a schema's {@code xsd:appinfo}.
 * The links are DOM elements that the linkbase parsers read directly.
 */
public final class EmbeddedLinkbases {
  private static final EmbeddedLinkbases EMPTY =
      new EmbeddedLinkbases(ImmutableMap.of(), ImmutableListMultimap.of());

  private final ImmutableMap<String, RoleType> roleTypes;
  private final ImmutableListMultimap<LinkbaseType, Element> links;

  public EmbeddedLinkbases(Map<String, RoleType> roleTypes,
      ListMultimap<LinkbaseType, Element> links) {
    this.roleTypes = ImmutableMap.copyOf(roleTypes);
    this.links = ImmutableListMultimap.copyOf(links);
  }

  public static EmbeddedLinkbases empty() {
    return EMPTY;
  }

  /** Role types keyed by role URI. */
  public Map<String, RoleType> getRoleTypes() {
    return roleTypes;
  }

  public List<Element> getLinks(LinkbaseType type) {
    return links.get(type);
  }

  public boolean hasLinks(LinkbaseType type) {
    return links.containsKey(type);
  }
}
