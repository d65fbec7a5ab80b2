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

import org.apache.calcite.adapter.xbrl.ElementIds;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable map from normalized element id to {@link ElementCatalogEntry}.
 *
 * <p>Populated through a {@link Builder} while the schema and label linkbases
 * are read, then frozen for the rest of the session.
 */
public final class ElementCatalog {
  private final ImmutableMap<String, ElementCatalogEntry> entries;

  private ElementCatalog(Map<String, ElementCatalogEntry> entries) {
    this.entries = ImmutableMap.copyOf(entries);
  }

  public static ElementCatalog empty() {
    return new ElementCatalog(ImmutableMap.of());
  }

  public static Builder builder() {
    return new Builder();
  }

  public @Nullable ElementCatalogEntry get(String elementId) {
    return entries.get(ElementIds.normalize(elementId));
  }

  public boolean contains(String elementId) {
    return entries.containsKey(ElementIds.normalize(elementId));
  }

  public Collection<ElementCatalogEntry> entries() {
    return entries.values();
  }

  public int size() {
    return entries.size();
  }

  /** Standard label of the element, or the element id when it has none. */
  public String labelOf(String elementId) {
    ElementCatalogEntry entry = get(elementId);
    if (entry != null) {
      String label = entry.getStandardLabel();
      if (label != null && !label.isEmpty()) {
        return label;
      }
    }
    return ElementIds.normalize(elementId);
  }

  /** Accumulates declarations and labels before the catalog is frozen. */
  public static final class Builder {
    private final Map<String, Declaration> declarations = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder declare(String elementId, String dataType, String periodType,
        @Nullable String balance, boolean isAbstract) {
      Declaration declaration = declaration(elementId);
      declaration.dataType = dataType;
      declaration.periodType = periodType;
      declaration.balance = balance;
      declaration.isAbstract = isAbstract;
      return this;
    }

    /**
     * Adds a label. Elements without a declaration yet get a placeholder entry
     * with an empty type and a duration period type.
     */
    public Builder addLabel(String elementId, String role, String text) {
      declaration(elementId).labels.put(role, text);
      return this;
    }

    public boolean isDeclared(String elementId) {
      return declarations.containsKey(ElementIds.normalize(elementId));
    }

    public int size() {
      return declarations.size();
    }

    private Declaration declaration(String elementId) {
      return declarations.computeIfAbsent(ElementIds.normalize(elementId),
          k -> new Declaration());
    }

    public ElementCatalog build() {
      Map<String, ElementCatalogEntry> entries = new LinkedHashMap<>();
      for (Map.Entry<String, Declaration> e : declarations.entrySet()) {
        Declaration d = e.getValue();
        entries.put(e.getKey(),
            new ElementCatalogEntry(e.getKey(), d.dataType, d.periodType, d.balance,
                d.isAbstract, d.labels));
      }
      return new ElementCatalog(entries);
    }
  }

  /** Mutable state of one element while the catalog is being built. */
  private static final class Declaration {
    String dataType = "";
    String periodType = ElementCatalogEntry.DURATION;
    @Nullable String balance;
    boolean isAbstract;
    final Map<String, String> labels = new LinkedHashMap<>();
  }
}
