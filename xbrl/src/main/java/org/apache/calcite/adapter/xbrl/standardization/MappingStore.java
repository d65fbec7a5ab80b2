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
package org.apache.calcite.adapter.xbrl.standardization;

import org.apache.calcite.adapter.xbrl.ElementIds;
import org.apache.calcite.adapter.xbrl.XbrlProcessingException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable table from standard concept display name to the company
 * concepts known to report it.
 *
 * <p>Mapping files are JSON, either flat
 * ({@code {"Revenue": ["us-gaap_Revenues", ...]}}) or grouped by statement
 * ({@code {"IncomeStatement": {"Revenue": [...]}}}).
 */
public final class MappingStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(MappingStore.class);

  public static final String DEFAULT_RESOURCE = "concept_mappings.json";

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final ImmutableMap<String, ImmutableSet<String>> mappings;
  private final ImmutableMap<String, String> reverse;

  private MappingStore(Map<String, ? extends Set<String>> mappings) {
    ImmutableMap.Builder<String, ImmutableSet<String>> forward = ImmutableMap.builder();
    Map<String, String> backward = new LinkedHashMap<>();
    for (Map.Entry<String, ? extends Set<String>> e : mappings.entrySet()) {
      forward.put(e.getKey(), ImmutableSet.copyOf(e.getValue()));
      for (String concept : e.getValue()) {
        backward.putIfAbsent(concept, e.getKey());
      }
    }
    this.mappings = forward.build();
    this.reverse = ImmutableMap.copyOf(backward);
  }

  public static MappingStore empty() {
    return new MappingStore(ImmutableMap.<String, Set<String>>of());
  }

  /** Mappings shipped on the classpath as {@value #DEFAULT_RESOURCE}. */
  public static MappingStore defaults() {
    return fromResource(DEFAULT_RESOURCE);
  }

  /**
   * Loads mappings from a classpath resource.
   *
   * @throws XbrlProcessingException when the resource is missing or not valid JSON
   */
  public static MappingStore fromResource(String resource) {
    try (InputStream is = MappingStore.class.getClassLoader().getResourceAsStream(resource)) {
      if (is == null) {
        throw new XbrlProcessingException(resource + " not found in classpath");
      }
      MappingStore store = fromJson(OBJECT_MAPPER.readTree(is));
      LOGGER.info("Loaded {} standard concept mappings from {}", store.size(), resource);
      return store;
    } catch (IOException e) {
      throw new XbrlProcessingException("Failed to load concept mappings from " + resource, e);
    }
  }

  /** Reads the flat or statement-grouped form. */
  public static MappingStore fromJson(JsonNode root) {
    Map<String, Set<String>> mappings = new LinkedHashMap<>();
    readMappings(root, mappings);
    return new MappingStore(mappings);
  }

  private static void readMappings(JsonNode node, Map<String, Set<String>> mappings) {
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode value = field.getValue();
      if (value.isArray()) {
        Set<String> concepts = mappings.computeIfAbsent(field.getKey(),
            k -> new LinkedHashSet<>());
        for (JsonNode concept : value) {
          concepts.add(ElementIds.normalize(concept.asText()));
        }
      } else if (value.isObject()) {
        readMappings(value, mappings);
      } else {
        LOGGER.warn("Ignoring mapping entry '{}' of type {}", field.getKey(),
            value.getNodeType());
      }
    }
  }

  /** Standard concept display name for a company concept, or null. */
  public @Nullable String getStandardConcept(String companyConcept) {
    return reverse.get(ElementIds.normalize(companyConcept));
  }

  public Set<String> getCompanyConcepts(String standardConcept) {
    ImmutableSet<String> concepts = mappings.get(standardConcept);
    return concepts == null ? ImmutableSet.of() : concepts;
  }

  public Set<String> getStandardConcepts() {
    return mappings.keySet();
  }

  /** A new store that also maps {@code companyConcept} to {@code standardConcept}. */
  public MappingStore withMapping(String companyConcept, String standardConcept) {
    Map<String, Set<String>> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ImmutableSet<String>> e : mappings.entrySet()) {
      copy.put(e.getKey(), new LinkedHashSet<>(e.getValue()));
    }
    copy.computeIfAbsent(standardConcept, k -> new LinkedHashSet<>())
        .add(ElementIds.normalize(companyConcept));
    return new MappingStore(copy);
  }

  /** Number of company concepts mapped. */
  public int size() {
    return reverse.size();
  }
}
