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

import org.apache.calcite.adapter.xbrl.ElementIds;
import org.apache.calcite.adapter.xbrl.model.Context;
import org.apache.calcite.adapter.xbrl.model.Decimals;
import org.apache.calcite.adapter.xbrl.model.Fact;
import org.apache.calcite.adapter.xbrl.model.FactStore;
import org.apache.calcite.adapter.xbrl.model.PeriodDescriptor;
import org.apache.calcite.adapter.xbrl.model.Unit;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads contexts, units and facts from an XBRL instance document.
 *
 * <p>Facts are the root's children (other than contexts, units and the schema
 * reference) and every element nested inside them that carries a
 * {@code contextRef}. Element ids are formed from the namespace prefix declared
 * for the fact's namespace; well-known taxonomy namespaces are recognised
 * even when declared under an unusual prefix.
 */
public class InstanceParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(InstanceParser.class);

  private static final Set<String> NON_FACT_ELEMENTS =
      ImmutableSet.of("context", "unit", "schemaRef");

  /** Namespace stems of well-known taxonomies, matched ignoring the year suffix. */
  private static final Map<String, String> KNOWN_NAMESPACES = ImmutableMap.of(
      "http://fasb.org/us-gaap", "us-gaap",
      "http://xbrl.ifrs.org/taxonomy", "ifrs",
      "http://xbrl.sec.gov/dei", "dei");

  public InstanceData parse(String content, String sourceName) {
    Document doc = XmlDocuments.parse(content, sourceName);
    Element root = doc.getDocumentElement();

    Map<String, Context> contexts = parseContexts(doc);
    Map<String, Unit> units = parseUnits(doc);
    FactStore facts = parseFacts(root);

    LOGGER.info("Parsed {} contexts, {} units and {} facts from {}",
        contexts.size(), units.size(), facts.size(), sourceName);
    return new InstanceData(contexts, units, facts);
  }

  // ========== Contexts ==========

  Map<String, Context> parseContexts(Document doc) {
    Map<String, Context> contexts = new LinkedHashMap<>();
    for (Element element : XmlDocuments.elementsByLocalName(doc, "context")) {
      String id = XmlDocuments.attribute(element, null, "id");
      if (id == null) {
        continue;
      }
      String identifier = null;
      String scheme = null;
      Element entity = XmlDocuments.firstChild(element, "entity");
      if (entity != null) {
        Element identifierElement = XmlDocuments.firstChild(entity, "identifier");
        identifier = XmlDocuments.text(identifierElement);
        scheme = identifierElement == null
            ? null
            : XmlDocuments.attribute(identifierElement, null, "scheme");
      }
      contexts.put(id,
          new Context(id, identifier, scheme, parsePeriod(element), parseDimensions(element)));
    }
    return contexts;
  }

  private static PeriodDescriptor parsePeriod(Element context) {
    Element period = XmlDocuments.firstChild(context, "period");
    if (period == null) {
      return PeriodDescriptor.forever();
    }
    String instant = XmlDocuments.text(XmlDocuments.firstChild(period, "instant"));
    if (instant != null) {
      return PeriodDescriptor.instant(instant);
    }
    String start = XmlDocuments.text(XmlDocuments.firstChild(period, "startDate"));
    String end = XmlDocuments.text(XmlDocuments.firstChild(period, "endDate"));
    if (start != null && end != null) {
      return PeriodDescriptor.duration(start, end);
    }
    return PeriodDescriptor.forever();
  }

  /** Explicit members from segment or scenario, plus typed members keyed to their child's tag. */
  private static Map<String, String> parseDimensions(Element context) {
    Map<String, String> dimensions = new LinkedHashMap<>();
    for (Element member : XmlDocuments.elementsByLocalName(context, "explicitMember")) {
      String dimension = XmlDocuments.attribute(member, null, "dimension");
      String value = XmlDocuments.text(member);
      if (dimension != null && value != null) {
        dimensions.put(ElementIds.normalize(dimension), ElementIds.normalize(value));
      }
    }
    for (Element member : XmlDocuments.elementsByLocalName(context, "typedMember")) {
      String dimension = XmlDocuments.attribute(member, null, "dimension");
      List<Element> children = XmlDocuments.childElements(member);
      if (dimension != null && !children.isEmpty()) {
        dimensions.put(ElementIds.normalize(dimension),
            XmlDocuments.localNameOf(children.get(0)));
      }
    }
    return dimensions;
  }

  // ========== Units ==========

  Map<String, Unit> parseUnits(Document doc) {
    Map<String, Unit> units = new LinkedHashMap<>();
    for (Element element : XmlDocuments.elementsByLocalName(doc, "unit")) {
      String id = XmlDocuments.attribute(element, null, "id");
      if (id == null) {
        continue;
      }
      Element divide = XmlDocuments.firstChild(element, "divide");
      if (divide != null) {
        String numerator = measureOf(XmlDocuments.firstChild(divide, "unitNumerator"));
        String denominator = measureOf(XmlDocuments.firstChild(divide, "unitDenominator"));
        if (numerator != null && denominator != null) {
          units.put(id, Unit.divide(id, numerator, denominator));
        }
      } else {
        String measure = XmlDocuments.text(XmlDocuments.firstChild(element, "measure"));
        if (measure != null) {
          units.put(id, Unit.simple(id, measure));
        }
      }
    }
    return units;
  }

  private static @Nullable String measureOf(@Nullable Element parent) {
    return parent == null ? null : XmlDocuments.text(XmlDocuments.firstChild(parent, "measure"));
  }

  // ========== Facts ==========

  FactStore parseFacts(Element root) {
    Map<String, String> prefixes = declaredPrefixes(root);
    FactStore.Builder facts = FactStore.builder();
    int empty = 0;

    for (Element child : XmlDocuments.childElements(root)) {
      if (NON_FACT_ELEMENTS.contains(XmlDocuments.localNameOf(child))) {
        continue;
      }
      List<Element> candidates = new ArrayList<>();
      candidates.add(child);
      candidates.addAll(XmlDocuments.elementsByLocalName(child, "*"));
      for (Element candidate : candidates) {
        String contextRef = XmlDocuments.attribute(candidate, null, "contextRef");
        if (contextRef == null) {
          continue;
        }
        String elementId = elementId(candidate, prefixes);
        String value = factValue(candidate);
        facts.add(
            new Fact(elementId, contextRef, value,
                XmlDocuments.attribute(candidate, null, "unitRef"),
                Decimals.parse(XmlDocuments.attribute(candidate, null, "decimals")),
                Fact.parseNumeric(value),
                XmlDocuments.attribute(candidate, null, "id")));
        if (value.isEmpty()) {
          empty++;
        }
      }
    }
    if (empty > 0) {
      LOGGER.debug("{} facts had no value", empty);
    }
    return facts.build();
  }

  /** Namespace URI to prefix, from the {@code xmlns:} declarations on the root element. */
  static Map<String, String> declaredPrefixes(Element root) {
    Map<String, String> prefixes = new HashMap<>();
    NamedNodeMap attributes = root.getAttributes();
    for (int i = 0; i < attributes.getLength(); i++) {
      Attr attr = (Attr) attributes.item(i);
      String name = attr.getName();
      if (name.startsWith("xmlns:")) {
        prefixes.put(attr.getValue(), name.substring("xmlns:".length()));
      }
    }
    return prefixes;
  }

  static String elementId(Element element, Map<String, String> prefixes) {
    String localName = XmlDocuments.localNameOf(element);
    String namespace = element.getNamespaceURI();
    if (namespace == null) {
      return localName;
    }
    String prefix = prefixes.get(namespace);
    if (prefix == null) {
      // Declared on the fact itself or on an enclosing element
      prefix = element.getPrefix() != null
          ? element.getPrefix()
          : element.lookupPrefix(namespace);
    }
    if (prefix == null) {
      for (Map.Entry<String, String> known : KNOWN_NAMESPACES.entrySet()) {
        if (namespace.startsWith(known.getKey())) {
          prefix = known.getValue();
          break;
        }
      }
    }
    return prefix == null ? localName : ElementIds.normalize(prefix + ":" + localName);
  }

  /** Direct text of a fact; a blank fact falls back to its first child with text. */
  static String factValue(Element element) {
    String value = directText(element);
    if (!value.isEmpty()) {
      return value;
    }
    for (Element child : XmlDocuments.childElements(element)) {
      String childText = directText(child);
      if (!childText.isEmpty()) {
        return childText;
      }
    }
    return "";
  }

  private static String directText(Element element) {
    StringBuilder text = new StringBuilder();
    for (Node node = element.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node.getNodeType() == Node.TEXT_NODE
          || node.getNodeType() == Node.CDATA_SECTION_NODE) {
        text.append(node.getNodeValue());
      }
    }
    return text.toString().trim();
  }
}
