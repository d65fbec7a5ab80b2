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

import org.apache.calcite.adapter.xbrl.Result;
import org.apache.calcite.adapter.xbrl.model.ElementCatalog;
import org.apache.calcite.adapter.xbrl.model.ElementCatalogEntry;
import org.apache.calcite.adapter.xbrl.model.RoleType;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads element declarations from a taxonomy schema into an
 * {@link ElementCatalog.Builder} and extracts any linkbases embedded in
 * its {@code xsd:appinfo}.
 */
public class SchemaParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaParser.class);

  /**
   * Parses a schema.
   *
   * @param content schema XML
   * @param sourceName file name used in error messages
   * @param catalog builder receiving element declarations
   * @return embedded role types and linkbases; extraction problems are reported as warnings
   * @throws org.apache.calcite.adapter.xbrl.XbrlProcessingException when the XML is malformed
   */
  public Result<EmbeddedLinkbases> parse(String content, String sourceName,
      ElementCatalog.Builder catalog) {
    Document doc = XmlDocuments.parse(content, sourceName);

    int declared = 0;
    for (Element element : XmlDocuments.elementsByLocalName(doc, "element")) {
      if (!XbrlNamespaces.XSD.equals(element.getNamespaceURI())) {
        continue;
      }
      String id = XmlDocuments.attribute(element, null, "id");
      if (id == null) {
        id = XmlDocuments.attribute(element, null, "name");
      }
      if (id == null) {
        continue;
      }
      String type = XmlDocuments.attribute(element, null, "type");
      boolean isAbstract = "true".equalsIgnoreCase(
          XmlDocuments.attribute(element, null, "abstract"));
      String periodType = xbrliProperty(element, "periodType");
      String balance = xbrliProperty(element, "balance");
      catalog.declare(id, type == null ? "" : type,
          periodType == null ? ElementCatalogEntry.DURATION : periodType, balance, isAbstract);
      declared++;
    }
    LOGGER.debug("Declared {} elements from {}", declared, sourceName);

    return extractEmbeddedLinkbases(doc, sourceName);
  }

  /** Reads {@code xbrli:periodType}/{@code xbrli:balance} from attributes or appinfo. */
  private static @Nullable String xbrliProperty(Element element, String name) {
    String value = XmlDocuments.attribute(element, XbrlNamespaces.XBRLI, name);
    if (value != null) {
      return value;
    }
    for (Element appinfo : XmlDocuments.elementsByLocalName(element, "appinfo")) {
      String text = XmlDocuments.descendantText(appinfo, name);
      if (text != null) {
        return text;
      }
    }
    return null;
  }

  /**
   * Collects {@code link:roleType} declarations and extended links from
   * {@code xsd:appinfo}. Failures are logged and returned as warnings with an
   * empty result.
   */
  Result<EmbeddedLinkbases> extractEmbeddedLinkbases(Document doc, String sourceName) {
    try {
      Map<String, RoleType> roleTypes = new LinkedHashMap<>();
      ListMultimap<LinkbaseType, Element> links = ArrayListMultimap.create();
      for (Element appinfo : XmlDocuments.elementsByLocalName(doc, "appinfo")) {
        for (Element roleType : XmlDocuments.elementsByLocalName(appinfo, "roleType")) {
          String roleUri = XmlDocuments.attribute(roleType, null, "roleURI");
          if (roleUri == null) {
            continue;
          }
          String id = XmlDocuments.attribute(roleType, null, "id");
          String definition = XmlDocuments.descendantText(roleType, "definition");
          List<String> usedOn = new ArrayList<>();
          for (Element used : XmlDocuments.elementsByLocalName(roleType, "usedOn")) {
            String text = XmlDocuments.text(used);
            if (text != null) {
              usedOn.add(text);
            }
          }
          roleTypes.put(roleUri, new RoleType(roleUri, id == null ? "" : id,
              definition == null ? "" : definition, usedOn));
        }
        for (Element linkbase : XmlDocuments.elementsByLocalName(appinfo, "linkbase")) {
          for (Element child : XmlDocuments.childElements(linkbase)) {
            LinkbaseType type = LinkbaseType.fromLinkElement(XmlDocuments.localNameOf(child));
            if (type != null) {
              links.put(type, child);
            }
          }
        }
      }
      if (!roleTypes.isEmpty() || !links.isEmpty()) {
        LOGGER.debug("Found {} role types and {} embedded links in {}",
            roleTypes.size(), links.size(), sourceName);
      }
      return Result.of(new EmbeddedLinkbases(roleTypes, links));
    } catch (RuntimeException e) {
      String warning = "Failed to extract embedded linkbases from " + sourceName + ": "
          + e.getMessage();
      LOGGER.warn(warning);
      return Result.of(EmbeddedLinkbases.empty(), Collections.singletonList(warning));
    }
  }
}
