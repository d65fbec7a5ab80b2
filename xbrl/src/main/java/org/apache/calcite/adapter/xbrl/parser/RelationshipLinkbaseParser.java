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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts arcs from presentation, calculation and definition linkbases,
 * grouped by extended-link role. Links that share a role are merged.
 */
public class RelationshipLinkbaseParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(RelationshipLinkbaseParser.class);

  private final LinkbaseType type;

  public RelationshipLinkbaseParser(LinkbaseType type) {
    if (type == LinkbaseType.LABEL) {
      throw new IllegalArgumentException("Label linkbases carry no relationships");
    }
    this.type = type;
  }

  public LinkbaseType getType() {
    return type;
  }

  /** Parses a standalone linkbase file into arcs per role URI. */
  public Map<String, List<Arc>> parse(String content, String sourceName) {
    Document doc = XmlDocuments.parse(content, sourceName);
    Map<String, List<Arc>> arcs =
        parseLinks(XmlDocuments.elementsByLocalName(doc, type.getLinkElement()));
    LOGGER.debug("Read {} {} roles from {}", arcs.size(), type, sourceName);
    return arcs;
  }

  /** Reads arcs from extended-link elements of this parser's type. */
  public Map<String, List<Arc>> parseLinks(List<Element> links) {
    Map<String, List<Arc>> arcsByRole = new LinkedHashMap<>();
    for (Element link : links) {
      String role = XmlDocuments.xlink(link, "role");
      if (role == null) {
        continue;
      }
      Map<String, String> locators = new HashMap<>();
      for (Element loc : XmlDocuments.elementsByLocalName(link, "loc")) {
        String label = XmlDocuments.xlink(loc, "label");
        String elementId = ElementIds.fromHref(XmlDocuments.xlink(loc, "href"));
        if (label != null && elementId != null) {
          locators.put(label, elementId);
        }
      }

      List<Arc> arcs = arcsByRole.computeIfAbsent(role, k -> new ArrayList<>());
      for (Element arcElement : XmlDocuments.elementsByLocalName(link, type.getArcElement())) {
        String from = locators.get(String.valueOf(XmlDocuments.xlink(arcElement, "from")));
        String to = locators.get(String.valueOf(XmlDocuments.xlink(arcElement, "to")));
        if (from == null || to == null) {
          continue;
        }
        arcs.add(
            new Arc(from, to,
                XmlDocuments.xlink(arcElement, "arcrole"),
                XmlDocuments.doubleAttribute(arcElement, "order", 1.0),
                XmlDocuments.doubleAttribute(arcElement, "weight", 1.0),
                XmlDocuments.attribute(arcElement, null, "preferredLabel"),
                "true".equalsIgnoreCase(
                    XmlDocuments.attribute(arcElement, XbrlNamespaces.XBRLDT, "closed"))));
      }
    }
    return arcsByRole;
  }
}
