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
import org.apache.calcite.adapter.xbrl.model.ElementCatalog;
import org.apache.calcite.adapter.xbrl.model.LabelRoles;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins label linkbase locators, arcs and label resources into element labels.
 *
 * <p>A label reaches its element in two hops: the arc's {@code from} names a
 * locator whose href identifies the element, and its {@code to} names the
 * {@code xlink:label} shared by one or more label resources. Only
 * {@value #LANGUAGE} labels are kept.
 */
public class LabelLinkbaseParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(LabelLinkbaseParser.class);

  static final String LANGUAGE = "en-US";

  /** Parses a standalone label linkbase file. */
  public int parse(String content, String sourceName, ElementCatalog.Builder catalog) {
    Document doc = XmlDocuments.parse(content, sourceName);
    int count = parseLinks(
        XmlDocuments.elementsByLocalName(doc, LinkbaseType.LABEL.getLinkElement()), catalog);
    LOGGER.debug("Read {} labels from {}", count, sourceName);
    return count;
  }

  /** Reads labels from {@code labelLink} elements; returns the number of labels added. */
  public int parseLinks(List<Element> labelLinks, ElementCatalog.Builder catalog) {
    int count = 0;
    for (Element link : labelLinks) {
      Map<String, String> locators = new HashMap<>();
      ListMultimap<String, LabelResource> resources = ArrayListMultimap.create();

      for (Element child : XmlDocuments.childElements(link)) {
        String name = XmlDocuments.localNameOf(child);
        if ("loc".equals(name)) {
          String label = XmlDocuments.xlink(child, "label");
          String elementId = ElementIds.fromHref(XmlDocuments.xlink(child, "href"));
          if (label != null && elementId != null) {
            locators.put(label, elementId);
          }
        } else if ("label".equals(name)) {
          String labelId = XmlDocuments.xlink(child, "label");
          String text = XmlDocuments.text(child);
          if (labelId == null || text == null) {
            continue;
          }
          String role = XmlDocuments.xlink(child, "role");
          String lang = XmlDocuments.attribute(child, XbrlNamespaces.XML, "lang");
          resources.put(labelId, new LabelResource(
              role == null ? LabelRoles.STANDARD : role,
              lang == null ? LANGUAGE : lang,
              text));
        }
      }

      for (Element arc : XmlDocuments.elementsByLocalName(link,
          LinkbaseType.LABEL.getArcElement())) {
        String from = XmlDocuments.xlink(arc, "from");
        String to = XmlDocuments.xlink(arc, "to");
        String elementId = from == null ? null : locators.get(from);
        if (elementId == null || to == null) {
          continue;
        }
        for (LabelResource resource : resources.get(to)) {
          if (LANGUAGE.equalsIgnoreCase(resource.lang)) {
            catalog.addLabel(elementId, resource.role, resource.text);
            count++;
          }
        }
      }
    }
    return count;
  }

  /** A {@code link:label} resource. */
  private static final class LabelResource {
    final String role;
    final String lang;
    final String text;

    LabelResource(String role, String lang, String text) {
      this.role = role;
      this.lang = lang;
      this.text = text;
    }
  }
}
