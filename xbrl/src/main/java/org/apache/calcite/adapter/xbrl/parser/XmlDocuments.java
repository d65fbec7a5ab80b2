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

import org.apache.calcite.adapter.xbrl.XbrlProcessingException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

/** DOM helpers shared by the schema, linkbase and instance parsers. */
public final class XmlDocuments {

  private XmlDocuments() {
  }

  /**
   * Parses {@code content} into a namespace-aware DOM.
   *
   * @throws XbrlProcessingException naming {@code sourceName} when the XML is malformed
   */
  public static Document parse(String content, String sourceName) {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
      factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
      factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd",
          false);
      factory.setExpandEntityReferences(false);
      DocumentBuilder builder = factory.newDocumentBuilder();
      return builder.parse(new InputSource(new StringReader(content)));
    } catch (SAXException | IOException | ParserConfigurationException e) {
      throw XbrlProcessingException.forFile(sourceName, content, e);
    }
  }

  /** All descendant elements with the given local name, in any namespace. */
  public static List<Element> elementsByLocalName(Node root, String localName) {
    NodeList nodes = root instanceof Document
        ? ((Document) root).getElementsByTagNameNS("*", localName)
        : ((Element) root).getElementsByTagNameNS("*", localName);
    List<Element> result = new ArrayList<>(nodes.getLength());
    for (int i = 0; i < nodes.getLength(); i++) {
      result.add((Element) nodes.item(i));
    }
    return result;
  }

  /** Direct child elements of {@code parent}. */
  public static List<Element> childElements(Element parent) {
    List<Element> result = new ArrayList<>();
    for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
      if (child.getNodeType() == Node.ELEMENT_NODE) {
        result.add((Element) child);
      }
    }
    return result;
  }

  /** First direct child with the given local name, or null. */
  public static @Nullable Element firstChild(Element parent, String localName) {
    for (Element child : childElements(parent)) {
      if (localName.equals(localNameOf(child))) {
        return child;
      }
    }
    return null;
  }

  /** Local name of an element, tolerating DOMs built without namespace support. */
  public static String localNameOf(Node node) {
    String localName = node.getLocalName();
    if (localName != null) {
      return localName;
    }
    String name = node.getNodeName();
    int colon = name.indexOf(':');
    return colon >= 0 ? name.substring(colon + 1) : name;
  }

  /** Trimmed text content, or null when blank. */
  public static @Nullable String text(@Nullable Element element) {
    if (element == null) {
      return null;
    }
    String text = element.getTextContent();
    if (text == null) {
      return null;
    }
    String trimmed = text.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  /** Text of the first descendant with the given local name, or null. */
  public static @Nullable String descendantText(Element parent, String localName) {
    List<Element> matches = elementsByLocalName(parent, localName);
    return matches.isEmpty() ? null : text(matches.get(0));
  }

  /** An xlink attribute such as {@code xlink:label}, falling back to the unqualified name. */
  public static @Nullable String xlink(Element element, String localName) {
    return attribute(element, XbrlNamespaces.XLINK, localName);
  }

  /**
   * An attribute by namespace, falling back to the attribute without a namespace.
   * Returns null when absent or empty.
   */
  public static @Nullable String attribute(Element element, @Nullable String namespace,
      String localName) {
    String value = namespace == null ? null : element.getAttributeNS(namespace, localName);
    if (value == null || value.isEmpty()) {
      value = element.getAttribute(localName);
    }
    return value == null || value.isEmpty() ? null : value;
  }

  /** Parses a numeric attribute, returning {@code defaultValue} when absent or malformed. */
  public static double doubleAttribute(Element element, String localName, double defaultValue) {
    String value = attribute(element, null, localName);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }
}
