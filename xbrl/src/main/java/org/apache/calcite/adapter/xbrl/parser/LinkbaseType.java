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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/** The four XBRL linkbases, with their extended-link and arc element names. */
public enum LinkbaseType {
  LABEL("labelLink", "labelArc", "_lab.xml"),
  PRESENTATION("presentationLink", "presentationArc", "_pre.xml"),
  CALCULATION("calculationLink", "calculationArc", "_cal.xml"),
  DEFINITION("definitionLink", "definitionArc", "_def.xml");

  private final String linkElement;
  private final String arcElement;
  private final String fileSuffix;

  LinkbaseType(String linkElement, String arcElement, String fileSuffix) {
    this.linkElement = linkElement;
    this.arcElement = arcElement;
    this.fileSuffix = fileSuffix;
  }

  public String getLinkElement() {
    return linkElement;
  }

  public String getArcElement() {
    return arcElement;
  }

  public String getFileSuffix() {
    return fileSuffix;
  }

  /** Linkbase type of a file by its EDGAR naming convention, or null. */
  public static @Nullable LinkbaseType fromFileName(String fileName) {
    String lower = fileName.toLowerCase(Locale.ROOT);
    for (LinkbaseType type : values()) {
      if (lower.endsWith(type.fileSuffix)) {
        return type;
      }
    }
    return null;
  }

  /** Linkbase type of an extended-link element name, or null. */
  public static @Nullable LinkbaseType fromLinkElement(String localName) {
    for (LinkbaseType type : values()) {
      if (type.linkElement.equals(localName)) {
        return type;
      }
    }
    return null;
  }
}
