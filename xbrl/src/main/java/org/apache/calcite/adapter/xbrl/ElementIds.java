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
package org.apache.calcite.adapter.xbrl;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Helpers for XBRL element identifiers.
 *
 * <p>Identifiers arrive as {@code us-gaap:Assets} from instance documents and as
 * {@code us-gaap_Assets} from linkbase hrefs. All lookups use the underscore form
 * so that both spellings resolve to the same entry.
 */
public final class ElementIds {

  private ElementIds() {
    // Utility class
  }

  /** Returns the underscore form of {@code elementId}. */
  public static String normalize(String elementId) {
    int colon = elementId.indexOf(':');
    if (colon < 0) {
      return elementId;
    }
    return elementId.substring(0, colon) + '_' + elementId.substring(colon + 1);
  }

  /** Returns the colon form of a normalized id, or the id itself when it has no prefix. */
  public static String toQualifiedName(String elementId) {
    String normalized = normalize(elementId);
    int underscore = normalized.indexOf('_');
    if (underscore < 0) {
      return normalized;
    }
    return normalized.substring(0, underscore) + ':' + normalized.substring(underscore + 1);
  }

  /** Returns the part of the id after its namespace prefix. */
  public static String localName(String elementId) {
    int colon = elementId.indexOf(':');
    if (colon >= 0) {
      return elementId.substring(colon + 1);
    }
    int underscore = elementId.indexOf('_');
    return underscore < 0 ? elementId : elementId.substring(underscore + 1);
  }

  /** Element id of a locator href such as {@code us-gaap-2024.xsd#us-gaap_Assets}. */
  public static @Nullable String fromHref(@Nullable String href) {
    if (href == null || href.isEmpty()) {
      return null;
    }
    int hash = href.lastIndexOf('#');
    String fragment = hash >= 0 ? href.substring(hash + 1) : href;
    return fragment.isEmpty() ? null : normalize(fragment);
  }
}
