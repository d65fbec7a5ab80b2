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

/** Namespace URIs of the XBRL 2.1, XDT and XLink vocabularies. */
public final class XbrlNamespaces {
  public static final String XLINK = "http://www.w3.org/1999/xlink";
  public static final String XSD = "http://www.w3.org/2001/XMLSchema";
  public static final String XBRLI = "http://www.xbrl.org/2003/instance";
  public static final String LINK = "http://www.xbrl.org/2003/linkbase";
  public static final String XBRLDI = "http://xbrl.org/2006/xbrldi";
  public static final String XBRLDT = "http://xbrl.org/2005/xbrldt";
  public static final String XML = "http://www.w3.org/XML/1998/namespace";

  public static final String ARCROLE_HYPERCUBE_DIMENSION =
      "http://xbrl.org/int/dim/arcrole/hypercube-dimension";
  public static final String ARCROLE_DIMENSION_DOMAIN =
      "http://xbrl.org/int/dim/arcrole/dimension-domain";
  public static final String ARCROLE_DOMAIN_MEMBER =
      "http://xbrl.org/int/dim/arcrole/domain-member";
  public static final String ARCROLE_DIMENSION_DEFAULT =
      "http://xbrl.org/int/dim/arcrole/dimension-default";
  public static final String ARCROLE_ALL = "http://xbrl.org/int/dim/arcrole/all";

  private XbrlNamespaces() {
  }
}
