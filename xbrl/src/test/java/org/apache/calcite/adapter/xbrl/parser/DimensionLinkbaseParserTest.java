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

import org.apache.calcite.adapter.xbrl.XbrlTestFixtures;
import org.apache.calcite.adapter.xbrl.model.Axis;
import org.apache.calcite.adapter.xbrl.model.DimensionModel;
import org.apache.calcite.adapter.xbrl.model.Domain;
import org.apache.calcite.adapter.xbrl.model.ElementCatalog;
import org.apache.calcite.adapter.xbrl.model.Table;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Tests for {@link DimensionLinkbaseParser}. */
@Tag("unit")
class DimensionLinkbaseParserTest {

  @Test
  void testSegmentHypercube() {
    Map<String, List<Arc>> arcs = new RelationshipLinkbaseParser(LinkbaseType.DEFINITION)
        .parse(XbrlTestFixtures.read("acme-20241231_def.xml"), "acme-20241231_def.xml");
    DimensionModel model = new DimensionLinkbaseParser().build(arcs, ElementCatalog.empty());

    Axis axis = model.getAxis("us-gaap_StatementBusinessSegmentsAxis");
    assertEquals("us-gaap_SegmentDomain", axis.getDomainId());
    assertEquals("us-gaap_SegmentDomain", axis.getDefaultMemberId());

    Domain domain = model.getDomain("us-gaap_SegmentDomain");
    assertEquals(ImmutableList.of("acme_ProductsMember", "acme_ServicesMember"),
        domain.getMembers());
    assertNull(domain.getParent());

    List<Table> tables = model.getTables(XbrlTestFixtures.SEGMENT_ROLE);
    assertEquals(1, tables.size());
    Table table = tables.get(0);
    assertEquals("us-gaap_SegmentReportingInformationTable", table.getElementId());
    assertEquals(ImmutableList.of("us-gaap_StatementBusinessSegmentsAxis"), table.getAxes());
    assertEquals(ImmutableList.of("us-gaap_SegmentReportingInformationLineItems"),
        table.getLineItems());
    assertTrue(table.isClosed());
    assertTrue(model.isAxisOfRole(XbrlTestFixtures.SEGMENT_ROLE,
        "us-gaap_StatementBusinessSegmentsAxis"));
    assertFalse(model.isAxisOfRole(XbrlTestFixtures.BALANCE_SHEET_ROLE,
        "us-gaap_StatementBusinessSegmentsAxis"));
  }

  @Test
  void testNestedMembersBecomeDomains() {
    List<Arc> arcs = ImmutableList.of(
        new Arc("ex_RegionAxis", "ex_RegionDomain",
            "http://xbrl.org/int/dim/arcrole/dimension-domain", 1, 1, null, false),
        new Arc("ex_RegionDomain", "ex_AmericasMember",
            "http://xbrl.org/int/dim/arcrole/domain-member", 1, 1, null, false),
        new Arc("ex_AmericasMember", "ex_UsMember",
            "http://xbrl.org/int/dim/arcrole/domain-member", 1, 1, null, false));
    DimensionModel model = new DimensionLinkbaseParser()
        .build(ImmutableMap.of("urn:role", arcs), ElementCatalog.empty());

    assertEquals(2, model.getDomains().size());
    Domain americas = model.getDomain("ex_AmericasMember");
    assertEquals("ex_RegionDomain", americas.getParent());
    assertEquals(ImmutableList.of("ex_UsMember"), americas.getMembers());
    assertTrue(model.getTables("urn:role").isEmpty());
  }
}
