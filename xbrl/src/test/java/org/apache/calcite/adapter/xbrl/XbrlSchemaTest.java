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

import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.Table;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link XbrlSchema} and {@link XbrlSchemaFactory}.
 */
@Tag("unit")
class XbrlSchemaTest {
  @TempDir
  File tempDir;

  private String model(File directory) {
    return "inline:{version: '1.0', defaultSchema: 'XBRL', schemas: [{"
        + "name: 'XBRL', type: 'custom', "
        + "factory: '" + XbrlSchemaFactory.class.getName() + "', "
        + "operand: {directory: '" + directory.getAbsolutePath().replace("\\", "\\\\")
        + "'}}]}";
  }

  @Test
  void testTables() {
    XbrlTestFixtures.copyTo(tempDir);
    XbrlSchema schema = new XbrlSchema(tempDir, XbrlConfig.defaults());
    assertEquals(2, schema.getTableNames().size());

    Table facts = schema.getTable(XbrlSchema.FACTS_TABLE);
    assertTrue(facts instanceof ScannableTable);
    assertEquals(43, ((ScannableTable) facts).scan(null).count());

    Table periods = schema.getTable(XbrlSchema.PERIODS_TABLE);
    assertNotNull(periods);
    assertEquals(4, ((ScannableTable) periods).scan(null).count());
  }

  @Test
  void testQueryOverFilingDirectories() throws SQLException {
    XbrlTestFixtures.copyTo(new File(tempDir, "acme-2024"));
    // Not a filing directory
    assertTrue(new File(tempDir, "empty").mkdirs());

    try (Connection connection = DriverManager.getConnection("jdbc:calcite:model="
        + model(tempDir));
         Statement statement = connection.createStatement()) {
      try (ResultSet rs = statement.executeQuery("select \"filing\", \"numeric_value\" "
          + "from \"facts\" where \"element_id\" = 'us-gaap_Assets' "
          + "and \"period_key\" = 'instant_2024-12-31'")) {
        assertTrue(rs.next());
        assertEquals("acme-2024", rs.getString(1));
        assertEquals(1000.0, rs.getDouble(2), 0.0);
        assertFalse(rs.next());
      }
      try (ResultSet rs = statement.executeQuery("select count(*) from \"facts\" "
          + "where \"dimensions\" is not null")) {
        assertTrue(rs.next());
        assertEquals(2, rs.getInt(1));
      }
      try (ResultSet rs = statement.executeQuery("select \"period_key\", \"days\" "
          + "from \"reporting_periods\" where \"duration_class\" = 'ANNUAL' "
          + "order by \"end_date\" desc")) {
        assertTrue(rs.next());
        assertEquals("duration_2024-01-01_2024-12-31", rs.getString(1));
        assertEquals(365L, rs.getLong(2));
        assertTrue(rs.next());
        assertFalse(rs.next());
      }
    }
  }

  @Test
  void testMissingDirectoryOperand() {
    assertThrows(IllegalArgumentException.class,
        () -> new XbrlSchemaFactory().create(null, "XBRL", ImmutableMap.<String, Object>of()));
  }
}
