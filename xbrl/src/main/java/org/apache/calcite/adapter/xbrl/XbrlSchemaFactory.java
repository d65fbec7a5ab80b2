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

import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Map;

/**
 * Schema factory exposing SEC XBRL filings as tables.
 *
 * <p>Example configuration:
 * <pre>
 * {
 *   "schemas": [{
 *     "name": "XBRL",
 *     "type": "custom",
 *     "factory": "org.apache.calcite.adapter.xbrl.XbrlSchemaFactory",
 *     "operand": {
 *       "directory": "/data/filings/aapl",
 *       "mappingResource": "concept_mappings.json"
 *     }
 *   }]
 * }
 * </pre>
 */
public class XbrlSchemaFactory implements SchemaFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(XbrlSchemaFactory.class);

  public static final String DIRECTORY = "directory";

  @Override public Schema create(SchemaPlus parentSchema, String name,
      Map<String, Object> operand) {
    Object directory = operand.get(DIRECTORY);
    if (directory == null) {
      throw new IllegalArgumentException("XBRL schema '" + name + "' requires a '"
          + DIRECTORY + "' operand");
    }
    XbrlConfig config = XbrlConfig.fromOperand(operand);
    LOGGER.info("Creating XBRL schema {} over {}", name, directory);
    return new XbrlSchema(new File(directory.toString()), config);
  }
}
