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

import org.apache.calcite.adapter.xbrl.calc.CalculationWeightCorrector;
import org.apache.calcite.adapter.xbrl.model.CalculationTree;
import org.apache.calcite.adapter.xbrl.model.DimensionModel;
import org.apache.calcite.adapter.xbrl.model.ElementCatalog;
import org.apache.calcite.adapter.xbrl.model.EntityInfo;
import org.apache.calcite.adapter.xbrl.model.FactStore;
import org.apache.calcite.adapter.xbrl.model.PresentationTree;
import org.apache.calcite.adapter.xbrl.model.RoleType;
import org.apache.calcite.adapter.xbrl.parser.Arc;
import org.apache.calcite.adapter.xbrl.parser.DimensionLinkbaseParser;
import org.apache.calcite.adapter.xbrl.parser.EmbeddedLinkbases;
import org.apache.calcite.adapter.xbrl.parser.InstanceData;
import org.apache.calcite.adapter.xbrl.parser.InstanceParser;
import org.apache.calcite.adapter.xbrl.parser.LabelLinkbaseParser;
import org.apache.calcite.adapter.xbrl.parser.LinkbaseType;
import org.apache.calcite.adapter.xbrl.parser.RelationshipLinkbaseParser;
import org.apache.calcite.adapter.xbrl.parser.SchemaParser;
import org.apache.calcite.adapter.xbrl.parser.TreeBuilder;
import org.apache.calcite.adapter.xbrl.period.ReportingPeriodBuilder;
import org.apache.calcite.adapter.xbrl.period.ReportingPeriods;
import org.apache.calcite.adapter.xbrl.statement.StatementInfo;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles an {@link XbrlDocument} from the text of a filing's files.
 *
 * <p>The schema is read first, then labels, then the relationship linkbases,
 * and the instance last. A standalone linkbase replaces any linkbase of the
 * same kind embedded in the schema. Calculation weights are applied to the
 * facts once, when the document is built.
 *
 * <pre>
 * XbrlDocument document = XbrlDocument.builder()
 *     .schema(xsd, "aapl-20240928.xsd")
 *     .presentation(pre, "aapl-20240928_pre.xml")
 *     .instance(xml, "aapl-20240928_htm.xml")
 *     .build();
 * </pre>
 */
public class XbrlDocumentBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(XbrlDocumentBuilder.class);

  private final XbrlConfig config;
  private @Nullable Source schema;
  private @Nullable Source instance;
  private final Map<LinkbaseType, Source> linkbases = new EnumMap<>(LinkbaseType.class);

  public XbrlDocumentBuilder(XbrlConfig config) {
    this.config = Preconditions.checkNotNull(config, "config");
  }

  public XbrlDocumentBuilder schema(String content, String sourceName) {
    this.schema = new Source(content, sourceName);
    return this;
  }

  public XbrlDocumentBuilder labels(String content, String sourceName) {
    return linkbase(LinkbaseType.LABEL, content, sourceName);
  }

  public XbrlDocumentBuilder presentation(String content, String sourceName) {
    return linkbase(LinkbaseType.PRESENTATION, content, sourceName);
  }

  public XbrlDocumentBuilder calculation(String content, String sourceName) {
    return linkbase(LinkbaseType.CALCULATION, content, sourceName);
  }

  public XbrlDocumentBuilder definition(String content, String sourceName) {
    return linkbase(LinkbaseType.DEFINITION, content, sourceName);
  }

  public XbrlDocumentBuilder linkbase(LinkbaseType type, String content, String sourceName) {
    linkbases.put(type, new Source(content, sourceName));
    return this;
  }

  public XbrlDocumentBuilder instance(String content, String sourceName) {
    this.instance = new Source(content, sourceName);
    return this;
  }

  /**
   * Parses everything supplied so far.
   *
   * @throws XbrlProcessingException when a file is not well-formed XML
   */
  public XbrlDocument build() {
    List<String> warnings = new ArrayList<>();

    ElementCatalog.Builder catalogBuilder = ElementCatalog.builder();
    EmbeddedLinkbases embedded = EmbeddedLinkbases.empty();
    if (schema != null) {
      Result<EmbeddedLinkbases> parsed =
          new SchemaParser().parse(schema.content, schema.name, catalogBuilder);
      warnings.addAll(parsed.getWarnings());
      embedded = parsed.getValue();
    }

    LabelLinkbaseParser labelParser = new LabelLinkbaseParser();
    Source labels = linkbases.get(LinkbaseType.LABEL);
    if (labels != null) {
      labelParser.parse(labels.content, labels.name, catalogBuilder);
    } else if (embedded.hasLinks(LinkbaseType.LABEL)) {
      labelParser.parseLinks(embedded.getLinks(LinkbaseType.LABEL), catalogBuilder);
    }
    ElementCatalog catalog = catalogBuilder.build();

    Map<String, String> definitions = roleDefinitions(embedded.getRoleTypes());

    Map<String, PresentationTree> presentationTrees = new LinkedHashMap<>();
    for (Map.Entry<String, List<Arc>> role
        : relationships(LinkbaseType.PRESENTATION, embedded).entrySet()) {
      PresentationTree tree = TreeBuilder.buildPresentationTree(role.getKey(),
          definitionOf(role.getKey(), definitions), role.getValue(), catalog);
      if (tree != null) {
        presentationTrees.put(role.getKey(), tree);
      }
    }

    Map<String, CalculationTree> calculationTrees = new LinkedHashMap<>();
    for (Map.Entry<String, List<Arc>> role
        : relationships(LinkbaseType.CALCULATION, embedded).entrySet()) {
      CalculationTree tree = TreeBuilder.buildCalculationTree(role.getKey(),
          definitionOf(role.getKey(), definitions), role.getValue(), catalog);
      if (tree != null) {
        calculationTrees.put(role.getKey(), tree);
      }
    }

    DimensionModel dimensions = new DimensionLinkbaseParser()
        .build(relationships(LinkbaseType.DEFINITION, embedded), catalog);

    InstanceData instanceData = InstanceData.empty();
    FactStore facts = FactStore.empty();
    if (instance != null) {
      instanceData = new InstanceParser().parse(instance.content, instance.name);
      Result<FactStore> corrected = new CalculationWeightCorrector()
          .correct(instanceData.getFacts(), calculationTrees.values());
      warnings.addAll(corrected.getWarnings());
      facts = corrected.getValue();
    }

    ReportingPeriods periods =
        new ReportingPeriodBuilder().build(instanceData.getContexts().values());
    Result<EntityInfo> entityInfo =
        new EntityInfoExtractor().extract(facts, instanceData.getContexts(), periods);
    warnings.addAll(entityInfo.getWarnings());

    LOGGER.info("Built document: {} elements, {} presentation roles, {} calculation roles, "
            + "{} facts, {} periods, {} warnings", catalog.size(), presentationTrees.size(),
        calculationTrees.size(), facts.size(), periods.size(), warnings.size());
    return new XbrlDocument(config, catalog, presentationTrees, calculationTrees, dimensions,
        instanceData.getContexts(), instanceData.getUnits(), facts, periods,
        entityInfo.getValue(), warnings);
  }

  private Map<String, List<Arc>> relationships(LinkbaseType type, EmbeddedLinkbases embedded) {
    RelationshipLinkbaseParser parser = new RelationshipLinkbaseParser(type);
    Source source = linkbases.get(type);
    if (source != null) {
      return parser.parse(source.content, source.name);
    }
    if (embedded.hasLinks(type)) {
      return parser.parseLinks(embedded.getLinks(type));
    }
    return new LinkedHashMap<>();
  }

  private static Map<String, String> roleDefinitions(Map<String, RoleType> roleTypes) {
    Map<String, String> definitions = new LinkedHashMap<>();
    for (RoleType roleType : roleTypes.values()) {
      if (!roleType.getDefinition().isEmpty()) {
        definitions.put(roleType.getRoleUri(), roleType.getDefinition());
      }
    }
    return definitions;
  }

  /** The declared definition, else the role's short name with underscores as spaces. */
  static String definitionOf(String roleUri, Map<String, String> definitions) {
    String definition = definitions.get(roleUri);
    if (definition != null) {
      return definition;
    }
    return StatementInfo.shortName(roleUri).replace('_', ' ');
  }

  /** File text and the name it is reported under. */
  private static final class Source {
    final String content;
    final String name;

    Source(String content, String name) {
      this.content = Preconditions.checkNotNull(content, "content");
      this.name = name;
    }
  }
}
