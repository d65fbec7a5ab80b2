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

import org.apache.calcite.adapter.xbrl.parser.LinkbaseType;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads a filing from a directory holding its schema, linkbases and
 * instance document.
 *
 * <p>Files are recognized by name: {@code _pre.xml}, {@code _cal.xml},
 * {@code _def.xml} and {@code _lab.xml} linkbases, an {@code .xsd} schema,
 * and as instance any other {@code .xml} file with {@code <xbrl} in its
 * first 2000 characters.
 */
public class XbrlDirectoryReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(XbrlDirectoryReader.class);

  static final int INSTANCE_SNIFF_LENGTH = 2000;

  /** Root element of an instance document, with or without a prefix. */
  private static final Pattern INSTANCE_ROOT = Pattern.compile("<([\\w.-]+:)?xbrl[\\s>]");

  private final XbrlConfig config;

  public XbrlDirectoryReader(XbrlConfig config) {
    this.config = Preconditions.checkNotNull(config, "config");
  }

  /** Kind of filing file, by name and content. */
  enum FileKind { SCHEMA, LABEL, PRESENTATION, CALCULATION, DEFINITION, INSTANCE }

  static @Nullable FileKind classify(String fileName, String content) {
    String lower = fileName.toLowerCase(Locale.ROOT);
    LinkbaseType linkbase = LinkbaseType.fromFileName(lower);
    if (linkbase != null) {
      return FileKind.valueOf(linkbase.name());
    }
    if (lower.endsWith(".xsd")) {
      return FileKind.SCHEMA;
    }
    if (lower.endsWith(".xml")) {
      String head = content.length() > INSTANCE_SNIFF_LENGTH
          ? content.substring(0, INSTANCE_SNIFF_LENGTH)
          : content;
      if (INSTANCE_ROOT.matcher(head).find()) {
        return FileKind.INSTANCE;
      }
    }
    return null;
  }

  /** Whether the directory directly contains at least one recognizable filing file. */
  public static boolean isFilingDirectory(File directory) {
    File[] files = directory.listFiles(File::isFile);
    if (files == null) {
      return false;
    }
    for (File file : files) {
      String name = file.getName().toLowerCase(Locale.ROOT);
      if (name.endsWith(".xsd") || name.endsWith(".xml")) {
        return true;
      }
    }
    return false;
  }

  /**
   * Parses the filing in {@code directory}.
   *
   * @throws XbrlProcessingException when the directory cannot be read or a
   *     file is malformed
   */
  public XbrlDocument read(File directory) {
    File[] files = directory.listFiles(File::isFile);
    if (files == null) {
      throw new XbrlProcessingException("Not a readable directory: " + directory);
    }
    Arrays.sort(files);
    XbrlDocumentBuilder builder = new XbrlDocumentBuilder(config);
    boolean haveSchema = false;
    boolean haveInstance = false;
    for (File file : files) {
      String content = readFile(file);
      FileKind kind = classify(file.getName(), content);
      if (kind == null) {
        LOGGER.debug("Ignoring {}", file.getName());
        continue;
      }
      switch (kind) {
        case SCHEMA:
          if (haveSchema) {
            LOGGER.warn("Ignoring additional schema {}", file.getName());
            continue;
          }
          haveSchema = true;
          builder.schema(content, file.getName());
          break;
        case INSTANCE:
          if (haveInstance) {
            LOGGER.warn("Ignoring additional instance document {}", file.getName());
            continue;
          }
          haveInstance = true;
          builder.instance(content, file.getName());
          break;
        default:
          builder.linkbase(LinkbaseType.valueOf(kind.name()), content, file.getName());
          break;
      }
      LOGGER.debug("Classified {} as {}", file.getName(), kind);
    }
    if (!haveInstance) {
      LOGGER.warn("No instance document found in {}", directory);
    }
    LOGGER.info("Reading XBRL filing from {}", directory);
    return builder.build();
  }

  private static String readFile(File file) {
    try {
      return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new XbrlProcessingException("Failed to read " + file, file.getName(), null, e);
    }
  }
}
