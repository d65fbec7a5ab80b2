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
 * Exception thrown when an XBRL schema, linkbase or instance document cannot be
 * parsed. Carries the name of the offending file and, when available, the start
 * of its content so callers never see a bare XML parser error.
 */
public class XbrlProcessingException extends RuntimeException {
  private static final int SNIPPET_LENGTH = 200;

  private final @Nullable String fileName;
  private final @Nullable String snippet;

  /** Creates a new XbrlProcessingException with the specified message. */
  public XbrlProcessingException(String message) {
    this(message, null, null, null);
  }

  public XbrlProcessingException(String message, Throwable cause) {
    this(message, null, null, cause);
  }

  public XbrlProcessingException(String message, @Nullable String fileName,
      @Nullable String snippet, @Nullable Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
    this.snippet = snippet;
  }

  /**
   * Wraps a low-level parse failure of {@code fileName}.
   *
   * @param fileName name of the file being parsed
   * @param content content of the file, used to build a snippet
   * @param cause underlying parser exception
   */
  public static XbrlProcessingException forFile(String fileName, @Nullable String content,
      Throwable cause) {
    String snippet = snippetOf(content);
    return new XbrlProcessingException(
        String.format("Failed to parse %s: %s", fileName, cause.getMessage()),
        fileName, snippet, cause);
  }

  static @Nullable String snippetOf(@Nullable String content) {
    if (content == null) {
      return null;
    }
    String trimmed = content.trim();
    return trimmed.length() <= SNIPPET_LENGTH
        ? trimmed
        : trimmed.substring(0, SNIPPET_LENGTH) + "...";
  }

  public @Nullable String getFileName() {
    return fileName;
  }

  public @Nullable String getSnippet() {
    return snippet;
  }
}
