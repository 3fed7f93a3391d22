/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.storage;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;

/**
 * Property-driven SQL text primitives: identifier delimiting, parameter markers and statement
 * separators.
 *
 * <p>The dialect is described by a {@code .properties} file loaded from the classpath
 * ({@code /dialects/<name>}). Supported properties:
 *
 * <ul>
 *   <li>{@code quoteChar}, {@code quoteEscape}: identifier delimiting
 *   <li>{@code parameterPrefix}: prefix of named parameter markers in the command text
 *   <li>{@code statementTerminator}: appended after every statement
 *   <li>{@code batchHeader}: prepended once to every batch script
 *   <li>{@code batchRowSeparator}: between the row tuples of a multi-row INSERT
 *   <li>{@code lastInsertIdFunction}: the expression yielding the identity of the last INSERT
 * </ul>
 */
@Slf4j
public class SqlGenerationHelper {

  public static final String MYCAT_DIALECT = "mycat.properties";

  private final Properties props = new Properties();

  public SqlGenerationHelper() {
    this(MYCAT_DIALECT);
  }

  public SqlGenerationHelper(String resourceName) {
    if (Objects.nonNull(resourceName)) {
      try (InputStream is = getClass().getResourceAsStream("/dialects/" + resourceName)) {
        if (Objects.nonNull(is)) {
          props.load(is);
        } else {
          log.warn("Dialect resource {} not found, using built-in defaults", resourceName);
        }
      } catch (IOException e) {
        log.warn("Could not read dialect resource {}, using built-in defaults", resourceName, e);
      }
    }
  }

  public String delimitIdentifier(String identifier) {
    String quoteChar = props.getProperty("quoteChar", "`");
    String quoteEscape = props.getProperty("quoteEscape", "``");
    return quoteChar + identifier.replace(quoteChar, quoteEscape) + quoteChar;
  }

  /** Delimits {@code name}, qualified by {@code schema} when one is given. */
  public String delimitIdentifier(String name, String schema) {
    if (Objects.isNull(schema) || schema.isEmpty()) {
      return delimitIdentifier(name);
    }
    return delimitIdentifier(schema) + "." + delimitIdentifier(name);
  }

  /** The marker written into command text for the parameter called {@code name}. */
  public String generateParameterName(String name) {
    return parameterPrefix() + name;
  }

  public String parameterPrefix() {
    return props.getProperty("parameterPrefix", "@");
  }

  public String statementTerminator() {
    return props.getProperty("statementTerminator", ";");
  }

  public String batchHeader() {
    return props.getProperty("batchHeader", "");
  }

  public String batchRowSeparator() {
    return props.getProperty("batchRowSeparator", ",\n");
  }

  public String lastInsertIdFunction() {
    return props.getProperty("lastInsertIdFunction", "LAST_INSERT_ID()");
  }
}
