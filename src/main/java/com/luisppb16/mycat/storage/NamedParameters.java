/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.experimental.UtilityClass;

/**
 * Rewrites named parameter markers ({@code @p0}) into JDBC positional markers.
 *
 * <p>Only names present in the supplied value map are rewritten, so MySQL user variables
 * ({@code @x}) and system variables ({@code @@x}) pass through untouched. Quoted literals and
 * delimited identifiers are copied verbatim.
 */
@UtilityClass
public class NamedParameters {

  public record Expanded(String sql, List<Object> values) {}

  public static Expanded expand(String commandText, Map<String, Object> values, String prefix) {
    Objects.requireNonNull(commandText, "Command text cannot be null");
    Objects.requireNonNull(values, "Parameter values cannot be null");
    if (prefix.length() != 1) {
      throw new IllegalArgumentException("Parameter prefix must be a single character: " + prefix);
    }
    final char marker = prefix.charAt(0);
    final StringBuilder sql = new StringBuilder(commandText.length());
    final List<Object> ordered = new ArrayList<>();

    int i = 0;
    final int length = commandText.length();
    while (i < length) {
      final char c = commandText.charAt(i);
      if (c == '\'' || c == '"' || c == '`') {
        final int end = skipQuoted(commandText, i, c);
        sql.append(commandText, i, end);
        i = end;
      } else if (c == marker && i + 1 < length && commandText.charAt(i + 1) == marker) {
        sql.append(c).append(c);
        i += 2;
      } else if (c == marker) {
        int end = i + 1;
        while (end < length && isNameChar(commandText.charAt(end))) {
          end++;
        }
        final String name = commandText.substring(i + 1, end);
        if (!name.isEmpty() && values.containsKey(name)) {
          sql.append('?');
          ordered.add(values.get(name));
        } else {
          sql.append(commandText, i, end);
        }
        i = end;
      } else {
        sql.append(c);
        i++;
      }
    }
    return new Expanded(sql.toString(), ordered);
  }

  private static int skipQuoted(String text, int start, char quote) {
    int i = start + 1;
    while (i < text.length()) {
      final char c = text.charAt(i);
      if (c == '\\' && quote != '`') {
        i += 2;
        continue;
      }
      if (c == quote) {
        if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return text.length();
  }

  private static boolean isNameChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
