/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.storage;

import static org.assertj.core.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NamedParametersTest {

  private static Map<String, Object> values(Object... pairs) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      map.put((String) pairs[i], pairs[i + 1]);
    }
    return map;
  }

  @Test
  void markers_becomePositionalInTextOrder() {
    NamedParameters.Expanded expanded =
        NamedParameters.expand(
            "UPDATE `t` SET `a` = @p1\nWHERE `id` = @p0;\n", values("p0", 7L, "p1", "x"), "@");

    assertThat(expanded.sql()).isEqualTo("UPDATE `t` SET `a` = ?\nWHERE `id` = ?;\n");
    assertThat(expanded.values()).containsExactly("x", 7L);
  }

  @Test
  void repeatedMarker_isBoundTwice() {
    NamedParameters.Expanded expanded =
        NamedParameters.expand("SELECT @p0, @p0", values("p0", 1), "@");

    assertThat(expanded.sql()).isEqualTo("SELECT ?, ?");
    assertThat(expanded.values()).containsExactly(1, 1);
  }

  @Test
  void nullValue_isBound() {
    NamedParameters.Expanded expanded =
        NamedParameters.expand("VALUES (@p0)", values("p0", null), "@");

    assertThat(expanded.sql()).isEqualTo("VALUES (?)");
    assertThat(expanded.values()).containsExactly((Object) null);
  }

  @Test
  void quotedText_isLeftAlone() {
    NamedParameters.Expanded expanded =
        NamedParameters.expand(
            "SELECT '@p0', \"@p0\", `@p0`, 'it''s @p0', @p0", values("p0", 1), "@");

    assertThat(expanded.sql()).isEqualTo("SELECT '@p0', \"@p0\", `@p0`, 'it''s @p0', ?");
    assertThat(expanded.values()).hasSize(1);
  }

  @Test
  void systemAndUserVariables_areLeftAlone() {
    NamedParameters.Expanded expanded =
        NamedParameters.expand("SELECT @@identity, @total, @p0", values("p0", 2), "@");

    assertThat(expanded.sql()).isEqualTo("SELECT @@identity, @total, ?");
    assertThat(expanded.values()).containsExactly(2);
  }

  @Test
  void longerNameIsNotMistakenForPrefix() {
    NamedParameters.Expanded expanded =
        NamedParameters.expand("VALUES (@p1, @p10)", values("p1", "a", "p10", "b"), "@");

    assertThat(expanded.values()).containsExactly("a", "b");
  }

  @Test
  void multiCharacterPrefix_rejected() {
    assertThatThrownBy(() -> NamedParameters.expand("x", Map.of(), "@@"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
