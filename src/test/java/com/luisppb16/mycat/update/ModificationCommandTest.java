/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import static org.assertj.core.api.Assertions.*;

import com.luisppb16.mycat.storage.Row;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ModificationCommandTest {

  private final Commands commands = new Commands();

  private static ModificationCommand insertWithKey(Class<?> keyType) {
    return new Commands().insertWithIdentity("users", keyType, "name", "a");
  }

  @Nested
  class Shape {

    @Test
    void writeAndReadColumnNames_keepDeclarationOrder() {
      ModificationCommand command =
          commands.updateReadingBack("users", 1, "name", "a", "updated_at");

      assertThat(command.writeColumnNames()).containsExactly("name");
      assertThat(command.readColumnNames()).containsExactly("updated_at");
      assertThat(command.requiresResultPropagation()).isTrue();
    }

    @Test
    void plainUpdate_needsNoPropagation() {
      assertThat(commands.update("users", 1, "name", "a").requiresResultPropagation()).isFalse();
    }

    @Test
    void writtenColumnWithoutParameter_rejected() {
      assertThatThrownBy(() -> ColumnModification.builder().columnName("name").write(true).build())
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("name");
    }

    @Test
    void columnList_isImmutable() {
      ModificationCommand command = commands.delete("users", 1);

      assertThatThrownBy(() -> command.getColumnModifications().clear())
          .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toString_namesStateAndTable() {
      ModificationCommand command =
          ModificationCommand.builder()
              .tableName("orders")
              .schema("shop")
              .entityState(EntityState.DELETED)
              .columnModifications(List.of())
              .build();

      assertThat(command).hasToString("ModificationCommand{DELETED shop.orders}");
    }
  }

  @Nested
  class GeneratedKeys {

    @Test
    void longKey_keepsIdentity() {
      ModificationCommand command = insertWithKey(Long.class);

      command.assignGeneratedKey(0, 5_000_000_000L);

      assertThat(command.getColumnModifications().get(0).getValue()).isEqualTo(5_000_000_000L);
    }

    @Test
    void intKey_isNarrowed() {
      ModificationCommand command = insertWithKey(int.class);

      command.assignGeneratedKey(0, 12);

      assertThat(command.getColumnModifications().get(0).getValue()).isEqualTo(12);
    }

    @Test
    void shortKey_isNarrowed() {
      ModificationCommand command = insertWithKey(Short.class);

      command.assignGeneratedKey(0, 12);

      assertThat(command.getColumnModifications().get(0).getValue()).isEqualTo((short) 12);
    }

    @Test
    void identityTooLargeForKeyType_fails() {
      assertThatThrownBy(() -> insertWithKey(Integer.class).assignGeneratedKey(0, 1L << 40))
          .isInstanceOf(ArithmeticException.class);
      assertThatThrownBy(() -> insertWithKey(Byte.class).assignGeneratedKey(0, 300))
          .isInstanceOf(ArithmeticException.class);
    }

    @Test
    void nonKeyColumn_rejected() {
      ModificationCommand command = insertWithKey(Long.class);

      assertThatThrownBy(() -> command.assignGeneratedKey(1, 1))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("not a key");
    }
  }

  @Nested
  class Propagation {

    @Test
    void readColumns_takeRowValues() {
      ModificationCommand command =
          commands.updateReadingBack("users", 1, "name", "a", "updated_at");

      command.propagateResults(new Row(Map.of("updated_at", "now")));

      assertThat(command.getColumnModifications().get(2).getValue()).isEqualTo("now");
      assertThat(command.getColumnModifications().get(0).getValue()).isEqualTo("a");
    }

    @Test
    void missingReadColumn_fails() {
      ModificationCommand command =
          commands.updateReadingBack("users", 1, "name", "a", "updated_at");

      assertThatThrownBy(() -> command.propagateResults(new Row(Map.of("other", 1))))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("updated_at");
    }
  }
}
