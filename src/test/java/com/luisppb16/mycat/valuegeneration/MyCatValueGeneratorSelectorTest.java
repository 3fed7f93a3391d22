/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.valuegeneration;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MyCatValueGeneratorSelectorTest {

  private final MyCatValueGeneratorSelector selector = new MyCatValueGeneratorSelector();

  private static PropertyDescriptor property(
      Class<?> type, ValueGenerated generated, String defaultSql) {
    return PropertyDescriptor.builder()
        .entityName("Order")
        .name("id")
        .type(type)
        .valueGenerated(generated)
        .defaultValueSql(defaultSql)
        .build();
  }

  @Nested
  class Selection {

    @Test
    void clientGeneratedGuid_isSequential() {
      assertThat(selector.select(property(UUID.class, ValueGenerated.ON_ADD, null)))
          .containsInstanceOf(SequentialGuidValueGenerator.class);
    }

    @Test
    void guidWithStoreDefault_isTemporary() {
      assertThat(selector.select(property(UUID.class, ValueGenerated.ON_ADD, "(UUID())")))
          .containsInstanceOf(TemporaryGuidValueGenerator.class);
    }

    @Test
    void guidNeverGenerated_isTemporary() {
      assertThat(selector.select(property(UUID.class, ValueGenerated.NEVER, null)))
          .containsInstanceOf(TemporaryGuidValueGenerator.class);
    }

    @Test
    void storeGeneratedInteger_getsTemporaryNumbers() {
      assertThat(selector.select(property(int.class, ValueGenerated.ON_ADD, null)))
          .containsInstanceOf(TemporaryNumberValueGenerator.class);
    }

    @Test
    void plainString_getsNothing() {
      assertThat(selector.select(property(String.class, ValueGenerated.ON_ADD, null))).isEmpty();
      assertThat(selector.select(property(Long.class, ValueGenerated.NEVER, null))).isEmpty();
    }

    @Test
    void selection_isCachedPerProperty() {
      PropertyDescriptor id = property(UUID.class, ValueGenerated.ON_ADD, null);

      assertThat(selector.select(id).orElseThrow()).isSameAs(selector.select(id).orElseThrow());
    }
  }

  @Nested
  class Generators {

    @Test
    void sequentialGuids_increaseAndCarryVersionAndVariant() {
      SequentialGuidValueGenerator generator = new SequentialGuidValueGenerator(1_000_000L);
      List<UUID> ids = new ArrayList<>();
      for (int i = 0; i < 5000; i++) {
        ids.add(generator.next());
      }

      assertThat(ids).isSortedAccordingTo(UUID::compareTo);
      assertThat(ids).extracting(UUID::toString).isSortedAccordingTo(String::compareTo);
      assertThat(ids).allSatisfy(
          id -> {
            assertThat(id.version()).isEqualTo(4);
            assertThat(id.variant()).isEqualTo(2);
          });
      assertThat(generator.generatesTemporaryValues()).isFalse();
    }

    @Test
    void temporaryNumbers_areNegativeAndDistinct() {
      TemporaryNumberValueGenerator longs = new TemporaryNumberValueGenerator(Long.class);
      TemporaryNumberValueGenerator ints = new TemporaryNumberValueGenerator(int.class);

      Number first = longs.next();
      Number second = longs.next();

      assertThat(first).isInstanceOf(Long.class);
      assertThat(first.longValue()).isNegative().isNotEqualTo(second.longValue());
      assertThat(ints.next()).isInstanceOf(Integer.class);
      assertThat(longs.generatesTemporaryValues()).isTrue();
    }

    @Test
    void temporaryShorts_runOutBeforeZero() {
      TemporaryNumberValueGenerator shorts = new TemporaryNumberValueGenerator(short.class);

      assertThatThrownBy(
              () -> {
                for (int i = 0; i < Short.MAX_VALUE; i++) {
                  shorts.next();
                }
              })
          .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void unsupportedType_rejected() {
      assertThatThrownBy(() -> new TemporaryNumberValueGenerator(String.class))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
