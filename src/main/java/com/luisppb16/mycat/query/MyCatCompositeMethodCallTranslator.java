/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.query;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** The provider's method-call rewrites; the first translator that knows the method wins. */
public class MyCatCompositeMethodCallTranslator implements MethodCallTranslator {

  private final List<MethodCallTranslator> translators;

  public MyCatCompositeMethodCallTranslator() {
    this(
        List.of(
            new MyCatMathPowerTranslator(),
            new MyCatStringToLowerTranslator(),
            new MyCatStringToUpperTranslator()));
  }

  public MyCatCompositeMethodCallTranslator(List<MethodCallTranslator> translators) {
    this.translators =
        List.copyOf(Objects.requireNonNull(translators, "Translators cannot be null"));
  }

  @Override
  public Optional<String> translate(Method method, String instanceSql, List<String> argumentsSql) {
    Objects.requireNonNull(method, "Method cannot be null");
    Objects.requireNonNull(argumentsSql, "Argument list cannot be null");
    return translators.stream()
        .map(t -> t.translate(method, instanceSql, argumentsSql))
        .flatMap(Optional::stream)
        .findFirst();
  }
}
