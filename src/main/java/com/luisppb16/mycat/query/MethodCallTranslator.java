/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.query;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Optional;

/**
 * Rewrites a call to a Java method as native SQL, when the translator knows the method.
 *
 * <p>Operands arrive already rendered as SQL fragments: {@code instanceSql} is {@code null} for a
 * static method.
 */
@FunctionalInterface
public interface MethodCallTranslator {

  Optional<String> translate(Method method, String instanceSql, List<String> argumentsSql);
}
