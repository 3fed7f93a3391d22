/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.query;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Maps a no-argument instance method onto a SQL function applied to the receiver. */
public class ParameterlessInstanceMethodCallTranslator implements MethodCallTranslator {

  private final Class<?> declaringType;
  private final String methodName;
  private final String sqlFunctionName;

  public ParameterlessInstanceMethodCallTranslator(
      Class<?> declaringType, String methodName, String sqlFunctionName) {
    this.declaringType = Objects.requireNonNull(declaringType, "Declaring type cannot be null");
    this.methodName = Objects.requireNonNull(methodName, "Method name cannot be null");
    this.sqlFunctionName = Objects.requireNonNull(sqlFunctionName, "Function name cannot be null");
  }

  @Override
  public Optional<String> translate(Method method, String instanceSql, List<String> argumentsSql) {
    if (Modifier.isStatic(method.getModifiers())
        || method.getDeclaringClass() != declaringType
        || !method.getName().equals(methodName)
        || method.getParameterCount() != 0
        || Objects.isNull(instanceSql)) {
      return Optional.empty();
    }
    return Optional.of(sqlFunctionName + "(" + instanceSql + ")");
  }
}
