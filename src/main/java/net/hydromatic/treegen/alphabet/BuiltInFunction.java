/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.treegen.alphabet;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in functions that may appear in a function set.
 *
 * <p>Every function maps real numbers to a real number. Functions that are
 * undefined for part of their domain ({@link #LOG}, {@link #SQRT}) are
 * "protected": they return a fixed value instead of {@code NaN}.
 */
public enum BuiltInFunction {
  /** Function "add", of arity 2. */
  ADD("add", (x1, x2) -> x1 + x2),

  /**
   * Function "aq", the analytic quotient, of arity 2.
   *
   * <p>As defined by Ni et al. in "The use of an analytic quotient operator in
   * genetic programming": {@code aq(x1, x2) = x1 / sqrt(1 + x2^2)}.
   */
  AQ("aq", (x1, x2) -> x1 / Math.sqrt(1 + x2 * x2)),

  /** Function "exp", exponentiation base e, of arity 1. */
  EXP("exp", Math::exp),

  /** Function "log", protected natural logarithm of arity 1. */
  LOG("log", x -> x != 0 ? Math.log(Math.abs(x)) : 0),

  /** Function "mul", of arity 2. */
  MUL("mul", (x1, x2) -> x1 * x2),

  /** Function "sin", of arity 1. */
  SIN("sin", Math::sin),

  /** Function "sqrt", protected square root of arity 1. Negative gives 0. */
  SQRT("sqrt", x -> x < 0 ? 0 : Math.sqrt(x)),

  /** Function "sub", of arity 2. */
  SUB("sub", (x1, x2) -> x1 - x2),

  /** Function "tanh", hyperbolic tangent of arity 1. */
  TANH("tanh", Math::tanh);

  /** Name, as it appears in function set definitions and canonical trees. */
  public final String fnName;

  public final int arity;

  private final @Nullable DoubleUnaryOperator unary;
  private final @Nullable DoubleBinaryOperator binary;

  /** Map of all functions, keyed by {@link #fnName}. */
  public static final ImmutableMap<String, BuiltInFunction> BY_NAME;

  static {
    final Map<String, BuiltInFunction> map = new LinkedHashMap<>();
    for (BuiltInFunction f : values()) {
      map.put(f.fnName, f);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  BuiltInFunction(String fnName, DoubleUnaryOperator unary) {
    this.fnName = requireNonNull(fnName, "fnName");
    this.arity = 1;
    this.unary = requireNonNull(unary, "unary");
    this.binary = null;
  }

  BuiltInFunction(String fnName, DoubleBinaryOperator binary) {
    this.fnName = requireNonNull(fnName, "fnName");
    this.arity = 2;
    this.unary = null;
    this.binary = requireNonNull(binary, "binary");
  }

  /** Looks up a function by name. Throws if not found; never returns null. */
  public static BuiltInFunction lookup(String fnName) {
    final BuiltInFunction f = BY_NAME.get(fnName);
    if (f == null) {
      throw new IllegalArgumentException(
          "unknown function '" + fnName + "'; expected one of "
              + BY_NAME.keySet());
    }
    return f;
  }

  /** Applies this function to one argument. */
  public double apply(double x) {
    checkArgument(unary != null, "function %s has arity %s", fnName, arity);
    return unary.applyAsDouble(x);
  }

  /** Applies this function to two arguments. */
  public double apply(double x1, double x2) {
    checkArgument(binary != null, "function %s has arity %s", fnName, arity);
    return binary.applyAsDouble(x1, x2);
  }

  /** Returns the implementation of a function of arity 1. */
  public DoubleUnaryOperator unary() {
    return requireNonNull(unary, fnName);
  }

  /** Returns the implementation of a function of arity 2. */
  public DoubleBinaryOperator binary() {
    return requireNonNull(binary, fnName);
  }
}

// End BuiltInFunction.java
