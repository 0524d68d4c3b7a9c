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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import net.hydromatic.treegen.alphabet.Symbol.Constant;
import net.hydromatic.treegen.alphabet.Symbol.Ephemeral;
import net.hydromatic.treegen.alphabet.Symbol.Primitive;
import net.hydromatic.treegen.alphabet.Symbol.Terminal;
import net.hydromatic.treegen.alphabet.Symbol.Variable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Alphabet of symbols from which trees are built.
 *
 * <p>A primitive set has a single return type; every function takes arguments
 * of that type and returns it, and every terminal is of that type. The
 * constant pool is sampled when the set is built and never changes.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public class PrimitiveSet {
  /** Default return type. */
  public static final String DEFAULT_TYPE = "float";

  public final String name;
  private final String retType;
  private final ImmutableList<Primitive> primitives;
  private final ImmutableList<Variable> variables;
  private final @Nullable Ephemeral ephemeral;
  private final ImmutableList<Terminal> terminals;
  private final double terminalRatio;
  private final int maxArity;

  private PrimitiveSet(
      String name,
      String retType,
      ImmutableList<Primitive> primitives,
      ImmutableList<Variable> variables,
      @Nullable Ephemeral ephemeral,
      @Nullable Double terminalRatio) {
    this.name = requireNonNull(name, "name");
    this.retType = requireNonNull(retType, "retType");
    this.primitives = requireNonNull(primitives, "primitives");
    this.variables = requireNonNull(variables, "variables");
    this.ephemeral = ephemeral;
    final ImmutableList.Builder<Terminal> b = ImmutableList.builder();
    b.addAll(variables);
    if (ephemeral != null) {
      b.add(ephemeral);
    }
    this.terminals = b.build();
    this.terminalRatio =
        terminalRatio != null
            ? terminalRatio
            : (double) terminals.size()
                / (terminals.size() + primitives.size());
    checkArgument(
        this.terminalRatio >= 0 && this.terminalRatio <= 1,
        "terminal ratio %s out of range [0, 1]",
        this.terminalRatio);
    int maxArity = 0;
    for (Primitive primitive : primitives) {
      maxArity = Math.max(maxArity, primitive.arity());
    }
    this.maxArity = maxArity;
  }

  /** Creates a builder. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Returns the type that trees built from this set return by default. */
  public String retType() {
    return retType;
  }

  /**
   * Returns the terminals that return a given type; empty if the type is not
   * this set's return type.
   */
  public List<Terminal> terminals(String type) {
    return retType.equals(type) ? terminals : ImmutableList.of();
  }

  /**
   * Returns the functions that return a given type; empty if the type is not
   * this set's return type.
   */
  public List<Primitive> functions(String type) {
    return retType.equals(type) ? primitives : ImmutableList.of();
  }

  /** Returns all functions, in the order they were added. */
  public List<Primitive> primitives() {
    return primitives;
  }

  public List<Variable> variables() {
    return variables;
  }

  /** Returns the constant pool; empty if the set has no ephemeral. */
  public List<Constant> constants() {
    return ephemeral == null ? ImmutableList.of() : ephemeral.pool;
  }

  /**
   * Returns the probability that, once minimum bounds are met, the grow
   * strategy places a terminal rather than a function.
   */
  public double terminalRatio() {
    return terminalRatio;
  }

  /** Returns the largest arity of any function; 0 if there are none. */
  public int maxArity() {
    return maxArity;
  }

  @Override
  public String toString() {
    return name + primitives + variables;
  }

  /** Builder for {@link PrimitiveSet}. */
  public static class Builder {
    private final String name;
    private String retType = DEFAULT_TYPE;
    private String variablePrefix = "v";
    private final List<BuiltInFunction> functions = new ArrayList<>();
    private int variableCount = 0;
    private @Nullable String ephemeralName;
    private final List<Double> constants = new ArrayList<>();
    private @Nullable Double terminalRatio;

    Builder(String name) {
      this.name = requireNonNull(name, "name");
    }

    public Builder retType(String retType) {
      this.retType = requireNonNull(retType, "retType");
      return this;
    }

    public Builder variablePrefix(String variablePrefix) {
      this.variablePrefix = requireNonNull(variablePrefix, "variablePrefix");
      return this;
    }

    /** Adds a function. */
    public Builder add(BuiltInFunction function) {
      checkArgument(
          !functions.contains(function), "duplicate function %s", function);
      functions.add(function);
      return this;
    }

    /** Adds several functions. */
    public Builder addAll(Iterable<BuiltInFunction> functions) {
      functions.forEach(this::add);
      return this;
    }

    /** Sets the number of variables, named {@code v0}, {@code v1}, etc. */
    public Builder variables(int variableCount) {
      checkArgument(variableCount >= 0, "negative variable count");
      this.variableCount = variableCount;
      return this;
    }

    /** Adds an ephemeral terminal whose pool holds the given constants. */
    public Builder ephemeral(String ephemeralName, List<Double> constants) {
      checkArgument(!constants.isEmpty(), "empty constant pool");
      this.ephemeralName = requireNonNull(ephemeralName, "ephemeralName");
      this.constants.clear();
      this.constants.addAll(constants);
      return this;
    }

    /**
     * Adds an ephemeral terminal whose pool holds {@code count} constants
     * drawn uniformly from [-1, 1).
     */
    public Builder ephemeral(String ephemeralName, int count, Random random) {
      checkArgument(count > 0, "constant count must be positive: %s", count);
      final List<Double> list = new ArrayList<>();
      for (int i = 0; i < count; i++) {
        list.add(random.nextDouble() * 2 - 1);
      }
      return ephemeral(ephemeralName, list);
    }

    /** Overrides the default terminal ratio. */
    public Builder terminalRatio(double terminalRatio) {
      this.terminalRatio = terminalRatio;
      return this;
    }

    public PrimitiveSet build() {
      final ImmutableList.Builder<Primitive> primitives =
          ImmutableList.builder();
      for (BuiltInFunction function : functions) {
        primitives.add(new Primitive(function, retType));
      }
      final ImmutableList.Builder<Variable> variables = ImmutableList.builder();
      for (int i = 0; i < variableCount; i++) {
        variables.add(new Variable(i, variablePrefix));
      }
      Ephemeral ephemeral = null;
      if (ephemeralName != null) {
        final ImmutableList.Builder<Constant> pool = ImmutableList.builder();
        for (int i = 0; i < constants.size(); i++) {
          pool.add(new Constant(i, constants.get(i)));
        }
        ephemeral = new Ephemeral(ephemeralName, pool.build());
      }
      return new PrimitiveSet(
          name,
          retType,
          primitives.build(),
          variables.build(),
          ephemeral,
          terminalRatio);
    }
  }
}

// End PrimitiveSet.java
