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
import java.util.Collections;
import java.util.Random;

/**
 * Member of an alphabet: a function, a variable, or a constant.
 *
 * <p>Symbols are immutable. A {@link Primitive} has one or more arguments;
 * every other kind of symbol is a {@link Terminal} and has none.
 */
public abstract class Symbol {
  public final Kind kind;
  public final String name;

  Symbol(Kind kind, String name) {
    this.kind = requireNonNull(kind, "kind");
    this.name = requireNonNull(name, "name");
  }

  /** Number of arguments. */
  public abstract int arity();

  @Override
  public String toString() {
    return name;
  }

  /** Kind of symbol. */
  public enum Kind {
    FUNCTION,
    VARIABLE,
    /** Generator that yields a {@link #CONSTANT} when materialized. */
    EPHEMERAL,
    CONSTANT
  }

  /** Function symbol. */
  public static class Primitive extends Symbol {
    public final BuiltInFunction function;
    public final String retType;
    /** Argument types; all equal to {@link #retType}. */
    public final ImmutableList<String> argTypes;

    Primitive(BuiltInFunction function, String retType) {
      super(Kind.FUNCTION, function.fnName);
      this.function = function;
      this.retType = requireNonNull(retType, "retType");
      this.argTypes =
          ImmutableList.copyOf(Collections.nCopies(function.arity, retType));
    }

    @Override
    public int arity() {
      return function.arity;
    }
  }

  /** Symbol that takes no arguments. */
  public abstract static class Terminal extends Symbol {
    Terminal(Kind kind, String name) {
      super(kind, name);
    }

    @Override
    public int arity() {
      return 0;
    }

    /**
     * Returns the terminal to place in a tree. Most terminals return
     * themselves; an {@link Ephemeral} draws a {@link Constant}.
     */
    public abstract Terminal materialize(Random random);
  }

  /** Reference to the {@code ordinal}th input variable. */
  public static class Variable extends Terminal {
    public final int ordinal;

    Variable(int ordinal, String prefix) {
      super(Kind.VARIABLE, prefix + ordinal);
      checkArgument(ordinal >= 0);
      this.ordinal = ordinal;
    }

    @Override
    public Terminal materialize(Random random) {
      return this;
    }
  }

  /**
   * Generator of constants. Draws uniformly from a fixed pool that was
   * sampled once, when the alphabet was created.
   */
  public static class Ephemeral extends Terminal {
    public final ImmutableList<Constant> pool;

    Ephemeral(String name, ImmutableList<Constant> pool) {
      super(Kind.EPHEMERAL, name);
      checkArgument(!pool.isEmpty(), "empty constant pool");
      this.pool = pool;
    }

    @Override
    public Terminal materialize(Random random) {
      return pool.get(random.nextInt(pool.size()));
    }
  }

  /** Constant value; the {@code ordinal}th member of a pool. */
  public static class Constant extends Terminal {
    public final int ordinal;
    public final double value;

    Constant(int ordinal, double value) {
      super(Kind.CONSTANT, Double.toString(value));
      this.ordinal = ordinal;
      this.value = value;
    }

    @Override
    public Terminal materialize(Random random) {
      return this;
    }
  }
}

// End Symbol.java
