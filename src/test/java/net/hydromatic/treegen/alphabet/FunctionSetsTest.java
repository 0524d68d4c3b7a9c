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

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.util.Map;
import java.util.Random;

import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests {@link FunctionSets}, {@link PrimitiveSets} and
 * {@link PrimitiveSet}. */
public class FunctionSetsTest {
  @Test void testBuiltIn() {
    final Map<String, FunctionSet> functionSets = FunctionSets.builtIn();
    assertThat(functionSets.keySet(),
        hasToString("[nicolau_a, nicolau_b, nicolau_c]"));
    final FunctionSet b = FunctionSets.lookup(functionSets, "nicolau_b");
    assertThat(b,
        hasToString("nicolau_b[sin, tanh, add, sub, mul, aq]"));
    assertThat(b.maxDepth, is(5));
    assertThat(b.binSize, is(1));
    assertThat(b.maxArity(), is(2));
    final FunctionSet a = FunctionSets.lookup(functionSets, "nicolau_a");
    assertThat(a.maxDepth, is(7));
    assertThat(a.binSize, is(2));
    assertThat(FunctionSets.lookup(functionSets, "nicolau_c").functions.size(),
        is(9));
    assertThrows(IllegalArgumentException.class,
        () -> FunctionSets.lookup(functionSets, "nicolau_z"));
  }

  @Test void testRead() {
    final URL url =
        FunctionSetsTest.class.getResource("/function-sets-test.toml");
    assertThat(url, notNullValue());
    final Map<String, FunctionSet> functionSets = FunctionSets.read(url);
    assertThat(functionSets.keySet(), hasToString("[tiny, binary]"));
    final FunctionSet tiny = functionSets.get("tiny");
    assertThat(tiny.functions,
        is(ImmutableList.of(BuiltInFunction.ADD, BuiltInFunction.SIN)));
    assertThat(tiny.maxDepth, is(3));
    assertThat(tiny.binSize, is(4));
  }

  @Test void testReadUnknownFunction() {
    final URL url =
        FunctionSetsTest.class.getResource("/function-sets-bad.toml");
    assertThat(url, notNullValue());
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> FunctionSets.read(url));
    assertThat(e.getMessage().startsWith("unknown function 'cos'"), is(true));
  }

  /** With 8-bit opcodes, the 6 functions of "nicolau_b" leave room for 5
   * variables and 244 constants. */
  @Test void testPrimitiveSet() {
    final FunctionSet b =
        FunctionSets.lookup(FunctionSets.builtIn(), "nicolau_b");
    final PrimitiveSet primitiveSet =
        PrimitiveSets.create(b, PrimitiveSets.DEFAULT_OPCODE_WIDTH,
            new Random(37));
    assertThat(primitiveSet.primitives().size(), is(6));
    assertThat(primitiveSet.variables().size(), is(5));
    assertThat(primitiveSet.variables().get(4), hasToString("v4"));
    assertThat(primitiveSet.constants().size(), is(244));
    assertThat(primitiveSet.maxArity(), is(2));
    // 5 variables and one ephemeral, against 6 functions
    assertThat(primitiveSet.terminalRatio(), is(0.5));
    for (Symbol.Constant constant : primitiveSet.constants()) {
      assertThat(constant.value, greaterThanOrEqualTo(-1d));
      assertThat(constant.value, lessThan(1d));
    }

    // The same seed gives the same pool
    final PrimitiveSet primitiveSet2 =
        PrimitiveSets.create(b, PrimitiveSets.DEFAULT_OPCODE_WIDTH,
            new Random(37));
    assertThat(primitiveSet2.constants().get(100).value,
        is(primitiveSet.constants().get(100).value));

    // 3 bits are too few for 6 functions
    assertThrows(IllegalArgumentException.class,
        () -> PrimitiveSets.create(b, 3, new Random(0)));
  }

  @Test void testTerminals() {
    final PrimitiveSet primitiveSet =
        PrimitiveSet.builder("t")
            .retType("int")
            .variablePrefix("x")
            .add(BuiltInFunction.ADD)
            .variables(3)
            .build();
    assertThat(primitiveSet.terminals("int"), hasToString("[x0, x1, x2]"));
    assertThat(primitiveSet.terminals("float").isEmpty(), is(true));
    assertThat(primitiveSet.functions("float").isEmpty(), is(true));
    assertThat(primitiveSet.functions("int"), hasToString("[add]"));
    assertThat(primitiveSet.functions("int").get(0).argTypes,
        hasToString("[int, int]"));
    assertThat(primitiveSet.constants().isEmpty(), is(true));
    assertThat(primitiveSet.terminalRatio(), is(0.75));

    assertThrows(IllegalArgumentException.class,
        () -> PrimitiveSet.builder("dup")
            .add(BuiltInFunction.ADD)
            .add(BuiltInFunction.ADD));
    assertThrows(IllegalArgumentException.class,
        () -> PrimitiveSet.builder("ratio").terminalRatio(1.5).build());
  }

  /** An ephemeral terminal materializes to one of its pool's constants. */
  @Test void testEphemeral() {
    final PrimitiveSet primitiveSet =
        PrimitiveSet.builder("e")
            .add(BuiltInFunction.SIN)
            .ephemeral("erc", ImmutableList.of(0.25, 0.5))
            .build();
    final Symbol.Terminal ephemeral =
        primitiveSet.terminals(PrimitiveSet.DEFAULT_TYPE).get(0);
    assertThat(ephemeral.kind, is(Symbol.Kind.EPHEMERAL));
    assertThat(ephemeral.name, is("erc"));
    final Random random = new Random(0);
    for (int i = 0; i < 10; i++) {
      final Symbol.Terminal constant = ephemeral.materialize(random);
      assertThat(constant.kind, is(Symbol.Kind.CONSTANT));
      assertThat(primitiveSet.constants().contains(constant), is(true));
    }
  }

  @Test void testBuiltInFunctions() {
    assertThat(BuiltInFunction.lookup("aq"), is(BuiltInFunction.AQ));
    assertThat(BuiltInFunction.AQ.arity, is(2));
    assertThat(BuiltInFunction.TANH.arity, is(1));
    assertThat(BuiltInFunction.AQ.apply(3, 0), is(3d));
    assertThat(BuiltInFunction.AQ.apply(-4, 0), is(-4d));
    assertThat(BuiltInFunction.LOG.apply(0), is(0d));
    assertThat(BuiltInFunction.LOG.apply(-Math.E), is(Math.log(Math.E)));
    assertThat(BuiltInFunction.SQRT.apply(-4), is(0d));
    assertThat(BuiltInFunction.SQRT.apply(9), is(3d));
    assertThat(BuiltInFunction.SUB.apply(1, 3), is(-2d));
    assertThrows(IllegalArgumentException.class,
        () -> BuiltInFunction.SIN.apply(1, 2));
    assertThrows(IllegalArgumentException.class,
        () -> BuiltInFunction.lookup("cos"));
  }
}

// End FunctionSetsTest.java
