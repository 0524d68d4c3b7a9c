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
package net.hydromatic.treegen.eval;

import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import net.hydromatic.treegen.alphabet.Symbol;
import net.hydromatic.treegen.tree.Tree;

/** Converts trees into executable {@link Code}. */
public abstract class Compiler {
  private Compiler() {}

  /** Compiles a tree. */
  public static Code compile(Tree tree) {
    final Cursor cursor = new Cursor(tree);
    final Code code = cursor.compile();
    if (cursor.i != tree.size()) {
      throw new AssertionError("compiled " + cursor.i + " of " + tree.size()
          + " nodes");
    }
    return code;
  }

  /** Walks the nodes of a tree in prefix order. */
  private static class Cursor {
    final Tree tree;
    int i;

    Cursor(Tree tree) {
      this.tree = tree;
    }

    Code compile() {
      final Symbol node = tree.nodes.get(i++);
      switch (node.kind) {
        case VARIABLE:
          final int ordinal = ((Symbol.Variable) node).ordinal;
          return env -> env[ordinal];

        case CONSTANT:
          final double value = ((Symbol.Constant) node).value;
          return env -> value;

        case FUNCTION:
          final Symbol.Primitive primitive = (Symbol.Primitive) node;
          switch (primitive.arity()) {
            case 1:
              final DoubleUnaryOperator f1 = primitive.function.unary();
              final Code arg = compile();
              return env -> f1.applyAsDouble(arg.eval(env));
            case 2:
              final DoubleBinaryOperator f2 = primitive.function.binary();
              final Code arg0 = compile();
              final Code arg1 = compile();
              return env -> f2.applyAsDouble(arg0.eval(env), arg1.eval(env));
            default:
              throw new AssertionError("arity " + primitive.arity());
          }

        default:
          throw new AssertionError("cannot compile " + node.kind);
      }
    }
  }
}

// End Compiler.java
