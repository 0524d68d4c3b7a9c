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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import net.hydromatic.treegen.tree.Tree;

/** Scores trees against data. */
public abstract class Fitness {
  private Fitness() {}

  /**
   * Returns the coefficient of determination (R²) of an estimate.
   *
   * <p>Returns 1 for a perfect estimate. If the target is constant, returns 1
   * if the estimate is perfect and 0 otherwise.
   */
  public static double r2(double[] target, double[] estimated) {
    checkArgument(target.length == estimated.length, "length mismatch");
    checkArgument(target.length > 0, "no cases");
    double mean = 0;
    for (double t : target) {
      mean += t;
    }
    mean /= target.length;
    double residual = 0;
    double total = 0;
    for (int i = 0; i < target.length; i++) {
      final double e = target[i] - estimated[i];
      residual += e * e;
      final double d = target[i] - mean;
      total += d * d;
    }
    if (total == 0) {
      return residual == 0 ? 1d : 0d;
    }
    return 1d - residual / total;
  }

  /** Evaluates a compiled tree on each fitness case. */
  public static double[] estimate(Code code, double[][] cases) {
    final double[] estimated = new double[cases.length];
    for (int i = 0; i < cases.length; i++) {
      estimated[i] = code.eval(cases[i]);
    }
    return estimated;
  }

  /**
   * Returns the R² score of each tree.
   *
   * @param trees Trees
   * @param cases Fitness cases; each is an array of variable values
   * @param target Desired output for each fitness case
   */
  public static double[] evaluate(
      List<Tree> trees, double[][] cases, double[] target) {
    checkArgument(cases.length == target.length, "length mismatch");
    final double[] scores = new double[trees.size()];
    for (int i = 0; i < trees.size(); i++) {
      final Code code = Compiler.compile(trees.get(i));
      scores[i] = r2(target, estimate(code, cases));
    }
    return scores;
  }
}

// End Fitness.java
