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
import static net.hydromatic.treegen.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;

/**
 * Named list of functions, plus the maximum depth and bin size with which to
 * sample trees over it.
 *
 * @see FunctionSets
 */
public class FunctionSet {
  public final String name;
  public final ImmutableList<BuiltInFunction> functions;
  public final int maxDepth;
  public final int binSize;

  public FunctionSet(
      String name, List<BuiltInFunction> functions, int maxDepth, int binSize) {
    this.name = requireNonNull(name, "name");
    this.functions = ImmutableList.copyOf(functions);
    this.maxDepth = maxDepth;
    this.binSize = binSize;
    checkArgument(!functions.isEmpty(), "function set %s is empty", name);
    checkArgument(maxDepth >= 0, "negative max depth in %s", name);
    checkArgument(binSize > 0, "bin size must be positive in %s", name);
  }

  /** Returns the largest arity of any function in this set. */
  public int maxArity() {
    int maxArity = 0;
    for (BuiltInFunction function : functions) {
      maxArity = Math.max(maxArity, function.arity);
    }
    return maxArity;
  }

  @Override
  public String toString() {
    return name + transformEager(functions, f -> f.fnName);
  }

  /** Creates a function set from a map, as read from a TOML table. */
  @SuppressWarnings("unchecked")
  static FunctionSet create(Map<String, Object> map) {
    final String name = (String) requireNonNull(map.get("name"), "name");
    final List<String> functionNames =
        (List<String>) requireNonNull(map.get("functions"), "functions");
    final Number maxDepth =
        (Number) requireNonNull(map.get("maxDepth"), "maxDepth");
    final Number binSize =
        (Number) requireNonNull(map.get("binSize"), "binSize");
    return new FunctionSet(
        name,
        transformEager(functionNames, BuiltInFunction::lookup),
        maxDepth.intValue(),
        binSize.intValue());
  }
}

// End FunctionSet.java
