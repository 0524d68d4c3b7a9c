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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.treegen.util.Static.transformEager;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Utilities for {@link FunctionSet}. */
public abstract class FunctionSets {
  private FunctionSets() {}

  /** Location of the function sets that ship with this library. */
  public static final String RESOURCE = "/function-sets.toml";

  /**
   * Returns the function sets defined in {@link #RESOURCE}, keyed by name, in
   * the order they are defined.
   */
  public static ImmutableMap<String, FunctionSet> builtIn() {
    final URL url = FunctionSets.class.getResource(RESOURCE);
    return read(requireNonNull(url, RESOURCE));
  }

  /**
   * Reads function sets from a TOML document. The document contains an array
   * of tables called "functionSets", each with the fields "name",
   * "functions", "maxDepth" and "binSize".
   */
  @SuppressWarnings("unchecked")
  public static ImmutableMap<String, FunctionSet> read(URL url) {
    final TomlMapper mapper = new TomlMapper();
    final Map<String, Object> document;
    try (InputStream in = url.openStream()) {
      document = mapper.readValue(in, Map.class);
    } catch (IOException e) {
      throw new UncheckedIOException("error while reading " + url, e);
    }
    final List<Map<String, Object>> rows =
        (List<Map<String, Object>>)
            requireNonNull(document.get("functionSets"), "functionSets");
    final Map<String, FunctionSet> map = new LinkedHashMap<>();
    for (FunctionSet functionSet : transformEager(rows, FunctionSet::create)) {
      if (map.put(functionSet.name, functionSet) != null) {
        throw new IllegalArgumentException(
            "duplicate function set '" + functionSet.name + "' in " + url);
      }
    }
    return ImmutableMap.copyOf(map);
  }

  /** Looks up a function set by name. Throws if not found. */
  public static FunctionSet lookup(
      Map<String, FunctionSet> functionSets, String name) {
    final FunctionSet functionSet = functionSets.get(name);
    if (functionSet == null) {
      throw new IllegalArgumentException(
          "function set '" + name + "' not found; expected one of "
              + functionSets.keySet());
    }
    return functionSet;
  }
}

// End FunctionSets.java
