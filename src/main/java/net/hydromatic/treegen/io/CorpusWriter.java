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
package net.hydromatic.treegen.io;

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import net.hydromatic.treegen.alphabet.PrimitiveSet;
import net.hydromatic.treegen.alphabet.Symbol;
import net.hydromatic.treegen.sample.BinResult;

/**
 * Writes a sampled corpus to files.
 *
 * <p>Each primitive set has a sub-directory, named after the set, holding
 * {@code constants.txt} (one constant per line, in pool order) and {@code
 * programs.txt} (one canonical tree per line, in bin order).
 */
public class CorpusWriter {
  public static final String CONSTANTS_FILE = "constants.txt";
  public static final String PROGRAMS_FILE = "programs.txt";

  private final File directory;

  public CorpusWriter(File directory) {
    this.directory = directory;
  }

  /** Returns the directory for a primitive set, creating it if necessary. */
  File directory(String name) throws IOException {
    final File dir = new File(directory, name);
    Files.createDirectories(dir.toPath());
    return dir;
  }

  /** Writes a primitive set's constant pool. */
  public File writeConstants(PrimitiveSet primitiveSet) throws IOException {
    final File file = new File(directory(primitiveSet.name), CONSTANTS_FILE);
    try (PrintWriter pw = printWriter(file)) {
      for (Symbol.Constant constant : primitiveSet.constants()) {
        pw.println(constant.value);
      }
    }
    return file;
  }

  /**
   * Writes the trees of every bin, if every bin is filled. Returns whether the
   * file was written.
   */
  public boolean writePrograms(String name, Map<Integer, BinResult> results)
      throws IOException {
    if (!BinResult.allFilled(results.values())) {
      return false;
    }
    final File file = new File(directory(name), PROGRAMS_FILE);
    try (PrintWriter pw = printWriter(file)) {
      for (BinResult result : results.values()) {
        for (String program : result.programs()) {
          pw.println(program);
        }
      }
    }
    return true;
  }

  private static PrintWriter printWriter(File file) throws IOException {
    return new PrintWriter(
        Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8));
  }

  /**
   * Returns a line describing how many trees each bin holds, for example
   * "nicolau_b = [1, 1, 0, 1]".
   */
  public static String summary(String name, Map<Integer, BinResult> results) {
    final List<Integer> counts =
        results.values().stream()
            .map(result -> result.samples.size())
            .collect(ImmutableList.toImmutableList());
    return name + " = " + counts;
  }
}

// End CorpusWriter.java
