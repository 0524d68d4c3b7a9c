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
package net.hydromatic.treegen;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Table;
import com.google.common.hash.Hashing;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.SortedMap;
import java.util.function.Consumer;
import net.hydromatic.treegen.alphabet.FunctionSet;
import net.hydromatic.treegen.alphabet.FunctionSets;
import net.hydromatic.treegen.alphabet.PrimitiveSet;
import net.hydromatic.treegen.alphabet.PrimitiveSets;
import net.hydromatic.treegen.eval.Profiler;
import net.hydromatic.treegen.gen.Strategy;
import net.hydromatic.treegen.gen.TargetMode;
import net.hydromatic.treegen.io.CorpusWriter;
import net.hydromatic.treegen.sample.BinResult;
import net.hydromatic.treegen.sample.BinSampler;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line driver.
 *
 * <p>Samples trees for one or more function sets, prints how many trees each
 * bin holds, and optionally writes the corpus and profiles its evaluation.
 */
public class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  private final ImmutableList<String> functionSetNames;
  private final Map<Prop, Object> propMap;
  private final ImmutableMap<String, FunctionSet> functionSets;
  private final PrintWriter out;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final PrintWriter out =
        new PrintWriter(
            new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    try {
      final List<String> argList = ImmutableList.copyOf(args);
      if (argList.contains("--help")) {
        usage(out::println);
      } else {
        final Main main = new Main(argList, out, FunctionSets.builtIn());
        main.run();
      }
      out.flush();
    } catch (Throwable e) {
      out.flush();
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main. */
  public Main(
      List<String> argList,
      Writer out,
      Map<String, FunctionSet> functionSets) {
    this.out =
        out instanceof PrintWriter ? (PrintWriter) out : new PrintWriter(out);
    this.functionSets = ImmutableMap.copyOf(functionSets);
    this.propMap = new LinkedHashMap<>();
    final List<String> names = new ArrayList<>();
    for (String arg : argList) {
      if (arg.startsWith("--")) {
        final int i = arg.indexOf('=');
        if (i < 0) {
          throw new RuntimeException(
              "expected '--property=value', got '" + arg + "'");
        }
        Prop.lookup(arg.substring(2, i))
            .setLenient(propMap, arg.substring(i + 1));
      } else {
        FunctionSets.lookup(functionSets, arg);
        names.add(arg);
      }
    }
    this.functionSetNames =
        names.isEmpty()
            ? this.functionSets.keySet().asList()
            : ImmutableList.copyOf(names);
  }

  static void usage(Consumer<String> outLines) {
    outLines.accept("Usage: java " + Main.class.getName()
        + " [--property=value ...] [functionSet ...]");
    outLines.accept("");
    outLines.accept("Properties:");
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      outLines.accept(
          "  --" + prop.camelName + "=" + prop.get(ImmutableMap.of()));
    }
  }

  /**
   * Samples every requested function set. Returns the results, keyed by
   * function set name.
   */
  public Map<String, SortedMap<Integer, BinResult>> run() throws IOException {
    final long seed = Prop.SEED.longValue(propMap);
    final int opcodeWidth = Prop.OPCODE_WIDTH.intValue(propMap);
    final int programsPerBin = Prop.PROGRAMS_PER_BIN.intValue(propMap);
    final @Nullable File directory = Prop.DIRECTORY.fileValue(propMap);
    final BinSampler.Config config =
        BinSampler.Config.DEFAULT
            .withMaxAttempts(Prop.MAX_ATTEMPTS.intValue(propMap))
            .withStrategy(Prop.STRATEGY.enumValue(propMap, Strategy.class))
            .withTargetMode(
                Prop.TARGET_MODE.enumValue(propMap, TargetMode.class))
            .withThreads(Prop.THREADS.intValue(propMap));

    // One stream for all constant pools, consumed in function set order.
    final Random random = new Random(seed);
    final Map<String, SortedMap<Integer, BinResult>> resultMap =
        new LinkedHashMap<>();
    final Map<String, PrimitiveSet> primitiveSets = new LinkedHashMap<>();
    for (String name : functionSetNames) {
      final FunctionSet functionSet = requireNonNull(functionSets.get(name));
      final PrimitiveSet primitiveSet =
          PrimitiveSets.create(functionSet, opcodeWidth, random);
      primitiveSets.put(name, primitiveSet);
      LOGGER.info("Sampling {} (max depth {}, bin size {})", functionSet,
          functionSet.maxDepth, functionSet.binSize);
      final BinSampler sampler =
          new BinSampler(config.withSeed(functionSetSeed(seed, name)));
      final SortedMap<Integer, BinResult> results =
          sampler.sampleBins(primitiveSet, functionSet.maxDepth,
              functionSet.binSize, programsPerBin);
      resultMap.put(name, results);

      if (directory != null) {
        final CorpusWriter writer = new CorpusWriter(directory);
        writer.writeConstants(primitiveSet);
        if (!writer.writePrograms(name, results)) {
          LOGGER.info("Not writing programs for {}; some bins are not filled",
              name);
        }
      }
    }

    out.println("Numbers of programs:");
    resultMap.forEach((name, results) ->
        out.println(CorpusWriter.summary(name, results)));

    if (Prop.PROFILE.booleanValue(propMap)) {
      final List<Integer> counts = Prop.FITNESS_CASES.intListValue(propMap);
      final int repeat = Prop.REPEAT.intValue(propMap);
      resultMap.forEach((name, results) -> {
        final PrimitiveSet primitiveSet = primitiveSets.get(name);
        final Profiler profiler =
            new Profiler(primitiveSet.variables().size(), counts, repeat,
                random);
        final Table<Integer, Integer, Double> table =
            profiler.profile(results);
        out.println("Function set `" + name + "`:");
        for (int count : counts) {
          out.println("Number of fitness cases: `" + count + "`");
          out.println("  " + table.column(count));
        }
      });
    }
    out.flush();
    return resultMap;
  }

  /** Returns the seed for a function set's bins. */
  static long functionSetSeed(long seed, String name) {
    return Hashing.murmur3_128()
        .newHasher()
        .putLong(seed)
        .putString(name, StandardCharsets.UTF_8)
        .hash()
        .asLong();
  }
}

// End Main.java
