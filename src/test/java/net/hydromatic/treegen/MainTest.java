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

import net.hydromatic.treegen.alphabet.FunctionSet;
import net.hydromatic.treegen.alphabet.FunctionSets;
import net.hydromatic.treegen.gen.Strategy;
import net.hydromatic.treegen.sample.BinResult;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static java.util.Objects.requireNonNull;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests {@link Main} and {@link Prop}. */
public class MainTest {
  private static final Map<String, FunctionSet> FUNCTION_SETS =
      FunctionSets.read(
          requireNonNull(
              MainTest.class.getResource("/function-sets-test.toml")));

  @TempDir File directory;

  /** Runs the command line and returns the lines of its output. */
  private static List<String> run(String... args) throws IOException {
    final StringWriter sw = new StringWriter();
    new Main(ImmutableList.copyOf(args), sw, FUNCTION_SETS).run();
    return ImmutableList.copyOf(sw.toString().split("\\R"));
  }

  @Test void testRun() throws IOException {
    final List<String> lines = run("--maxAttempts=20", "binary");
    assertThat(lines,
        hasToString("[Numbers of programs:, binary = [1]]"));
  }

  /** With no function set names, samples every function set. */
  @Test void testRunAll() throws IOException {
    final StringWriter sw = new StringWriter();
    final Map<String, SortedMap<Integer, BinResult>> results =
        new Main(ImmutableList.of("--programsPerBin=2"), sw, FUNCTION_SETS)
            .run();
    assertThat(results.keySet(), hasToString("[tiny, binary]"));
    // "tiny" has arity 2 and depth 3, so 15 sizes in bins of 4
    assertThat(results.get("tiny").size(), is(4));
    assertThat(results.get("binary").size(), is(1));
    assertThat(sw.toString().startsWith("Numbers of programs:"), is(true));
  }

  /** The same seed gives the same trees; a different seed need not. */
  @Test void testSeed() throws IOException {
    final List<String> programs0 = programs("--seed=5");
    final List<String> programs1 = programs("--seed=5");
    assertThat(programs0, is(programs1));
    assertThat(programs0.size(), is(12));
  }

  private static List<String> programs(String... args) throws IOException {
    final List<String> argList = new ArrayList<>(ImmutableList.copyOf(args));
    argList.add("--programsPerBin=3");
    argList.add("--maxAttempts=4");
    argList.add("--strategy=half_and_half");
    argList.add("tiny");
    final Map<String, SortedMap<Integer, BinResult>> results =
        new Main(argList, new StringWriter(), FUNCTION_SETS).run();
    final List<String> programs = new ArrayList<>();
    for (BinResult result : results.get("tiny").values()) {
      programs.addAll(result.programs());
      // Pad unfilled bins so that bins line up
      for (int i = result.samples.size(); i < result.target; i++) {
        programs.add("");
      }
    }
    return programs;
  }

  @Test void testDirectory() throws IOException {
    run("--directory=" + directory, "--maxAttempts=20", "binary");
    final File subDirectory = new File(directory, "binary");
    final List<String> constants =
        Files.readAllLines(new File(subDirectory, "constants.txt").toPath(),
            StandardCharsets.UTF_8);
    // 256 codes, minus 2 functions, 1 ephemeral and 1 variable
    assertThat(constants.size(), is(252));
    final List<String> programs =
        Files.readAllLines(new File(subDirectory, "programs.txt").toPath(),
            StandardCharsets.UTF_8);
    assertThat(programs.size(), is(1));
  }

  @Test void testProfile() throws IOException {
    final List<String> lines =
        run("--profile=true", "--fitnessCases=5,20", "--repeat=2", "binary");
    assertThat(lines, hasItem("Function set `binary`:"));
    assertThat(lines, hasItem("Number of fitness cases: `5`"));
    assertThat(lines, hasItem("Number of fitness cases: `20`"));
  }

  @Test void testBadArguments() {
    final RuntimeException e =
        assertThrows(RuntimeException.class, () -> run("--foo=1"));
    assertThat(e.getMessage(), is("property foo not found"));

    final RuntimeException e2 =
        assertThrows(RuntimeException.class, () -> run("--seed"));
    assertThat(e2.getMessage(),
        is("expected '--property=value', got '--seed'"));

    assertThrows(IllegalArgumentException.class, () -> run("nicolau_z"));

    final RuntimeException e3 =
        assertThrows(RuntimeException.class, () -> run("--strategy=best"));
    assertThat(e3.getMessage(),
        is("value for property strategy must be one of: "
            + "'grow', 'full', 'half_and_half'"));

    final RuntimeException e4 =
        assertThrows(RuntimeException.class, () -> run("--threads=many"));
    assertThat(e4.getMessage(),
        is("invalid value 'many' for property threads"));
  }

  @Test void testUsage() {
    final List<String> lines = new ArrayList<>();
    Main.usage(lines::add);
    assertThat(lines.get(0).startsWith("Usage: java "), is(true));
    assertThat(lines, hasItem("  --seed=37"));
    assertThat(lines, hasItem("  --strategy=GROW"));
    assertThat(lines, hasItem("  --directory=null"));
  }

  @Test void testFunctionSetSeed() {
    assertThat(Main.functionSetSeed(37, "tiny"),
        is(Main.functionSetSeed(37, "tiny")));
    assertThat(Main.functionSetSeed(37, "tiny"),
        not(Main.functionSetSeed(37, "binary")));
    assertThat(Main.functionSetSeed(37, "tiny"),
        not(Main.functionSetSeed(38, "tiny")));
  }

  @Test void testProp() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.lookup("maxAttempts"), is(Prop.MAX_ATTEMPTS));
    assertThat(Prop.lookup("MAX_ATTEMPTS"), is(Prop.MAX_ATTEMPTS));
    assertThat(Prop.MAX_ATTEMPTS.intValue(map), is(1));
    Prop.MAX_ATTEMPTS.setLenient(map, "7");
    assertThat(Prop.MAX_ATTEMPTS.intValue(map), is(7));

    assertThat(Prop.STRATEGY.enumValue(map, Strategy.class),
        is(Strategy.GROW));
    Prop.STRATEGY.setLenient(map, "Half_And_Half");
    assertThat(Prop.STRATEGY.enumValue(map, Strategy.class),
        is(Strategy.HALF_AND_HALF));

    Prop.SEED.setLenient(map, "12345678901");
    assertThat(Prop.SEED.longValue(map), is(12345678901L));

    assertThat(Prop.FITNESS_CASES.intListValue(map),
        hasToString("[10, 100, 1000]"));
    Prop.FITNESS_CASES.setLenient(map, "3, 4");
    assertThat(Prop.FITNESS_CASES.intListValue(map), hasToString("[3, 4]"));

    assertThat(Prop.DIRECTORY.fileValue(map) == null, is(true));
    Prop.DIRECTORY.setLenient(map, "/tmp/x");
    assertThat(Prop.DIRECTORY.fileValue(map), is(new File("/tmp/x")));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.SEED.intValue(map));
    assertThrows(RuntimeException.class,
        () -> Prop.MAX_ATTEMPTS.set(map, "8"));
    assertThrows(RuntimeException.class,
        () -> Prop.MAX_ATTEMPTS.set(map, null));
  }
}

// End MainTest.java
