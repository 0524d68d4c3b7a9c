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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.io.File;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.treegen.alphabet.PrimitiveSets;
import net.hydromatic.treegen.gen.Strategy;
import net.hydromatic.treegen.gen.TargetMode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property of a sampling run.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that has no
 * entry in the map has its default value.
 *
 * @see Main
 */
public enum Prop {
  /**
   * File property "directory" is where the corpus is written. Default is null,
   * in which case no files are written.
   */
  DIRECTORY("directory", File.class, false, null),

  /**
   * String property "fitnessCases" is a comma-separated list of the numbers of
   * fitness cases with which to profile evaluation. Default is "10,100,1000".
   */
  FITNESS_CASES("fitnessCases", String.class, true, "10,100,1000"),

  /**
   * Integer property "maxAttempts" is the number of times to call the builder
   * for each tree requested from a bin. Default is 1.
   */
  MAX_ATTEMPTS("maxAttempts", Integer.class, true, 1),

  /**
   * Integer property "opcodeWidth" is the number of bits in an opcode, which
   * determines the number of constants. Default is 8.
   */
  OPCODE_WIDTH(
      "opcodeWidth", Integer.class, true, PrimitiveSets.DEFAULT_OPCODE_WIDTH),

  /**
   * Boolean property "profile" controls whether to time the evaluation of the
   * sampled trees. Default is false.
   */
  PROFILE("profile", Boolean.class, true, false),

  /**
   * Integer property "programsPerBin" is the number of distinct trees to
   * collect in each size bin. Default is 1.
   */
  PROGRAMS_PER_BIN("programsPerBin", Integer.class, true, 1),

  /** Integer property "repeat" is the number of timed runs when profiling. */
  REPEAT("repeat", Integer.class, true, 1),

  /** Long property "seed" seeds every random stream. Default is 37. */
  SEED("seed", Long.class, true, 37L),

  /** Property "strategy" is how trees are grown. Default is "grow". */
  STRATEGY("strategy", Strategy.class, true, Strategy.GROW),

  /**
   * Property "targetMode" is whether the builder aims for a random size
   * ("by_size", the default) or a random depth ("by_depth").
   */
  TARGET_MODE("targetMode", TargetMode.class, true, TargetMode.BY_SIZE),

  /**
   * Integer property "threads" is the number of threads with which to sample
   * bins. Default is 1.
   */
  THREADS("threads", Integer.class, true, 1);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(
      String camelName,
      Class<?> type,
      boolean required,
      @Nullable Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(validValue(type, defaultValue));
    }
  }

  private static boolean validValue(Class<?> type, Object value) {
    if (type == Boolean.class
        || type == File.class
        || type == Integer.class
        || type == Long.class
        || type == String.class
        || type.isEnum()) {
      return type.isInstance(value);
    }
    return false;
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new RuntimeException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property, or null. */
  public @Nullable Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    Object o = map.get(this);
    return this.<Integer>typeValue(o);
  }

  /** Returns the value of a long property. */
  public long longValue(Map<Prop, Object> map) {
    checkType(Long.class);
    Object o = map.get(this);
    return this.<Long>typeValue(o);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  /** Returns the value of a file property, or null. */
  public @Nullable File fileValue(Map<Prop, Object> map) {
    checkType(File.class);
    return (File) get(map);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  /** Returns the value of a comma-separated list of integers. */
  public List<Integer> intListValue(Map<Prop, Object> map) {
    final ImmutableList.Builder<Integer> list = ImmutableList.builder();
    for (String s : stringValue(map).split(",")) {
      list.add(Integer.parseInt(s.trim()));
    }
    return list.build();
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new RuntimeException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /**
   * Sets the value of a property, converting strings (such as command-line
   * arguments) to the property's type.
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = (String) value;
      if (type.isEnum()) {
        Optional<Enum> optional =
            Enums.getIfPresent((Class<Enum>) type, s.toUpperCase(Locale.ROOT));
        if (!optional.isPresent()) {
          String values =
              Arrays.stream((Enum[]) type.getEnumConstants())
                  .map(e -> e.name().toLowerCase(Locale.ROOT))
                  .collect(Collectors.joining("', '", "'", "'"));
          throw new RuntimeException(
              "value for property " + camelName + " must be one of: "
                  + values);
        }
        set(map, optional.get());
        return;
      }
      try {
        if (type == Integer.class) {
          set(map, Integer.valueOf(s));
        } else if (type == Long.class) {
          set(map, Long.valueOf(s));
        } else if (type == Boolean.class) {
          set(map, Boolean.valueOf(s));
        } else if (type == File.class) {
          set(map, new File(s));
        } else {
          set(map, value);
        }
      } catch (NumberFormatException e) {
        throw new RuntimeException(
            "invalid value '" + s + "' for property " + camelName, e);
      }
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new RuntimeException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new RuntimeException("value for property must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
