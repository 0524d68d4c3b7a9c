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
package net.hydromatic.treegen.gen;

import java.util.function.Consumer;
import net.hydromatic.treegen.tree.Tree;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action each time an obligation is
   * resolved, then calls the underlying tracer.
   */
  public static Tracer withOnResolve(Tracer tracer, ResolveConsumer consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResolve(Obligation obligation, int placed, int pending) {
        consumer.accept(obligation, placed, pending);
        super.onResolve(obligation, placed, pending);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each completed tree,
   * then calls the underlying tracer.
   */
  public static Tracer withOnTree(Tracer tracer, Consumer<Tree> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTree(Tree tree) {
        consumer.accept(tree);
        super.onTree(tree);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action each time the builder
   * gives up, then calls the underlying tracer.
   */
  public static Tracer withOnInfeasible(
      Tracer tracer, Consumer<@Nullable Obligation> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInfeasible(@Nullable Obligation obligation) {
        consumer.accept(obligation);
        super.onInfeasible(obligation);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when a bin is finished,
   * then calls the underlying tracer.
   */
  public static Tracer withOnBin(Tracer tracer, BinConsumer consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onBin(int bin, int attempts, int count, boolean filled) {
        consumer.accept(bin, attempts, count, filled);
        super.onBin(bin, attempts, count, filled);
      }
    };
  }

  /** Action on {@link Tracer#onResolve}. */
  @FunctionalInterface
  public interface ResolveConsumer {
    void accept(Obligation obligation, int placed, int pending);
  }

  /** Action on {@link Tracer#onBin}. */
  @FunctionalInterface
  public interface BinConsumer {
    void accept(int bin, int attempts, int count, boolean filled);
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onResolve(Obligation obligation, int placed, int pending) {}

    @Override
    public void onTree(Tree tree) {}

    @Override
    public void onInfeasible(@Nullable Obligation obligation) {}

    @Override
    public void onSample(int bin, @Nullable Tree tree, boolean accepted) {}

    @Override
    public void onBin(int bin, int attempts, int count, boolean filled) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onResolve(Obligation obligation, int placed, int pending) {
      tracer.onResolve(obligation, placed, pending);
    }

    @Override
    public void onTree(Tree tree) {
      tracer.onTree(tree);
    }

    @Override
    public void onInfeasible(@Nullable Obligation obligation) {
      tracer.onInfeasible(obligation);
    }

    @Override
    public void onSample(int bin, @Nullable Tree tree, boolean accepted) {
      tracer.onSample(bin, tree, accepted);
    }

    @Override
    public void onBin(int bin, int attempts, int count, boolean filled) {
      tracer.onBin(bin, attempts, count, filled);
    }
  }
}

// End Tracers.java
