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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Pending node in a tree under construction.
 *
 * <p>{@link #size} is the size of the tree so far, counting every node that
 * has been placed or is pending, including this one.
 */
public class Obligation {
  public final int depth;
  public final int size;

  public Obligation(int depth, int size) {
    checkArgument(depth >= 0, "negative depth");
    checkArgument(size >= 1, "size must be positive");
    this.depth = depth;
    this.size = size;
  }

  /** Returns a copy of this obligation with a different size. */
  public Obligation withSize(int size) {
    return size == this.size ? this : new Obligation(depth, size);
  }

  @Override
  public String toString() {
    return "(" + depth + ", " + size + ")";
  }
}

// End Obligation.java
