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

/**
 * Thrown when a tree that the builder considers complete violates the bounds
 * it was given, or when the builder's running size disagrees with the tree.
 *
 * <p>Either means that the size arithmetic is unsound. It is not an expected
 * outcome, and callers should not catch it; compare {@link TreeBuilder#build},
 * which returns null when no tree can be built.
 */
public class TreeInvariantException extends RuntimeException {
  public TreeInvariantException(String message) {
    super(message);
  }
}

// End TreeInvariantException.java
