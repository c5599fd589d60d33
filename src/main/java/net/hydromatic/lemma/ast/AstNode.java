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
package net.hydromatic.lemma.ast;

import static java.util.Objects.requireNonNull;

/** Node of the internal syntax: a term, an elimination or a pattern. */
public abstract class AstNode {
  public final Op op;

  protected AstNode(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a string.
   *
   * <p>The purpose of this string is debugging and error messages. Variables
   * in terms are printed by de Bruijn index, for example "@0".
   */
  @Override
  public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new AstWriter());
  }

  /** Converts this node into a string, with a given writer. */
  public final String unparse(AstWriter w) {
    return unparse(w, 0, 0).toString();
  }

  /**
   * Writes this node. If {@code left} or {@code right} is positive, the node
   * is in argument position and an application must be parenthesized.
   */
  abstract AstWriter unparse(AstWriter w, int left, int right);
}

// End AstNode.java
