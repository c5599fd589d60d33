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

import java.util.List;

/** Context for writing an AST out as a string. */
public class AstWriter {
  /** Binding strength of an argument in an application. */
  static final int ARG = 1;

  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /**
   * Appends a head applied to arguments, for example "suc n". Wraps the
   * application in parentheses if it is itself in argument position.
   */
  public AstWriter app(String head, List<? extends AstNode> args, int left,
      int right) {
    if (args.isEmpty()) {
      return append(head);
    }
    if (left > 0 || right > 0) {
      return append("(").app(head, args, 0, 0).append(")");
    }
    append(head);
    for (AstNode arg : args) {
      append(" ").append(arg, ARG, ARG);
    }
    return this;
  }

  /**
   * Appends a list of nodes separated by spaces, each in argument position;
   * for example, the patterns of a clause.
   */
  public AstWriter spaced(List<? extends AstNode> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(" ");
      }
      append(nodes.get(i), ARG, ARG);
    }
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
