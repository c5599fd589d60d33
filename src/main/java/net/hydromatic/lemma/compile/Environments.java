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
package net.hydromatic.lemma.compile;

import static java.util.Objects.requireNonNull;

import java.util.function.Consumer;
import net.hydromatic.lemma.type.Definition;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  /** Creates an empty environment. */
  public static Environment empty() {
    return EmptyEnvironment.INSTANCE;
  }

  /**
   * Environment that inherits from a parent environment and adds one
   * definition.
   */
  static class SubEnvironment extends Environment {
    private final Environment parent;
    private final Definition definition;

    SubEnvironment(Environment parent, Definition definition) {
      this.parent = requireNonNull(parent);
      this.definition = requireNonNull(definition);
    }

    @Override
    public String toString() {
      return definition.name + ", ...";
    }

    @Override
    public @Nullable Definition getOpt(String name) {
      if (name.equals(definition.name)) {
        return definition;
      }
      return parent.getOpt(name);
    }

    @Override
    public Environment bind(Definition definition) {
      Environment env;
      if (this.definition.name.equals(definition.name)) {
        // The new definition will obscure the current environment's
        // definition. Bind the parent environment instead. This tends to
        // prevent long chains from forming, and allows obscured definitions
        // to be garbage-collected.
        env = parent;
        while (env instanceof SubEnvironment
            && ((SubEnvironment) env).definition.name.equals(definition.name)) {
          env = ((SubEnvironment) env).parent;
        }
      } else {
        env = this;
      }
      return new SubEnvironment(env, definition);
    }

    @Override
    void visit(Consumer<Definition> consumer) {
      consumer.accept(definition);
      parent.visit(consumer);
    }
  }

  /** Empty environment. */
  private static class EmptyEnvironment extends Environment {
    static final EmptyEnvironment INSTANCE = new EmptyEnvironment();

    @Override
    void visit(Consumer<Definition> consumer) {}

    @Override
    public @Nullable Definition getOpt(String name) {
      return null;
    }
  }
}

// End Environments.java
