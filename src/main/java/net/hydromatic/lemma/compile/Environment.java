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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.lemma.type.Definition;
import net.hydromatic.lemma.type.IsForced;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Environment of definitions that the forcing pass consults: constructors,
 * with their forcing annotations, and pattern-matching functions.
 *
 * <p>Every environment is immutable; when you call {@link #bind}, a new
 * environment is created that inherits from the previous environment. The new
 * environment may obscure definitions in the old environment, but neither the
 * new nor the old will ever change.
 *
 * <p>A data type's constructors must be bound before any clause that matches
 * on them is translated.
 *
 * <p>To create an empty environment, call {@link Environments#empty()}.
 */
public abstract class Environment {
  /**
   * Visits every definition in this environment.
   *
   * <p>Definitions that are obscured by more recent definitions of the same
   * name are visited, but after the more obscuring definitions.
   */
  abstract void visit(Consumer<Definition> consumer);

  /** Returns the definition of {@code name} if bound, null if not. */
  public abstract @Nullable Definition getOpt(String name);

  /**
   * Returns the definition of {@code name}.
   *
   * <p>Every name in a pattern or a term has been resolved before the
   * forcing pass sees it, so a missing name is an internal error.
   */
  public Definition get(String name) {
    final Definition definition = getOpt(name);
    if (definition == null) {
      throw new AssertionError("definition not found: " + name);
    }
    return definition;
  }

  /** Returns the forcing annotations of a constructor or function. */
  public List<IsForced> forcedArgs(String name) {
    return get(name).forced;
  }

  /**
   * Creates an environment that is the same as this environment, plus one
   * more definition.
   */
  public Environment bind(Definition definition) {
    return new Environments.SubEnvironment(this, definition);
  }

  /** Returns a map of the definitions, keyed by name, most recent first. */
  public final Map<String, Definition> getDefinitionMap() {
    final Map<String, Definition> map = new LinkedHashMap<>();
    visit(definition -> map.putIfAbsent(definition.name, definition));
    return map;
  }
}

// End Environment.java
