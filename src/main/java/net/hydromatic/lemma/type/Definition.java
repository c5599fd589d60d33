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
package net.hydromatic.lemma.type;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * What the forcing pass knows about a named constant: its kind, its forcing
 * annotations, and, for a constructor, whether it is an eta constructor.
 *
 * <p>Used in {@link net.hydromatic.lemma.compile.Environment}.
 */
public class Definition {
  public final String name;
  public final Kind kind;
  /** One annotation per argument, in argument order. May be shorter than the
   * argument list; missing annotations are {@link IsForced#NOT_FORCED}. */
  public final List<IsForced> forced;
  /** Whether this is the only constructor of a record type with eta. */
  public final boolean eta;

  private Definition(String name, Kind kind, ImmutableList<IsForced> forced,
      boolean eta) {
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    this.forced = requireNonNull(forced);
    this.eta = eta;
    checkArgument(!eta || kind == Kind.CONSTRUCTOR,
        "only a constructor can be an eta constructor: %s", name);
  }

  /** Creates the definition of a constructor. */
  public static Definition constructor(String name, List<IsForced> forced,
      boolean eta) {
    return new Definition(name, Kind.CONSTRUCTOR, ImmutableList.copyOf(forced),
        eta);
  }

  /** Creates the definition of a pattern-matching function. */
  public static Definition function(String name, List<IsForced> forced) {
    return new Definition(name, Kind.FUNCTION, ImmutableList.copyOf(forced),
        false);
  }

  /** Creates the definition of a data type. */
  public static Definition dataType(String name) {
    return new Definition(name, Kind.DATA_TYPE, ImmutableList.of(), false);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind, forced, eta);
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || o instanceof Definition
            && name.equals(((Definition) o).name)
            && kind == ((Definition) o).kind
            && forced.equals(((Definition) o).forced)
            && eta == ((Definition) o).eta;
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase(Locale.ROOT) + " " + name
        + (forced.isEmpty() ? "" : " " + forced)
        + (eta ? " (eta)" : "");
  }

  /** Kind of definition. */
  public enum Kind {
    CONSTRUCTOR,
    FUNCTION,
    DATA_TYPE
  }
}

// End Definition.java
