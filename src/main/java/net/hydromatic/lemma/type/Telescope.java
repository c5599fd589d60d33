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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.lemma.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.IntFunction;
import net.hydromatic.lemma.ast.Core;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Ordered sequence of typed bindings, each of which may refer to the
 * bindings before it.
 *
 * <p>In a telescope of size <i>n</i>, the binding at position <i>j</i>
 * (counting from 0 at the left) is the variable with de Bruijn index
 * <i>n</i> - 1 - <i>j</i>.
 */
public final class Telescope {
  public static final Telescope EMPTY = new Telescope(ImmutableList.of());

  /** Type of interval variables bound by path types. */
  public static final Core.Term INTERVAL = core.def("I");

  public final List<Dom> doms;

  private Telescope(ImmutableList<Dom> doms) {
    this.doms = requireNonNull(doms);
  }

  /** Creates a telescope. */
  public static Telescope of(List<Dom> doms) {
    return doms.isEmpty() ? EMPTY : new Telescope(ImmutableList.copyOf(doms));
  }

  /** Creates a telescope. */
  public static Telescope of(Dom... doms) {
    return of(ImmutableList.copyOf(doms));
  }

  /**
   * Returns the telescope of a type, and its codomain.
   *
   * <p>Peels function types, and also path types, each of which binds a
   * variable of the interval with the default modality.
   * Does not reduce the type; the caller must supply it normalized.
   */
  public static View view(Core.Term type) {
    final ImmutableList.Builder<Dom> doms = ImmutableList.builder();
    Core.Term t = type;
    for (;;) {
      switch (t.op) {
      case PI:
        final Core.Pi pi = (Core.Pi) t;
        doms.add(pi.dom);
        t = pi.codomain;
        break;

      case PATH_TYPE:
        final Core.PathType pathType = (Core.PathType) t;
        doms.add(Dom.of(pathType.name, INTERVAL));
        t = pathType.line;
        break;

      default:
        return new View(of(doms.build()), t);
      }
    }
  }

  @Override
  public int hashCode() {
    return doms.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Telescope && doms.equals(((Telescope) o).doms);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    doms.forEach(dom -> b.append(b.length() == 0 ? "" : " ").append(dom));
    return b.toString();
  }

  public int size() {
    return doms.size();
  }

  /** Returns the binding of the variable with a given de Bruijn index. */
  public Dom lookup(int index) {
    return doms.get(doms.size() - 1 - index);
  }

  /**
   * Returns a telescope whose modalities are changed. The function is called
   * with the de Bruijn index of each binding; if it returns null, the binding
   * is unchanged.
   */
  public Telescope withModalities(IntFunction<@Nullable Modality> f) {
    final ImmutableList.Builder<Dom> b = ImmutableList.builder();
    for (int j = 0; j < doms.size(); j++) {
      final Dom dom = doms.get(j);
      final Modality modality = f.apply(doms.size() - 1 - j);
      b.add(modality == null ? dom : dom.withModality(modality));
    }
    final ImmutableList<Dom> newDoms = b.build();
    return newDoms.equals(doms) ? this : new Telescope(newDoms);
  }

  /** Telescope of a type, and the type's codomain. */
  public static final class View {
    public final Telescope telescope;
    public final Core.Term target;

    View(Telescope telescope, Core.Term target) {
      this.telescope = requireNonNull(telescope);
      this.target = requireNonNull(target);
    }

    @Override
    public String toString() {
      return telescope + " → " + target;
    }
  }
}

// End Telescope.java
