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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.lemma.type.Dom;
import net.hydromatic.lemma.type.Modality;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds terms, eliminations and patterns. */
public enum CoreBuilder {
  /**
   * The singleton instance of the CORE builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  core;

  // arguments

  /** Creates an argument with the default modality and no name. */
  public <E extends AstNode> Core.Arg<E> arg(E value) {
    return new Core.Arg<>(Modality.DEFAULT, null, value);
  }

  /** Creates an argument with a given modality and no name. */
  public <E extends AstNode> Core.Arg<E> arg(Modality modality, E value) {
    return new Core.Arg<>(modality, null, value);
  }

  /** Creates an argument with a given modality and display name. */
  public <E extends AstNode> Core.Arg<E> namedArg(Modality modality,
      @Nullable String name, E value) {
    return new Core.Arg<>(modality, name, value);
  }

  /** Wraps each value in an argument with the default modality. */
  @SafeVarargs
  public final <E extends AstNode> ImmutableList<Core.Arg<E>> args(
      E... values) {
    final ImmutableList.Builder<Core.Arg<E>> b = ImmutableList.builder();
    for (E value : values) {
      b.add(arg(value));
    }
    return b.build();
  }

  // terms

  /** Creates a bare variable. */
  public Core.Var var(int index) {
    return new Core.Var(index, ImmutableList.of());
  }

  /** Creates a variable applied to eliminations. */
  public Core.Var var(int index, List<Core.Elim> elims) {
    return new Core.Var(index, ImmutableList.copyOf(elims));
  }

  /** Creates a constructor application whose arguments have the default
   * modality. */
  public Core.Con con(String name, Core.Term... args) {
    return new Core.Con(name, args(args));
  }

  /** Creates a constructor application. */
  public Core.Con con(String name, List<Core.Arg<Core.Term>> args) {
    return new Core.Con(name, ImmutableList.copyOf(args));
  }

  /** Creates an application of a definition (or data type) to arguments
   * with the default modality. */
  public Core.Def def(String name, Core.Term... args) {
    final ImmutableList.Builder<Core.Elim> b = ImmutableList.builder();
    for (Core.Term arg : args) {
      b.add(apply(arg));
    }
    return new Core.Def(name, b.build());
  }

  /** Creates an application of a definition (or data type) to
   * eliminations. */
  public Core.Def def(String name, List<Core.Elim> elims) {
    return new Core.Def(name, ImmutableList.copyOf(elims));
  }

  /** Creates a literal. */
  @SuppressWarnings("rawtypes")
  public Core.Lit lit(Comparable value) {
    return new Core.Lit(value);
  }

  /** Creates a universe. */
  public Core.Sort sort(int level) {
    return new Core.Sort(level);
  }

  /** Creates a lambda. */
  public Core.Lam lam(String name, Core.Term body) {
    return new Core.Lam(name, body);
  }

  /** Creates a function type whose parameter has the default modality. */
  public Core.Pi pi(String name, Core.Term type, Core.Term codomain) {
    return new Core.Pi(Dom.of(name, type), codomain);
  }

  /** Creates a function type. */
  public Core.Pi pi(Dom dom, Core.Term codomain) {
    return new Core.Pi(dom, codomain);
  }

  /** Creates a path type. */
  public Core.PathType pathType(String name, Core.Term line, Core.Term lhs,
      Core.Term rhs) {
    return new Core.PathType(name, line, lhs, rhs);
  }

  // eliminations

  /** Creates an application to an argument with the default modality. */
  public Core.Apply apply(Core.Term term) {
    return new Core.Apply(arg(term));
  }

  /** Creates an application to an argument. */
  public Core.Apply apply(Core.Arg<Core.Term> arg) {
    return new Core.Apply(arg);
  }

  /** Creates a projection. */
  public Core.Proj proj(String field) {
    return new Core.Proj(field);
  }

  /** Creates a path application. */
  public Core.IApply iApply(Core.Term lhs, Core.Term rhs, Core.Term point) {
    return new Core.IApply(lhs, rhs, point);
  }

  // patterns

  /** Creates a pattern variable. */
  public Core.PatVar patVar(String name, int index) {
    return new Core.PatVar(name, index);
  }

  /** Creates a pattern that binds a variable. */
  public Core.VarPat varPat(String name, int index) {
    return new Core.VarPat(patVar(name, index));
  }

  /** Creates a pattern that binds a variable. */
  public Core.VarPat varPat(Core.PatVar var) {
    return new Core.VarPat(var);
  }

  /** Creates a dot pattern. */
  public Core.DotPat dotPat(Core.Term term) {
    return new Core.DotPat(term);
  }

  /** Creates a constructor pattern whose sub-patterns have the default
   * modality. */
  public Core.ConPat conPat(String name, Core.Pat... args) {
    return new Core.ConPat(name, false, args(args));
  }

  /** Creates a constructor pattern. */
  public Core.ConPat conPat(String name, boolean lazy,
      List<Core.Arg<Core.Pat>> args) {
    return new Core.ConPat(name, lazy, ImmutableList.copyOf(args));
  }

  /** Creates a literal pattern. */
  @SuppressWarnings("rawtypes")
  public Core.LitPat litPat(Comparable value) {
    return new Core.LitPat(value);
  }

  /** Creates a projection pattern. */
  public Core.ProjPat projPat(String field) {
    return new Core.ProjPat(field);
  }

  /** Creates a definition pattern whose sub-patterns have the default
   * modality. */
  public Core.DefPat defPat(String name, Core.Pat... args) {
    return new Core.DefPat(name, args(args));
  }

  /** Creates a definition pattern. */
  public Core.DefPat defPat(String name, List<Core.Arg<Core.Pat>> args) {
    return new Core.DefPat(name, ImmutableList.copyOf(args));
  }

  /** Creates a path application pattern. */
  public Core.IApplyPat iApplyPat(Core.Term lhs, Core.Term rhs,
      Core.PatVar var) {
    return new Core.IApplyPat(lhs, rhs, var);
  }
}

// End CoreBuilder.java
