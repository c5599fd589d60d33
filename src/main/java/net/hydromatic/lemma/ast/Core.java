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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.List;
import java.util.Objects;
import net.hydromatic.lemma.type.Dom;
import net.hydromatic.lemma.type.Modality;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Internal syntax: terms, eliminations and patterns.
 *
 * <p>Terms are normalized and use de Bruijn indices. This class functions as
 * a namespace, so that we can keep the class names short.
 */
public class Core {
  private Core() {}

  /** Returns the values of a list of arguments. */
  static <E extends AstNode> List<E> values(List<Arg<E>> args) {
    return Lists.transform(args, arg -> arg.value);
  }

  /** Base class for a term. */
  public abstract static class Term extends AstNode {
    Term(Op op) {
      super(op);
    }
  }

  /**
   * Variable, by de Bruijn index, applied to zero or more eliminations.
   *
   * <p>For example, "@0" is the most recently bound variable.
   */
  public static class Var extends Term {
    public final int index;
    public final List<Elim> elims;

    Var(int index, ImmutableList<Elim> elims) {
      super(Op.VAR);
      this.index = index;
      this.elims = requireNonNull(elims);
      checkArgument(index >= 0, "negative index %s", index);
    }

    /** Returns whether this variable has no eliminations. */
    public boolean isBare() {
      return elims.isEmpty();
    }

    @Override
    public int hashCode() {
      return Objects.hash(index, elims);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Var
              && index == ((Var) o).index
              && elims.equals(((Var) o).elims);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.app("@" + index, elims, left, right);
    }
  }

  /**
   * Constructor application.
   *
   * <p>For example, "suc @0" applies constructor "suc" to the variable "@0".
   */
  public static class Con extends Term {
    public final String name;
    public final List<Arg<Term>> args;

    Con(String name, ImmutableList<Arg<Term>> args) {
      super(Op.CON);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Con
              && name.equals(((Con) o).name)
              && args.equals(((Con) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.app(name, values(args), left, right);
    }
  }

  /** Application of a definition or a data type to eliminations. */
  public static class Def extends Term {
    public final String name;
    public final List<Elim> elims;

    Def(String name, ImmutableList<Elim> elims) {
      super(Op.DEF);
      this.name = requireNonNull(name);
      this.elims = requireNonNull(elims);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, elims);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Def
              && name.equals(((Def) o).name)
              && elims.equals(((Def) o).elims);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.app(name, elims, left, right);
    }
  }

  /** Literal. */
  @SuppressWarnings("rawtypes")
  public static class Lit extends Term {
    public final Comparable value;

    Lit(Comparable value) {
      super(Op.LIT);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Lit && value.equals(((Lit) o).value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(literal(value));
    }
  }

  /** Universe, such as "Set" or "Set1". */
  public static class Sort extends Term {
    public final int level;

    Sort(int level) {
      super(Op.SORT);
      this.level = level;
    }

    @Override
    public int hashCode() {
      return level;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Sort && level == ((Sort) o).level;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(level == 0 ? "Set" : "Set" + level);
    }
  }

  /** Lambda abstraction. The body refers to the bound variable as "@0". */
  public static class Lam extends Term {
    public final String name;
    public final Term body;

    Lam(String name, Term body) {
      super(Op.LAM);
      this.name = requireNonNull(name);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Lam
              && name.equals(((Lam) o).name)
              && body.equals(((Lam) o).body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("λ " + name + " → ").append(body, 0, 0);
    }
  }

  /**
   * Dependent function type.
   *
   * <p>For example, "(n : Nat) → Fin (suc @0)". The codomain refers to the
   * bound variable as "@0".
   */
  public static class Pi extends Term {
    public final Dom dom;
    public final Term codomain;

    Pi(Dom dom, Term codomain) {
      super(Op.PI);
      this.dom = requireNonNull(dom);
      this.codomain = requireNonNull(codomain);
    }

    @Override
    public int hashCode() {
      return Objects.hash(dom, codomain);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Pi
              && dom.equals(((Pi) o).dom)
              && codomain.equals(((Pi) o).codomain);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(dom.toString()).append(" → ").append(codomain, 0, 0);
    }
  }

  /**
   * Path type "PathP (λ name → line) lhs rhs".
   *
   * <p>A path is a function from the interval, so a path type behaves like a
   * function type that binds an interval variable.
   */
  public static class PathType extends Term {
    public final String name;
    public final Term line;
    public final Term lhs;
    public final Term rhs;

    PathType(String name, Term line, Term lhs, Term rhs) {
      super(Op.PATH_TYPE);
      this.name = requireNonNull(name);
      this.line = requireNonNull(line);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, line, lhs, rhs);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof PathType
              && name.equals(((PathType) o).name)
              && line.equals(((PathType) o).line)
              && lhs.equals(((PathType) o).lhs)
              && rhs.equals(((PathType) o).rhs);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.app("PathP",
          ImmutableList.of(new Lam(name, line), lhs, rhs), left, right);
    }
  }

  /** Base class for an elimination: application, projection or path
   * application. */
  public abstract static class Elim extends AstNode {
    Elim(Op op) {
      super(op);
    }
  }

  /** Application to an argument. */
  public static class Apply extends Elim {
    public final Arg<Term> arg;

    Apply(Arg<Term> arg) {
      super(Op.APPLY);
      this.arg = requireNonNull(arg);
    }

    @Override
    public int hashCode() {
      return arg.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Apply && arg.equals(((Apply) o).arg);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(arg.value, left, right);
    }
  }

  /** Projection of a record field. */
  public static class Proj extends Elim {
    public final String field;

    Proj(String field) {
      super(Op.PROJ);
      this.field = requireNonNull(field);
    }

    @Override
    public int hashCode() {
      return field.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Proj && field.equals(((Proj) o).field);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("." + field);
    }
  }

  /**
   * Application of a path to a point of the interval. {@code lhs} and
   * {@code rhs} are the end-points of the path.
   */
  public static class IApply extends Elim {
    public final Term lhs;
    public final Term rhs;
    public final Term point;

    IApply(Term lhs, Term rhs, Term point) {
      super(Op.I_APPLY);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
      this.point = requireNonNull(point);
    }

    @Override
    public int hashCode() {
      return Objects.hash(lhs, rhs, point);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IApply
              && lhs.equals(((IApply) o).lhs)
              && rhs.equals(((IApply) o).rhs)
              && point.equals(((IApply) o).point);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(point, left, right);
    }
  }

  /**
   * Argument: a value tagged with a modality and an optional display name.
   *
   * <p>Arguments of constructor applications, eliminations and patterns are
   * all wrapped this way.
   *
   * @param <E> Value type
   */
  public static final class Arg<E extends AstNode> {
    public final Modality modality;
    public final @Nullable String name;
    public final E value;

    Arg(Modality modality, @Nullable String name, E value) {
      this.modality = requireNonNull(modality);
      this.name = name;
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(modality, name, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Arg
              && modality.equals(((Arg<?>) o).modality)
              && Objects.equals(name, ((Arg<?>) o).name)
              && value.equals(((Arg<?>) o).value);
    }

    @Override
    public String toString() {
      return value.toString();
    }

    /** Returns an argument with the same modality and name and a new value. */
    public <F extends AstNode> Arg<F> withValue(F value) {
      //noinspection unchecked
      return value == (AstNode) this.value
          ? (Arg<F>) (Arg<?>) this
          : new Arg<>(modality, name, value);
    }

    /** Returns a copy of this argument with a given modality. */
    public Arg<E> withModality(Modality modality) {
      return modality.equals(this.modality)
          ? this
          : new Arg<>(modality, name, value);
    }

    /** Returns a copy of this argument without a display name. */
    public Arg<E> unnamed() {
      return name == null ? this : new Arg<>(modality, null, value);
    }
  }

  /** Pattern variable: a display name and a de Bruijn index into the
   * telescope of the clause. */
  public static final class PatVar {
    public final String name;
    public final int index;

    PatVar(String name, int index) {
      this.name = requireNonNull(name);
      this.index = index;
      checkArgument(index >= 0, "negative index %s", index);
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + index;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof PatVar
              && name.equals(((PatVar) o).name)
              && index == ((PatVar) o).index;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * Base class for a pattern.
   *
   * <p>For example, in the clause "proj .(suc n) (fzero n) = n", ".(suc n)"
   * is a {@link DotPat} and "fzero n" is a {@link ConPat} containing a
   * {@link VarPat}.
   */
  public abstract static class Pat extends AstNode {
    Pat(Op op) {
      super(op);
    }
  }

  /** Pattern that binds a variable. */
  public static class VarPat extends Pat {
    public final PatVar var;

    VarPat(PatVar var) {
      super(Op.VAR_PAT);
      this.var = requireNonNull(var);
    }

    @Override
    public int hashCode() {
      return var.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof VarPat && var.equals(((VarPat) o).var);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(var.name);
    }
  }

  /**
   * Dot pattern, ".t": a placeholder that carries a term whose value is
   * already determined. It matches anything and binds nothing.
   */
  public static class DotPat extends Pat {
    public final Term term;

    DotPat(Term term) {
      super(Op.DOT_PAT);
      this.term = requireNonNull(term);
    }

    @Override
    public int hashCode() {
      return term.hashCode() + 1;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof DotPat && term.equals(((DotPat) o).term);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(".").append(term, AstWriter.ARG, AstWriter.ARG);
    }
  }

  /**
   * Constructor pattern.
   *
   * <p>A lazy constructor pattern is one that is known to match, because it
   * was rebuilt from the term of a dot pattern.
   */
  public static class ConPat extends Pat {
    public final String name;
    public final boolean lazy;
    public final List<Arg<Pat>> args;

    ConPat(String name, boolean lazy, ImmutableList<Arg<Pat>> args) {
      super(Op.CON_PAT);
      this.name = requireNonNull(name);
      this.lazy = lazy;
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, lazy, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ConPat
              && name.equals(((ConPat) o).name)
              && lazy == ((ConPat) o).lazy
              && args.equals(((ConPat) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.app(name, values(args), left, right);
    }

    /** Creates a copy of this {@code ConPat} with given arguments,
     * or {@code this} if the arguments are the same. */
    public ConPat copy(List<Arg<Pat>> args) {
      return args.equals(this.args)
          ? this
          : new ConPat(name, lazy, ImmutableList.copyOf(args));
    }
  }

  /** Literal pattern. */
  @SuppressWarnings("rawtypes")
  public static class LitPat extends Pat {
    public final Comparable value;

    LitPat(Comparable value) {
      super(Op.LIT_PAT);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof LitPat && value.equals(((LitPat) o).value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(literal(value));
    }
  }

  /** Projection pattern, a copattern that selects a record field. */
  public static class ProjPat extends Pat {
    public final String field;

    ProjPat(String field) {
      super(Op.PROJ_PAT);
      this.field = requireNonNull(field);
    }

    @Override
    public int hashCode() {
      return field.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ProjPat && field.equals(((ProjPat) o).field);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("." + field);
    }
  }

  /** Pattern that applies a pattern-matching definition to sub-patterns. */
  public static class DefPat extends Pat {
    public final String name;
    public final List<Arg<Pat>> args;

    DefPat(String name, ImmutableList<Arg<Pat>> args) {
      super(Op.DEF_PAT);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof DefPat
              && name.equals(((DefPat) o).name)
              && args.equals(((DefPat) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.app(name, values(args), left, right);
    }

    /** Creates a copy of this {@code DefPat} with given arguments,
     * or {@code this} if the arguments are the same. */
    public DefPat copy(List<Arg<Pat>> args) {
      return args.equals(this.args)
          ? this
          : new DefPat(name, ImmutableList.copyOf(args));
    }
  }

  /**
   * Path application pattern. Binds an interval variable; {@code lhs} and
   * {@code rhs} are the end-points of the path.
   */
  public static class IApplyPat extends Pat {
    public final Term lhs;
    public final Term rhs;
    public final PatVar var;

    IApplyPat(Term lhs, Term rhs, PatVar var) {
      super(Op.I_APPLY_PAT);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
      this.var = requireNonNull(var);
    }

    @Override
    public int hashCode() {
      return Objects.hash(lhs, rhs, var);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IApplyPat
              && lhs.equals(((IApplyPat) o).lhs)
              && rhs.equals(((IApplyPat) o).rhs)
              && var.equals(((IApplyPat) o).var);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(var.name);
    }
  }

  @SuppressWarnings("rawtypes")
  private static String literal(Comparable value) {
    return value instanceof String ? "\"" + value + "\"" : value.toString();
  }
}

// End Core.java
