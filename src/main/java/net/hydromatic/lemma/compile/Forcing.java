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
import static net.hydromatic.lemma.ast.CoreBuilder.core;
import static net.hydromatic.lemma.compile.Patterns.bindsVariables;
import static net.hydromatic.lemma.compile.Patterns.patternToTerm;
import static net.hydromatic.lemma.compile.Patterns.patternVarModalities;
import static net.hydromatic.lemma.compile.Tracers.clause;
import static net.hydromatic.lemma.util.Static.anyMatch;
import static net.hydromatic.lemma.util.Static.forEachIndexed;
import static net.hydromatic.lemma.util.Static.minusAll;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.lemma.ast.Core;
import net.hydromatic.lemma.ast.Op;
import net.hydromatic.lemma.type.Definition;
import net.hydromatic.lemma.type.IsForced;
import net.hydromatic.lemma.type.Modality;
import net.hydromatic.lemma.type.Relevance;
import net.hydromatic.lemma.type.Telescope;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Forcing analysis and forcing translation.
 *
 * <p>A constructor argument is <em>forced</em> if its value is determined by
 * the indices of the constructor's result type. For example, in
 *
 * <blockquote><pre>
 *   data Fin : Nat → Set where
 *     fzero : (n : Nat) → Fin (suc n)
 *     fsuc  : (n : Nat) (i : Fin n) → Fin (suc n)</pre></blockquote>
 *
 * <p>the argument {@code n} of both constructors is forced. When a
 * constructor is registered, {@link #computeForcingAnnotations} decides which
 * of its arguments are forced.
 *
 * <p>A clause must not bind a variable, or perform a match, inside a forced
 * position: the value is not stored at run time. Before the right-hand side of
 * a clause is checked, {@link #forcingTranslation} replaces patterns in forced
 * positions with dot patterns, and moves each binding or match that was lost
 * into a dot pattern in an unforced position. For example,
 *
 * <blockquote><pre>
 *   f : (n : Nat) → Fin n → Nat
 *   f .(suc n) (fzero n) = n</pre></blockquote>
 *
 * <p>becomes "f (suc n) (fzero .n) = n".
 *
 * <p>A {@code Forcing} is immutable. Registering a definition returns a new
 * {@code Forcing} whose {@link Environment} contains it.
 */
public class Forcing {
  private final ImmutableMap<Prop, Object> propMap;
  public final Environment env;
  private final Tracer tracer;
  private final int maxPatternDepth;

  private Forcing(ImmutableMap<Prop, Object> propMap, Environment env,
      Tracer tracer) {
    this.propMap = requireNonNull(propMap);
    this.env = requireNonNull(env);
    this.tracer = requireNonNull(tracer);
    this.maxPatternDepth = Prop.MAX_PATTERN_DEPTH.intValue(propMap);
  }

  /** Creates a {@code Forcing}. */
  public static Forcing create(Map<Prop, Object> propMap, Environment env,
      Tracer tracer) {
    return new Forcing(ImmutableMap.copyOf(propMap), env, tracer);
  }

  /** Returns a copy of this {@code Forcing} with a given environment. */
  public Forcing withEnvironment(Environment env) {
    return env == this.env ? this : new Forcing(propMap, env, tracer);
  }

  //~ Forcing analysis -------------------------------------------------------

  /**
   * Decides which arguments of a constructor are forced.
   *
   * <p>The type is the type of the constructor, excluding parameters. It must
   * be of the form "Γ → D vs", where the {@code vs} are in normal form.
   * Returns one annotation per binder of Γ, in order; if forcing is
   * disabled, returns an empty list without looking at the type.
   *
   * <p>An argument is forced if its quantity was not written by the user,
   * it is not irrelevant, and its variable occurs in {@code vs} in a position
   * that is at least as usable as the argument.
   */
  public List<IsForced> computeForcingAnnotations(String ctorName,
      Core.Term type) {
    if (!Prop.FORCING.booleanValue(propMap)) {
      // Positions past the end of the list are not forced
      return ImmutableList.of();
    }
    final Telescope.View view = Telescope.view(type);
    final int n = view.telescope.size();
    if (view.target.op != Op.DEF) {
      throw new AssertionError("result type of constructor " + ctorName
          + " is not a data type: " + view.target);
    }
    final List<ForcedVariables.Occurrence> xs =
        ForcedVariables.ofElims(((Core.Def) view.target).elims);
    final ImmutableList.Builder<IsForced> b = ImmutableList.builder();
    forEachIndexed(view.telescope.doms, (dom, j) ->
        b.add(isForced(xs, dom.modality, n - 1 - j)
            ? IsForced.FORCED
            : IsForced.NOT_FORCED));
    final ImmutableList<IsForced> forcedArgs = b.build();
    tracer.onForcingAnnotations(ctorName, xs, forcedArgs);
    return forcedArgs;
  }

  private static boolean isForced(List<ForcedVariables.Occurrence> xs,
      Modality modality, int index) {
    return modality.noUserQuantity()
        && modality.relevance != Relevance.IRRELEVANT
        && anyMatch(xs, occurrence ->
            occurrence.index == index
                && occurrence.modality.moreUsable(modality));
  }

  /** Computes the forcing annotations of a constructor and returns a
   * {@code Forcing} whose environment contains the constructor. */
  public Forcing registerConstructor(String ctorName, Core.Term type,
      boolean eta) {
    final List<IsForced> forced = computeForcingAnnotations(ctorName, type);
    return withEnvironment(
        env.bind(Definition.constructor(ctorName, forced, eta)));
  }

  /** Returns a {@code Forcing} whose environment contains a pattern-matching
   * definition with the given forcing annotations. */
  public Forcing registerFunction(String name, List<IsForced> forced) {
    return withEnvironment(env.bind(Definition.function(name, forced)));
  }

  /** Returns a {@code Forcing} whose environment contains a data type. */
  public Forcing registerDataType(String name) {
    return withEnvironment(env.bind(Definition.dataType(name)));
  }

  //~ Forcing translation ----------------------------------------------------

  /**
   * Moves bindings of forced variables to unforced positions.
   *
   * <p>Alternates between {@link #dotForcedPatterns} and
   * {@link #rebindForcedPattern} until there is nothing left to move.
   * The result has the same length as {@code patterns}, and every
   * sub-pattern list keeps its length.
   *
   * @throws CompileException if a forced pattern could be moved to more than
   * one place
   */
  public List<Core.Arg<Core.Pat>> forcingTranslation(
      List<Core.Arg<Core.Pat>> patterns) {
    // A pattern rebound in one round sits in an unforced position, so only
    // its proper sub-patterns can be rebound in the next round; the bound
    // is never reached.
    final int limit = Patterns.size(patterns);
    List<Core.Arg<Core.Pat>> ps = patterns;
    for (int round = 0;; round++) {
      final DotResult dotResult = dotForcedPatterns(ps);
      if (!dotResult.patterns.equals(ps)) {
        tracer.onDotted(ps, dotResult.patterns, dotResult.rebind);
      }
      if (dotResult.rebind.isEmpty()) {
        // Nothing to move, but dots may have changed, so return the dotted
        // patterns, not the originals.
        return dotResult.patterns;
      }
      if (round > limit) {
        throw new AssertionError("forcing translation of " + clause(patterns)
            + " did not converge");
      }
      List<Core.Arg<Core.Pat>> qs = dotResult.patterns;
      for (Core.Pat toRebind : dotResult.rebind) {
        qs = rebindForcedPattern(qs, toRebind);
      }
      ps = qs;
    }
  }

  /**
   * Applies the forcing translation to patterns in order to update the
   * modalities of forced arguments in their telescope.
   *
   * <p>Used before checking a right-hand side, so that every use of a forced
   * variable agrees with the modality of the position where the variable is
   * finally bound. The telescope must type the variables bound by the
   * patterns.
   */
  public Telescope forceTranslateTelescope(Telescope delta,
      List<Core.Arg<Core.Pat>> patterns) {
    final List<Core.Arg<Core.Pat>> patterns2 = forcingTranslation(patterns);
    final List<Map.Entry<Core.PatVar, Modality>> xms =
        patternVarModalities(patterns);
    final List<Map.Entry<Core.PatVar, Modality>> xms2 =
        patternVarModalities(patterns2);
    final List<Map.Entry<Core.PatVar, Modality>> oldModalities =
        minusAll(xms, xms2);
    final List<Map.Entry<Core.PatVar, Modality>> newModalities =
        minusAll(xms2, xms);
    if (newModalities.isEmpty()) {
      return delta;
    }
    final Telescope delta2 =
        delta.withModalities(index -> {
          for (Map.Entry<Core.PatVar, Modality> e : newModalities) {
            if (e.getKey().index == index) {
              return e.getValue();
            }
          }
          return null;
        });
    tracer.onTelescope(oldModalities, newModalities, delta2);
    return delta2;
  }

  /**
   * Replaces each pattern in a forced position with a dot pattern.
   *
   * <p>Returns the new patterns, and the replaced patterns that bind
   * variables or perform a real match, and therefore must be bound somewhere
   * else. A pattern in a forced position that is already a dot or projection
   * pattern is left alone.
   */
  public DotResult dotForcedPatterns(List<Core.Arg<Core.Pat>> patterns) {
    final ImmutableList.Builder<Core.Pat> rebind = ImmutableList.builder();
    final List<Core.Arg<Core.Pat>> dotted =
        dotArgs(ImmutableList.of(), patterns, rebind, 0);
    return new DotResult(dotted, rebind.build());
  }

  private ImmutableList<Core.Arg<Core.Pat>> dotArgs(List<IsForced> forced,
      List<Core.Arg<Core.Pat>> args, ImmutableList.Builder<Core.Pat> rebind,
      int depth) {
    final ImmutableList.Builder<Core.Arg<Core.Pat>> b =
        ImmutableList.builder();
    forEachIndexed(args, (arg, i) ->
        b.add(
            arg.withValue(
                dot(IsForced.at(forced, i), arg.value, rebind, depth))));
    return b.build();
  }

  private Core.Pat dot(IsForced forced, Core.Pat pat,
      ImmutableList.Builder<Core.Pat> rebind, int depth) {
    checkDepth(depth);
    switch (pat.op) {
    case DOT_PAT:
    case PROJ_PAT:
      return pat;
    default:
      break;
    }
    if (forced.isForced()) {
      if (isProperMatch(pat) || bindsVariables(pat)) {
        rebind.add(pat);
      }
      return core.dotPat(patternToTerm(pat));
    }
    switch (pat.op) {
    case CON_PAT:
      final Core.ConPat conPat = (Core.ConPat) pat;
      return conPat.copy(
          dotArgs(env.forcedArgs(conPat.name), conPat.args, rebind,
              depth + 1));

    case DEF_PAT:
      final Core.DefPat defPat = (Core.DefPat) pat;
      return defPat.copy(
          dotArgs(env.forcedArgs(defPat.name), defPat.args, rebind,
              depth + 1));

    default:
      return pat;
    }
  }

  /**
   * Returns whether a pattern performs a real match.
   *
   * <p>A match on an eta constructor always succeeds, so it is a real match
   * only if one of its sub-patterns is.
   */
  public boolean isProperMatch(Core.Pat pat) {
    switch (pat.op) {
    case LIT_PAT:
    case DEF_PAT:
      return true;

    case CON_PAT:
      final Core.ConPat conPat = (Core.ConPat) pat;
      return !env.get(conPat.name).eta
          || anyMatch(conPat.args, arg -> isProperMatch(arg.value));

    default:
      // Variable, dot, projection and path application patterns
      return false;
    }
  }

  /**
   * Binds a forced pattern in an unforced position.
   *
   * <p>The forced pattern has already been dotted by
   * {@link #dotForcedPatterns}. This method finds a dot pattern in an
   * unforced position whose term is the term of the forced pattern, or a
   * constructor application that contains it, and turns it into a match.
   * For example, rebinding "suc n" in
   *
   * <blockquote><pre>.(suc n) (fzero .n)</pre></blockquote>
   *
   * <p>yields "(suc n) (fzero .n)".
   *
   * <p>If a pattern in an unforced position already binds a variable, the
   * patterns are returned unchanged. For any other pattern, finding no place
   * is an internal error.
   *
   * @throws CompileException if there is more than one place to bind a
   * pattern that is not a variable
   */
  public List<Core.Arg<Core.Pat>> rebindForcedPattern(
      List<Core.Arg<Core.Pat>> patterns, Core.Pat toRebind) {
    tracer.onRebind(toRebind, patterns);
    final Rebinder rebinder = new Rebinder(toRebind);
    final List<Core.Arg<Core.Pat>> result =
        rebinder.rebindArgs(ImmutableList.of(), patterns, 0);
    switch (rebinder.count) {
    case 0:
      if (rebinder.alreadyBound && rebinder.rebindingVar) {
        // An earlier rebinding has bound this variable
        return patterns;
      }
      throw new AssertionError("no place to bind forced pattern " + toRebind
          + " in " + clause(patterns));

    case 1:
      tracer.onRebindResult(result);
      return result;

    default:
      throw new CompileException("I can't figure out where to move the forced "
          + "pattern " + toRebind + " in clause " + clause(patterns));
    }
  }

  private void checkDepth(int depth) {
    if (depth > maxPatternDepth) {
      throw new CompileException("patterns are nested more than "
          + maxPatternDepth + " deep");
    }
  }

  /** Searches a list of patterns, depth-first, for places to bind one
   * forced pattern. */
  private class Rebinder {
    final Core.Pat toRebind;
    final Core.Term target;
    final boolean rebindingVar;
    /** Number of places found. */
    int count;
    /** Whether the search has finished. */
    boolean done;
    /** Whether the pattern was already bound. */
    boolean alreadyBound;

    Rebinder(Core.Pat toRebind) {
      this.toRebind = requireNonNull(toRebind);
      this.target = patternToTerm(toRebind);
      this.rebindingVar = toRebind.op == Op.VAR_PAT;
    }

    ImmutableList<Core.Arg<Core.Pat>> rebindArgs(List<IsForced> forced,
        List<Core.Arg<Core.Pat>> args, int depth) {
      final ImmutableList.Builder<Core.Arg<Core.Pat>> b =
          ImmutableList.builder();
      forEachIndexed(args, (arg, i) ->
          b.add(done
              ? arg
              : arg.withValue(
                  rebind(IsForced.at(forced, i), arg.value, depth))));
      return b.build();
    }

    Core.Pat rebind(IsForced forced, Core.Pat pat, int depth) {
      checkDepth(depth);
      if (forced.isForced()) {
        return pat;
      }
      if (Patterns.rebinds(pat, toRebind)) {
        done = true;
        alreadyBound = true;
        return pat;
      }
      switch (pat.op) {
      case DOT_PAT:
        final Core.Pat placement =
            placement(IsForced.NOT_FORCED, ((Core.DotPat) pat).term, depth);
        if (placement == null) {
          return pat;
        }
        ++count;
        if (rebindingVar) {
          // Several places for a variable are fine; take the first.
          done = true;
        }
        return placement;

      case CON_PAT:
        final Core.ConPat conPat = (Core.ConPat) pat;
        return conPat.copy(
            rebindArgs(env.forcedArgs(conPat.name), conPat.args, depth + 1));

      case DEF_PAT:
        final Core.DefPat defPat = (Core.DefPat) pat;
        return defPat.copy(
            rebindArgs(env.forcedArgs(defPat.name), defPat.args, depth + 1));

      default:
        return pat;
      }
    }

    /**
     * Returns a pattern that could replace a dot pattern with a given term
     * and bind the forced pattern, or null.
     *
     * <p>If the term is the forced pattern's term, that is the forced
     * pattern itself. If the term is a constructor application, the first
     * unforced argument that contains the forced pattern's term yields a
     * lazy constructor pattern that binds it in that argument, with the
     * other arguments dotted.
     */
    Core.@Nullable Pat placement(IsForced forced, Core.Term term, int depth) {
      checkDepth(depth);
      if (forced.isForced()) {
        return null;
      }
      if (term.equals(target)) {
        return toRebind;
      }
      if (term.op != Op.CON) {
        return null;
      }
      final Core.Con con = (Core.Con) term;
      final List<IsForced> forcedArgs = env.forcedArgs(con.name);
      for (int i = 0; i < con.args.size(); i++) {
        final Core.Pat pat =
            placement(IsForced.at(forcedArgs, i), con.args.get(i).value,
                depth + 1);
        if (pat != null) {
          return core.conPat(con.name, true, place(con.args, i, pat));
        }
      }
      return null;
    }

    /** Converts the arguments of a constructor application to patterns:
     * argument {@code i} becomes {@code pat}, the others become dot
     * patterns. */
    private List<Core.Arg<Core.Pat>> place(List<Core.Arg<Core.Term>> args,
        int i, Core.Pat pat) {
      final ImmutableList.Builder<Core.Arg<Core.Pat>> b =
          ImmutableList.builder();
      forEachIndexed(args, (arg, k) ->
          b.add(
              arg.<Core.Pat>withValue(k == i ? pat : core.dotPat(arg.value))
                  .unnamed()));
      return b.build();
    }
  }

  /** Result of {@link #dotForcedPatterns}. */
  public static class DotResult {
    /** The patterns, with patterns in forced positions dotted. */
    public final List<Core.Arg<Core.Pat>> patterns;
    /** The dotted patterns that must be bound elsewhere. */
    public final List<Core.Pat> rebind;

    DotResult(List<Core.Arg<Core.Pat>> patterns, List<Core.Pat> rebind) {
      this.patterns = ImmutableList.copyOf(patterns);
      this.rebind = ImmutableList.copyOf(rebind);
    }

    @Override
    public String toString() {
      return "(" + clause(patterns) + ", " + rebind + ")";
    }
  }
}

// End Forcing.java
