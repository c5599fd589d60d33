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

import static net.hydromatic.lemma.ast.CoreBuilder.core;
import static net.hydromatic.lemma.util.Static.allMatch;
import static net.hydromatic.lemma.util.Static.anyMatch;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import net.hydromatic.lemma.ast.Core;
import net.hydromatic.lemma.ast.Op;
import net.hydromatic.lemma.type.Modality;

/** Utilities for patterns. */
public abstract class Patterns {
  private Patterns() {}

  /**
   * Converts a pattern to the term that it matches.
   *
   * <p>For example, "suc n" becomes "suc @0" if {@code n} has index 0. A
   * projection pattern is not a term.
   */
  public static Core.Term patternToTerm(Core.Pat pat) {
    switch (pat.op) {
    case VAR_PAT:
      return core.var(((Core.VarPat) pat).var.index);

    case DOT_PAT:
      return ((Core.DotPat) pat).term;

    case CON_PAT:
      final Core.ConPat conPat = (Core.ConPat) pat;
      final ImmutableList.Builder<Core.Arg<Core.Term>> args =
          ImmutableList.builder();
      conPat.args.forEach(arg ->
          args.add(arg.withValue(patternToTerm(arg.value)).unnamed()));
      return core.con(conPat.name, args.build());

    case DEF_PAT:
      final Core.DefPat defPat = (Core.DefPat) pat;
      return core.def(defPat.name, patternsToElims(defPat.args));

    case LIT_PAT:
      return core.lit(((Core.LitPat) pat).value);

    case I_APPLY_PAT:
      return core.var(((Core.IApplyPat) pat).var.index);

    case PROJ_PAT:
    default:
      throw new AssertionError("pattern has no term: " + pat);
    }
  }

  /** Converts a list of patterns to eliminations. Projection patterns become
   * projections, path application patterns become path applications, and
   * other patterns become applications. */
  public static ImmutableList<Core.Elim> patternsToElims(
      List<Core.Arg<Core.Pat>> patterns) {
    final ImmutableList.Builder<Core.Elim> b = ImmutableList.builder();
    for (Core.Arg<Core.Pat> arg : patterns) {
      switch (arg.value.op) {
      case PROJ_PAT:
        b.add(core.proj(((Core.ProjPat) arg.value).field));
        break;

      case I_APPLY_PAT:
        final Core.IApplyPat iApplyPat = (Core.IApplyPat) arg.value;
        b.add(
            core.iApply(iApplyPat.lhs, iApplyPat.rhs,
                core.var(iApplyPat.var.index)));
        break;

      default:
        b.add(core.apply(arg.withValue(patternToTerm(arg.value)).unnamed()));
      }
    }
    return b.build();
  }

  /** Returns whether a pattern binds at least one variable. */
  public static boolean bindsVariables(Core.Pat pat) {
    switch (pat.op) {
    case VAR_PAT:
    case I_APPLY_PAT:
      return true;

    case CON_PAT:
      return anyMatch(((Core.ConPat) pat).args,
          arg -> bindsVariables(arg.value));

    case DEF_PAT:
      return anyMatch(((Core.DefPat) pat).args,
          arg -> bindsVariables(arg.value));

    default:
      return false;
    }
  }

  /**
   * Returns the variables bound by a list of patterns, each with its
   * modality. The modality of a variable is the composition of the
   * modalities of the arguments that enclose it.
   */
  public static ImmutableList<Map.Entry<Core.PatVar, Modality>>
      patternVarModalities(List<Core.Arg<Core.Pat>> patterns) {
    final ImmutableList.Builder<Map.Entry<Core.PatVar, Modality>> b =
        ImmutableList.builder();
    patterns.forEach(arg -> patternVarModalities(arg, b));
    return b.build();
  }

  private static void patternVarModalities(Core.Arg<Core.Pat> arg,
      ImmutableList.Builder<Map.Entry<Core.PatVar, Modality>> b) {
    final Modality m = arg.modality;
    final Core.Pat pat = arg.value;
    switch (pat.op) {
    case VAR_PAT:
      b.add(
          Maps.immutableEntry(((Core.VarPat) pat).var,
              m.combine(Modality.DEFAULT)));
      return;

    case I_APPLY_PAT:
      b.add(
          Maps.immutableEntry(((Core.IApplyPat) pat).var,
              m.combine(Modality.DEFAULT)));
      return;

    case CON_PAT:
    case DEF_PAT:
      final List<Core.Arg<Core.Pat>> args =
          pat.op == Op.CON_PAT
              ? ((Core.ConPat) pat).args
              : ((Core.DefPat) pat).args;
      for (Map.Entry<Core.PatVar, Modality> e : patternVarModalities(args)) {
        b.add(Maps.immutableEntry(e.getKey(), m.combine(e.getValue())));
      }
      return;

    default:
      // Dot, literal and projection patterns bind nothing
    }
  }

  /**
   * Returns whether pattern {@code p} rebinds pattern {@code q}.
   *
   * <p>Almost equality, but a variable pattern in {@code p} rebinds any dot
   * pattern in the same place in {@code q}. The forcing translation uses
   * this to recognize a forced pattern that an earlier relocation has
   * already bound.
   */
  public static boolean rebinds(Core.Pat p, Core.Pat q) {
    if (p.op == Op.VAR_PAT
        && q.op == Op.DOT_PAT) {
      return true;
    }
    if (p.op != q.op) {
      return false;
    }
    switch (p.op) {
    case VAR_PAT:
      return ((Core.VarPat) p).var.index == ((Core.VarPat) q).var.index;

    case CON_PAT:
      final Core.ConPat conP = (Core.ConPat) p;
      final Core.ConPat conQ = (Core.ConPat) q;
      return conP.name.equals(conQ.name)
          && allMatch(conP.args, conQ.args,
              (a, b) -> rebinds(a.value, b.value));

    case DEF_PAT:
      final Core.DefPat defP = (Core.DefPat) p;
      final Core.DefPat defQ = (Core.DefPat) q;
      return defP.name.equals(defQ.name)
          && allMatch(defP.args, defQ.args,
              (a, b) -> rebinds(a.value, b.value));

    case I_APPLY_PAT:
      final Core.IApplyPat iP = (Core.IApplyPat) p;
      final Core.IApplyPat iQ = (Core.IApplyPat) q;
      return iP.lhs.equals(iQ.lhs)
          && iP.rhs.equals(iQ.rhs)
          && iP.var.index == iQ.var.index;

    default:
      // Dot, literal and projection patterns
      return p.equals(q);
    }
  }

  /**
   * Returns the size of a list of patterns: the number of pattern nodes,
   * where a dot pattern counts as the size of its term.
   */
  public static int size(List<Core.Arg<Core.Pat>> patterns) {
    int n = 0;
    for (Core.Arg<Core.Pat> arg : patterns) {
      n += size(arg.value);
    }
    return n;
  }

  private static int size(Core.Pat pat) {
    switch (pat.op) {
    case DOT_PAT:
      return size(((Core.DotPat) pat).term);
    case CON_PAT:
      return 1 + size(((Core.ConPat) pat).args);
    case DEF_PAT:
      return 1 + size(((Core.DefPat) pat).args);
    default:
      return 1;
    }
  }

  /** Returns the size of a term, counting constructor and definition
   * applications and their arguments. */
  private static int size(Core.Term term) {
    switch (term.op) {
    case CON:
      int n = 1;
      for (Core.Arg<Core.Term> arg : ((Core.Con) term).args) {
        n += size(arg.value);
      }
      return n;
    case DEF:
      int m = 1;
      for (Core.Elim elim : ((Core.Def) term).elims) {
        m += elim.op == Op.APPLY
            ? size(((Core.Apply) elim).arg.value)
            : 1;
      }
      return m;
    default:
      return 1;
    }
  }
}

// End Patterns.java
