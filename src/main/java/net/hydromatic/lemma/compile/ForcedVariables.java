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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.lemma.ast.Core;
import net.hydromatic.lemma.type.Modality;

/**
 * Finds the variables of a term that could be forced: those that occur as
 * pattern variables, that is, bare and under constructors only.
 *
 * <p>The term must be in normal form. A term that is not normalized yields
 * fewer variables, never wrong ones.
 *
 * <p>Eliminations other than application (projections and path
 * applications) contribute no variables. Neither do type constructors: a
 * data type is not injective in the equality used by pattern matching.
 */
public class ForcedVariables {
  private ForcedVariables() {}

  /** Returns the forced variables of a term. */
  public static ImmutableList<Occurrence> of(Core.Term term) {
    final ImmutableList.Builder<Occurrence> b = ImmutableList.builder();
    collect(term, b);
    return b.build();
  }

  /** Returns the forced variables of a list of terms. */
  public static ImmutableList<Occurrence> ofTerms(
      List<? extends Core.Term> terms) {
    final ImmutableList.Builder<Occurrence> b = ImmutableList.builder();
    terms.forEach(term -> collect(term, b));
    return b.build();
  }

  /** Returns the forced variables of a list of arguments. */
  public static ImmutableList<Occurrence> ofArgs(
      List<Core.Arg<Core.Term>> args) {
    final ImmutableList.Builder<Occurrence> b = ImmutableList.builder();
    args.forEach(arg -> collect(arg, b));
    return b.build();
  }

  /** Returns the forced variables of a list of eliminations. */
  public static ImmutableList<Occurrence> ofElims(List<Core.Elim> elims) {
    final ImmutableList.Builder<Occurrence> b = ImmutableList.builder();
    for (Core.Elim elim : elims) {
      switch (elim.op) {
      case APPLY:
        collect(((Core.Apply) elim).arg, b);
        break;
      case PROJ:
      case I_APPLY:
        break;
      default:
        throw new AssertionError(elim.op);
      }
    }
    return b.build();
  }

  private static void collect(Core.Term term,
      ImmutableList.Builder<Occurrence> b) {
    switch (term.op) {
    case VAR:
      final Core.Var variable = (Core.Var) term;
      if (variable.isBare()) {
        b.add(new Occurrence(Modality.UNIT, variable.index));
      }
      return;

    case CON:
      ((Core.Con) term).args.forEach(arg -> collect(arg, b));
      return;

    default:
      // Other terms contain no forced variables
    }
  }

  /** Collects the variables of an argument, each combined with the
   * argument's modality. */
  private static void collect(Core.Arg<Core.Term> arg,
      ImmutableList.Builder<Occurrence> b) {
    for (Occurrence occurrence : of(arg.value)) {
      b.add(
          new Occurrence(arg.modality.combine(occurrence.modality),
              occurrence.index));
    }
  }

  /** Occurrence of a variable, by de Bruijn index, with the modality of the
   * position where it occurs. */
  public static final class Occurrence {
    public final Modality modality;
    public final int index;

    public Occurrence(Modality modality, int index) {
      this.modality = requireNonNull(modality);
      this.index = index;
    }

    @Override
    public int hashCode() {
      return Objects.hash(modality, index);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Occurrence
              && modality.equals(((Occurrence) o).modality)
              && index == ((Occurrence) o).index;
    }

    @Override
    public String toString() {
      return "(" + modality + ", " + index + ")";
    }
  }
}

// End ForcedVariables.java
