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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import net.hydromatic.lemma.ast.Core;
import net.hydromatic.lemma.type.Modality;
import org.junit.jupiter.api.Test;

/** Tests for {@link ForcedVariables}. */
public class ForcedVariablesTest {
  private static final Core.Term ZERO = core.con("zero");

  @Test
  void testVar() {
    assertThat(ForcedVariables.of(core.var(3)),
        is(ImmutableList.of(new ForcedVariables.Occurrence(Modality.UNIT, 3))));
    assertThat(ForcedVariables.of(core.var(3)), hasToString("[(@ω, 3)]"));

    // A variable applied to an argument is not a pattern variable
    assertThat(
        ForcedVariables.of(core.var(3, ImmutableList.of(core.apply(ZERO)))),
        empty());
  }

  /** Variables under constructors are found, and take the modality of the
   * arguments that contain them. */
  @Test
  void testCon() {
    final Core.Term term =
        core.con("cons",
            ImmutableList.of(
                core.<Core.Term>arg(Modality.IRRELEVANT, core.var(1)),
                core.<Core.Term>arg(core.con("suc", core.var(0))),
                core.<Core.Term>arg(ZERO)));
    assertThat(ForcedVariables.of(term), hasToString("[(.@ω, 1), (@ω, 0)]"));

    final Core.Term nested =
        core.con("wrap",
            ImmutableList.of(
                core.<Core.Term>arg(Modality.ERASED,
                    core.con("box",
                        ImmutableList.of(
                            core.<Core.Term>arg(Modality.IRRELEVANT,
                                core.var(2)))))));
    assertThat(ForcedVariables.of(nested), hasToString("[(.@0, 2)]"));
  }

  /** Definitions, literals and binders contribute no variables. */
  @Test
  void testOpaque() {
    assertThat(ForcedVariables.of(core.def("plus", core.var(0), core.var(1))),
        empty());
    assertThat(ForcedVariables.of(core.lit(42)), empty());
    assertThat(ForcedVariables.of(core.sort(0)), empty());
    assertThat(ForcedVariables.of(core.lam("x", core.var(0))), empty());
    assertThat(ForcedVariables.of(core.pi("x", core.def("Nat"), core.var(1))),
        empty());
  }

  /** Applications contribute their argument's variables; projections and
   * path applications contribute none. */
  @Test
  void testElims() {
    final ImmutableList<Core.Elim> elims =
        ImmutableList.of(core.apply(core.var(2)),
            core.proj("fst"),
            core.iApply(ZERO, ZERO, core.var(1)),
            core.apply(core.con("suc", core.var(0))));
    assertThat(ForcedVariables.ofElims(elims), hasToString("[(@ω, 2), (@ω, 0)]"));
  }

  @Test
  void testOfTermsAndArgs() {
    assertThat(
        ForcedVariables.ofTerms(ImmutableList.of(core.var(1), ZERO, core.var(0))),
        hasToString("[(@ω, 1), (@ω, 0)]"));
    assertThat(
        ForcedVariables.ofArgs(
            ImmutableList.of(core.<Core.Term>arg(Modality.ERASED, core.var(4)))),
        hasToString("[(@0, 4)]"));
  }
}

// End ForcedVariablesTest.java
