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
import static net.hydromatic.lemma.compile.Fixtures.FSUC_TYPE;
import static net.hydromatic.lemma.compile.Fixtures.FZERO_TYPE;
import static net.hydromatic.lemma.compile.Fixtures.NAT;
import static net.hydromatic.lemma.compile.Fixtures.ZERO;
import static net.hydromatic.lemma.compile.Fixtures.forcing;
import static net.hydromatic.lemma.type.IsForced.FORCED;
import static net.hydromatic.lemma.type.IsForced.NOT_FORCED;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.lemma.ast.Core;
import net.hydromatic.lemma.type.Dom;
import net.hydromatic.lemma.type.IsForced;
import net.hydromatic.lemma.type.Modality;
import net.hydromatic.lemma.type.Quantity;
import net.hydromatic.lemma.type.Relevance;
import org.junit.jupiter.api.Test;

/** Tests the forcing analysis, {@link Forcing#computeForcingAnnotations}. */
public class ForcingTest {
  @Test
  void testNat() {
    final Forcing f = forcing();
    assertThat(f.env.forcedArgs("zero"), empty());
    assertThat(f.env.forcedArgs("suc"), is(ImmutableList.of(NOT_FORCED)));
  }

  /** The index of {@code fzero} and {@code fsuc} is forced, but the
   * recursive argument of {@code fsuc} is not. */
  @Test
  void testFin() {
    final Forcing f = forcing();
    assertThat(f.env.forcedArgs("fzero"), is(ImmutableList.of(FORCED)));
    assertThat(f.env.forcedArgs("fsuc"),
        is(ImmutableList.of(FORCED, NOT_FORCED)));
    assertThat(f.env.forcedArgs("efzero"), is(ImmutableList.of(FORCED)));
  }

  /** The parameter {@code A} of {@code Vec} occurs in the result type, but is
   * outside the constructor's telescope, so is ignored. */
  @Test
  void testVec() {
    final Forcing f = forcing();
    assertThat(f.env.forcedArgs("nil"), empty());
    assertThat(f.env.forcedArgs("cons"),
        is(ImmutableList.of(FORCED, NOT_FORCED, NOT_FORCED)));
  }

  @Test
  void testSing() {
    final Forcing f = forcing();
    assertThat(f.env.forcedArgs("sing"), is(ImmutableList.of(FORCED)));
    assertThat(f.env.forcedArgs("mk"), is(ImmutableList.of(FORCED)));
    assertThat(f.env.forcedArgs("pair"),
        is(ImmutableList.of(NOT_FORCED, NOT_FORCED)));
    assertThat(f.env.get("pair").eta, is(true));
  }

  /** An argument whose quantity the user wrote is never forced. */
  @Test
  void testUserQuantity() {
    final Modality erased =
        Modality.of(Relevance.RELEVANT, Quantity.ZERO, true);
    final Core.Term type =
        core.pi(Dom.of("n", NAT, erased),
            core.def("Fin", core.con("suc", core.var(0))));
    assertThat(forcing().computeForcingAnnotations("c", type),
        is(ImmutableList.of(NOT_FORCED)));

    // The same quantity, inferred, allows forcing
    final Core.Term type2 =
        core.pi(Dom.of("n", NAT, Modality.ERASED),
            core.def("Fin", core.con("suc", core.var(0))));
    assertThat(forcing().computeForcingAnnotations("c", type2),
        is(ImmutableList.of(FORCED)));
  }

  @Test
  void testIrrelevant() {
    final Core.Term type =
        core.pi(Dom.of("n", NAT, Modality.IRRELEVANT),
            core.def("Fin", core.con("suc", core.var(0))));
    assertThat(forcing().computeForcingAnnotations("c", type),
        is(ImmutableList.of(NOT_FORCED)));
  }

  /** A variable that occurs in the index only in an irrelevant position
   * cannot be recovered, so a relevant argument is not forced. A shape-
   * irrelevant argument can be recovered from a relevant position. */
  @Test
  void testOccurrenceModality() {
    final Core.Term index =
        core.con("suc",
            ImmutableList.of(
                core.<Core.Term>arg(Modality.IRRELEVANT, core.var(0))));
    final Core.Term type = core.pi("n", NAT, core.def("Fin", index));
    assertThat(forcing().computeForcingAnnotations("c", type),
        is(ImmutableList.of(NOT_FORCED)));

    final Modality nonStrict = Modality.of(Relevance.NON_STRICT, Quantity.OMEGA);
    final Core.Term type2 =
        core.pi(Dom.of("n", NAT, nonStrict),
            core.def("Fin", core.con("suc", core.var(0))));
    assertThat(forcing().computeForcingAnnotations("c", type2),
        is(ImmutableList.of(FORCED)));
  }

  /** Only bare variables under constructors count. A variable applied to an
   * argument, or under a definition, or only in a projection or path
   * application, is not forced. */
  @Test
  void testNotPatternVariable() {
    final Forcing f = forcing();
    final Core.Term applied =
        core.pi("n", NAT,
            core.def("Fin",
                core.var(0, ImmutableList.of(core.apply(ZERO)))));
    assertThat(f.computeForcingAnnotations("c", applied),
        is(ImmutableList.of(NOT_FORCED)));

    final Core.Term underDef =
        core.pi("n", NAT,
            core.def("Fin", core.def("double", core.var(0))));
    assertThat(f.computeForcingAnnotations("c", underDef),
        is(ImmutableList.of(NOT_FORCED)));

    final Core.Term projected =
        core.pi("n", NAT,
            core.def("P",
                ImmutableList.of(core.proj("fst"),
                    core.iApply(ZERO, ZERO, core.var(0)))));
    assertThat(f.computeForcingAnnotations("c", projected),
        is(ImmutableList.of(NOT_FORCED)));
  }

  /** A path type binds an interval variable, which is part of the
   * telescope. */
  @Test
  void testPathType() {
    final Core.Term type =
        core.pi("n", NAT,
            core.pathType("i", core.def("P", core.var(1)), ZERO, ZERO));
    assertThat(forcing().computeForcingAnnotations("c", type),
        is(ImmutableList.of(FORCED, NOT_FORCED)));
  }

  @Test
  void testTargetNotDataType() {
    final Core.Term type = core.pi("n", NAT, core.var(1));
    final AssertionError e =
        assertThrows(AssertionError.class,
            () -> forcing().computeForcingAnnotations("c", type));
    assertThat(e.getMessage(),
        is("result type of constructor c is not a data type: @1"));
  }

  /** With forcing disabled, no argument is forced, and the type is not
   * examined. */
  @Test
  void testForcingDisabled() {
    final Forcing f =
        Fixtures.forcing(ImmutableMap.of(Prop.FORCING, false),
            Tracers.nullTracer());
    assertThat(f.env.forcedArgs("fzero"), empty());
    assertThat(f.env.forcedArgs("cons"), empty());
    assertThat(IsForced.at(f.env.forcedArgs("fsuc"), 0), is(NOT_FORCED));

    // A type that does not end in a data type is not an error
    assertThat(f.computeForcingAnnotations("c", core.pi("n", NAT, core.var(1))),
        empty());
  }

  /** Making the declared modality of an argument less usable (more relevant,
   * or unrestricted) can turn a forced argument into an unforced one, but
   * never the reverse. */
  @Test
  void testMonotonic() {
    final List<Modality> modalities = new ArrayList<>();
    for (Relevance relevance : Relevance.values()) {
      for (Quantity quantity : Quantity.values()) {
        modalities.add(Modality.of(relevance, quantity));
      }
    }
    final Forcing f = forcing();
    int flips = 0;
    for (Modality occurrence : modalities) {
      final Core.Term index =
          core.con("suc",
              ImmutableList.of(core.<Core.Term>arg(occurrence, core.var(0))));
      for (Modality m1 : modalities) {
        for (Modality m2 : modalities) {
          if (!m2.moreUsable(m1)
              || m1.relevance == Relevance.IRRELEVANT
              || m2.relevance == Relevance.IRRELEVANT) {
            continue;
          }
          final IsForced forced1 = forced(f, m1, index);
          final IsForced forced2 = forced(f, m2, index);
          if (forced1 == NOT_FORCED) {
            assertThat(forced2, is(NOT_FORCED));
          }
          if (forced1 != forced2) {
            ++flips;
          }
        }
      }
    }
    // Some pairs flip from forced to not forced
    assertThat(flips > 0, is(true));
  }

  private static IsForced forced(Forcing f, Modality modality,
      Core.Term index) {
    final Core.Term type =
        core.pi(Dom.of("n", NAT, modality), core.def("Fin", index));
    final List<IsForced> forcedList = f.computeForcingAnnotations("c", type);
    assertThat(forcedList, hasSize(1));
    return forcedList.get(0);
  }

  @Test
  void testTrace() {
    final List<String> records = new ArrayList<>();
    Fixtures.forcing(ImmutableMap.of(),
            Tracers.recordingTracer(Tracers.ANALYSIS_LEVEL, records::add))
        .computeForcingAnnotations("fsuc", FSUC_TYPE);
    final String expected = "Forcing analysis for fsuc\n"
        + "  xs          = [1]\n"
        + "  forcedArgs  = [FORCED, NOT_FORCED]";
    assertThat(records.get(records.size() - 1), is(expected));

    // At lower verbosity, the analysis is not traced
    final List<String> records2 = new ArrayList<>();
    Fixtures.forcing(ImmutableMap.of(),
            Tracers.recordingTracer(Tracers.REBIND_LEVEL, records2::add))
        .computeForcingAnnotations("fzero", FZERO_TYPE);
    assertThat(records2, empty());
  }

  @Test
  void testPropValues() {
    assertThat(Prop.MAX_PATTERN_DEPTH.intValue(ImmutableMap.of()), is(512));
    assertThat(
        Prop.FORCING.booleanValue(ImmutableMap.of(Prop.FORCING, false)),
        is(false));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.FORCING.intValue(ImmutableMap.of()));
  }
}

// End ForcingTest.java
