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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.lemma.ast.Core;
import net.hydromatic.lemma.type.Dom;
import net.hydromatic.lemma.type.Modality;

/**
 * Data types for forcing tests.
 *
 * <blockquote><pre>
 * data Nat : Set where
 *   zero : Nat
 *   suc  : (n : Nat) → Nat
 *
 * data Fin : Nat → Set where
 *   fzero : (n : Nat) → Fin (suc n)
 *   fsuc  : (n : Nat) (i : Fin n) → Fin (suc n)
 *
 * data EFin : Nat → Set where
 *   efzero : (@0 n : Nat) → EFin (suc n)
 *
 * data Vec (A : Set) : Nat → Set where
 *   nil  : Vec A zero
 *   cons : (n : Nat) (x : A) (xs : Vec A n) → Vec A (suc n)
 *
 * data Sing (A : Set) : A → Set where
 *   sing : (x : A) → Sing A x
 *
 * data Tag : Nat → Set where
 *   mk : (n : Nat) → Tag n
 *
 * record Sigma : Set where    -- with eta
 *   constructor pair
 *   field fst snd : Nat
 *
 * data Box : Sigma → Set where
 *   box : (p : Sigma) → Box p</pre></blockquote>
 *
 * <p>Constructor types exclude parameters, so {@code A} is variable
 * "@0" outside the constructor's telescope.
 */
class Fixtures {
  private Fixtures() {}

  static final Core.Term NAT = core.def("Nat");
  static final Core.Term ZERO = core.con("zero");
  static final Core.Term SIGMA = core.def("Sigma");

  static final Core.Term SUC_TYPE = core.pi("n", NAT, NAT);

  static final Core.Term FZERO_TYPE =
      core.pi("n", NAT, core.def("Fin", core.con("suc", core.var(0))));

  static final Core.Term FSUC_TYPE =
      core.pi("n", NAT,
          core.pi("i", core.def("Fin", core.var(0)),
              core.def("Fin", core.con("suc", core.var(1)))));

  static final Core.Term EFZERO_TYPE =
      core.pi(Dom.of("n", NAT, Modality.ERASED),
          core.def("EFin", core.con("suc", core.var(0))));

  static final Core.Term NIL_TYPE = core.def("Vec", core.var(0), ZERO);

  static final Core.Term CONS_TYPE =
      core.pi("n", NAT,
          core.pi("x", core.var(1),
              core.pi("xs", core.def("Vec", core.var(2), core.var(1)),
                  core.def("Vec", core.var(3),
                      core.con("suc", core.var(2))))));

  static final Core.Term SING_TYPE =
      core.pi("x", core.var(0), core.def("Sing", core.var(1), core.var(0)));

  static final Core.Term MK_TYPE =
      core.pi("n", NAT, core.def("Tag", core.var(0)));

  static final Core.Term PAIR_TYPE =
      core.pi("fst", NAT, core.pi("snd", NAT, SIGMA));

  static final Core.Term BOX_TYPE =
      core.pi("p", SIGMA, core.def("Box", core.var(0)));

  /** Returns a {@code Forcing} with default properties and all of the data
   * types registered. */
  static Forcing forcing() {
    return forcing(ImmutableMap.of(), Tracers.nullTracer());
  }

  /** Returns a {@code Forcing} with given properties and all of the data
   * types registered. */
  static Forcing forcing(Map<Prop, Object> propMap, Tracer tracer) {
    return Forcing.create(propMap, Environments.empty(), tracer)
        .registerDataType("Nat")
        .registerConstructor("zero", NAT, false)
        .registerConstructor("suc", SUC_TYPE, false)
        .registerDataType("Fin")
        .registerConstructor("fzero", FZERO_TYPE, false)
        .registerConstructor("fsuc", FSUC_TYPE, false)
        .registerDataType("EFin")
        .registerConstructor("efzero", EFZERO_TYPE, false)
        .registerDataType("Vec")
        .registerConstructor("nil", NIL_TYPE, false)
        .registerConstructor("cons", CONS_TYPE, false)
        .registerDataType("Sing")
        .registerConstructor("sing", SING_TYPE, false)
        .registerDataType("Tag")
        .registerConstructor("mk", MK_TYPE, false)
        .registerDataType("Sigma")
        .registerConstructor("pair", PAIR_TYPE, true)
        .registerDataType("Box")
        .registerConstructor("box", BOX_TYPE, false);
  }

  /** Wraps patterns in arguments with the default modality. */
  static List<Core.Arg<Core.Pat>> pats(Core.Pat... pats) {
    return core.args(pats);
  }

  /** Wraps a pattern in an argument with the default modality. */
  static Core.Arg<Core.Pat> arg(Core.Pat pat) {
    return core.arg(pat);
  }

  /** Wraps a pattern in an argument with a given modality. */
  static Core.Arg<Core.Pat> arg(Modality modality, Core.Pat pat) {
    return core.arg(modality, pat);
  }

  /** Creates a lazy constructor pattern. */
  static Core.ConPat lazyConPat(String name, Core.Pat... args) {
    return core.conPat(name, true, core.args(args));
  }

  /** Creates a constructor pattern whose arguments have given modalities. */
  static Core.ConPat conPat(String name, List<Core.Arg<Core.Pat>> args) {
    return core.conPat(name, false, ImmutableList.copyOf(args));
  }
}

// End Fixtures.java
