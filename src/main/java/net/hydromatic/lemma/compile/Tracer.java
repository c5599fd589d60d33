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

import java.util.List;
import java.util.Map;
import net.hydromatic.lemma.ast.Core;
import net.hydromatic.lemma.type.IsForced;
import net.hydromatic.lemma.type.Modality;
import net.hydromatic.lemma.type.Telescope;

/** Called on various events during the forcing analysis and translation. */
public interface Tracer {
  /** Called when the forcing annotations of a constructor are computed. */
  void onForcingAnnotations(String ctorName,
      List<ForcedVariables.Occurrence> occurrences, List<IsForced> forced);

  /**
   * Called when a dot pass has changed the patterns of a clause, with the
   * patterns that must be bound elsewhere.
   */
  void onDotted(List<Core.Arg<Core.Pat>> patterns,
      List<Core.Arg<Core.Pat>> dotted, List<Core.Pat> rebind);

  /** Called before searching for a place to bind a forced pattern. */
  void onRebind(Core.Pat toRebind, List<Core.Arg<Core.Pat>> patterns);

  /** Called with the patterns after a forced pattern has been bound. */
  void onRebindResult(List<Core.Arg<Core.Pat>> patterns);

  /**
   * Called when the forcing translation changes the modalities of pattern
   * variables, with the old and new modalities and the updated telescope.
   */
  void onTelescope(List<Map.Entry<Core.PatVar, Modality>> oldModalities,
      List<Map.Entry<Core.PatVar, Modality>> newModalities,
      Telescope telescope);
}

// End Tracer.java
