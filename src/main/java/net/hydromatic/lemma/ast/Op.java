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

/** Sub-types of {@link AstNode}. */
public enum Op {
  // terms
  VAR,
  CON,
  DEF,
  LIT,
  SORT,
  LAM,
  PI,
  PATH_TYPE,

  // eliminations
  APPLY,
  PROJ,
  I_APPLY,

  // patterns
  VAR_PAT,
  DOT_PAT,
  CON_PAT,
  LIT_PAT,
  PROJ_PAT,
  DEF_PAT,
  I_APPLY_PAT
}

// End Op.java
