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
package net.hydromatic.lemma.type;

/**
 * Relevance of a binding; whether its value may be inspected.
 *
 * <p>Values are ordered from most relevant to least relevant. Composition
 * yields the less relevant of the two, so {@link #RELEVANT} is its unit and
 * {@link #IRRELEVANT} absorbs everything.
 */
public enum Relevance {
  /** The binding may be used freely. */
  RELEVANT(""),
  /** The binding may only be used in types, not inspected at run time. */
  NON_STRICT(".."),
  /** The binding may not be inspected at all. */
  IRRELEVANT(".");

  /** Prefix used when rendering a modality. */
  public final String prefix;

  Relevance(String prefix) {
    this.prefix = prefix;
  }

  /** Composes two relevances. */
  public Relevance compose(Relevance relevance) {
    return compareTo(relevance) >= 0 ? this : relevance;
  }

  /**
   * Returns whether a binding of this relevance may stand in for a binding of
   * the given relevance. For example, a relevant binding may be used where an
   * irrelevant one is expected, but not vice versa.
   */
  public boolean moreRelevant(Relevance relevance) {
    return compareTo(relevance) <= 0;
  }
}

// End Relevance.java
