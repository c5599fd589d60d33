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

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Modality of a binding: its {@link Relevance} and {@link Quantity}, and
 * whether the user wrote the quantity explicitly.
 *
 * <p>Modalities are immutable.
 */
public final class Modality {
  /**
   * Unit of {@link #combine}: relevant and unrestricted. An occurrence of a
   * bare variable has this modality.
   */
  public static final Modality UNIT =
      new Modality(Relevance.RELEVANT, Quantity.OMEGA, false);

  /** Modality of an ordinary binder. */
  public static final Modality DEFAULT = UNIT;

  /** Modality of an irrelevant binder. */
  public static final Modality IRRELEVANT =
      new Modality(Relevance.IRRELEVANT, Quantity.OMEGA, false);

  /** Modality of an erased binder whose quantity was inferred. */
  public static final Modality ERASED =
      new Modality(Relevance.RELEVANT, Quantity.ZERO, false);

  public final Relevance relevance;
  public final Quantity quantity;
  /** Whether the user wrote the quantity explicitly. */
  public final boolean userQuantity;

  private Modality(
      Relevance relevance, Quantity quantity, boolean userQuantity) {
    this.relevance = requireNonNull(relevance, "relevance");
    this.quantity = requireNonNull(quantity, "quantity");
    this.userQuantity = userQuantity;
  }

  /** Creates a modality whose quantity was not written by the user. */
  public static Modality of(Relevance relevance, Quantity quantity) {
    return of(relevance, quantity, false);
  }

  /** Creates a modality. */
  public static Modality of(
      Relevance relevance, Quantity quantity, boolean userQuantity) {
    if (!userQuantity
        && relevance == Relevance.RELEVANT
        && quantity == Quantity.OMEGA) {
      return UNIT;
    }
    return new Modality(relevance, quantity, userQuantity);
  }

  @Override
  public int hashCode() {
    return Objects.hash(relevance, quantity, userQuantity);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Modality
            && relevance == ((Modality) o).relevance
            && quantity == ((Modality) o).quantity
            && userQuantity == ((Modality) o).userQuantity;
  }

  @Override
  public String toString() {
    return relevance.prefix + "@" + quantity.symbol + (userQuantity ? "!" : "");
  }

  /**
   * Composes this modality with another.
   *
   * <p>Relevance and quantity are composed component-wise. The quantity of
   * the result counts as user-written if either quantity was.
   */
  public Modality combine(Modality modality) {
    return of(
        relevance.compose(modality.relevance),
        quantity.compose(modality.quantity),
        userQuantity || modality.userQuantity);
  }

  /**
   * Returns whether a binding of this modality may stand in for a binding of
   * the given modality. Ignores where the quantities came from.
   */
  public boolean moreUsable(Modality modality) {
    return relevance.moreRelevant(modality.relevance)
        && quantity.moreQuantity(modality.quantity);
  }

  /** Returns whether the quantity was inferred rather than written. */
  public boolean noUserQuantity() {
    return !userQuantity;
  }
}

// End Modality.java
