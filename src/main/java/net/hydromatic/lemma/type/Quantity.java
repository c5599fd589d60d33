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
 * Quantity of a binding; how many times it may be used at run time.
 *
 * <p>{@link #OMEGA} places no constraint. It is the unit of composition, and
 * is below every other quantity in the usability order; {@link #ONE} and
 * {@link #ZERO} are incomparable. {@link #ZERO} (erased) absorbs everything
 * under composition.
 */
public enum Quantity {
  /** Unrestricted. */
  OMEGA("ω"),
  /** Linear; used exactly once. */
  ONE("1"),
  /** Erased; not used at run time. */
  ZERO("0");

  public final String symbol;

  Quantity(String symbol) {
    this.symbol = symbol;
  }

  /** Composes two quantities. */
  public Quantity compose(Quantity quantity) {
    return compareTo(quantity) >= 0 ? this : quantity;
  }

  /**
   * Returns whether a binding of this quantity may stand in for a binding of
   * the given quantity.
   */
  public boolean moreQuantity(Quantity quantity) {
    return this == OMEGA || this == quantity;
  }
}

// End Quantity.java
