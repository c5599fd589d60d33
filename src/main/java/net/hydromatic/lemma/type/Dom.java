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
import net.hydromatic.lemma.ast.Core;

/** Binding of a name to a type, with a modality. An element of a
 * {@link Telescope}. */
public final class Dom {
  public final String name;
  public final Core.Term type;
  public final Modality modality;

  private Dom(String name, Core.Term type, Modality modality) {
    this.name = requireNonNull(name);
    this.type = requireNonNull(type);
    this.modality = requireNonNull(modality);
  }

  /** Creates a binding with the default modality. */
  public static Dom of(String name, Core.Term type) {
    return new Dom(name, type, Modality.DEFAULT);
  }

  /** Creates a binding. */
  public static Dom of(String name, Core.Term type, Modality modality) {
    return new Dom(name, type, modality);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, modality);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Dom
            && name.equals(((Dom) o).name)
            && type.equals(((Dom) o).type)
            && modality.equals(((Dom) o).modality);
  }

  @Override
  public String toString() {
    return "(" + (modality.equals(Modality.DEFAULT) ? "" : modality + " ")
        + name + " : " + type + ")";
  }

  /** Returns a copy of this binding with a given modality. */
  public Dom withModality(Modality modality) {
    return modality.equals(this.modality)
        ? this
        : new Dom(name, type, modality);
  }
}

// End Dom.java
