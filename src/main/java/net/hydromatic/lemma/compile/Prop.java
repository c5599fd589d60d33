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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import java.util.Map;

/**
 * Property.
 *
 * <p>Properties are held in a {@code Map<Prop, Object>} that is passed
 * explicitly to {@link Forcing#create}.
 */
public enum Prop {
  /**
   * Boolean property "forcing" controls whether constructor arguments may be
   * forced. If false, the forcing analysis marks no argument as forced.
   * Default is true.
   */
  FORCING("forcing", Boolean.class, true),

  /**
   * Integer property "forcingVerbosity" controls how much the print tracer
   * writes. Records at level 40 describe changed modalities, at 50 each
   * rebinding, and at 60 the analysis of each constructor. Default is 0,
   * which writes nothing.
   */
  FORCING_VERBOSITY("forcingVerbosity", Integer.class, 0),

  /**
   * Integer property "maxPatternDepth" is the deepest nesting of patterns
   * that the forcing translation will traverse. Default is 512.
   */
  MAX_PATTERN_DEPTH("maxPatternDepth", Integer.class, 512);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }
}

// End Prop.java
