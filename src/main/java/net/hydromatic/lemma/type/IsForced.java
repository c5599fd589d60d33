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

import java.util.List;

/**
 * Whether a constructor argument is forced, that is, recoverable from the
 * indices of the constructor's result type.
 */
public enum IsForced {
  FORCED,
  NOT_FORCED;

  public boolean isForced() {
    return this == FORCED;
  }

  /**
   * Returns the {@code i}th element of an annotation list, or {@link
   * #NOT_FORCED} if the list is too short. A definition with no annotations
   * forces nothing.
   */
  public static IsForced at(List<IsForced> forcedList, int i) {
    return i < forcedList.size() ? forcedList.get(i) : NOT_FORCED;
  }
}

// End IsForced.java
