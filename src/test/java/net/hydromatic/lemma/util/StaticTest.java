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
package net.hydromatic.lemma.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Static}. */
public class StaticTest {
  @Test
  void testShorterThan() {
    final List<String> list = ImmutableList.of("a", "b", "c");
    assertThat(Static.shorterThan(list, 4), is(true));
    assertThat(Static.shorterThan(list, 3), is(false));
    final Iterable<String> iterable = list::iterator;
    assertThat(Static.shorterThan(iterable, 4), is(true));
    assertThat(Static.shorterThan(iterable, 3), is(false));
    assertThat(Static.shorterThan(iterable, 0), is(false));
  }

  /** {@link Static#minusAll} removes one occurrence per element, and keeps
   * order. */
  @Test
  void testMinusAll() {
    assertThat(
        Static.minusAll(ImmutableList.of("a", "b", "a", "c"),
            ImmutableList.of("a", "c", "d")),
        is(ImmutableList.of("b", "a")));
    assertThat(
        Static.<String>minusAll(ImmutableList.of(), ImmutableList.of("a"))
            .isEmpty(),
        is(true));
  }

  @Test
  void testMatch() {
    final List<Integer> list = ImmutableList.of(1, 2, 3);
    assertThat(Static.anyMatch(list, i -> i > 2), is(true));
    assertThat(Static.anyMatch(list, i -> i > 3), is(false));
    assertThat(Static.allMatch(list, ImmutableList.of(2, 3, 4), (i, j) -> i < j),
        is(true));
    assertThat(Static.allMatch(list, ImmutableList.of(2, 3), (i, j) -> i < j),
        is(false));
  }

  @Test
  void testForEachIndexed() {
    final List<String> out = new ArrayList<>();
    Static.forEachIndexed(ImmutableList.of("x", "y"),
        (s, i) -> out.add(i + ":" + s));
    assertThat(out, is(ImmutableList.of("0:x", "1:y")));
  }
}

// End StaticTest.java
