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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.ObjIntConsumer;
import java.util.function.Predicate;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Returns whether an {@link Iterable} has fewer than {@code n} elements.
   *
   * @param <E> Element type
   */
  public static <E> boolean shorterThan(Iterable<E> iterable, int n) {
    if (iterable instanceof Collection) {
      return ((Collection<E>) iterable).size() < n;
    }
    if (n <= 0) {
      return false;
    }
    int i = 0;
    for (Iterator<E> iterator = iterable.iterator();
        iterator.hasNext();
        iterator.next()) {
      if (++i == n) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether a predicate is true for at least one element of a list. */
  public static <E> boolean anyMatch(
      Iterable<? extends E> iterable, Predicate<E> predicate) {
    for (E e : iterable) {
      if (predicate.test(e)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns whether a predicate is true for each pair of corresponding
   * elements of two lists. Returns false if the lists have different sizes.
   */
  public static <E, F> boolean allMatch(
      List<E> list0, List<F> list1, BiPredicate<E, F> predicate) {
    if (list0.size() != list1.size()) {
      return false;
    }
    for (int i = 0; i < list0.size(); i++) {
      if (!predicate.test(list0.get(i), list1.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Calls a consumer for each element of a list, with its ordinal. */
  public static <E> void forEachIndexed(
      List<? extends E> list, ObjIntConsumer<E> consumer) {
    for (int i = 0; i < list.size(); i++) {
      consumer.accept(list.get(i), i);
    }
  }

  /**
   * Returns the elements of {@code list0} that remain after removing, for
   * each element of {@code list1}, its first occurrence in {@code list0}.
   *
   * <p>For example, {@code minusAll([a, b, a, c], [a, c, d])} returns
   * {@code [b, a]}. Order is preserved.
   */
  public static <E> ImmutableList<E> minusAll(
      List<? extends E> list0, List<? extends E> list1) {
    final List<E> list = new ArrayList<>(list0);
    for (E e : list1) {
      list.remove(e);
    }
    return ImmutableList.copyOf(list);
  }
}

// End Static.java
