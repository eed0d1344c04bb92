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
package net.hydromatic.moviedb.util;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Eagerly converts a Collection to an ImmutableList, applying a mapping
   * function to each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      Collection<? extends E> elements, Function<E, T> mapper) {
    if (elements.isEmpty()) {
      // Save ourselves the effort of creating a Builder.
      return ImmutableList.of();
    }

    // Optimize by making the builder the same size as the collection.
    final ImmutableList.Builder<T> b =
        ImmutableList.builderWithExpectedSize(elements.size());
    elements.forEach(e -> b.add(mapper.apply(e)));
    return b.build();
  }

  /**
   * Eagerly converts a List to an ImmutableList, keeping elements that pass a
   * predicate.
   */
  public static <E> ImmutableList<E> filterEager(
      List<? extends E> elements, Predicate<E> predicate) {
    // Do all the elements match?
    for (int i = 0; i < elements.size(); i++) {
      E element = elements.get(i);
      if (predicate.test(element)) {
        continue;
      }
      final ImmutableList.Builder<E> b =
          ImmutableList.builderWithExpectedSize(elements.size());
      // Add all elements before the first non-matching element.
      for (int j = 0; j < i; j++) {
        b.add(elements.get(j));
      }
      // Test and add all elements after the first non-matching element.
      for (int j = i + 1; j < elements.size(); j++) {
        E e = elements.get(j);
        if (predicate.test(e)) {
          b.add(e);
        }
      }
      return b.build();
    }
    // All elements match. We can just return the original list.
    return ImmutableList.copyOf(elements);
  }

  /**
   * Returns the element with the largest key, or null if no element has a
   * non-null key.
   *
   * <p>Elements whose key is null are ignored. If several elements share the
   * largest key, returns the first of them.
   */
  public static <E> @Nullable E firstMax(
      Iterable<? extends E> elements,
      Function<E, ? extends @Nullable Integer> keyFn) {
    E best = null;
    int bestKey = Integer.MIN_VALUE;
    for (E e : elements) {
      final Integer key = keyFn.apply(e);
      if (key == null) {
        continue;
      }
      if (best == null || key > bestKey) {
        best = e;
        bestKey = key;
      }
    }
    return best;
  }
}

// End Static.java
