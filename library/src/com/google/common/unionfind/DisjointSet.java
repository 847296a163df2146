/*
 * Copyright 2024 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.common.unionfind;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A {@link UnionFind} over a fixed universe of arbitrary elements rather than dense integers. Each
 * distinct element is given an index, in iteration order, when the set is created; no elements can
 * be added afterwards.
 *
 * <p>Queries about elements outside the universe are not errors: {@link #findRoot} returns null and
 * {@link #union} and {@link #connected} return false.
 */
public final class DisjointSet<T> {
  /** Map from elements to their indices in the underlying UnionFind. */
  private final ImmutableMap<T, Integer> elementIndices;
  /** The inverse of elementIndices, maps from index back to element. */
  private final ImmutableList<T> elements;
  private final UnionFind unionFind;

  private DisjointSet(ImmutableList<T> elements) {
    checkArgument(!elements.isEmpty(), "A disjoint set needs at least one element");
    ImmutableMap.Builder<T, Integer> indices = ImmutableMap.builderWithExpectedSize(elements.size());
    for (int i = 0; i < elements.size(); ++i) {
      indices.put(elements.get(i), i);
    }
    this.elementIndices = indices.buildOrThrow();
    this.elements = elements;
    this.unionFind = new UnionFind(elements.size());
  }

  /**
   * Returns a disjoint set where each distinct element of {@code elements} is in its own group.
   * Duplicates are ignored.
   *
   * @throws IllegalArgumentException if {@code elements} is empty
   * @throws NullPointerException if any element is null
   */
  public static <T> DisjointSet<T> of(Iterable<? extends T> elements) {
    Set<T> distinct = new LinkedHashSet<>();
    for (T element : elements) {
      distinct.add(checkNotNull(element, "Disjoint set elements may not be null"));
    }
    return new DisjointSet<>(ImmutableList.copyOf(distinct));
  }

  /** As {@link #of(Iterable)}. */
  @SafeVarargs
  public static <T> DisjointSet<T> of(T... elements) {
    return of(Arrays.asList(elements));
  }

  /** Returns true if {@code val} is one of the elements of this set. */
  public boolean contains(T val) {
    return elementIndices.containsKey(val);
  }

  /**
   * Returns the representative element of the group containing {@code val}, or null if {@code val}
   * isn't in the set. Like {@link UnionFind#find}, this compresses the path to the root.
   */
  public @Nullable T findRoot(T val) {
    Integer index = elementIndices.get(val);
    if (index == null) {
      return null;
    }
    return elements.get(unionFind.find(index));
  }

  /**
   * Merges the groups containing {@code a} and {@code b}. If either a or b isn't in the set, returns
   * false and does not modify the set. Otherwise returns true, even if they were already in the
   * same group.
   */
  @CanIgnoreReturnValue
  public boolean union(T a, T b) {
    Integer aIndex = elementIndices.get(a);
    Integer bIndex = elementIndices.get(b);
    if (aIndex == null || bIndex == null) {
      return false;
    }
    unionFind.union(aIndex, bIndex);
    return true;
  }

  /** Returns true if {@code a} and {@code b} are both in the set and in the same group. */
  public boolean connected(T a, T b) {
    Integer aIndex = elementIndices.get(a);
    Integer bIndex = elementIndices.get(b);
    return aIndex != null && bIndex != null && unionFind.connected(aIndex, bIndex);
  }

  /** Returns the total number of elements in the set. Unioning doesn't change the size. */
  public int size() {
    return elements.size();
  }

  /** Returns the number of distinct groups. */
  public int count() {
    return unionFind.count();
  }
}
