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
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.logging.Logger;

/**
 * A disjoint set (AKA union-find set, AKA merge-find set) over the dense integer elements {@code
 * [0, size)}. Every element starts in its own group; {@link #union} merges groups and {@link
 * #connected} asks whether two elements share a group. Groups can never be split again.
 *
 * <p>In practice, disjoint sets are used for connected-component like algorithms where we want to
 * build up relationships between subsets and query the final connected pieces, and for cycle
 * detection in Kruskal's minimum spanning tree algorithm.
 *
 * <p>This implementation uses both path compression and union-by-rank, so both the union() and
 * find() operations have O(a(N)) amortized complexity, where a(n) is the inverse Ackermann
 * function. For any value that we'll ever care about, a(n) is less than 5, which is, for all
 * practical purposes, constant. The rank of a root is an upper bound on the height of its tree, not
 * the number of elements in the group.
 *
 * <p>This class is not thread-safe, and that includes the query methods: {@link #find} and {@link
 * #connected} rewrite parent pointers as they go. Clients sharing an instance between threads must
 * guard every call with the same lock.
 */
public final class UnionFind {
  private static final Logger log = Platform.getLoggerForClass(UnionFind.class);

  /** The parent of each element. An element is a root iff it is its own parent. */
  private final int[] parents;

  /** Upper bound on the height of the tree under each root. Stale for non-root elements. */
  private final int[] ranks;

  /** The number of distinct roots. */
  private int count;

  /**
   * Creates a new disjoint set of {@code size} singleton groups, with elements numbered {@code 0}
   * to {@code size - 1}.
   *
   * @throws IllegalArgumentException if {@code size} is not positive
   */
  public UnionFind(int size) {
    checkArgument(size > 0, "Size must be positive, but was %s", size);
    parents = new int[size];
    ranks = new int[size];
    for (int i = 0; i < size; ++i) {
      parents[i] = i;
    }
    count = size;
  }

  /** Returns the number of elements, fixed at construction. */
  public int size() {
    return parents.length;
  }

  /** Returns the current number of distinct groups. Never increases. */
  public int count() {
    return count;
  }

  /**
   * Returns the root of the group containing {@code p}.
   *
   * <p>Although this is a query, it is not read-only: every element on the path from {@code p} to
   * the root is re-pointed directly at the root (path compression). The groups themselves, the
   * count and the ranks are unchanged.
   *
   * @throws IndexOutOfBoundsException if {@code p} is not in {@code [0, size())}
   */
  public int find(int p) {
    checkElementIndex(p, parents.length, "Element");
    return findRoot(p);
  }

  /** Returns the root of an element already known to be in range, compressing the path to it. */
  private int findRoot(int p) {
    int root = p;
    while (parents[root] != root) {
      root = parents[root];
    }
    // Path compression.
    while (parents[p] != root) {
      int next = parents[p];
      parents[p] = root;
      p = next;
    }
    return root;
  }

  /**
   * Merges the groups containing {@code p} and {@code q}. The root of lower rank is attached under
   * the root of higher rank. When the ranks are equal, the root of {@code q} is attached under the
   * root of {@code p}, and the rank of the root of {@code p} goes up by one.
   *
   * <p>Returns true if {@code p} and {@code q} were in different groups, in which case {@link
   * #count()} has decreased by one. Returns false, and changes nothing, if they were already
   * connected.
   *
   * @throws IndexOutOfBoundsException if either element is not in {@code [0, size())}. The set is
   *     unchanged in that case.
   */
  @CanIgnoreReturnValue
  public boolean union(int p, int q) {
    checkElementIndex(p, parents.length, "First element");
    checkElementIndex(q, parents.length, "Second element");
    int pRoot = findRoot(p);
    int qRoot = findRoot(q);
    if (pRoot == qRoot) {
      return false; // Already in the same set.
    }
    if (ranks[pRoot] < ranks[qRoot]) {
      parents[pRoot] = qRoot;
    } else if (ranks[pRoot] > ranks[qRoot]) {
      parents[qRoot] = pRoot;
    } else {
      parents[qRoot] = pRoot;
      ranks[pRoot]++;
    }
    count--;
    return true;
  }

  /**
   * Returns true if {@code p} and {@code q} are in the same group. Compresses both paths, like two
   * calls to {@link #find}.
   *
   * @throws IndexOutOfBoundsException if either element is not in {@code [0, size())}
   */
  public boolean connected(int p, int q) {
    checkElementIndex(p, parents.length, "First element");
    checkElementIndex(q, parents.length, "Second element");
    return findRoot(p) == findRoot(q);
  }

  /**
   * Returns true if {@code p} is currently the representative of its group. Unlike {@link #find},
   * this does not modify the set.
   */
  public boolean isRoot(int p) {
    checkElementIndex(p, parents.length, "Element");
    return parents[p] == p;
  }

  /**
   * Returns the rank of the root of the group containing {@code p}, which bounds the height of that
   * group's tree and is never more than log2(size()). Does not compress the path.
   */
  public int rank(int p) {
    checkElementIndex(p, parents.length, "Element");
    while (parents[p] != p) {
      p = parents[p];
    }
    return ranks[p];
  }

  /**
   * Returns true if the internal state is consistent: every parent is in range, ranks strictly
   * increase from child to parent (so every parent chain ends at a root), and the count matches the
   * number of roots. Logs the first problem found. Does not modify the set.
   */
  public boolean isValid() {
    int n = parents.length;
    int numRoots = 0;
    for (int i = 0; i < n; ++i) {
      int parent = parents[i];
      if (parent < 0 || parent >= n) {
        log.info("Element " + i + " has out of range parent " + parent);
        return false;
      }
      if (parent == i) {
        numRoots++;
      } else if (ranks[i] >= ranks[parent]) {
        log.info(
            "Element " + i + " has rank " + ranks[i] + " but its parent " + parent
                + " has rank " + ranks[parent]);
        return false;
      }
    }
    if (numRoots != count) {
      log.info("Count is " + count + " but there are " + numRoots + " roots");
      return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("size", parents.length)
        .add("count", count)
        .toString();
  }
}
