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
package com.google.common.unionfind.benchmarks;

import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

import com.google.common.unionfind.UnionFind;
import java.util.Random;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

/**
 * Benchmarks for {@link UnionFind}.
 */
public final class UnionFindBenchmark {

  private UnionFindBenchmark() { }

  /** Benchmark state with a number of consecutive integer elements. */
  @State(Scope.Thread)
  @BenchmarkMode(Mode.AverageTime)
  @OutputTimeUnit(NANOSECONDS)
  @Warmup(iterations = 3, time = 5, timeUnit = SECONDS)
  @Measurement(iterations = 5, time = 5, timeUnit = SECONDS)
  public static class ConsecutiveIntegerState {
    @Param({"64", "512", "4096", "32768", "262144"})
    int numElements;

    /** Random pairs of elements, as {p0, q0, p1, q1, ...}. */
    private int[] pairs;

    @Setup(Level.Trial)
    public void setup() {
      Random rand = new Random(123456);
      pairs = new int[2 * numElements];
      for (int i = 0; i < pairs.length; i++) {
        pairs[i] = rand.nextInt(numElements);
      }
    }

    /**
     * Measures the amount of time it takes to create a set of numElements, union consecutive
     * elements together, and then find the root of the last element.
     */
    @Benchmark
    public int findRoot() {
      UnionFind set = new UnionFind(numElements);
      for (int i = 0; i + 1 < numElements; i++) {
        set.union(i, i + 1);
      }
      return set.find(numElements - 1);
    }

    /**
     * Measures numElements random unions, each followed by a connected() query on an unrelated
     * pair.
     */
    @Benchmark
    public int randomUnionAndConnected() {
      UnionFind set = new UnionFind(numElements);
      int connectedPairs = 0;
      for (int i = 0; i < numElements; i++) {
        set.union(pairs[2 * i], pairs[2 * i + 1]);
        int j = numElements - 1 - i;
        if (set.connected(pairs[2 * j], pairs[2 * j + 1])) {
          connectedPairs++;
        }
      }
      return connectedPairs + set.count();
    }
  }
}
