package az.zeynalov.balanced.benchmark;

import az.zeynalov.balanced.BalancedSearchTree;
import az.zeynalov.balanced.IndexedBinaryHeap;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.Arrays;
import java.util.Collections;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 2)
@Fork(value = 1)
public class BalancedStructuresBenchmark {

  private static final long SEED = 42L;

  // =========================================================================
  //  TREE STATE
  // =========================================================================

  @State(Scope.Thread)
  public static class TreeState {
    @Param({"1000", "10000", "100000"})
    int size;

    BalancedSearchTree<Integer> tree;
    TreeSet<Integer> treeSet;

    Integer[] keys;
    Integer missingKey;
    int index;

    @Setup(Level.Trial)
    public void setup() {
      tree = new BalancedSearchTree<>();
      treeSet = new TreeSet<>();
      keys = shuffledKeys(size);

      // Pre-fill both trees for the search benchmarks
      for (Integer key : keys) {
        tree.insert(key);
        treeSet.add(key);
      }

      missingKey = -1;
      index = 0;
    }

    public Integer nextKey() {
      return keys[index++ % size];
    }
  }

  // =========================================================================
  //  HEAP STATE
  // =========================================================================

  @State(Scope.Thread)
  public static class HeapState {
    @Param({"1000", "10000", "100000"})
    int size;

    IndexedBinaryHeap<Integer> heap;
    PriorityQueue<Integer> priorityQueue;

    Integer[] keys;
    int index;

    @Setup(Level.Iteration)
    public void setup() {
      keys = shuffledKeys(size);
      heap = IndexedBinaryHeap.maxHeap();
      priorityQueue = new PriorityQueue<>(Collections.reverseOrder());

      for (Integer key : keys) {
        heap.insert(key);
        priorityQueue.add(key);
      }
      index = 0;
    }

    public Integer nextKey() {
      return keys[index++ % size];
    }
  }

  // =========================================================================
  //  BENCHMARKS: TREE SEARCH
  // =========================================================================

  @Benchmark
  public void search_balancedTree(TreeState state, Blackhole bh) {
    bh.consume(state.tree.search(state.nextKey()));
  }

  @Benchmark
  public void search_treeSet(TreeState state, Blackhole bh) {
    bh.consume(state.treeSet.contains(state.nextKey()));
  }

  @Benchmark
  public void searchMiss_balancedTree(TreeState state, Blackhole bh) {
    bh.consume(state.tree.search(state.missingKey));
  }

  // =========================================================================
  //  BENCHMARKS: TREE DELETE + INSERT
  // =========================================================================

  @Benchmark
  public void churn_balancedTree(TreeState state) {
    // Delete and put back, so the tree size stays constant across invocations
    Integer key = state.nextKey();
    state.tree.delete(key);
    state.tree.insert(key);
  }

  @Benchmark
  public void churn_treeSet(TreeState state) {
    Integer key = state.nextKey();
    state.treeSet.remove(key);
    state.treeSet.add(key);
  }

  // =========================================================================
  //  BENCHMARKS: HEAP ARBITRARY REMOVE
  // =========================================================================

  @Benchmark
  public void removeAndReinsert_indexedHeap(HeapState state) {
    Integer key = state.nextKey();
    state.heap.remove(key);
    state.heap.insert(key);
  }

  @Benchmark
  public void removeAndReinsert_priorityQueue(HeapState state) {
    // PriorityQueue.remove(Object) is a linear scan
    Integer key = state.nextKey();
    state.priorityQueue.remove(key);
    state.priorityQueue.add(key);
  }

  // =========================================================================
  //  HELPERS
  // =========================================================================

  private static Integer[] shuffledKeys(int size) {
    Integer[] keys = new Integer[size];
    for (int i = 0; i < size; i++) {
      keys[i] = i;
    }
    Collections.shuffle(Arrays.asList(keys), new Random(SEED));
    return keys;
  }

  public static void main(String[] args) throws RunnerException {
    Options opts = new OptionsBuilder()
        .include(BalancedStructuresBenchmark.class.getSimpleName())
        .build();
    new Runner(opts).run();
  }
}
