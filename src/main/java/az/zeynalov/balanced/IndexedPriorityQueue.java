package az.zeynalov.balanced;

import az.zeynalov.balanced.exception.ErrorMessage;
import az.zeynalov.balanced.exception.InvalidPriorityException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Queue of distinct values where the lowest priority number is served first and values with the
 * same priority leave in the order they were enqueued.
 * <p>
 * Built on {@link IndexedBinaryHeap}: the heap stores {@link PriorityEntry} wrappers and ranks them
 * by (priority ascending, sequence ascending), while {@code entries} maps each value to its live
 * wrapper so that {@link #remove(Object)} and {@link #updatePriority(Object, double)} can hand the
 * exact wrapper to the heap.
 *
 * @param <E> the value type, keyed by {@code equals}/{@code hashCode}
 */
public class IndexedPriorityQueue<E> {

  private static final double DEFAULT_PRIORITY = 0;

  private static final Comparator<PriorityEntry<?>> SERVE_ORDER =
      Comparator.<PriorityEntry<?>>comparingDouble(PriorityEntry::priority)
          .thenComparingLong(PriorityEntry::sequence)
          .reversed();

  private final IndexedBinaryHeap<PriorityEntry<E>> heap = new IndexedBinaryHeap<>(SERVE_ORDER);
  private final Map<E, PriorityEntry<E>> entries = new HashMap<>();

  private long sequence;

  /**
   * Adds {@code value}, or replaces its priority if it is already queued. A replaced value goes
   * behind the values that already share its new priority.
   */
  public void enqueue(E value, double priority) {
    Objects.requireNonNull(value, ErrorMessage.NULL_VALUE);
    checkPriority(priority);

    PriorityEntry<E> previous = entries.get(value);
    if (previous != null) {
      heap.remove(previous);
    }

    PriorityEntry<E> entry = PriorityEntry.of(value, priority, sequence++);
    heap.insert(entry);
    entries.put(value, entry);
  }

  /**
   * Loads all values at once. On an empty queue this heapifies in linear time, otherwise every
   * value is enqueued one by one. The map's iteration order decides who goes first among equal
   * priorities.
   */
  public void enqueueAll(Map<? extends E, Double> values) {
    for (Map.Entry<? extends E, Double> value : values.entrySet()) {
      Objects.requireNonNull(value.getKey(), ErrorMessage.NULL_VALUE);
      Objects.requireNonNull(value.getValue(), ErrorMessage.NULL_VALUE);
      checkPriority(value.getValue());
    }

    if (!isEmpty()) {
      values.forEach(this::enqueue);
      return;
    }

    List<PriorityEntry<E>> loaded = new ArrayList<>(values.size());
    for (Map.Entry<? extends E, Double> value : values.entrySet()) {
      PriorityEntry<E> entry = PriorityEntry.of(value.getKey(), value.getValue(), sequence++);
      loaded.add(entry);
      entries.put(value.getKey(), entry);
    }
    heap.buildHeap(loaded);
  }

  /**
   * Loads plain values at priority 0, so they leave in iteration order. A value that appears more
   * than once is queued once, at its first position.
   */
  public void enqueueAll(Collection<? extends E> values) {
    Map<E, Double> withPriority = new LinkedHashMap<>();
    for (E value : values) {
      withPriority.put(Objects.requireNonNull(value, ErrorMessage.NULL_VALUE), DEFAULT_PRIORITY);
    }
    enqueueAll(withPriority);
  }

  public Optional<E> dequeue() {
    Optional<PriorityEntry<E>> entry = heap.extractMax();
    entry.ifPresent(e -> entries.remove(e.value()));
    return entry.map(PriorityEntry::value);
  }

  public Optional<E> peek() {
    return heap.peekMax().map(PriorityEntry::value);
  }

  public OptionalDouble peekPriority() {
    return heap.peekMax()
        .map(entry -> OptionalDouble.of(entry.priority()))
        .orElse(OptionalDouble.empty());
  }

  public boolean contains(E value) {
    return entries.containsKey(value);
  }

  public OptionalDouble getPriority(E value) {
    PriorityEntry<E> entry = entries.get(value);
    return entry == null ? OptionalDouble.empty() : OptionalDouble.of(entry.priority());
  }

  /**
   * Moves a queued value to {@code newPriority}. It is treated as freshly enqueued, so it goes
   * behind values already waiting at that priority. Returns false when the value is not queued.
   */
  public boolean updatePriority(E value, double newPriority) {
    checkPriority(newPriority);
    PriorityEntry<E> current = entries.get(value);
    if (current == null) {
      return false;
    }

    PriorityEntry<E> updated = PriorityEntry.of(value, newPriority, sequence++);
    heap.updatePriority(current, updated);
    entries.put(value, updated);
    return true;
  }

  public boolean remove(E value) {
    PriorityEntry<E> entry = entries.remove(value);
    return entry != null && heap.remove(entry);
  }

  public int size() {
    return heap.size();
  }

  public boolean isEmpty() {
    return heap.isEmpty();
  }

  public void clear() {
    heap.clear();
    entries.clear();
    sequence = 0;
  }

  /**
   * Values in the heap's array order, not in serving order.
   */
  public List<E> toList() {
    List<PriorityEntry<E>> snapshot = heap.toList();
    List<E> values = new ArrayList<>(snapshot.size());
    for (PriorityEntry<E> entry : snapshot) {
      values.add(entry.value());
    }
    return values;
  }

  /**
   * Dequeues as the iterator advances; the queue is empty once the iterator is exhausted.
   */
  public Iterator<E> drain() {
    return new Iterator<>() {
      @Override
      public boolean hasNext() {
        return !isEmpty();
      }

      @Override
      public E next() {
        return dequeue().orElseThrow(() -> new NoSuchElementException(ErrorMessage.QUEUE_DRAINED));
      }
    };
  }

  private static void checkPriority(double priority) {
    if (Double.isNaN(priority)) {
      throw InvalidPriorityException.of(ErrorMessage.PRIORITY_NOT_A_NUMBER);
    }
  }
}
