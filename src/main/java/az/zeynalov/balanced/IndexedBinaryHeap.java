package az.zeynalov.balanced;

import az.zeynalov.balanced.exception.ErrorMessage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Binary max-heap backed by an {@link ArrayList}, with a side map from every stored element to the
 * slots it currently occupies in the list.
 * <p>
 * Layout: the element at index i has its children at 2i + 1 and 2i + 2 and its parent at
 * (i - 1) / 2. The map is what turns {@link #remove(Object)} and
 * {@link #updatePriority(Object, Object)} from a linear scan into a lookup followed by one sift.
 * <p>
 * Elements are keyed by {@code equals}/{@code hashCode}. Equal elements may be stored more than
 * once; each one owns its own slot and {@code remove}/{@code updatePriority} act on a single
 * occurrence. A stored element must not be mutated in a way that changes its hash.
 *
 * @param <T> the element type
 */
public class IndexedBinaryHeap<T> {

  private static final int ROOT = 0;
  private static final int NOT_FOUND = -1;

  private final Comparator<? super T> comparator;

  private final List<T> elements = new ArrayList<>();
  private final Map<T, TreeSet<Integer>> positions = new HashMap<>();

  /**
   * @param comparator positive when the first argument should sit above the second
   */
  public IndexedBinaryHeap(Comparator<? super T> comparator) {
    this.comparator = Objects.requireNonNull(comparator);
  }

  public static <T extends Comparable<? super T>> IndexedBinaryHeap<T> maxHeap() {
    return new IndexedBinaryHeap<>(Comparator.naturalOrder());
  }

  public static <T extends Comparable<? super T>> IndexedBinaryHeap<T> minHeap() {
    return new IndexedBinaryHeap<>(Comparator.reverseOrder());
  }

  public void insert(T value) {
    Objects.requireNonNull(value, ErrorMessage.NULL_VALUE);
    elements.add(value);
    int index = elements.size() - 1;
    addPosition(value, index);
    siftUp(index);
  }

  public Optional<T> peekMax() {
    return isEmpty() ? Optional.empty() : Optional.of(elements.get(ROOT));
  }

  public Optional<T> extractMax() {
    if (isEmpty()) {
      return Optional.empty();
    }

    T max = elements.get(ROOT);
    removeSlot(ROOT);
    return Optional.of(max);
  }

  /**
   * Removes one stored element equal to {@code value}. Returns false when there is none.
   */
  public boolean remove(T value) {
    int index = lastIndexOf(value);
    if (index == NOT_FOUND) {
      return false;
    }
    removeSlot(index);
    return true;
  }

  /**
   * Replaces one occurrence of {@code oldValue} with {@code newValue} in the same slot and restores
   * the heap order.
   * <p>
   * {@code oldValue} has to be equal to the stored element (it is used as the lookup key), so it
   * must still hash the way it did when it was inserted. Returns false when no such element is
   * stored.
   */
  public boolean updatePriority(T oldValue, T newValue) {
    Objects.requireNonNull(newValue, ErrorMessage.NULL_VALUE);
    int index = lastIndexOf(oldValue);
    if (index == NOT_FOUND) {
      return false;
    }

    removePosition(elements.get(index), index);
    elements.set(index, newValue);
    addPosition(newValue, index);

    if (comparator.compare(oldValue, newValue) == 0) {
      return true;
    }

    siftDown(index);
    siftUp(index);
    return true;
  }

  /**
   * Replaces the whole content with {@code values} and heapifies bottom-up in linear time. The
   * heap is left unchanged when {@code values} holds a null.
   */
  public void buildHeap(Collection<? extends T> values) {
    for (T value : values) {
      Objects.requireNonNull(value, ErrorMessage.NULL_VALUE);
    }

    elements.clear();
    elements.addAll(values);
    positions.clear();
    for (int i = 0; i < elements.size(); i++) {
      addPosition(elements.get(i), i);
    }

    for (int i = elements.size() / 2 - 1; i >= ROOT; i--) {
      siftDown(i);
    }
  }

  public boolean contains(T value) {
    return value != null && positions.containsKey(value);
  }

  /**
   * Lowest slot holding an element equal to {@code value}, or -1 when none is stored.
   */
  public int indexOf(T value) {
    SortedSet<Integer> slots = value == null ? null : positions.get(value);
    return slots == null ? NOT_FOUND : slots.first();
  }

  /**
   * Every slot holding an element equal to {@code value}, ascending, as the index map records
   * them.
   */
  public SortedSet<Integer> indexesOf(T value) {
    TreeSet<Integer> slots = value == null ? null : positions.get(value);
    return slots == null
        ? Collections.emptySortedSet()
        : Collections.unmodifiableSortedSet(new TreeSet<>(slots));
  }

  public int size() {
    return elements.size();
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  public void clear() {
    elements.clear();
    positions.clear();
  }

  /**
   * Copy of the backing list in heap order.
   */
  public List<T> toList() {
    return new ArrayList<>(elements);
  }

  /**
   * Full scan of the heap property. Diagnostic only.
   */
  public boolean isValid() {
    for (int i = 1; i < elements.size(); i++) {
      if (comparator.compare(elements.get(parent(i)), elements.get(i)) < 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Extracts elements from the largest down as the iterator advances. The heap is empty once the
   * iterator is exhausted, so a second call sees nothing.
   */
  public Iterator<T> drainDescending() {
    return new Iterator<>() {
      @Override
      public boolean hasNext() {
        return !isEmpty();
      }

      @Override
      public T next() {
        return extractMax().orElseThrow(() -> new NoSuchElementException(ErrorMessage.HEAP_DRAINED));
      }
    };
  }

  /**
   * Moves the last element into {@code index} and drops the last slot. When {@code index} is the
   * last slot it is simply truncated.
   */
  private void removeSlot(int index) {
    int lastIndex = elements.size() - 1;
    if (index != lastIndex) {
      swap(index, lastIndex);
    }
    removePosition(elements.remove(lastIndex), lastIndex);

    if (index < elements.size()) {
      // Only one of the two can move the element, the other returns after one comparison
      siftDown(index);
      siftUp(index);
    }
  }

  private int lastIndexOf(T value) {
    TreeSet<Integer> slots = value == null ? null : positions.get(value);
    return slots == null ? NOT_FOUND : slots.last();
  }

  private void siftUp(int index) {
    int current = index;
    while (current > ROOT) {
      int parent = parent(current);
      if (comparator.compare(elements.get(current), elements.get(parent)) <= 0) {
        break;
      }
      swap(current, parent);
      current = parent;
    }
  }

  /**
   * Left child is checked first and the right one replaces it only when strictly larger, so on a
   * tie between children the left one moves up.
   */
  private void siftDown(int index) {
    int size = elements.size();
    int current = index;
    while (true) {
      int largest = current;
      int left = leftChild(current);
      int right = left + 1;

      if (left < size && comparator.compare(elements.get(left), elements.get(largest)) > 0) {
        largest = left;
      }
      if (right < size && comparator.compare(elements.get(right), elements.get(largest)) > 0) {
        largest = right;
      }
      if (largest == current) {
        return;
      }

      swap(current, largest);
      current = largest;
    }
  }

  /**
   * Every change of position goes through here, so both map entries are rewritten together with
   * the list slots. Two equal elements share one slot set that already holds both indexes.
   */
  private void swap(int i, int j) {
    T first = elements.get(i);
    T second = elements.get(j);
    elements.set(i, second);
    elements.set(j, first);
    if (first.equals(second)) {
      return;
    }

    removePosition(first, i);
    removePosition(second, j);
    addPosition(first, j);
    addPosition(second, i);
  }

  private void addPosition(T value, int index) {
    positions.computeIfAbsent(value, v -> new TreeSet<>()).add(index);
  }

  private void removePosition(T value, int index) {
    TreeSet<Integer> slots = positions.get(value);
    slots.remove(index);
    if (slots.isEmpty()) {
      positions.remove(value);
    }
  }

  private static int parent(int index) {
    return (index - 1) / 2;
  }

  private static int leftChild(int index) {
    return 2 * index + 1;
  }
}
