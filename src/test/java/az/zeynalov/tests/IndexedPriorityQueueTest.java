package az.zeynalov.tests;

import static org.junit.jupiter.api.Assertions.*;

import az.zeynalov.balanced.IndexedPriorityQueue;
import az.zeynalov.balanced.exception.InvalidPriorityException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalDouble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class IndexedPriorityQueueTest {

  private IndexedPriorityQueue<String> queue;

  @BeforeEach
  void setUp() {
    queue = new IndexedPriorityQueue<>();
  }

  @Nested
  class Ordering {

    @Test
    void lowestPriorityNumberIsServedFirst() {
      queue.enqueue("a", 3);
      queue.enqueue("b", 1);
      queue.enqueue("c", 2);

      assertEquals(List.of("b", "c", "a"), drainAll());
    }

    @Test
    void equalPrioritiesLeaveInArrivalOrder() {
      queue.enqueue("x", 1);
      queue.enqueue("y", 1);
      queue.enqueue("z", 1);
      queue.enqueue("w", 0);

      assertEquals(List.of("w", "x", "y", "z"), drainAll());
    }

    @Test
    void negativeAndInfinitePriorities() {
      queue.enqueue("last", Double.POSITIVE_INFINITY);
      queue.enqueue("first", Double.NEGATIVE_INFINITY);
      queue.enqueue("middle", -2.5);

      assertEquals(List.of("first", "middle", "last"), drainAll());
    }
  }

  @Nested
  class Lookup {

    @Test
    void emptyQueue() {
      assertTrue(queue.isEmpty());
      assertEquals(Optional.empty(), queue.peek());
      assertEquals(OptionalDouble.empty(), queue.peekPriority());
      assertEquals(Optional.empty(), queue.dequeue());
    }

    @Test
    void peekAndPriority() {
      queue.enqueue("a", 4);
      queue.enqueue("b", 2);

      assertEquals(Optional.of("b"), queue.peek());
      assertEquals(OptionalDouble.of(2), queue.peekPriority());
      assertEquals(OptionalDouble.of(4), queue.getPriority("a"));
      assertEquals(OptionalDouble.empty(), queue.getPriority("missing"));
      assertEquals(2, queue.size());
    }

    @Test
    void containsFollowsDequeue() {
      queue.enqueue("a", 1);
      assertTrue(queue.contains("a"));

      queue.dequeue();

      assertFalse(queue.contains("a"));
    }

    @Test
    void toListHoldsEveryValue() {
      queue.enqueue("a", 3);
      queue.enqueue("b", 1);
      queue.enqueue("c", 2);

      List<String> values = queue.toList();

      assertEquals(3, values.size());
      assertTrue(values.containsAll(List.of("a", "b", "c")));
      assertEquals(3, queue.size());
    }
  }

  @Nested
  class Updates {

    @Test
    void reEnqueueReplacesEntry() {
      queue.enqueue("a", 5);
      queue.enqueue("b", 5);
      queue.enqueue("a", 1);

      assertEquals(2, queue.size());
      assertEquals(OptionalDouble.of(1), queue.getPriority("a"));
      assertEquals(List.of("a", "b"), drainAll());
    }

    @Test
    void updatePriorityMovesValueUp() {
      queue.enqueue("a", 5);
      queue.enqueue("b", 3);

      assertTrue(queue.updatePriority("a", 1));

      assertEquals(Optional.of("a"), queue.peek());
      assertEquals(OptionalDouble.of(1), queue.peekPriority());
    }

    @Test
    void updatedValueQueuesBehindEqualPriorities() {
      queue.enqueue("a", 1);
      queue.enqueue("c", 1);
      queue.enqueue("b", 2);

      queue.updatePriority("b", 1);

      assertEquals(List.of("a", "c", "b"), drainAll());
    }

    @Test
    void updateOfMissingValueReturnsFalse() {
      queue.enqueue("a", 1);

      assertFalse(queue.updatePriority("missing", 0));
      assertEquals(1, queue.size());
    }

    @Test
    void remove() {
      queue.enqueue("a", 1);
      queue.enqueue("b", 2);

      assertTrue(queue.remove("a"));
      assertFalse(queue.remove("a"));

      assertEquals(1, queue.size());
      assertEquals(Optional.of("b"), queue.peek());
    }

    @Test
    void nanPriorityIsRejected() {
      queue.enqueue("a", 1);

      assertThrows(InvalidPriorityException.class, () -> queue.enqueue("b", Double.NaN));
      assertThrows(InvalidPriorityException.class, () -> queue.updatePriority("a", Double.NaN));
      assertEquals(OptionalDouble.of(1), queue.getPriority("a"));
      assertEquals(1, queue.size());
    }

    @Test
    void clearResetsQueue() {
      queue.enqueue("a", 1);
      queue.enqueue("b", 2);

      queue.clear();

      assertTrue(queue.isEmpty());
      assertFalse(queue.contains("a"));
      queue.enqueue("c", 1);
      assertEquals(Optional.of("c"), queue.peek());
    }
  }

  @Nested
  class BulkLoad {

    @Test
    void emptyQueueKeepsMapOrderAmongEqualPriorities() {
      Map<String, Double> values = new LinkedHashMap<>();
      values.put("p", 2.0);
      values.put("q", 1.0);
      values.put("r", 2.0);

      queue.enqueueAll(values);

      assertEquals(3, queue.size());
      assertEquals(List.of("q", "p", "r"), drainAll());
    }

    @Test
    void nonEmptyQueueMergesValues() {
      queue.enqueue("p", 5);

      Map<String, Double> values = new LinkedHashMap<>();
      values.put("p", 0.5);
      values.put("s", 3.0);
      queue.enqueueAll(values);

      assertEquals(2, queue.size());
      assertEquals(List.of("p", "s"), drainAll());
    }

    @Test
    void plainValuesGetDefaultPriorityAndKeepOrder() {
      queue.enqueueAll(List.of("first", "second", "first", "third"));

      assertEquals(3, queue.size());
      assertEquals(OptionalDouble.of(0), queue.getPriority("second"));
      assertEquals(List.of("first", "second", "third"), drainAll());
    }

    @Test
    void plainValuesQueueBehindEarlierZeroPriorityValues() {
      queue.enqueue("early", 0);
      queue.enqueue("urgent", -1);

      queue.enqueueAll(List.of("late"));

      assertEquals(List.of("urgent", "early", "late"), drainAll());
    }

    @Test
    void invalidEntryLeavesQueueUntouched() {
      Map<String, Double> values = new LinkedHashMap<>();
      values.put("ok", 1.0);
      values.put("bad", Double.NaN);

      assertThrows(InvalidPriorityException.class, () -> queue.enqueueAll(values));
      assertTrue(queue.isEmpty());
    }
  }

  @Test
  void drainEmptiesQueue() {
    queue.enqueue("a", 2);
    queue.enqueue("b", 1);

    Iterator<String> drain = queue.drain();
    assertEquals("b", drain.next());
    assertEquals("a", drain.next());
    assertFalse(drain.hasNext());
    assertThrows(NoSuchElementException.class, drain::next);
    assertTrue(queue.isEmpty());
  }

  private List<String> drainAll() {
    List<String> values = new ArrayList<>();
    queue.drain().forEachRemaining(values::add);
    return values;
  }
}
