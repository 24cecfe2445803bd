package az.zeynalov.balanced;

/**
 * A queued value with its priority and the sequence number it was enqueued with. The sequence
 * number makes two entries of the same value distinct, which lets the queue replace an entry in
 * the heap without the old and new entry ever colliding in the index map.
 */
public record PriorityEntry<E>(E value, double priority, long sequence) {

  public static <E> PriorityEntry<E> of(E value, double priority, long sequence) {
    return new PriorityEntry<>(value, priority, sequence);
  }
}
