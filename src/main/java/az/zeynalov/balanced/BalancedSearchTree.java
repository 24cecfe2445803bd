package az.zeynalov.balanced;

import az.zeynalov.balanced.exception.ErrorMessage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;

/**
 * AVL tree of distinct values.
 * <p>
 * Every node keeps the height of its subtree, so after an insert or delete the tree can be
 * repaired on the way back from the recursion by looking only at the heights of the two children.
 * The difference of those heights (balance factor) never exceeds 1 once an operation returns,
 * which keeps the height under ~1.44 log2(n).
 *
 * @param <T> the value type, ordered by the comparator given at construction
 */
public class BalancedSearchTree<T> {

  private static final int EMPTY_HEIGHT = 0;
  private static final int MAX_IMBALANCE = 1;

  private static final class Node<T> {

    T value;
    Node<T> left;
    Node<T> right;
    int height;

    Node(T value) {
      this.value = value;
      this.height = 1;
    }
  }

  private final Comparator<? super T> comparator;

  private Node<T> root;
  private int size;

  // Set by the recursive insert/delete when the shape actually changed
  private boolean modified;

  /**
   * Orders values by their natural ordering. Values that are not {@link Comparable} fail with
   * {@link ClassCastException} on the first comparison, the same way {@link java.util.TreeMap}
   * does.
   */
  public BalancedSearchTree() {
    this(null);
  }

  public BalancedSearchTree(Comparator<? super T> comparator) {
    this.comparator = comparator != null ? comparator : BalancedSearchTree::compareNaturally;
  }

  /**
   * Inserts the value unless an equal value is already stored, in which case the tree is left
   * untouched.
   */
  public void insert(T value) {
    Objects.requireNonNull(value, ErrorMessage.NULL_VALUE);
    modified = false;
    root = insert(root, value);
    if (modified) {
      size++;
    }
  }

  public boolean search(T value) {
    Objects.requireNonNull(value, ErrorMessage.NULL_VALUE);
    Node<T> current = root;
    while (current != null) {
      int cmp = comparator.compare(value, current.value);
      if (cmp == 0) {
        return true;
      }
      current = cmp < 0 ? current.left : current.right;
    }
    return false;
  }

  /**
   * Removes the value if present. Returns false when no equal value is stored.
   */
  public boolean delete(T value) {
    Objects.requireNonNull(value, ErrorMessage.NULL_VALUE);
    modified = false;
    root = delete(root, value);
    if (modified) {
      size--;
    }
    return modified;
  }

  public List<T> inOrder() {
    List<T> result = new ArrayList<>(size);
    inOrder(root, result);
    return result;
  }

  public List<T> preOrder() {
    List<T> result = new ArrayList<>(size);
    preOrder(root, result);
    return result;
  }

  public List<T> postOrder() {
    List<T> result = new ArrayList<>(size);
    postOrder(root, result);
    return result;
  }

  /**
   * Values grouped by depth, root level first, each level left to right.
   */
  public List<List<T>> levelOrder() {
    List<List<T>> levels = new ArrayList<>();
    if (root == null) {
      return levels;
    }

    Queue<Node<T>> queue = new ArrayDeque<>();
    queue.add(root);
    while (!queue.isEmpty()) {
      int levelSize = queue.size();
      List<T> level = new ArrayList<>(levelSize);
      for (int i = 0; i < levelSize; i++) {
        Node<T> node = queue.poll();
        level.add(node.value);
        if (node.left != null) {
          queue.add(node.left);
        }
        if (node.right != null) {
          queue.add(node.right);
        }
      }
      levels.add(level);
    }
    return levels;
  }

  public Optional<T> findMin() {
    return root == null ? Optional.empty() : Optional.of(minNode(root).value);
  }

  public Optional<T> findMax() {
    if (root == null) {
      return Optional.empty();
    }
    Node<T> current = root;
    while (current.right != null) {
      current = current.right;
    }
    return Optional.of(current.value);
  }

  public Optional<T> rootValue() {
    return root == null ? Optional.empty() : Optional.of(root.value);
  }

  public int getTreeHeight() {
    return height(root);
  }

  /**
   * Recomputes every subtree height from scratch instead of trusting the cached ones, so it also
   * catches a stale height field. Only meant for diagnostics and tests.
   */
  public boolean isBalanced() {
    return checkedHeight(root) != -1;
  }

  /**
   * Checks the ordering of the whole tree, each node against the bounds inherited from its
   * ancestors.
   */
  public boolean isValidSearchTree() {
    return isOrdered(root, null, null);
  }

  public boolean isEmpty() {
    return root == null;
  }

  public int size() {
    return size;
  }

  public void clear() {
    root = null;
    size = 0;
  }

  private Node<T> insert(Node<T> node, T value) {
    if (node == null) {
      modified = true;
      return new Node<>(value);
    }

    int cmp = comparator.compare(value, node.value);
    if (cmp < 0) {
      node.left = insert(node.left, value);
    } else if (cmp > 0) {
      node.right = insert(node.right, value);
    } else {
      return node;
    }

    if (!modified) {
      return node;
    }

    updateHeight(node);
    int balance = balanceFactor(node);

    // Left-Left
    if (balance > MAX_IMBALANCE && comparator.compare(value, node.left.value) < 0) {
      return rotateRight(node);
    }
    // Right-Right
    if (balance < -MAX_IMBALANCE && comparator.compare(value, node.right.value) > 0) {
      return rotateLeft(node);
    }
    // Left-Right
    if (balance > MAX_IMBALANCE && comparator.compare(value, node.left.value) > 0) {
      node.left = rotateLeft(node.left);
      return rotateRight(node);
    }
    // Right-Left
    if (balance < -MAX_IMBALANCE && comparator.compare(value, node.right.value) < 0) {
      node.right = rotateRight(node.right);
      return rotateLeft(node);
    }

    return node;
  }

  private Node<T> delete(Node<T> node, T value) {
    if (node == null) {
      return null;
    }

    int cmp = comparator.compare(value, node.value);
    if (cmp < 0) {
      node.left = delete(node.left, value);
    } else if (cmp > 0) {
      node.right = delete(node.right, value);
    } else {
      modified = true;
      if (node.left == null || node.right == null) {
        // Leaf or single child: splice the child (possibly null) into the parent
        return node.left != null ? node.left : node.right;
      }

      Node<T> successor = minNode(node.right);
      node.value = successor.value;
      node.right = delete(node.right, successor.value);
    }

    if (!modified) {
      return node;
    }

    return rebalance(node);
  }

  /**
   * Unlike insert, a delete can shorten a subtree that was already the shorter one, so the case is
   * picked from the balance factor of the taller child and every ancestor may need a rotation.
   */
  private Node<T> rebalance(Node<T> node) {
    updateHeight(node);
    int balance = balanceFactor(node);

    if (balance > MAX_IMBALANCE) {
      if (balanceFactor(node.left) < 0) {
        node.left = rotateLeft(node.left);
      }
      return rotateRight(node);
    }

    if (balance < -MAX_IMBALANCE) {
      if (balanceFactor(node.right) > 0) {
        node.right = rotateRight(node.right);
      }
      return rotateLeft(node);
    }

    return node;
  }

  /**
   *       y                x
   *      / \              / \
   *     x   C    -->     A   y
   *    / \                  / \
   *   A   B                B   C
   */
  private Node<T> rotateRight(Node<T> y) {
    Node<T> x = y.left;
    y.left = x.right;
    x.right = y;

    updateHeight(y);
    updateHeight(x);
    return x;
  }

  /**
   * Mirror image of {@link #rotateRight(Node)}.
   */
  private Node<T> rotateLeft(Node<T> x) {
    Node<T> y = x.right;
    x.right = y.left;
    y.left = x;

    updateHeight(x);
    updateHeight(y);
    return y;
  }

  @SuppressWarnings("unchecked")
  private static <T> int compareNaturally(T first, T second) {
    return ((Comparable<? super T>) first).compareTo(second);
  }

  private void updateHeight(Node<T> node) {
    node.height = 1 + Math.max(height(node.left), height(node.right));
  }

  private int height(Node<T> node) {
    return node == null ? EMPTY_HEIGHT : node.height;
  }

  private int balanceFactor(Node<T> node) {
    return node == null ? 0 : height(node.left) - height(node.right);
  }

  private Node<T> minNode(Node<T> node) {
    Node<T> current = node;
    while (current.left != null) {
      current = current.left;
    }
    return current;
  }

  // Returns -1 as soon as an unbalanced or mis-measured subtree is found
  private int checkedHeight(Node<T> node) {
    if (node == null) {
      return EMPTY_HEIGHT;
    }
    int left = checkedHeight(node.left);
    if (left == -1) {
      return -1;
    }
    int right = checkedHeight(node.right);
    if (right == -1) {
      return -1;
    }
    int actual = 1 + Math.max(left, right);
    if (Math.abs(left - right) > MAX_IMBALANCE || actual != node.height) {
      return -1;
    }
    return actual;
  }

  private boolean isOrdered(Node<T> node, T lower, T upper) {
    if (node == null) {
      return true;
    }
    if (lower != null && comparator.compare(node.value, lower) <= 0) {
      return false;
    }
    if (upper != null && comparator.compare(node.value, upper) >= 0) {
      return false;
    }
    return isOrdered(node.left, lower, node.value) && isOrdered(node.right, node.value, upper);
  }

  private void inOrder(Node<T> node, List<T> result) {
    if (node == null) {
      return;
    }
    inOrder(node.left, result);
    result.add(node.value);
    inOrder(node.right, result);
  }

  private void preOrder(Node<T> node, List<T> result) {
    if (node == null) {
      return;
    }
    result.add(node.value);
    preOrder(node.left, result);
    preOrder(node.right, result);
  }

  private void postOrder(Node<T> node, List<T> result) {
    if (node == null) {
      return;
    }
    postOrder(node.left, result);
    postOrder(node.right, result);
    result.add(node.value);
  }
}
