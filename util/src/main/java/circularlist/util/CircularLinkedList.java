// Copyright 2026 The Circular List Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package circularlist.util;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.Iterables;
import com.google.common.flogger.FluentLogger;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Circular singly linked list, iterable from its front element all the way around the cycle.
 *
 * @param <T> - Element type stored in the list. {@code null} elements are permitted.
 *
 * <p>The last element links back to the head, and iteration ends when an iterator returns to the
 * head it started from rather than at a terminating entry. Mutations happen at the front or
 * <em>after</em> a given position, as with a forward list.</p>
 *
 * <p>The head entry keeps its identity for as long as the list is non-empty. {@link #pushFront}
 * links the new entry behind the head and swaps the two values, and {@link #popFront} copies the
 * second value into the head before unlinking the second entry. An iterator referencing the head
 * therefore observes the new front value after either call.</p>
 *
 * <p>Two lists are equal when one is a rotation of the other: same size, and the values read in
 * cyclic order from some starting element match pointwise.</p>
 *
 * <p>Not synchronized.</p>
 */
public final class CircularLinkedList<T> implements Iterable<T> {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Nullable private Entry<T> head;

  private int size;

  /** Creates an empty list. */
  public CircularLinkedList() {}

  /** Creates a deep copy of {@code other}, with the same front element and cyclic order. */
  public CircularLinkedList(CircularLinkedList<? extends T> other) {
    copyEntriesFrom(checkNotNull(other, "other"));
  }

  /** Returns a list whose front-to-back order is the iteration order of {@code elements}. */
  public static <T> CircularLinkedList<T> copyOf(Iterable<? extends T> elements) {
    return new Builder<T>().addAll(elements).build();
  }

  /** Returns a list whose front-to-back order is the order of {@code elements}. */
  @SafeVarargs
  public static <T> CircularLinkedList<T> of(T... elements) {
    return new Builder<T>().addAll(checkNotNull(elements, "elements")).build();
  }

  public static <T> Builder<T> builder() {
    return new Builder<>();
  }

  /** Inserts {@code value} at the front of the list. */
  public void pushFront(@Nullable T value) {
    if (head == null) {
      head = new Entry<>(value);
      head.next = head;
    } else {
      Entry<T> entry = new Entry<>(value);
      entry.next = head.next;
      head.next = entry;
      swapValues(head, entry);
    }
    size++;
  }

  /**
   * Removes the front element.
   *
   * @throws EmptyContainerException if the list is empty
   */
  public void popFront() {
    Entry<T> first = checkNotEmpty();
    if (first.next == first) {
      first.next = null;
      head = null;
    } else {
      Entry<T> popped = first.next;
      first.value = popped.value;
      first.next = popped.next;
      popped.next = null;
    }
    size--;
  }

  /**
   * Returns the front element.
   *
   * @throws EmptyContainerException if the list is empty
   */
  public T front() {
    return checkNotEmpty().value;
  }

  /**
   * Replaces the front element.
   *
   * @throws EmptyContainerException if the list is empty
   */
  public void setFront(@Nullable T value) {
    checkNotEmpty().value = value;
  }

  public boolean isEmpty() {
    return head == null;
  }

  public int size() {
    return size;
  }

  /**
   * Inserts {@code value} immediately after the element referenced by {@code position}.
   *
   * @return an iterator referencing the inserted element
   * @throws InvalidIteratorException if {@code position} references no element of this list
   */
  public CircularLinkedListIterator<T> insertAfter(
      CircularLinkedListIterator<T> position, @Nullable T value) {
    Entry<T> at = checkPosition(position, "Invalid iterator");
    Entry<T> entry = new Entry<>(value);
    entry.next = at.next;
    at.next = entry;
    size++;
    return new CircularLinkedListIterator<>(entry, head, false);
  }

  /**
   * Removes the element following the one referenced by {@code position}.
   *
   * <p>The head can only be removed with {@link #popFront}.</p>
   *
   * @return an iterator referencing the element that now follows {@code position}, which may be
   *     the head
   * @throws InvalidIteratorException if {@code position} references no element of this list, or
   *     the element following it is the head
   */
  public CircularLinkedListIterator<T> eraseAfter(CircularLinkedListIterator<T> position) {
    Entry<T> at = checkPosition(position, "Invalid iterator or nothing to erase");
    Entry<T> erased = at.next;
    if (erased == head) {
      logger.atFine().log("Refusing to erase the head after %s", position);
      throw new InvalidIteratorException("Invalid iterator or nothing to erase");
    }
    at.next = erased.next;
    erased.next = null;
    size--;
    return new CircularLinkedListIterator<>(at.next, head, false);
  }

  /** Removes every element. */
  public void clear() {
    if (head == null) {
      return;
    }
    int cleared = size;
    // Unlink each entry so none keeps the rest of the former cycle reachable.
    Entry<T> entry = head.next;
    head.next = null;
    while (entry != head) {
      Entry<T> next = entry.next;
      entry.next = null;
      entry = next;
    }
    head = null;
    size = 0;
    logger.atFine().log("Cleared %d entries", cleared);
  }

  /**
   * Replaces the contents of this list with a deep copy of {@code other}.
   *
   * <p>Assigning a list to itself leaves it unchanged.</p>
   *
   * @return this list
   */
  public CircularLinkedList<T> assign(CircularLinkedList<? extends T> other) {
    checkNotNull(other, "other");
    if (other != this) {
      clear();
      copyEntriesFrom(other);
      logger.atFine().log("Assigned %d entries", size);
    }
    return this;
  }

  /** Returns an iterator at the front element, already ended if the list is empty. */
  public CircularLinkedListIterator<T> begin() {
    return new CircularLinkedListIterator<>(head, head, head == null);
  }

  /** Returns the ended iterator, positioned on the head slot. */
  public CircularLinkedListIterator<T> end() {
    return new CircularLinkedListIterator<>(head, head, true);
  }

  /** Read-only counterpart of {@link #begin}. */
  public ConstCircularLinkedListIterator<T> cbegin() {
    return new ConstCircularLinkedListIterator<>(head, head, head == null);
  }

  /** Read-only counterpart of {@link #end}. */
  public ConstCircularLinkedListIterator<T> cend() {
    return new ConstCircularLinkedListIterator<>(head, head, true);
  }

  /** Same as {@link #begin}, so that the list can be used in for-each loops. */
  @Override
  public CircularLinkedListIterator<T> iterator() {
    return begin();
  }

  /**
   * Returns whether {@code o} is a {@link CircularLinkedList} holding the same values in the same
   * cyclic order, starting from any of its elements.
   */
  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CircularLinkedList)) {
      return false;
    }
    CircularLinkedList<?> other = (CircularLinkedList<?>) o;
    if (size != other.size) {
      return false;
    }
    if (head == null || other.head == null) {
      return head == null && other.head == null;
    }
    // Brute force over every rotation of the other list.
    Entry<?> otherStart = other.head;
    for (int i = 0; i < size; i++) {
      if (Objects.equals(head.value, otherStart.value) && matchesFrom(head, otherStart, size)) {
        return true;
      }
      otherStart = otherStart.next;
    }
    return false;
  }

  /** Sum of the element hash codes, which does not depend on the starting element. */
  @Override
  public int hashCode() {
    int hash = 0;
    for (T value : this) {
      hash += Objects.hashCode(value);
    }
    return hash;
  }

  /** Renders the elements from front to back, e.g. {@code [1, 2, 3]}. */
  @Override
  public String toString() {
    return Iterables.toString(this);
  }

  private Entry<T> checkNotEmpty() {
    if (head == null) {
      throw new EmptyContainerException("List is empty");
    }
    return head;
  }

  private Entry<T> checkPosition(CircularLinkedListIterator<T> position, String message) {
    checkNotNull(position, "position");
    // An unlinked entry has no next entry.
    if (position.isEnd() || position.head != head || position.entry.next == null) {
      logger.atFine().log("Rejected iterator %s", position);
      throw new InvalidIteratorException(message);
    }
    return position.entry;
  }

  private void copyEntriesFrom(CircularLinkedList<? extends T> other) {
    if (other.head == null) {
      return;
    }
    head = new Entry<>(other.head.value);
    Entry<T> current = head;
    for (Entry<? extends T> source = other.head.next;
        source != other.head;
        source = source.next) {
      current.next = new Entry<>(source.value);
      current = current.next;
    }
    current.next = head;
    size = other.size;
  }

  private static boolean matchesFrom(Entry<?> first, Entry<?> second, int count) {
    for (int i = 0; i < count; i++) {
      if (!Objects.equals(first.value, second.value)) {
        return false;
      }
      first = first.next;
      second = second.next;
    }
    return true;
  }

  private static <T> void swapValues(Entry<T> first, Entry<T> second) {
    T value = first.value;
    first.value = second.value;
    second.value = value;
  }

  /**
   * Node of a {@link CircularLinkedList} that stores one element and points to the next
   * {@link Entry} in the cycle.
   *
   * @param <T> - Matching element type of the list.
   */
  static final class Entry<T> {

    @Nullable T value;

    Entry<T> next;

    Entry(@Nullable T value) {
      this.value = value;
    }
  }

  /**
   * Builds a {@link CircularLinkedList} from front to back.
   *
   * @param <T> - Matching element type of the list.
   *
   * <p>The first element added becomes the front. On build, the last added {@link Entry} is
   * pointed back to the first one, and the builder is reset so that further additions start a new
   * list.</p>
   */
  public static final class Builder<T> {

    /** First {@link Entry} of the list being built. */
    @Nullable private Entry<T> first;

    /** {@link Entry} corresponding to the most recently added element. */
    @Nullable private Entry<T> current;

    private int size;

    Builder() {}

    /** Appends {@code element} behind the elements already added. */
    public Builder<T> add(@Nullable T element) {
      Entry<T> nextEntry = new Entry<>(element);
      if (current == null) {
        first = nextEntry;
      } else {
        current.next = nextEntry;
      }
      current = nextEntry;
      size++;
      return this;
    }

    /** Simply calls {@code add}, for each element in {@code elements}. */
    public Builder<T> addAll(Iterable<? extends T> elements) {
      for (T element : checkNotNull(elements, "elements")) {
        add(element);
      }
      return this;
    }

    /** Simply calls {@code add}, for each element in {@code elements}. */
    @SafeVarargs
    public final Builder<T> addAll(T... elements) {
      for (T element : checkNotNull(elements, "elements")) {
        add(element);
      }
      return this;
    }

    /** Closes the cycle and hands the added entries to a new list. */
    public CircularLinkedList<T> build() {
      CircularLinkedList<T> list = new CircularLinkedList<>();
      if (current != null) {
        current.next = first;
        list.head = first;
        list.size = size;
      }
      first = null;
      current = null;
      size = 0;
      return list;
    }
  }
}
