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

import static com.google.common.base.MoreObjects.toStringHelper;

import circularlist.util.CircularLinkedList.Entry;
import java.util.Iterator;
import javax.annotation.Nullable;

/**
 * Position within a {@link CircularLinkedList}, shared by its mutable and read-only iterators.
 *
 * @param <T> - Element type of the list.
 * @param <I> - Concrete iterator type, returned by {@link #advance} and {@link #copy}.
 *
 * <p>An iterator is a view made of the current {@link Entry}, the head {@link Entry} of the list
 * at the time the iterator was created and a flag marking that a full cycle has been completed. It
 * owns no entries. Advancing onto the captured head sets the flag, after which the iterator can
 * neither be dereferenced nor advanced.</p>
 *
 * <p>Only the iterators returned by {@link CircularLinkedList#insertAfter} and
 * {@link CircularLinkedList#eraseAfter} are guaranteed to be usable after a structural change to
 * the list. Any other iterator may be stale, and stale iterators are not detected.</p>
 */
public abstract class AbstractCircularLinkedListIterator<
        T, I extends AbstractCircularLinkedListIterator<T, I>>
    implements Iterator<T> {

  /** Current {@link Entry}, {@code null} when iterating over an empty list. */
  @Nullable Entry<T> entry;

  /** Head {@link Entry} of the list when this iterator was created. */
  @Nullable final Entry<T> head;

  /** Set once traversal has come back around to {@code head}. */
  boolean isEnd;

  AbstractCircularLinkedListIterator(
      @Nullable Entry<T> entry, @Nullable Entry<T> head, boolean isEnd) {
    this.entry = entry;
    this.head = head;
    this.isEnd = isEnd;
  }

  /** Returns this iterator as its concrete type. */
  abstract I self();

  /** Returns an independent iterator at the same position. */
  public abstract I copy();

  /**
   * Returns the value of the current element.
   *
   * @throws InvalidIteratorException if the iterator references no element
   */
  public T get() {
    checkBound("Dereferencing invalid iterator");
    return entry.value;
  }

  /**
   * Moves to the next element, marking the iterator as ended when it returns to the head.
   *
   * @return this iterator
   * @throws InvalidIteratorException if the iterator references no element
   */
  public I advance() {
    checkBound("Advancing invalid iterator");
    entry = entry.next;
    if (entry == head) {
      isEnd = true;
    }
    return self();
  }

  /**
   * Moves to the next element and returns a copy of this iterator from before the move.
   *
   * @throws InvalidIteratorException if the iterator references no element
   */
  public I postAdvance() {
    checkBound("Advancing invalid iterator");
    I initial = copy();
    advance();
    return initial;
  }

  /** Whether this iterator has completed its cycle, or never had an element to start from. */
  public boolean isEnd() {
    return entry == null || isEnd;
  }

  @Override
  public boolean hasNext() {
    return !isEnd();
  }

  /** Returns the current value, then advances. */
  @Override
  public T next() {
    T value = get();
    advance();
    return value;
  }

  void checkBound(String message) {
    if (isEnd()) {
      throw new InvalidIteratorException(message);
    }
  }

  /**
   * Two iterators are equal when both are ended, or when they reference the same element and
   * agree on the end flag.
   */
  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AbstractCircularLinkedListIterator<?, ?> other = (AbstractCircularLinkedListIterator<?, ?>) o;
    if (isEnd() && other.isEnd()) {
      return true;
    }
    return entry == other.entry && isEnd == other.isEnd;
  }

  @Override
  public int hashCode() {
    return isEnd() ? 0 : System.identityHashCode(entry);
  }

  @Override
  public String toString() {
    return isEnd()
        ? toStringHelper(this).addValue("end").toString()
        : toStringHelper(this).add("value", entry.value).toString();
  }
}
