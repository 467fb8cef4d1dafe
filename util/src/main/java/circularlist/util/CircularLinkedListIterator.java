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

import circularlist.util.CircularLinkedList.Entry;
import javax.annotation.Nullable;

/**
 * Iterator of a {@link CircularLinkedList} that can replace the value of the element it references.
 *
 * <p>It is also the position type taken by {@link CircularLinkedList#insertAfter} and
 * {@link CircularLinkedList#eraseAfter}.</p>
 *
 * @param <T> - Element type of the list.
 */
public final class CircularLinkedListIterator<T>
    extends AbstractCircularLinkedListIterator<T, CircularLinkedListIterator<T>> {

  CircularLinkedListIterator(@Nullable Entry<T> entry, @Nullable Entry<T> head, boolean isEnd) {
    super(entry, head, isEnd);
  }

  /**
   * Replaces the value of the current element.
   *
   * <p>Every other iterator referencing the same element observes the new value.</p>
   *
   * @throws InvalidIteratorException if the iterator references no element
   */
  public void set(@Nullable T value) {
    checkBound("Dereferencing invalid iterator");
    entry.value = value;
  }

  @Override
  CircularLinkedListIterator<T> self() {
    return this;
  }

  @Override
  public CircularLinkedListIterator<T> copy() {
    return new CircularLinkedListIterator<>(entry, head, isEnd);
  }
}
