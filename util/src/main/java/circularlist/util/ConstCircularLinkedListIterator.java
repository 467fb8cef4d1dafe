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
 * Read-only iterator of a {@link CircularLinkedList}.
 *
 * @param <T> - Element type of the list.
 */
public final class ConstCircularLinkedListIterator<T>
    extends AbstractCircularLinkedListIterator<T, ConstCircularLinkedListIterator<T>> {

  ConstCircularLinkedListIterator(
      @Nullable Entry<T> entry, @Nullable Entry<T> head, boolean isEnd) {
    super(entry, head, isEnd);
  }

  @Override
  ConstCircularLinkedListIterator<T> self() {
    return this;
  }

  @Override
  public ConstCircularLinkedListIterator<T> copy() {
    return new ConstCircularLinkedListIterator<>(entry, head, isEnd);
  }
}
