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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ConstCircularLinkedListIterator}. */
class ConstCircularLinkedListIteratorTest {

  @Test
  void testTraversal_cbeginToCend() {
    CircularLinkedList<String> letters = CircularLinkedList.of("x", "y", "z");
    List<String> results = new ArrayList<>();
    for (ConstCircularLinkedListIterator<String> it = letters.cbegin();
        !it.equals(letters.cend());
        it.advance()) {
      results.add(it.get());
    }
    assertThat(results).containsExactly("x", "y", "z").inOrder();
  }

  @Test
  void testGet_observesChangesMadeThroughList() {
    CircularLinkedList<String> letters = CircularLinkedList.of("b");
    ConstCircularLinkedListIterator<String> front = letters.cbegin();
    letters.pushFront("a");
    assertThat(front.get()).isEqualTo("a");
    letters.begin().set("c");
    assertThat(front.get()).isEqualTo("c");
  }

  @Test
  void testPostAdvance_returnsPreviousPosition() {
    CircularLinkedList<String> letters = CircularLinkedList.of("x", "y");
    ConstCircularLinkedListIterator<String> it = letters.cbegin();
    assertThat(it.postAdvance().get()).isEqualTo("x");
    assertThat(it.postAdvance().get()).isEqualTo("y");
    assertThat(it).isEqualTo(letters.cend());
  }

  @Test
  void testEmptyList_cbeginIsCend() {
    CircularLinkedList<String> empty = new CircularLinkedList<>();
    assertThat(empty.cbegin()).isEqualTo(empty.cend());
    assertThrows(InvalidIteratorException.class, () -> empty.cbegin().get());
  }

  @Test
  void testFailure_advancePastEnd() {
    CircularLinkedList<String> letters = CircularLinkedList.of("x");
    ConstCircularLinkedListIterator<String> it = letters.cbegin().advance();
    assertThat(it.isEnd()).isTrue();
    InvalidIteratorException thrown = assertThrows(InvalidIteratorException.class, it::advance);
    assertThat(thrown).hasMessageThat().isEqualTo("Advancing invalid iterator");
  }

  @Test
  void testEquals_notEqualToMutableIterator() {
    CircularLinkedList<String> letters = CircularLinkedList.of("x");
    assertThat(letters.cbegin()).isEqualTo(letters.cbegin());
    assertThat(letters.cbegin()).isNotEqualTo(letters.begin());
  }
}
