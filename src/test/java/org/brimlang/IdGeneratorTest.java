/*
 * Copyright 2025 The Brim Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.brimlang;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.HashSet;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IdGeneratorTest {

  @Test
  public void sequential() {
    IdGenerator ids = IdGenerator.sequential("n");
    assertThat(ids.newStreamId().text()).isEqualTo("S-n1");
    assertThat(ids.newFunctionId().text()).isEqualTo("F-n2");
    assertThat(ids.newApplicationId().text()).isEqualTo("A-n3");
    // A new generator starts over.
    assertThat(IdGenerator.sequential("n").nextUid()).isEqualTo("n1");
  }

  @Test
  public void emptyTag() {
    assertThrows(IllegalArgumentException.class, () -> IdGenerator.sequential(""));
  }

  @Test
  public void random() {
    IdGenerator ids = IdGenerator.random();
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 1000; i++) {
      String uid = ids.nextUid();
      assertThat(uid).matches("[0-9a-z]+");
      assertThat(seen.add(uid)).isTrue();
    }
    assertThat(Ids.isStreamId(ids.newStreamId().text())).isTrue();
  }
}
