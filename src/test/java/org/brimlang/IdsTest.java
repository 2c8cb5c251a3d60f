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
import org.brimlang.Ids.ApplicationId;
import org.brimlang.Ids.FunctionId;
import org.brimlang.Ids.StreamId;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IdsTest {

  @Test
  public void prefixes() {
    assertThat(Ids.isStreamId("S-x")).isTrue();
    assertThat(Ids.isStreamId("F-x")).isFalse();
    assertThat(Ids.isStreamId("S-")).isFalse();
    assertThat(Ids.isFunctionId("F-add")).isTrue();
    assertThat(Ids.isFunctionId("add")).isFalse();
    assertThat(Ids.isApplicationId("A-1")).isTrue();
    assertThat(Ids.isApplicationId("S-1")).isFalse();
  }

  @Test
  public void wrongPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> StreamId.of("F-x"));
    assertThrows(IllegalArgumentException.class, () -> FunctionId.of("S-x"));
    assertThrows(IllegalArgumentException.class, () -> ApplicationId.of("x"));
  }

  @Test
  public void valueSemantics() {
    assertThat(StreamId.of("S-x")).isEqualTo(StreamId.of("S-x"));
    assertThat(StreamId.of("S-x").toString()).isEqualTo("S-x");
    Set<Object> ids = new HashSet<>();
    ids.add(StreamId.of("S-x"));
    ids.add(StreamId.of("S-x"));
    ids.add(FunctionId.of("F-x"));
    assertThat(ids).hasSize(2);
  }
}
