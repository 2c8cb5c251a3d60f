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

package org.brimlang.compiler;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.NoSuchElementException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EnvironmentTest {

  @Test
  public void lookupFallsBackToParent() {
    Environment<String, Integer> outer = new Environment<>();
    outer.set("a", 1);
    Environment<String, Integer> inner = new Environment<>(outer);
    inner.set("b", 2);

    assertThat(inner.has("a")).isTrue();
    assertThat(inner.hasLocal("a")).isFalse();
    assertThat(inner.get("a")).isEqualTo(1);
    assertThat(inner.get("b")).isEqualTo(2);
    // Bindings in a child are not visible from its parent.
    assertThat(outer.has("b")).isFalse();
  }

  @Test
  public void shadowing() {
    Environment<String, Integer> outer = new Environment<>();
    outer.set("a", 1);
    Environment<String, Integer> inner = new Environment<>(outer);
    inner.set("a", 2);

    assertThat(inner.get("a")).isEqualTo(2);
    assertThat(outer.get("a")).isEqualTo(1);
  }

  @Test
  public void duplicateInSameFrame() {
    Environment<String, Integer> env = new Environment<>();
    env.set("a", 1);
    assertThrows(IllegalStateException.class, () -> env.set("a", 2));
    assertThat(env.get("a")).isEqualTo(1);
  }

  @Test
  public void nullValueIsPresent() {
    Environment<String, Integer> outer = new Environment<>();
    outer.set("p", null);
    Environment<String, Integer> inner = new Environment<>(outer);

    assertThat(inner.has("p")).isTrue();
    assertThat(inner.get("p")).isNull();
    assertThrows(IllegalStateException.class, () -> outer.set("p", 3));
  }

  @Test
  public void missingKey() {
    Environment<String, Integer> env = new Environment<>(new Environment<>());
    assertThat(env.has("x")).isFalse();
    NoSuchElementException e = assertThrows(NoSuchElementException.class, () -> env.get("x"));
    assertThat(e).hasMessageThat().isEqualTo("x");
  }
}
