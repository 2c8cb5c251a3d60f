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
import static org.brimlang.compiler.TestTrees.aid;
import static org.brimlang.compiler.TestTrees.fid;
import static org.brimlang.compiler.TestTrees.sid;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.brimlang.compiler.CompiledDefinition.AppSpec;
import org.brimlang.compiler.CompiledDefinition.ConstStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DefinitionVerifierTest {

  private static AppSpec cos(String out, String arg) {
    return new AppSpec(
        ImmutableList.of(sid(out)),
        aid(out),
        fid("cos"),
        ImmutableList.of(sid(arg)),
        ImmutableList.of());
  }

  private static CompiledDefinition definition(
      ImmutableList<ConstStream> consts, ImmutableList<AppSpec> apps) {
    return new CompiledDefinition(
        ImmutableList.of(sid("p")),
        ImmutableList.of(),
        consts,
        apps,
        ImmutableList.of(),
        ImmutableList.of());
  }

  @Test
  public void ordered() {
    DefinitionVerifier.verify(
        definition(
            ImmutableList.of(new ConstStream(sid("k"), 1.0)),
            ImmutableList.of(cos("a", "k"), cos("b", "a"), cos("c", "p"), cos("d", "outside"))));
  }

  @Test
  public void unordered() {
    InvariantViolation e =
        assertThrows(
            InvariantViolation.class,
            () ->
                DefinitionVerifier.verify(
                    definition(
                        ImmutableList.of(), ImmutableList.of(cos("b", "a"), cos("a", "p")))));
    assertThat(e.kind).isEqualTo(InvariantViolation.Kind.UNORDERED_APPLICATION);
    assertThat(e.subject).isEqualTo("A-b");
  }

  @Test
  public void selfDependent() {
    InvariantViolation e =
        assertThrows(
            InvariantViolation.class,
            () ->
                DefinitionVerifier.verify(
                    definition(ImmutableList.of(), ImmutableList.of(cos("a", "a")))));
    assertThat(e.kind).isEqualTo(InvariantViolation.Kind.UNORDERED_APPLICATION);
  }

  @Test
  public void constantShadowsParameter() {
    InvariantViolation e =
        assertThrows(
            InvariantViolation.class,
            () ->
                DefinitionVerifier.verify(
                    definition(
                        ImmutableList.of(new ConstStream(sid("p"), null)), ImmutableList.of())));
    assertThat(e.kind).isEqualTo(InvariantViolation.Kind.DUPLICATE_STREAM_ID);
    assertThat(e.subject).isEqualTo("S-p");
  }

  @Test
  public void outputDefinedTwice() {
    InvariantViolation e =
        assertThrows(
            InvariantViolation.class,
            () ->
                DefinitionVerifier.verify(
                    definition(
                        ImmutableList.of(), ImmutableList.of(cos("a", "p"), cos("a", "p")))));
    assertThat(e.kind).isEqualTo(InvariantViolation.Kind.DUPLICATE_STREAM_ID);
  }
}
