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
import static org.brimlang.compiler.TestTrees.GLOBALS;
import static org.brimlang.compiler.TestTrees.app;
import static org.brimlang.compiler.TestTrees.def;
import static org.brimlang.compiler.TestTrees.num;
import static org.brimlang.compiler.TestTrees.ref;
import static org.brimlang.compiler.TestTrees.sid;
import static org.brimlang.compiler.TestTrees.yieldAt;

import com.google.common.collect.ImmutableList;
import org.brimlang.Ids.FunctionId;
import org.brimlang.Ids.StreamId;
import org.brimlang.tree.FunctionDefinition;
import org.brimlang.tree.StreamExpression;
import org.brimlang.tree.TreeFunctionDefinition;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of how references from a nested scope to its enclosing scopes are reported. */
@RunWith(JUnit4.class)
public class ScopeCompilerTest {

  private final Environment<StreamId, StreamExpression> outerStreams = new Environment<>();
  private final Environment<FunctionId, FunctionDefinition> outerFunctions = new Environment<>();

  @Before
  public void setUp() {
    outerStreams.set(sid("x"), num("x", 1));
    outerStreams.set(sid("y"), num("y", 2));
    GLOBALS.forEach(outerFunctions::set);
  }

  private ScopeCompiler.Result compile(TreeFunctionDefinition definition) {
    return new ScopeCompiler(Compiler.Options.DEFAULT.withVerify(true))
        .compile(definition, outerStreams, outerFunctions);
  }

  @Test
  public void externalReference() {
    TreeFunctionDefinition g =
        def("g", ImmutableList.of("p"), 1, yieldAt(0, app("s", "add", ref("x"), ref("p"))));
    ScopeCompiler.Result result = compile(g);

    assertThat(result.externalStreamIds).containsExactly(sid("x"));
    assertThat(result.definition.apps.get(0).streamArgs())
        .containsExactly(sid("x"), sid("p"))
        .inOrder();
  }

  @Test
  public void shadowedReferenceIsNotExternal() {
    TreeFunctionDefinition g =
        def(
            "g",
            ImmutableList.of(),
            1,
            num("x", 5),
            yieldAt(0, app("s", "add", ref("x"), ref("y"))));
    ScopeCompiler.Result result = compile(g);

    assertThat(result.externalStreamIds).containsExactly(sid("y"));
  }

  @Test
  public void externalReferenceFromNestedScope() {
    // h refers to x (from outside g) and to z (defined by g).
    TreeFunctionDefinition h =
        def("h", ImmutableList.of(), 1, yieldAt(0, app("s", "add", ref("x"), ref("z"))));
    TreeFunctionDefinition g =
        def("g", ImmutableList.of(), 1, num("z", 3), h, yieldAt(0, ref("z")));
    ScopeCompiler.Result result = compile(g);

    assertThat(result.externalStreamIds).containsExactly(sid("x"));
    assertThat(result.definition.apps).isEmpty();
    assertThat(result.definition.localDefs.get(0).definition().apps).hasSize(1);
  }

  @Test
  public void closedScope() {
    TreeFunctionDefinition g =
        def("g", ImmutableList.of("p"), 1, yieldAt(0, app("s", "cos", ref("p"))));
    assertThat(compile(g).externalStreamIds).isEmpty();
  }
}
