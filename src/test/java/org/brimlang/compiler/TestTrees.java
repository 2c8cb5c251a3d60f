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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import org.brimlang.Ids.ApplicationId;
import org.brimlang.Ids.FunctionId;
import org.brimlang.Ids.StreamId;
import org.brimlang.natives.StandardNatives;
import org.brimlang.tree.Application;
import org.brimlang.tree.ArrayLiteral;
import org.brimlang.tree.BodyExpression;
import org.brimlang.tree.FunctionExpression;
import org.brimlang.tree.FunctionReference;
import org.brimlang.tree.FunctionSignature;
import org.brimlang.tree.NativeFunctionDefinition;
import org.brimlang.tree.NumberLiteral;
import org.brimlang.tree.StreamExpression;
import org.brimlang.tree.StreamIndirection;
import org.brimlang.tree.StreamReference;
import org.brimlang.tree.TreeFunctionDefinition;
import org.brimlang.tree.YieldExpression;

/**
 * Static helpers for building program trees in tests. Ids are given by name without their prefix,
 * e.g. {@code num("x", 3)} is a number literal with stream id {@code S-x}.
 */
final class TestTrees {

  private TestTrees() {}

  /** The standard natives, plus {@link #DIVMOD} and {@link #MAP}. */
  static final ImmutableMap<FunctionId, NativeFunctionDefinition> GLOBALS;

  /** A native with two stream parameters and two yields (quotient and remainder). */
  static final NativeFunctionDefinition DIVMOD =
      new NativeFunctionDefinition(
          fid("divmod"),
          new FunctionSignature(
              ImmutableList.of("_a", "_b"), ImmutableList.of(), ImmutableList.of("", "rem")));

  /** A native with one stream parameter (an array) and one function parameter. */
  static final NativeFunctionDefinition MAP =
      new NativeFunctionDefinition(
          fid("map"),
          new FunctionSignature(
              ImmutableList.of("array"),
              ImmutableList.of(
                  new FunctionSignature.FunctionParam(
                      "transform", FunctionSignature.simple(true, "value"))),
              ImmutableList.of("")));

  static {
    ImmutableMap.Builder<FunctionId, NativeFunctionDefinition> builder = ImmutableMap.builder();
    builder.putAll(StandardNatives.create().definitions());
    builder.put(DIVMOD.id, DIVMOD);
    builder.put(MAP.id, MAP);
    GLOBALS = builder.buildOrThrow();
  }

  static StreamId sid(String name) {
    return StreamId.of("S-" + name);
  }

  static FunctionId fid(String name) {
    return FunctionId.of("F-" + name);
  }

  static ApplicationId aid(String name) {
    return ApplicationId.of("A-" + name);
  }

  static NumberLiteral num(String id, double value) {
    return new NumberLiteral(sid(id), value);
  }

  static StreamReference ref(String id) {
    return new StreamReference(sid(id));
  }

  static FunctionReference fref(String id) {
    return new FunctionReference(fid(id));
  }

  static ArrayLiteral array(String id, StreamExpression... elements) {
    return new ArrayLiteral(sid(id), Arrays.asList(elements));
  }

  static StreamIndirection indirect(String id, StreamExpression expression) {
    return new StreamIndirection(sid(id), null, expression);
  }

  /**
   * Returns an application of {@code function} with a single unnamed output {@code out}; its
   * application id is {@code "A-" + out}.
   */
  static Application app(String out, String function, StreamExpression... args) {
    return new Application(
        aid(out),
        fid(function),
        Arrays.asList(args),
        ImmutableList.of(),
        ImmutableList.of(new Application.Out(sid(out), null)));
  }

  /** Like {@link #app(String, String, StreamExpression...)}, with function arguments. */
  static Application app(
      String out,
      String function,
      List<? extends StreamExpression> args,
      List<? extends FunctionExpression> functionArgs) {
    return new Application(
        aid(out),
        fid(function),
        args,
        functionArgs,
        ImmutableList.of(new Application.Out(sid(out), null)));
  }

  static Application.Out out(String id, String name) {
    return new Application.Out(sid(id), name);
  }

  static YieldExpression yieldAt(int index, StreamExpression expression) {
    return new YieldExpression(index, expression);
  }

  /** Returns a definition with the given stream parameters and number of yields. */
  static TreeFunctionDefinition def(
      String id, List<String> streamParams, int numYields, BodyExpression... body) {
    return def(id, streamParams, ImmutableList.of(), numYields, body);
  }

  static TreeFunctionDefinition def(
      String id,
      List<String> streamParams,
      List<String> functionParams,
      int numYields,
      BodyExpression... body) {
    FunctionSignature signature =
        new FunctionSignature(
            streamParams,
            functionParams.stream()
                .map(p -> new FunctionSignature.FunctionParam(p, FunctionSignature.simple(true)))
                .collect(ImmutableList.toImmutableList()),
            yieldNames(numYields));
    return new TreeFunctionDefinition(
        fid(id),
        signature,
        streamParams.stream().map(TestTrees::sid).collect(ImmutableList.toImmutableList()),
        functionParams.stream().map(TestTrees::fid).collect(ImmutableList.toImmutableList()),
        Arrays.asList(body));
  }

  /** Returns a main definition (no parameters) with the given number of yields. */
  static TreeFunctionDefinition main(int numYields, BodyExpression... body) {
    return def("main", ImmutableList.of(), numYields, body);
  }

  private static ImmutableList<String> yieldNames(int numYields) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (int i = 0; i < numYields; i++) {
      builder.add("out" + i);
    }
    return builder.build();
  }
}
