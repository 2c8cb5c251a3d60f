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

package org.brimlang.tree;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.brimlang.Ids.FunctionId;
import org.brimlang.Ids.StreamId;

/**
 * A function whose body is a list of body expressions in the tree. The body is a scope: the stream
 * and function parameter ids are visible within it, as is everything defined by its body
 * expressions (but not within the bodies of nested definitions).
 *
 * <p>A program's main definition is a TreeFunctionDefinition.
 */
public final class TreeFunctionDefinition extends FunctionDefinition {
  /** The ids by which the body refers to its stream parameters, in parameter order. */
  public final ImmutableList<StreamId> streamParams;

  /** The ids by which the body refers to its function parameters, in parameter order. */
  public final ImmutableList<FunctionId> functionParams;

  public final ImmutableList<BodyExpression> body;

  public TreeFunctionDefinition(
      FunctionId id,
      FunctionSignature signature,
      List<StreamId> streamParams,
      List<FunctionId> functionParams,
      List<? extends BodyExpression> body) {
    super(id, signature);
    this.streamParams = ImmutableList.copyOf(streamParams);
    this.functionParams = ImmutableList.copyOf(functionParams);
    this.body = ImmutableList.copyOf(body);
  }

  @Override
  public String toString() {
    return String.format("def %s(%s; %s) %s", id, streamParams, functionParams, body);
  }
}
