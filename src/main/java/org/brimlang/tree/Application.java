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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.brimlang.Ids.ApplicationId;
import org.brimlang.Ids.FunctionId;
import org.brimlang.Ids.StreamId;
import org.jspecify.annotations.Nullable;

/**
 * An application of a function to stream and function arguments. An application defines one
 * stream id for each output declared by the applied function's signature.
 */
public final class Application extends StreamExpression {
  public final ApplicationId id;

  /** The function being applied. */
  public final FunctionId function;

  public final ImmutableList<StreamExpression> streamArgs;
  public final ImmutableList<FunctionExpression> functionArgs;
  public final ImmutableList<Out> outs;

  public Application(
      ApplicationId id,
      FunctionId function,
      List<? extends StreamExpression> streamArgs,
      List<? extends FunctionExpression> functionArgs,
      List<Out> outs) {
    this.id = Preconditions.checkNotNull(id);
    this.function = Preconditions.checkNotNull(function);
    this.streamArgs = ImmutableList.copyOf(streamArgs);
    this.functionArgs = ImmutableList.copyOf(functionArgs);
    this.outs = ImmutableList.copyOf(outs);
  }

  /**
   * One output of an application. An output that the user has given a local name can be referred
   * to elsewhere by its id; the first unnamed output is the value of the application expression
   * itself.
   */
  public static final class Out {
    public final StreamId id;
    public final @Nullable String name;

    public Out(StreamId id, @Nullable String name) {
      this.id = Preconditions.checkNotNull(id);
      this.name = name;
    }

    @Override
    public String toString() {
      return (name == null) ? id.toString() : id + ":" + name;
    }
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitApplication(this);
  }

  @Override
  public String toString() {
    return String.format("%s=%s%s(%s)", outs, function, streamArgs, functionArgs);
  }
}
