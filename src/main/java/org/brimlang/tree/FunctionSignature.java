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

/**
 * The interface of a function: the names of its stream parameters, its function parameters (each
 * with a signature of its own), and its yields (outputs).
 *
 * <p>The compiler only uses the number of yields, to check that a tree definition's yields are
 * fully populated; parameter names are for the editor.
 */
public final class FunctionSignature {
  public final ImmutableList<String> streamParams;
  public final ImmutableList<FunctionParam> functionParams;
  public final ImmutableList<String> yields;

  public FunctionSignature(
      List<String> streamParams, List<FunctionParam> functionParams, List<String> yields) {
    this.streamParams = ImmutableList.copyOf(streamParams);
    this.functionParams = ImmutableList.copyOf(functionParams);
    this.yields = ImmutableList.copyOf(yields);
  }

  /**
   * Returns a signature with the given stream parameters, no function parameters, and either a
   * single unnamed yield or none.
   */
  public static FunctionSignature simple(boolean yields, String... streamParams) {
    return new FunctionSignature(
        ImmutableList.copyOf(streamParams),
        ImmutableList.of(),
        yields ? ImmutableList.of("") : ImmutableList.of());
  }

  public int numYields() {
    return yields.size();
  }

  /** A named function parameter and the signature of the functions it accepts. */
  public static final class FunctionParam {
    public final String name;
    public final FunctionSignature signature;

    public FunctionParam(String name, FunctionSignature signature) {
      this.name = Preconditions.checkNotNull(name);
      this.signature = Preconditions.checkNotNull(signature);
    }
  }
}
