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

package org.brimlang.natives;

import java.util.ArrayList;
import java.util.Collections;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import org.brimlang.compiler.Builtins;
import org.brimlang.tree.FunctionSignature;
import org.brimlang.tree.NativeFunctionDefinition;
import org.jspecify.annotations.Nullable;

/**
 * The native functions available to every program: the builtins that the compiler targets when it
 * desugars array literals and indirections, plus a small library of pure functions.
 *
 * <p>Arithmetic functions treat their arguments as doubles; if any argument is undefined (null)
 * the result is undefined.
 */
public final class StandardNatives {

  private StandardNatives() {}

  /** Returns a new registry containing all the standard natives. */
  public static NativeRegistry create() {
    return addTo(NativeRegistry.builder()).build();
  }

  /** Adds all the standard natives to {@code builder} and returns it. */
  public static NativeRegistry.Builder addTo(NativeRegistry.Builder builder) {
    // Arrays take any number of elements, so their signature lists no parameters.
    builder.add(
        new NativeFunction(
            new NativeFunctionDefinition(Builtins.ARRAY, FunctionSignature.simple(true)),
            "array",
            args -> Collections.unmodifiableList(new ArrayList<>(args))));
    builder.add(
        new NativeFunction(
            new NativeFunctionDefinition(Builtins.IDENTITY, FunctionSignature.simple(true, "_v")),
            "identity",
            args -> args.get(0)));
    builder.define(
        "ifte",
        "if",
        FunctionSignature.simple(true, "cond", "then", "else"),
        args -> isTruthy(args.get(0)) ? args.get(1) : args.get(2));
    builder.define("add", "add", binarySignature(), binary((a, b) -> a + b));
    builder.define("sub", "subtract", binarySignature(), binary((a, b) -> a - b));
    builder.define("mult", "multiply", binarySignature(), binary((a, b) -> a * b));
    builder.define("div", "divide", binarySignature(), binary((a, b) -> a / b));
    builder.define("cos", "cosine", FunctionSignature.simple(true, "_v"), unary(Math::cos));
    return builder;
  }

  private static FunctionSignature binarySignature() {
    return FunctionSignature.simple(true, "_a", "_b");
  }

  private static boolean isTruthy(@Nullable Object value) {
    if (value == null) {
      return false;
    } else if (value instanceof Boolean b) {
      return b;
    } else if (value instanceof Number n) {
      double d = n.doubleValue();
      return d != 0 && !Double.isNaN(d);
    } else if (value instanceof String s) {
      return !s.isEmpty();
    }
    return true;
  }

  private static NativeFunction.Impl unary(DoubleUnaryOperator op) {
    return args -> {
      Object a = args.get(0);
      return (a instanceof Number na) ? op.applyAsDouble(na.doubleValue()) : null;
    };
  }

  private static NativeFunction.Impl binary(DoubleBinaryOperator op) {
    return args -> {
      Object a = args.get(0);
      Object b = args.get(1);
      if (a instanceof Number na && b instanceof Number nb) {
        return op.applyAsDouble(na.doubleValue(), nb.doubleValue());
      }
      return null;
    };
  }
}
