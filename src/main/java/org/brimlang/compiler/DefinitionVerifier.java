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

import java.util.HashMap;
import java.util.Map;
import org.brimlang.Ids.StreamId;
import org.brimlang.compiler.CompiledDefinition.AppSpec;
import org.brimlang.compiler.CompiledDefinition.ConstStream;
import org.brimlang.compiler.InvariantViolation.Kind;

/**
 * Consistency checks on a newly-built CompiledDefinition, enabled by {@link
 * Compiler.Options#withVerify}. These should never fail; a failure means the compiler itself has a
 * bug.
 *
 * <p>Only the definition's own streams are checked. Stream arguments that aren't defined in the
 * definition are assumed to come from an enclosing scope.
 */
final class DefinitionVerifier {

  private DefinitionVerifier() {}

  /**
   * Throws an InvariantViolation unless each stream is defined exactly once, and each application
   * only consumes streams defined by earlier applications (or by parameters and constants).
   */
  static void verify(CompiledDefinition definition) {
    // Maps each stream id to the index of the app that defines it, or -1 for parameters and
    // constants.
    Map<StreamId, Integer> definedAt = new HashMap<>();
    for (StreamId id : definition.streamParamIds) {
      define(definedAt, id, -1);
    }
    for (ConstStream c : definition.constStreams) {
      define(definedAt, c.id(), -1);
    }
    for (int i = 0; i < definition.apps.size(); i++) {
      for (StreamId id : definition.apps.get(i).outputs()) {
        define(definedAt, id, i);
      }
    }
    for (int i = 0; i < definition.apps.size(); i++) {
      AppSpec app = definition.apps.get(i);
      for (StreamId arg : app.streamArgs()) {
        Integer index = definedAt.get(arg);
        if (index != null && index >= i) {
          throw Compiler.violation(
              Kind.UNORDERED_APPLICATION, app.id(), "Consumes %s before it is defined", arg);
        }
      }
    }
  }

  private static void define(Map<StreamId, Integer> definedAt, StreamId id, int index) {
    if (definedAt.put(id, index) != null) {
      throw Compiler.violation(Kind.DUPLICATE_STREAM_ID, id, "Stream compiled twice");
    }
  }
}
