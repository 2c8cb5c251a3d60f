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

import org.brimlang.Ids.StreamId;
import org.jspecify.annotations.Nullable;

/** A static-only class with helpers for examining program trees. */
public class Nodes {

  private Nodes() {}

  /**
   * Returns the id of the stream that represents the value of {@code expression}: its own id for a
   * literal, array or indirection, the target id for a reference, and the first unnamed output of
   * an application. Returns null for an application with no unnamed output.
   */
  public static @Nullable StreamId returnedStreamId(StreamExpression expression) {
    return expression.accept(RETURNED_ID);
  }

  private static final StreamExpression.Visitor<@Nullable StreamId> RETURNED_ID =
      new StreamExpression.Visitor<@Nullable StreamId>() {
        @Override
        public StreamId visitUndefined(UndefinedLiteral node) {
          return node.id;
        }

        @Override
        public StreamId visitNumber(NumberLiteral node) {
          return node.id;
        }

        @Override
        public StreamId visitText(TextLiteral node) {
          return node.id;
        }

        @Override
        public StreamId visitBoolean(BooleanLiteral node) {
          return node.id;
        }

        @Override
        public StreamId visitArray(ArrayLiteral node) {
          return node.id;
        }

        @Override
        public StreamId visitIndirection(StreamIndirection node) {
          return node.id;
        }

        @Override
        public StreamId visitReference(StreamReference node) {
          return node.target;
        }

        @Override
        public @Nullable StreamId visitApplication(Application node) {
          // Named outputs are referred to by id; the value of the expression itself is the
          // first output without a name.
          for (Application.Out out : node.outs) {
            if (out.name == null) {
              return out.id;
            }
          }
          return null;
        }
      };
}
