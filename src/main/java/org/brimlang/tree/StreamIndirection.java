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
import org.brimlang.Ids.StreamId;
import org.jspecify.annotations.Nullable;

/**
 * A named pass-through: defines a new stream id whose value is always the value of the wrapped
 * expression. The editor uses indirections to give a description to an intermediate value.
 */
public final class StreamIndirection extends StreamExpression {
  public final StreamId id;

  /** Optional user-supplied text describing this stream. */
  public final @Nullable String description;

  public final StreamExpression expression;

  public StreamIndirection(
      StreamId id, @Nullable String description, StreamExpression expression) {
    this.id = Preconditions.checkNotNull(id);
    this.description = description;
    this.expression = Preconditions.checkNotNull(expression);
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitIndirection(this);
  }

  @Override
  public String toString() {
    return id + "=(" + expression + ")";
  }
}
