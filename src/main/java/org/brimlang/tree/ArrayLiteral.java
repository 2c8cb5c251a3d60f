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
import org.brimlang.Ids.StreamId;

/**
 * An array literal defines a stream whose value is an array of its elements' values. It is sugar
 * for an application of the builtin array constructor.
 */
public final class ArrayLiteral extends StreamExpression {
  public final StreamId id;
  public final ImmutableList<StreamExpression> elements;

  public ArrayLiteral(StreamId id, List<? extends StreamExpression> elements) {
    this.id = Preconditions.checkNotNull(id);
    this.elements = ImmutableList.copyOf(elements);
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitArray(this);
  }

  @Override
  public String toString() {
    return id + "=" + elements;
  }
}
