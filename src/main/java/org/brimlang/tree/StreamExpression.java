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

/**
 * A StreamExpression is a node whose value is a stream. Most stream expressions also define one or
 * more stream ids; a {@link StreamReference} instead consumes an id defined elsewhere.
 *
 * <p>The set of stream expression kinds is closed: each kind has a corresponding method in {@link
 * Visitor}, so adding a kind forces every visitor to handle it.
 */
public abstract class StreamExpression implements BodyExpression {

  // Subclasses are all in this package.
  StreamExpression() {}

  public abstract <T> T accept(Visitor<T> visitor);

  @Override
  public final <T> T accept(BodyExpression.Visitor<T> visitor) {
    return visitor.visitStreamExpression(this);
  }

  /** A Visitor has one method for each kind of stream expression. */
  public interface Visitor<T> {
    T visitUndefined(UndefinedLiteral node);

    T visitNumber(NumberLiteral node);

    T visitText(TextLiteral node);

    T visitBoolean(BooleanLiteral node);

    T visitArray(ArrayLiteral node);

    T visitIndirection(StreamIndirection node);

    T visitReference(StreamReference node);

    T visitApplication(Application node);
  }
}
