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

package org.brimlang;

import com.google.common.base.Preconditions;

/**
 * The Ids class is just a namespace for the three kinds of identifier used in a program tree.
 *
 * <p>Identifiers are opaque, globally unique strings. Each kind has a distinct prefix ({@code
 * "S-"}, {@code "F-"}, or {@code "A-"}) so that the text of an id is enough to tell which
 * namespace it belongs to. Ids are created once, when the node that owns them is constructed (see
 * {@link IdGenerator}); the compiler never creates or renames user-visible ids.
 */
public class Ids {

  // Just a namespace for the contained types.
  private Ids() {}

  public static final String STREAM_ID_PREFIX = "S-";
  public static final String FUNCTION_ID_PREFIX = "F-";
  public static final String APPLICATION_ID_PREFIX = "A-";

  /** Returns true if {@code s} has the form of a stream id. */
  public static boolean isStreamId(String s) {
    return s.startsWith(STREAM_ID_PREFIX) && s.length() > STREAM_ID_PREFIX.length();
  }

  /** Returns true if {@code s} has the form of a function id. */
  public static boolean isFunctionId(String s) {
    return s.startsWith(FUNCTION_ID_PREFIX) && s.length() > FUNCTION_ID_PREFIX.length();
  }

  /** Returns true if {@code s} has the form of an application id. */
  public static boolean isApplicationId(String s) {
    return s.startsWith(APPLICATION_ID_PREFIX) && s.length() > APPLICATION_ID_PREFIX.length();
  }

  /** Identifies a single stream, i.e. one value-producing slot in the dataflow graph. */
  public record StreamId(String text) {
    public StreamId {
      Preconditions.checkArgument(isStreamId(text), "Not a stream id: %s", text);
    }

    public static StreamId of(String text) {
      return new StreamId(text);
    }

    @Override
    public String toString() {
      return text;
    }
  }

  /** Identifies a function, whether defined in the tree or supplied natively. */
  public record FunctionId(String text) {
    public FunctionId {
      Preconditions.checkArgument(isFunctionId(text), "Not a function id: %s", text);
    }

    public static FunctionId of(String text) {
      return new FunctionId(text);
    }

    @Override
    public String toString() {
      return text;
    }
  }

  /** Identifies one application (function call) node. */
  public record ApplicationId(String text) {
    public ApplicationId {
      Preconditions.checkArgument(isApplicationId(text), "Not an application id: %s", text);
    }

    public static ApplicationId of(String text) {
      return new ApplicationId(text);
    }

    @Override
    public String toString() {
      return text;
    }
  }
}
