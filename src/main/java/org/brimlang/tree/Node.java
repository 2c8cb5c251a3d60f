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
 * A node of a program tree. Trees are immutable and persistent: the editor replaces nodes rather
 * than mutating them, so a node's identity is stable for as long as that node is part of the tree.
 *
 * <p>Node classes do not override {@code equals()}; the compiler relies on identity to tell two
 * structurally identical subexpressions apart.
 */
public interface Node {}
