/*
 * Copyright 2025 The Stackframe Authors
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

package org.stackframe.prologue;

/**
 * The target's rule for whether a function needs a stack frame at all, given only facts that are
 * known before any prologue is inserted.
 */
@FunctionalInterface
public interface FramePolicy {

  boolean prologueRequired(boolean containsCalls, int numStackSlots);

  /** A frame is needed by functions that make calls or that have stack slots. */
  FramePolicy DEFAULT = (containsCalls, numStackSlots) -> containsCalls || numStackSlots > 0;

  /** Every function gets a frame; used when frame pointers are enabled. */
  FramePolicy ALWAYS = (containsCalls, numStackSlots) -> true;

  static FramePolicy forFramePointers(boolean framePointers) {
    return framePointers ? ALWAYS : DEFAULT;
  }
}
