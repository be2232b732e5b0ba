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

/** Whether the function's stack frame is set up at a given point on one execution path. */
public enum FrameState {
  NO_PROLOGUE_ON_STACK,
  PROLOGUE_ON_STACK;

  /** This state's bit in a {@link FrameStateSet}. */
  int bit() {
    return 1 << ordinal();
  }
}
