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

package org.stackframe.cfg;

/**
 * Source position attached to an {@link Instruction}. Does not affect the semantics of the
 * instruction, but is copied onto instructions synthesized from it so that diagnostics and debug
 * info still point somewhere sensible.
 */
public record DebugLocation(String file, int line) {

  /** Used for instructions with no known source position. */
  public static final DebugLocation NONE = new DebugLocation("", 0);

  public boolean isNone() {
    return file.isEmpty() && line == 0;
  }

  @Override
  public String toString() {
    return isNone() ? "" : file + ":" + line;
  }
}
