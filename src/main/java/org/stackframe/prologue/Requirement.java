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
 * What an instruction needs from the stack frame, as determined by {@link
 * InstructionRequirements}.
 */
public enum Requirement {
  /**
   * The instruction does not use the stack, so it doesn't matter whether there's a prologue on the
   * stack or not.
   */
  NO_REQUIREMENTS,

  /**
   * The instruction uses the stack, either through stack slots or as a call, and hence requires a
   * prologue to already be on the stack.
   */
  REQUIRES_PROLOGUE,

  /**
   * The instruction must only execute when there's no prologue on the stack: either on a path that
   * never had one, or after the epilogue. This is the case for returns and for tail calls to other
   * functions. Only terminators have this requirement.
   */
  REQUIRES_NO_PROLOGUE,

  /** The instruction is the frame setup marker itself. Only body instructions can be this. */
  PROLOGUE,

  /** The instruction is the frame teardown marker itself. Only body instructions can be this. */
  EPILOGUE
}
