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

import org.jspecify.annotations.Nullable;
import org.stackframe.cfg.Instruction;
import org.stackframe.cfg.InstructionId;

/**
 * Thrown when the prologue pass finds a Cfg that breaks one of its rules. Every such case is a bug
 * in an earlier pass (or in this one), so there is no attempt to recover; the compilation of the
 * function is abandoned.
 */
public class PrologueError extends RuntimeException {

  /** The rules that can be broken. */
  public enum Violation {
    PRECONDITION("Cfg contains prologue/epilogue before the prologue pass"),
    EPILOGUE_WITHOUT_PROLOGUE("epilogue appears without a prologue on the stack"),
    NEEDS_PROLOGUE("instruction needs prologue but no prologue on the stack"),
    DUPLICATE_PROLOGUE("prologue appears while prologue is already on the stack"),
    BASIC_REQUIRES_NO_PROLOGUE("basic instruction requires no prologue, this should never happen"),
    PROLOGUE_NOT_REMOVED("terminator must occur after an epilogue but prologue is on the stack"),
    DATAFLOW_FAILED("dataflow analysis failed");

    final String description;

    Violation(String description) {
      this.description = description;
    }

    public String description() {
      return description;
    }
  }

  private final Violation violation;
  private final @Nullable InstructionId instructionId;

  private PrologueError(
      Violation violation, @Nullable InstructionId instructionId, String message) {
    super(message);
    this.violation = violation;
    this.instructionId = instructionId;
  }

  /** Returns a PrologueError for a rule broken by the given instruction. */
  static PrologueError atInstruction(Violation violation, Instruction<?> instr) {
    return new PrologueError(
        violation,
        instr.id(),
        String.format(
            "Prologue pass: error validating instruction %s: %s",
            instr.id().toStringPadded(), violation.description));
  }

  /** Returns a PrologueError for a failure that is not attributable to a single instruction. */
  static PrologueError forFunction(Violation violation, String functionName) {
    return new PrologueError(
        violation,
        null,
        String.format("Prologue pass: %s in %s", violation.description, functionName));
  }

  public Violation violation() {
    return violation;
  }

  /** The offending instruction, or null if the failure is not specific to one instruction. */
  public @Nullable InstructionId instructionId() {
    return instructionId;
  }
}
