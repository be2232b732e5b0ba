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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.stackframe.cfg.BasicBlock;
import org.stackframe.cfg.BasicOp;
import org.stackframe.cfg.Cfg;
import org.stackframe.cfg.CfgPrinter;
import org.stackframe.cfg.Instruction;

/**
 * The prologue pass. Given the Cfg of a function whose registers have been allocated, decides
 * whether the function needs a stack frame and if so inserts a {@link BasicOp#PROLOGUE} at the
 * start of the entry block and a {@link BasicOp#EPILOGUE} before each return or tail call to
 * another function. A later stage turns these markers into target code.
 *
 * <p>The lifecycle of a CfgPrologue is
 *
 * <ul>
 *   <li>Create it with the {@link Options} for this compilation.
 *   <li>Call {@link #run} once for each function.
 * </ul>
 *
 * <p>Any problem found is reported by throwing a {@link PrologueError}.
 */
public final class CfgPrologue {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /**
   * Settings for the pass.
   *
   * @param validate if true, {@link #run} checks its result with {@link PrologueValidator}
   * @param policy decides which functions need a frame
   */
  public record Options(boolean validate, FramePolicy policy) {

    /** The system property that sets {@link #validate}. */
    public static final String VALIDATE_PROPERTY = "stackframe.prologue.validate";

    /** The system property that selects {@link FramePolicy#ALWAYS} when true. */
    public static final String FRAME_POINTERS_PROPERTY = "stackframe.prologue.framePointers";

    public static final Options DEFAULT = new Options(true, FramePolicy.DEFAULT);

    public Options {
      Preconditions.checkNotNull(policy);
    }

    /**
     * Returns Options determined by the {@link #VALIDATE_PROPERTY} (default true) and {@link
     * #FRAME_POINTERS_PROPERTY} (default false) system properties.
     */
    public static Options fromSystemProperties() {
      boolean validate = Boolean.parseBoolean(System.getProperty(VALIDATE_PROPERTY, "true"));
      boolean framePointers =
          Boolean.parseBoolean(System.getProperty(FRAME_POINTERS_PROPERTY, "false"));
      return new Options(validate, FramePolicy.forFramePointers(framePointers));
    }
  }

  private final Options options;

  public CfgPrologue(Options options) {
    this.options = Preconditions.checkNotNull(options);
  }

  public Options options() {
    return options;
  }

  /**
   * Runs the pass on {@code cfg}, modifying it in place, and returns it.
   *
   * @throws PrologueError if {@code cfg} already contains prologue or epilogue markers, or if
   *     validation is enabled and the result places them incorrectly
   */
  @CanIgnoreReturnValue
  public Cfg run(Cfg cfg) {
    validateNoPrologue(cfg);
    addPrologueIfRequired(cfg, options.policy());
    if (options.validate()) {
      PrologueValidator.run(cfg);
    }
    return cfg;
  }

  /**
   * Throws a {@link PrologueError} if any block of {@code cfg} contains a prologue or epilogue.
   * Nothing but this pass may create them, so finding one means the pass has already run.
   */
  public static void validateNoPrologue(Cfg cfg) {
    for (BasicBlock block : cfg.blocks()) {
      for (Instruction<BasicOp> instr : block.body()) {
        if (instr.desc().isFrameMarker()) {
          throw PrologueError.atInstruction(PrologueError.Violation.PRECONDITION, instr);
        }
      }
    }
  }

  /**
   * If {@code policy} says that {@code cfg} needs a frame, inserts a prologue as the first
   * instruction of the entry block and an epilogue as the last body instruction of each block whose
   * terminator must run without a frame. Returns true if anything was inserted.
   *
   * <p>The new instructions take their ids from the Cfg's allocator, and their debug locations
   * from the instruction they precede or follow. No edges or terminators are changed.
   */
  @CanIgnoreReturnValue
  public static boolean addPrologueIfRequired(Cfg cfg, FramePolicy policy) {
    boolean required = policy.prologueRequired(cfg.containsCalls(), cfg.numStackSlots());
    logger.atFine().log("%s: prologue required: %s", cfg.functionName(), required);
    if (!required) {
      return false;
    }
    List<Instruction<BasicOp>> entryBody = cfg.entryBlock().body();
    // The prologue's attributes come from whatever instruction currently starts the entry block.
    Instruction<?> next = entryBody.isEmpty() ? cfg.entryBlock().terminator() : entryBody.get(0);
    entryBody.add(
        0,
        Instruction.copyAttributes(
            next, BasicOp.PROLOGUE, cfg.instructionIds().getAndIncrement()));
    int numEpilogues = 0;
    for (BasicBlock block : cfg.blocks()) {
      Requirement requirement =
          InstructionRequirements.terminator(block.terminator(), cfg.functionName());
      if (requirement == Requirement.REQUIRES_NO_PROLOGUE) {
        block
            .body()
            .add(
                Instruction.copyAttributes(
                    block.terminator(), BasicOp.EPILOGUE, cfg.instructionIds().getAndIncrement()));
        ++numEpilogues;
      }
    }
    logger.atFine().log(
        "%s: inserted prologue and %s epilogue(s):\n%s",
        cfg.functionName(), numEpilogues, lazy(() -> CfgPrinter.print(cfg)));
    return true;
  }
}
