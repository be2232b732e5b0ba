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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A CfgBuilder is used to assemble the {@link Cfg} of a single function. The lifecycle of a
 * CfgBuilder is <nl>
 * <li>Create it with the function's name, and set the function-level facts ({@link
 *     #setContainsCalls}, {@link #setNumStackSlots}).
 * <li>Call {@link #block} once for each label, adding body instructions and then exactly one
 *     terminator to the returned {@link BlockBuilder}. The first block created is the entry block
 *     unless {@link #setEntry} says otherwise.
 * <li>Call {@link #build} to check the graph and return the Cfg. </nl>
 *
 * <p>Instruction ids are allocated in the order instructions are added, starting from zero; the
 * resulting Cfg continues from where the builder left off.
 */
public class CfgBuilder {
  private final String functionName;
  private final InstructionId.Allocator instructionIds = new InstructionId.Allocator();
  private final Map<Integer, BlockBuilder> blocks = new LinkedHashMap<>();
  private @Nullable Integer entryLabel;
  private boolean containsCalls;
  private int numStackSlots;
  private boolean built;

  public CfgBuilder(String functionName) {
    this.functionName = Preconditions.checkNotNull(functionName);
  }

  @CanIgnoreReturnValue
  public CfgBuilder setContainsCalls(boolean containsCalls) {
    this.containsCalls = containsCalls;
    return this;
  }

  @CanIgnoreReturnValue
  public CfgBuilder setNumStackSlots(int numStackSlots) {
    Preconditions.checkArgument(numStackSlots >= 0);
    this.numStackSlots = numStackSlots;
    return this;
  }

  /** Makes the block with the given label the entry block (it need not have been created yet). */
  @CanIgnoreReturnValue
  public CfgBuilder setEntry(int label) {
    this.entryLabel = label;
    return this;
  }

  /** Starts a new block with the given label. */
  public BlockBuilder block(int label) {
    Preconditions.checkState(!built);
    Preconditions.checkArgument(!blocks.containsKey(label), "Duplicate label %s", label);
    BlockBuilder result = new BlockBuilder(label);
    blocks.put(label, result);
    if (entryLabel == null) {
      entryLabel = label;
    }
    return result;
  }

  /**
   * Checks that the graph is complete and consistent (every block is terminated and every edge
   * leads to a block) and returns it as a Cfg. Blocks that are the target of an exceptional edge
   * are marked as trap handlers. May only be called once.
   */
  public Cfg build() {
    Preconditions.checkState(!built, "build() already called");
    Preconditions.checkState(entryLabel != null, "No blocks in %s", functionName);
    Preconditions.checkState(blocks.containsKey(entryLabel), "No entry block %s", entryLabel);
    Set<Integer> handlers = new HashSet<>();
    for (BlockBuilder bb : blocks.values()) {
      Preconditions.checkState(bb.terminator != null, "Block %s has no terminator", bb.label);
      for (int succ : bb.successors) {
        Preconditions.checkState(
            blocks.containsKey(succ), "Block %s jumps to missing block %s", bb.label, succ);
      }
      if (bb.exceptionalSuccessor != null) {
        Preconditions.checkState(
            blocks.containsKey(bb.exceptionalSuccessor),
            "Block %s raises to missing block %s",
            bb.label,
            bb.exceptionalSuccessor);
        handlers.add(bb.exceptionalSuccessor);
      }
    }
    ImmutableMap.Builder<Integer, BasicBlock> result = ImmutableMap.builder();
    for (BlockBuilder bb : blocks.values()) {
      result.put(
          bb.label,
          new BasicBlock(
              bb.label,
              bb.body,
              bb.terminator,
              bb.successors,
              bb.exceptionalSuccessor,
              handlers.contains(bb.label)));
    }
    built = true;
    return new Cfg(
        functionName,
        entryLabel,
        containsCalls,
        numStackSlots,
        instructionIds,
        result.buildOrThrow());
  }

  /** Accumulates the contents of one block. */
  public final class BlockBuilder {
    private final int label;
    private final List<Instruction<BasicOp>> body = new ArrayList<>();
    private @Nullable Instruction<TerminatorOp> terminator;
    private ImmutableList<Integer> successors = ImmutableList.of();
    private @Nullable Integer exceptionalSuccessor;

    private BlockBuilder(int label) {
      this.label = label;
    }

    public int label() {
      return label;
    }

    /** Appends a body instruction, allocating its id. */
    @CanIgnoreReturnValue
    public BlockBuilder add(Instruction.Builder<BasicOp> instr) {
      Preconditions.checkState(terminator == null, "Block %s is already terminated", label);
      body.add(instr.build(instructionIds.getAndIncrement()));
      return this;
    }

    /** Sets the block's terminator and its normal successors. */
    @CanIgnoreReturnValue
    public BlockBuilder terminate(Instruction.Builder<TerminatorOp> instr, int... successors) {
      Preconditions.checkState(terminator == null, "Block %s is already terminated", label);
      terminator = instr.build(instructionIds.getAndIncrement());
      this.successors = ImmutableList.copyOf(Ints.asList(successors));
      return this;
    }

    /** Sets the handler that receives exceptions raised in this block. */
    @CanIgnoreReturnValue
    public BlockBuilder onException(int handler) {
      exceptionalSuccessor = handler;
      return this;
    }
  }
}
