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
import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableMap;

/**
 * The control-flow graph of a single function: a set of {@link BasicBlock}s keyed by label, one of
 * which is the entry block, together with the per-function facts that later passes need.
 *
 * <p>Cfgs are created by a {@link CfgBuilder}. The set of blocks and the edges between them are
 * fixed; passes may only edit block bodies, allocating ids for any new instructions from {@link
 * #instructionIds}.
 */
public final class Cfg {
  private final String functionName;
  private final int entryLabel;
  private final boolean containsCalls;
  private final int numStackSlots;
  private final InstructionId.Allocator instructionIds;

  /** All blocks, in the order they were added to the builder. */
  private final ImmutableMap<Integer, BasicBlock> blocks;

  Cfg(
      String functionName,
      int entryLabel,
      boolean containsCalls,
      int numStackSlots,
      InstructionId.Allocator instructionIds,
      ImmutableMap<Integer, BasicBlock> blocks) {
    this.functionName = functionName;
    this.entryLabel = entryLabel;
    this.containsCalls = containsCalls;
    this.numStackSlots = numStackSlots;
    this.instructionIds = instructionIds;
    this.blocks = blocks;
  }

  /** The (linker) name of the function, as used by direct calls to it. */
  public String functionName() {
    return functionName;
  }

  public int entryLabel() {
    return entryLabel;
  }

  public BasicBlock entryBlock() {
    return block(entryLabel);
  }

  /** True if the function performs any non-tail call. */
  public boolean containsCalls() {
    return containsCalls;
  }

  /** The number of local stack slots assigned by the register allocator. */
  public int numStackSlots() {
    return numStackSlots;
  }

  /** The allocator from which ids for new instructions in this function must be taken. */
  public InstructionId.Allocator instructionIds() {
    return instructionIds;
  }

  /** Returns the block with the given label; throws if there is none. */
  public BasicBlock block(int label) {
    BasicBlock result = blocks.get(label);
    Preconditions.checkArgument(result != null, "No block %s in %s", label, functionName);
    return result;
  }

  public boolean hasBlock(int label) {
    return blocks.containsKey(label);
  }

  public ImmutableCollection<BasicBlock> blocks() {
    return blocks.values();
  }

  public int numBlocks() {
    return blocks.size();
  }

  @Override
  public String toString() {
    return CfgPrinter.print(this);
  }
}
