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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * A single machine-level instruction. The type parameter is the kind of operation: block bodies
 * hold {@code Instruction<BasicOp>} and each block ends with one {@code Instruction<TerminatorOp>}.
 *
 * <p>Instructions are immutable; passes that change the program replace or insert instructions
 * rather than modifying them.
 */
public final class Instruction<D extends Enum<D>> {
  private static final Joiner COMMA = Joiner.on(", ");

  private final D desc;
  private final ImmutableList<Register> args;
  private final ImmutableList<Register> results;
  private final int stackOffset;
  private final int immediate;
  private final @Nullable String symbol;
  private final DebugLocation dbg;
  private final InstructionId id;

  private Instruction(Builder<D> builder, InstructionId id) {
    this.desc = builder.desc;
    this.args = builder.args;
    this.results = builder.results;
    this.stackOffset = builder.stackOffset;
    this.immediate = builder.immediate;
    this.symbol = builder.symbol;
    this.dbg = builder.dbg;
    this.id = id;
  }

  /** Returns a Builder for a body instruction performing {@code op}. */
  public static Builder<BasicOp> basic(BasicOp op) {
    return new Builder<>(op);
  }

  /** Returns a Builder for a terminator performing {@code op}. */
  public static Builder<TerminatorOp> terminator(TerminatorOp op) {
    return new Builder<>(op);
  }

  /**
   * Returns a new instruction with the given operation and id that has no registers, no stack
   * offset and no operands, but shares the non-semantic attributes (currently just the {@link
   * #dbg debug location}) of {@code from}.
   */
  public static <D extends Enum<D>> Instruction<D> copyAttributes(
      Instruction<?> from, D desc, InstructionId id) {
    return new Builder<>(desc).dbg(from.dbg).build(id);
  }

  public D desc() {
    return desc;
  }

  /** The registers read by this instruction. */
  public ImmutableList<Register> args() {
    return args;
  }

  /** The registers written by this instruction. */
  public ImmutableList<Register> results() {
    return results;
  }

  /**
   * The amount (in bytes) by which the stack pointer has been moved from its position on function
   * entry, at the point this instruction executes; non-zero when e.g. outgoing arguments have been
   * pushed.
   */
  public int stackOffset() {
    return stackOffset;
  }

  /** An operation-specific operand, e.g. the adjustment made by {@link BasicOp#STACK_OFFSET}. */
  public int immediate() {
    return immediate;
  }

  /** The callee of a direct call or tail call; null for other operations. */
  public @Nullable String symbol() {
    return symbol;
  }

  public DebugLocation dbg() {
    return dbg;
  }

  public InstructionId id() {
    return id;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(id.toStringPadded()).append(' ').append(mnemonic(desc));
    if (symbol != null) {
      sb.append(' ').append(symbol);
    }
    if (immediate != 0) {
      sb.append(' ').append(immediate);
    }
    if (!args.isEmpty()) {
      sb.append(' ');
      COMMA.appendTo(sb, args);
    }
    if (!results.isEmpty()) {
      sb.append(" -> ");
      COMMA.appendTo(sb, results);
    }
    if (stackOffset != 0) {
      sb.append(" [stack offset ").append(stackOffset).append(']');
    }
    if (!dbg.isNone()) {
      sb.append(" @ ").append(dbg);
    }
    return sb.toString();
  }

  private static String mnemonic(Enum<?> desc) {
    if (desc instanceof BasicOp op) {
      return op.mnemonic();
    } else if (desc instanceof TerminatorOp op) {
      return op.mnemonic();
    }
    return desc.name();
  }

  /**
   * Accumulates the parts of an Instruction. The id is supplied last (by {@link #build}), since
   * it must come from the allocator of the Cfg the instruction will belong to.
   */
  public static final class Builder<D extends Enum<D>> {
    private final D desc;
    private ImmutableList<Register> args = ImmutableList.of();
    private ImmutableList<Register> results = ImmutableList.of();
    private int stackOffset;
    private int immediate;
    private @Nullable String symbol;
    private DebugLocation dbg = DebugLocation.NONE;

    private Builder(D desc) {
      this.desc = Preconditions.checkNotNull(desc);
    }

    public D desc() {
      return desc;
    }

    @CanIgnoreReturnValue
    public Builder<D> args(Register... args) {
      this.args = ImmutableList.copyOf(Arrays.asList(args));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<D> results(Register... results) {
      this.results = ImmutableList.copyOf(Arrays.asList(results));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<D> stackOffset(int stackOffset) {
      this.stackOffset = stackOffset;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<D> immediate(int immediate) {
      this.immediate = immediate;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<D> symbol(String symbol) {
      this.symbol = Preconditions.checkNotNull(symbol);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<D> dbg(DebugLocation dbg) {
      this.dbg = Preconditions.checkNotNull(dbg);
      return this;
    }

    /**
     * Returns the Instruction with the given id.
     *
     * @throws IllegalArgumentException if this is a {@link TerminatorOp#TAILCALL_DIRECT} with no
     *     {@link #symbol}
     */
    public Instruction<D> build(InstructionId id) {
      Preconditions.checkArgument(
          symbol != null || !desc.equals(TerminatorOp.TAILCALL_DIRECT),
          "Direct tail call has no symbol");
      return new Instruction<>(this, Preconditions.checkNotNull(id));
    }
  }
}
