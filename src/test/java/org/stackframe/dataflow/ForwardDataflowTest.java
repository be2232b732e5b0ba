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

package org.stackframe.dataflow;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.stackframe.cfg.BasicOp;
import org.stackframe.cfg.Cfg;
import org.stackframe.cfg.CfgBuilder;
import org.stackframe.cfg.Instruction;
import org.stackframe.cfg.TerminatorOp;

@RunWith(JUnit4.class)
public class ForwardDataflowTest {

  /** Sets of strings, joined by union. */
  private static final Domain<ImmutableSet<String>> SETS =
      new Domain<>() {
        @Override
        public ImmutableSet<String> bot() {
          return ImmutableSet.of();
        }

        @Override
        public ImmutableSet<String> join(ImmutableSet<String> left, ImmutableSet<String> right) {
          return Sets.union(left, right).immutableCopy();
        }

        @Override
        public boolean lessEqual(ImmutableSet<String> left, ImmutableSet<String> right) {
          return right.containsAll(left);
        }
      };

  /**
   * Records which instructions have executed: each instruction adds its id, and the exceptional
   * image of a terminator also records that it raised. The context is a prefix for each entry.
   */
  private static final ForwardTransfer<ImmutableSet<String>, String> TRACE =
      new ForwardTransfer<>() {
        @Override
        public ImmutableSet<String> basic(
            ImmutableSet<String> value, Instruction<BasicOp> instr, String prefix) {
          return add(value, prefix + instr.id());
        }

        @Override
        public Image<ImmutableSet<String>> terminator(
            ImmutableSet<String> value, Instruction<TerminatorOp> instr, String prefix) {
          ImmutableSet<String> after = add(value, prefix + instr.id());
          return new Image<>(after, add(after, "raised@" + instr.id()));
        }
      };

  private static ImmutableSet<String> add(ImmutableSet<String> set, String element) {
    return ImmutableSet.<String>builder().addAll(set).add(element).build();
  }

  private ForwardDataflow<ImmutableSet<String>, String> dataflow;

  @Before
  public void setup() {
    dataflow = new ForwardDataflow<>(SETS, TRACE);
  }

  @Test
  public void straightLine() {
    CfgBuilder cb = new CfgBuilder("f");
    cb.block(1)
        .add(Instruction.basic(BasicOp.MOVE))
        .terminate(Instruction.terminator(TerminatorOp.ALWAYS), 2);
    cb.block(2).terminate(Instruction.terminator(TerminatorOp.RETURN));
    Cfg cfg = cb.build();

    ForwardDataflow.Result<ImmutableSet<String>> result =
        dataflow.run(cfg, ImmutableSet.of("init"), false, "i");

    assertThat(result.isOk()).isTrue();
    assertThat(result.entryValues().get(1)).containsExactly("init");
    assertThat(result.entryValues().get(2)).containsExactly("init", "i0", "i1");
  }

  @Test
  public void joinAtMerge() {
    CfgBuilder cb = new CfgBuilder("f");
    cb.block(1).terminate(Instruction.terminator(TerminatorOp.INT_TEST), 2, 3);
    cb.block(2).terminate(Instruction.terminator(TerminatorOp.ALWAYS), 4);
    cb.block(3).terminate(Instruction.terminator(TerminatorOp.ALWAYS), 4);
    cb.block(4).terminate(Instruction.terminator(TerminatorOp.RETURN));

    ForwardDataflow.Result<ImmutableSet<String>> result =
        dataflow.run(cb.build(), ImmutableSet.of(), false, "");

    assertThat(result.entryValues().get(4)).containsExactly("0", "1", "2");
  }

  @Test
  public void loopReachesFixpoint() {
    CfgBuilder cb = new CfgBuilder("f");
    cb.block(1).terminate(Instruction.terminator(TerminatorOp.ALWAYS), 2);
    cb.block(2)
        .add(Instruction.basic(BasicOp.INTOP))
        .terminate(Instruction.terminator(TerminatorOp.INT_TEST), 2, 3);
    cb.block(3).terminate(Instruction.terminator(TerminatorOp.RETURN));

    ForwardDataflow.Result<ImmutableSet<String>> result =
        dataflow.run(cb.build(), ImmutableSet.of(), false, "");

    // Block 2 is reached both from block 1 and from itself.
    assertThat(result.entryValues().get(2)).containsExactly("0", "1", "2");
    assertThat(result.entryValues().get(3)).containsExactly("0", "1", "2");
  }

  @Test
  public void exceptionalEdgeGetsExceptionalImage() {
    CfgBuilder cb = new CfgBuilder("f");
    cb.block(1).terminate(Instruction.terminator(TerminatorOp.CALL), 2).onException(3);
    cb.block(2).terminate(Instruction.terminator(TerminatorOp.RETURN));
    cb.block(3).terminate(Instruction.terminator(TerminatorOp.RAISE));

    ForwardDataflow.Result<ImmutableSet<String>> result =
        dataflow.run(cb.build(), ImmutableSet.of(), false, "");

    assertThat(result.entryValues().get(2)).containsExactly("0");
    assertThat(result.entryValues().get(3)).containsExactly("0", "raised@0");
  }

  @Test
  public void unreachableBlocksAreAbsent() {
    CfgBuilder cb = new CfgBuilder("f");
    cb.block(1).terminate(Instruction.terminator(TerminatorOp.RETURN));
    cb.block(2).terminate(Instruction.terminator(TerminatorOp.RETURN)).onException(3);
    cb.block(3).terminate(Instruction.terminator(TerminatorOp.RAISE));

    ForwardDataflow.Result<ImmutableSet<String>> result =
        dataflow.run(cb.build(), ImmutableSet.of(), false, "");

    assertThat(result.entryValues().keySet()).containsExactly(1);
  }

  @Test
  public void handlersAsEntryPoints() {
    CfgBuilder cb = new CfgBuilder("f");
    cb.block(1).terminate(Instruction.terminator(TerminatorOp.RETURN));
    cb.block(2).terminate(Instruction.terminator(TerminatorOp.RETURN)).onException(3);
    cb.block(3).terminate(Instruction.terminator(TerminatorOp.RAISE));

    ForwardDataflow.Result<ImmutableSet<String>> result =
        dataflow.run(cb.build(), ImmutableSet.of("init"), true, "");

    assertThat(result.entryValues().keySet()).containsExactly(1, 3);
    assertThat(result.entryValues().get(3)).containsExactly("init");
  }

  @Test
  public void iterationLimit() {
    CfgBuilder cb = new CfgBuilder("f");
    cb.block(1).terminate(Instruction.terminator(TerminatorOp.ALWAYS), 2);
    cb.block(2).terminate(Instruction.terminator(TerminatorOp.ALWAYS), 3);
    cb.block(3).terminate(Instruction.terminator(TerminatorOp.RETURN));

    ForwardDataflow.Result<ImmutableSet<String>> result =
        new ForwardDataflow<>(SETS, TRACE, 2).run(cb.build(), ImmutableSet.of(), false, "");

    assertThat(result.isOk()).isFalse();
    assertThrows(IllegalStateException.class, result::entryValues);
  }

  @Test
  public void noVisitBoundByDefault() {
    int numBlocks = 20_000;
    CfgBuilder cb = new CfgBuilder("f");
    for (int label = 1; label < numBlocks; label++) {
      cb.block(label).terminate(Instruction.terminator(TerminatorOp.ALWAYS), label + 1);
    }
    cb.block(numBlocks).terminate(Instruction.terminator(TerminatorOp.RETURN));

    ForwardDataflow.Result<ImmutableSet<String>> result =
        new ForwardDataflow<>(SETS, ForwardDataflowTest.<String>identity())
            .run(cb.build(), ImmutableSet.of("init"), false, "");

    assertThat(result.isOk()).isTrue();
    assertThat(result.entryValues()).hasSize(numBlocks);
    assertThat(result.entryValues().get(numBlocks)).containsExactly("init");
  }

  /** A transfer that leaves every value unchanged. */
  private static <C> ForwardTransfer<ImmutableSet<String>, C> identity() {
    return new ForwardTransfer<>() {
      @Override
      public ImmutableSet<String> basic(
          ImmutableSet<String> value, Instruction<BasicOp> instr, C context) {
        return value;
      }

      @Override
      public Image<ImmutableSet<String>> terminator(
          ImmutableSet<String> value, Instruction<TerminatorOp> instr, C context) {
        return Image.uniform(value);
      }
    };
  }

  @Test
  public void transferExceptionsPropagate() {
    CfgBuilder cb = new CfgBuilder("f");
    cb.block(1).terminate(Instruction.terminator(TerminatorOp.RETURN));
    ForwardTransfer<ImmutableSet<String>, String> failing =
        new ForwardTransfer<>() {
          @Override
          public ImmutableSet<String> basic(
              ImmutableSet<String> value, Instruction<BasicOp> instr, String context) {
            return value;
          }

          @Override
          public Image<ImmutableSet<String>> terminator(
              ImmutableSet<String> value, Instruction<TerminatorOp> instr, String context) {
            throw new IllegalStateException("rejected " + instr.id());
          }
        };

    Cfg cfg = cb.build();
    ForwardDataflow<ImmutableSet<String>, String> rejecting = new ForwardDataflow<>(SETS, failing);

    IllegalStateException e =
        assertThrows(
            IllegalStateException.class, () -> rejecting.run(cfg, ImmutableSet.of(), false, ""));
    assertThat(e).hasMessageThat().isEqualTo("rejected 0");
  }

  @Test
  public void badIterationLimit() {
    assertThrows(IllegalArgumentException.class, () -> new ForwardDataflow<>(SETS, TRACE, 0));
  }
}
