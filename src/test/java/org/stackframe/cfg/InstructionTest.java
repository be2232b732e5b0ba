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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class InstructionTest {

  private static final DebugLocation DBG = new DebugLocation("f.ml", 12);

  @Test
  public void paddedIds() {
    assertThat(new InstructionId(0).toStringPadded()).isEqualTo("0000");
    assertThat(new InstructionId(42).toStringPadded()).isEqualTo("0042");
    assertThat(new InstructionId(12345).toStringPadded()).isEqualTo("12345");
    assertThat(new InstructionId(42).toString()).isEqualTo("42");
  }

  @Test
  public void negativeId() {
    assertThrows(IllegalArgumentException.class, () -> new InstructionId(-1));
  }

  @Test
  public void allocatorIsMonotonic() {
    InstructionId.Allocator ids = new InstructionId.Allocator(10);
    assertThat(ids.peek()).isEqualTo(10);
    InstructionId first = ids.getAndIncrement();
    InstructionId second = ids.getAndIncrement();
    assertThat(first.value()).isEqualTo(10);
    assertThat(second).isGreaterThan(first);
    assertThat(ids.peek()).isEqualTo(12);
  }

  @Test
  public void builderFields() {
    Register x = new Register("x", Location.register(0));
    Register s = new Register("s", Location.local(2));
    Instruction<TerminatorOp> instr =
        Instruction.terminator(TerminatorOp.TAILCALL_DIRECT)
            .symbol("caml_g")
            .args(x, s)
            .stackOffset(16)
            .dbg(DBG)
            .build(new InstructionId(5));

    assertThat(instr.desc()).isEqualTo(TerminatorOp.TAILCALL_DIRECT);
    assertThat(instr.symbol()).isEqualTo("caml_g");
    assertThat(instr.args()).containsExactly(x, s).inOrder();
    assertThat(instr.results()).isEmpty();
    assertThat(instr.stackOffset()).isEqualTo(16);
    assertThat(instr.immediate()).isEqualTo(0);
    assertThat(instr.dbg()).isEqualTo(DBG);
    assertThat(instr.id()).isEqualTo(new InstructionId(5));
  }

  @Test
  public void directTailCallNeedsSymbol() {
    Instruction.Builder<TerminatorOp> tailCall =
        Instruction.terminator(TerminatorOp.TAILCALL_DIRECT);
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> tailCall.build(new InstructionId(0)));
    assertThat(e).hasMessageThat().isEqualTo("Direct tail call has no symbol");

    CfgBuilder cb = new CfgBuilder("caml_f");
    assertThrows(IllegalArgumentException.class, () -> cb.block(1).terminate(tailCall));
    // Other calls may be indirect.
    assertThat(Instruction.terminator(TerminatorOp.CALL).build(new InstructionId(1)).symbol())
        .isNull();
  }

  @Test
  public void printing() {
    Instruction<BasicOp> move =
        Instruction.basic(BasicOp.MOVE)
            .args(new Register("x", Location.register(3)))
            .results(new Register("y", Location.local(0)))
            .dbg(DBG)
            .build(new InstructionId(7));
    assertThat(move.toString()).isEqualTo("0007 move x:%r3 -> y:s[local 0] @ f.ml:12");

    Instruction<BasicOp> adjust =
        Instruction.basic(BasicOp.STACK_OFFSET).immediate(-16).build(new InstructionId(8));
    assertThat(adjust.toString()).isEqualTo("0008 stack_offset -16");

    Instruction<TerminatorOp> call =
        Instruction.terminator(TerminatorOp.CALL)
            .symbol("caml_g")
            .stackOffset(8)
            .build(new InstructionId(9));
    assertThat(call.toString()).isEqualTo("0009 call caml_g [stack offset 8]");
  }

  @Test
  public void copyAttributesKeepsOnlyDebugLocation() {
    Instruction<TerminatorOp> ret =
        Instruction.terminator(TerminatorOp.RETURN)
            .args(new Register("r", Location.register(0)))
            .dbg(DBG)
            .build(new InstructionId(3));

    Instruction<BasicOp> epilogue =
        Instruction.copyAttributes(ret, BasicOp.EPILOGUE, new InstructionId(11));

    assertThat(epilogue.desc()).isEqualTo(BasicOp.EPILOGUE);
    assertThat(epilogue.id()).isEqualTo(new InstructionId(11));
    assertThat(epilogue.dbg()).isEqualTo(DBG);
    assertThat(epilogue.args()).isEmpty();
    assertThat(epilogue.results()).isEmpty();
    assertThat(epilogue.stackOffset()).isEqualTo(0);
    assertThat(epilogue.symbol()).isNull();
  }

  @Test
  public void onlyLocalSlotsAreInTheFrame(@TestParameter Location.Kind kind) {
    Location loc = new Location(kind, 1);
    assertThat(loc.isLocalStackSlot()).isEqualTo(kind == Location.Kind.STACK_LOCAL);
    assertThat(new Register("r", loc).isOnLocalStack()).isEqualTo(loc.isLocalStackSlot());
  }

  @Test
  public void locationFactories() {
    assertThat(Location.register(2).kind()).isEqualTo(Location.Kind.REGISTER);
    assertThat(Location.local(2).kind()).isEqualTo(Location.Kind.STACK_LOCAL);
    assertThat(Location.incoming(2).kind()).isEqualTo(Location.Kind.STACK_INCOMING);
    assertThat(Location.outgoing(2).kind()).isEqualTo(Location.Kind.STACK_OUTGOING);
    assertThat(Location.domainState(2).kind()).isEqualTo(Location.Kind.STACK_DOMAIN_STATE);
    assertThat(Register.unallocated("t").loc()).isEqualTo(Location.UNKNOWN);
    assertThat(Register.unallocated("t").toString()).isEqualTo("t:?");
  }

  @Test
  public void frameMarkers(@TestParameter BasicOp op) {
    assertThat(op.isFrameMarker()).isEqualTo(op == BasicOp.PROLOGUE || op == BasicOp.EPILOGUE);
  }

  @Test
  public void nonTailCalls(@TestParameter TerminatorOp op) {
    boolean expected =
        op == TerminatorOp.CALL || op == TerminatorOp.CALL_NO_RETURN || op == TerminatorOp.PRIM;
    assertThat(op.isNonTailCall()).isEqualTo(expected);
  }

  @Test
  public void debugLocation() {
    assertThat(DebugLocation.NONE.isNone()).isTrue();
    assertThat(DebugLocation.NONE.toString()).isEmpty();
    assertThat(DBG.isNone()).isFalse();
    assertThat(DBG.toString()).isEqualTo("f.ml:12");
  }
}
