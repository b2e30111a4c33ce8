/*
 * Copyright 2025 The Retrospect Authors
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

package org.scumlang.asm;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.naming.TestCaseName;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class InstructionTest {

  private static final Arg RAX = Arg.of(Register.RAX);
  private static final Arg RCX = Arg.of(Register.RCX);

  /** Each instruction and its assembler text. */
  private static Object[] renderings() {
    return new Object[] {
      new Object[] {Instruction.move(RAX, Arg.constant(5)), "mov RAX, 5"},
      new Object[] {Instruction.move(Arg.stackSlot(2), RAX), "mov [RSP + 8 * -2], RAX"},
      new Object[] {Instruction.move(RCX, Arg.stackSlot(1)), "mov RCX, [RSP + 8 * -1]"},
      new Object[] {Instruction.add(RAX, Arg.stackSlot(3)), "add RAX, [RSP + 8 * -3]"},
      new Object[] {Instruction.add(RAX, RAX), "add RAX, RAX"},
      new Object[] {Instruction.subtract(RAX, Arg.constant(-2)), "sub RAX, -2"},
      new Object[] {Instruction.multiply(RCX), "mul RCX"},
      new Object[] {Instruction.multiply(Arg.stackSlot(4)), "mul [RSP + 8 * -4]"},
      new Object[] {Instruction.increment(RAX), "inc RAX"},
      new Object[] {Instruction.decrement(RAX), "dec RAX"},
      new Object[] {Instruction.compare(RAX, Arg.constant(0)), "cmp RAX, 0"},
      new Object[] {Instruction.jumpIfEqual("else_3"), "je else_3"},
      new Object[] {Instruction.jump("endif_3"), "jmp endif_3"},
      new Object[] {Instruction.label("if_3"), "if_3:"},
      new Object[] {Instruction.RETURN, "ret"},
      new Object[] {Instruction.comment("hello"), "; hello"},
    };
  }

  @Test
  @Parameters(method = "renderings")
  @TestCaseName("render_{index}")
  public void render(Instruction inst, String expected) {
    assertThat(inst.render()).isEqualTo(expected);
    assertThat(inst.toString()).isEqualTo(expected);
  }

  @Test
  public void invalidOperands() {
    // No immediate destinations.
    assertThrows(IllegalArgumentException.class, () -> Instruction.move(Arg.constant(1), RAX));
    assertThrows(IllegalArgumentException.class, () -> Instruction.increment(Arg.constant(1)));
    // No memory-to-memory forms.
    assertThrows(
        IllegalArgumentException.class,
        () -> Instruction.move(Arg.stackSlot(1), Arg.stackSlot(2)));
    assertThrows(
        IllegalArgumentException.class,
        () -> Instruction.add(Arg.stackSlot(1), Arg.stackSlot(2)));
    // mul has no immediate form.
    assertThrows(IllegalArgumentException.class, () -> Instruction.multiply(Arg.constant(3)));
    assertThrows(IllegalArgumentException.class, () -> Instruction.label(""));
    assertThrows(IllegalArgumentException.class, () -> Instruction.jump(""));
    assertThrows(IllegalArgumentException.class, () -> Instruction.comment("two\nlines"));
  }

  @Test
  public void equality() {
    assertThat(Instruction.move(RAX, Arg.constant(1)))
        .isEqualTo(Instruction.move(RAX, Arg.constant(1)));
    assertThat(Instruction.move(RAX, Arg.constant(1)))
        .isNotEqualTo(Instruction.add(RAX, Arg.constant(1)));
    assertThat(Instruction.increment(RAX)).isNotEqualTo(Instruction.decrement(RAX));
    assertThat(Instruction.jump("a")).isNotEqualTo(Instruction.jumpIfEqual("a"));
    assertThat(Instruction.label("a")).isEqualTo(Instruction.label("a"));
    assertThat(Instruction.label("a").hashCode()).isEqualTo(Instruction.label("a").hashCode());
  }
}
