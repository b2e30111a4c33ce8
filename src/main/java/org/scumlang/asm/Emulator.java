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

import com.google.common.base.Preconditions;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes a list of Instructions in memory, so that compiled code can be checked without an
 * assembler. Each Emulator runs a single program; create a new one for each run.
 *
 * <p>Registers start at zero except RSP, which points into an otherwise empty stack. Reading a
 * stack word that was never written is treated as an error, since compiled code should never do
 * it.
 */
public final class Emulator {

  /** Where RSP points when execution starts. */
  private static final long INITIAL_RSP = 0x7fff_0000L;

  /** Guards against programs that loop; compiled code only jumps forward. */
  private static final int MAX_STEPS = 10_000_000;

  private final EnumMap<Register, Long> registers = new EnumMap<>(Register.class);
  private final Map<Long, Long> memory = new HashMap<>();
  private boolean zeroFlag;
  private int steps;

  public Emulator() {
    for (Register r : Register.values()) {
      registers.put(r, 0L);
    }
    registers.put(Register.RSP, INITIAL_RSP);
  }

  /** Executes {@code program} and returns the final value of RAX. */
  public static long run(Program program) {
    return new Emulator().execute(program.instructions());
  }

  /**
   * Executes {@code instructions} until a {@code ret} or the end of the list, and returns the value
   * of RAX.
   */
  public long execute(List<Instruction> instructions) {
    Map<String, Integer> labels = new HashMap<>();
    for (int i = 0; i < instructions.size(); i++) {
      if (instructions.get(i) instanceof Instruction.Label label) {
        Integer prev = labels.put(label.name, i);
        Preconditions.checkArgument(prev == null, "Duplicate label %s", label.name);
      }
    }
    int pc = 0;
    while (pc < instructions.size()) {
      if (++steps > MAX_STEPS) {
        throw new IllegalStateException("Step limit exceeded");
      }
      Instruction inst = instructions.get(pc++);
      if (inst instanceof Instruction.Move move) {
        write(move.dst, read(move.src));
      } else if (inst instanceof Instruction.Add add) {
        write(add.dst, read(add.dst) + read(add.src));
      } else if (inst instanceof Instruction.Subtract sub) {
        write(sub.dst, read(sub.dst) - read(sub.src));
      } else if (inst instanceof Instruction.Compare cmp) {
        zeroFlag = read(cmp.dst) == read(cmp.src);
      } else if (inst instanceof Instruction.Multiply mul) {
        long x = registers.get(Register.RAX);
        long y = read(mul.arg);
        registers.put(Register.RAX, x * y);
        registers.put(Register.RDX, unsignedMultiplyHigh(x, y));
      } else if (inst instanceof Instruction.Increment inc) {
        write(inc.arg, read(inc.arg) + 1);
      } else if (inst instanceof Instruction.Decrement dec) {
        write(dec.arg, read(dec.arg) - 1);
      } else if (inst instanceof Instruction.JumpIfEqual je) {
        if (zeroFlag) {
          pc = target(labels, je.label);
        }
      } else if (inst instanceof Instruction.Jump jmp) {
        pc = target(labels, jmp.label);
      } else if (inst instanceof Instruction.Return) {
        break;
      } else {
        // Labels and comments generate no code.
        assert inst instanceof Instruction.Label || inst instanceof Instruction.Comment;
      }
    }
    return registers.get(Register.RAX);
  }

  /** Returns the current value of the given register. */
  public long register(Register register) {
    return registers.get(register);
  }

  private static int target(Map<String, Integer> labels, String label) {
    Integer pc = labels.get(label);
    if (pc == null) {
      throw new IllegalStateException("Undefined label " + label);
    }
    return pc;
  }

  private long address(Arg.Memory mem) {
    return registers.get(mem.base) + Arg.SLOT_SIZE * mem.offset;
  }

  private long read(Arg arg) {
    if (arg instanceof Arg.Constant c) {
      return c.value;
    } else if (arg instanceof Arg.Reg reg) {
      return registers.get(reg.register);
    }
    Arg.Memory mem = (Arg.Memory) arg;
    Long value = memory.get(address(mem));
    if (value == null) {
      throw new IllegalStateException("Read of uninitialized " + mem);
    }
    return value;
  }

  private void write(Arg arg, long value) {
    if (arg instanceof Arg.Reg reg) {
      registers.put(reg.register, value);
    } else {
      memory.put(address((Arg.Memory) arg), value);
    }
  }

  /** The high 64 bits of the unsigned 128-bit product of x and y. */
  private static long unsignedMultiplyHigh(long x, long y) {
    return Math.multiplyHigh(x, y) + ((x >> 63) & y) + ((y >> 63) & x);
  }
}
