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
import java.util.Objects;

/**
 * An Arg is an operand of an {@link Instruction}. There are three subclasses:
 *
 * <ul>
 *   <li>{@link Constant}: an immediate 64-bit value, printed in decimal
 *   <li>{@link Reg}: the contents of a register, printed as its name
 *   <li>{@link Memory}: an 8-byte word at a fixed offset from a register, printed as {@code [RSP +
 *       8 * -2]}
 * </ul>
 *
 * <p>Args are immutable.
 */
public abstract class Arg {

  /** The size in bytes of each stack slot. */
  public static final int SLOT_SIZE = 8;

  private static final EnumMap<Register, Reg> REGISTERS = new EnumMap<>(Register.class);

  static {
    for (Register r : Register.values()) {
      REGISTERS.put(r, new Reg(r));
    }
  }

  private Arg() {}

  /** Returns the assembler text for this operand. */
  public abstract String render();

  /** True if this operand can be written to. */
  public boolean isWritable() {
    return true;
  }

  /** True if this operand refers to memory. */
  public boolean isMemory() {
    return false;
  }

  @Override
  public final String toString() {
    return render();
  }

  public static Constant constant(long value) {
    return new Constant(value);
  }

  public static Reg of(Register register) {
    return REGISTERS.get(register);
  }

  /** Returns an operand addressing {@code [register + 8 * offset]}. */
  public static Memory memory(Register register, long offset) {
    return new Memory(register, offset);
  }

  /**
   * Returns the operand for stack slot {@code slot} (numbered from 1). Slots grow downward from the
   * stack pointer, so slot {@code n} is at {@code [RSP + 8 * -n]}.
   */
  public static Memory stackSlot(int slot) {
    Preconditions.checkArgument(slot > 0, "stack slots are numbered from 1, not %s", slot);
    return new Memory(Register.RSP, -slot);
  }

  /** An immediate value. */
  public static final class Constant extends Arg {
    public final long value;

    private Constant(long value) {
      this.value = value;
    }

    @Override
    public String render() {
      return Long.toString(value);
    }

    @Override
    public boolean isWritable() {
      return false;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Constant other && value == other.value;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }
  }

  /** A register. */
  public static final class Reg extends Arg {
    public final Register register;

    private Reg(Register register) {
      this.register = register;
    }

    @Override
    public String render() {
      return register.asmName();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Reg other && register == other.register;
    }

    @Override
    public int hashCode() {
      return register.hashCode();
    }
  }

  /** A word in memory, addressed relative to a register. */
  public static final class Memory extends Arg {
    public final Register base;

    /** The distance from {@code base}, in units of {@link #SLOT_SIZE} bytes. */
    public final long offset;

    private Memory(Register base, long offset) {
      this.base = base;
      this.offset = offset;
    }

    @Override
    public String render() {
      return String.format("[%s + %d * %d]", base.asmName(), SLOT_SIZE, offset);
    }

    @Override
    public boolean isMemory() {
      return true;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Memory other && base == other.base && offset == other.offset;
    }

    @Override
    public int hashCode() {
      return Objects.hash(base, offset);
    }
  }
}
