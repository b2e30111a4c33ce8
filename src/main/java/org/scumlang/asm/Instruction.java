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
import java.util.Objects;

/**
 * An Instruction is one line of generated assembly. Each subclass renders as a single line in NASM
 * syntax:
 *
 * <ul>
 *   <li>{@link Move} {@code mov dst, src}
 *   <li>{@link Add} {@code add dst, src}
 *   <li>{@link Subtract} {@code sub dst, src}
 *   <li>{@link Multiply} {@code mul src} (multiplies RAX, result in RDX:RAX)
 *   <li>{@link Increment} {@code inc dst}
 *   <li>{@link Decrement} {@code dec dst}
 *   <li>{@link Compare} {@code cmp dst, src}
 *   <li>{@link JumpIfEqual} {@code je label}
 *   <li>{@link Jump} {@code jmp label}
 *   <li>{@link Label} {@code name:}
 *   <li>{@link Return} {@code ret}
 *   <li>{@link Comment} {@code ; text}
 * </ul>
 *
 * <p>Instructions are immutable and compare by value.
 */
public abstract class Instruction {

  /** The only instance of {@link Return}. */
  public static final Return RETURN = new Return();

  private Instruction() {}

  /** Returns this instruction as a line of assembler text (with no indentation or newline). */
  public abstract String render();

  @Override
  public final String toString() {
    return render();
  }

  public static Move move(Arg dst, Arg src) {
    return new Move(dst, src);
  }

  public static Add add(Arg dst, Arg src) {
    return new Add(dst, src);
  }

  public static Subtract subtract(Arg dst, Arg src) {
    return new Subtract(dst, src);
  }

  public static Multiply multiply(Arg src) {
    return new Multiply(src);
  }

  public static Increment increment(Arg dst) {
    return new Increment(dst);
  }

  public static Decrement decrement(Arg dst) {
    return new Decrement(dst);
  }

  public static Compare compare(Arg dst, Arg src) {
    return new Compare(dst, src);
  }

  public static JumpIfEqual jumpIfEqual(String label) {
    return new JumpIfEqual(label);
  }

  public static Jump jump(String label) {
    return new Jump(label);
  }

  public static Label label(String name) {
    return new Label(name);
  }

  public static Comment comment(String text) {
    return new Comment(text);
  }

  /** An instruction with a destination and a source operand. */
  public abstract static class TwoOperand extends Instruction {
    private final String mnemonic;
    public final Arg dst;
    public final Arg src;

    private TwoOperand(String mnemonic, Arg dst, Arg src, boolean writesDst) {
      Preconditions.checkArgument(
          !writesDst || dst.isWritable(), "%s: cannot write to %s", mnemonic, dst);
      // x86 has no memory-to-memory form of these instructions.
      Preconditions.checkArgument(
          !(dst.isMemory() && src.isMemory()), "%s: two memory operands", mnemonic);
      this.mnemonic = mnemonic;
      this.dst = dst;
      this.src = src;
    }

    @Override
    public String render() {
      return mnemonic + " " + dst.render() + ", " + src.render();
    }

    @Override
    public boolean equals(Object obj) {
      return obj != null
          && obj.getClass() == getClass()
          && dst.equals(((TwoOperand) obj).dst)
          && src.equals(((TwoOperand) obj).src);
    }

    @Override
    public int hashCode() {
      return Objects.hash(getClass(), dst, src);
    }
  }

  /** An instruction with a single operand. */
  public abstract static class OneOperand extends Instruction {
    private final String mnemonic;
    public final Arg arg;

    private OneOperand(String mnemonic, Arg arg, boolean writesArg) {
      Preconditions.checkArgument(
          !writesArg || arg.isWritable(), "%s: cannot write to %s", mnemonic, arg);
      this.mnemonic = mnemonic;
      this.arg = arg;
    }

    @Override
    public String render() {
      return mnemonic + " " + arg.render();
    }

    @Override
    public boolean equals(Object obj) {
      return obj != null && obj.getClass() == getClass() && arg.equals(((OneOperand) obj).arg);
    }

    @Override
    public int hashCode() {
      return Objects.hash(getClass(), arg);
    }
  }

  /** An instruction that refers to a label. */
  public abstract static class LabelRef extends Instruction {
    private final String mnemonic;
    public final String label;

    private LabelRef(String mnemonic, String label) {
      Preconditions.checkArgument(!label.isEmpty(), "empty label");
      this.mnemonic = mnemonic;
      this.label = label;
    }

    @Override
    public String render() {
      return mnemonic + " " + label;
    }

    @Override
    public boolean equals(Object obj) {
      return obj != null && obj.getClass() == getClass() && label.equals(((LabelRef) obj).label);
    }

    @Override
    public int hashCode() {
      return Objects.hash(getClass(), label);
    }
  }

  /** Copies {@code src} to {@code dst}. */
  public static final class Move extends TwoOperand {
    private Move(Arg dst, Arg src) {
      super("mov", dst, src, true);
    }
  }

  /** {@code dst = dst + src}. */
  public static final class Add extends TwoOperand {
    private Add(Arg dst, Arg src) {
      super("add", dst, src, true);
    }
  }

  /** {@code dst = dst - src}. */
  public static final class Subtract extends TwoOperand {
    private Subtract(Arg dst, Arg src) {
      super("sub", dst, src, true);
    }
  }

  /** Sets the zero flag if {@code dst == src}. */
  public static final class Compare extends TwoOperand {
    private Compare(Arg dst, Arg src) {
      super("cmp", dst, src, false);
    }
  }

  /** Unsigned multiply of RAX by {@code arg}; the low half of the product is left in RAX. */
  public static final class Multiply extends OneOperand {
    private Multiply(Arg src) {
      super("mul", src, false);
      // mul has no immediate form.
      Preconditions.checkArgument(!(src instanceof Arg.Constant), "mul: constant operand");
    }
  }

  /** {@code arg = arg + 1}. */
  public static final class Increment extends OneOperand {
    private Increment(Arg dst) {
      super("inc", dst, true);
    }
  }

  /** {@code arg = arg - 1}. */
  public static final class Decrement extends OneOperand {
    private Decrement(Arg dst) {
      super("dec", dst, true);
    }
  }

  /** Jumps to {@code label} if the zero flag is set. */
  public static final class JumpIfEqual extends LabelRef {
    private JumpIfEqual(String label) {
      super("je", label);
    }
  }

  /** Jumps to {@code label}. */
  public static final class Jump extends LabelRef {
    private Jump(String label) {
      super("jmp", label);
    }
  }

  /** Marks a jump target; generates no code. */
  public static final class Label extends Instruction {
    public final String name;

    private Label(String name) {
      Preconditions.checkArgument(!name.isEmpty(), "empty label");
      this.name = name;
    }

    @Override
    public String render() {
      return name + ":";
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Label other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  /** Returns to the caller; the result is in RAX. */
  public static final class Return extends Instruction {
    private Return() {}

    @Override
    public String render() {
      return "ret";
    }
  }

  /** Text for a human reader; generates no code. */
  public static final class Comment extends Instruction {
    public final String text;

    private Comment(String text) {
      Preconditions.checkArgument(text.indexOf('\n') < 0, "multi-line comment");
      this.text = text;
    }

    @Override
    public String render() {
      return "; " + text;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Comment other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
      return text.hashCode();
    }
  }
}
