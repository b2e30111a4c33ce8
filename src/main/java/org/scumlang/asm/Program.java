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

import com.google.common.collect.ImmutableList;
import org.scumlang.util.PrintOptions;

/**
 * A complete compiled program: the body instructions that leave the result in RAX, wrapped in the
 * scaffolding that makes them callable from the C runtime.
 *
 * <p>The rendered text is
 *
 * <pre>
 * section .text
 * global our_code_starts_here
 * our_code_starts_here:
 *   ...one line per body instruction...
 *   ret
 * </pre>
 *
 * Labels are not indented.
 */
public final class Program {

  public final ImmutableList<Instruction> body;

  public Program(ImmutableList<Instruction> body) {
    this.body = body;
  }

  /** Returns the body followed by the final {@code ret}. */
  public ImmutableList<Instruction> instructions() {
    return ImmutableList.<Instruction>builderWithExpectedSize(body.size() + 1)
        .addAll(body)
        .add(Instruction.RETURN)
        .build();
  }

  /** Returns the three lines that precede the body. */
  public static String prelude(PrintOptions options) {
    String entry = options.entryLabel();
    return "section .text\nglobal " + entry + "\n" + entry + ":\n";
  }

  /** Returns the assembler source for this program, one instruction per line. */
  public String render(PrintOptions options) {
    StringBuilder sb = new StringBuilder(prelude(options));
    for (Instruction inst : instructions()) {
      if (!(inst instanceof Instruction.Label)) {
        sb.append(options.indent());
      }
      sb.append(inst.render()).append('\n');
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return render(PrintOptions.DEFAULT);
  }
}
