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

/**
 * The x86-64 registers that generated code refers to. All of them except RSP are caller-saved in
 * the System V and Windows x64 calling conventions, so compiled code may clobber them freely.
 */
public enum Register {
  /** Holds the value of the expression being evaluated, and the program's result. */
  RAX,
  /** Holds the second operand of a multiplication. */
  RCX,
  /** Receives the high half of a multiplication. */
  RDX,
  /** The stack pointer; variables are stored at fixed offsets below it. */
  RSP;

  /** Returns the name of this register as the assembler expects it. */
  public String asmName() {
    return name();
  }
}
