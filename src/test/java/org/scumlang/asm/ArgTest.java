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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ArgTest {

  @Test
  public void rendering() {
    assertThat(Arg.constant(42).render()).isEqualTo("42");
    assertThat(Arg.constant(-1).render()).isEqualTo("-1");
    assertThat(Arg.of(Register.RAX).render()).isEqualTo("RAX");
    assertThat(Arg.of(Register.RCX).toString()).isEqualTo("RCX");
    assertThat(Arg.stackSlot(1).render()).isEqualTo("[RSP + 8 * -1]");
    assertThat(Arg.stackSlot(12).render()).isEqualTo("[RSP + 8 * -12]");
    assertThat(Arg.memory(Register.RSP, 2).render()).isEqualTo("[RSP + 8 * 2]");
  }

  @Test
  public void stackSlotsStartAtOne() {
    assertThrows(IllegalArgumentException.class, () -> Arg.stackSlot(0));
    assertThrows(IllegalArgumentException.class, () -> Arg.stackSlot(-3));
  }

  @Test
  public void kinds() {
    assertThat(Arg.constant(1).isWritable()).isFalse();
    assertThat(Arg.constant(1).isMemory()).isFalse();
    assertThat(Arg.of(Register.RAX).isWritable()).isTrue();
    assertThat(Arg.of(Register.RAX).isMemory()).isFalse();
    assertThat(Arg.stackSlot(1).isWritable()).isTrue();
    assertThat(Arg.stackSlot(1).isMemory()).isTrue();
  }

  @Test
  public void equality() {
    assertThat(Arg.of(Register.RDX)).isSameInstanceAs(Arg.of(Register.RDX));
    assertThat(Arg.constant(7)).isEqualTo(Arg.constant(7));
    assertThat(Arg.constant(7)).isNotEqualTo(Arg.constant(8));
    assertThat(Arg.stackSlot(3)).isEqualTo(Arg.memory(Register.RSP, -3));
    assertThat(Arg.stackSlot(3).hashCode()).isEqualTo(Arg.memory(Register.RSP, -3).hashCode());
    assertThat(Arg.stackSlot(3)).isNotEqualTo(Arg.stackSlot(4));
  }
}
