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

package org.scumlang.compiler;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.scumlang.ast.Expression;

@RunWith(JUnit4.class)
public class EnvironmentTest {

  @Test
  public void empty() {
    Environment env = Environment.empty();
    assertThat(env.isEmpty()).isTrue();
    assertThat(env.boundCount()).isEqualTo(0);
    assertThat(env.names()).isEmpty();
    assertThat(env.isBound("x")).isFalse();
  }

  @Test
  public void slotsAreAssignedInOrder() {
    Environment env = Environment.empty().extend("x").extend("y");
    assertThat(env.lookup("x").getValue()).isEqualTo(1);
    assertThat(env.lookup("y").getValue()).isEqualTo(2);
    assertThat(env.boundCount()).isEqualTo(2);
    assertThat(env.names()).containsExactly("x", "y").inOrder();
  }

  @Test
  public void extendDoesNotModify() {
    Environment outer = Environment.empty().extend("x");
    Environment inner = outer.extend("y");
    assertThat(outer.isBound("y")).isFalse();
    assertThat(outer.boundCount()).isEqualTo(1);
    assertThat(inner.isBound("y")).isTrue();
  }

  @Test
  public void shadowingAllocatesANewSlot() {
    Environment env = Environment.empty().extend("a").extend("b").extend("a");
    assertThat(env.lookup("a").getValue()).isEqualTo(3);
    assertThat(env.lookup("b").getValue()).isEqualTo(2);
    assertThat(env.boundCount()).isEqualTo(3);
    // Only the visible bindings are listed.
    assertThat(ImmutableList.copyOf(env.names())).containsExactly("a", "b");
  }

  @Test
  public void lookup() {
    Environment env = Environment.empty().extend("x");
    assertThat(env.lookup("x").getValue()).isEqualTo(1);
    Result<Integer> missing = env.lookup("z");
    assertThat(missing.isError()).isTrue();
    assertThat(missing.getError().kind).isEqualTo(CompileError.Kind.UNBOUND_IDENTIFIER);
    assertThat(missing.getError().name).isEqualTo("z");
    assertThat(missing.getError().getMessage()).isEqualTo("Unbound identifier 'z'");
    assertThrows(IllegalStateException.class, missing::getValue);
  }

  @Test
  public void lookupReportsTheNode() {
    Environment env = Environment.empty().extend("x");
    assertThat(env.lookup("x", Expression.id("x").withId(2)).getValue()).isEqualTo(1);
    CompileError error = env.lookup("z", Expression.id("z").withId(5)).getError();
    assertThat(error.kind).isEqualTo(CompileError.Kind.UNBOUND_IDENTIFIER);
    assertThat(error.nodeId).isEqualTo(5);
    assertThat(error.getMessage()).isEqualTo("Unbound identifier 'z' (node 5)");
    assertThat(env.lookup("z", null).getError().nodeId).isEqualTo(Expression.NO_ID);
  }

  @Test
  public void equality() {
    assertThat(Environment.empty().extend("x")).isEqualTo(Environment.empty().extend("x"));
    assertThat(Environment.empty().extend("x").extend("x"))
        .isNotEqualTo(Environment.empty().extend("x"));
  }
}
