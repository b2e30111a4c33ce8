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
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.scumlang.asm.Emulator;
import org.scumlang.asm.Program;
import org.scumlang.ast.Expression;
import org.scumlang.interpreter.Interpreter;
import org.scumlang.testing.ExpressionGenerator;
import org.scumlang.util.PrintOptions;

/** Checks each compiler stage against the interpreter on randomly generated programs. */
@RunWith(TestParameterInjector.class)
public class RandomProgramTest {

  private static final int PROGRAMS_PER_SEED = 300;

  private static final int MAX_DEPTH = 7;

  @TestParameter({"1", "2", "3", "42", "2025"})
  private int seed;

  private static long interpret(Expression expr) {
    return Interpreter.interpret(expr).getValue();
  }

  private static long emulate(Expression expr) {
    return Emulator.run(Compiler.compile(expr, CompileOptions.DEFAULT).getValue());
  }

  @Test
  public void normalizationPreservesMeaning() {
    ExpressionGenerator generator = new ExpressionGenerator(seed);
    for (int i = 0; i < PROGRAMS_PER_SEED; i++) {
      Expression expr = generator.next(MAX_DEPTH);
      Expression anf = AnfNormalizer.toAnf(Annotator.annotate(expr));
      assertWithMessage("Not in ANF: %s", anf).that(AnfNormalizer.isAnf(anf)).isTrue();
      assertWithMessage("Normalizing %s", expr).that(interpret(anf)).isEqualTo(interpret(expr));
    }
  }

  @Test
  public void compiledCodeMatchesInterpreter() {
    ExpressionGenerator generator = new ExpressionGenerator(seed);
    for (int i = 0; i < PROGRAMS_PER_SEED; i++) {
      Expression expr = generator.next(MAX_DEPTH);
      assertWithMessage("Compiling %s", expr).that(emulate(expr)).isEqualTo(interpret(expr));
    }
  }

  @Test
  public void compilationIsDeterministic() {
    ExpressionGenerator generator = new ExpressionGenerator(seed);
    for (int i = 0; i < 20; i++) {
      Expression expr = generator.next(MAX_DEPTH);
      Program first = Compiler.compile(expr, CompileOptions.DEFAULT).getValue();
      Program second = Compiler.compile(expr, CompileOptions.DEFAULT).getValue();
      assertThat(second.render(PrintOptions.DEFAULT)).isEqualTo(first.render(PrintOptions.DEFAULT));
    }
  }

  @Test
  public void arithmeticIdentities() {
    ExpressionGenerator generator = new ExpressionGenerator(seed);
    for (int i = 0; i < 50; i++) {
      Expression a = generator.next(3);
      Expression b = generator.next(3);
      assertThat(emulate(Expression.plus(a, b))).isEqualTo(emulate(Expression.plus(b, a)));
      assertThat(emulate(Expression.times(a, b))).isEqualTo(emulate(Expression.times(b, a)));
      assertThat(emulate(Expression.minus(a, a))).isEqualTo(0L);
      assertThat(emulate(Expression.doubled(a))).isEqualTo(emulate(Expression.plus(a, a)));
      assertThat(emulate(Expression.decrement(Expression.increment(a)))).isEqualTo(emulate(a));
      assertThat(emulate(Expression.increment(Expression.decrement(a)))).isEqualTo(emulate(a));
      assertThat(emulate(Expression.minus(Expression.plus(a, b), b))).isEqualTo(interpret(a));
      assertThat(emulate(Expression.plus(a, Expression.num(0)))).isEqualTo(emulate(a));
    }
  }
}
