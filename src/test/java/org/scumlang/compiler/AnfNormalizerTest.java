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
import static org.scumlang.ast.Expression.id;
import static org.scumlang.ast.Expression.ifThenElse;
import static org.scumlang.ast.Expression.increment;
import static org.scumlang.ast.Expression.let;
import static org.scumlang.ast.Expression.minus;
import static org.scumlang.ast.Expression.num;
import static org.scumlang.ast.Expression.plus;
import static org.scumlang.ast.Expression.times;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.scumlang.ast.Expression;
import org.scumlang.util.PrintOptions;

@RunWith(JUnit4.class)
public class AnfNormalizerTest {

  private static Expression normalize(Expression expr) {
    return AnfNormalizer.toAnf(Annotator.annotate(expr));
  }

  @Test
  public void immediateOperandsAreUnchanged() {
    Expression annotated = Annotator.annotate(plus(num(1), id("a")));
    assertThat(AnfNormalizer.toAnf(annotated)).isEqualTo(annotated);
    // Nothing needs a temporary, so ids are not required.
    assertThat(AnfNormalizer.toAnf(plus(num(1), id("a")))).isEqualTo(plus(num(1), id("a")));
  }

  @Test
  public void leftOperandIsBoundFirst() {
    Expression anf = normalize(plus(minus(num(4), num(3)), times(num(4), num(5))));
    assertThat(anf.toString())
        .isEqualTo("(let (tmp$2 (- 4 3)) (let (tmp$5 (* 4 5)) (+ tmp$2 tmp$5)))");
    assertThat(AnfNormalizer.isAnf(anf)).isTrue();
  }

  @Test
  public void nestedUnary() {
    assertThat(normalize(increment(increment(increment(num(1))))).toString())
        .isEqualTo("(let (tmp$1 (inc 1)) (let (tmp$2 (inc tmp$1)) (inc tmp$2)))");
  }

  @Test
  public void predicateIsHoisted() {
    Expression anf = normalize(ifThenElse(increment(num(1)), increment(num(2)), num(3)));
    assertThat(anf.toString()).isEqualTo("(let (tmp$1 (inc 1)) (if tmp$1 (inc 2) 3))");
    // Original nodes keep their ids; the new ones have none.
    assertThat(anf.toString(PrintOptions.DEBUG))
        .isEqualTo(
            "Let(tmp$1, Increment(NumericLiteral(1)#0)#1, If(IdLiteral(tmp$1),"
                + " Increment(NumericLiteral(2)#2)#3, NumericLiteral(3)#4)#5)");
  }

  @Test
  public void branchesAreNormalizedSeparately() {
    Expression anf =
        normalize(
            ifThenElse(
                num(0), increment(increment(num(2))), times(num(3), plus(num(4), id("z")))));
    assertThat(anf.toString())
        .isEqualTo(
            "(if 0 (let (tmp$2 (inc 2)) (inc tmp$2)) (let (tmp$7 (+ 4 z)) (* 3 tmp$7)))");
  }

  @Test
  public void letBoundTemporariesEncloseTheLet() {
    Expression anf = normalize(let("x", plus(increment(num(1)), num(2)), id("x")));
    assertThat(anf.toString()).isEqualTo("(let (tmp$1 (inc 1)) (let (x (+ tmp$1 2)) x))");
  }

  @Test
  public void letBodyIsNormalizedInsideTheLet() {
    Expression anf = normalize(let("x", num(1), plus(id("x"), increment(id("x")))));
    assertThat(anf.toString()).isEqualTo("(let (x 1) (let (tmp$3 (inc x)) (+ x tmp$3)))");
  }

  @Test
  public void temporariesCannotCapture() {
    // A user variable named like a temporary is rejected, so a temporary never shadows one.
    assertThrows(IllegalArgumentException.class, () -> let("tmp$1", num(1), num(2)));
    Expression anf = normalize(let("tmp_1", num(5), plus(increment(id("tmp_1")), num(1))));
    assertThat(anf.toString())
        .isEqualTo("(let (tmp_1 5) (let (tmp$2 (inc tmp_1)) (+ tmp$2 1)))");
  }

  @Test
  public void unannotatedInputIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> AnfNormalizer.toAnf(increment(increment(num(1)))));
  }

  @Test
  public void isAnf() {
    assertThat(AnfNormalizer.isAnf(num(1))).isTrue();
    assertThat(AnfNormalizer.isAnf(plus(num(1), id("a")))).isTrue();
    assertThat(AnfNormalizer.isAnf(plus(increment(num(1)), num(2)))).isFalse();
    assertThat(AnfNormalizer.isAnf(increment(plus(num(1), num(2))))).isFalse();
    assertThat(AnfNormalizer.isAnf(ifThenElse(increment(num(1)), num(2), num(3)))).isFalse();
    // A Let may bind any expression that is itself in ANF.
    assertThat(AnfNormalizer.isAnf(let("a", ifThenElse(num(1), num(2), num(3)), id("a"))))
        .isTrue();
    assertThat(AnfNormalizer.isAnf(let("a", num(1), plus(num(1), increment(id("a"))))))
        .isFalse();
  }

  @Test
  public void normalizingIsIdempotent() {
    Expression anf = normalize(plus(minus(num(4), num(3)), times(num(4), num(5))));
    assertThat(AnfNormalizer.toAnf(anf)).isEqualTo(anf);
  }
}
