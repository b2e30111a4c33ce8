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

import org.scumlang.ast.Expression;
import org.scumlang.ast.Expression.BinaryOp;
import org.scumlang.ast.Expression.IdLiteral;
import org.scumlang.ast.Expression.If;
import org.scumlang.ast.Expression.Let;
import org.scumlang.ast.Expression.NumericLiteral;
import org.scumlang.ast.Expression.UnaryOp;

/**
 * Assigns every node of an expression tree a distinct id. Ids are assigned in post-order (children
 * left to right, then the node itself), starting at zero, so the root always has id {@code
 * size() - 1}.
 *
 * <p>Any ids already present on the input are replaced.
 */
public final class Annotator implements Expression.Visitor<Expression> {

  private int next;

  private Annotator() {}

  /** Returns a copy of {@code expr} in which every node has an id. */
  public static Expression annotate(Expression expr) {
    return expr.accept(new Annotator());
  }

  private int nextId() {
    return next++;
  }

  @Override
  public Expression visitNumericLiteral(NumericLiteral expr) {
    return expr.withId(nextId());
  }

  @Override
  public Expression visitIdLiteral(IdLiteral expr) {
    return expr.withId(nextId());
  }

  @Override
  public Expression visitUnaryOp(UnaryOp expr) {
    Expression operand = expr.operand.accept(this);
    return expr.withOperand(operand).withId(nextId());
  }

  @Override
  public Expression visitBinaryOp(BinaryOp expr) {
    Expression left = expr.left.accept(this);
    Expression right = expr.right.accept(this);
    return expr.withOperands(left, right).withId(nextId());
  }

  @Override
  public Expression visitLet(Let expr) {
    Expression bound = expr.bound.accept(this);
    Expression body = expr.body.accept(this);
    return expr.withParts(bound, body).withId(nextId());
  }

  @Override
  public Expression visitIf(If expr) {
    Expression predicate = expr.predicate.accept(this);
    Expression thenBranch = expr.thenBranch.accept(this);
    Expression elseBranch = expr.elseBranch.accept(this);
    return expr.withParts(predicate, thenBranch, elseBranch).withId(nextId());
  }
}
