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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import org.scumlang.ast.Expression;
import org.scumlang.ast.Expression.BinaryOp;
import org.scumlang.ast.Expression.IdLiteral;
import org.scumlang.ast.Expression.If;
import org.scumlang.ast.Expression.Let;
import org.scumlang.ast.Expression.NumericLiteral;
import org.scumlang.ast.Expression.UnaryOp;

/**
 * Rewrites expressions into A-Normal Form: every operand of a {@link UnaryOp} or {@link BinaryOp}
 * and every {@link If} predicate is immediate (a literal or an identifier).
 *
 * <p>A compound operand is evaluated into a temporary bound by a new {@link Let} that encloses the
 * operation; the temporary is named after the id of the operand it holds (see {@link
 * Expression#temporary}), so the input must have been annotated. Temporaries are introduced in
 * evaluation order, outermost first. The branches of an If are normalized separately, so nothing
 * computed inside a branch is moved above the test.
 */
public final class AnfNormalizer {

  // Static methods only
  private AnfNormalizer() {}

  /** Returns an expression in ANF that evaluates to the same value as {@code expr}. */
  public static Expression toAnf(Expression expr) {
    Hoister hoister = new Hoister();
    Expression core = expr.accept(hoister);
    return hoister.wrap(core);
  }

  /** True if {@code expr} is in A-Normal Form. */
  public static boolean isAnf(Expression expr) {
    return expr.accept(ANF_CHECKER);
  }

  /** A temporary waiting to be bound around the expression that uses it. */
  private static class Binding {
    final int forId;
    final Expression value;

    Binding(int forId, Expression value) {
      this.forId = forId;
      this.value = value;
    }
  }

  /**
   * Normalizes an expression except for its outermost layer of temporaries, which are left in
   * {@link #hoisted} for the caller to bind.
   */
  private static class Hoister implements Expression.Visitor<Expression> {
    private final List<Binding> hoisted = new ArrayList<>();

    /** Returns {@code core} enclosed by the Lets for each hoisted temporary. */
    Expression wrap(Expression core) {
      Expression result = core;
      for (int i = hoisted.size() - 1; i >= 0; i--) {
        Binding b = hoisted.get(i);
        result = Expression.letTemporary(b.forId, b.value, result);
      }
      return result;
    }

    /**
     * Normalizes {@code expr}; if the result is not immediate, binds it to a new temporary and
     * returns a reference to that.
     */
    private Expression immediate(Expression expr) {
      Expression core = expr.accept(this);
      if (core.isImmediate()) {
        return core;
      }
      Preconditions.checkArgument(
          expr.hasId(), "expression must be annotated before normalization: %s", expr);
      hoisted.add(new Binding(expr.id(), core));
      return Expression.temporary(expr.id());
    }

    @Override
    public Expression visitNumericLiteral(NumericLiteral expr) {
      return expr;
    }

    @Override
    public Expression visitIdLiteral(IdLiteral expr) {
      return expr;
    }

    @Override
    public Expression visitUnaryOp(UnaryOp expr) {
      return expr.withOperand(immediate(expr.operand));
    }

    @Override
    public Expression visitBinaryOp(BinaryOp expr) {
      // Left's temporaries must be bound before right's.
      Expression left = immediate(expr.left);
      Expression right = immediate(expr.right);
      return expr.withOperands(left, right);
    }

    @Override
    public Expression visitLet(Let expr) {
      // Temporaries needed by the bound expression enclose this Let; the body gets its own.
      Expression bound = expr.bound.accept(this);
      return expr.withParts(bound, toAnf(expr.body));
    }

    @Override
    public Expression visitIf(If expr) {
      Expression predicate = immediate(expr.predicate);
      return expr.withParts(predicate, toAnf(expr.thenBranch), toAnf(expr.elseBranch));
    }
  }

  private static final Expression.Visitor<Boolean> ANF_CHECKER =
      new Expression.Visitor<Boolean>() {
        @Override
        public Boolean visitNumericLiteral(NumericLiteral expr) {
          return true;
        }

        @Override
        public Boolean visitIdLiteral(IdLiteral expr) {
          return true;
        }

        @Override
        public Boolean visitUnaryOp(UnaryOp expr) {
          return expr.operand.isImmediate();
        }

        @Override
        public Boolean visitBinaryOp(BinaryOp expr) {
          return expr.left.isImmediate() && expr.right.isImmediate();
        }

        @Override
        public Boolean visitLet(Let expr) {
          return expr.bound.accept(this) && expr.body.accept(this);
        }

        @Override
        public Boolean visitIf(If expr) {
          return expr.predicate.isImmediate()
              && expr.thenBranch.accept(this)
              && expr.elseBranch.accept(this);
        }
      };
}
