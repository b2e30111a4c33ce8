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

package org.scumlang.interpreter;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.scumlang.ast.Expression;
import org.scumlang.ast.Expression.BinaryOp;
import org.scumlang.ast.Expression.IdLiteral;
import org.scumlang.ast.Expression.If;
import org.scumlang.ast.Expression.Let;
import org.scumlang.ast.Expression.NumericLiteral;
import org.scumlang.ast.Expression.UnaryOp;
import org.scumlang.compiler.CompileError;
import org.scumlang.compiler.Result;

/**
 * Evaluates expressions directly, as a reference for what compiled code should compute.
 * Arithmetic wraps around on 64-bit overflow, as it does in compiled code.
 *
 * <p>Works equally on raw, annotated, and normalized trees.
 */
public final class Interpreter implements Expression.Visitor<Long> {

  private final ImmutableMap<String, Long> bindings;

  private Interpreter(ImmutableMap<String, Long> bindings) {
    this.bindings = bindings;
  }

  /** Evaluates {@code expr} with no variables bound. */
  public static Result<Long> interpret(Expression expr) {
    return interpret(expr, ImmutableMap.of());
  }

  /**
   * Returns the value of {@code expr} when its free variables have the values given by {@code
   * bindings}, or UNBOUND_IDENTIFIER if it refers to a variable that has none.
   */
  public static Result<Long> interpret(Expression expr, Map<String, Long> bindings) {
    try {
      return Result.ofValue(expr.accept(new Interpreter(ImmutableMap.copyOf(bindings))));
    } catch (CompileError e) {
      return Result.ofError(e);
    }
  }

  @Override
  public Long visitNumericLiteral(NumericLiteral expr) {
    return expr.value;
  }

  @Override
  public Long visitIdLiteral(IdLiteral expr) {
    Long value = bindings.get(expr.name);
    if (value == null) {
      throw CompileError.unboundIdentifier(expr.name, expr);
    }
    return value;
  }

  @Override
  public Long visitUnaryOp(UnaryOp expr) {
    return expr.kind.apply(expr.operand.accept(this));
  }

  @Override
  public Long visitBinaryOp(BinaryOp expr) {
    long left = expr.left.accept(this);
    long right = expr.right.accept(this);
    return expr.kind.apply(left, right);
  }

  @Override
  public Long visitLet(Let expr) {
    long bound = expr.bound.accept(this);
    ImmutableMap<String, Long> extended =
        ImmutableMap.<String, Long>builderWithExpectedSize(bindings.size() + 1)
            .putAll(bindings)
            .put(expr.name, bound)
            .buildKeepingLast();
    return expr.body.accept(new Interpreter(extended));
  }

  @Override
  public Long visitIf(If expr) {
    long predicate = expr.predicate.accept(this);
    return (predicate != 0) ? expr.thenBranch.accept(this) : expr.elseBranch.accept(this);
  }
}
