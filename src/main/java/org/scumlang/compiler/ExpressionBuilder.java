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

import java.util.List;
import org.antlr.v4.runtime.Token;
import org.scumlang.ast.Expression;
import org.scumlang.ast.Expression.BinaryOp;
import org.scumlang.ast.Expression.UnaryOp;
import org.scumlang.compiler.ScumParser.ApplyExprContext;
import org.scumlang.compiler.ScumParser.ExprContext;
import org.scumlang.compiler.ScumParser.IdExprContext;
import org.scumlang.compiler.ScumParser.IfExprContext;
import org.scumlang.compiler.ScumParser.LetExprContext;
import org.scumlang.compiler.ScumParser.NumberExprContext;
import org.scumlang.compiler.ScumParser.ProgramContext;

/** Converts a parse tree into an (unannotated) Expression. */
class ExpressionBuilder extends ScumBaseVisitor<Expression> {

  @Override
  public Expression visitProgram(ProgramContext ctx) {
    return visit(ctx.expr());
  }

  @Override
  public Expression visitNumberExpr(NumberExprContext ctx) {
    Token token = ctx.INT().getSymbol();
    try {
      return Expression.num(Long.parseLong(token.getText()));
    } catch (NumberFormatException e) {
      throw CompileError.syntax(
          token.getLine(),
          token.getCharPositionInLine(),
          "Integer literal out of range: %s",
          token.getText());
    }
  }

  @Override
  public Expression visitIdExpr(IdExprContext ctx) {
    return Expression.id(ctx.ID().getText());
  }

  @Override
  public Expression visitLetExpr(LetExprContext ctx) {
    return Expression.let(ctx.ID().getText(), visit(ctx.expr(0)), visit(ctx.expr(1)));
  }

  @Override
  public Expression visitIfExpr(IfExprContext ctx) {
    return Expression.ifThenElse(visit(ctx.expr(0)), visit(ctx.expr(1)), visit(ctx.expr(2)));
  }

  @Override
  public Expression visitApplyExpr(ApplyExprContext ctx) {
    Token op = ctx.operator().getStart();
    String name = op.getText();
    List<ExprContext> args = ctx.expr();
    for (BinaryOp.Kind kind : BinaryOp.Kind.values()) {
      if (kind.symbol.equals(name)) {
        checkArity(op, args, 2);
        return Expression.binary(kind, visit(args.get(0)), visit(args.get(1)));
      }
    }
    for (UnaryOp.Kind kind : UnaryOp.Kind.values()) {
      if (kind.keyword.equals(name)) {
        checkArity(op, args, 1);
        return Expression.unary(kind, visit(args.get(0)));
      }
    }
    throw CompileError.unknownExpression(
        name, op.getLine(), op.getCharPositionInLine(), "Unknown operator '%s'", name);
  }

  private static void checkArity(Token op, List<ExprContext> args, int expected) {
    if (args.size() != expected) {
      throw CompileError.unknownExpression(
          op.getText(),
          op.getLine(),
          op.getCharPositionInLine(),
          "'%s' expects %s operand%s, got %s",
          op.getText(),
          expected,
          (expected == 1) ? "" : "s",
          args.size());
    }
  }
}
