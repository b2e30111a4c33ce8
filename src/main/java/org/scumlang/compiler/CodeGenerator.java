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
import com.google.common.collect.ImmutableList;
import org.scumlang.asm.Arg;
import org.scumlang.asm.Instruction;
import org.scumlang.asm.Register;
import org.scumlang.ast.Expression;
import org.scumlang.ast.Expression.BinaryOp;
import org.scumlang.ast.Expression.IdLiteral;
import org.scumlang.ast.Expression.If;
import org.scumlang.ast.Expression.Let;
import org.scumlang.ast.Expression.NumericLiteral;
import org.scumlang.ast.Expression.UnaryOp;

/**
 * Lowers an expression in A-Normal Form to a sequence of Instructions that leave its value in RAX.
 *
 * <p>Each variable lives in the stack slot its {@link Environment} assigns. A binary operation
 * saves its right operand in a scratch slot; scratch slots are numbered after every slot that a
 * variable of the expression could be given, so they never overlap a live variable. Labels for
 * conditionals are named after the id of the {@link If} node.
 *
 * <p>A CodeGenerator is used for a single call to {@link #compileExpression}.
 */
public final class CodeGenerator {

  static final Arg.Reg ACCUMULATOR = Arg.of(Register.RAX);

  static final Arg.Reg SECONDARY = Arg.of(Register.RCX);

  private final CompileOptions options;

  private final ImmutableList.Builder<Instruction> out = ImmutableList.builder();

  /** Scratch slots are numbered from {@code firstScratch}. */
  private final int firstScratch;

  private int scratchCount;

  private CodeGenerator(CompileOptions options, int firstScratch) {
    this.options = options;
    this.firstScratch = firstScratch;
  }

  /** Compiles {@code expr} with no variables in scope and default options. */
  public static Result<ImmutableList<Instruction>> compileExpression(Expression expr) {
    return compileExpression(expr, Environment.empty(), CompileOptions.DEFAULT);
  }

  public static Result<ImmutableList<Instruction>> compileExpression(
      Expression expr, Environment env) {
    return compileExpression(expr, env, CompileOptions.DEFAULT);
  }

  /**
   * Returns the instructions that evaluate {@code expr} into RAX, given that the variables of
   * {@code env} hold their values in their slots, or the first CompileError found.
   *
   * @param expr must be in A-Normal Form, and each {@link If} in it must have an id
   */
  public static Result<ImmutableList<Instruction>> compileExpression(
      Expression expr, Environment env, CompileOptions options) {
    Preconditions.checkArgument(
        AnfNormalizer.isAnf(expr), "expression is not in A-Normal Form: %s", expr);
    CodeGenerator generator =
        new CodeGenerator(options, env.boundCount() + expr.accept(LET_COUNTER) + 1);
    try {
      generator.emit(expr, env);
    } catch (CompileError e) {
      return Result.ofError(e);
    }
    return Result.ofValue(generator.out.build());
  }

  /** Returns the slot for the next scratch value. */
  private int newScratchSlot() {
    return firstScratch + scratchCount++;
  }

  private void emit(Expression expr, Environment env) {
    expr.accept(new Lowering(env));
  }

  /** Emits the code for a single expression in a single Environment. */
  private class Lowering implements Expression.Visitor<Void> {
    final Environment env;

    Lowering(Environment env) {
      this.env = env;
    }

    @Override
    public Void visitNumericLiteral(NumericLiteral expr) {
      long n = expr.value;
      if (options.checkLiteralRange()) {
        if (n < options.minLiteral()) {
          throw CompileError.numberUnderflow(n, options.minLiteral(), expr);
        } else if (n > options.maxLiteral()) {
          throw CompileError.numberOverflow(n, options.maxLiteral(), expr);
        }
      }
      out.add(Instruction.move(ACCUMULATOR, Arg.constant(n)));
      return null;
    }

    @Override
    public Void visitIdLiteral(IdLiteral expr) {
      Result<Integer> slot = env.lookup(expr.name, expr);
      if (slot.isError()) {
        throw slot.getError();
      }
      out.add(Instruction.move(ACCUMULATOR, Arg.stackSlot(slot.getValue())));
      return null;
    }

    @Override
    public Void visitUnaryOp(UnaryOp expr) {
      expr.operand.accept(this);
      switch (expr.kind) {
        case INCREMENT:
          out.add(Instruction.increment(ACCUMULATOR));
          break;
        case DECREMENT:
          out.add(Instruction.decrement(ACCUMULATOR));
          break;
        case DOUBLED:
          out.add(Instruction.add(ACCUMULATOR, ACCUMULATOR));
          break;
      }
      return null;
    }

    @Override
    public Void visitBinaryOp(BinaryOp expr) {
      expr.right.accept(this);
      Arg.Memory scratch = Arg.stackSlot(newScratchSlot());
      out.add(Instruction.move(scratch, ACCUMULATOR));
      expr.left.accept(this);
      switch (expr.kind) {
        case PLUS:
          out.add(Instruction.add(ACCUMULATOR, scratch));
          break;
        case MINUS:
          out.add(Instruction.subtract(ACCUMULATOR, scratch));
          break;
        case TIMES:
          out.add(Instruction.move(SECONDARY, scratch));
          out.add(Instruction.multiply(SECONDARY));
          break;
      }
      return null;
    }

    @Override
    public Void visitLet(Let expr) {
      expr.bound.accept(this);
      Environment extended = env.extend(expr.name);
      out.add(Instruction.move(Arg.stackSlot(extended.boundCount()), ACCUMULATOR));
      emit(expr.body, extended);
      return null;
    }

    @Override
    public Void visitIf(If expr) {
      Preconditions.checkArgument(expr.hasId(), "conditional has no id: %s", expr);
      int id = expr.id();
      String elseLabel = "else_" + id;
      String endLabel = "endif_" + id;
      expr.predicate.accept(this);
      out.add(Instruction.label("if_" + id));
      out.add(Instruction.compare(ACCUMULATOR, Arg.constant(0)));
      out.add(Instruction.jumpIfEqual(elseLabel));
      expr.thenBranch.accept(this);
      out.add(Instruction.jump(endLabel));
      out.add(Instruction.label(elseLabel));
      expr.elseBranch.accept(this);
      out.add(Instruction.label(endLabel));
      return null;
    }
  }

  /** Counts the Lets in an expression, an upper bound on the variable slots it will allocate. */
  private static final Expression.Visitor<Integer> LET_COUNTER =
      new Expression.Visitor<Integer>() {
        @Override
        public Integer visitNumericLiteral(NumericLiteral expr) {
          return 0;
        }

        @Override
        public Integer visitIdLiteral(IdLiteral expr) {
          return 0;
        }

        @Override
        public Integer visitUnaryOp(UnaryOp expr) {
          return expr.operand.accept(this);
        }

        @Override
        public Integer visitBinaryOp(BinaryOp expr) {
          return expr.left.accept(this) + expr.right.accept(this);
        }

        @Override
        public Integer visitLet(Let expr) {
          return 1 + expr.bound.accept(this) + expr.body.accept(this);
        }

        @Override
        public Integer visitIf(If expr) {
          return expr.predicate.accept(this)
              + expr.thenBranch.accept(this)
              + expr.elseBranch.accept(this);
        }
      };
}
