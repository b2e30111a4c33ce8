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

import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.scumlang.asm.Program;
import org.scumlang.ast.Expression;
import org.scumlang.util.PrintOptions;

/**
 * Compiles Scum programs to x86-64 assembly. The pipeline is
 *
 * <ol>
 *   <li>{@link Annotator#annotate}: give every node a distinct id;
 *   <li>{@link AnfNormalizer#toAnf}: make every operand immediate;
 *   <li>{@link CodeGenerator#compileExpression}: lower to instructions, starting with no
 *       variables in scope; and
 *   <li>{@link Program#render}: add the entry point scaffolding and print.
 * </ol>
 *
 * The first error from any stage is returned and nothing is printed.
 */
public final class Compiler {

  private static final Logger logger = Logger.getLogger(Compiler.class.getName());

  // Static methods only
  private Compiler() {}

  /** Compiles {@code expr} into a Program. */
  public static Result<Program> compile(Expression expr, CompileOptions options) {
    Expression annotated = Annotator.annotate(expr);
    Expression anf = AnfNormalizer.toAnf(annotated);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          String.format(
              "Normalized %s nodes to %s: %s",
              annotated.size(), anf.size(), anf.toString(PrintOptions.DEBUG)));
    }
    Result<Program> result =
        CodeGenerator.compileExpression(anf, Environment.empty(), options).map(Program::new);
    if (result.isError()) {
      logger.fine(() -> "Compilation failed: " + result.getError().getMessage());
    } else {
      logger.fine(() -> "Generated " + result.getValue().body.size() + " instructions");
    }
    return result;
  }

  /** Compiles {@code expr} to assembler source with default options. */
  public static Result<String> compileProgram(Expression expr) {
    return compileProgram(expr, CompileOptions.DEFAULT, PrintOptions.DEFAULT);
  }

  /** Compiles {@code expr} to assembler source. */
  public static Result<String> compileProgram(
      Expression expr, CompileOptions options, PrintOptions printOptions) {
    return compile(expr, options).map(program -> program.render(printOptions));
  }

  /** Parses a Scum program. */
  public static Result<Expression> parse(CharStream input) {
    // Throw CompileErrors in response to parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw CompileError.syntax(msg, lineNum, charPositionInLine);
          }
        };
    ScumLexer lexer = new ScumLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    ScumParser parser = new ScumParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    try {
      return Result.ofValue(new ExpressionBuilder().visit(parser.program()));
    } catch (CompileError e) {
      return Result.ofError(e);
    }
  }

  /** Parses a Scum program. */
  public static Result<Expression> parse(String source) {
    return parse(CharStreams.fromString(source));
  }
}
