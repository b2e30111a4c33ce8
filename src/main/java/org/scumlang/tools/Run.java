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

package org.scumlang.tools;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;
import org.scumlang.asm.Emulator;
import org.scumlang.asm.Program;
import org.scumlang.ast.Expression;
import org.scumlang.ast.Expression.NumericLiteral;
import org.scumlang.compiler.Annotator;
import org.scumlang.compiler.CompileError;
import org.scumlang.compiler.CompileOptions;
import org.scumlang.compiler.Compiler;
import org.scumlang.compiler.Result;
import org.scumlang.util.PrintOptions;

/**
 * A simple command-line tool that compiles a single Scum program and prints the assembler source.
 *
 * <p>If the file contains just an integer {@code n}, the program compiled is {@code (+ (- n 3) (*
 * 4 5))}. The system property {@code run=true} also executes the result in the {@link Emulator};
 * {@code checkRange=true} rejects literals that would not fit in 63 bits.
 */
public class Run {
  private Run() {}

  static final int USAGE_ERROR = 1;

  private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /** Does the work of {@link #main} and returns the exit status. */
  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args.length != 1) {
      err.println("Use: run <fileName>");
      return USAGE_ERROR;
    }
    boolean execute = Boolean.parseBoolean(System.getProperty("run", "false"));
    boolean checkRange = Boolean.parseBoolean(System.getProperty("checkRange", "false"));
    String source;
    try {
      source = Files.readString(Path.of(args[0]), UTF_8);
    } catch (IOException e) {
      err.printf("error: cannot read %s: %s\n", args[0], e.getMessage());
      return USAGE_ERROR;
    }
    CompileOptions options = new CompileOptions.Builder().checkLiteralRange(checkRange).build();
    Result<Expression> expr = sourceExpression(source.trim());
    Result<Program> result = expr.flatMap(e -> Compiler.compile(e, options));
    // Nothing is written to out unless every stage succeeded.
    if (result.isError()) {
      CompileError error = result.getError();
      err.printf("error: %s: %s\n", error.kind, error.getMessage());
      return error.kind.exitStatus;
    }
    Program program = result.getValue();
    out.println("; " + Annotator.annotate(expr.getValue()).toString(PrintOptions.DEBUG));
    out.print(program.render(PrintOptions.DEFAULT));
    if (execute) {
      out.println("; result: " + Emulator.run(program));
    }
    return 0;
  }

  /** Returns the expression for the given file contents. */
  static Result<Expression> sourceExpression(String source) {
    Result<Expression> parsed = Compiler.parse(source);
    if (INTEGER.matcher(source).matches()) {
      // The parser has range-checked it.
      return parsed.map(literal -> demonstration(((NumericLiteral) literal).value));
    }
    return parsed;
  }

  /** The program compiled for a file containing just {@code n}. */
  static Expression demonstration(long n) {
    return Expression.plus(
        Expression.minus(Expression.num(n), Expression.num(3)),
        Expression.times(Expression.num(4), Expression.num(5)));
  }
}
