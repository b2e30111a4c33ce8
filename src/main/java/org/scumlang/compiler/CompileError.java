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

import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import org.jspecify.annotations.Nullable;
import org.scumlang.ast.Expression;

/**
 * All Scum language errors detected before execution are represented by a CompileError.
 *
 * <p>A CompileError may be thrown within a compiler stage, but each stage's public entry point
 * catches it and returns it in a {@link Result}.
 */
public class CompileError extends RuntimeException {

  /** The kinds of CompileError. Each has a distinct exit status for the command-line tool. */
  public enum Kind {
    SYNTAX_ERROR(2),
    UNKNOWN_EXPRESSION(3),
    UNBOUND_IDENTIFIER(4),
    NUMBER_OVERFLOW(5),
    NUMBER_UNDERFLOW(6);

    public final int exitStatus;

    Kind(int exitStatus) {
      this.exitStatus = exitStatus;
    }
  }

  public final Kind kind;
  public final String msg;

  /** The identifier this error refers to, if any. */
  public final @Nullable String name;

  /** The id of the expression this error refers to, or {@link Expression#NO_ID}. */
  public final int nodeId;

  /** Source position (1-based line), or 0 if the error was not found while parsing. */
  public final int lineNum;

  public final int charPositionInLine;

  private CompileError(
      Kind kind,
      String msg,
      @Nullable String name,
      int nodeId,
      int lineNum,
      int charPositionInLine) {
    super(msg);
    this.kind = kind;
    this.msg = msg;
    this.name = name;
    this.nodeId = nodeId;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
  }

  @Override
  public String getMessage() {
    if (lineNum > 0) {
      return String.format("%s (%s:%s)", msg, lineNum, charPositionInLine);
    } else if (nodeId != Expression.NO_ID) {
      return String.format("%s (node %s)", msg, nodeId);
    }
    return msg;
  }

  /** Returns a new "Unbound identifier '%s'" CompileError. */
  public static CompileError unboundIdentifier(String name, Expression where) {
    return new CompileError(
        Kind.UNBOUND_IDENTIFIER,
        String.format("Unbound identifier '%s'", name),
        name,
        where.idOrNone(),
        0,
        0);
  }

  /** Returns a new "Unbound identifier '%s'" CompileError that isn't tied to a node. */
  public static CompileError unboundIdentifier(String name) {
    return new CompileError(
        Kind.UNBOUND_IDENTIFIER,
        String.format("Unbound identifier '%s'", name),
        name,
        Expression.NO_ID,
        0,
        0);
  }

  /** Returns a new "Number %s exceeds maximum %s" CompileError. */
  public static CompileError numberOverflow(long n, long max, Expression where) {
    return new CompileError(
        Kind.NUMBER_OVERFLOW,
        String.format("Number %s exceeds maximum %s", n, max),
        null,
        where.idOrNone(),
        0,
        0);
  }

  /** Returns a new "Number %s is below minimum %s" CompileError. */
  public static CompileError numberUnderflow(long n, long min, Expression where) {
    return new CompileError(
        Kind.NUMBER_UNDERFLOW,
        String.format("Number %s is below minimum %s", n, min),
        null,
        where.idOrNone(),
        0,
        0);
  }

  /** Returns a new SYNTAX_ERROR at the given source position. */
  public static CompileError syntax(String msg, int lineNum, int charPositionInLine) {
    return new CompileError(
        Kind.SYNTAX_ERROR, msg, null, Expression.NO_ID, lineNum, charPositionInLine);
  }

  /** Returns a new SYNTAX_ERROR at the given source position. */
  @FormatMethod
  static CompileError syntax(
      int lineNum, int charPositionInLine, String fmt, @Nullable Object... fmtArgs) {
    return syntax(String.format(fmt, fmtArgs), lineNum, charPositionInLine);
  }

  /** Returns a new UNKNOWN_EXPRESSION for an application form with the given head. */
  @FormatMethod
  static CompileError unknownExpression(
      String name,
      int lineNum,
      int charPositionInLine,
      @FormatString String fmt,
      @Nullable Object... fmtArgs) {
    return new CompileError(
        Kind.UNKNOWN_EXPRESSION,
        String.format(fmt, fmtArgs),
        name,
        Expression.NO_ID,
        lineNum,
        charPositionInLine);
  }
}
