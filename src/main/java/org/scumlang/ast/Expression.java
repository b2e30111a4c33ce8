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

package org.scumlang.ast;

import com.google.common.base.Preconditions;
import java.util.Objects;
import java.util.regex.Pattern;
import org.scumlang.util.PrintOptions;

/**
 * An Expression is a node in the tree of a Scum program. There are six subclasses:
 *
 * <ul>
 *   <li>{@link NumericLiteral}: a 64-bit integer constant
 *   <li>{@link IdLiteral}: a reference to a variable
 *   <li>{@link UnaryOp}: increment, decrement, or doubling of one operand
 *   <li>{@link BinaryOp}: addition, subtraction, or multiplication of two operands
 *   <li>{@link Let}: binds a name to a value for the evaluation of a body
 *   <li>{@link If}: evaluates one of two branches depending on whether a predicate is zero
 * </ul>
 *
 * <p>No other subclasses can exist (the constructor is private), so a {@link Visitor} handles
 * every case.
 *
 * <p>Expressions are immutable. Each node has an optional id; trees built by the factory methods
 * have none, and {@code Annotator} returns a copy in which every node has a distinct one. The
 * {@code with...} methods return a copy that keeps this node's id.
 */
public abstract class Expression {

  /** The value returned by {@link #idOrNone} for a node that has not been annotated. */
  public static final int NO_ID = -1;

  /** Valid user identifiers; temporaries are the only names outside this set. */
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private static final String TEMP_PREFIX = "tmp$";

  private final int id;

  private Expression(int id) {
    Preconditions.checkArgument(id >= NO_ID, "bad id %s", id);
    this.id = id;
  }

  /** Returns true if this node has been assigned an id. */
  public final boolean hasId() {
    return id != NO_ID;
  }

  /** Returns this node's id; {@link #hasId} must be true. */
  public final int id() {
    Preconditions.checkState(hasId(), "expression has not been annotated: %s", this);
    return id;
  }

  /** Returns this node's id, or {@link #NO_ID}. */
  public final int idOrNone() {
    return id;
  }

  /** Returns a copy of this node (with the same children) that has the given id. */
  public abstract Expression withId(int id);

  /** True for {@link NumericLiteral} and {@link IdLiteral}. */
  public boolean isImmediate() {
    return false;
  }

  /** Returns the number of nodes in this tree. */
  public abstract int size();

  public abstract <T> T accept(Visitor<T> visitor);

  /** Appends a rendering of this expression to {@code sb}. */
  abstract void print(StringBuilder sb, PrintOptions options);

  public final String toString(PrintOptions options) {
    StringBuilder sb = new StringBuilder();
    print(sb, options);
    return sb.toString();
  }

  @Override
  public final String toString() {
    return toString(PrintOptions.DEFAULT);
  }

  /** Appends {@code "#id"} if ids are being shown and this node has one. */
  final void printId(StringBuilder sb, PrintOptions options) {
    if (options.showIds() && hasId()) {
      sb.append('#').append(id);
    }
  }

  /** One method for each subclass of Expression. */
  public interface Visitor<T> {
    T visitNumericLiteral(NumericLiteral expr);

    T visitIdLiteral(IdLiteral expr);

    T visitUnaryOp(UnaryOp expr);

    T visitBinaryOp(BinaryOp expr);

    T visitLet(Let expr);

    T visitIf(If expr);
  }

  /** Returns true if {@code name} may be used as a variable name in a program. */
  public static boolean isValidIdentifier(String name) {
    return IDENTIFIER.matcher(name).matches();
  }

  public static NumericLiteral num(long value) {
    return new NumericLiteral(value, NO_ID);
  }

  public static IdLiteral id(String name) {
    Preconditions.checkArgument(isValidIdentifier(name), "Invalid identifier '%s'", name);
    return new IdLiteral(name, NO_ID);
  }

  /**
   * Returns a reference to the temporary that holds the value of the node with the given id. The
   * name is not a valid identifier, so it cannot be captured by or shadow a user variable.
   */
  public static IdLiteral temporary(int forId) {
    Preconditions.checkArgument(forId >= 0);
    return new IdLiteral(TEMP_PREFIX + forId, NO_ID);
  }

  public static UnaryOp increment(Expression operand) {
    return new UnaryOp(UnaryOp.Kind.INCREMENT, operand, NO_ID);
  }

  public static UnaryOp decrement(Expression operand) {
    return new UnaryOp(UnaryOp.Kind.DECREMENT, operand, NO_ID);
  }

  public static UnaryOp doubled(Expression operand) {
    return new UnaryOp(UnaryOp.Kind.DOUBLED, operand, NO_ID);
  }

  public static BinaryOp plus(Expression left, Expression right) {
    return new BinaryOp(BinaryOp.Kind.PLUS, left, right, NO_ID);
  }

  public static BinaryOp minus(Expression left, Expression right) {
    return new BinaryOp(BinaryOp.Kind.MINUS, left, right, NO_ID);
  }

  public static BinaryOp times(Expression left, Expression right) {
    return new BinaryOp(BinaryOp.Kind.TIMES, left, right, NO_ID);
  }

  public static UnaryOp unary(UnaryOp.Kind kind, Expression operand) {
    return new UnaryOp(kind, operand, NO_ID);
  }

  public static BinaryOp binary(BinaryOp.Kind kind, Expression left, Expression right) {
    return new BinaryOp(kind, left, right, NO_ID);
  }

  public static Let let(String name, Expression bound, Expression body) {
    Preconditions.checkArgument(isValidIdentifier(name), "Invalid identifier '%s'", name);
    return new Let(name, bound, body, NO_ID);
  }

  /**
   * Returns a Let that binds the temporary for the node with the given id (see {@link
   * #temporary}).
   */
  public static Let letTemporary(int forId, Expression bound, Expression body) {
    return new Let(temporary(forId).name, bound, body, NO_ID);
  }

  public static If ifThenElse(Expression predicate, Expression thenBranch, Expression elseBranch) {
    return new If(predicate, thenBranch, elseBranch, NO_ID);
  }

  /** A 64-bit integer constant. */
  public static final class NumericLiteral extends Expression {
    public final long value;

    private NumericLiteral(long value, int id) {
      super(id);
      this.value = value;
    }

    @Override
    public NumericLiteral withId(int id) {
      return new NumericLiteral(value, id);
    }

    @Override
    public boolean isImmediate() {
      return true;
    }

    @Override
    public int size() {
      return 1;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitNumericLiteral(this);
    }

    @Override
    void print(StringBuilder sb, PrintOptions options) {
      if (options.showIds()) {
        sb.append("NumericLiteral(").append(value).append(')');
      } else {
        sb.append(value);
      }
      printId(sb, options);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof NumericLiteral other
          && value == other.value
          && idOrNone() == other.idOrNone();
    }

    @Override
    public int hashCode() {
      return Objects.hash(value, idOrNone());
    }
  }

  /** A reference to a variable, which must be bound by an enclosing {@link Let}. */
  public static final class IdLiteral extends Expression {
    public final String name;

    private IdLiteral(String name, int id) {
      super(id);
      this.name = name;
    }

    /** True if this refers to a temporary introduced by normalization. */
    public boolean isTemporary() {
      return name.startsWith(TEMP_PREFIX);
    }

    @Override
    public IdLiteral withId(int id) {
      return new IdLiteral(name, id);
    }

    @Override
    public boolean isImmediate() {
      return true;
    }

    @Override
    public int size() {
      return 1;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIdLiteral(this);
    }

    @Override
    void print(StringBuilder sb, PrintOptions options) {
      if (options.showIds()) {
        sb.append("IdLiteral(").append(name).append(')');
      } else {
        sb.append(name);
      }
      printId(sb, options);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof IdLiteral other
          && name.equals(other.name)
          && idOrNone() == other.idOrNone();
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, idOrNone());
    }
  }

  /** An operation on a single operand. */
  public static final class UnaryOp extends Expression {

    /** The supported unary operations. */
    public enum Kind {
      INCREMENT("inc", "Increment"),
      DECREMENT("dec", "Decrement"),
      DOUBLED("double", "Doubled");

      /** The operator's name in the surface syntax. */
      public final String keyword;

      final String debugName;

      Kind(String keyword, String debugName) {
        this.keyword = keyword;
        this.debugName = debugName;
      }

      /** Applies this operation with 64-bit wrapping arithmetic. */
      public long apply(long x) {
        switch (this) {
          case INCREMENT:
            return x + 1;
          case DECREMENT:
            return x - 1;
          case DOUBLED:
            return x + x;
        }
        throw new AssertionError(this);
      }
    }

    public final Kind kind;
    public final Expression operand;

    private UnaryOp(Kind kind, Expression operand, int id) {
      super(id);
      this.kind = Preconditions.checkNotNull(kind);
      this.operand = Preconditions.checkNotNull(operand);
    }

    /** Returns a copy of this node with a different operand. */
    public UnaryOp withOperand(Expression newOperand) {
      return new UnaryOp(kind, newOperand, idOrNone());
    }

    @Override
    public UnaryOp withId(int id) {
      return new UnaryOp(kind, operand, id);
    }

    @Override
    public int size() {
      return 1 + operand.size();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitUnaryOp(this);
    }

    @Override
    void print(StringBuilder sb, PrintOptions options) {
      if (options.showIds()) {
        sb.append(kind.debugName).append('(');
        operand.print(sb, options);
        sb.append(')');
        printId(sb, options);
      } else {
        sb.append('(').append(kind.keyword).append(' ');
        operand.print(sb, options);
        sb.append(')');
      }
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof UnaryOp other
          && kind == other.kind
          && operand.equals(other.operand)
          && idOrNone() == other.idOrNone();
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, operand, idOrNone());
    }
  }

  /** An arithmetic operation on two operands. */
  public static final class BinaryOp extends Expression {

    /** The supported binary operations. */
    public enum Kind {
      PLUS("+", "Plus"),
      MINUS("-", "Minus"),
      TIMES("*", "Times");

      /** The operator's symbol in the surface syntax. */
      public final String symbol;

      final String debugName;

      Kind(String symbol, String debugName) {
        this.symbol = symbol;
        this.debugName = debugName;
      }

      /** Applies this operation with 64-bit wrapping arithmetic. */
      public long apply(long x, long y) {
        switch (this) {
          case PLUS:
            return x + y;
          case MINUS:
            return x - y;
          case TIMES:
            return x * y;
        }
        throw new AssertionError(this);
      }
    }

    public final Kind kind;
    public final Expression left;
    public final Expression right;

    private BinaryOp(Kind kind, Expression left, Expression right, int id) {
      super(id);
      this.kind = Preconditions.checkNotNull(kind);
      this.left = Preconditions.checkNotNull(left);
      this.right = Preconditions.checkNotNull(right);
    }

    /** Returns a copy of this node with different operands. */
    public BinaryOp withOperands(Expression newLeft, Expression newRight) {
      return new BinaryOp(kind, newLeft, newRight, idOrNone());
    }

    @Override
    public BinaryOp withId(int id) {
      return new BinaryOp(kind, left, right, id);
    }

    @Override
    public int size() {
      return 1 + left.size() + right.size();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBinaryOp(this);
    }

    @Override
    void print(StringBuilder sb, PrintOptions options) {
      if (options.showIds()) {
        sb.append(kind.debugName).append('(');
        left.print(sb, options);
        sb.append(", ");
        right.print(sb, options);
        sb.append(')');
        printId(sb, options);
      } else {
        sb.append('(').append(kind.symbol).append(' ');
        left.print(sb, options);
        sb.append(' ');
        right.print(sb, options);
        sb.append(')');
      }
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof BinaryOp other
          && kind == other.kind
          && left.equals(other.left)
          && right.equals(other.right)
          && idOrNone() == other.idOrNone();
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, left, right, idOrNone());
    }
  }

  /**
   * Evaluates {@code bound}, then evaluates {@code body} with {@code name} bound to the result. A
   * Let whose name is already bound shadows the outer binding within its body.
   */
  public static final class Let extends Expression {
    public final String name;
    public final Expression bound;
    public final Expression body;

    private Let(String name, Expression bound, Expression body, int id) {
      super(id);
      this.name = Preconditions.checkNotNull(name);
      this.bound = Preconditions.checkNotNull(bound);
      this.body = Preconditions.checkNotNull(body);
    }

    /** Returns a copy of this node with a different bound expression and body. */
    public Let withParts(Expression newBound, Expression newBody) {
      return new Let(name, newBound, newBody, idOrNone());
    }

    @Override
    public Let withId(int id) {
      return new Let(name, bound, body, id);
    }

    @Override
    public int size() {
      return 1 + bound.size() + body.size();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitLet(this);
    }

    @Override
    void print(StringBuilder sb, PrintOptions options) {
      if (options.showIds()) {
        sb.append("Let(").append(name).append(", ");
        bound.print(sb, options);
        sb.append(", ");
        body.print(sb, options);
        sb.append(')');
        printId(sb, options);
      } else {
        sb.append("(let (").append(name).append(' ');
        bound.print(sb, options);
        sb.append(") ");
        body.print(sb, options);
        sb.append(')');
      }
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Let other
          && name.equals(other.name)
          && bound.equals(other.bound)
          && body.equals(other.body)
          && idOrNone() == other.idOrNone();
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, bound, body, idOrNone());
    }
  }

  /** Evaluates {@code thenBranch} if {@code predicate} is non-zero, {@code elseBranch} if not. */
  public static final class If extends Expression {
    public final Expression predicate;
    public final Expression thenBranch;
    public final Expression elseBranch;

    private If(Expression predicate, Expression thenBranch, Expression elseBranch, int id) {
      super(id);
      this.predicate = Preconditions.checkNotNull(predicate);
      this.thenBranch = Preconditions.checkNotNull(thenBranch);
      this.elseBranch = Preconditions.checkNotNull(elseBranch);
    }

    /** Returns a copy of this node with different children. */
    public If withParts(Expression newPredicate, Expression newThen, Expression newElse) {
      return new If(newPredicate, newThen, newElse, idOrNone());
    }

    @Override
    public If withId(int id) {
      return new If(predicate, thenBranch, elseBranch, id);
    }

    @Override
    public int size() {
      return 1 + predicate.size() + thenBranch.size() + elseBranch.size();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIf(this);
    }

    @Override
    void print(StringBuilder sb, PrintOptions options) {
      sb.append(options.showIds() ? "If(" : "(if ");
      String separator = options.showIds() ? ", " : " ";
      predicate.print(sb, options);
      sb.append(separator);
      thenBranch.print(sb, options);
      sb.append(separator);
      elseBranch.print(sb, options);
      sb.append(')');
      printId(sb, options);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof If other
          && predicate.equals(other.predicate)
          && thenBranch.equals(other.thenBranch)
          && elseBranch.equals(other.elseBranch)
          && idOrNone() == other.idOrNone();
    }

    @Override
    public int hashCode() {
      return Objects.hash(predicate, thenBranch, elseBranch, idOrNone());
    }
  }
}
