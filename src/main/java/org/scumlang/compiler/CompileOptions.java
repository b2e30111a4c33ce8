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
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** Settings that affect code generation. CompileOptions are immutable. */
public final class CompileOptions {

  /** No literal range check. */
  public static final CompileOptions DEFAULT = new Builder().build();

  private final boolean checkLiteralRange;
  private final long minLiteral;
  private final long maxLiteral;

  private CompileOptions(Builder builder) {
    this.checkLiteralRange = builder.checkLiteralRange;
    this.minLiteral = builder.minLiteral;
    this.maxLiteral = builder.maxLiteral;
  }

  /**
   * If true, a numeric literal outside {@code [minLiteral, maxLiteral]} is rejected with
   * NUMBER_UNDERFLOW or NUMBER_OVERFLOW.
   */
  public boolean checkLiteralRange() {
    return checkLiteralRange;
  }

  public long minLiteral() {
    return minLiteral;
  }

  public long maxLiteral() {
    return maxLiteral;
  }

  /** A Builder is used to construct a new CompileOptions. */
  public static class Builder {
    private boolean checkLiteralRange = false;

    // The default range leaves room for a one-bit tag, should values ever be tagged.
    private long minLiteral = Long.MIN_VALUE / 2;
    private long maxLiteral = Long.MAX_VALUE / 2;

    @CanIgnoreReturnValue
    public Builder checkLiteralRange(boolean checkLiteralRange) {
      this.checkLiteralRange = checkLiteralRange;
      return this;
    }

    /** Sets the literal range and enables checking it. */
    @CanIgnoreReturnValue
    public Builder literalRange(long min, long max) {
      Preconditions.checkArgument(min <= max, "empty range %s..%s", min, max);
      this.minLiteral = min;
      this.maxLiteral = max;
      this.checkLiteralRange = true;
      return this;
    }

    public CompileOptions build() {
      return new CompileOptions(this);
    }
  }
}
