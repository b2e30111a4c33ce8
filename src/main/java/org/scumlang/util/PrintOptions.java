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

package org.scumlang.util;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Controls how expressions and programs are converted to text. PrintOptions are immutable; each
 * call that renders something takes one explicitly.
 */
public final class PrintOptions {

  /** Surface syntax, no ids, two-space instruction indent. */
  public static final PrintOptions DEFAULT = new Builder().build();

  /** Constructor-style expressions with their ids. */
  public static final PrintOptions DEBUG = new Builder().showIds(true).build();

  private final boolean showIds;
  private final String indent;
  private final String entryLabel;

  private PrintOptions(Builder builder) {
    this.showIds = builder.showIds;
    this.indent = builder.indent;
    this.entryLabel = builder.entryLabel;
  }

  /**
   * If true, expressions are printed in constructor form and each node is followed by {@code #id}
   * (when it has one); otherwise they are printed in the surface syntax.
   */
  public boolean showIds() {
    return showIds;
  }

  /** Prefix for every instruction line of a program except labels. */
  public String indent() {
    return indent;
  }

  /** The global symbol that the C runtime calls. */
  public String entryLabel() {
    return entryLabel;
  }

  public Builder toBuilder() {
    return new Builder().showIds(showIds).indent(indent).entryLabel(entryLabel);
  }

  /** A Builder is used to construct a new PrintOptions. */
  public static class Builder {
    private boolean showIds = false;
    private String indent = "  ";
    private String entryLabel = "our_code_starts_here";

    @CanIgnoreReturnValue
    public Builder showIds(boolean showIds) {
      this.showIds = showIds;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder indent(String indent) {
      this.indent = Preconditions.checkNotNull(indent);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder entryLabel(String entryLabel) {
      Preconditions.checkArgument(!entryLabel.isEmpty(), "entry label must not be empty");
      this.entryLabel = entryLabel;
      return this;
    }

    public PrintOptions build() {
      return new PrintOptions(this);
    }
  }
}
