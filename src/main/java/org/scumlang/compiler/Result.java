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
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of a compiler stage: either a value or the first CompileError encountered. Results
 * are immutable.
 */
public final class Result<T> {

  private final @Nullable T value;
  private final @Nullable CompileError error;

  private Result(@Nullable T value, @Nullable CompileError error) {
    this.value = value;
    this.error = error;
  }

  public static <T> Result<T> ofValue(T value) {
    return new Result<>(Preconditions.checkNotNull(value), null);
  }

  public static <T> Result<T> ofError(CompileError error) {
    return new Result<>(null, Preconditions.checkNotNull(error));
  }

  public boolean isValue() {
    return error == null;
  }

  public boolean isError() {
    return error != null;
  }

  /** Returns the value; throws IllegalStateException if this is an error. */
  public T getValue() {
    Preconditions.checkState(error == null, "Result is an error: %s", error);
    return value;
  }

  /** Returns the error; throws IllegalStateException if this is a value. */
  public CompileError getError() {
    Preconditions.checkState(error != null, "Result is a value: %s", value);
    return error;
  }

  /** Applies {@code fn} to the value; errors are passed through unchanged. */
  public <U> Result<U> map(Function<? super T, ? extends U> fn) {
    return (error == null) ? ofValue(fn.apply(value)) : ofError(error);
  }

  /** Applies {@code fn} to the value; errors (including any returned by fn) short-circuit. */
  public <U> Result<U> flatMap(Function<? super T, Result<U>> fn) {
    return (error == null) ? fn.apply(value) : ofError(error);
  }

  @Override
  public String toString() {
    return (error == null) ? "Value(" + value + ")" : "Error(" + error.getMessage() + ")";
  }
}
