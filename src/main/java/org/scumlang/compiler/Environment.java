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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;
import org.scumlang.ast.Expression;

/**
 * An Environment maps each variable in scope to the stack slot that holds its value. Environments
 * are immutable; {@link #extend} returns a new one.
 *
 * <p>Slots are assigned sequentially from 1 in the order bindings are added and are never reused:
 * rebinding a name gives it a new slot, and the old slot stays allocated (and may still be live in
 * an enclosing scope).
 */
public final class Environment {

  private static final Environment EMPTY = new Environment(ImmutableMap.of(), 0);

  /** Maps each visible name to its slot, in the order the names were first bound. */
  private final ImmutableMap<String, Integer> slots;

  /** The number of bindings added so far, including shadowed ones; also the highest slot used. */
  private final int boundCount;

  private Environment(ImmutableMap<String, Integer> slots, int boundCount) {
    this.slots = slots;
    this.boundCount = boundCount;
  }

  /** Returns an Environment with no bindings. */
  public static Environment empty() {
    return EMPTY;
  }

  /**
   * Returns a new Environment in which {@code name} is bound to slot {@code boundCount() + 1}. Any
   * previous binding of {@code name} is shadowed.
   */
  public Environment extend(String name) {
    int slot = boundCount + 1;
    ImmutableMap<String, Integer> newSlots =
        ImmutableMap.<String, Integer>builderWithExpectedSize(slots.size() + 1)
            .putAll(slots)
            .put(name, slot)
            .buildKeepingLast();
    return new Environment(newSlots, slot);
  }

  /** Returns the slot bound to {@code name}, or an UNBOUND_IDENTIFIER error. */
  public Result<Integer> lookup(String name) {
    return lookup(name, null);
  }

  /**
   * Returns the slot bound to {@code name}, or an UNBOUND_IDENTIFIER error that refers to {@code
   * where} (if non-null).
   */
  public Result<Integer> lookup(String name, @Nullable Expression where) {
    Integer slot = slots.get(name);
    if (slot != null) {
      return Result.ofValue(slot);
    }
    return Result.ofError(
        (where == null)
            ? CompileError.unboundIdentifier(name)
            : CompileError.unboundIdentifier(name, where));
  }

  public boolean isBound(String name) {
    return slots.containsKey(name);
  }

  /** The number of slots allocated, i.e. the number of calls to {@link #extend} so far. */
  public int boundCount() {
    return boundCount;
  }

  /** The names that are currently visible, in the order they were first bound. */
  public Iterable<String> names() {
    return slots.keySet();
  }

  public boolean isEmpty() {
    return boundCount == 0;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Environment other
        && boundCount == other.boundCount
        && slots.equals(other.slots);
  }

  @Override
  public int hashCode() {
    return slots.hashCode() * 31 + boundCount;
  }

  @Override
  public String toString() {
    return slots.toString();
  }
}
