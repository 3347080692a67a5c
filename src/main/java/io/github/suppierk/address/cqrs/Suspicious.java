/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.suppierk.address.cqrs;

import java.util.function.Supplier;

/**
 * Defines internal utility for verifying programmatic inputs.
 *
 * <p>Business rule violations are reported as {@link CommandResult}s, whereas misuse of the API
 * itself (e.g. passing {@code null} instead of a projection snapshot) is a programming error and
 * is reported with an exception using the methods below.
 */
public abstract class Suspicious {
  /**
   * Checks values the instance depends on, e.g. results of factories or own fields.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the name used in the message
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T throwIllegalStateIfNull(final T value, final String whatMustNotBeNull) {
    if (value == null) {
      throw new IllegalStateException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * Checks method arguments only.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the argument name used in the message
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalArgumentException when the value is {@code null}
   */
  protected final <T> T throwIllegalArgumentIfNull(
      final T value, final String whatMustNotBeNull) {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * Checks argument properties which go beyond nullability, e.g. ownership of an event.
   *
   * @param condition which must hold
   * @param message describing the violation, only evaluated on failure
   * @throws IllegalArgumentException when the condition does not hold
   */
  protected final void throwIllegalArgumentUnless(
      final boolean condition, final Supplier<String> message) {
    if (!condition) {
      throw new IllegalArgumentException(message.get());
    }
  }
}
