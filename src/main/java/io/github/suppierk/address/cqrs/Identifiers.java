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

import java.util.UUID;

/** Helpers around the zero identifier. */
public final class Identifiers {
  /** The zero identifier, never assigned to an entity. */
  public static final UUID EMPTY = new UUID(0L, 0L);

  private Identifiers() {
    // Cannot be instantiated
  }

  /**
   * @param id to check
   * @return {@code true} if the identifier is {@code null} or the zero identifier
   */
  public static boolean isEmpty(final UUID id) {
    return id == null || EMPTY.equals(id);
  }

  /**
   * @param value to check
   * @return {@code true} if the value is {@code null}, empty or consists of whitespace only
   */
  public static boolean isBlank(final String value) {
    return value == null || value.isBlank();
  }
}
