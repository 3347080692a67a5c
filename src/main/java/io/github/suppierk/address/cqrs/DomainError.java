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

import java.io.Serializable;

/**
 * A single business rule violation.
 *
 * @param code for programmatic handling
 * @param message for humans
 */
public record DomainError(AddressErrorCode code, String message) implements Serializable {
  public DomainError {
    if (code == null) {
      throw new IllegalArgumentException("Error code cannot be null");
    }

    if (message == null) {
      throw new IllegalArgumentException("Error message cannot be null");
    }
  }

  @Override
  public String toString() {
    return "%s: %s".formatted(code, message);
  }
}
