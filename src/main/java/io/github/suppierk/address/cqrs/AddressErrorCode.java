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

/**
 * Stable symbolic codes of every caller-facing failure.
 *
 * <p>Declaration order matches the order in which aggregates evaluate their rules.
 */
public enum AddressErrorCode {
  /** Identifier passed to a creation command is the zero identifier. */
  INVALID_IDENTIFIER,
  /** Required text field is {@code null}, empty or whitespace only. */
  REQUIRED_FIELD_MISSING,
  /** Reference to another entity is the zero identifier. */
  REFERENCE_INVALID,
  /** Reference to another entity is absent from the supplied projection snapshot. */
  REFERENCE_NOT_FOUND,
  ALREADY_CREATED,
  NOT_INITIALIZED,
  ALREADY_DELETED,
  CANNOT_UPDATE_DELETED,
  /** Requested values are equal to the current ones. */
  NO_CHANGES,
  /** Event stream was appended to by someone else since it has been loaded. */
  CONCURRENCY_CONFLICT
}
