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

import java.util.Optional;

/**
 * Outcome of an aggregate command.
 *
 * <p>A successful command does not carry any values - resulting state is readable from the
 * aggregate itself. A failed command carries exactly one {@link DomainError}, even if several
 * rules were violated.
 */
public sealed interface CommandResult permits CommandResult.Success, CommandResult.Failure {
  /**
   * @return successful result
   */
  static CommandResult ok() {
    return Success.INSTANCE;
  }

  /**
   * @param code of the violated rule
   * @param message describing the violation
   * @return failed result
   */
  static CommandResult fail(final AddressErrorCode code, final String message) {
    return new Failure(new DomainError(code, message));
  }

  /**
   * @return {@code true} if the command was accepted
   */
  boolean isSuccess();

  /**
   * @return {@code true} if the command was rejected
   */
  default boolean isFailure() {
    return !isSuccess();
  }

  /**
   * @return the error of a rejected command, empty for accepted ones
   */
  Optional<DomainError> error();

  /** Accepted command. */
  final class Success implements CommandResult {
    private static final Success INSTANCE = new Success();

    private Success() {
      // Cannot be instantiated from the outside
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public Optional<DomainError> error() {
      return Optional.empty();
    }

    @Override
    public String toString() {
      return "Success";
    }
  }

  /**
   * Rejected command.
   *
   * @param domainError describing the first violated rule
   */
  record Failure(DomainError domainError) implements CommandResult {
    public Failure {
      if (domainError == null) {
        throw new IllegalArgumentException("Domain error cannot be null");
      }
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public Optional<DomainError> error() {
      return Optional.of(domainError);
    }

    /**
     * @return shortcut to the code of the error
     */
    public AddressErrorCode code() {
      return domainError.code();
    }
  }
}
