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

package io.github.suppierk.address.eventstore;

import io.github.suppierk.address.cqrs.AddressErrorCode;
import io.github.suppierk.address.cqrs.DomainError;
import java.io.Serial;
import java.util.UUID;

/**
 * A specific {@link Exception} to be thrown if an event stream has been appended to since the
 * caller loaded it.
 *
 * <p>The core never retries: callers are expected to reload the aggregate and re-issue the
 * command.
 */
public class ConcurrencyConflictException extends RuntimeException {
  @Serial private static final long serialVersionUID = -4417028551203762014L;

  private final UUID streamId;
  private final long expectedVersion;
  private final long actualVersion;

  /**
   * @param streamId of the conflicting stream
   * @param expectedVersion stream length the caller expected
   * @param actualVersion stream length found by the store
   */
  public ConcurrencyConflictException(
      final UUID streamId, final long expectedVersion, final long actualVersion) {
    this(streamId, expectedVersion, actualVersion, null);
  }

  /**
   * Constructs a new runtime exception with the specified cause, used when the conflict has been
   * detected by the underlying storage (e.g. a unique key violation caused by a racing writer).
   *
   * @param streamId of the conflicting stream
   * @param expectedVersion stream length the caller expected
   * @param actualVersion stream length found by the store, {@code -1} if unknown
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   *     (A {@code null} value is permitted, and indicates that the cause is nonexistent or
   *     unknown.)
   */
  public ConcurrencyConflictException(
      final UUID streamId,
      final long expectedVersion,
      final long actualVersion,
      final Throwable cause) {
    super(
        "Stream '%s' was expected to have %d events, but has %s"
            .formatted(
                streamId,
                expectedVersion,
                actualVersion < 0 ? "more" : String.valueOf(actualVersion)),
        cause);
    this.streamId = streamId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  public UUID getStreamId() {
    return streamId;
  }

  public long getExpectedVersion() {
    return expectedVersion;
  }

  /**
   * @return stream length found by the store, {@code -1} if unknown
   */
  public long getActualVersion() {
    return actualVersion;
  }

  /**
   * @return this failure in the same shape as aggregate command failures
   */
  public DomainError toDomainError() {
    return new DomainError(AddressErrorCode.CONCURRENCY_CONFLICT, getMessage());
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 409;
  }
}
