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

import io.github.suppierk.address.cqrs.DomainEvent;
import io.github.suppierk.address.cqrs.DomainMessage;
import java.time.Instant;
import java.util.UUID;

/**
 * A {@link DomainEvent} together with the metadata assigned by the {@link EventStore}.
 *
 * @param streamId identifier of the aggregate
 * @param streamVersion 1-based position within the stream
 * @param globalPosition 1-based position within the global feed
 * @param recordedAt time of persistence, never used when applying the event
 * @param event the payload
 */
public record RecordedEvent(
    UUID streamId, long streamVersion, long globalPosition, Instant recordedAt, DomainEvent event)
    implements DomainMessage<Long, Instant> {

  public RecordedEvent {
    if (streamId == null) {
      throw new IllegalArgumentException("Stream id cannot be null");
    }

    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }
  }

  /** {@inheritDoc} */
  @Override
  public Long messageId() {
    return globalPosition;
  }

  /** {@inheritDoc} */
  @Override
  public Instant createdAt() {
    return recordedAt;
  }
}
