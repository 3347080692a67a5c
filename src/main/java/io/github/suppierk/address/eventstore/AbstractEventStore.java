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
import io.github.suppierk.address.cqrs.Suspicious;
import java.util.List;
import java.util.UUID;

/** Argument checks shared by {@link EventStore} implementations. */
abstract class AbstractEventStore extends Suspicious implements EventStore {
  /**
   * @throws IllegalArgumentException if the append request is malformed
   */
  protected final void verifyAppend(
      final UUID streamId, final long expectedVersion, final List<? extends DomainEvent> events) {
    throwIllegalArgumentIfNull(streamId, "Stream id");
    throwIllegalArgumentIfNull(events, "Events");

    throwIllegalArgumentUnless(
        expectedVersion >= 0,
        () -> "Expected version cannot be negative, got %d".formatted(expectedVersion));

    for (DomainEvent event : events) {
      throwIllegalArgumentIfNull(event, "Appended event");

      throwIllegalArgumentUnless(
          streamId.equals(event.aggregateId()),
          () ->
              "%s belongs to '%s' and cannot be appended to stream '%s'"
                  .formatted(event.getClass().getSimpleName(), event.aggregateId(), streamId));
    }
  }
}
