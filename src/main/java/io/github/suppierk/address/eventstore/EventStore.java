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
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Ordered, append-only storage of per-aggregate event streams.
 *
 * <p>Implementations guarantee that events of one stream are totally ordered by append order and
 * that every persisted event gets a unique, increasing global position which defines the order of
 * the global feed.
 */
public interface EventStore {
  /**
   * Appends events to the end of the stream.
   *
   * @param streamId identifier of the aggregate
   * @param expectedVersion number of events the caller believes the stream currently holds
   * @param events to append, in order
   * @throws ConcurrencyConflictException if the stream holds a different number of events
   * @throws IllegalArgumentException if any argument is {@code null} or events belong to a
   *     different stream
   */
  void append(
      final UUID streamId, final long expectedVersion, final List<? extends DomainEvent> events)
      throws ConcurrencyConflictException;

  /**
   * @param streamId identifier of the aggregate
   * @return every event of the stream in append order, empty list for unknown streams
   */
  List<RecordedEvent> load(final UUID streamId);

  /**
   * Reads the global feed. The returned {@link Stream} can be lazy and hold resources, therefore
   * it must be closed by the caller.
   *
   * @param checkpoint global position of the last event already processed, {@code 0} to start
   *     from the beginning
   * @return persisted events with a global position greater than the checkpoint, in global order
   */
  Stream<RecordedEvent> subscribeAll(final long checkpoint);
}
