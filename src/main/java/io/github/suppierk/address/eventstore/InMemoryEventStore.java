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
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} keeping everything on the heap.
 *
 * <p>Suitable for tests and for embedding where durability is provided elsewhere. All operations
 * are serialized on the instance monitor.
 */
public final class InMemoryEventStore extends AbstractEventStore {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryEventStore.class);

  private final Clock clock;
  private final List<RecordedEvent> globalFeed;
  private final Map<UUID, List<RecordedEvent>> streams;

  public InMemoryEventStore() {
    this(Clock.systemUTC());
  }

  /**
   * @param clock used to stamp recorded events
   * @throws IllegalArgumentException if the clock is {@code null}
   */
  public InMemoryEventStore(final Clock clock) {
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
    this.globalFeed = new ArrayList<>();
    this.streams = new HashMap<>();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void append(
      final UUID streamId, final long expectedVersion, final List<? extends DomainEvent> events) {
    verifyAppend(streamId, expectedVersion, events);

    final List<RecordedEvent> stream = streams.computeIfAbsent(streamId, id -> new ArrayList<>());

    if (stream.size() != expectedVersion) {
      LOG.warn(
          "Rejected append to stream '{}': expected version {}, actual {}",
          streamId,
          expectedVersion,
          stream.size());
      throw new ConcurrencyConflictException(streamId, expectedVersion, stream.size());
    }

    for (DomainEvent event : events) {
      final var recordedEvent =
          new RecordedEvent(
              streamId, stream.size() + 1L, globalFeed.size() + 1L, clock.instant(), event);
      stream.add(recordedEvent);
      globalFeed.add(recordedEvent);
    }

    LOG.debug("Appended {} events to stream '{}'", events.size(), streamId);
  }

  /** {@inheritDoc} */
  @Override
  public synchronized List<RecordedEvent> load(final UUID streamId) {
    throwIllegalArgumentIfNull(streamId, "Stream id");
    return List.copyOf(streams.getOrDefault(streamId, List.of()));
  }

  /**
   * {@inheritDoc}
   *
   * <p>The returned stream is a snapshot taken at invocation time.
   */
  @Override
  public synchronized Stream<RecordedEvent> subscribeAll(final long checkpoint) {
    final int from = (int) Math.min(Math.max(checkpoint, 0L), globalFeed.size());
    return List.copyOf(globalFeed.subList(from, globalFeed.size())).stream();
  }
}
