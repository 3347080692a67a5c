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

import io.github.suppierk.address.cqrs.AggregateRoot;
import io.github.suppierk.address.cqrs.Suspicious;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges aggregates and the {@link EventStore}: loading replays a stream into a fresh aggregate,
 * storing appends whatever the aggregate staged since it was loaded.
 *
 * <p>Typical flow is one load, one or more commands and one store per request. A {@link
 * ConcurrencyConflictException} on store means the stream moved on in the meantime: reload and
 * retry the command.
 */
public final class AggregateRepository extends Suspicious {
  private static final Logger LOG = LoggerFactory.getLogger(AggregateRepository.class);

  private final EventStore eventStore;

  /**
   * @param eventStore to read and write streams with
   * @throws IllegalArgumentException if the store is {@code null}
   */
  public AggregateRepository(final EventStore eventStore) {
    this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
  }

  /**
   * @param id of the aggregate
   * @param factory creating an empty aggregate instance
   * @param <A> is the type of the aggregate
   * @return aggregate with the whole stream replayed, still empty if the stream does not exist
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public <A extends AggregateRoot<?>> A load(final UUID id, final Supplier<A> factory) {
    throwIllegalArgumentIfNull(id, "Aggregate id");
    throwIllegalArgumentIfNull(factory, "Aggregate factory");

    final A aggregate = throwIllegalStateIfNull(factory.get(), "New aggregate");
    final List<RecordedEvent> history = eventStore.load(id);
    aggregate.replay(history.stream().map(RecordedEvent::event).toList());

    LOG.debug(
        "Loaded {} '{}' at version {}",
        aggregate.getClass().getSimpleName(),
        id,
        aggregate.getVersion());
    return aggregate;
  }

  /**
   * Appends staged events of the aggregate and marks them as committed. Does nothing if there are
   * no staged events.
   *
   * @param aggregate to persist
   * @throws ConcurrencyConflictException if the stream was appended to after the aggregate was
   *     loaded, staged events are kept in that case
   * @throws IllegalArgumentException if the aggregate is {@code null}
   */
  public void store(final AggregateRoot<?> aggregate) {
    throwIllegalArgumentIfNull(aggregate, "Aggregate");

    final var events = aggregate.getUncommittedEvents();

    if (events.isEmpty()) {
      return;
    }

    final UUID id = throwIllegalStateIfNull(aggregate.getId(), "Aggregate id");
    eventStore.append(id, aggregate.getCommittedVersion(), events);
    aggregate.markCommitted();
  }
}
