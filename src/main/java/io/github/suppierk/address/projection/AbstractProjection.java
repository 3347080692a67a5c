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

package io.github.suppierk.address.projection;

import io.github.suppierk.address.cqrs.DomainEvent;
import io.github.suppierk.address.cqrs.Suspicious;
import io.github.suppierk.address.eventstore.RecordedEvent;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Base for projections dispatching events by their exact class.
 *
 * <p>Writes happen under the write lock, snapshots are taken under the read lock, so readers never
 * observe an event half-applied.
 */
public abstract class AbstractProjection extends Suspicious implements Projection {
  private final Map<Class<? extends DomainEvent>, Consumer<DomainEvent>> handlers;
  private final ReadWriteLock lock;

  protected AbstractProjection() {
    this.handlers = new HashMap<>();
    this.lock = new ReentrantReadWriteLock();
  }

  /**
   * Registers a handler, must be invoked from the constructor of the subclass.
   *
   * @param eventClass exact class of the event
   * @param handler to invoke
   * @param <E> is the type of the event
   * @throws IllegalStateException if a handler for the class has already been registered
   */
  protected final <E extends DomainEvent> void projectEvent(
      final Class<E> eventClass, final Consumer<E> handler) {
    throwIllegalArgumentIfNull(eventClass, "Event class");
    throwIllegalArgumentIfNull(handler, "Event handler");

    if (handlers.containsKey(eventClass)) {
      throw new IllegalStateException(
          "Handler for %s is already registered".formatted(eventClass.getSimpleName()));
    }

    handlers.put(eventClass, event -> handler.accept(eventClass.cast(event)));
  }

  /** {@inheritDoc} */
  @Override
  public final void project(final RecordedEvent recordedEvent) {
    throwIllegalArgumentIfNull(recordedEvent, "Recorded event");

    final var handler = handlers.get(recordedEvent.event().getClass());

    if (handler == null) {
      return;
    }

    lock.writeLock().lock();
    try {
      handler.accept(recordedEvent.event());
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * @param snapshot copying the required part of the index
   * @param <T> is the type of the snapshot
   * @return the snapshot taken under the read lock
   */
  protected final <T> T read(final Supplier<T> snapshot) {
    lock.readLock().lock();
    try {
      return snapshot.get();
    } finally {
      lock.readLock().unlock();
    }
  }
}
