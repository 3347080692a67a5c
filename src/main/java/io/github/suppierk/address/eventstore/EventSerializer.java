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
import io.github.suppierk.java.Try;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@link DomainEvent}s to bytes and back using Java serialization.
 *
 * <p>Deserialization only admits classes of this project and of the JDK, every other class in the
 * payload is rejected.
 */
public final class EventSerializer {
  private static final Logger LOG = LoggerFactory.getLogger(EventSerializer.class);

  private static final ObjectInputFilter FILTER =
      ObjectInputFilter.Config.createFilter("io.github.suppierk.address.**;java.**;!*");

  /**
   * @param event to serialize
   * @return serialized form
   */
  public byte[] serialize(final DomainEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    final Try<byte[]> payload = Try.of(() -> write(event));
    payload.ifFailure(
        cause -> LOG.warn("Failed to serialize {}", event.getClass().getSimpleName(), cause));
    return payload.get();
  }

  /**
   * @param payload produced by {@link #serialize(DomainEvent)}
   * @return the event
   */
  public DomainEvent deserialize(final byte[] payload) {
    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null");
    }

    final Try<DomainEvent> event = Try.of(() -> read(payload));
    event.ifFailure(
        cause -> LOG.warn("Failed to deserialize payload of {} bytes", payload.length, cause));
    return event.get();
  }

  private static byte[] write(final DomainEvent event) throws IOException {
    final var bytes = new ByteArrayOutputStream();
    try (var out = new ObjectOutputStream(bytes)) {
      out.writeObject(event);
    }
    return bytes.toByteArray();
  }

  private static DomainEvent read(final byte[] payload) throws IOException, ClassNotFoundException {
    try (var in = new ObjectInputStream(new ByteArrayInputStream(payload))) {
      in.setObjectInputFilter(FILTER);
      final Object object = in.readObject();

      if (object instanceof DomainEvent event) {
        return event;
      }

      throw new IOException(
          "Payload holds %s instead of an event"
              .formatted(object == null ? null : object.getClass().getName()));
    }
  }
}
