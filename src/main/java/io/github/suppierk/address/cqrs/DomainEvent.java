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

import java.io.Serializable;
import java.util.UUID;

/**
 * Represents an immutable fact about a past state change of a single aggregate.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>Events must be fully self-describing: applying an event must never require looking at the
 * current wall-clock time, external systems or any other event. Events carry absolute values, so
 * replaying the same stream from the empty state always produces the same result.
 *
 * <p>Events are persisted by the event store and possibly transferred between processes - this
 * is the reason this interface extends {@link Serializable}.
 */
public interface DomainEvent extends Serializable {
  /**
   * @return identifier of the aggregate (and therefore of the stream) this event belongs to
   */
  UUID aggregateId();
}
