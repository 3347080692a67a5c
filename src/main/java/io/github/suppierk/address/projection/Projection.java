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

import io.github.suppierk.address.eventstore.RecordedEvent;

/**
 * Read-optimized index incrementally maintained from the global event feed.
 *
 * <p>Projections only ever see persisted events, each exactly once and in global order. They are
 * written by a single {@link ProjectionDispatcher} and never by command handlers.
 */
public interface Projection {
  /**
   * Applies the event to the index. Event kinds the projection does not track are ignored.
   *
   * @param recordedEvent persisted event
   * @throws IllegalStateException if the event contradicts the index, which means the feed has
   *     been tampered with or delivered out of order
   */
  void project(final RecordedEvent recordedEvent);
}
