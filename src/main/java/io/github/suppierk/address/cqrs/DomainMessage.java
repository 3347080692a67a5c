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
import java.time.temporal.Temporal;

/**
 * Envelope of anything the event store hands out: an identifier defining its position and the
 * time it was recorded.
 *
 * @param <I> is the type of the message identifier
 * @param <T> is the type of the recording timestamp
 */
// @formatter:off
public interface DomainMessage<
  I extends Serializable,
  T extends Temporal & Serializable
> extends Serializable {
// @formatter:on

  /**
   * Named so that records can implement it with a component, while {@code id()} stays free for
   * the entity identifier carried by events.
   *
   * @return an identifier of this message, unique within its feed
   */
  I messageId();

  /**
   * @return the time when this message was recorded
   */
  T createdAt();
}
