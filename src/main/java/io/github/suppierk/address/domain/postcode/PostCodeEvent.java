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

package io.github.suppierk.address.domain.postcode;

import io.github.suppierk.address.cqrs.DomainEvent;
import java.util.UUID;

/** Events of the {@link PostCodeAggregate} stream. */
public sealed interface PostCodeEvent extends DomainEvent
    permits PostCodeCreated, PostCodeUpdated, PostCodeDeleted {
  /**
   * @return post code identifier
   */
  UUID id();

  @Override
  default UUID aggregateId() {
    return id();
  }
}
