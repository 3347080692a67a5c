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

package io.github.suppierk.address.domain.unitaddress;

import io.github.suppierk.address.cqrs.DomainEvent;
import java.util.UUID;

/** Events of the {@link UnitAddressAggregate} stream. */
// @formatter:off
public sealed interface UnitAddressEvent extends DomainEvent
permits
  UnitAddressCreated, UnitAddressUpdated, UnitAddressDeleted,
  UnitAddressExternalIdUpdated, UnitAddressAccessAddressIdUpdated, UnitAddressStatusUpdated,
  UnitAddressFloorNameUpdated, UnitAddressSuiteNameUpdated, UnitAddressPendingOfficialUpdated
{
// @formatter:on

  /**
   * @return unit address identifier
   */
  UUID id();

  @Override
  default UUID aggregateId() {
    return id();
  }
}
