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

package io.github.suppierk.address.domain.accessaddress;

import java.util.UUID;

/**
 * Business fields of an access address, as accepted by {@link AccessAddressAggregate#create} and
 * {@link AccessAddressAggregate#update}. Only used as a command argument, never persisted.
 *
 * @param officialId identifier in the official registry, {@code null} for addresses not known to
 *     it yet
 * @param municipalCode required
 * @param status of the address
 * @param roadCode required
 * @param houseNumber required
 * @param postCodeId reference to a post code
 * @param eastCoordinate of the entrance
 * @param northCoordinate of the entrance
 * @param townName optional
 * @param plotId optional
 * @param roadId reference to a road
 * @param pendingOfficial {@code true} while the address awaits official registration
 */
public record AccessAddressValues(
    String officialId,
    String municipalCode,
    AccessAddressStatus status,
    String roadCode,
    String houseNumber,
    UUID postCodeId,
    double eastCoordinate,
    double northCoordinate,
    String townName,
    String plotId,
    UUID roadId,
    boolean pendingOfficial) {}
