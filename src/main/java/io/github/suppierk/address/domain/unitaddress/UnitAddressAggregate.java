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

import io.github.suppierk.address.cqrs.AggregateRoot;
import io.github.suppierk.address.cqrs.CommandResult;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.UUID;

/**
 * A unit (floor / suite) inside the building reachable through an access address.
 *
 * <p>The access address reference is checked against the existence snapshot supplied by the
 * caller, typically {@code AddressProjection#getAccessAddressIds()}.
 */
public final class UnitAddressAggregate extends AggregateRoot<UnitAddressEvent> {
  private static final String ACCESS_ADDRESS = "Access address";

  private String externalId;
  private UUID accessAddressId;
  private UnitAddressStatus status;
  private String floorName;
  private String suiteName;
  private Instant externalCreatedDate;
  private Instant externalUpdatedDate;
  private boolean pendingOfficial;

  public UnitAddressAggregate() {
    super(UnitAddressEvent.class, "Unit address");
  }

  public String getExternalId() {
    return externalId;
  }

  public UUID getAccessAddressId() {
    return accessAddressId;
  }

  public UnitAddressStatus getStatus() {
    return status;
  }

  public String getFloorName() {
    return floorName;
  }

  public String getSuiteName() {
    return suiteName;
  }

  public Instant getExternalCreatedDate() {
    return externalCreatedDate;
  }

  public Instant getExternalUpdatedDate() {
    return externalUpdatedDate;
  }

  public boolean isPendingOfficial() {
    return pendingOfficial;
  }

  @SuppressWarnings("squid:S107")
  public CommandResult create(
      final UUID id,
      final String externalId,
      final UUID accessAddressId,
      final UnitAddressStatus status,
      final String floorName,
      final String suiteName,
      final Instant externalCreatedDate,
      final Instant externalUpdatedDate,
      final boolean pendingOfficial,
      final Collection<UUID> existingAccessAddressIds) {
    return requireIdentifier(id)
        .or(() -> requireReference(accessAddressId, existingAccessAddressIds, ACCESS_ADDRESS))
        .or(this::requireNotCreated)
        .orElseGet(
            () ->
                raise(
                    new UnitAddressCreated(
                        id,
                        externalId,
                        accessAddressId,
                        status,
                        floorName,
                        suiteName,
                        externalCreatedDate,
                        externalUpdatedDate,
                        pendingOfficial)));
  }

  /**
   * Replaces every business field at once. The external timestamp alone does not count as a
   * change.
   */
  @SuppressWarnings("squid:S107")
  public CommandResult update(
      final String externalId,
      final UUID accessAddressId,
      final UnitAddressStatus status,
      final String floorName,
      final String suiteName,
      final Instant externalUpdatedDate,
      final boolean pendingOfficial,
      final Collection<UUID> existingAccessAddressIds) {
    return requireReference(accessAddressId, existingAccessAddressIds, ACCESS_ADDRESS)
        .or(this::requireUpdatable)
        .or(
            () ->
                requireChanges(
                    !Objects.equals(this.externalId, externalId)
                        || !Objects.equals(this.accessAddressId, accessAddressId)
                        || this.status != status
                        || !Objects.equals(this.floorName, floorName)
                        || !Objects.equals(this.suiteName, suiteName)
                        || this.pendingOfficial != pendingOfficial))
        .orElseGet(
            () ->
                raise(
                    new UnitAddressUpdated(
                        getId(),
                        externalId,
                        accessAddressId,
                        status,
                        floorName,
                        suiteName,
                        externalUpdatedDate,
                        pendingOfficial)));
  }

  public CommandResult updateExternalId(
      final String externalId, final Instant externalUpdatedDate) {
    return requireUpdatable()
        .or(() -> requireChanges(!Objects.equals(this.externalId, externalId)))
        .orElseGet(
            () ->
                raise(new UnitAddressExternalIdUpdated(getId(), externalId, externalUpdatedDate)));
  }

  public CommandResult updateAccessAddressId(
      final UUID accessAddressId,
      final Instant externalUpdatedDate,
      final Collection<UUID> existingAccessAddressIds) {
    return requireReference(accessAddressId, existingAccessAddressIds, ACCESS_ADDRESS)
        .or(this::requireUpdatable)
        .or(() -> requireChanges(!accessAddressId.equals(this.accessAddressId)))
        .orElseGet(
            () ->
                raise(
                    new UnitAddressAccessAddressIdUpdated(
                        getId(), accessAddressId, externalUpdatedDate)));
  }

  public CommandResult updateStatus(
      final UnitAddressStatus status, final Instant externalUpdatedDate) {
    return requireUpdatable()
        .or(() -> requireChanges(this.status != status))
        .orElseGet(
            () -> raise(new UnitAddressStatusUpdated(getId(), status, externalUpdatedDate)));
  }

  public CommandResult updateFloorName(final String floorName, final Instant externalUpdatedDate) {
    return requireUpdatable()
        .or(() -> requireChanges(!Objects.equals(this.floorName, floorName)))
        .orElseGet(
            () -> raise(new UnitAddressFloorNameUpdated(getId(), floorName, externalUpdatedDate)));
  }

  public CommandResult updateSuiteName(final String suiteName, final Instant externalUpdatedDate) {
    return requireUpdatable()
        .or(() -> requireChanges(!Objects.equals(this.suiteName, suiteName)))
        .orElseGet(
            () -> raise(new UnitAddressSuiteNameUpdated(getId(), suiteName, externalUpdatedDate)));
  }

  public CommandResult updatePendingOfficial(
      final boolean pendingOfficial, final Instant externalUpdatedDate) {
    return requireUpdatable()
        .or(() -> requireChanges(this.pendingOfficial != pendingOfficial))
        .orElseGet(
            () ->
                raise(
                    new UnitAddressPendingOfficialUpdated(
                        getId(), pendingOfficial, externalUpdatedDate)));
  }

  public CommandResult delete(final Instant externalUpdatedDate) {
    return requireDeletable()
        .orElseGet(() -> raise(new UnitAddressDeleted(getId(), externalUpdatedDate)));
  }

  @Override
  protected void apply(final UnitAddressEvent event) {
    if (event instanceof UnitAddressCreated created) {
      assignId(created.id());
      externalId = created.externalId();
      accessAddressId = created.accessAddressId();
      status = created.status();
      floorName = created.floorName();
      suiteName = created.suiteName();
      externalCreatedDate = created.externalCreatedDate();
      externalUpdatedDate = created.externalUpdatedDate();
      pendingOfficial = created.pendingOfficial();
    } else if (event instanceof UnitAddressUpdated updated) {
      externalId = updated.externalId();
      accessAddressId = updated.accessAddressId();
      status = updated.status();
      floorName = updated.floorName();
      suiteName = updated.suiteName();
      externalUpdatedDate = updated.externalUpdatedDate();
      pendingOfficial = updated.pendingOfficial();
    } else if (event instanceof UnitAddressDeleted deleted) {
      externalUpdatedDate = deleted.externalUpdatedDate();
      markDeleted();
    } else if (event instanceof UnitAddressExternalIdUpdated updated) {
      externalId = updated.externalId();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof UnitAddressAccessAddressIdUpdated updated) {
      accessAddressId = updated.accessAddressId();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof UnitAddressStatusUpdated updated) {
      status = updated.status();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof UnitAddressFloorNameUpdated updated) {
      floorName = updated.floorName();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof UnitAddressSuiteNameUpdated updated) {
      suiteName = updated.suiteName();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof UnitAddressPendingOfficialUpdated updated) {
      pendingOfficial = updated.pendingOfficial();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else {
      throw new IllegalStateException("Unsupported unit address event: %s".formatted(event));
    }
  }
}
