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

import io.github.suppierk.address.cqrs.AggregateRoot;
import io.github.suppierk.address.cqrs.CommandResult;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * The entrance of a building: house number on a road within a post code.
 *
 * <p>Road and post code references are checked against the existence snapshots supplied by the
 * caller, road first.
 */
public final class AccessAddressAggregate extends AggregateRoot<AccessAddressEvent> {
  private static final String ROAD = "Road";
  private static final String POST_CODE = "Post code";
  private static final String MUNICIPAL_CODE = "municipal code";
  private static final String ROAD_CODE = "road code";
  private static final String HOUSE_NUMBER = "house number";

  private String officialId;
  private String municipalCode;
  private AccessAddressStatus status;
  private String roadCode;
  private String houseNumber;
  private UUID postCodeId;
  private double eastCoordinate;
  private double northCoordinate;
  private String townName;
  private String plotId;
  private UUID roadId;
  private Instant externalCreatedDate;
  private Instant externalUpdatedDate;
  private boolean pendingOfficial;

  public AccessAddressAggregate() {
    super(AccessAddressEvent.class, "Access address");
  }

  public String getOfficialId() {
    return officialId;
  }

  public String getMunicipalCode() {
    return municipalCode;
  }

  public AccessAddressStatus getStatus() {
    return status;
  }

  public String getRoadCode() {
    return roadCode;
  }

  public String getHouseNumber() {
    return houseNumber;
  }

  public UUID getPostCodeId() {
    return postCodeId;
  }

  public double getEastCoordinate() {
    return eastCoordinate;
  }

  public double getNorthCoordinate() {
    return northCoordinate;
  }

  public String getTownName() {
    return townName;
  }

  public String getPlotId() {
    return plotId;
  }

  public UUID getRoadId() {
    return roadId;
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

  /**
   * @return current business fields
   */
  public AccessAddressValues getValues() {
    return new AccessAddressValues(
        officialId,
        municipalCode,
        status,
        roadCode,
        houseNumber,
        postCodeId,
        eastCoordinate,
        northCoordinate,
        townName,
        plotId,
        roadId,
        pendingOfficial);
  }

  public CommandResult create(
      final UUID id,
      final AccessAddressValues values,
      final Instant externalCreatedDate,
      final Instant externalUpdatedDate,
      final Collection<UUID> existingRoadIds,
      final Collection<UUID> existingPostCodeIds) {
    throwIllegalArgumentIfNull(values, "Access address values");

    return requireIdentifier(id)
        .or(() -> requireValues(values, existingRoadIds, existingPostCodeIds))
        .or(this::requireNotCreated)
        .orElseGet(
            () ->
                raise(
                    new AccessAddressCreated(
                        id,
                        values.officialId(),
                        values.municipalCode(),
                        values.status(),
                        values.roadCode(),
                        values.houseNumber(),
                        values.postCodeId(),
                        values.eastCoordinate(),
                        values.northCoordinate(),
                        values.townName(),
                        values.plotId(),
                        values.roadId(),
                        externalCreatedDate,
                        externalUpdatedDate,
                        values.pendingOfficial())));
  }

  /**
   * Replaces every business field at once. The external timestamp alone does not count as a
   * change.
   */
  public CommandResult update(
      final AccessAddressValues values,
      final Instant externalUpdatedDate,
      final Collection<UUID> existingRoadIds,
      final Collection<UUID> existingPostCodeIds) {
    throwIllegalArgumentIfNull(values, "Access address values");

    return requireValues(values, existingRoadIds, existingPostCodeIds)
        .or(this::requireUpdatable)
        .or(() -> requireChanges(!values.equals(getValues())))
        .orElseGet(
            () ->
                raise(
                    new AccessAddressUpdated(
                        getId(),
                        values.officialId(),
                        values.municipalCode(),
                        values.status(),
                        values.roadCode(),
                        values.houseNumber(),
                        values.postCodeId(),
                        values.eastCoordinate(),
                        values.northCoordinate(),
                        values.townName(),
                        values.plotId(),
                        values.roadId(),
                        externalUpdatedDate,
                        values.pendingOfficial())));
  }

  public CommandResult updateOfficialId(
      final String officialId, final Instant externalUpdatedDate) {
    return requireUpdatable()
        .or(() -> requireChanges(!Objects.equals(this.officialId, officialId)))
        .orElseGet(
            () ->
                raise(
                    new AccessAddressOfficialIdUpdated(getId(), officialId, externalUpdatedDate)));
  }

  public CommandResult updateMunicipalCode(
      final String municipalCode, final Instant externalUpdatedDate) {
    return requireText(municipalCode, MUNICIPAL_CODE)
        .or(this::requireUpdatable)
        .or(() -> requireChanges(!municipalCode.equals(this.municipalCode)))
        .orElseGet(
            () ->
                raise(
                    new AccessAddressMunicipalCodeUpdated(
                        getId(), municipalCode, externalUpdatedDate)));
  }

  public CommandResult updateStatus(
      final AccessAddressStatus status, final Instant externalUpdatedDate) {
    return requireUpdatable()
        .or(() -> requireChanges(this.status != status))
        .orElseGet(
            () -> raise(new AccessAddressStatusUpdated(getId(), status, externalUpdatedDate)));
  }

  public CommandResult updateRoadCode(final String roadCode, final Instant externalUpdatedDate) {
    return requireText(roadCode, ROAD_CODE)
        .or(this::requireUpdatable)
        .or(() -> requireChanges(!roadCode.equals(this.roadCode)))
        .orElseGet(
            () -> raise(new AccessAddressRoadCodeUpdated(getId(), roadCode, externalUpdatedDate)));
  }

  public CommandResult updateHouseNumber(
      final String houseNumber, final Instant externalUpdatedDate) {
    return requireText(houseNumber, HOUSE_NUMBER)
        .or(this::requireUpdatable)
        .or(() -> requireChanges(!houseNumber.equals(this.houseNumber)))
        .orElseGet(
            () ->
                raise(
                    new AccessAddressHouseNumberUpdated(
                        getId(), houseNumber, externalUpdatedDate)));
  }

  public CommandResult updatePostCodeId(
      final UUID postCodeId,
      final Instant externalUpdatedDate,
      final Collection<UUID> existingPostCodeIds) {
    return requireReference(postCodeId, existingPostCodeIds, POST_CODE)
        .or(this::requireUpdatable)
        .or(() -> requireChanges(!postCodeId.equals(this.postCodeId)))
        .orElseGet(
            () ->
                raise(
                    new AccessAddressPostCodeIdUpdated(getId(), postCodeId, externalUpdatedDate)));
  }

  public CommandResult updateCoordinates(
      final double eastCoordinate,
      final double northCoordinate,
      final Instant externalUpdatedDate) {
    return requireUpdatable()
        .or(
            () ->
                requireChanges(
                    Double.compare(this.eastCoordinate, eastCoordinate) != 0
                        || Double.compare(this.northCoordinate, northCoordinate) != 0))
        .orElseGet(
            () ->
                raise(
                    new AccessAddressCoordinatesUpdated(
                        getId(), eastCoordinate, northCoordinate, externalUpdatedDate)));
  }

  public CommandResult updateTownName(final String townName, final Instant externalUpdatedDate) {
    return requireUpdatable()
        .or(() -> requireChanges(!Objects.equals(this.townName, townName)))
        .orElseGet(
            () -> raise(new AccessAddressTownNameUpdated(getId(), townName, externalUpdatedDate)));
  }

  public CommandResult updatePlotId(final String plotId, final Instant externalUpdatedDate) {
    return requireUpdatable()
        .or(() -> requireChanges(!Objects.equals(this.plotId, plotId)))
        .orElseGet(
            () -> raise(new AccessAddressPlotIdUpdated(getId(), plotId, externalUpdatedDate)));
  }

  public CommandResult updateRoadId(
      final UUID roadId,
      final Instant externalUpdatedDate,
      final Collection<UUID> existingRoadIds) {
    return requireReference(roadId, existingRoadIds, ROAD)
        .or(this::requireUpdatable)
        .or(() -> requireChanges(!roadId.equals(this.roadId)))
        .orElseGet(
            () -> raise(new AccessAddressRoadIdUpdated(getId(), roadId, externalUpdatedDate)));
  }

  public CommandResult updatePendingOfficial(
      final boolean pendingOfficial, final Instant externalUpdatedDate) {
    return requireUpdatable()
        .or(() -> requireChanges(this.pendingOfficial != pendingOfficial))
        .orElseGet(
            () ->
                raise(
                    new AccessAddressPendingOfficialUpdated(
                        getId(), pendingOfficial, externalUpdatedDate)));
  }

  public CommandResult delete(final Instant externalUpdatedDate) {
    return requireDeletable()
        .orElseGet(() -> raise(new AccessAddressDeleted(getId(), externalUpdatedDate)));
  }

  private Optional<CommandResult> requireValues(
      final AccessAddressValues values,
      final Collection<UUID> existingRoadIds,
      final Collection<UUID> existingPostCodeIds) {
    return requireText(values.municipalCode(), MUNICIPAL_CODE)
        .or(() -> requireText(values.roadCode(), ROAD_CODE))
        .or(() -> requireText(values.houseNumber(), HOUSE_NUMBER))
        .or(() -> requireReference(values.roadId(), existingRoadIds, ROAD))
        .or(() -> requireReference(values.postCodeId(), existingPostCodeIds, POST_CODE));
  }

  @Override
  protected void apply(final AccessAddressEvent event) {
    if (event instanceof AccessAddressCreated created) {
      assignId(created.id());
      officialId = created.officialId();
      municipalCode = created.municipalCode();
      status = created.status();
      roadCode = created.roadCode();
      houseNumber = created.houseNumber();
      postCodeId = created.postCodeId();
      eastCoordinate = created.eastCoordinate();
      northCoordinate = created.northCoordinate();
      townName = created.townName();
      plotId = created.plotId();
      roadId = created.roadId();
      externalCreatedDate = created.externalCreatedDate();
      externalUpdatedDate = created.externalUpdatedDate();
      pendingOfficial = created.pendingOfficial();
    } else if (event instanceof AccessAddressUpdated updated) {
      officialId = updated.officialId();
      municipalCode = updated.municipalCode();
      status = updated.status();
      roadCode = updated.roadCode();
      houseNumber = updated.houseNumber();
      postCodeId = updated.postCodeId();
      eastCoordinate = updated.eastCoordinate();
      northCoordinate = updated.northCoordinate();
      townName = updated.townName();
      plotId = updated.plotId();
      roadId = updated.roadId();
      externalUpdatedDate = updated.externalUpdatedDate();
      pendingOfficial = updated.pendingOfficial();
    } else if (event instanceof AccessAddressDeleted deleted) {
      externalUpdatedDate = deleted.externalUpdatedDate();
      markDeleted();
    } else if (event instanceof AccessAddressOfficialIdUpdated updated) {
      officialId = updated.officialId();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof AccessAddressMunicipalCodeUpdated updated) {
      municipalCode = updated.municipalCode();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof AccessAddressStatusUpdated updated) {
      status = updated.status();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof AccessAddressRoadCodeUpdated updated) {
      roadCode = updated.roadCode();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof AccessAddressHouseNumberUpdated updated) {
      houseNumber = updated.houseNumber();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof AccessAddressPostCodeIdUpdated updated) {
      postCodeId = updated.postCodeId();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof AccessAddressCoordinatesUpdated updated) {
      eastCoordinate = updated.eastCoordinate();
      northCoordinate = updated.northCoordinate();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof AccessAddressTownNameUpdated updated) {
      townName = updated.townName();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof AccessAddressPlotIdUpdated updated) {
      plotId = updated.plotId();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof AccessAddressRoadIdUpdated updated) {
      roadId = updated.roadId();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else if (event instanceof AccessAddressPendingOfficialUpdated updated) {
      pendingOfficial = updated.pendingOfficial();
      externalUpdatedDate = updated.externalUpdatedDate();
    } else {
      throw new IllegalStateException("Unsupported access address event: %s".formatted(event));
    }
  }
}
