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

package io.github.suppierk.address.domain.road;

import io.github.suppierk.address.cqrs.AggregateRoot;
import io.github.suppierk.address.cqrs.CommandResult;
import java.util.Objects;
import java.util.UUID;

/** A road, referenced by access addresses. */
public final class RoadAggregate extends AggregateRoot<RoadEvent> {
  private String officialId;
  private String name;
  private RoadStatus status;

  public RoadAggregate() {
    super(RoadEvent.class, "Road");
  }

  public String getOfficialId() {
    return officialId;
  }

  public String getName() {
    return name;
  }

  public RoadStatus getStatus() {
    return status;
  }

  /**
   * @throws IllegalArgumentException if the status is {@code null}
   */
  public CommandResult create(
      final UUID id, final String officialId, final String name, final RoadStatus status) {
    throwIllegalArgumentIfNull(status, "Road status");

    return requireIdentifier(id)
        .or(() -> requireText(officialId, "official id"))
        .or(this::requireNotCreated)
        .orElseGet(() -> raise(new RoadCreated(id, officialId, name, status)));
  }

  /**
   * @throws IllegalArgumentException if the status is {@code null}
   */
  public CommandResult update(
      final String officialId, final String name, final RoadStatus status) {
    throwIllegalArgumentIfNull(status, "Road status");

    return requireText(officialId, "official id")
        .or(this::requireUpdatable)
        .or(
            () ->
                requireChanges(
                    !Objects.equals(this.officialId, officialId)
                        || !Objects.equals(this.name, name)
                        || this.status != status))
        .orElseGet(() -> raise(new RoadUpdated(getId(), officialId, name, status)));
  }

  public CommandResult delete() {
    return requireDeletable().orElseGet(() -> raise(new RoadDeleted(getId())));
  }

  @Override
  protected void apply(final RoadEvent event) {
    if (event instanceof RoadCreated created) {
      assignId(created.id());
      officialId = created.officialId();
      name = created.name();
      status = created.status();
    } else if (event instanceof RoadUpdated updated) {
      officialId = updated.officialId();
      name = updated.name();
      status = updated.status();
    } else if (event instanceof RoadDeleted) {
      markDeleted();
    } else {
      throw new IllegalStateException("Unsupported road event: %s".formatted(event));
    }
  }
}
