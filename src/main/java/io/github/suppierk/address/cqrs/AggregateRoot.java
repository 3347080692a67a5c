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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory reconstruction of a single entity from its event stream.
 *
 * <p>Lifecycle:
 *
 * <ul>
 *   <li>Constructed empty, identifier is not set.
 *   <li>Either created via a creation command or hydrated via {@link #replay(Iterable)}.
 *   <li>Mutated by commands, each staging at most one event which is applied immediately, so that
 *       consecutive commands on the same instance compose before being persisted.
 *   <li>Optionally marked deleted, which blocks any further mutation but keeps the history.
 * </ul>
 *
 * <p>Commands validate first and stage the event afterwards, therefore {@link #apply(DomainEvent)}
 * never fails for events produced by this class. Instances are not thread-safe: callers must
 * serialize commands issued against the same identifier.
 *
 * <p>Validation helpers return an empty {@link Optional} when the rule holds, which allows
 * commands to be expressed as a short-circuiting {@link Optional#or(java.util.function.Supplier)}
 * chain in the documented rule order.
 *
 * @param <EVENT> is the sealed family of events this aggregate understands
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract class AggregateRoot<EVENT extends DomainEvent> extends Suspicious {
  private final Class<EVENT> eventClass;
  private final String entityName;
  private final List<EVENT> uncommittedEvents;

  private UUID id;
  private boolean deleted;
  private long version;

  /**
   * @param eventClass is the root of the event family, used to reject foreign events on replay
   * @param entityName is used in error messages
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  protected AggregateRoot(final Class<EVENT> eventClass, final String entityName) {
    this.eventClass = throwIllegalArgumentIfNull(eventClass, "Event class");
    this.entityName = throwIllegalArgumentIfNull(entityName, "Entity name");
    this.uncommittedEvents = new ArrayList<>();
  }

  /**
   * @return entity identifier or {@code null} if the entity was not created yet
   */
  public final UUID getId() {
    return id;
  }

  /**
   * @return {@code true} if the entity has been deleted
   */
  public final boolean isDeleted() {
    return deleted;
  }

  /**
   * @return number of events applied to this instance, both replayed and staged
   */
  public final long getVersion() {
    return version;
  }

  /**
   * @return number of events known to be persisted, used as the expected stream length on append
   */
  public final long getCommittedVersion() {
    return version - uncommittedEvents.size();
  }

  /**
   * @return events staged since the instance was loaded or last committed
   */
  public final List<EVENT> getUncommittedEvents() {
    return List.copyOf(uncommittedEvents);
  }

  /** Forgets staged events once they have been persisted. */
  public final void markCommitted() {
    uncommittedEvents.clear();
  }

  /**
   * Rebuilds state from the persisted history. Must be invoked on a fresh instance.
   *
   * @param history of the stream, in append order
   * @throws IllegalArgumentException if history is {@code null} or contains a foreign event
   * @throws IllegalStateException if this instance already has applied events
   */
  public final void replay(final Iterable<? extends DomainEvent> history) {
    throwIllegalArgumentIfNull(history, "Event history");

    if (version != 0) {
      throw new IllegalStateException(
          "%s '%s' already has %d applied events and cannot replay history"
              .formatted(entityName, id, version));
    }

    for (DomainEvent event : history) {
      throwIllegalArgumentIfNull(event, "Replayed event");

      throwIllegalArgumentUnless(
          eventClass.isInstance(event),
          () ->
              "%s cannot be applied to %s"
                  .formatted(event.getClass().getSimpleName(), entityName));

      apply(eventClass.cast(event));
      version++;
    }
  }

  /**
   * Pure state transition. Implementations must handle every member of the event family and fail
   * with {@link IllegalStateException} for anything else.
   *
   * @param event to apply
   */
  protected abstract void apply(final EVENT event);

  /**
   * Stages the event and applies it immediately.
   *
   * @param event to stage
   * @return successful result
   */
  protected final CommandResult raise(final EVENT event) {
    throwIllegalArgumentIfNull(event, "Raised event");

    apply(event);
    version++;
    uncommittedEvents.add(event);
    return CommandResult.ok();
  }

  /**
   * Must be used by {@link #apply(DomainEvent)} of the creation event.
   *
   * @param newId to assign
   * @throws IllegalStateException if a different identifier was already assigned
   */
  protected final void assignId(final UUID newId) {
    if (id != null && !id.equals(newId)) {
      throw new IllegalStateException(
          "%s identifier is immutable: '%s' cannot become '%s'".formatted(entityName, id, newId));
    }

    this.id = newId;
  }

  /** Must be used by {@link #apply(DomainEvent)} of the deletion event. */
  protected final void markDeleted() {
    this.deleted = true;
  }

  protected final String getEntityName() {
    return entityName;
  }

  protected final Optional<CommandResult> requireIdentifier(final UUID newId) {
    if (Identifiers.isEmpty(newId)) {
      return Optional.of(
          CommandResult.fail(
              AddressErrorCode.INVALID_IDENTIFIER,
              "%s id cannot be empty".formatted(entityName)));
    }

    return Optional.empty();
  }

  protected final Optional<CommandResult> requireText(final String value, final String fieldName) {
    if (Identifiers.isBlank(value)) {
      return Optional.of(
          CommandResult.fail(
              AddressErrorCode.REQUIRED_FIELD_MISSING,
              "%s %s cannot be null, empty or whitespace".formatted(entityName, fieldName)));
    }

    return Optional.empty();
  }

  /**
   * @param reference to another entity
   * @param existingIds snapshot of the referenced entity existence projection
   * @param referenceName used in error messages
   * @return failure if the reference is empty or unknown
   * @throws IllegalArgumentException if the snapshot is {@code null}
   */
  protected final Optional<CommandResult> requireReference(
      final UUID reference, final Collection<UUID> existingIds, final String referenceName) {
    throwIllegalArgumentIfNull(existingIds, "Existing %s ids".formatted(referenceName));

    if (Identifiers.isEmpty(reference)) {
      return Optional.of(
          CommandResult.fail(
              AddressErrorCode.REFERENCE_INVALID,
              "%s id cannot be empty".formatted(referenceName)));
    }

    if (!existingIds.contains(reference)) {
      return Optional.of(
          CommandResult.fail(
              AddressErrorCode.REFERENCE_NOT_FOUND,
              "%s with id '%s' does not exist".formatted(referenceName, reference)));
    }

    return Optional.empty();
  }

  protected final Optional<CommandResult> requireNotCreated() {
    if (id != null) {
      return Optional.of(
          CommandResult.fail(
              AddressErrorCode.ALREADY_CREATED,
              "%s with id '%s' has already been created".formatted(entityName, id)));
    }

    return Optional.empty();
  }

  protected final Optional<CommandResult> requireUpdatable() {
    return requireInitialized()
        .or(
            () ->
                deleted
                    ? Optional.of(
                        CommandResult.fail(
                            AddressErrorCode.CANNOT_UPDATE_DELETED,
                            "Cannot update deleted %s with id '%s'".formatted(entityName, id)))
                    : Optional.empty());
  }

  protected final Optional<CommandResult> requireDeletable() {
    return requireInitialized()
        .or(
            () ->
                deleted
                    ? Optional.of(
                        CommandResult.fail(
                            AddressErrorCode.ALREADY_DELETED,
                            "%s with id '%s' is already deleted".formatted(entityName, id)))
                    : Optional.empty());
  }

  protected final Optional<CommandResult> requireChanges(final boolean hasChanges) {
    if (!hasChanges) {
      return Optional.of(
          CommandResult.fail(
              AddressErrorCode.NO_CHANGES,
              "No changes for %s with id '%s'".formatted(entityName, id)));
    }

    return Optional.empty();
  }

  private Optional<CommandResult> requireInitialized() {
    if (id == null) {
      return Optional.of(
          CommandResult.fail(
              AddressErrorCode.NOT_INITIALIZED,
              "%s has not been created yet".formatted(entityName)));
    }

    return Optional.empty();
  }
}
