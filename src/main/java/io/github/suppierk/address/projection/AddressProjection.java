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

import io.github.suppierk.address.domain.accessaddress.AccessAddressCreated;
import io.github.suppierk.address.domain.accessaddress.AccessAddressDeleted;
import io.github.suppierk.address.domain.accessaddress.AccessAddressOfficialIdUpdated;
import io.github.suppierk.address.domain.accessaddress.AccessAddressUpdated;
import io.github.suppierk.address.domain.postcode.PostCodeCreated;
import io.github.suppierk.address.domain.postcode.PostCodeDeleted;
import io.github.suppierk.address.domain.road.RoadCreated;
import io.github.suppierk.address.domain.road.RoadDeleted;
import io.github.suppierk.address.domain.road.RoadUpdated;
import io.github.suppierk.address.domain.unitaddress.UnitAddressCreated;
import io.github.suppierk.address.domain.unitaddress.UnitAddressDeleted;
import io.github.suppierk.address.domain.unitaddress.UnitAddressExternalIdUpdated;
import io.github.suppierk.address.domain.unitaddress.UnitAddressUpdated;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Lookup tables replacing the foreign keys a relational model would have.
 *
 * <p>Maintained indexes:
 *
 * <ul>
 *   <li>Access addresses: existence set and official id to id lookup. Access addresses can exist
 *       without an official id, so the existence set is kept separately from the lookup.
 *   <li>Unit addresses: existence set and external id to id lookup.
 *   <li>Roads: existence set and official id to id lookup. An official id owned by another road
 *       is never taken over.
 *   <li>Post codes: bijective number to id table, both directions always change together.
 * </ul>
 *
 * <p>Deleted entities leave every index. All accessors return immutable snapshots which are safe
 * to hand to aggregate commands.
 */
public final class AddressProjection extends AbstractProjection {
  private final Set<UUID> accessAddressIds = new HashSet<>();
  private final KeyIndex<String> accessAddressOfficialIds = new KeyIndex<>("Access address");

  private final Set<UUID> unitAddressIds = new HashSet<>();
  private final KeyIndex<String> unitAddressExternalIds = new KeyIndex<>("Unit address");

  private final Set<UUID> roadIds = new HashSet<>();
  private final KeyIndex<String> roadOfficialIds = new KeyIndex<>("Road");

  private final KeyIndex<String> postCodeNumbers = new KeyIndex<>("Post code");

  public AddressProjection() {
    projectEvent(
        AccessAddressCreated.class,
        created -> {
          accessAddressIds.add(created.id());
          accessAddressOfficialIds.move(created.id(), created.officialId());
        });
    projectEvent(
        AccessAddressUpdated.class,
        updated -> accessAddressOfficialIds.move(updated.id(), updated.officialId()));
    projectEvent(
        AccessAddressOfficialIdUpdated.class,
        updated -> accessAddressOfficialIds.move(updated.id(), updated.officialId()));
    projectEvent(
        AccessAddressDeleted.class,
        deleted -> {
          removeExisting(accessAddressIds, deleted.id(), "Access address");
          accessAddressOfficialIds.move(deleted.id(), null);
        });

    projectEvent(
        UnitAddressCreated.class,
        created -> {
          unitAddressIds.add(created.id());
          unitAddressExternalIds.move(created.id(), created.externalId());
        });
    projectEvent(
        UnitAddressUpdated.class,
        updated -> unitAddressExternalIds.move(updated.id(), updated.externalId()));
    projectEvent(
        UnitAddressExternalIdUpdated.class,
        updated -> unitAddressExternalIds.move(updated.id(), updated.externalId()));
    projectEvent(
        UnitAddressDeleted.class,
        deleted -> {
          removeExisting(unitAddressIds, deleted.id(), "Unit address");
          unitAddressExternalIds.move(deleted.id(), null);
        });

    projectEvent(
        RoadCreated.class,
        created -> {
          roadOfficialIds.insert(created.officialId(), created.id());
          roadIds.add(created.id());
        });
    projectEvent(
        RoadUpdated.class,
        updated -> roadOfficialIds.replace(updated.id(), updated.officialId()));
    projectEvent(
        RoadDeleted.class,
        deleted -> {
          removeExisting(roadIds, deleted.id(), "Road");
          roadOfficialIds.move(deleted.id(), null);
        });

    projectEvent(
        PostCodeCreated.class, created -> postCodeNumbers.insert(created.number(), created.id()));
    projectEvent(PostCodeDeleted.class, deleted -> postCodeNumbers.remove(deleted.id()));
  }

  /**
   * @return identifiers of every existing access address
   */
  public Set<UUID> getAccessAddressIds() {
    return read(() -> Set.copyOf(accessAddressIds));
  }

  /**
   * @return official id to id lookup of access addresses which have an official id
   */
  public Map<String, UUID> getAccessAddressOfficialIdToId() {
    return read(accessAddressOfficialIds::keyToIdSnapshot);
  }

  public Optional<UUID> findAccessAddressIdByOfficialId(final String officialId) {
    return read(() -> accessAddressOfficialIds.findId(officialId));
  }

  /**
   * @return identifiers of every existing unit address
   */
  public Set<UUID> getUnitAddressIds() {
    return read(() -> Set.copyOf(unitAddressIds));
  }

  /**
   * @return external id to id lookup of unit addresses which have an external id
   */
  public Map<String, UUID> getUnitAddressExternalIdToId() {
    return read(unitAddressExternalIds::keyToIdSnapshot);
  }

  public Optional<UUID> findUnitAddressIdByExternalId(final String externalId) {
    return read(() -> unitAddressExternalIds.findId(externalId));
  }

  /**
   * @return identifiers of every existing road
   */
  public Set<UUID> getRoadIds() {
    return read(() -> Set.copyOf(roadIds));
  }

  public Map<String, UUID> getRoadOfficialIdToId() {
    return read(roadOfficialIds::keyToIdSnapshot);
  }

  public Optional<UUID> findRoadIdByOfficialId(final String officialId) {
    return read(() -> roadOfficialIds.findId(officialId));
  }

  /**
   * @return identifiers of every existing post code
   */
  public Set<UUID> getPostCodeIds() {
    return read(postCodeNumbers::idSnapshot);
  }

  public Map<String, UUID> getPostCodeNumberToId() {
    return read(postCodeNumbers::keyToIdSnapshot);
  }

  public Map<UUID, String> getPostCodeIdToNumber() {
    return read(postCodeNumbers::idToKeySnapshot);
  }

  public Optional<UUID> findPostCodeIdByNumber(final String number) {
    return read(() -> postCodeNumbers.findId(number));
  }

  private static void removeExisting(final Set<UUID> ids, final UUID id, final String entityName) {
    if (!ids.remove(id)) {
      throw new IllegalStateException(
          "%s '%s' cannot be deleted: it was never created".formatted(entityName, id));
    }
  }

  /**
   * Two-directional key to id table.
   *
   * <p>Every mutation changes both directions together, so the table is never left consistent in
   * one direction only.
   *
   * @param <K> is the type of the key
   */
  private static final class KeyIndex<K> {
    private final String entityName;
    private final Map<K, UUID> keyToId = new HashMap<>();
    private final Map<UUID, K> idToKey = new HashMap<>();

    private KeyIndex(final String entityName) {
      this.entityName = entityName;
    }

    /**
     * @throws IllegalStateException if either the key or the id is already taken
     */
    private void insert(final K key, final UUID id) {
      if (keyToId.containsKey(key) || idToKey.containsKey(id)) {
        throw new IllegalStateException(
            "%s '%s' cannot be registered under '%s': key or id is already taken"
                .formatted(entityName, id, key));
      }

      keyToId.put(key, id);
      idToKey.put(id, key);
    }

    /**
     * @throws IllegalStateException if the id was never inserted
     */
    private void remove(final UUID id) {
      final K key = idToKey.remove(id);

      if (key == null) {
        throw new IllegalStateException(
            "%s '%s' cannot be removed: it was never registered".formatted(entityName, id));
      }

      keyToId.remove(key);
    }

    /**
     * Re-registers an already registered id under a new key.
     *
     * @throws IllegalStateException if the id was never inserted or the key is owned by another id
     */
    private void replace(final UUID id, final K newKey) {
      final UUID owner = keyToId.get(newKey);

      if (!idToKey.containsKey(id) || (owner != null && !owner.equals(id))) {
        throw new IllegalStateException(
            "%s '%s' cannot be re-registered under '%s': unknown id or key owned by '%s'"
                .formatted(entityName, id, newKey, owner));
      }

      move(id, newKey);
    }

    /**
     * Re-registers the id under a new key, {@code null} key only drops the current registration.
     * A key still owned by another id is taken over by this one.
     */
    private void move(final UUID id, final K newKey) {
      final K oldKey = idToKey.remove(id);

      if (oldKey != null) {
        keyToId.remove(oldKey, id);
      }

      if (newKey != null) {
        final UUID previousOwner = keyToId.put(newKey, id);

        if (previousOwner != null && !previousOwner.equals(id)) {
          idToKey.remove(previousOwner);
        }

        idToKey.put(id, newKey);
      }
    }

    private Optional<UUID> findId(final K key) {
      return Optional.ofNullable(key == null ? null : keyToId.get(key));
    }

    private Map<K, UUID> keyToIdSnapshot() {
      return Map.copyOf(keyToId);
    }

    private Map<UUID, K> idToKeySnapshot() {
      return Map.copyOf(idToKey);
    }

    private Set<UUID> idSnapshot() {
      return Set.copyOf(idToKey.keySet());
    }
  }
}
