package io.github.suppierk.address.projection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.address.cqrs.DomainEvent;
import io.github.suppierk.address.domain.accessaddress.AccessAddressCreated;
import io.github.suppierk.address.domain.accessaddress.AccessAddressDeleted;
import io.github.suppierk.address.domain.accessaddress.AccessAddressOfficialIdUpdated;
import io.github.suppierk.address.domain.accessaddress.AccessAddressStatus;
import io.github.suppierk.address.domain.accessaddress.AccessAddressTownNameUpdated;
import io.github.suppierk.address.domain.postcode.PostCodeCreated;
import io.github.suppierk.address.domain.postcode.PostCodeDeleted;
import io.github.suppierk.address.domain.postcode.PostCodeUpdated;
import io.github.suppierk.address.domain.road.RoadCreated;
import io.github.suppierk.address.domain.road.RoadDeleted;
import io.github.suppierk.address.domain.road.RoadStatus;
import io.github.suppierk.address.domain.road.RoadUpdated;
import io.github.suppierk.address.domain.unitaddress.UnitAddressCreated;
import io.github.suppierk.address.domain.unitaddress.UnitAddressDeleted;
import io.github.suppierk.address.domain.unitaddress.UnitAddressExternalIdUpdated;
import io.github.suppierk.address.domain.unitaddress.UnitAddressStatus;
import io.github.suppierk.address.eventstore.RecordedEvent;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AddressProjectionTest {
  static final UUID POST_CODE_ID = UUID.fromString("f4e2f5a6-0d48-4e0a-a9b8-5d0c3f1e9b21");
  static final UUID ROAD_ID = UUID.fromString("d309aa7b-81a3-4708-b1f5-e8155c29e5b5");
  static final UUID ACCESS_ADDRESS_ID = UUID.fromString("5bc2ad5b-8634-4b05-86b2-ea6eb10596dc");
  static final UUID UNIT_ADDRESS_ID = UUID.fromString("d4de2559-066d-4492-8f84-712f4995b7a3");
  static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  AddressProjection projection;
  long position;

  @BeforeEach
  void setUp() {
    projection = new AddressProjection();
    position = 0L;
  }

  void project(final DomainEvent event) {
    position++;
    projection.project(new RecordedEvent(event.aggregateId(), 1L, position, NOW, event));
  }

  static AccessAddressCreated accessAddressCreated(final UUID id, final String officialId) {
    return new AccessAddressCreated(
        id,
        officialId,
        "0607",
        AccessAddressStatus.ACTIVE,
        "1234",
        "10A",
        POST_CODE_ID,
        552700.0,
        6163800.0,
        "Fredericia",
        null,
        ROAD_ID,
        NOW,
        NOW,
        false);
  }

  static UnitAddressCreated unitAddressCreated(final UUID id, final String externalId) {
    return new UnitAddressCreated(
        id,
        externalId,
        ACCESS_ADDRESS_ID,
        UnitAddressStatus.ACTIVE,
        "1 st.",
        "mf",
        NOW,
        NOW,
        false);
  }

  @Nested
  class PostCodes {
    @Test
    void when_post_code_is_created_both_directions_are_registered() {
      project(new PostCodeCreated(POST_CODE_ID, "7000", "Fredericia"));

      assertEquals(Map.of("7000", POST_CODE_ID), projection.getPostCodeNumberToId());
      assertEquals(Map.of(POST_CODE_ID, "7000"), projection.getPostCodeIdToNumber());
      assertEquals(Set.of(POST_CODE_ID), projection.getPostCodeIds());
      assertEquals(Optional.of(POST_CODE_ID), projection.findPostCodeIdByNumber("7000"));
    }

    @Test
    void when_post_code_is_renamed_lookups_are_unchanged() {
      project(new PostCodeCreated(POST_CODE_ID, "7000", "Fredericia"));
      project(new PostCodeUpdated(POST_CODE_ID, "Fredericia C"));

      assertEquals(Map.of("7000", POST_CODE_ID), projection.getPostCodeNumberToId());
    }

    @Test
    void when_post_code_is_deleted_both_directions_are_removed() {
      project(new PostCodeCreated(POST_CODE_ID, "7000", "Fredericia"));
      project(new PostCodeDeleted(POST_CODE_ID));

      assertTrue(projection.getPostCodeNumberToId().isEmpty());
      assertTrue(projection.getPostCodeIdToNumber().isEmpty());
      assertTrue(projection.getPostCodeIds().isEmpty());
      assertTrue(projection.findPostCodeIdByNumber("7000").isEmpty());
    }

    @Test
    void when_unknown_post_code_is_deleted_illegal_state_exception_is_thrown() {
      assertThrows(IllegalStateException.class, () -> project(new PostCodeDeleted(POST_CODE_ID)));
    }

    @Test
    void when_number_is_registered_twice_illegal_state_exception_is_thrown() {
      project(new PostCodeCreated(POST_CODE_ID, "7000", "Fredericia"));

      assertThrows(
          IllegalStateException.class,
          () -> project(new PostCodeCreated(UUID.randomUUID(), "7000", "Fredericia")));
      assertEquals(Map.of("7000", POST_CODE_ID), projection.getPostCodeNumberToId());
      assertEquals(Map.of(POST_CODE_ID, "7000"), projection.getPostCodeIdToNumber());
    }
  }

  @Nested
  class Roads {
    @Test
    void when_road_is_created_it_is_known_by_id_and_official_id() {
      project(new RoadCreated(ROAD_ID, "road-1", "Vej", RoadStatus.EFFECTIVE));

      assertEquals(Set.of(ROAD_ID), projection.getRoadIds());
      assertEquals(Optional.of(ROAD_ID), projection.findRoadIdByOfficialId("road-1"));
    }

    @Test
    void when_official_id_changes_lookup_key_moves() {
      project(new RoadCreated(ROAD_ID, "road-1", "Vej", RoadStatus.EFFECTIVE));
      project(new RoadUpdated(ROAD_ID, "road-2", "Vej", RoadStatus.EFFECTIVE));

      assertEquals(Map.of("road-2", ROAD_ID), projection.getRoadOfficialIdToId());
      assertEquals(Set.of(ROAD_ID), projection.getRoadIds());
    }

    @Test
    void when_road_is_deleted_it_is_forgotten() {
      project(new RoadCreated(ROAD_ID, "road-1", "Vej", RoadStatus.EFFECTIVE));
      project(new RoadDeleted(ROAD_ID));

      assertTrue(projection.getRoadIds().isEmpty());
      assertTrue(projection.getRoadOfficialIdToId().isEmpty());
    }

    @Test
    void when_official_id_of_another_road_is_taken_table_is_untouched_and_owner_survives() {
      final var otherRoadId = UUID.fromString("0b6f1a3e-5c2d-4f7a-8e91-2d4c6b8a0f13");
      project(new RoadCreated(ROAD_ID, "road-1", "Vej", RoadStatus.EFFECTIVE));
      project(new RoadCreated(otherRoadId, "road-2", "Gade", RoadStatus.EFFECTIVE));

      assertThrows(
          IllegalStateException.class,
          () -> project(new RoadUpdated(otherRoadId, "road-1", "Gade", RoadStatus.EFFECTIVE)));
      assertEquals(Set.of(ROAD_ID, otherRoadId), projection.getRoadIds());
      assertEquals(
          Map.of("road-1", ROAD_ID, "road-2", otherRoadId), projection.getRoadOfficialIdToId());

      project(new RoadDeleted(ROAD_ID));

      assertEquals(Set.of(otherRoadId), projection.getRoadIds());
      assertEquals(Map.of("road-2", otherRoadId), projection.getRoadOfficialIdToId());
    }

    @Test
    void when_released_official_id_is_reused_by_another_road_lookup_follows() {
      final var otherRoadId = UUID.fromString("0b6f1a3e-5c2d-4f7a-8e91-2d4c6b8a0f13");
      project(new RoadCreated(ROAD_ID, "road-1", "Vej", RoadStatus.EFFECTIVE));
      project(new RoadCreated(otherRoadId, "road-2", "Gade", RoadStatus.EFFECTIVE));
      project(new RoadDeleted(ROAD_ID));
      project(new RoadUpdated(otherRoadId, "road-1", "Gade", RoadStatus.EFFECTIVE));

      assertEquals(Set.of(otherRoadId), projection.getRoadIds());
      assertEquals(Optional.of(otherRoadId), projection.findRoadIdByOfficialId("road-1"));
    }

    @Test
    void when_unknown_road_is_updated_illegal_state_exception_is_thrown() {
      assertThrows(
          IllegalStateException.class,
          () -> project(new RoadUpdated(ROAD_ID, "road-1", "Vej", RoadStatus.EFFECTIVE)));
      assertTrue(projection.getRoadIds().isEmpty());
    }

    @Test
    void when_unknown_road_is_deleted_illegal_state_exception_is_thrown() {
      assertThrows(IllegalStateException.class, () -> project(new RoadDeleted(ROAD_ID)));
    }
  }

  @Nested
  class AccessAddresses {
    @Test
    void when_access_address_has_no_official_id_it_still_exists() {
      project(accessAddressCreated(ACCESS_ADDRESS_ID, null));

      assertEquals(Set.of(ACCESS_ADDRESS_ID), projection.getAccessAddressIds());
      assertTrue(projection.getAccessAddressOfficialIdToId().isEmpty());
    }

    @Test
    void when_official_id_changes_lookup_key_moves() {
      project(accessAddressCreated(ACCESS_ADDRESS_ID, "official-1"));
      project(new AccessAddressOfficialIdUpdated(ACCESS_ADDRESS_ID, "official-2", NOW));

      assertEquals(
          Map.of("official-2", ACCESS_ADDRESS_ID), projection.getAccessAddressOfficialIdToId());
      assertTrue(projection.findAccessAddressIdByOfficialId("official-1").isEmpty());
    }

    @Test
    void when_official_id_is_cleared_lookup_entry_is_removed() {
      project(accessAddressCreated(ACCESS_ADDRESS_ID, "official-1"));
      project(new AccessAddressOfficialIdUpdated(ACCESS_ADDRESS_ID, null, NOW));

      assertTrue(projection.getAccessAddressOfficialIdToId().isEmpty());
      assertEquals(Set.of(ACCESS_ADDRESS_ID), projection.getAccessAddressIds());
    }

    @Test
    void when_unrelated_field_changes_projection_is_unchanged() {
      project(accessAddressCreated(ACCESS_ADDRESS_ID, "official-1"));
      project(new AccessAddressTownNameUpdated(ACCESS_ADDRESS_ID, "Vejle", NOW));

      assertEquals(
          Map.of("official-1", ACCESS_ADDRESS_ID), projection.getAccessAddressOfficialIdToId());
    }

    @Test
    void when_access_address_is_deleted_it_is_forgotten() {
      project(accessAddressCreated(ACCESS_ADDRESS_ID, "official-1"));
      project(new AccessAddressDeleted(ACCESS_ADDRESS_ID, NOW));

      assertTrue(projection.getAccessAddressIds().isEmpty());
      assertTrue(projection.getAccessAddressOfficialIdToId().isEmpty());
    }

    @Test
    void when_unknown_access_address_is_deleted_illegal_state_exception_is_thrown() {
      assertThrows(
          IllegalStateException.class,
          () -> project(new AccessAddressDeleted(ACCESS_ADDRESS_ID, NOW)));
    }
  }

  @Nested
  class UnitAddresses {
    @Test
    void when_unit_address_is_created_it_is_known_by_id_and_external_id() {
      project(unitAddressCreated(UNIT_ADDRESS_ID, "external-1"));

      assertEquals(Set.of(UNIT_ADDRESS_ID), projection.getUnitAddressIds());
      assertEquals(
          Optional.of(UNIT_ADDRESS_ID), projection.findUnitAddressIdByExternalId("external-1"));
    }

    @Test
    void when_external_id_changes_lookup_key_moves() {
      project(unitAddressCreated(UNIT_ADDRESS_ID, "external-1"));
      project(new UnitAddressExternalIdUpdated(UNIT_ADDRESS_ID, "external-2", NOW));

      assertEquals(
          Map.of("external-2", UNIT_ADDRESS_ID), projection.getUnitAddressExternalIdToId());
    }

    @Test
    void when_unit_address_is_deleted_it_is_forgotten() {
      project(unitAddressCreated(UNIT_ADDRESS_ID, "external-1"));
      project(new UnitAddressDeleted(UNIT_ADDRESS_ID, NOW));

      assertFalse(projection.getUnitAddressIds().contains(UNIT_ADDRESS_ID));
      assertTrue(projection.getUnitAddressExternalIdToId().isEmpty());
    }
  }

  @Test
  void when_snapshot_is_taken_later_events_do_not_change_it() {
    project(new RoadCreated(ROAD_ID, "road-1", "Vej", RoadStatus.EFFECTIVE));
    final var snapshot = projection.getRoadIds();

    project(new RoadDeleted(ROAD_ID));

    assertEquals(Set.of(ROAD_ID), snapshot);
    assertThrows(UnsupportedOperationException.class, () -> snapshot.add(UUID.randomUUID()));
  }

  @Test
  void when_recorded_event_is_null_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> projection.project(null));
  }
}
