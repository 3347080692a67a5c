package io.github.suppierk.address.projection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.address.domain.accessaddress.AccessAddressAggregate;
import io.github.suppierk.address.domain.accessaddress.AccessAddressStatus;
import io.github.suppierk.address.domain.accessaddress.AccessAddressValues;
import io.github.suppierk.address.domain.postcode.PostCodeAggregate;
import io.github.suppierk.address.domain.road.RoadAggregate;
import io.github.suppierk.address.domain.road.RoadStatus;
import io.github.suppierk.address.domain.unitaddress.UnitAddressAggregate;
import io.github.suppierk.address.domain.unitaddress.UnitAddressStatus;
import io.github.suppierk.address.eventstore.AggregateRepository;
import io.github.suppierk.address.eventstore.InMemoryEventStore;
import io.github.suppierk.address.eventstore.RecordedEvent;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProjectionDispatcherTest {
  static final UUID POST_CODE_ID = UUID.fromString("f4e2f5a6-0d48-4e0a-a9b8-5d0c3f1e9b21");
  static final UUID ROAD_ID = UUID.fromString("d309aa7b-81a3-4708-b1f5-e8155c29e5b5");
  static final UUID ACCESS_ADDRESS_ID = UUID.fromString("5bc2ad5b-8634-4b05-86b2-ea6eb10596dc");
  static final UUID UNIT_ADDRESS_ID = UUID.fromString("d4de2559-066d-4492-8f84-712f4995b7a3");
  static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  InMemoryEventStore eventStore;
  AggregateRepository repository;
  AddressProjection projection;
  List<RecordedEvent> delivered;
  ProjectionDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    eventStore = new InMemoryEventStore();
    repository = new AggregateRepository(eventStore);
    projection = new AddressProjection();
    delivered = new ArrayList<>();
    dispatcher = new ProjectionDispatcher(eventStore, List.of(projection, delivered::add));
  }

  @Test
  void when_any_of_the_constructor_arguments_is_null_throw_illegal_argument_exception() {
    assertThrows(IllegalArgumentException.class, () -> new ProjectionDispatcher(null, List.of()));
    assertThrows(IllegalArgumentException.class, () -> new ProjectionDispatcher(eventStore, null));
  }

  @Test
  void when_nothing_was_appended_nothing_is_delivered() {
    assertEquals(0L, dispatcher.catchUp());
    assertEquals(0L, dispatcher.getCheckpoint());
  }

  @Test
  void when_caught_up_repeatedly_every_event_is_delivered_exactly_once_in_order() {
    final var postCode = new PostCodeAggregate();
    postCode.create(POST_CODE_ID, "7000", "Fredericia");
    repository.store(postCode);

    final var road = new RoadAggregate();
    road.create(ROAD_ID, "road-1", "Vej", RoadStatus.EFFECTIVE);
    repository.store(road);

    assertEquals(2L, dispatcher.catchUp());
    assertEquals(0L, dispatcher.catchUp());

    road.update("road-1", "Vej 2", RoadStatus.EFFECTIVE);
    repository.store(road);

    assertEquals(1L, dispatcher.catchUp());
    assertEquals(3L, dispatcher.getCheckpoint());
    assertEquals(
        List.of(1L, 2L, 3L), delivered.stream().map(RecordedEvent::globalPosition).toList());
  }

  @Test
  void when_whole_registry_is_built_projection_supplies_references_for_next_commands() {
    final var postCode = new PostCodeAggregate();
    assertTrue(postCode.create(POST_CODE_ID, "7000", "Fredericia").isSuccess());
    repository.store(postCode);

    final var road = new RoadAggregate();
    assertTrue(road.create(ROAD_ID, "road-1", "Vej", RoadStatus.EFFECTIVE).isSuccess());
    repository.store(road);

    dispatcher.catchUp();

    final var accessAddress = new AccessAddressAggregate();
    final var values =
        new AccessAddressValues(
            "official-1",
            "0607",
            AccessAddressStatus.ACTIVE,
            "1234",
            "10A",
            projection.findPostCodeIdByNumber("7000").orElseThrow(),
            552700.0,
            6163800.0,
            "Fredericia",
            null,
            projection.findRoadIdByOfficialId("road-1").orElseThrow(),
            false);
    assertTrue(
        accessAddress
            .create(
                ACCESS_ADDRESS_ID,
                values,
                NOW,
                NOW,
                projection.getRoadIds(),
                projection.getPostCodeIds())
            .isSuccess());
    repository.store(accessAddress);

    dispatcher.catchUp();

    final var unitAddress = new UnitAddressAggregate();
    assertTrue(
        unitAddress
            .create(
                UNIT_ADDRESS_ID,
                "external-1",
                ACCESS_ADDRESS_ID,
                UnitAddressStatus.ACTIVE,
                "1 st.",
                "mf",
                NOW,
                NOW,
                false,
                projection.getAccessAddressIds())
            .isSuccess());
    repository.store(unitAddress);

    dispatcher.catchUp();

    assertEquals(
        Map.of("official-1", ACCESS_ADDRESS_ID), projection.getAccessAddressOfficialIdToId());
    assertEquals(Set.of(UNIT_ADDRESS_ID), projection.getUnitAddressIds());
    assertEquals(4L, dispatcher.getCheckpoint());
  }

  @Test
  void when_projection_fails_checkpoint_stays_at_last_delivered_event() {
    final var postCode = new PostCodeAggregate();
    postCode.create(POST_CODE_ID, "7000", "Fredericia");
    postCode.delete();
    repository.store(postCode);

    final Projection brokenOnDeletion =
        recordedEvent -> {
          if (recordedEvent.streamVersion() == 2L) {
            throw new IllegalStateException("Broken projection");
          }
        };
    final var failing = new ProjectionDispatcher(eventStore, List.of(brokenOnDeletion));

    assertThrows(IllegalStateException.class, failing::catchUp);
    assertEquals(1L, failing.getCheckpoint());
  }

  @Test
  void when_later_projection_fails_earlier_projections_do_not_see_the_event_again() {
    final var postCode = new PostCodeAggregate();
    postCode.create(POST_CODE_ID, "7000", "Fredericia");
    repository.store(postCode);

    final List<Long> seenByCounting = new ArrayList<>();
    final Projection counting = recordedEvent -> seenByCounting.add(recordedEvent.globalPosition());
    final var failures = new AtomicInteger(1);
    final Projection flaky =
        recordedEvent -> {
          if (failures.getAndDecrement() > 0) {
            throw new IllegalStateException("Temporarily broken projection");
          }
        };
    final var twoProjections = new ProjectionDispatcher(eventStore, List.of(counting, flaky));

    assertThrows(IllegalStateException.class, twoProjections::catchUp);
    assertEquals(0L, twoProjections.getCheckpoint());

    assertEquals(1L, twoProjections.catchUp());
    assertEquals(1L, twoProjections.getCheckpoint());
    assertEquals(List.of(1L), seenByCounting);
  }

  @Test
  void when_roads_swap_official_ids_through_commands_registry_keeps_every_live_road() {
    final var firstRoadId = ROAD_ID;
    final var secondRoadId = UUID.fromString("0b6f1a3e-5c2d-4f7a-8e91-2d4c6b8a0f13");

    final var firstRoad = new RoadAggregate();
    firstRoad.create(firstRoadId, "R1", "Vej", RoadStatus.EFFECTIVE);
    repository.store(firstRoad);

    final var secondRoad = new RoadAggregate();
    secondRoad.create(secondRoadId, "R2", "Gade", RoadStatus.EFFECTIVE);
    repository.store(secondRoad);

    dispatcher.catchUp();

    firstRoad.delete();
    repository.store(firstRoad);
    secondRoad.update("R1", "Gade", RoadStatus.EFFECTIVE);
    repository.store(secondRoad);

    assertEquals(2L, dispatcher.catchUp());
    assertEquals(Set.of(secondRoadId), projection.getRoadIds());
    assertEquals(Map.of("R1", secondRoadId), projection.getRoadOfficialIdToId());
  }
}
