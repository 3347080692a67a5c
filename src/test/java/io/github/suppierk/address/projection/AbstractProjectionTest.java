package io.github.suppierk.address.projection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.address.domain.road.RoadCreated;
import io.github.suppierk.address.domain.road.RoadDeleted;
import io.github.suppierk.address.domain.road.RoadStatus;
import io.github.suppierk.address.eventstore.RecordedEvent;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AbstractProjectionTest {
  static final UUID ROAD_ID = UUID.fromString("d309aa7b-81a3-4708-b1f5-e8155c29e5b5");

  static class RoadCounter extends AbstractProjection {
    private int created;

    RoadCounter() {
      projectEvent(RoadCreated.class, event -> created++);
    }

    int getCreated() {
      return read(() -> created);
    }
  }

  static class DuplicateRegistration extends AbstractProjection {
    DuplicateRegistration() {
      projectEvent(RoadCreated.class, event -> {});
      projectEvent(RoadCreated.class, event -> {});
    }
  }

  @Test
  void when_handler_is_registered_twice_illegal_state_exception_is_thrown() {
    assertThrows(IllegalStateException.class, DuplicateRegistration::new);
  }

  @Test
  void when_event_kind_is_not_registered_it_is_ignored() {
    final var counter = new RoadCounter();

    counter.project(
        new RecordedEvent(
            ROAD_ID,
            1L,
            1L,
            Instant.now(),
            new RoadCreated(ROAD_ID, "road-1", "Vej", RoadStatus.EFFECTIVE)));
    counter.project(new RecordedEvent(ROAD_ID, 2L, 2L, Instant.now(), new RoadDeleted(ROAD_ID)));

    assertEquals(1, counter.getCreated());
  }
}
