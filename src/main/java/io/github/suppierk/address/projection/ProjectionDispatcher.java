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

import io.github.suppierk.address.cqrs.Suspicious;
import io.github.suppierk.address.eventstore.EventStore;
import io.github.suppierk.address.eventstore.RecordedEvent;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds the global event feed into a fixed set of projections.
 *
 * <p>Every persisted event is delivered to every projection exactly once, in global order. Each
 * projection has its own position in the feed, so a projection failing on an event never causes
 * the projections which already accepted it to see it again on the next {@link #catchUp()}.
 */
public final class ProjectionDispatcher extends Suspicious {
  private static final Logger LOG = LoggerFactory.getLogger(ProjectionDispatcher.class);

  private final EventStore eventStore;
  private final List<Projection> projections;
  private final long[] positions;

  /**
   * @param eventStore to read the global feed from
   * @param projections to feed, in delivery order
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public ProjectionDispatcher(final EventStore eventStore, final List<Projection> projections) {
    this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
    this.projections = List.copyOf(throwIllegalArgumentIfNull(projections, "Projections"));
    this.positions = new long[this.projections.size()];
  }

  /**
   * Delivers every event persisted after the checkpoint to the projections which have not seen it.
   *
   * <p>If a projection throws, its position stays at the last event it accepted, the remaining
   * projections do not receive the failed event and the exception is propagated.
   *
   * @return number of events delivered to at least one projection
   */
  public synchronized long catchUp() {
    long delivered = 0L;
    final long checkpoint = getCheckpoint();

    try (Stream<RecordedEvent> feed = eventStore.subscribeAll(checkpoint)) {
      final Iterator<RecordedEvent> iterator = feed.iterator();

      while (iterator.hasNext()) {
        final RecordedEvent recordedEvent = iterator.next();

        // Stores may replay positions we have already seen
        if (recordedEvent.globalPosition() <= checkpoint) {
          continue;
        }

        boolean accepted = false;

        for (int i = 0; i < positions.length; i++) {
          if (recordedEvent.globalPosition() > positions[i]) {
            projections.get(i).project(recordedEvent);
            positions[i] = recordedEvent.globalPosition();
            accepted = true;
          }
        }

        if (accepted) {
          delivered++;
        }
      }
    }

    if (delivered > 0) {
      LOG.debug("Delivered {} events to {} projections", delivered, projections.size());
    }

    return delivered;
  }

  /**
   * @return global position of the last event every projection accepted, {@code 0} if nothing was
   *     delivered yet
   */
  public synchronized long getCheckpoint() {
    long checkpoint = Long.MAX_VALUE;

    for (long position : positions) {
      checkpoint = Math.min(checkpoint, position);
    }

    return positions.length == 0 ? 0L : checkpoint;
  }
}
