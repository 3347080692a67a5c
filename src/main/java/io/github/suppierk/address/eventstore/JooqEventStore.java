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

package io.github.suppierk.address.eventstore;

import io.github.suppierk.address.cqrs.DomainEvent;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} backed by a single relational table accessed with jOOQ.
 *
 * <p>Expected table layout (see {@code address_events.sql}):
 *
 * <ul>
 *   <li>{@code global_position} - identity, defines the order of the global feed.
 *   <li>{@code stream_id}, {@code stream_version} - unique together, define the order within a
 *       stream.
 *   <li>{@code event_type} - informational, fully qualified class name of the event.
 *   <li>{@code payload} - serialized event, see {@link EventSerializer}.
 *   <li>{@code recorded_at} - UTC time of the append.
 * </ul>
 *
 * <p>Appends run in a single transaction. The version check inside the transaction detects stale
 * writers, the unique key detects writers racing with us between the check and the insert - both
 * are reported as {@link ConcurrencyConflictException}.
 */
public final class JooqEventStore extends AbstractEventStore {
  /** Table name used by the convenience constructor. */
  public static final String DEFAULT_TABLE_NAME = "address_events";

  private static final Logger LOG = LoggerFactory.getLogger(JooqEventStore.class);

  private static final Field<Long> GLOBAL_POSITION =
      DSL.field(DSL.name("global_position"), SQLDataType.BIGINT);
  private static final Field<UUID> STREAM_ID = DSL.field(DSL.name("stream_id"), SQLDataType.UUID);
  private static final Field<Long> STREAM_VERSION =
      DSL.field(DSL.name("stream_version"), SQLDataType.BIGINT);
  private static final Field<String> EVENT_TYPE =
      DSL.field(DSL.name("event_type"), SQLDataType.VARCHAR(255));
  private static final Field<byte[]> PAYLOAD =
      DSL.field(DSL.name("payload"), SQLDataType.VARBINARY);
  private static final Field<LocalDateTime> RECORDED_AT =
      DSL.field(DSL.name("recorded_at"), SQLDataType.LOCALDATETIME);

  private final DSLContext dsl;
  private final Table<Record> table;
  private final Clock clock;
  private final EventSerializer serializer;

  /**
   * @param dsl to run statements with
   * @throws IllegalArgumentException if the context is {@code null}
   */
  public JooqEventStore(final DSLContext dsl) {
    this(dsl, DEFAULT_TABLE_NAME, Clock.systemUTC());
  }

  /**
   * @param dsl to run statements with
   * @param tableName of the events table
   * @param clock used to stamp recorded events
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public JooqEventStore(final DSLContext dsl, final String tableName, final Clock clock) {
    this.dsl = throwIllegalArgumentIfNull(dsl, "DSLContext");
    this.table = DSL.table(DSL.name(throwIllegalArgumentIfNull(tableName, "Table name")));
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
    this.serializer = new EventSerializer();
  }

  /** {@inheritDoc} */
  @Override
  public void append(
      final UUID streamId, final long expectedVersion, final List<? extends DomainEvent> events) {
    verifyAppend(streamId, expectedVersion, events);

    if (events.isEmpty()) {
      return;
    }

    try {
      dsl.transaction(
          (final Configuration trx) -> {
            final DSLContext trxDsl = trx.dsl();
            final long actualVersion = currentVersion(trxDsl, streamId);

            if (actualVersion != expectedVersion) {
              throw new ConcurrencyConflictException(streamId, expectedVersion, actualVersion);
            }

            final LocalDateTime recordedAt =
                LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
            long version = expectedVersion;

            for (DomainEvent event : events) {
              version++;
              trxDsl
                  .insertInto(table)
                  .columns(STREAM_ID, STREAM_VERSION, EVENT_TYPE, PAYLOAD, RECORDED_AT)
                  .values(
                      streamId,
                      version,
                      event.getClass().getName(),
                      serializer.serialize(event),
                      recordedAt)
                  .execute();
            }
          });
    } catch (ConcurrencyConflictException e) {
      LOG.warn(e.getMessage());
      throw e;
    } catch (DataAccessException e) {
      if (e.sqlStateClass() != SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
        throw e;
      }

      LOG.warn("Concurrent append to stream '{}' detected by the database", streamId);
      throw new ConcurrencyConflictException(streamId, expectedVersion, -1L, e);
    }

    LOG.debug("Appended {} events to stream '{}'", events.size(), streamId);
  }

  /** {@inheritDoc} */
  @Override
  public List<RecordedEvent> load(final UUID streamId) {
    throwIllegalArgumentIfNull(streamId, "Stream id");

    return dsl.select(GLOBAL_POSITION, STREAM_ID, STREAM_VERSION, PAYLOAD, RECORDED_AT)
        .from(table)
        .where(STREAM_ID.eq(streamId))
        .orderBy(STREAM_VERSION.asc())
        .fetch(this::toRecordedEvent);
  }

  /**
   * {@inheritDoc}
   *
   * <p>The returned stream keeps a database cursor open until it is closed.
   */
  @Override
  public Stream<RecordedEvent> subscribeAll(final long checkpoint) {
    return dsl.select(GLOBAL_POSITION, STREAM_ID, STREAM_VERSION, PAYLOAD, RECORDED_AT)
        .from(table)
        .where(GLOBAL_POSITION.gt(checkpoint))
        .orderBy(GLOBAL_POSITION.asc())
        .fetchStream()
        .map(this::toRecordedEvent);
  }

  private long currentVersion(final DSLContext trxDsl, final UUID streamId) {
    final Field<Long> maxVersion = DSL.max(STREAM_VERSION);
    final Long version =
        trxDsl.select(maxVersion).from(table).where(STREAM_ID.eq(streamId)).fetchOne(maxVersion);
    return version == null ? 0L : version;
  }

  private RecordedEvent toRecordedEvent(final Record row) {
    return new RecordedEvent(
        row.get(STREAM_ID),
        row.get(STREAM_VERSION),
        row.get(GLOBAL_POSITION),
        row.get(RECORDED_AT).toInstant(ZoneOffset.UTC),
        serializer.deserialize(row.get(PAYLOAD)));
  }
}
