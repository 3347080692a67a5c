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

/**
 * Defines general contract rules used by the codebase.
 *
 * <p>Here is an example to help explain how different domain objects are related to each other -
 * let's assume that a municipality registers a new house on an existing road:
 *
 * <ul>
 *   <li>The road and the post code of the house are already known, each of them is an {@link
 *       io.github.suppierk.address.cqrs.AggregateRoot} with its own event stream.
 *   <li>The house gets an access address, which is an {@link
 *       io.github.suppierk.address.cqrs.AggregateRoot} as well:
 *       <ul>
 *         <li>Creating it checks the road and the post code against snapshots of existing
 *             identifiers, taken from the address projection rather than from foreign keys.
 *         <li>If every precondition holds, the aggregate raises a {@link
 *             io.github.suppierk.address.cqrs.DomainEvent} and reports {@link
 *             io.github.suppierk.address.cqrs.CommandResult#ok()}.
 *         <li>Otherwise nothing is raised and the result carries a {@link
 *             io.github.suppierk.address.cqrs.DomainError} with one of the {@link
 *             io.github.suppierk.address.cqrs.AddressErrorCode}s.
 *       </ul>
 *   <li>Apartments of the house become unit addresses referencing the access address, the same way
 *       the access address references the road.
 *   <li>Raised events are persisted to the event store and later fed into projections, which keep
 *       the identifier snapshots used by the next commands up to date.
 * </ul>
 */
package io.github.suppierk.address.cqrs;
