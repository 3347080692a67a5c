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

package io.github.suppierk.address.domain.postcode;

import io.github.suppierk.address.cqrs.AggregateRoot;
import io.github.suppierk.address.cqrs.CommandResult;
import java.util.UUID;

/**
 * A postal district, e.g. {@code 7000 Fredericia}.
 *
 * <p>The number is immutable after creation: it is the key under which the post code is known to
 * the address projection.
 */
public final class PostCodeAggregate extends AggregateRoot<PostCodeEvent> {
  private String number;
  private String name;

  public PostCodeAggregate() {
    super(PostCodeEvent.class, "Post code");
  }

  public String getNumber() {
    return number;
  }

  public String getName() {
    return name;
  }

  public CommandResult create(final UUID id, final String number, final String name) {
    return requireIdentifier(id)
        .or(() -> requireText(number, "number"))
        .or(() -> requireText(name, "name"))
        .or(this::requireNotCreated)
        .orElseGet(() -> raise(new PostCodeCreated(id, number, name)));
  }

  public CommandResult update(final String name) {
    return requireText(name, "name")
        .or(this::requireUpdatable)
        .or(() -> requireChanges(!name.equals(this.name)))
        .orElseGet(() -> raise(new PostCodeUpdated(getId(), name)));
  }

  public CommandResult delete() {
    return requireDeletable().orElseGet(() -> raise(new PostCodeDeleted(getId())));
  }

  @Override
  protected void apply(final PostCodeEvent event) {
    if (event instanceof PostCodeCreated created) {
      assignId(created.id());
      number = created.number();
      name = created.name();
    } else if (event instanceof PostCodeUpdated updated) {
      name = updated.name();
    } else if (event instanceof PostCodeDeleted) {
      markDeleted();
    } else {
      throw new IllegalStateException("Unsupported post code event: %s".formatted(event));
    }
  }
}
