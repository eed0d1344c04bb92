/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.moviedb.model;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A row in the {@link Table#ACTORS} table. */
public final class Actor {
  public final int id;
  public final String name;
  /** Age in years, or null if not known. */
  public final @Nullable Integer age;

  /** Creates an Actor. */
  public Actor(int id, String name, @Nullable Integer age) {
    this.id = id;
    this.name = requireNonNull(name, "name");
    this.age = age;
  }

  /** Returns whether this actor's age is known. */
  public boolean hasAge() {
    return age != null;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, name, age);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Actor
            && id == ((Actor) o).id
            && name.equals(((Actor) o).name)
            && Objects.equals(age, ((Actor) o).age);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes "name(age)", or just "name" if the age is unknown. */
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(name);
    if (age != null) {
      buf.append('(').append(age).append(')');
    }
    return buf;
  }
}

// End Actor.java
