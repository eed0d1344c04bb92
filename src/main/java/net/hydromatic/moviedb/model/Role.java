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

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A row in the {@link Table#MOVIE_ACTORS} table: the fact that an actor
 * appears in a movie.
 *
 * <p>Both fields are ids, not references; a role is only valid while the
 * movie and the actor it names both exist.
 */
public final class Role {
  public final int movieId;
  public final int actorId;

  private Role(int movieId, int actorId) {
    this.movieId = movieId;
    this.actorId = actorId;
  }

  /** Creates a Role. */
  public static Role of(int movieId, int actorId) {
    return new Role(movieId, actorId);
  }

  /**
   * Returns whether this role references a given movie and actor. A null
   * argument matches any id.
   */
  public boolean matches(@Nullable Integer movieId, @Nullable Integer actorId) {
    return (movieId == null || this.movieId == movieId)
        && (actorId == null || this.actorId == actorId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(movieId, actorId);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Role
            && movieId == ((Role) o).movieId
            && actorId == ((Role) o).actorId;
  }

  @Override
  public String toString() {
    return "(" + movieId + ", " + actorId + ")";
  }
}

// End Role.java
