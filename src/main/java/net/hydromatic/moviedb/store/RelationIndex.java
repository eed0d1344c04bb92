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
package net.hydromatic.moviedb.store;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.moviedb.util.Static.filterEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import java.util.LinkedHashSet;
import java.util.Set;
import net.hydromatic.moviedb.model.Role;
import net.hydromatic.moviedb.model.Table;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Holds the {@link Role}s that link movies to actors.
 *
 * <p>Every role references a movie and an actor that exist in the
 * {@link EntityStore}. Links are checked against the store when they are
 * created, and the index removes the roles of a movie or actor as soon as the
 * store deletes it.
 *
 * <p>Roles are indexed in both directions; the two maps always hold the same
 * set of pairs, each in link order.
 */
public class RelationIndex {
  private final EntityStore store;
  private final Set<Role> roles = new LinkedHashSet<>();
  private final SetMultimap<Integer, Integer> actorsByMovie =
      LinkedHashMultimap.create();
  private final SetMultimap<Integer, Integer> moviesByActor =
      LinkedHashMultimap.create();

  private RelationIndex(EntityStore store) {
    this.store = requireNonNull(store);
  }

  /**
   * Creates a RelationIndex over a store, and registers it to remove roles
   * when the store deletes a movie or actor.
   */
  public static RelationIndex create(EntityStore store) {
    final RelationIndex index = new RelationIndex(store);
    store.addListener(index::cascade);
    return index;
  }

  private void cascade(Table table, int id) {
    switch (table) {
      case ACTORS:
        unlinkAll(null, id);
        break;
      case MOVIES:
        unlinkAll(id, null);
        break;
      default:
        throw new AssertionError("unexpected table " + table);
    }
  }

  /**
   * Links a movie to an actor.
   *
   * @throws NotFoundException if the movie or the actor does not exist
   * @throws DuplicateException if they are already linked
   */
  public Role link(int movieId, int actorId) {
    if (!store.containsMovie(movieId)) {
      throw new NotFoundException(Table.MOVIES, movieId);
    }
    if (!store.containsActor(actorId)) {
      throw new NotFoundException(Table.ACTORS, actorId);
    }
    final Role role = Role.of(movieId, actorId);
    if (!roles.add(role)) {
      throw new DuplicateException(role);
    }
    actorsByMovie.put(movieId, actorId);
    moviesByActor.put(actorId, movieId);
    return role;
  }

  /**
   * Removes every role that references a given movie and actor, and returns
   * the removed roles in link order.
   *
   * <p>A null id matches every movie (or actor); if both are null, all roles
   * are removed. Removing roles that do not exist is not an error.
   */
  public ImmutableList<Role> unlinkAll(
      @Nullable Integer movieId, @Nullable Integer actorId) {
    final ImmutableList<Role> removed = roles(movieId, actorId);
    for (Role role : removed) {
      roles.remove(role);
      actorsByMovie.remove(role.movieId, role.actorId);
      moviesByActor.remove(role.actorId, role.movieId);
    }
    return removed;
  }

  /**
   * Returns the roles that reference a given movie and actor, in link order.
   * A null id matches any.
   */
  public ImmutableList<Role> roles(
      @Nullable Integer movieId, @Nullable Integer actorId) {
    if (movieId != null && actorId != null) {
      final Role role = Role.of(movieId, actorId);
      return roles.contains(role) ? ImmutableList.of(role) : ImmutableList.of();
    }
    return filterEager(
        ImmutableList.copyOf(roles), role -> role.matches(movieId, actorId));
  }

  /** Returns all roles, in link order. */
  public ImmutableList<Role> roles() {
    return ImmutableList.copyOf(roles);
  }

  /** Returns the ids of the actors in a movie, in link order. */
  public ImmutableSet<Integer> actorsOf(int movieId) {
    return ImmutableSet.copyOf(actorsByMovie.get(movieId));
  }

  /** Returns the ids of the movies an actor is in, in link order. */
  public ImmutableSet<Integer> moviesOf(int actorId) {
    return ImmutableSet.copyOf(moviesByActor.get(actorId));
  }

  /** Returns whether a movie and an actor are linked. */
  public boolean contains(int movieId, int actorId) {
    return actorsByMovie.containsEntry(movieId, actorId);
  }

  /** Returns the number of roles. */
  public int size() {
    return roles.size();
  }
}

// End RelationIndex.java
