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
package net.hydromatic.moviedb;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import net.hydromatic.moviedb.model.Actor;
import net.hydromatic.moviedb.model.Movie;
import net.hydromatic.moviedb.model.Role;
import net.hydromatic.moviedb.model.Table;
import net.hydromatic.moviedb.query.QueryEngine;
import net.hydromatic.moviedb.query.Rows;
import net.hydromatic.moviedb.store.DuplicateException;
import net.hydromatic.moviedb.store.EntityStore;
import net.hydromatic.moviedb.store.NotFoundException;
import net.hydromatic.moviedb.store.RelationIndex;
import net.hydromatic.moviedb.store.ValidationException;
import net.hydromatic.moviedb.util.Prop;
import net.hydromatic.moviedb.util.Tracer;
import net.hydromatic.moviedb.util.Tracers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A catalog of movies, actors, and the roles that link them.
 *
 * <p>A catalog starts empty. Populate it with the insert and link methods, or
 * with a {@link BuiltInDataSet}, then read it with the query methods.
 *
 * <p>Each method holds the catalog's lock until it returns, so a catalog may
 * be shared between threads. A modifying method either has its full effect,
 * including removing the roles of a deleted row, or throws and has no effect.
 *
 * <p>The {@link Tracer} is told of a modification after it has been applied.
 * If the tracer throws, the exception reaches the caller but the modification
 * stays in place, and {@link Tracer#onException} is not called.
 */
public class Catalog {
  private final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;
  private final @Nullable ReentrantLock lock;
  private final EntityStore store = new EntityStore();
  private final RelationIndex relations = RelationIndex.create(store);
  private final QueryEngine queries;

  private Catalog(Map<Prop, Object> propMap, Tracer tracer) {
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer, "tracer");
    this.lock =
        Prop.LOCKING.booleanValue(this.propMap) ? new ReentrantLock() : null;
    this.queries = new QueryEngine(store, relations, this.propMap);
  }

  /** Creates an empty catalog with default properties. */
  public static Catalog create() {
    return create(ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Creates an empty catalog.
   *
   * @param propMap Property values; copied, so later changes to the map have
   *     no effect on the catalog
   * @param tracer Receives an event for each operation
   */
  public static Catalog create(Map<Prop, Object> propMap, Tracer tracer) {
    return new Catalog(propMap, tracer);
  }

  /** Returns the value of a property. */
  public Object get(Prop prop) {
    return prop.get(propMap);
  }

  private <T> T locked(Supplier<T> action) {
    if (lock == null) {
      return action.get();
    }
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Runs a modifying action, reporting any exception to the tracer. If the
   * action succeeds, passes its result to {@code event}.
   */
  private <T> T modify(Supplier<T> action, Consumer<T> event) {
    return locked(
        () -> {
          final T result;
          try {
            result = action.get();
          } catch (RuntimeException e) {
            tracer.onException(e);
            throw e;
          }
          event.accept(result);
          return result;
        });
  }

  /** Runs a query, reporting its result to the tracer. */
  private <T> T query(String name, Supplier<T> action) {
    return locked(
        () -> {
          final T result = action.get();
          tracer.onQuery(name, result);
          return result;
        });
  }

  // Modifying operations

  /**
   * Inserts an actor and returns its id.
   *
   * @throws ValidationException if {@code name} is null or empty
   */
  public int insertActor(String name, @Nullable Integer age) {
    return modify(
        () -> store.insertActor(name, age),
        id -> tracer.onInsert(Table.ACTORS, id));
  }

  /**
   * Inserts a movie and returns its id.
   *
   * @throws ValidationException if {@code title} is null or empty
   */
  public int insertMovie(String title, @Nullable Integer releaseYear) {
    return modify(
        () -> store.insertMovie(title, releaseYear),
        id -> tracer.onInsert(Table.MOVIES, id));
  }

  /**
   * Deletes an actor and every role that references it.
   *
   * @throws NotFoundException if there is no actor with this id
   */
  public Actor deleteActor(int id) {
    final List<Role> cascaded = new ArrayList<>();
    return modify(
        () -> {
          cascaded.addAll(relations.roles(null, id));
          return store.deleteActor(id);
        },
        actor -> tracer.onDelete(Table.ACTORS, id, cascaded));
  }

  /**
   * Deletes a movie and every role that references it.
   *
   * @throws NotFoundException if there is no movie with this id
   */
  public Movie deleteMovie(int id) {
    final List<Role> cascaded = new ArrayList<>();
    return modify(
        () -> {
          cascaded.addAll(relations.roles(id, null));
          return store.deleteMovie(id);
        },
        movie -> tracer.onDelete(Table.MOVIES, id, cascaded));
  }

  /**
   * Links a movie to an actor.
   *
   * @throws NotFoundException if the movie or actor does not exist
   * @throws DuplicateException if they are already linked
   */
  public Role link(int movieId, int actorId) {
    return modify(() -> relations.link(movieId, actorId), tracer::onLink);
  }

  // Lookups

  /**
   * Returns the actor with a given id.
   *
   * @throws NotFoundException if there is no such actor
   */
  public Actor getActor(int id) {
    return locked(() -> store.getActor(id));
  }

  /**
   * Returns the movie with a given id.
   *
   * @throws NotFoundException if there is no such movie
   */
  public Movie getMovie(int id) {
    return locked(() -> store.getMovie(id));
  }

  /** Returns the ids of the actors in a movie, in link order. */
  public ImmutableSet<Integer> actorIdsOf(int movieId) {
    return locked(() -> relations.actorsOf(movieId));
  }

  /** Returns the ids of the movies an actor is in, in link order. */
  public ImmutableSet<Integer> movieIdsOf(int actorId) {
    return locked(() -> relations.moviesOf(actorId));
  }

  /** Returns all roles, in link order. */
  public ImmutableList<Role> roles() {
    return locked(relations::roles);
  }

  // Queries; see QueryEngine for the contract of each

  public ImmutableList<Actor> listActors() {
    return query("listActors", queries::listActors);
  }

  public ImmutableList<Movie> listMovies() {
    return query("listMovies", queries::listMovies);
  }

  public ImmutableList<Actor> castOf(String movieTitle) {
    return query("castOf", () -> queries.castOf(movieTitle));
  }

  public ImmutableList<Movie> moviesOf(String actorName) {
    return query("moviesOf", () -> queries.moviesOf(actorName));
  }

  public ImmutableList<Movie> moviesInYear(int year) {
    return query("moviesInYear", () -> queries.moviesInYear(year));
  }

  public ImmutableList<Actor> actorsYoungerThan(int maxAge) {
    return query("actorsYoungerThan", () -> queries.actorsYoungerThan(maxAge));
  }

  public ImmutableList<Rows.ActorCount> movieCountPerActor() {
    return query("movieCountPerActor", queries::movieCountPerActor);
  }

  public @Nullable Actor oldestActor() {
    return query("oldestActor", queries::oldestActor);
  }

  public ImmutableList<Movie> moviesFrom(int year) {
    return query("moviesFrom", () -> queries.moviesFrom(year));
  }

  public ImmutableList<Rows.MovieCast> movieCasts() {
    return query("movieCasts", queries::movieCasts);
  }

  public ImmutableList<Rows.MovieCount> moviesWithMultipleActors() {
    return query("moviesWithMultipleActors", queries::moviesWithMultipleActors);
  }

  public @Nullable BigDecimal averageActorAge() {
    return query("averageActorAge", queries::averageActorAge);
  }

  public ImmutableList<Rows.Decade> moviesByDecade() {
    return query("moviesByDecade", queries::moviesByDecade);
  }

  public ImmutableList<Rows.ActorCount> actorsInMultipleMovies() {
    return query("actorsInMultipleMovies", queries::actorsInMultipleMovies);
  }

  public @Nullable Movie mostRecentMovie() {
    return query("mostRecentMovie", queries::mostRecentMovie);
  }

  public ImmutableList<Rows.TableSummary> tables() {
    return query("tables", queries::tables);
  }

  public String databaseName() {
    return query("databaseName", queries::databaseName);
  }
}

// End Catalog.java
