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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;
import net.hydromatic.moviedb.model.Actor;
import net.hydromatic.moviedb.model.Movie;
import net.hydromatic.moviedb.model.Table;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Holds the {@link Actor} and {@link Movie} rows of a catalog.
 *
 * <p>Each table assigns ids from its own counter, starting at 1. An id is
 * never reused, even after the row that had it is deleted.
 *
 * <p>When a row is deleted, every registered {@link Listener} is told, so
 * that rows referencing it can be removed too.
 */
public class EntityStore {
  private final IdTable<Actor> actors = new IdTable<>(Table.ACTORS);
  private final IdTable<Movie> movies = new IdTable<>(Table.MOVIES);
  private final List<Listener> listeners = new ArrayList<>();

  /** Registers a listener to be called after each delete. */
  public void addListener(Listener listener) {
    listeners.add(requireNonNull(listener));
  }

  /**
   * Inserts an actor and returns its id.
   *
   * @param name Name; required
   * @param age Age, or null if not known
   * @throws ValidationException if the name is null or empty
   */
  public int insertActor(String name, @Nullable Integer age) {
    if (Strings.isNullOrEmpty(name)) {
      throw new ValidationException(Table.ACTORS, "name");
    }
    return actors.insert(id -> new Actor(id, name, age));
  }

  /**
   * Inserts a movie and returns its id.
   *
   * @param title Title; required
   * @param releaseYear Year of release, or null if not known
   * @throws ValidationException if the title is null or empty
   */
  public int insertMovie(String title, @Nullable Integer releaseYear) {
    if (Strings.isNullOrEmpty(title)) {
      throw new ValidationException(Table.MOVIES, "title");
    }
    return movies.insert(id -> new Movie(id, title, releaseYear));
  }

  /** Returns the actor with a given id; throws if there is none. */
  public Actor getActor(int id) {
    return actors.get(id);
  }

  /** Returns the movie with a given id; throws if there is none. */
  public Movie getMovie(int id) {
    return movies.get(id);
  }

  public boolean containsActor(int id) {
    return actors.rows.containsKey(id);
  }

  public boolean containsMovie(int id) {
    return movies.rows.containsKey(id);
  }

  /** Deletes an actor, and returns the row that was removed. */
  public Actor deleteActor(int id) {
    final Actor actor = actors.delete(id);
    listeners.forEach(listener -> listener.onDelete(Table.ACTORS, id));
    return actor;
  }

  /** Deletes a movie, and returns the row that was removed. */
  public Movie deleteMovie(int id) {
    final Movie movie = movies.delete(id);
    listeners.forEach(listener -> listener.onDelete(Table.MOVIES, id));
    return movie;
  }

  /** Returns a snapshot of all actors, in insertion order. */
  public ImmutableList<Actor> listActors() {
    return ImmutableList.copyOf(actors.rows.values());
  }

  /** Returns a snapshot of all movies, in insertion order. */
  public ImmutableList<Movie> listMovies() {
    return ImmutableList.copyOf(movies.rows.values());
  }

  public int actorCount() {
    return actors.rows.size();
  }

  public int movieCount() {
    return movies.rows.size();
  }

  /** Callback invoked after a row has been deleted from the store. */
  public interface Listener {
    void onDelete(Table table, int id);
  }

  /** Rows of one table, keyed by id, in insertion order. */
  private static class IdTable<E> {
    final Table table;
    final Map<Integer, E> rows = new LinkedHashMap<>();
    /** Id to be assigned to the next row; never decreases. */
    int nextId = 1;

    IdTable(Table table) {
      this.table = table;
    }

    int insert(IntFunction<E> factory) {
      final int id = nextId++;
      rows.put(id, factory.apply(id));
      return id;
    }

    E get(int id) {
      final E e = rows.get(id);
      if (e == null) {
        throw new NotFoundException(table, id);
      }
      return e;
    }

    E delete(int id) {
      final E e = rows.remove(id);
      if (e == null) {
        throw new NotFoundException(table, id);
      }
      return e;
    }
  }
}

// End EntityStore.java
