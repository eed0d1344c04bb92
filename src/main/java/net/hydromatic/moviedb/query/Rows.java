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
package net.hydromatic.moviedb.query;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.moviedb.model.Actor;
import net.hydromatic.moviedb.model.Movie;
import net.hydromatic.moviedb.model.Table;

/** Rows returned by {@link QueryEngine} operations that aggregate. */
public abstract class Rows {
  private Rows() {}

  /** An actor and a count of movies. */
  public static final class ActorCount {
    public final Actor actor;
    public final int count;

    public ActorCount(Actor actor, int count) {
      this.actor = requireNonNull(actor);
      this.count = count;
    }

    @Override
    public int hashCode() {
      return Objects.hash(actor, count);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ActorCount
              && actor.equals(((ActorCount) o).actor)
              && count == ((ActorCount) o).count;
    }

    @Override
    public String toString() {
      return actor.name + ": " + count;
    }
  }

  /** A movie and a count of actors. */
  public static final class MovieCount {
    public final Movie movie;
    public final int count;

    public MovieCount(Movie movie, int count) {
      this.movie = requireNonNull(movie);
      this.count = count;
    }

    @Override
    public int hashCode() {
      return Objects.hash(movie, count);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof MovieCount
              && movie.equals(((MovieCount) o).movie)
              && count == ((MovieCount) o).count;
    }

    @Override
    public String toString() {
      return movie.title + ": " + count;
    }
  }

  /** A movie and the names of its actors. */
  public static final class MovieCast {
    public final Movie movie;
    /** Names of the actors, in the order they were linked to the movie. */
    public final ImmutableList<String> names;
    /** The names, joined with the cast separator. */
    public final String cast;

    public MovieCast(Movie movie, List<String> names, String cast) {
      this.movie = requireNonNull(movie);
      this.names = ImmutableList.copyOf(names);
      this.cast = requireNonNull(cast);
    }

    @Override
    public int hashCode() {
      return Objects.hash(movie, names, cast);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof MovieCast
              && movie.equals(((MovieCast) o).movie)
              && names.equals(((MovieCast) o).names)
              && cast.equals(((MovieCast) o).cast);
    }

    @Override
    public String toString() {
      return movie + ": " + cast;
    }
  }

  /** The movies released in one decade. */
  public static final class Decade {
    /** First year of the decade, e.g. 1990. */
    public final int decade;
    /** Label, e.g. "1990s". */
    public final String label;
    public final ImmutableList<Movie> movies;
    /** Titles of the movies, joined with the cast separator. */
    public final String titles;

    public Decade(int decade, String label, List<Movie> movies, String titles) {
      this.decade = decade;
      this.label = requireNonNull(label);
      this.movies = ImmutableList.copyOf(movies);
      this.titles = requireNonNull(titles);
    }

    /** Returns the number of movies. */
    public int count() {
      return movies.size();
    }

    @Override
    public int hashCode() {
      return Objects.hash(decade, label, movies, titles);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Decade
              && decade == ((Decade) o).decade
              && label.equals(((Decade) o).label)
              && movies.equals(((Decade) o).movies)
              && titles.equals(((Decade) o).titles);
    }

    @Override
    public String toString() {
      return label + " (" + count() + "): " + titles;
    }
  }

  /** A table and the number of rows it holds. */
  public static final class TableSummary {
    public final Table table;
    public final int rowCount;

    public TableSummary(Table table, int rowCount) {
      this.table = requireNonNull(table);
      this.rowCount = rowCount;
    }

    @Override
    public int hashCode() {
      return Objects.hash(table, rowCount);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TableSummary
              && table == ((TableSummary) o).table
              && rowCount == ((TableSummary) o).rowCount;
    }

    @Override
    public String toString() {
      return table + ": " + rowCount;
    }
  }
}

// End Rows.java
