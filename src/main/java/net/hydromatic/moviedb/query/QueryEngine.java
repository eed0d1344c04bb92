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
import static net.hydromatic.moviedb.util.Static.filterEager;
import static net.hydromatic.moviedb.util.Static.firstMax;
import static net.hydromatic.moviedb.util.Static.transformEager;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.Ordering;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.moviedb.model.Actor;
import net.hydromatic.moviedb.model.Movie;
import net.hydromatic.moviedb.model.Table;
import net.hydromatic.moviedb.store.EntityStore;
import net.hydromatic.moviedb.store.RelationIndex;
import net.hydromatic.moviedb.util.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Answers the fixed set of queries over a catalog.
 *
 * <p>Every call computes its result from the current contents of the
 * {@link EntityStore} and {@link RelationIndex}; nothing is cached between
 * calls. Queries never fail because no rows match; they return an empty list,
 * a zero count, or null.
 *
 * <p>Where a query orders by a count or a year, rows that compare equal stay
 * in insertion order. Where a query returns the single row with the greatest
 * value, the first inserted wins a tie.
 */
public class QueryEngine {
  /** Rows are "multiple" if their count exceeds this. */
  private static final int MULTIPLE = 1;

  private static final Ordering<Rows.ActorCount> BY_COUNT_DESCENDING =
      Ordering.from(Comparator.comparingInt((Rows.ActorCount r) -> r.count))
          .reverse();

  private static final Ordering<Movie> BY_RELEASE_YEAR =
      Ordering.from(
          Comparator.comparingInt((Movie m) -> requireNonNull(m.releaseYear)));

  private final EntityStore store;
  private final RelationIndex relations;
  private final Map<Prop, Object> propMap;

  /** Creates a QueryEngine. */
  public QueryEngine(
      EntityStore store, RelationIndex relations, Map<Prop, Object> propMap) {
    this.store = requireNonNull(store);
    this.relations = requireNonNull(relations);
    this.propMap = requireNonNull(propMap);
  }

  /** Returns all actors, in insertion order. */
  public ImmutableList<Actor> listActors() {
    return store.listActors();
  }

  /** Returns all movies, in insertion order. */
  public ImmutableList<Movie> listMovies() {
    return store.listMovies();
  }

  /**
   * Returns the actors in the movies with a given title.
   *
   * <p>There is one row per role: movies in insertion order, and within each
   * movie, actors in the order they were linked.
   */
  public ImmutableList<Actor> castOf(String movieTitle) {
    final ImmutableList.Builder<Actor> b = ImmutableList.builder();
    for (Movie movie : store.listMovies()) {
      if (movie.title.equals(movieTitle)) {
        for (int actorId : relations.actorsOf(movie.id)) {
          b.add(store.getActor(actorId));
        }
      }
    }
    return b.build();
  }

  /**
   * Returns the movies of the actors with a given name. There is one row per
   * role.
   */
  public ImmutableList<Movie> moviesOf(String actorName) {
    final ImmutableList.Builder<Movie> b = ImmutableList.builder();
    for (Actor actor : store.listActors()) {
      if (actor.name.equals(actorName)) {
        for (int movieId : relations.moviesOf(actor.id)) {
          b.add(store.getMovie(movieId));
        }
      }
    }
    return b.build();
  }

  /** Returns the movies released in a given year. */
  public ImmutableList<Movie> moviesInYear(int year) {
    return filterEager(
        store.listMovies(),
        m -> m.hasReleaseYear() && m.releaseYear == year);
  }

  /**
   * Returns the actors whose age is less than {@code maxAge}. Actors whose age
   * is not known are not returned.
   */
  public ImmutableList<Actor> actorsYoungerThan(int maxAge) {
    return filterEager(
        store.listActors(), a -> a.hasAge() && a.age < maxAge);
  }

  /**
   * Returns every actor with the number of movies they are in, including
   * actors in no movies, by descending count.
   */
  public ImmutableList<Rows.ActorCount> movieCountPerActor() {
    return BY_COUNT_DESCENDING.immutableSortedCopy(movieCounts());
  }

  private ImmutableList<Rows.ActorCount> movieCounts() {
    return transformEager(
        store.listActors(),
        a -> new Rows.ActorCount(a, relations.moviesOf(a.id).size()));
  }

  /**
   * Returns the oldest actor, or null if no actor's age is known. If several
   * actors share the greatest age, returns the first inserted.
   */
  public @Nullable Actor oldestActor() {
    return firstMax(store.listActors(), a -> a.age);
  }

  /** Returns the movies released in or after {@code year}, by year. */
  public ImmutableList<Movie> moviesFrom(int year) {
    return BY_RELEASE_YEAR.immutableSortedCopy(
        filterEager(
            store.listMovies(),
            m -> m.hasReleaseYear() && m.releaseYear >= year));
  }

  /**
   * Returns each movie with the names of its actors. Movies that have no
   * actors are not returned.
   */
  public ImmutableList<Rows.MovieCast> movieCasts() {
    final Joiner joiner = Joiner.on(Prop.CAST_SEPARATOR.stringValue(propMap));
    final ImmutableList.Builder<Rows.MovieCast> b = ImmutableList.builder();
    for (Movie movie : store.listMovies()) {
      final Set<Integer> actorIds = relations.actorsOf(movie.id);
      if (actorIds.isEmpty()) {
        continue;
      }
      final List<String> names =
          transformEager(actorIds, id -> store.getActor(id).name);
      b.add(new Rows.MovieCast(movie, names, joiner.join(names)));
    }
    return b.build();
  }

  /** Returns the movies that have more than one actor, with their count. */
  public ImmutableList<Rows.MovieCount> moviesWithMultipleActors() {
    final ImmutableList.Builder<Rows.MovieCount> b = ImmutableList.builder();
    for (Movie movie : store.listMovies()) {
      final int count = relations.actorsOf(movie.id).size();
      if (count > MULTIPLE) {
        b.add(new Rows.MovieCount(movie, count));
      }
    }
    return b.build();
  }

  /**
   * Returns the mean age of the actors whose age is known, rounded half away
   * from zero; or null if no actor's age is known.
   */
  public @Nullable BigDecimal averageActorAge() {
    long sum = 0;
    int count = 0;
    for (Actor actor : store.listActors()) {
      if (actor.hasAge()) {
        sum += actor.age;
        ++count;
      }
    }
    if (count == 0) {
      return null;
    }
    return BigDecimal.valueOf(sum)
        .divide(
            BigDecimal.valueOf(count),
            Prop.AVERAGE_SCALE.intValue(propMap),
            RoundingMode.HALF_UP);
  }

  /**
   * Groups the movies by the decade of their release, in ascending order of
   * decade. Movies whose year is not known are not returned.
   */
  public ImmutableList<Rows.Decade> moviesByDecade() {
    final ListMultimap<Integer, Movie> byDecade =
        MultimapBuilder.treeKeys().arrayListValues().build();
    for (Movie movie : store.listMovies()) {
      if (movie.hasReleaseYear()) {
        byDecade.put(decadeOf(movie.releaseYear), movie);
      }
    }
    final Joiner joiner = Joiner.on(Prop.CAST_SEPARATOR.stringValue(propMap));
    final String suffix = Prop.DECADE_SUFFIX.stringValue(propMap);
    final ImmutableList.Builder<Rows.Decade> b = ImmutableList.builder();
    byDecade
        .asMap()
        .forEach(
            (decade, movies) ->
                b.add(
                    new Rows.Decade(
                        decade,
                        decade + suffix,
                        ImmutableList.copyOf(movies),
                        joiner.join(transformEager(movies, m -> m.title)))));
    return b.build();
  }

  /**
   * Returns the first year of the decade that contains a given year. Division
   * truncates toward zero, so years -9 through 9 are all in decade 0.
   */
  static int decadeOf(int year) {
    return year / 10 * 10;
  }

  /**
   * Returns the actors who are in more than one movie, with their count, by
   * descending count.
   */
  public ImmutableList<Rows.ActorCount> actorsInMultipleMovies() {
    return BY_COUNT_DESCENDING.immutableSortedCopy(
        filterEager(movieCounts(), r -> r.count > MULTIPLE));
  }

  /**
   * Returns the most recently released movie, or null if no movie's year is
   * known. If several movies share the latest year, returns the first
   * inserted.
   */
  public @Nullable Movie mostRecentMovie() {
    return firstMax(store.listMovies(), m -> m.releaseYear);
  }

  /** Returns each table with its number of rows. */
  public ImmutableList<Rows.TableSummary> tables() {
    return ImmutableList.of(
        new Rows.TableSummary(Table.ACTORS, store.actorCount()),
        new Rows.TableSummary(Table.MOVIES, store.movieCount()),
        new Rows.TableSummary(Table.MOVIE_ACTORS, relations.size()));
  }

  /** Returns the name of the database. */
  public String databaseName() {
    return Prop.DATABASE_NAME.stringValue(propMap);
  }
}

// End QueryEngine.java
