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

import static net.hydromatic.moviedb.Matchers.equalsUnordered;
import static net.hydromatic.moviedb.Matchers.hasNames;
import static net.hydromatic.moviedb.Matchers.hasTitles;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import net.hydromatic.moviedb.model.Actor;
import net.hydromatic.moviedb.model.Movie;
import net.hydromatic.moviedb.model.Role;
import net.hydromatic.moviedb.query.Rows;
import net.hydromatic.moviedb.store.DuplicateException;
import net.hydromatic.moviedb.store.NotFoundException;
import net.hydromatic.moviedb.store.ValidationException;
import net.hydromatic.moviedb.util.Prop;
import net.hydromatic.moviedb.util.Tracer;
import net.hydromatic.moviedb.util.Tracers;
import org.junit.jupiter.api.Test;

/** Tests for {@link Catalog}, mostly over {@link BuiltInDataSet#MOVIES}. */
class CatalogTest {
  @Test
  void testSeedQueries() {
    final Catalog catalog = BuiltInDataSet.MOVIES.catalog();
    assertThat(
        catalog.moviesInYear(1994),
        hasTitles("Forrest Gump", "The Shawshank Redemption"));
    assertThat(
        catalog.castOf("Avengers: Endgame"),
        equalsUnordered(catalog.getActor(4), catalog.getActor(5)));
    assertThat(
        titles(catalog.moviesOf("Meryl Streep")),
        equalsUnordered("Forrest Gump", "The Devil Wears Prada"));
    assertThat(
        catalog.actorsYoungerThan(50),
        hasNames("Leonardo DiCaprio", "Scarlett Johansson"));
    assertThat(catalog.averageActorAge(), is(new BigDecimal("57.4")));
    assertThat(
        catalog.moviesWithMultipleActors().toString(),
        is("[Forrest Gump: 2, Avengers: Endgame: 2]"));
    assertThat(catalog.oldestActor().name, is("Meryl Streep"));
    assertThat(catalog.mostRecentMovie().title, is("Avengers: Endgame"));
    assertThat(catalog.moviesFrom(2000), hasSize(2));
    assertThat(catalog.movieCasts(), hasSize(4));
    assertThat(catalog.moviesByDecade(), hasSize(3));
    assertThat(
        catalog.actorsInMultipleMovies().toString(), is("[Meryl Streep: 2]"));
    assertThat(
        catalog.tables().toString(),
        is("[Actors: 5, Movies: 5, Movie_Actors: 6]"));
    assertThat(catalog.databaseName(), is("MovieDB"));
  }

  @Test
  void testMovieCountPerActorCoversEveryActor() {
    final Catalog catalog = BuiltInDataSet.MOVIES.catalog();
    final List<Rows.ActorCount> counts = catalog.movieCountPerActor();
    assertThat(counts, hasSize(catalog.listActors().size()));
    final Set<Integer> ids = new HashSet<>();
    int total = 0;
    for (Rows.ActorCount count : counts) {
      assertThat(ids.add(count.actor.id), is(true));
      total += count.count;
    }
    assertThat(total, is(catalog.roles().size()));
  }

  @Test
  void testListIsIdempotent() {
    final Catalog catalog = BuiltInDataSet.MOVIES.catalog();
    final List<Actor> actors = catalog.listActors();
    final List<Movie> movies = catalog.listMovies();
    assertThat(catalog.listActors(), is(actors));
    assertThat(catalog.listMovies(), is(movies));
  }

  @Test
  void testInsertThenGet() {
    final Catalog catalog = Catalog.create();
    final int id = catalog.insertActor("Someone", null);
    assertThat(catalog.getActor(id), is(new Actor(id, "Someone", null)));
    final int id2 = catalog.insertMovie("Something", 2024);
    assertThat(catalog.getMovie(id2), is(new Movie(id2, "Something", 2024)));

    catalog.deleteActor(id);
    assertThat(catalog.insertActor("Someone Else", 40), is(id + 1));
  }

  @Test
  void testDeleteMovieCascades() {
    final Catalog catalog = BuiltInDataSet.MOVIES.catalog();
    final Movie endgame = catalog.deleteMovie(4);
    assertThat(endgame.title, is("Avengers: Endgame"));
    assertThat(catalog.castOf("Avengers: Endgame"), empty());
    assertThat(catalog.actorIdsOf(4), empty());
    assertThat(catalog.movieIdsOf(4), empty());
    assertThat(catalog.movieIdsOf(5), empty());
    assertThat(catalog.roles(), hasSize(4));
    assertThrows(NotFoundException.class, () -> catalog.getMovie(4));
    assertThrows(NotFoundException.class, () -> catalog.link(4, 4));
  }

  @Test
  void testDeleteActorCascades() {
    final Catalog catalog = BuiltInDataSet.MOVIES.catalog();
    catalog.deleteActor(2);
    assertThat(catalog.moviesOf("Meryl Streep"), empty());
    assertThat(catalog.castOf("Forrest Gump"), hasNames("Tom Hanks"));
    assertThat(catalog.movieCasts(), hasSize(3));
    assertThat(catalog.movieIdsOf(2), empty());
  }

  @Test
  void testLinkIsSymmetric() {
    final Catalog catalog = BuiltInDataSet.MOVIES.catalog();
    final Role role = catalog.link(5, 1);
    assertThat(catalog.actorIdsOf(5), contains(1));
    assertThat(catalog.movieIdsOf(1), contains(1, 5));
    assertThat(catalog.roles().get(6), is(role));
  }

  /** A failed operation leaves the catalog as it was. */
  @Test
  void testFailuresHaveNoEffect() {
    final Catalog catalog = BuiltInDataSet.MOVIES.catalog();
    final List<Role> roles = catalog.roles();
    final List<Actor> actors = catalog.listActors();
    final List<Movie> movies = catalog.listMovies();

    final DuplicateException e =
        assertThrows(DuplicateException.class, () -> catalog.link(1, 2));
    assertThat(e.role, is(Role.of(1, 2)));
    assertThrows(NotFoundException.class, () -> catalog.link(1, 6));
    assertThrows(NotFoundException.class, () -> catalog.link(6, 1));
    assertThrows(NotFoundException.class, () -> catalog.deleteActor(6));
    assertThrows(NotFoundException.class, () -> catalog.deleteMovie(0));
    assertThrows(ValidationException.class, () -> catalog.insertActor("", 1));
    assertThrows(
        ValidationException.class, () -> catalog.insertMovie("", 2000));

    assertThat(catalog.roles(), is(roles));
    assertThat(catalog.listActors(), is(actors));
    assertThat(catalog.listMovies(), is(movies));
    assertThat(catalog.insertActor("Next", null), is(6));
  }

  @Test
  void testTracer() {
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer =
        Tracers.withOnInsert(
            tracer, (table, id) -> events.add("insert " + table + " " + id));
    tracer =
        Tracers.withOnDelete(tracer, roles -> events.add("cascade " + roles));
    tracer = Tracers.withOnLink(tracer, role -> events.add("link " + role));
    tracer = Tracers.withOnQuery(tracer, name -> events.add("query " + name));
    tracer =
        Tracers.withOnException(
            tracer, e -> events.add("error " + e.getClass().getSimpleName()));
    final Catalog catalog = Catalog.create(ImmutableMap.of(), tracer);

    final int actor = catalog.insertActor("a", 1);
    final int movie = catalog.insertMovie("m", 2000);
    catalog.link(movie, actor);
    assertThrows(DuplicateException.class, () -> catalog.link(movie, actor));
    catalog.listActors();
    catalog.deleteMovie(movie);
    assertThrows(NotFoundException.class, () -> catalog.deleteMovie(movie));
    catalog.oldestActor();
    assertThat(
        events,
        contains(
            "insert Actors 1",
            "insert Movies 1",
            "link (1, 1)",
            "error DuplicateException",
            "query listActors",
            "cascade [(1, 1)]",
            "error NotFoundException",
            "query oldestActor"));
  }

  /** A tracer that throws on insert does not undo the insert. */
  @Test
  void testThrowingTracer() {
    final List<String> errors = new ArrayList<>();
    Tracer tracer =
        Tracers.withOnInsert(
            Tracers.empty(),
            (table, id) -> {
              throw new IllegalStateException("insert " + table + " " + id);
            });
    tracer =
        Tracers.withOnException(
            tracer, e -> errors.add(e.getClass().getSimpleName()));
    final Catalog catalog = Catalog.create(ImmutableMap.of(), tracer);

    final IllegalStateException e =
        assertThrows(
            IllegalStateException.class, () -> catalog.insertActor("X", 1));
    assertThat(e.getMessage(), is("insert Actors 1"));
    assertThat(catalog.listActors(), hasNames("X"));
    assertThat(errors, empty());

    // A modification that fails is reported, and the tracer's insert event
    // does not fire.
    assertThrows(ValidationException.class, () -> catalog.insertActor("", 1));
    assertThat(errors, contains("ValidationException"));
    assertThat(catalog.listActors(), hasSize(1));
  }

  /** A tracer that throws on delete does not undo the cascade. */
  @Test
  void testThrowingDeleteTracer() {
    final Catalog catalog =
        Catalog.create(
            ImmutableMap.of(),
            Tracers.withOnDelete(
                Tracers.empty(),
                roles -> {
                  throw new IllegalStateException("cascade " + roles);
                }));
    final int actor = catalog.insertActor("a", 1);
    final int movie = catalog.insertMovie("m", 2000);
    catalog.link(movie, actor);

    final IllegalStateException e =
        assertThrows(
            IllegalStateException.class, () -> catalog.deleteMovie(movie));
    assertThat(e.getMessage(), is("cascade [(1, 1)]"));
    assertThat(catalog.listMovies(), empty());
    assertThat(catalog.roles(), empty());
    assertThat(catalog.listActors(), hasNames("a"));
  }

  @Test
  void testProperties() {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    Prop.DATABASE_NAME.set(propMap, "Films");
    Prop.lookup("castSeparator").set(propMap, " / ");
    Prop.lookup("DECADE_SUFFIX").set(propMap, "");
    Prop.LOCKING.set(propMap, false);
    final Catalog catalog = Catalog.create(propMap, Tracers.empty());

    // The catalog took a copy of the map.
    propMap.clear();

    BuiltInDataSet.MOVIES.populate(catalog);
    assertThat(catalog.get(Prop.LOCKING), is((Object) false));
    assertThat(catalog.get(Prop.AVERAGE_SCALE), is((Object) 1));
    assertThat(catalog.databaseName(), is("Films"));
    assertThat(
        catalog.movieCasts().get(0).cast, is("Tom Hanks / Meryl Streep"));
    assertThat(catalog.moviesByDecade().get(1).label, is("2000"));
  }

  @Test
  void testDataSets() {
    assertThat(
        BuiltInDataSet.DICTIONARY.get("movies"),
        sameInstance(BuiltInDataSet.MOVIES));
    final Catalog catalog = BuiltInDataSet.DICTIONARY.get("empty").catalog();
    assertThat(catalog.listActors(), empty());
    assertThat(catalog.oldestActor() == null, is(true));
    assertThat(catalog.averageActorAge() == null, is(true));
    assertThat(catalog.moviesByDecade(), empty());
  }

  /** Inserts from several threads at once get distinct ids. */
  @Test
  void testConcurrentInserts() throws Exception {
    final Catalog catalog = Catalog.create();
    final int threadCount = 4;
    final int perThread = 250;
    final ExecutorService executor = Executors.newFixedThreadPool(threadCount);
    try {
      final List<Future<List<Integer>>> futures = new ArrayList<>();
      for (int t = 0; t < threadCount; t++) {
        final int thread = t;
        futures.add(
            executor.submit(
                () -> {
                  final List<Integer> ids = new ArrayList<>();
                  for (int i = 0; i < perThread; i++) {
                    final String name = "actor " + thread + "." + i;
                    ids.add(catalog.insertActor(name, i));
                  }
                  return ids;
                }));
      }
      final Set<Integer> ids = new HashSet<>();
      for (Future<List<Integer>> future : futures) {
        ids.addAll(future.get(30, TimeUnit.SECONDS));
      }
      assertThat(ids, hasSize(threadCount * perThread));
    } finally {
      executor.shutdownNow();
    }
    assertThat(catalog.listActors(), hasSize(threadCount * perThread));
    assertThat(
        catalog.tables().get(0).rowCount, is(threadCount * perThread));
  }

  private static List<String> titles(List<Movie> movies) {
    return movies.stream().map(m -> m.title).collect(Collectors.toList());
  }
}

// End CatalogTest.java
