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

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Data sets that can be loaded into a {@link Catalog}. */
public enum BuiltInDataSet {
  /** No rows. */
  EMPTY {
    @Override
    public Catalog populate(Catalog catalog) {
      return catalog;
    }
  },

  /**
   * Five actors, five movies and six roles.
   *
   * <p>Ids are assigned in the order below, so in an empty catalog actor 1 is
   * Tom Hanks and movie 1 is Forrest Gump. Meryl Streep is in two movies;
   * Forrest Gump and Avengers: Endgame each have two actors; The Shawshank
   * Redemption has none.
   */
  MOVIES {
    @Override
    public Catalog populate(Catalog catalog) {
      final int tomHanks = catalog.insertActor("Tom Hanks", 67);
      final int merylStreep = catalog.insertActor("Meryl Streep", 74);
      final int leonardoDiCaprio = catalog.insertActor("Leonardo DiCaprio", 49);
      final int scarlettJohansson =
          catalog.insertActor("Scarlett Johansson", 39);
      final int robertDowneyJr = catalog.insertActor("Robert Downey Jr.", 58);

      final int forrestGump = catalog.insertMovie("Forrest Gump", 1994);
      final int devilWearsPrada =
          catalog.insertMovie("The Devil Wears Prada", 2006);
      final int titanic = catalog.insertMovie("Titanic", 1997);
      final int endgame = catalog.insertMovie("Avengers: Endgame", 2019);
      catalog.insertMovie("The Shawshank Redemption", 1994);

      catalog.link(forrestGump, tomHanks);
      catalog.link(devilWearsPrada, merylStreep);
      catalog.link(titanic, leonardoDiCaprio);
      catalog.link(endgame, scarlettJohansson);
      catalog.link(endgame, robertDowneyJr);
      catalog.link(forrestGump, merylStreep);
      return catalog;
    }
  };

  /**
   * Map of all known data sets, keyed by lower-case name.
   *
   * <p>Contains "empty" and "movies".
   */
  public static final Map<String, BuiltInDataSet> DICTIONARY =
      Stream.of(BuiltInDataSet.values())
          .collect(
              Collectors.toMap(d -> d.name().toLowerCase(Locale.ROOT), d -> d));

  /** Adds this data set's rows to a catalog, and returns the catalog. */
  public abstract Catalog populate(Catalog catalog);

  /** Creates a catalog with default properties that contains this data set. */
  public Catalog catalog() {
    return populate(Catalog.create());
  }
}

// End BuiltInDataSet.java
