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

/** A row in the {@link Table#MOVIES} table. */
public final class Movie {
  public final int id;
  public final String title;
  /** Year of release, or null if not known. */
  public final @Nullable Integer releaseYear;

  /** Creates a Movie. */
  public Movie(int id, String title, @Nullable Integer releaseYear) {
    this.id = id;
    this.title = requireNonNull(title, "title");
    this.releaseYear = releaseYear;
  }

  /** Returns whether this movie's release year is known. */
  public boolean hasReleaseYear() {
    return releaseYear != null;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, title, releaseYear);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Movie
            && id == ((Movie) o).id
            && title.equals(((Movie) o).title)
            && Objects.equals(releaseYear, ((Movie) o).releaseYear);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(title);
    if (releaseYear != null) {
      buf.append('(').append(releaseYear).append(')');
    }
    return buf;
  }
}

// End Movie.java
