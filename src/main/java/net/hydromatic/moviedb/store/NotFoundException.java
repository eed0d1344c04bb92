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

import net.hydromatic.moviedb.model.Table;
import net.hydromatic.moviedb.util.CatalogException;

/** A row was referenced by an id that does not exist. */
public class NotFoundException extends RuntimeException
    implements CatalogException {
  public final Table table;
  public final int id;

  public NotFoundException(Table table, int id) {
    super("no row in " + table + " with id " + id);
    this.table = requireNonNull(table);
    this.id = id;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(getMessage());
  }
}

// End NotFoundException.java
