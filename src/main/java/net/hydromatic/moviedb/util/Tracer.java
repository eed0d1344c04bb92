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
package net.hydromatic.moviedb.util;

import java.util.List;
import net.hydromatic.moviedb.model.Role;
import net.hydromatic.moviedb.model.Table;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events while a catalog is read and modified. */
public interface Tracer {
  /** Called after a row has been inserted into {@code table}. */
  void onInsert(Table table, int id);

  /**
   * Called after a row has been deleted from {@code table}, with the roles
   * that were removed because they referenced it.
   */
  void onDelete(Table table, int id, List<Role> cascaded);

  /** Called after a movie and an actor have been linked. */
  void onLink(Role role);

  /** Called with the result of a query; null if the query found no row. */
  void onQuery(String name, @Nullable Object result);

  /**
   * Called with the exception thrown by a modifying operation, before it is
   * rethrown. Returns whether a handler was found.
   */
  boolean onException(RuntimeException e);
}

// End Tracer.java
