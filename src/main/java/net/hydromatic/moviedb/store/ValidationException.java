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

/** A required field was missing or empty when inserting a row. */
public class ValidationException extends RuntimeException
    implements CatalogException {
  public final Table table;
  public final String field;

  public ValidationException(Table table, String field) {
    super(field + " must not be empty");
    this.table = requireNonNull(table);
    this.field = requireNonNull(field);
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("invalid ")
        .append(table)
        .append(" row: ")
        .append(getMessage());
  }
}

// End ValidationException.java
