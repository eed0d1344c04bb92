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

import static java.util.Objects.requireNonNull;

import java.io.PrintWriter;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.moviedb.model.Role;
import net.hydromatic.moviedb.model.Table;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes a line to a writer for every event. */
  public static Tracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /**
   * Returns a tracer that performs the given action on each insert, then calls
   * the underlying tracer.
   */
  public static Tracer withOnInsert(
      Tracer tracer, BiConsumer<Table, Integer> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInsert(Table table, int id) {
        consumer.accept(table, id);
        super.onInsert(table, id);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the roles removed by
   * each delete, then calls the underlying tracer.
   */
  public static Tracer withOnDelete(
      Tracer tracer, Consumer<List<Role>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDelete(Table table, int id, List<Role> cascaded) {
        consumer.accept(cascaded);
        super.onDelete(table, id, cascaded);
      }
    };
  }

  public static Tracer withOnLink(Tracer tracer, Consumer<Role> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onLink(Role role) {
        consumer.accept(role);
        super.onLink(role);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the name of each
   * query, then calls the underlying tracer.
   */
  public static Tracer withOnQuery(Tracer tracer, Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onQuery(String name, @Nullable Object result) {
        consumer.accept(name);
        super.onQuery(name, result);
      }
    };
  }

  public static Tracer withOnException(
      Tracer tracer, Consumer<RuntimeException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean onException(RuntimeException e) {
        consumer.accept(e);
        super.onException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onInsert(Table table, int id) {}

    @Override
    public void onDelete(Table table, int id, List<Role> cascaded) {}

    @Override
    public void onLink(Role role) {}

    @Override
    public void onQuery(String name, @Nullable Object result) {}

    @Override
    public boolean onException(RuntimeException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onInsert(Table table, int id) {
      tracer.onInsert(table, id);
    }

    @Override
    public void onDelete(Table table, int id, List<Role> cascaded) {
      tracer.onDelete(table, id, cascaded);
    }

    @Override
    public void onLink(Role role) {
      tracer.onLink(role);
    }

    @Override
    public void onQuery(String name, @Nullable Object result) {
      tracer.onQuery(name, result);
    }

    @Override
    public boolean onException(RuntimeException e) {
      return tracer.onException(e);
    }
  }

  /** Tracer that writes each event to a {@link PrintWriter}. */
  private static class PrintTracer implements Tracer {
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    @Override
    public void onInsert(Table table, int id) {
      w.println("insert " + table + " " + id);
      w.flush();
    }

    @Override
    public void onDelete(Table table, int id, List<Role> cascaded) {
      w.println("delete " + table + " " + id + " cascade " + cascaded);
      w.flush();
    }

    @Override
    public void onLink(Role role) {
      w.println("link " + role);
      w.flush();
    }

    @Override
    public void onQuery(String name, @Nullable Object result) {
      w.println("query " + name + " " + result);
      w.flush();
    }

    @Override
    public boolean onException(RuntimeException e) {
      final StringBuilder buf = new StringBuilder("error ");
      if (e instanceof CatalogException) {
        ((CatalogException) e).describeTo(buf);
      } else {
        buf.append(e);
      }
      w.println(buf);
      w.flush();
      return true;
    }
  }
}

// End Tracers.java
