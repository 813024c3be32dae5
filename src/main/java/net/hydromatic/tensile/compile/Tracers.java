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
package net.hydromatic.tensile.compile;

import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.tensile.ast.Expr;
import net.hydromatic.tensile.cfg.ProgramPoint;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each finished
   * tree, then calls the underlying tracer. */
  public static Tracer withOnTree(Tracer tracer,
      Consumer<Expr.Assign> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTree(Expr.Assign tree) {
        consumer.accept(tree);
        super.onTree(tree);
      }
    };
  }

  /** Returns a tracer that performs the given action on the control flow
   * of a kernel, then calls the underlying tracer. */
  public static Tracer withOnCfg(Tracer tracer,
      Consumer<List<ProgramPoint>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCfg(List<ProgramPoint> cfg) {
        consumer.accept(cfg);
        super.onCfg(cfg);
      }
    };
  }

  /** Tracer that does nothing. */
  private enum EmptyTracer implements Tracer {
    INSTANCE;

    @Override
    public void onTree(Expr.Assign tree) {}

    @Override
    public void onCfg(List<ProgramPoint> cfg) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    private final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onTree(Expr.Assign tree) {
      tracer.onTree(tree);
    }

    @Override
    public void onCfg(List<ProgramPoint> cfg) {
      tracer.onCfg(cfg);
    }
  }
}

// End Tracers.java
