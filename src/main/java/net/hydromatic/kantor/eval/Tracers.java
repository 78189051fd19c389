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
package net.hydromatic.kantor.eval;

import net.hydromatic.kantor.ast.Ast;
import net.hydromatic.kantor.type.Binding;
import net.hydromatic.kantor.util.KantorException;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on a parsed program,
   * then calls the underlying tracer. */
  public static Tracer withOnParse(Tracer tracer,
      Consumer<Ast.Program> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onParse(Ast.Program program) {
        consumer.accept(program);
        super.onParse(program);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of
   * a declaration, then calls the underlying tracer. */
  public static Tracer withOnBinding(Tracer tracer,
      Consumer<Binding> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onBinding(Binding binding) {
        consumer.accept(binding);
        super.onBinding(binding);
      }
    };
  }

  /** Returns a tracer that performs the given action when a comprehension
   * skips an element, then calls the underlying tracer. */
  public static Tracer withOnSkip(Tracer tracer,
      BiConsumer<Ast.Comprehension, Value> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSkip(Ast.Comprehension comprehension,
          Value element) {
        consumer.accept(comprehension, element);
        super.onSkip(comprehension, element);
      }
    };
  }

  public static Tracer withOnException(Tracer tracer,
      Consumer<KantorException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean onException(KantorException e) {
        consumer.accept(e);
        super.onException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onParse(Ast.Program program) {
    }

    @Override public void onBinding(Binding binding) {
    }

    @Override public void onSkip(Ast.Comprehension comprehension,
        Value element) {
    }

    @Override public boolean onException(KantorException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onParse(Ast.Program program) {
      tracer.onParse(program);
    }

    @Override public void onBinding(Binding binding) {
      tracer.onBinding(binding);
    }

    @Override public void onSkip(Ast.Comprehension comprehension,
        Value element) {
      tracer.onSkip(comprehension, element);
    }

    @Override public boolean onException(KantorException e) {
      return tracer.onException(e);
    }
  }
}

// End Tracers.java
