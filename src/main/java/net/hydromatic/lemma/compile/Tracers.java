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
package net.hydromatic.lemma.compile;

import static com.google.common.collect.Lists.transform;
import static java.util.Objects.requireNonNull;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.lemma.ast.AstWriter;
import net.hydromatic.lemma.ast.Core;
import net.hydromatic.lemma.type.IsForced;
import net.hydromatic.lemma.type.Modality;
import net.hydromatic.lemma.type.Telescope;

/** Implementations of {@link Tracer}. */
public class Tracers {
  /** Level of records about changed modalities. */
  public static final int TELESCOPE_LEVEL = 40;
  /** Level of records about dotting and rebinding. */
  public static final int REBIND_LEVEL = 50;
  /** Level of records about the analysis of constructors. */
  public static final int ANALYSIS_LEVEL = 60;

  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer nullTracer() {
    return NullTracer.INSTANCE;
  }

  /**
   * Returns a tracer that writes records whose level is no greater than
   * {@code verbosity} to a writer.
   */
  public static Tracer printTracer(PrintWriter w, int verbosity) {
    requireNonNull(w);
    return new RecordTracer(verbosity, line -> {
      w.println(line);
      w.flush();
    });
  }

  /**
   * Returns a tracer that writes to a writer, with the verbosity given by
   * the {@link Prop#FORCING_VERBOSITY} property.
   */
  public static Tracer printTracer(PrintWriter w, Map<Prop, Object> propMap) {
    return printTracer(w, Prop.FORCING_VERBOSITY.intValue(propMap));
  }

  /**
   * Returns a tracer that passes each record whose level is no greater than
   * {@code verbosity}, rendered as a string, to a consumer.
   */
  public static Tracer recordingTracer(int verbosity,
      Consumer<String> consumer) {
    return new RecordTracer(verbosity, requireNonNull(consumer));
  }

  /** Renders a list of patterns as they would appear in a clause. */
  static String clause(List<Core.Arg<Core.Pat>> patterns) {
    return new AstWriter().spaced(transform(patterns, arg -> arg.value))
        .toString();
  }

  /** Implementation of {@link Tracer} that does nothing. */
  private static class NullTracer implements Tracer {
    static final NullTracer INSTANCE = new NullTracer();

    @Override
    public void onForcingAnnotations(String ctorName,
        List<ForcedVariables.Occurrence> occurrences, List<IsForced> forced) {}

    @Override
    public void onDotted(List<Core.Arg<Core.Pat>> patterns,
        List<Core.Arg<Core.Pat>> dotted, List<Core.Pat> rebind) {}

    @Override
    public void onRebind(Core.Pat toRebind,
        List<Core.Arg<Core.Pat>> patterns) {}

    @Override
    public void onRebindResult(List<Core.Arg<Core.Pat>> patterns) {}

    @Override
    public void onTelescope(List<Map.Entry<Core.PatVar, Modality>> oldModalities,
        List<Map.Entry<Core.PatVar, Modality>> newModalities,
        Telescope telescope) {}
  }

  /**
   * Implementation of {@link Tracer} that renders each event as a record and
   * passes the records at or below a verbosity level to a consumer.
   */
  private static class RecordTracer implements Tracer {
    private final int verbosity;
    private final Consumer<String> consumer;

    RecordTracer(int verbosity, Consumer<String> consumer) {
      this.verbosity = verbosity;
      this.consumer = consumer;
    }

    private boolean enabled(int level) {
      return level <= verbosity;
    }

    @Override
    public void onForcingAnnotations(String ctorName,
        List<ForcedVariables.Occurrence> occurrences, List<IsForced> forced) {
      if (enabled(ANALYSIS_LEVEL)) {
        consumer.accept("Forcing analysis for " + ctorName
            + "\n  xs          = "
            + transform(occurrences, occurrence -> occurrence.index)
            + "\n  forcedArgs  = " + forced);
      }
    }

    @Override
    public void onDotted(List<Core.Arg<Core.Pat>> patterns,
        List<Core.Arg<Core.Pat>> dotted, List<Core.Pat> rebind) {
      if (enabled(REBIND_LEVEL)) {
        consumer.accept("forcingTranslation"
            + "\n  patterns: " + clause(patterns)
            + "\n  dotted:   " + clause(dotted)
            + "\n  rebind:   " + rebind);
      }
    }

    @Override
    public void onRebind(Core.Pat toRebind,
        List<Core.Arg<Core.Pat>> patterns) {
      if (enabled(REBIND_LEVEL)) {
        consumer.accept("rebinding " + toRebind + " in " + clause(patterns));
      }
    }

    @Override
    public void onRebindResult(List<Core.Arg<Core.Pat>> patterns) {
      if (enabled(REBIND_LEVEL)) {
        consumer.accept("  result: " + clause(patterns));
      }
    }

    @Override
    public void onTelescope(List<Map.Entry<Core.PatVar, Modality>> oldModalities,
        List<Map.Entry<Core.PatVar, Modality>> newModalities,
        Telescope telescope) {
      if (enabled(TELESCOPE_LEVEL)) {
        consumer.accept("Updating modalities of forced arguments"
            + "\n  from: " + oldModalities
            + "\n  to:   " + newModalities);
      }
      if (enabled(ANALYSIS_LEVEL)) {
        consumer.accept("  delta' = " + telescope);
      }
    }
  }
}

// End Tracers.java
