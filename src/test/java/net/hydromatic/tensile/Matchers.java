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
package net.hydromatic.tensile;

import java.util.List;
import net.hydromatic.tensile.cfg.Cfgs;
import net.hydromatic.tensile.cfg.ProgramPoint;
import net.hydromatic.tensile.compile.CompileException;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for use in Tensile tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a {@link CompileException} of a given kind whose message
   * contains a given string. */
  public static Matcher<Throwable> throwsA(CompileException.Kind kind,
      String message) {
    return new CustomTypeSafeMatcher<Throwable>(kind + " with message "
        + message) {
      @Override protected boolean matchesSafely(Throwable item) {
        return item instanceof CompileException
            && ((CompileException) item).kind() == kind
            && item.getMessage().contains(message);
      }
    };
  }

  /** Matches a control flow whose actions, one per line, are as
   * given. */
  public static Matcher<List<ProgramPoint>> hasActions(String... lines) {
    final StringBuilder b = new StringBuilder();
    for (String line : lines) {
      b.append(line).append('\n');
    }
    final String expected = b.toString();
    return new CustomTypeSafeMatcher<List<ProgramPoint>>("actions "
        + expected) {
      @Override protected boolean matchesSafely(List<ProgramPoint> cfg) {
        return Cfgs.describe(cfg).equals(expected);
      }
    };
  }
}

// End Matchers.java
