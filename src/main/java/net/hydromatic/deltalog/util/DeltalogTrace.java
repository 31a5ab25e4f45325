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
package net.hydromatic.deltalog.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contains all of the tracers used within the Deltalog compiler.
 *
 * <p>To enable tracing, set the level of the "net.hydromatic.deltalog"
 * logger, or of an individual tracer, to DEBUG in your logging configuration.
 */
public abstract class DeltalogTrace {
  private DeltalogTrace() {}

  private static final Logger ANALYZER_TRACER =
      LoggerFactory.getLogger("net.hydromatic.deltalog.compile.Analyzer");

  private static final Logger RULE_TRACER =
      LoggerFactory.getLogger("net.hydromatic.deltalog.compile.RuleAnalyzer");

  /**
   * Returns the tracer for program-level analysis: symbol tables, column names
   * and delta predicates.
   */
  public static Logger getAnalyzerTracer() {
    return ANALYZER_TRACER;
  }

  /** Returns the tracer for per-rule variable and equality tables. */
  public static Logger getRuleTracer() {
    return RULE_TRACER;
  }
}

// End DeltalogTrace.java
