/*
 * Copyright 2026 The PHP Flow Diagnostics Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.phpcomp.diagnostics;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.phpcomp.semantics.BoundArgument;
import net.phpcomp.semantics.BoundExpression;
import net.phpcomp.semantics.BoundExpressionStatement;
import net.phpcomp.semantics.BoundLiteral;
import net.phpcomp.semantics.BoundLocal;
import net.phpcomp.semantics.BoundStatement;
import net.phpcomp.semantics.BoundVariableName;
import net.phpcomp.semantics.BoundVariableRef;
import net.phpcomp.semantics.Compilation;
import net.phpcomp.semantics.SimpleSymbolProvider;
import net.phpcomp.semantics.SourceRoutineSymbol;
import net.phpcomp.semantics.SourceSpan;
import net.phpcomp.semantics.SymbolProvider;
import net.phpcomp.semantics.TypeRefContext;
import net.phpcomp.semantics.graph.BoundBlock;
import net.phpcomp.semantics.graph.ControlFlowGraph;

/**
 * Builds a routine body by hand, the way the binder would, and collects what the diagnostics pass
 * reports for it. Every node gets a distinct span so tests can tell reports apart by location.
 */
final class RoutineFixture {

  static final String SOURCE_NAME = "test.php";

  final Compilation compilation;
  final TypeRefContext typeCtx = new TypeRefContext();
  final ControlFlowGraph.Builder graph = ControlFlowGraph.builder();
  final BoundBlock entry;

  private int nextOffset = 0;

  RoutineFixture() {
    this(SimpleSymbolProvider.empty());
  }

  RoutineFixture(SymbolProvider symbolProvider) {
    this.compilation = new Compilation(symbolProvider);
    this.entry = graph.newBlock();
  }

  /** Returns a fresh span that does not overlap any span handed out before. */
  SourceSpan span() {
    SourceSpan span = SourceSpan.of(nextOffset, 10);
    nextOffset += 10;
    return span;
  }

  BoundLiteral literal(Object value) {
    return new BoundLiteral(value, span());
  }

  BoundVariableRef local(String name) {
    return new BoundVariableRef(BoundVariableName.direct(name), new BoundLocal(name), span());
  }

  static BoundExpressionStatement statement(BoundExpression expression) {
    return new BoundExpressionStatement(expression);
  }

  static ImmutableList<BoundArgument> arguments(BoundExpression... values) {
    ImmutableList.Builder<BoundArgument> arguments = ImmutableList.builder();
    for (BoundExpression value : values) {
      arguments.add(new BoundArgument(value));
    }
    return arguments.build();
  }

  /** Adds statements to the entry block. */
  void add(BoundStatement... statements) {
    for (BoundStatement statement : statements) {
      entry.add(statement);
    }
  }

  void add(BoundExpression expression) {
    entry.add(statement(expression));
  }

  SourceRoutineSymbol.Builder routine(String name, SourceRoutineSymbol.Kind kind) {
    return SourceRoutineSymbol.builder(name, kind)
        .setCompilation(compilation)
        .setTypeRefContext(typeCtx)
        .setSourceFileName(SOURCE_NAME)
        .setSpan(SourceSpan.of(1000, 50));
  }

  /** Analyzes a global function whose body is the graph built so far. */
  ImmutableList<PhpError> analyzeFunction() {
    return analyze(routine("foo", SourceRoutineSymbol.Kind.FUNCTION));
  }

  ImmutableList<PhpError> analyze(SourceRoutineSymbol.Builder routine) {
    return analyzeRoutine(routine.setControlFlowGraph(graph.build()).build());
  }

  static ImmutableList<PhpError> analyzeRoutine(SourceRoutineSymbol routine) {
    List<PhpError> errors = new ArrayList<>();
    DiagnosingVisitor.analyze((level, error) -> errors.add(error), routine);
    return ImmutableList.copyOf(errors);
  }

  static ImmutableList<DiagnosticType> typesOf(List<PhpError> errors) {
    ImmutableList.Builder<DiagnosticType> types = ImmutableList.builder();
    for (PhpError error : errors) {
      types.add(error.getType());
    }
    return types.build();
  }
}
