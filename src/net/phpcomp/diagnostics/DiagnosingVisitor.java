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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import java.util.Optional;
import net.phpcomp.semantics.BoundArgument;
import net.phpcomp.semantics.BoundArrayEx;
import net.phpcomp.semantics.BoundAssertEx;
import net.phpcomp.semantics.BoundAssignEx;
import net.phpcomp.semantics.BoundBinaryEx;
import net.phpcomp.semantics.BoundDeclareStatement;
import net.phpcomp.semantics.BoundEvalEx;
import net.phpcomp.semantics.BoundExpression;
import net.phpcomp.semantics.BoundGlobalFunctionCall;
import net.phpcomp.semantics.BoundInstanceFunctionCall;
import net.phpcomp.semantics.BoundLocal;
import net.phpcomp.semantics.BoundNewEx;
import net.phpcomp.semantics.BoundReturnStatement;
import net.phpcomp.semantics.BoundRoutineName;
import net.phpcomp.semantics.BoundStatement;
import net.phpcomp.semantics.BoundStaticFunctionCall;
import net.phpcomp.semantics.BoundTemporalVariableRef;
import net.phpcomp.semantics.BoundTypeRef;
import net.phpcomp.semantics.BoundVariableRef;
import net.phpcomp.semantics.BoundYieldStatement;
import net.phpcomp.semantics.CoreTypes;
import net.phpcomp.semantics.MethodSymbol;
import net.phpcomp.semantics.ObsoleteData;
import net.phpcomp.semantics.Operations;
import net.phpcomp.semantics.SourceRoutineSymbol;
import net.phpcomp.semantics.SourceSpan;
import net.phpcomp.semantics.TypeRefContext;
import net.phpcomp.semantics.TypeRefMask;
import net.phpcomp.semantics.TypeRefSyntax;
import net.phpcomp.semantics.TypeSymbol;
import net.phpcomp.semantics.graph.BoundBlock;
import net.phpcomp.semantics.graph.CatchBlock;
import net.phpcomp.semantics.graph.ControlFlowGraph;
import net.phpcomp.semantics.graph.GraphVisitor;
import net.phpcomp.semantics.graph.TryCatchEdge;
import org.jspecify.annotations.Nullable;

/**
 * Reports the semantic diagnostics of a routine: illegal control flow, misuse of symbols and
 * types, suspicious code and unreachable code.
 *
 * <p>The graph is walked once. Each check reads the type facts and resolution results already
 * attached to the bound tree and never modifies it. Checks are independent of one another; the
 * diagnostics are reported at their default level and the {@link ErrorHandler} decides what to do
 * with them.
 */
public final class DiagnosingVisitor extends GraphVisitor {

  private static final String TO_STRING_NAME = "__toString";

  private final SourceRoutineSymbol routine;
  private final RoutineErrorReporter reporter;
  private final ScopeTracker scopes = new ScopeTracker();

  /**
   * Analyzes the body of {@code routine}, reporting to {@code errorHandler}. Routines without a
   * body, such as abstract methods, are skipped.
   *
   * @throws IllegalStateException if the routine's graph has no start block
   */
  public static void analyze(ErrorHandler errorHandler, SourceRoutineSymbol routine) {
    ControlFlowGraph graph = routine.getControlFlowGraph();
    if (graph != null) {
      new DiagnosingVisitor(errorHandler, routine).visitCFG(graph);
    }
  }

  private DiagnosingVisitor(ErrorHandler errorHandler, SourceRoutineSymbol routine) {
    this.routine = routine;
    this.reporter = new RoutineErrorReporter(errorHandler, routine);
  }

  private TypeRefContext typeCtx() {
    return routine.getTypeRefContext();
  }

  private CoreTypes coreTypes() {
    return routine.getDeclaringCompilation().getCoreTypes();
  }

  private int currentOrdinal() {
    BoundBlock block = getCurrentBlock();
    return block == null ? -1 : block.getOrdinal();
  }

  @Override
  public void visitCFG(ControlFlowGraph graph) {
    resetVisitedBlocks();

    super.visitCFG(graph);

    // Missing and redefined labels are known only after the whole graph was seen.
    new LabelValidator(reporter).validate(graph.getLabels());

    checkUnreachableCode(graph);
  }

  private void checkUnreachableCode(ControlFlowGraph graph) {
    for (BoundBlock block : graph.getBlocks()) {
      if (isVisited(block) || block.isEmpty()) {
        continue;
      }
      for (BoundStatement statement : block.getStatements()) {
        SourceSpan span = RoutineErrorReporter.spanOf(statement);
        if (span.isValid()) {
          reporter.report(span, PhpDiagnostics.UNREACHABLE_CODE);
          break;
        }
      }
    }
  }

  @Override
  public void visitCFGTryCatchEdge(TryCatchEdge x) {
    // The body block leads to the rest of the routine, so regions are ordinal ranges.
    int next = x.getNextBlock().getOrdinal();
    scopes.push(ScopeTracker.Kind.TRY, x.getBodyBlock().getOrdinal(), next);

    ImmutableList<CatchBlock> catches = x.getCatchBlocks();
    BoundBlock finallyBlock = x.getFinallyBlock();
    for (int i = 0; i < catches.size(); i++) {
      BoundBlock end;
      if (i + 1 < catches.size()) {
        end = catches.get(i + 1);
      } else {
        end = finallyBlock != null ? finallyBlock : x.getNextBlock();
      }
      scopes.push(ScopeTracker.Kind.CATCH, catches.get(i).getOrdinal(), end.getOrdinal());
    }

    if (finallyBlock != null) {
      scopes.push(ScopeTracker.Kind.FINALLY, finallyBlock.getOrdinal(), next);
    }

    super.visitCFGTryCatchEdge(x);
  }

  @Override
  public void visitEval(BoundEvalEx x) {
    reporter.report(RoutineErrorReporter.spanOf(x).withLength(4), PhpDiagnostics.EVAL_DISCOURAGED);

    super.visitEval(x);
  }

  @Override
  public void visitArray(BoundArrayEx x) {
    if (x.getAccess().isNone()) {
      reporter.report(x, PhpDiagnostics.EXPRESSION_NOT_READ);
    }

    super.visitArray(x);
  }

  @Override
  public void visitTypeRef(BoundTypeRef typeRef) {
    TypeRefSyntax syntax = typeRef.getTypeRef();
    if (typeRef.hasClassNameRestriction() && syntax != null && syntax.isPrimitive()) {
      // A primitive type makes no sense where a class name is expected.
      reporter.report(
          syntax.getSpan(), PhpDiagnostics.PRIMITIVE_TYPE_NAME_MISUSED, syntax.toString());
    } else {
      checkUndefinedType(typeRef);
      super.visitTypeRef(typeRef);
    }
  }

  private void checkUndefinedType(BoundTypeRef typeRef) {
    if (!SymbolResolution.isUndefinedType(typeRef)) {
      return;
    }
    TypeRefSyntax syntax = typeRef.getTypeRef();
    String name =
        syntax.getQualifiedName() != null ? syntax.getQualifiedName().toString() : syntax.toString();
    reporter.report(syntax.getSpan(), PhpDiagnostics.UNDEFINED_TYPE, name);
  }

  @Override
  public void visitNew(BoundNewEx x) {
    TypeSymbol type = x.getTypeRef().getResolvedType();
    if (type != null && type.isValidType()) {
      if (type.isInterfaceType()) {
        cannotInstantiate(x, "interface", type);
      } else if (type.isStatic()) {
        cannotInstantiate(x, "static", type);
      } else if (type.isTraitType()) {
        cannotInstantiate(x, "trait", type);
      } else if (type == coreTypes().getClosure()) {
        TypeRefSyntax syntax = x.getTypeRef().getTypeRef();
        SourceSpan span =
            syntax != null ? syntax.getSpan() : RoutineErrorReporter.spanOf(x.getTypeRef());
        reporter.report(span, PhpDiagnostics.CLOSURE_INSTANTIATED, type.getName());
      } else if (type.isAbstract()) {
        cannotInstantiate(x, "abstract class", type);
      }
    }

    super.visitNew(x);
  }

  private void cannotInstantiate(BoundNewEx x, String kind, TypeSymbol type) {
    reporter.report(
        x, PhpDiagnostics.CANNOT_INSTANTIATE_TYPE, kind, type.getFullName().toString());
  }

  @Override
  public void visitReturn(BoundReturnStatement x) {
    BoundExpression returned = x.getReturned();

    if (routine.isMethod() && Ascii.equalsIgnoreCase(routine.getName(), TO_STRING_NAME)) {
      if (returned == null || !isAllowedToStringReturnType(returned.getTypeRefMask())) {
        SourceSpan span = x.getSyntax() != null ? x.getSyntax() : routine.getSpan();
        TypeSymbol containingType = routine.getContainingType();
        String typeName =
            containingType != null ? containingType.getFullName().toString() : routine.getName();
        reporter.report(span, PhpDiagnostics.TO_STRING_MUST_RETURN_STRING, typeName);
      }
    }

    TypeRefSyntax returnType = routine.getReturnTypeSyntax();
    if (returnType != null && returnType.isVoid() && returned != null) {
      reporter.report(x, PhpDiagnostics.VOID_FUNCTION_CANNOT_RETURN_VALUE);
    }

    if (x.getSyntax() != null && scopes.isInside(currentOrdinal(), ScopeTracker.Kind.FINALLY)) {
      reporter.report(x, PhpDiagnostics.NOT_YET_IMPLEMENTED, "return from finally block");
    }

    super.visitReturn(x);
  }

  /** Strings, or facts that may hold a string: objects, arrays and numbers are rejected. */
  private boolean isAllowedToStringReturnType(TypeRefMask mask) {
    return mask.isRef() || mask.isAnyType() || typeCtx().isAString(mask);
  }

  @Override
  public void visitAssign(BoundAssignEx x) {
    // $x = $x
    if (x.getTarget() instanceof BoundVariableRef
        && x.getValue() instanceof BoundVariableRef
        && x.getSyntax() != null) {
      BoundVariableRef target = (BoundVariableRef) x.getTarget();
      BoundVariableRef value = (BoundVariableRef) x.getValue();
      if (target.getVariable() instanceof BoundLocal && value.getVariable() instanceof BoundLocal) {
        String name = target.getVariable().getName();
        if (!name.isEmpty() && name.equals(value.getVariable().getName())) {
          reporter.report(x, PhpDiagnostics.ASSIGNING_SAME_VARIABLE);
        }
      }
    }

    super.visitAssign(x);
  }

  @Override
  public void visitGlobalFunctionCall(BoundGlobalFunctionCall x) {
    if (SymbolResolution.isUndefinedFunctionCall(x)) {
      SourceSpan span = x.getNameSpan() != null ? x.getNameSpan() : RoutineErrorReporter.spanOf(x);
      reporter.report(
          span, PhpDiagnostics.UNDEFINED_FUNCTION_CALL, x.getName().getNameValue().toString());
    }

    BoundExpression nameExpression = x.getName().getNameExpression();
    if (nameExpression != null) {
      // The value called must be usable as a callback.
      TypeRefMask mask = nameExpression.getTypeRefMask();
      if (!typeCtx().canBeCallable(mask)) {
        reporter.report(x, PhpDiagnostics.INVALID_FUNCTION_NAME, typeCtx().toString(mask));
      }
    }

    super.visitGlobalFunctionCall(x);
  }

  @Override
  public void visitInstanceFunctionCall(BoundInstanceFunctionCall x) {
    super.visitInstanceFunctionCall(x);

    checkMethodCallTargetInstance(x.getInstance(), x.getName());
    checkObsoleteSymbol(x, x.getTargetMethod());
  }

  @Override
  public void visitStaticFunctionCall(BoundStaticFunctionCall x) {
    super.visitStaticFunctionCall(x);

    checkObsoleteSymbol(x, x.getTargetMethod());
  }

  private void checkMethodCallTargetInstance(@Nullable BoundExpression target, BoundRoutineName name) {
    if (target == null) {
      return;
    }

    String nonObjectType = null;
    TypeSymbol resultType = target.getResultType();
    if (resultType != null) {
      switch (resultType.getSpecialType()) {
        case VOID:
        case INT32:
        case INT64:
        case STRING:
        case BOOLEAN:
          nonObjectType = resultType.getPhpTypeNameOrNull();
          break;
        default:
          if (coreTypes().isNonObjectValueType(resultType)) {
            nonObjectType = resultType.getPhpTypeNameOrNull();
          }
          break;
      }
    } else {
      TypeRefMask mask = target.getTypeRefMask();
      if (!mask.isAnyType() && !mask.isRef() && !typeCtx().isObject(mask)) {
        nonObjectType = typeCtx().toString(mask);
      }
    }

    if (nonObjectType != null) {
      String methodName = name.isDirect() ? name.getNameValue().getName() : "{}";
      reporter.report(
          target, PhpDiagnostics.METHOD_CALLED_ON_NON_OBJECT, methodName, nonObjectType);
    }
  }

  private void checkObsoleteSymbol(BoundExpression call, @Nullable MethodSymbol target) {
    Optional<ObsoleteData> obsolete = SymbolResolution.getObsoleteData(target);
    if (obsolete.isPresent()) {
      reporter.report(
          call,
          PhpDiagnostics.SYMBOL_DEPRECATED,
          target.getKindName(),
          target.getName(),
          obsolete.get().message());
    }
  }

  @Override
  public void visitVariableRef(BoundVariableRef x) {
    if (x.isMaybeUninitialized() && !x.getAccess().isQuiet() && x.getSyntax() != null) {
      reporter.report(
          x, PhpDiagnostics.UNINITIALIZED_VARIABLE_USE, String.valueOf(x.getName().getNameValue()));
    }

    super.visitVariableRef(x);
  }

  @Override
  public void visitTemporalVariableRef(BoundTemporalVariableRef x) {
    // Synthesized by the binder, nothing to report.
  }

  @Override
  public void visitDeclareStatement(BoundDeclareStatement x) {
    reporter.report(
        x.getDeclareClauseSpan(), PhpDiagnostics.NOT_YET_IMPLEMENTED_IGNORED, "Declare construct");

    super.visitDeclareStatement(x);
  }

  @Override
  public void visitAssert(BoundAssertEx x) {
    super.visitAssert(x);

    ImmutableList<BoundArgument> args = x.getArgumentsInSourceOrder();
    if (args.isEmpty()) {
      reporter.report(x, PhpDiagnostics.MISSING_ARGUMENTS, "assert", "1", "0");
      return;
    }

    BoundExpression assertion = args.get(0).getValue();
    if (assertion.isConstantFalse()) {
      reporter.report(x, PhpDiagnostics.ASSERT_ALWAYS_FAIL);
    }

    if (typeCtx().isAString(assertion.getTypeRefMask())) {
      reporter.report(assertion, PhpDiagnostics.STRING_ASSERTION_DEPRECATED);
    }

    if (args.size() > 2) {
      reporter.report(x, PhpDiagnostics.TOO_MANY_ARGUMENTS);
    }
  }

  @Override
  public void visitBinaryExpression(BoundBinaryEx x) {
    super.visitBinaryExpression(x);

    if (x.getOperation() == Operations.DIV && x.getRight().isConstantZero()) {
      reporter.report(x.getRight(), PhpDiagnostics.DIVISION_BY_ZERO);
    }
  }

  @Override
  public void visitYieldStatement(BoundYieldStatement x) {
    if (scopes.isInsideAnyTryOrCatchOrFinally(currentOrdinal())) {
      reporter.report(
          x,
          PhpDiagnostics.NOT_YET_IMPLEMENTED,
          "yielding from an exception handling construct (try, catch, finally)");
    }

    super.visitYieldStatement(x);
  }
}
