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

package net.phpcomp.semantics;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import net.phpcomp.semantics.graph.ControlFlowGraph;
import org.jspecify.annotations.Nullable;

/**
 * A function, method or lambda declared in source, together with its bound body.
 *
 * <p>Abstract and interface methods have no body, and therefore no {@link ControlFlowGraph}.
 */
public final class SourceRoutineSymbol {

  /** The syntactic form of the declaration. */
  public enum Kind {
    FUNCTION,
    METHOD,
    LAMBDA,
    /** The implicit routine holding a file's top-level statements. */
    GLOBAL_CODE,
  }

  private final String name;
  private final Kind kind;
  private final @Nullable TypeSymbol containingType;
  private final @Nullable TypeRefSyntax returnTypeSyntax;
  private final @Nullable ControlFlowGraph controlFlowGraph;
  private final TypeRefContext typeRefContext;
  private final Compilation compilation;
  private final String sourceFileName;
  private final SourceSpan span;

  private SourceRoutineSymbol(Builder builder) {
    this.name = builder.name;
    this.kind = builder.kind;
    this.containingType = builder.containingType;
    this.returnTypeSyntax = builder.returnTypeSyntax;
    this.controlFlowGraph = builder.controlFlowGraph;
    this.typeRefContext = builder.typeRefContext;
    this.compilation = checkNotNull(builder.compilation, "compilation");
    this.sourceFileName = builder.sourceFileName;
    this.span = builder.span;
  }

  public static Builder builder(String name, Kind kind) {
    return new Builder(name, kind);
  }

  public String getName() {
    return name;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isMethod() {
    return kind == Kind.METHOD;
  }

  /** The class declaring a method; null for functions and global code. */
  public @Nullable TypeSymbol getContainingType() {
    return containingType;
  }

  /** The declared return type hint, or null if there is none. */
  public @Nullable TypeRefSyntax getReturnTypeSyntax() {
    return returnTypeSyntax;
  }

  public @Nullable ControlFlowGraph getControlFlowGraph() {
    return controlFlowGraph;
  }

  public TypeRefContext getTypeRefContext() {
    return typeRefContext;
  }

  public Compilation getDeclaringCompilation() {
    return compilation;
  }

  public String getSourceFileName() {
    return sourceFileName;
  }

  /** The span of the whole declaration. */
  public SourceSpan getSpan() {
    return span;
  }

  @Override
  public String toString() {
    return containingType == null ? name : containingType + "::" + name;
  }

  /** Builder for {@link SourceRoutineSymbol}. */
  public static final class Builder {
    private final String name;
    private final Kind kind;
    private @Nullable TypeSymbol containingType;
    private @Nullable TypeRefSyntax returnTypeSyntax;
    private @Nullable ControlFlowGraph controlFlowGraph;
    private TypeRefContext typeRefContext = new TypeRefContext();
    private @Nullable Compilation compilation;
    private String sourceFileName = "";
    private SourceSpan span = SourceSpan.INVALID;

    private Builder(String name, Kind kind) {
      this.name = checkNotNull(name);
      this.kind = checkNotNull(kind);
    }

    @CanIgnoreReturnValue
    public Builder setContainingType(TypeSymbol containingType) {
      this.containingType = containingType;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setReturnTypeSyntax(TypeRefSyntax returnTypeSyntax) {
      this.returnTypeSyntax = returnTypeSyntax;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setControlFlowGraph(ControlFlowGraph controlFlowGraph) {
      this.controlFlowGraph = controlFlowGraph;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTypeRefContext(TypeRefContext typeRefContext) {
      this.typeRefContext = checkNotNull(typeRefContext);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCompilation(Compilation compilation) {
      this.compilation = compilation;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSourceFileName(String sourceFileName) {
      this.sourceFileName = checkNotNull(sourceFileName);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSpan(SourceSpan span) {
      this.span = checkNotNull(span);
      return this;
    }

    public SourceRoutineSymbol build() {
      return new SourceRoutineSymbol(this);
    }
  }
}
