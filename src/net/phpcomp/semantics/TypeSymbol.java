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
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * A type a type reference may resolve to: a user or library class, interface or trait, a
 * platform value type, or the error sentinel produced when resolution fails.
 */
public final class TypeSymbol implements Symbol {

  /** The declaration kind of the type. */
  public enum TypeKind {
    CLASS,
    INTERFACE,
    TRAIT,
    /** A non-object runtime value type such as {@code int} or the platform array. */
    VALUE,
    ERROR,
  }

  private final QualifiedName name;
  private final TypeKind kind;
  private final boolean isAbstract;
  private final boolean isStatic;
  private final SpecialType specialType;
  private final @Nullable String phpTypeName;
  private final CandidateReason candidateReason;
  private final @Nullable ObsoleteData obsoleteData;

  private TypeSymbol(Builder builder) {
    this.name = builder.name;
    this.kind = builder.kind;
    this.isAbstract = builder.isAbstract;
    this.isStatic = builder.isStatic;
    this.specialType = builder.specialType;
    this.phpTypeName = builder.phpTypeName;
    this.candidateReason = builder.candidateReason;
    this.obsoleteData = builder.obsoleteData;
  }

  public static Builder builder(QualifiedName name, TypeKind kind) {
    return new Builder(name, kind);
  }

  public static TypeSymbol classType(String name) {
    return builder(QualifiedName.of(name), TypeKind.CLASS).build();
  }

  public static TypeSymbol interfaceType(String name) {
    return builder(QualifiedName.of(name), TypeKind.INTERFACE).build();
  }

  public static TypeSymbol traitType(String name) {
    return builder(QualifiedName.of(name), TypeKind.TRAIT).build();
  }

  /** Creates the sentinel for a type reference that could not be resolved. */
  public static TypeSymbol error(QualifiedName name, CandidateReason reason) {
    return builder(name, TypeKind.ERROR).setCandidateReason(reason).build();
  }

  @Override
  public String getName() {
    return name.getName();
  }

  public QualifiedName getFullName() {
    return name;
  }

  @Override
  public String getKindName() {
    switch (kind) {
      case INTERFACE:
        return "interface";
      case TRAIT:
        return "trait";
      default:
        return "class";
    }
  }

  public TypeKind getTypeKind() {
    return kind;
  }

  public boolean isValidType() {
    return kind != TypeKind.ERROR;
  }

  public boolean isErrorType() {
    return kind == TypeKind.ERROR;
  }

  public boolean isInterfaceType() {
    return kind == TypeKind.INTERFACE;
  }

  public boolean isTraitType() {
    return kind == TypeKind.TRAIT;
  }

  public boolean isAbstract() {
    return isAbstract;
  }

  public boolean isStatic() {
    return isStatic;
  }

  public SpecialType getSpecialType() {
    return specialType;
  }

  /** The PHP spelling of a value type, e.g. {@code int}; null for classes. */
  public @Nullable String getPhpTypeNameOrNull() {
    return phpTypeName;
  }

  /** Why resolution failed; {@link CandidateReason#NONE} for resolved types. */
  public CandidateReason getCandidateReason() {
    return candidateReason;
  }

  @Override
  public Optional<ObsoleteData> getObsoleteData() {
    return Optional.ofNullable(obsoleteData);
  }

  @Override
  public String toString() {
    return name.toString();
  }

  /** Builder for {@link TypeSymbol}. */
  public static final class Builder {
    private final QualifiedName name;
    private final TypeKind kind;
    private boolean isAbstract;
    private boolean isStatic;
    private SpecialType specialType = SpecialType.NONE;
    private @Nullable String phpTypeName;
    private CandidateReason candidateReason = CandidateReason.NONE;
    private @Nullable ObsoleteData obsoleteData;

    private Builder(QualifiedName name, TypeKind kind) {
      this.name = checkNotNull(name);
      this.kind = checkNotNull(kind);
    }

    @CanIgnoreReturnValue
    public Builder setAbstract(boolean isAbstract) {
      this.isAbstract = isAbstract;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setStatic(boolean isStatic) {
      this.isStatic = isStatic;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSpecialType(SpecialType specialType) {
      this.specialType = checkNotNull(specialType);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setPhpTypeName(String phpTypeName) {
      this.phpTypeName = phpTypeName;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCandidateReason(CandidateReason candidateReason) {
      this.candidateReason = checkNotNull(candidateReason);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setObsoleteData(ObsoleteData obsoleteData) {
      this.obsoleteData = obsoleteData;
      return this;
    }

    public TypeSymbol build() {
      return new TypeSymbol(this);
    }
  }
}
