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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A {@link SymbolProvider} over a fixed set of declarations. Type and function names are matched
 * case-insensitively, constants case-sensitively.
 */
public final class SimpleSymbolProvider implements SymbolProvider {

  private final ImmutableMap<String, ScriptSymbol> files;
  private final ImmutableMap<QualifiedName, TypeSymbol> types;
  private final ImmutableMap<QualifiedName, MethodSymbol> functions;
  private final ImmutableMap<String, Object> constants;
  private final ImmutableSet<String> extensions;

  private SimpleSymbolProvider(Builder builder) {
    this.files = ImmutableMap.copyOf(builder.files);
    this.types = ImmutableMap.copyOf(builder.types);
    this.functions = ImmutableMap.copyOf(builder.functions);
    this.constants = ImmutableMap.copyOf(builder.constants);
    this.extensions = ImmutableSet.copyOf(builder.extensions);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** A provider that knows no declarations at all. */
  public static SimpleSymbolProvider empty() {
    return builder().build();
  }

  @Override
  public @Nullable ScriptSymbol resolveFile(String path) {
    return files.get(normalizePath(path));
  }

  @Override
  public @Nullable TypeSymbol resolveType(QualifiedName name) {
    return types.get(name);
  }

  @Override
  public @Nullable MethodSymbol resolveFunction(QualifiedName name) {
    return functions.get(name);
  }

  @Override
  public Optional<Object> resolveConstant(String name) {
    return Optional.ofNullable(constants.get(name));
  }

  @Override
  public Iterable<String> getExtensions() {
    return extensions;
  }

  private static String normalizePath(String path) {
    String normalized = path.replace('\\', '/');
    while (normalized.startsWith("./")) {
      normalized = normalized.substring(2);
    }
    return Ascii.toLowerCase(normalized);
  }

  /** Builder for {@link SimpleSymbolProvider}. */
  public static final class Builder {
    private final Map<String, ScriptSymbol> files = new LinkedHashMap<>();
    private final Map<QualifiedName, TypeSymbol> types = new LinkedHashMap<>();
    private final Map<QualifiedName, MethodSymbol> functions = new LinkedHashMap<>();
    private final Map<String, Object> constants = new LinkedHashMap<>();
    private final Set<String> extensions = new LinkedHashSet<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder addFile(ScriptSymbol file) {
      files.put(normalizePath(file.relativePath()), file);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addType(TypeSymbol type) {
      types.put(type.getFullName(), type);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addFunction(MethodSymbol function) {
      functions.put(QualifiedName.of(function.getName()), function);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addConstant(String name, Object value) {
      constants.put(name, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addExtension(String name) {
      extensions.add(name);
      return this;
    }

    public SimpleSymbolProvider build() {
      return new SimpleSymbolProvider(this);
    }
  }
}
