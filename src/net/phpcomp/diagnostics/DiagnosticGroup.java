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

import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Group a set of related diagnostic types together, so that they can
 * be toggled on and off as one unit.
 */
public class DiagnosticGroup {

  // The set of types represented by this group, hashed by key.
  private final ImmutableSet<DiagnosticType> types;

  // A human-readable name for the group.
  private final @Nullable String name;

  /**
   * Create a group that matches all errors of the given types.
   */
  DiagnosticGroup(@Nullable String name, DiagnosticType... types) {
    this.name = name;
    this.types = ImmutableSet.copyOf(Arrays.asList(types));
  }

  /**
   * Create a group that matches all errors of the given types.
   */
  public DiagnosticGroup(DiagnosticType... types) {
    this((String) null, types);
  }

  /** Create a diagnostic group that matches only the given type. */
  public static DiagnosticGroup forType(DiagnosticType type) {
    return new DiagnosticGroup(type);
  }

  /**
   * Create a composite group.
   */
  public DiagnosticGroup(@Nullable String name, DiagnosticGroup... groups) {
    Set<DiagnosticType> set = new LinkedHashSet<>();

    for (DiagnosticGroup group : groups) {
      set.addAll(group.types);
    }

    this.name = name;
    this.types = ImmutableSet.copyOf(set);
  }

  /**
   * Returns whether the given error's type matches a type
   * in this group.
   */
  public boolean matches(PhpError error) {
    return matches(error.getType());
  }

  /**
   * Returns whether the given type matches a type in this group.
   */
  public boolean matches(DiagnosticType type) {
    return types.contains(type);
  }

  /**
   * Returns an iterable over all the types in this group.
   */
  public Iterable<DiagnosticType> getTypes() {
    return types;
  }

  public @Nullable String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name == null ? super.toString() : "DiagnosticGroup<" + name + ">";
  }
}
