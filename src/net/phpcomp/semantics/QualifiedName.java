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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A namespace-qualified PHP name such as {@code \Foo\Bar\baz}. Names compare case-insensitively,
 * the way the language resolves functions and classes.
 */
public final class QualifiedName {

  private static final char SEPARATOR = '\\';

  private final ImmutableList<String> components;

  private QualifiedName(ImmutableList<String> components) {
    checkArgument(!components.isEmpty(), "empty name");
    this.components = components;
  }

  /** Parses a name; a leading separator (fully qualified form) is ignored. */
  public static QualifiedName of(String name) {
    ImmutableList<String> parts =
        ImmutableList.copyOf(Splitter.on(SEPARATOR).omitEmptyStrings().split(name));
    return new QualifiedName(parts);
  }

  /** Returns the last component, e.g. {@code baz} for {@code \Foo\Bar\baz}. */
  public String getName() {
    return components.get(components.size() - 1);
  }

  /** Returns the namespace part, or null for a name in the global namespace. */
  public @Nullable QualifiedName getNamespace() {
    if (isSimple()) {
      return null;
    }
    return new QualifiedName(components.subList(0, components.size() - 1));
  }

  public boolean isSimple() {
    return components.size() == 1;
  }

  public ImmutableList<String> components() {
    return components;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof QualifiedName)) {
      return false;
    }
    return Ascii.equalsIgnoreCase(toString(), o.toString());
  }

  @Override
  public int hashCode() {
    return Ascii.toLowerCase(toString()).hashCode();
  }

  @Override
  public String toString() {
    return Joiner.on(SEPARATOR).join(components);
  }
}
