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

package net.phpcomp.semantics.graph;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Arrays;
import net.phpcomp.semantics.SourceSpan;

/** An entry of a graph's label table. */
public final class LabelBlockState {

  private final String label;
  private final SourceSpan labelSpan;
  private final ImmutableSet<LabelBlockFlags> flags;

  public LabelBlockState(String label, SourceSpan labelSpan, Iterable<LabelBlockFlags> flags) {
    this.label = checkNotNull(label);
    this.labelSpan = checkNotNull(labelSpan);
    this.flags = Sets.immutableEnumSet(flags);
  }

  public static LabelBlockState of(String label, SourceSpan labelSpan, LabelBlockFlags... flags) {
    return new LabelBlockState(label, labelSpan, Arrays.asList(flags));
  }

  public String getLabel() {
    return label;
  }

  /** The span of the label's first occurrence, whether a use or a definition. */
  public SourceSpan getLabelSpan() {
    return labelSpan;
  }

  public ImmutableSet<LabelBlockFlags> getFlags() {
    return flags;
  }

  public boolean hasFlag(LabelBlockFlags flag) {
    return flags.contains(flag);
  }

  @Override
  public String toString() {
    return label + flags;
  }
}
