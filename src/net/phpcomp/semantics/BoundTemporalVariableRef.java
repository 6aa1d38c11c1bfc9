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

import net.phpcomp.semantics.graph.GraphVisitor;

/** A reference to a variable the binder synthesized while lowering a construct. */
public final class BoundTemporalVariableRef extends BoundVariableRef {

  public BoundTemporalVariableRef(String name) {
    super(BoundVariableName.direct(name), new BoundLocal(name), null);
  }

  @Override
  public void accept(GraphVisitor visitor) {
    visitor.visitTemporalVariableRef(this);
  }
}
