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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.phpcomp.semantics.BoundStatement;
import org.jspecify.annotations.Nullable;

/**
 * A basic block: a sequence of statements executed in order, followed by at most one outgoing
 * {@link Edge}.
 *
 * <p>The ordinal is the block's identity within its graph. Ordinals are dense and assigned in
 * discovery order, so the blocks covered by a try, catch or finally region form the interval
 * between the region's first block and the block control resumes at afterwards.
 */
public class BoundBlock {

  private final int ordinal;
  private final List<BoundStatement> statements = new ArrayList<>();
  private @Nullable Edge nextEdge;

  BoundBlock(int ordinal) {
    this.ordinal = ordinal;
  }

  public int getOrdinal() {
    return ordinal;
  }

  public List<BoundStatement> getStatements() {
    return Collections.unmodifiableList(statements);
  }

  public void add(BoundStatement statement) {
    statements.add(checkNotNull(statement));
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  /** The outgoing edge; null for the exit block and blocks ending the routine. */
  public @Nullable Edge getNextEdge() {
    return nextEdge;
  }

  void setNextEdge(Edge nextEdge) {
    this.nextEdge = checkNotNull(nextEdge);
  }

  public void accept(GraphVisitor visitor) {
    visitor.visitCFGBlock(this);
  }

  @Override
  public String toString() {
    return "#" + ordinal;
  }
}
