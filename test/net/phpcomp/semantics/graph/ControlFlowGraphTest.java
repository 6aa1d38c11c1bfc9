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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import net.phpcomp.semantics.SourceSpan;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ControlFlowGraph}. */
@RunWith(JUnit4.class)
public final class ControlFlowGraphTest {

  private final ControlFlowGraph.Builder builder = ControlFlowGraph.builder();

  @Test
  public void testOrdinalsFollowCreationOrder() {
    BoundBlock a = builder.newBlock();
    CaseBlock b = builder.newCaseBlock(null);
    BoundBlock c = builder.newBlock();

    ControlFlowGraph graph = builder.build();

    assertThat(a.getOrdinal()).isEqualTo(0);
    assertThat(b.getOrdinal()).isEqualTo(1);
    assertThat(c.getOrdinal()).isEqualTo(2);
    assertThat(graph.getBlocks()).containsExactly(a, b, c).inOrder();
  }

  @Test
  public void testStartDefaultsToFirstBlock() {
    BoundBlock first = builder.newBlock();
    builder.newBlock();

    assertThat(builder.build().getStart()).isSameInstanceAs(first);
    assertThat(ControlFlowGraph.builder().build().getStart()).isNull();
  }

  @Test
  public void testExplicitStartAndExit() {
    BoundBlock exit = builder.newBlock();
    BoundBlock start = builder.newBlock();
    builder.setStart(start).setExit(exit);

    ControlFlowGraph graph = builder.build();

    assertThat(graph.getStart()).isSameInstanceAs(start);
    assertThat(graph.getExit()).isSameInstanceAs(exit);
  }

  @Test
  public void testForeignBlockIsRejected() {
    BoundBlock foreign = ControlFlowGraph.builder().newBlock();

    assertThrows(IllegalArgumentException.class, () -> builder.setStart(foreign));
  }

  @Test
  public void testEdgeAttachesToSource() {
    BoundBlock a = builder.newBlock();
    BoundBlock b = builder.newBlock();

    SimpleEdge edge = new SimpleEdge(a, b);

    assertThat(a.getNextEdge()).isSameInstanceAs(edge);
    assertThat(edge.getTargets()).containsExactly(b);
    assertThat(b.getNextEdge()).isNull();
  }

  @Test
  public void testLabels() {
    LabelBlockState label =
        LabelBlockState.of("end", SourceSpan.of(3, 3), LabelBlockFlags.USED, LabelBlockFlags.USED);
    builder.addLabel(label);

    ControlFlowGraph graph = builder.build();

    assertThat(graph.getLabels()).containsExactly(label);
    assertThat(label.getFlags()).containsExactly(LabelBlockFlags.USED);
    assertThat(label.hasFlag(LabelBlockFlags.DEFINED)).isFalse();
  }
}
