/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */

package exm.midend.fir.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.fir.FirDeclarations.FirFunction;

/**
 * Control flow graph of a single function.  Nodes are listed in the
 * order of the constructs they belong to, enter node first.
 */
public class ControlFlowGraph {
  private final FirFunction function;
  private final List<CFGNode> nodes = new ArrayList<CFGNode>();
  private CFGNode enterNode = null;
  private CFGNode exitNode = null;

  public ControlFlowGraph(FirFunction function) {
    this.function = function;
  }

  public FirFunction getFunction() {
    return function;
  }

  public List<CFGNode> getNodes() {
    return Collections.unmodifiableList(nodes);
  }

  public CFGNode getEnterNode() {
    if (enterNode == null) {
      throw new StructuralInvariantError("Graph of " + function.getName()
                                       + " has no enter node");
    }
    return enterNode;
  }

  public CFGNode getExitNode() {
    if (exitNode == null) {
      throw new StructuralInvariantError("Graph of " + function.getName()
                                       + " has no exit node");
    }
    return exitNode;
  }

  void setEnterNode(CFGNode enterNode) {
    assert(this.enterNode == null);
    this.enterNode = enterNode;
  }

  void setExitNode(CFGNode exitNode) {
    assert(this.exitNode == null);
    this.exitNode = exitNode;
  }

  void addNode(CFGNode node) {
    assert(node.getOwner() == this);
    nodes.add(node);
  }

  /**
   * @return index of node in structural order, or -1 if not registered
   */
  public int indexOf(CFGNode node) {
    return nodes.indexOf(node);
  }

  @Override
  public String toString() {
    return "ControlFlowGraph(" + function.getName() + ", " + nodes.size()
         + " nodes)";
  }
}
