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
import exm.midend.fir.FirElement;

/**
 * Node of a control flow graph.  Edges are kept on both endpoints and
 * may be repeated.
 *
 * Structure is fixed once the owning graph has been built; only the
 * dead flag may change afterwards.
 */
public class CFGNode {
  private final ControlFlowGraph owner;
  private final CFGNodeKind kind;
  private final FirElement fir;
  private final int level;

  private final List<CFGNode> previousNodes = new ArrayList<CFGNode>();
  private final List<CFGNode> followingNodes = new ArrayList<CFGNode>();

  private boolean isDead = false;

  public CFGNode(ControlFlowGraph owner, CFGNodeKind kind, FirElement fir,
                 int level) {
    assert(owner != null);
    assert(kind != null);
    assert(fir != null);
    this.owner = owner;
    this.kind = kind;
    this.fir = fir;
    this.level = level;
  }

  public ControlFlowGraph getOwner() {
    return owner;
  }

  public CFGNodeKind getKind() {
    return kind;
  }

  /**
   * @return the element this node represents
   */
  public FirElement getFir() {
    return fir;
  }

  public int getLevel() {
    return level;
  }

  public List<CFGNode> getPreviousNodes() {
    return Collections.unmodifiableList(previousNodes);
  }

  public List<CFGNode> getFollowingNodes() {
    return Collections.unmodifiableList(followingNodes);
  }

  public boolean isDead() {
    return isDead;
  }

  public void setDead(boolean isDead) {
    this.isDead = isDead;
  }

  /**
   * Dead nodes see all neighbours, live nodes only live ones
   */
  public List<CFGNode> getUsefulFollowingNodes() {
    return useful(followingNodes);
  }

  public List<CFGNode> getUsefulPreviousNodes() {
    return useful(previousNodes);
  }

  private List<CFGNode> useful(List<CFGNode> nodes) {
    if (isDead) {
      return Collections.unmodifiableList(nodes);
    }
    List<CFGNode> result = new ArrayList<CFGNode>(nodes.size());
    for (CFGNode node: nodes) {
      if (!node.isDead()) {
        result.add(node);
      }
    }
    return result;
  }

  /**
   * Add edge from this node to target, updating both endpoints
   */
  void connectTo(CFGNode target) {
    if (target.owner != owner) {
      throw new StructuralInvariantError(
          "Edge between graphs: " + this + " -> " + target);
    }
    followingNodes.add(target);
    target.previousNodes.add(this);
  }

  @Override
  public String toString() {
    return kind.name() + "@" + level;
  }
}
