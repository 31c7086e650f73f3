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

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.midend.common.exceptions.StructuralInvariantError;

/**
 * Check structural well-formedness of a finished graph.
 * Throws StructuralInvariantError on the first problem found.
 */
public class ControlFlowGraphValidator {

  public static void validate(ControlFlowGraph graph) {
    List<CFGNode> nodes = graph.getNodes();
    Set<CFGNode> registered = new HashSet<CFGNode>(nodes);
    CFGNode enter = graph.getEnterNode();
    CFGNode exit = graph.getExitNode();

    if (!registered.contains(enter) || !registered.contains(exit)) {
      fail(graph, "enter or exit node not registered");
    }
    if (!enter.getPreviousNodes().isEmpty()) {
      fail(graph, "enter node has predecessors");
    }
    if (!exit.getFollowingNodes().isEmpty()) {
      fail(graph, "exit node has successors");
    }
    if (registered.size() != nodes.size()) {
      fail(graph, "node registered twice");
    }

    for (CFGNode node: nodes) {
      if (node.getOwner() != graph) {
        fail(graph, node + " belongs to other graph " + node.getOwner());
      }
      checkEdges(graph, registered, node);
      if (node != enter && node.getPreviousNodes().isEmpty()
          && !node.isDead()) {
        fail(graph, "live node " + node + " is unreachable");
      }
      if (node.getKind().isEnter()) {
        checkMatchingExit(graph, node);
      }
    }
  }

  private static void checkEdges(ControlFlowGraph graph,
                                 Set<CFGNode> registered, CFGNode node) {
    for (CFGNode next: node.getFollowingNodes()) {
      if (!registered.contains(next)) {
        fail(graph, "edge " + node + " -> unregistered " + next);
      }
      if (Collections.frequency(node.getFollowingNodes(), next) !=
          Collections.frequency(next.getPreviousNodes(), node)) {
        fail(graph, "asymmetric edge " + node + " -> " + next);
      }
    }
    for (CFGNode prev: node.getPreviousNodes()) {
      if (!prev.getFollowingNodes().contains(node)) {
        fail(graph, "asymmetric edge " + prev + " -> " + node);
      }
    }
  }

  private static void checkMatchingExit(ControlFlowGraph graph,
                                        CFGNode enter) {
    CFGNodeKind exitKind = enter.getKind().matchingExit();
    for (CFGNode node: graph.getNodes()) {
      if (node.getKind() == exitKind && node.getFir() == enter.getFir()) {
        if (node.getLevel() != enter.getLevel()) {
          fail(graph, "level of " + node + " doesn't match " + enter);
        }
        return;
      }
    }
    fail(graph, "no " + exitKind + " for " + enter + " of "
                + enter.getFir());
  }

  private static void fail(ControlFlowGraph graph, String msg) {
    throw new StructuralInvariantError("Malformed " + graph + ": " + msg);
  }
}
