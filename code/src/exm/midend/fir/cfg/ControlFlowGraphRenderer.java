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
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Text dump of a graph: one line per node, indented by level, listing
 * the indices of the following nodes
 */
public class ControlFlowGraphRenderer {

  private static final String INDENT = "  ";

  public static String render(ControlFlowGraph graph) {
    StringBuilder sb = new StringBuilder();
    sb.append("graph ").append(graph.getFunction().getName()).append("\n");
    List<CFGNode> nodes = graph.getNodes();
    for (int i = 0; i < nodes.size(); i++) {
      CFGNode node = nodes.get(i);
      sb.append(i).append(": ");
      sb.append(StringUtils.repeat(INDENT, node.getLevel()));
      sb.append(node.getKind().name());
      if (node.isDead()) {
        sb.append(" (dead)");
      }
      List<Integer> following = new ArrayList<Integer>();
      for (CFGNode next: node.getFollowingNodes()) {
        following.add(graph.indexOf(next));
      }
      if (!following.isEmpty()) {
        sb.append(" -> ").append(StringUtils.join(following, ", "));
      }
      sb.append("\n");
    }
    return sb.toString();
  }
}
