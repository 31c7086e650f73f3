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

package exm.midend.ir;

/**
 * Node of the IR tree.
 */
public interface IrElement {
  public <R, D> R accept(IrElementVisitor<R, D> visitor, D data);

  /**
   * Visit each direct child in order
   */
  public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data);

  /**
   * Replace each direct child with the result of transforming it
   */
  public <D> void transformChildren(IrElementTransformer<D> transformer,
                                    D data);
}
