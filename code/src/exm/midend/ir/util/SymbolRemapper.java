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

package exm.midend.ir.util;

import exm.midend.ir.IrSymbol;
import exm.midend.ir.IrSymbolOwner;

/**
 * Maps symbols of a tree being copied to the symbols of the copy.
 */
public interface SymbolRemapper {
  /**
   * @return symbol for the copy of a declaration inside the copied tree
   */
  public <T extends IrSymbolOwner> IrSymbol<T> getDeclared(IrSymbol<T> symbol);

  /**
   * @return symbol to use where the copied tree refers to symbol
   */
  public <T extends IrSymbolOwner> IrSymbol<T> getReferenced(
                                                  IrSymbol<T> symbol);
}
