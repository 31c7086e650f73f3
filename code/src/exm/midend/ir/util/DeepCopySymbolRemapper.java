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

import java.util.HashMap;
import java.util.Map;

import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.ir.IrElement;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.IrSymbolOwner;
import exm.midend.ir.IrTreeWalker;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrPackageFragment;

/**
 * Remapper for copying a whole subtree.  Run it over the subtree first:
 * it allocates a fresh symbol for every declaration it finds.
 * References to declarations outside the subtree are kept as they are.
 */
public class DeepCopySymbolRemapper extends IrTreeWalker
                                    implements SymbolRemapper {

  /** Symbols are compared by identity */
  private final Map<IrSymbol<?>, IrSymbol<?>> declared =
                          new HashMap<IrSymbol<?>, IrSymbol<?>>();

  @Override
  public Void visitElement(IrElement element, Void data) {
    if (element instanceof IrDeclaration ||
        element instanceof IrPackageFragment) {
      IrSymbol<?> symbol = ((IrSymbolOwner)element).getSymbol();
      declared.put(symbol, new IrSymbol<IrSymbolOwner>(symbol.getKind(),
                                                     symbol.getDescriptor()));
    }
    return super.visitElement(element, data);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T extends IrSymbolOwner> IrSymbol<T> getDeclared(
                                                IrSymbol<T> symbol) {
    IrSymbol<?> result = declared.get(symbol);
    if (result == null) {
      throw new StructuralInvariantError("No copy allocated for declared "
                                         + symbol);
    }
    return (IrSymbol<T>)result;
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T extends IrSymbolOwner> IrSymbol<T> getReferenced(
                                                IrSymbol<T> symbol) {
    IrSymbol<?> result = declared.get(symbol);
    return result == null ? symbol : (IrSymbol<T>)result;
  }
}
