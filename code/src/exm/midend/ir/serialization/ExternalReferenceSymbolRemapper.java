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

package exm.midend.ir.serialization;

import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.IrSymbolOwner;
import exm.midend.ir.IrDeclarations.IrTypeParameter;
import exm.midend.ir.util.SymbolRemapper;

/**
 * Redirects references in copied annotations to mirrors.  Annotations
 * declare nothing, so asking for a declared symbol is an error.
 */
class ExternalReferenceSymbolRemapper implements SymbolRemapper {
  private final ExternalReferenceCollection collection;

  ExternalReferenceSymbolRemapper(ExternalReferenceCollection collection) {
    this.collection = collection;
  }

  @Override
  public <T extends IrSymbolOwner> IrSymbol<T> getDeclared(
                                                IrSymbol<T> symbol) {
    throw new StructuralInvariantError("Unexpected declaration of " + symbol
                                       + " inside annotation");
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T extends IrSymbolOwner> IrSymbol<T> getReferenced(
                                                IrSymbol<T> symbol) {
    if (!symbol.isBound() || symbol.getOwner() instanceof IrTypeParameter) {
      // Not mirrored: classifiers known only by descriptor, type parameters
      return symbol;
    }
    IrSymbolOwner copy = collection.getCopyInternal(symbol.getOwner());
    return (IrSymbol<T>)copy.getSymbol();
  }
}
