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

import java.util.ArrayList;
import java.util.List;

import exm.midend.ir.IrTypes.IrSimpleType;
import exm.midend.ir.IrTypes.IrType;

/**
 * Rewrites classifiers of types through a symbol remapper
 */
public class DeepCopyTypeRemapper {
  private final SymbolRemapper symbolRemapper;

  public DeepCopyTypeRemapper(SymbolRemapper symbolRemapper) {
    this.symbolRemapper = symbolRemapper;
  }

  /**
   * @return remapped type, or null if type was null
   */
  public IrType remapType(IrType type) {
    if (!(type instanceof IrSimpleType)) {
      // Error types and absent types carry no symbols
      return type;
    }
    IrSimpleType simple = (IrSimpleType)type;
    List<IrType> args = new ArrayList<IrType>(simple.getArguments().size());
    for (IrType arg: simple.getArguments()) {
      args.add(remapType(arg));
    }
    return new IrSimpleType(symbolRemapper.getReferenced(
                  simple.getClassifier()), simple.isNullable(), args);
  }

  public List<IrType> remapTypes(List<IrType> types) {
    List<IrType> result = new ArrayList<IrType>(types.size());
    for (IrType type: types) {
      result.add(remapType(type));
    }
    return result;
  }
}
