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

import exm.midend.common.exceptions.UnsupportedInputError;
import exm.midend.ir.IrTypes.IrErrorType;
import exm.midend.ir.IrTypes.IrSimpleType;
import exm.midend.ir.IrTypes.IrType;
import exm.midend.ir.descriptors.Descriptors.ClassDescriptor;
import exm.midend.ir.descriptors.Descriptors.DeclarationDescriptor;
import exm.midend.ir.descriptors.Descriptors.TypeDescriptor;
import exm.midend.ir.descriptors.Descriptors.TypeParameterDescriptor;

/**
 * Translates front-end types to IR types.  Classifiers are referenced
 * through the symbol table, so the resulting types may point at
 * declarations that have not been generated yet.
 */
public class TypeTranslator {
  private final SymbolTable symbolTable;

  public TypeTranslator(SymbolTable symbolTable) {
    this.symbolTable = symbolTable;
  }

  /**
   * @return translated type, or null if type is null
   */
  public IrType translateType(TypeDescriptor type) {
    if (type == null) {
      return null;
    }
    if (type.isError()) {
      return IrErrorType.INSTANCE;
    }
    List<IrType> args = new ArrayList<IrType>();
    for (TypeDescriptor arg: type.getArguments()) {
      args.add(translateType(arg));
    }
    DeclarationDescriptor classifier = type.getClassifier();
    if (classifier instanceof ClassDescriptor) {
      return new IrSimpleType(
          symbolTable.referenceClass((ClassDescriptor)classifier),
          type.isNullable(), args);
    } else if (classifier instanceof TypeParameterDescriptor) {
      return new IrSimpleType(symbolTable.referenceTypeParameter(
                                  (TypeParameterDescriptor)classifier),
                              type.isNullable(), args);
    } else {
      throw new UnsupportedInputError("Unexpected classifier " + classifier
                                      + " of type " + type);
    }
  }

  public List<IrType> translateTypes(List<TypeDescriptor> types) {
    List<IrType> result = new ArrayList<IrType>(types.size());
    for (TypeDescriptor type: types) {
      result.add(translateType(type));
    }
    return result;
  }
}
