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
import exm.midend.ir.IrSymbol;
import exm.midend.ir.IrSymbolOwner;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrConstructor;
import exm.midend.ir.IrDeclarations.IrEnumEntry;
import exm.midend.ir.IrDeclarations.IrExternalPackageFragment;
import exm.midend.ir.IrDeclarations.IrField;
import exm.midend.ir.IrDeclarations.IrProperty;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrDeclarations.IrTypeParameter;
import exm.midend.ir.descriptors.Descriptors.ClassConstructorDescriptor;
import exm.midend.ir.descriptors.Descriptors.ClassDescriptor;
import exm.midend.ir.descriptors.Descriptors.DeclarationDescriptor;
import exm.midend.ir.descriptors.Descriptors.FunctionDescriptor;
import exm.midend.ir.descriptors.Descriptors.PackageFragmentDescriptor;
import exm.midend.ir.descriptors.Descriptors.PropertyDescriptor;
import exm.midend.ir.descriptors.Descriptors.TypeParameterDescriptor;

/**
 * Symbols of declarations known by descriptor.  A symbol can be
 * referenced before its declaration exists; declaring binds the same
 * symbol, so every reference to a descriptor sees the declaration.
 *
 * Descriptors are compared by identity.
 */
public class SymbolTable {

  /**
   * Creates the declaration for a symbol.  The declaration must bind
   * the symbol.
   */
  public static interface DeclarationFactory<T extends IrSymbolOwner> {
    public T create(IrSymbol<T> symbol);
  }

  private static class SymbolMap<D extends DeclarationDescriptor,
                                 T extends IrSymbolOwner> {
    private final IrSymbol.Kind kind;
    private final Map<D, IrSymbol<T>> symbols = new HashMap<D, IrSymbol<T>>();

    SymbolMap(IrSymbol.Kind kind) {
      this.kind = kind;
    }

    IrSymbol<T> reference(D descriptor) {
      IrSymbol<T> symbol = symbols.get(descriptor);
      if (symbol == null) {
        symbol = new IrSymbol<T>(kind, descriptor);
        symbols.put(descriptor, symbol);
      }
      return symbol;
    }

    T declare(D descriptor, DeclarationFactory<T> factory) {
      IrSymbol<T> symbol = reference(descriptor);
      if (symbol.isBound()) {
        throw new StructuralInvariantError(kind + " " + descriptor +
                            " already declared as " + symbol.getOwner());
      }
      T owner = factory.create(symbol);
      if (!symbol.isBound() || symbol.getOwner() != owner) {
        throw new StructuralInvariantError("Declaration " + owner +
                            " did not bind symbol for " + descriptor);
      }
      return owner;
    }
  }

  private final SymbolMap<PackageFragmentDescriptor, IrExternalPackageFragment>
      externalPackageFragments =
        new SymbolMap<PackageFragmentDescriptor, IrExternalPackageFragment>(
                              IrSymbol.Kind.EXTERNAL_PACKAGE_FRAGMENT);
  private final SymbolMap<ClassDescriptor, IrClass> classes =
        new SymbolMap<ClassDescriptor, IrClass>(IrSymbol.Kind.CLASS);
  private final SymbolMap<ClassDescriptor, IrEnumEntry> enumEntries =
        new SymbolMap<ClassDescriptor, IrEnumEntry>(IrSymbol.Kind.ENUM_ENTRY);
  private final SymbolMap<ClassConstructorDescriptor, IrConstructor>
      constructors = new SymbolMap<ClassConstructorDescriptor, IrConstructor>(
                              IrSymbol.Kind.CONSTRUCTOR);
  private final SymbolMap<FunctionDescriptor, IrSimpleFunction>
      simpleFunctions = new SymbolMap<FunctionDescriptor, IrSimpleFunction>(
                              IrSymbol.Kind.SIMPLE_FUNCTION);
  private final SymbolMap<PropertyDescriptor, IrProperty> properties =
        new SymbolMap<PropertyDescriptor, IrProperty>(IrSymbol.Kind.PROPERTY);
  private final SymbolMap<PropertyDescriptor, IrField> fields =
        new SymbolMap<PropertyDescriptor, IrField>(IrSymbol.Kind.FIELD);
  private final SymbolMap<TypeParameterDescriptor, IrTypeParameter>
      typeParameters = new SymbolMap<TypeParameterDescriptor, IrTypeParameter>(
                              IrSymbol.Kind.TYPE_PARAMETER);

  public IrSymbol<IrExternalPackageFragment> referenceExternalPackageFragment(
                                      PackageFragmentDescriptor descriptor) {
    return externalPackageFragments.reference(descriptor);
  }

  public IrExternalPackageFragment declareExternalPackageFragment(
                                  final PackageFragmentDescriptor descriptor) {
    return externalPackageFragments.declare(descriptor,
        new DeclarationFactory<IrExternalPackageFragment>() {
          @Override
          public IrExternalPackageFragment create(
                            IrSymbol<IrExternalPackageFragment> symbol) {
            return new IrExternalPackageFragment(symbol,
                                                 descriptor.getFqName());
          }
        });
  }

  public IrSymbol<IrClass> referenceClass(ClassDescriptor descriptor) {
    return classes.reference(descriptor);
  }

  public IrClass declareClass(ClassDescriptor descriptor,
                              DeclarationFactory<IrClass> factory) {
    return classes.declare(descriptor, factory);
  }

  public IrSymbol<IrEnumEntry> referenceEnumEntry(ClassDescriptor descriptor) {
    return enumEntries.reference(descriptor);
  }

  public IrEnumEntry declareEnumEntry(ClassDescriptor descriptor,
                                  DeclarationFactory<IrEnumEntry> factory) {
    return enumEntries.declare(descriptor, factory);
  }

  public IrSymbol<IrConstructor> referenceConstructor(
                                  ClassConstructorDescriptor descriptor) {
    return constructors.reference(descriptor);
  }

  public IrConstructor declareConstructor(
          ClassConstructorDescriptor descriptor,
          DeclarationFactory<IrConstructor> factory) {
    return constructors.declare(descriptor, factory);
  }

  public IrSymbol<IrSimpleFunction> referenceSimpleFunction(
                                          FunctionDescriptor descriptor) {
    return simpleFunctions.reference(descriptor);
  }

  public IrSimpleFunction declareSimpleFunction(FunctionDescriptor descriptor,
                            DeclarationFactory<IrSimpleFunction> factory) {
    return simpleFunctions.declare(descriptor, factory);
  }

  public IrSymbol<IrProperty> referenceProperty(
                                          PropertyDescriptor descriptor) {
    return properties.reference(descriptor);
  }

  public IrProperty declareProperty(PropertyDescriptor descriptor,
                                    DeclarationFactory<IrProperty> factory) {
    return properties.declare(descriptor, factory);
  }

  /**
   * Backing fields are keyed by the descriptor of their property
   */
  public IrSymbol<IrField> referenceField(PropertyDescriptor descriptor) {
    return fields.reference(descriptor);
  }

  public IrField declareField(PropertyDescriptor descriptor,
                              DeclarationFactory<IrField> factory) {
    return fields.declare(descriptor, factory);
  }

  public IrSymbol<IrTypeParameter> referenceTypeParameter(
                                      TypeParameterDescriptor descriptor) {
    return typeParameters.reference(descriptor);
  }

  public IrTypeParameter declareTypeParameter(
          TypeParameterDescriptor descriptor,
          DeclarationFactory<IrTypeParameter> factory) {
    return typeParameters.declare(descriptor, factory);
  }
}
