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

import org.apache.log4j.Logger;

import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.common.exceptions.UnresolvedIdentityError;
import exm.midend.common.exceptions.UnsupportedInputError;
import exm.midend.ir.ClassKind;
import exm.midend.ir.IrConstants;
import exm.midend.ir.IrDeclarationOrigin;
import exm.midend.ir.IrDeclarationParent;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.Visibility;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrConstructor;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrEnumEntry;
import exm.midend.ir.IrDeclarations.IrExternalPackageFragment;
import exm.midend.ir.IrDeclarations.IrField;
import exm.midend.ir.IrDeclarations.IrFunction;
import exm.midend.ir.IrDeclarations.IrProperty;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrDeclarations.IrTypeParameter;
import exm.midend.ir.IrDeclarations.IrValueParameter;
import exm.midend.ir.IrExpressions.ConstKind;
import exm.midend.ir.IrExpressions.IrConst;
import exm.midend.ir.IrExpressions.IrExpressionBody;
import exm.midend.ir.IrTypes;
import exm.midend.ir.IrTypes.IrType;
import exm.midend.ir.descriptors.Descriptors.CallableKind;
import exm.midend.ir.descriptors.Descriptors.CallableMemberDescriptor;
import exm.midend.ir.descriptors.Descriptors.ClassConstructorDescriptor;
import exm.midend.ir.descriptors.Descriptors.ClassDescriptor;
import exm.midend.ir.descriptors.Descriptors.DeclarationDescriptor;
import exm.midend.ir.descriptors.Descriptors.FunctionDescriptor;
import exm.midend.ir.descriptors.Descriptors.PackageFragmentDescriptor;
import exm.midend.ir.descriptors.Descriptors.PropertyAccessorDescriptor;
import exm.midend.ir.descriptors.Descriptors.PropertyDescriptor;
import exm.midend.ir.descriptors.Descriptors.TypeDescriptor;
import exm.midend.ir.descriptors.Descriptors.TypeParameterDescriptor;
import exm.midend.ir.descriptors.Descriptors.ValueParameterDescriptor;

/**
 * Generates bodiless declarations for descriptors of external
 * declarations.  Every stub is declared through the symbol table, so
 * asking twice for the same descriptor returns the same stub.
 *
 * A stub's parent is the stub of its containing declaration, but stubs
 * are not added to their parent's declaration list.
 */
public class DeclarationStubGenerator {
  private static final int UNDEFINED = IrConstants.UNDEFINED_OFFSET;

  private final Logger logger;
  private final SymbolTable symbolTable;
  private final TypeTranslator typeTranslator;

  public DeclarationStubGenerator(Logger logger, SymbolTable symbolTable) {
    this.logger = logger;
    this.symbolTable = symbolTable;
    this.typeTranslator = new TypeTranslator(symbolTable);
  }

  public SymbolTable getSymbolTable() {
    return symbolTable;
  }

  public IrExternalPackageFragment generateOrGetEmptyExternalPackageFragmentStub(
                                    PackageFragmentDescriptor descriptor) {
    IrSymbol<IrExternalPackageFragment> referenced =
              symbolTable.referenceExternalPackageFragment(descriptor);
    if (referenced.isBound()) {
      return referenced.getOwner();
    }
    return symbolTable.declareExternalPackageFragment(descriptor);
  }

  public IrDeclaration generateMemberStub(DeclarationDescriptor descriptor) {
    if (descriptor instanceof ClassDescriptor) {
      ClassDescriptor cls = (ClassDescriptor)descriptor;
      if (cls.getKind() == ClassKind.ENUM_ENTRY) {
        return generateEnumEntryStub(cls);
      } else {
        return generateClassStub(cls);
      }
    } else if (descriptor instanceof ClassConstructorDescriptor) {
      return generateConstructorStub((ClassConstructorDescriptor)descriptor);
    } else if (descriptor instanceof FunctionDescriptor) {
      return generateFunctionStub((FunctionDescriptor)descriptor, true);
    } else if (descriptor instanceof PropertyDescriptor) {
      return generatePropertyStub((PropertyDescriptor)descriptor);
    } else {
      throw new UnsupportedInputError("Unexpected member descriptor: "
                                      + descriptor);
    }
  }

  public IrDeclaration generateStubBySymbol(IrSymbol<?> symbol) {
    DeclarationDescriptor descriptor = symbol.getDescriptor();
    if (descriptor == null) {
      throw new UnresolvedIdentityError("No descriptor to generate stub for "
                                        + symbol);
    }
    switch (symbol.getKind()) {
      case FIELD:
        return generateFieldStub((PropertyDescriptor)descriptor);
      case TYPE_PARAMETER:
        return generateOrGetTypeParameterStub(
                                  (TypeParameterDescriptor)descriptor);
      default:
        return generateMemberStub(descriptor);
    }
  }

  private IrDeclarationOrigin computeOrigin(DeclarationDescriptor descriptor) {
    if (descriptor instanceof CallableMemberDescriptor &&
        ((CallableMemberDescriptor)descriptor).getKind() ==
                                              CallableKind.FAKE_OVERRIDE) {
      return IrDeclarationOrigin.FAKE_OVERRIDE;
    }
    return IrDeclarationOrigin.IR_EXTERNAL_DECLARATION_STUB;
  }

  private IrType toIrType(TypeDescriptor type) {
    return typeTranslator.translateType(type);
  }

  /**
   * Find or generate the stub that will be the parent of a stub
   */
  private IrDeclarationParent parentStub(DeclarationDescriptor container) {
    if (container instanceof PackageFragmentDescriptor) {
      return generateOrGetEmptyExternalPackageFragmentStub(
                                (PackageFragmentDescriptor)container);
    } else if (container instanceof ClassDescriptor) {
      return generateClassStub((ClassDescriptor)container);
    } else if (container instanceof ClassConstructorDescriptor ||
               container instanceof FunctionDescriptor) {
      return (IrFunction)generateMemberStub(container);
    } else {
      throw new UnresolvedIdentityError("No parent stub for container "
                                        + container);
    }
  }

  public IrProperty generatePropertyStub(final PropertyDescriptor descriptor) {
    IrSymbol<IrProperty> referenced = symbolTable.referenceProperty(descriptor);
    if (referenced.isBound()) {
      return referenced.getOwner();
    }

    final IrDeclarationOrigin origin = computeOrigin(descriptor);
    IrProperty property = symbolTable.declareProperty(descriptor,
        new SymbolTable.DeclarationFactory<IrProperty>() {
          @Override
          public IrProperty create(IrSymbol<IrProperty> symbol) {
            return new IrProperty(UNDEFINED, UNDEFINED, origin, symbol,
                descriptor.getName(), descriptor.getVisibility(),
                descriptor.getModality(), descriptor.isVar(),
                descriptor.isConst(), descriptor.isLateinit(),
                descriptor.isDelegated(), descriptor.isExternal());
          }
        });
    IrDeclarationParent parent =
                parentStub(descriptor.getContainingDeclaration());
    property.setParent(parent);

    if (descriptor.getGetter() != null) {
      IrSimpleFunction getter =
              generateFunctionStub(descriptor.getGetter(), false);
      getter.setCorrespondingPropertySymbol(property.getSymbol());
      property.setGetter(getter);
    }
    if (descriptor.getSetter() != null) {
      IrSimpleFunction setter =
              generateFunctionStub(descriptor.getSetter(), false);
      setter.setCorrespondingPropertySymbol(property.getSymbol());
      property.setSetter(setter);
    }
    if (descriptor.hasBackingField()) {
      IrField field = generateFieldStub(descriptor);
      field.setCorrespondingPropertySymbol(property.getSymbol());
      property.setBackingField(field);
    }
    logStub(property);
    return property;
  }

  public IrField generateFieldStub(final PropertyDescriptor descriptor) {
    IrSymbol<IrField> referenced = symbolTable.referenceField(descriptor);
    if (referenced.isBound()) {
      return referenced.getOwner();
    }

    final IrDeclarationOrigin origin = computeOrigin(descriptor);
    final DeclarationDescriptor container =
                                descriptor.getContainingDeclaration();
    IrField field = symbolTable.declareField(descriptor,
        new SymbolTable.DeclarationFactory<IrField>() {
          @Override
          public IrField create(IrSymbol<IrField> symbol) {
            return new IrField(UNDEFINED, UNDEFINED, origin, symbol,
                descriptor.getName(), toIrType(descriptor.getReturnType()),
                // Backing fields are private to their class
                Visibility.PRIVATE, !descriptor.isVar(),
                descriptor.isExternal(),
                container instanceof PackageFragmentDescriptor);
          }
        });
    field.setParent(parentStub(container));
    logStub(field);
    return field;
  }

  /**
   * @param createPropertyIfNeeded if true, an accessor is generated
   *        through its property, so that the property is linked to it
   */
  public IrSimpleFunction generateFunctionStub(
        final FunctionDescriptor descriptor, boolean createPropertyIfNeeded) {
    IrSymbol<IrSimpleFunction> referenced =
                        symbolTable.referenceSimpleFunction(descriptor);
    if (referenced.isBound()) {
      return referenced.getOwner();
    }

    if (createPropertyIfNeeded &&
        descriptor instanceof PropertyAccessorDescriptor) {
      PropertyAccessorDescriptor accessor =
                              (PropertyAccessorDescriptor)descriptor;
      IrProperty property =
              generatePropertyStub(accessor.getCorrespondingProperty());
      IrSimpleFunction result = accessor.isGetter() ? property.getGetter()
                                                    : property.getSetter();
      if (result == null || result.getSymbol() != referenced) {
        throw new StructuralInvariantError("Property " + property +
            " has no accessor for " + descriptor);
      }
      return result;
    }

    final IrDeclarationOrigin origin = computeOrigin(descriptor);
    IrSimpleFunction function = symbolTable.declareSimpleFunction(descriptor,
        new SymbolTable.DeclarationFactory<IrSimpleFunction>() {
          @Override
          public IrSimpleFunction create(IrSymbol<IrSimpleFunction> symbol) {
            return new IrSimpleFunction(UNDEFINED, UNDEFINED, origin, symbol,
                descriptor.getName(), descriptor.getVisibility(),
                descriptor.getModality(),
                toIrType(descriptor.getReturnType()), descriptor.isInline(),
                descriptor.isExternal(), descriptor.isTailrec(),
                descriptor.isSuspend());
          }
        });
    function.setParent(parentStub(descriptor.getContainingDeclaration()));
    generateParameterStubs(function, descriptor);
    logStub(function);
    return function;
  }

  public IrConstructor generateConstructorStub(
                      final ClassConstructorDescriptor descriptor) {
    IrSymbol<IrConstructor> referenced =
                        symbolTable.referenceConstructor(descriptor);
    if (referenced.isBound()) {
      return referenced.getOwner();
    }

    final IrDeclarationOrigin origin = computeOrigin(descriptor);
    IrConstructor constructor = symbolTable.declareConstructor(descriptor,
        new SymbolTable.DeclarationFactory<IrConstructor>() {
          @Override
          public IrConstructor create(IrSymbol<IrConstructor> symbol) {
            return new IrConstructor(UNDEFINED, UNDEFINED, origin, symbol,
                descriptor.getName(), descriptor.getVisibility(),
                toIrType(descriptor.getReturnType()), false, false,
                descriptor.isPrimary());
          }
        });
    constructor.setParent(generateClassStub(descriptor.getConstructedClass()));
    generateParameterStubs(constructor, descriptor);
    logStub(constructor);
    return constructor;
  }

  private void generateParameterStubs(IrFunction function,
                                      CallableMemberDescriptor descriptor) {
    for (TypeParameterDescriptor tp: descriptor.getTypeParameters()) {
      function.getTypeParameters().add(generateOrGetTypeParameterStub(tp));
    }
    if (descriptor.getDispatchReceiverType() != null) {
      function.setDispatchReceiverParameter(generateReceiverStub(function,
                                  descriptor.getDispatchReceiverType()));
    }
    if (descriptor.getExtensionReceiverType() != null) {
      function.setExtensionReceiverParameter(generateReceiverStub(function,
                                  descriptor.getExtensionReceiverType()));
    }
    for (ValueParameterDescriptor param: descriptor.getValueParameters()) {
      IrValueParameter paramStub = generateValueParameterStub(param);
      paramStub.setParent(function);
      function.getValueParameters().add(paramStub);
    }
  }

  private IrValueParameter generateReceiverStub(IrFunction function,
                                                TypeDescriptor type) {
    IrValueParameter receiver = new IrValueParameter(UNDEFINED, UNDEFINED,
        IrDeclarationOrigin.IR_EXTERNAL_DECLARATION_STUB,
        new IrSymbol<IrValueParameter>(IrSymbol.Kind.VALUE_PARAMETER),
        "<this>", -1, toIrType(type), null, false, false);
    receiver.setParent(function);
    return receiver;
  }

  /**
   * A declared default value becomes the zero value of the parameter's
   * type, since the real expression lives in the external module
   */
  public IrValueParameter generateValueParameterStub(
                                  ValueParameterDescriptor descriptor) {
    IrType type = toIrType(descriptor.getType());
    IrValueParameter param = new IrValueParameter(UNDEFINED, UNDEFINED,
        computeOrigin(descriptor),
        new IrSymbol<IrValueParameter>(IrSymbol.Kind.VALUE_PARAMETER,
                                       descriptor),
        descriptor.getName(), descriptor.getIndex(), type,
        toIrType(descriptor.getVarargElementType()),
        descriptor.isCrossinline(), descriptor.isNoinline());
    if (descriptor.declaresDefaultValue()) {
      param.setDefaultValue(new IrExpressionBody(zeroConst(type)));
    }
    return param;
  }

  public IrClass generateClassStub(final ClassDescriptor descriptor) {
    IrSymbol<IrClass> referenced = symbolTable.referenceClass(descriptor);
    if (referenced.isBound()) {
      return referenced.getOwner();
    }

    final IrDeclarationOrigin origin = computeOrigin(descriptor);
    IrClass cls = symbolTable.declareClass(descriptor,
        new SymbolTable.DeclarationFactory<IrClass>() {
          @Override
          public IrClass create(IrSymbol<IrClass> symbol) {
            return new IrClass(UNDEFINED, UNDEFINED, origin, symbol,
                descriptor.getName(), descriptor.getKind(),
                descriptor.getVisibility(), descriptor.getModality(),
                descriptor.isCompanion(), descriptor.isInner(),
                descriptor.isData(), descriptor.isExternal(),
                descriptor.isInline());
          }
        });
    cls.setParent(parentStub(descriptor.getContainingDeclaration()));
    for (TypeParameterDescriptor tp: descriptor.getTypeParameters()) {
      cls.getTypeParameters().add(generateOrGetTypeParameterStub(tp));
    }
    cls.getSuperTypes().addAll(
              typeTranslator.translateTypes(descriptor.getSuperTypes()));
    IrUtils.createParameterDeclarations(cls);
    logStub(cls);
    return cls;
  }

  public IrEnumEntry generateEnumEntryStub(final ClassDescriptor descriptor) {
    IrSymbol<IrEnumEntry> referenced =
                              symbolTable.referenceEnumEntry(descriptor);
    if (referenced.isBound()) {
      return referenced.getOwner();
    }

    final IrDeclarationOrigin origin = computeOrigin(descriptor);
    IrEnumEntry entry = symbolTable.declareEnumEntry(descriptor,
        new SymbolTable.DeclarationFactory<IrEnumEntry>() {
          @Override
          public IrEnumEntry create(IrSymbol<IrEnumEntry> symbol) {
            return new IrEnumEntry(UNDEFINED, UNDEFINED, origin, symbol,
                                   descriptor.getName());
          }
        });
    entry.setParent(parentStub(descriptor.getContainingDeclaration()));
    logStub(entry);
    return entry;
  }

  public IrTypeParameter generateOrGetTypeParameterStub(
                              final TypeParameterDescriptor descriptor) {
    IrSymbol<IrTypeParameter> referenced =
                          symbolTable.referenceTypeParameter(descriptor);
    if (referenced.isBound()) {
      return referenced.getOwner();
    }
    // Generating the container may generate this type parameter
    IrDeclarationParent parent =
                      parentStub(descriptor.getContainingDeclaration());
    if (referenced.isBound()) {
      return referenced.getOwner();
    }

    final IrDeclarationOrigin origin = computeOrigin(descriptor);
    IrTypeParameter tp = symbolTable.declareTypeParameter(descriptor,
        new SymbolTable.DeclarationFactory<IrTypeParameter>() {
          @Override
          public IrTypeParameter create(IrSymbol<IrTypeParameter> symbol) {
            return new IrTypeParameter(UNDEFINED, UNDEFINED, origin, symbol,
                descriptor.getName(), descriptor.getIndex(),
                descriptor.isReified());
          }
        });
    tp.setParent(parent);
    tp.getSuperTypes().addAll(
              typeTranslator.translateTypes(descriptor.getUpperBounds()));
    return tp;
  }

  private static IrConst zeroConst(IrType type) {
    ConstKind kind;
    Object value;
    if (IrTypes.isBuiltIn(type, "Float")) {
      kind = ConstKind.FLOAT;
      value = 0.0f;
    } else if (IrTypes.isBuiltIn(type, "Double")) {
      kind = ConstKind.DOUBLE;
      value = 0.0;
    } else if (IrTypes.isBuiltIn(type, "Boolean")) {
      kind = ConstKind.BOOLEAN;
      value = false;
    } else if (IrTypes.isBuiltIn(type, "Byte")) {
      kind = ConstKind.BYTE;
      value = (byte)0;
    } else if (IrTypes.isBuiltIn(type, "Char")) {
      kind = ConstKind.CHAR;
      value = (char)0;
    } else if (IrTypes.isBuiltIn(type, "Short")) {
      kind = ConstKind.SHORT;
      value = (short)0;
    } else if (IrTypes.isBuiltIn(type, "Int")) {
      kind = ConstKind.INT;
      value = 0;
    } else if (IrTypes.isBuiltIn(type, "Long")) {
      kind = ConstKind.LONG;
      value = 0L;
    } else {
      return IrConst.constNull(UNDEFINED, UNDEFINED, type);
    }
    return new IrConst(UNDEFINED, UNDEFINED, type, kind, value);
  }

  private void logStub(IrDeclaration stub) {
    if (logger.isTraceEnabled()) {
      logger.trace("Generated stub " + stub + " in " + stub.getParent());
    }
  }
}
