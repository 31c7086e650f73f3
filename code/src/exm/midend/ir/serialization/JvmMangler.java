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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import exm.midend.common.exceptions.UnresolvedIdentityError;
import exm.midend.common.exceptions.UnsupportedInputError;
import exm.midend.ir.FqName;
import exm.midend.ir.IrDeclarationParent;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.IrSymbolOwner;
import exm.midend.ir.IrTypes;
import exm.midend.ir.Visibility;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrConstructor;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrEnumEntry;
import exm.midend.ir.IrDeclarations.IrField;
import exm.midend.ir.IrDeclarations.IrFunction;
import exm.midend.ir.IrDeclarations.IrPackageFragment;
import exm.midend.ir.IrDeclarations.IrProperty;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrDeclarations.IrTypeParameter;
import exm.midend.ir.IrDeclarations.IrValueParameter;
import exm.midend.ir.IrTypes.IrSimpleType;
import exm.midend.ir.IrTypes.IrType;

/**
 * Mangling scheme for JVM units.  Functions are mangled with their
 * parameter types so that overloads get distinct names.
 */
public class JvmMangler implements IrMangler {
  public static final JvmMangler INSTANCE = new JvmMangler();

  private static final HashFunction HASH = Hashing.murmur3_128();

  private JvmMangler() {
  }

  @Override
  public boolean isExported(IrDeclaration declaration) {
    Visibility visibility;
    if (declaration instanceof IrClass) {
      visibility = ((IrClass)declaration).getVisibility();
    } else if (declaration instanceof IrFunction) {
      visibility = ((IrFunction)declaration).getVisibility();
    } else if (declaration instanceof IrProperty) {
      visibility = ((IrProperty)declaration).getVisibility();
    } else if (declaration instanceof IrField) {
      visibility = ((IrField)declaration).getVisibility();
    } else if (declaration instanceof IrEnumEntry) {
      visibility = Visibility.PUBLIC;
    } else {
      // Parameters, type parameters and local variables
      return false;
    }
    if (!visibility.isExternallyVisible()) {
      return false;
    }

    IrDeclarationParent parent = declaration.getParent();
    if (parent instanceof IrPackageFragment) {
      return true;
    } else if (parent instanceof IrClass) {
      return isExported((IrClass)parent);
    } else {
      // Local to a function, or not in a tree
      return false;
    }
  }

  @Override
  public String mangledName(IrDeclaration declaration) {
    if (declaration instanceof IrClass) {
      return "kclass:" + fqName(declaration);
    } else if (declaration instanceof IrConstructor) {
      return "kctor:" + fqName(declaration) +
             signature((IrFunction)declaration);
    } else if (declaration instanceof IrSimpleFunction) {
      return "kfun:" + fqName(declaration) +
             signature((IrFunction)declaration);
    } else if (declaration instanceof IrProperty) {
      IrProperty property = (IrProperty)declaration;
      String receiver = "";
      if (property.getGetter() != null &&
          property.getGetter().getExtensionReceiverParameter() != null) {
        receiver = "@" + typeString(property.getGetter()
                        .getExtensionReceiverParameter().getType());
      }
      return "kprop:" + fqName(declaration) + receiver;
    } else if (declaration instanceof IrField) {
      return "kfield:" + fqName(declaration);
    } else if (declaration instanceof IrEnumEntry) {
      return "kenumentry:" + fqName(declaration);
    } else {
      throw new UnsupportedInputError("No mangling rule for " + declaration);
    }
  }

  @Override
  public long hashedMangle(IrDeclaration declaration) {
    return HASH.hashString(mangledName(declaration), StandardCharsets.UTF_8)
               .asLong();
  }

  private static String fqName(IrDeclaration declaration) {
    FqName fqName = declaration.fqNameWhenAvailable();
    if (fqName == null) {
      throw new UnresolvedIdentityError("No fully-qualified name for " +
            declaration + ", parent " + declaration.getParent());
    }
    return fqName.asString();
  }

  private static String signature(IrFunction function) {
    StringBuilder sb = new StringBuilder();
    if (!function.getTypeParameters().isEmpty()) {
      List<String> names = new ArrayList<String>();
      for (IrTypeParameter tp: function.getTypeParameters()) {
        names.add(tp.getName());
      }
      sb.append('<').append(StringUtils.join(names, ',')).append('>');
    }
    sb.append('(');
    List<String> params = new ArrayList<String>();
    if (function.getExtensionReceiverParameter() != null) {
      params.add("@" + typeString(
              function.getExtensionReceiverParameter().getType()));
    }
    for (IrValueParameter param: function.getValueParameters()) {
      params.add(typeString(param.getType()) +
                 (param.getVarargElementType() != null ? "..." : ""));
    }
    sb.append(StringUtils.join(params, ';'));
    sb.append(')');
    return sb.toString();
  }

  private static String typeString(IrType type) {
    if (!(type instanceof IrSimpleType)) {
      return "<error>";
    }
    IrSimpleType simple = (IrSimpleType)type;
    IrSymbol<? extends IrSymbolOwner> classifier = simple.getClassifier();
    String name;
    if (classifier.getKind() == IrSymbol.Kind.TYPE_PARAMETER) {
      name = classifier.isBound() ?
             "#" + ((IrTypeParameter)classifier.getOwner()).getName() :
             "#" + classifier.getDescriptor().getName();
    } else {
      FqName fqName = IrTypes.classFqName(type);
      name = fqName != null ? fqName.asString() : "<anonymous>";
    }
    StringBuilder sb = new StringBuilder(name);
    if (!simple.getArguments().isEmpty()) {
      List<String> args = new ArrayList<String>();
      for (IrType arg: simple.getArguments()) {
        args.add(typeString(arg));
      }
      sb.append('<').append(StringUtils.join(args, ',')).append('>');
    }
    if (simple.isNullable()) {
      sb.append('?');
    }
    return sb.toString();
  }
}
