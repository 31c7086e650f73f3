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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrTypeParameter;
import exm.midend.ir.descriptors.BuiltIns;
import exm.midend.ir.descriptors.Descriptors.ClassDescriptor;
import exm.midend.ir.descriptors.Descriptors.DeclarationDescriptor;

/**
 * Types of IR values.  Types are immutable and may be shared between
 * trees.
 */
public class IrTypes {

  public static abstract class IrType {
    public abstract boolean isNullable();
  }

  /**
   * Class or type parameter type, possibly nullable, with type
   * arguments
   */
  public static class IrSimpleType extends IrType {
    private final IrSymbol<? extends IrSymbolOwner> classifier;
    private final boolean hasQuestionMark;
    private final List<IrType> arguments;

    public IrSimpleType(IrSymbol<? extends IrSymbolOwner> classifier,
                        boolean hasQuestionMark, List<IrType> arguments) {
      assert(classifier.getKind() == IrSymbol.Kind.CLASS ||
             classifier.getKind() == IrSymbol.Kind.TYPE_PARAMETER) :
             classifier;
      this.classifier = classifier;
      this.hasQuestionMark = hasQuestionMark;
      this.arguments = Collections.unmodifiableList(
                                  new ArrayList<IrType>(arguments));
    }

    public IrSimpleType(IrSymbol<? extends IrSymbolOwner> classifier,
                        boolean hasQuestionMark) {
      this(classifier, hasQuestionMark, Collections.<IrType>emptyList());
    }

    public IrSymbol<? extends IrSymbolOwner> getClassifier() {
      return classifier;
    }

    @Override
    public boolean isNullable() {
      return hasQuestionMark;
    }

    public List<IrType> getArguments() {
      return arguments;
    }

    @Override
    public int hashCode() {
      return (System.identityHashCode(classifier) * 31 +
              (hasQuestionMark ? 1 : 0)) * 31 + arguments.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof IrSimpleType))
        return false;
      IrSimpleType other = (IrSimpleType)obj;
      return classifier == other.classifier &&
             hasQuestionMark == other.hasQuestionMark &&
             arguments.equals(other.arguments);
    }

    @Override
    public String toString() {
      String name;
      if (classifier.isBound()) {
        IrSymbolOwner owner = classifier.getOwner();
        name = owner instanceof IrClass ? ((IrClass)owner).getName() :
                                     ((IrTypeParameter)owner).getName();
      } else {
        name = String.valueOf(classifier.getDescriptor());
      }
      return name + (arguments.isEmpty() ? "" : arguments.toString())
                  + (hasQuestionMark ? "?" : "");
    }
  }

  /**
   * Type that front end couldn't resolve
   */
  public static class IrErrorType extends IrType {
    public static final IrErrorType INSTANCE = new IrErrorType();

    private IrErrorType() {
    }

    @Override
    public boolean isNullable() {
      return false;
    }

    @Override
    public String toString() {
      return "<error>";
    }
  }

  public static boolean isError(IrType type) {
    return type instanceof IrErrorType;
  }

  /**
   * @return fully-qualified name of the class of type, or null if
   *      the type is not a class type or the name is not known
   */
  public static FqName classFqName(IrType type) {
    if (!(type instanceof IrSimpleType)) {
      return null;
    }
    IrSymbol<? extends IrSymbolOwner> classifier =
                              ((IrSimpleType)type).getClassifier();
    if (classifier.getKind() != IrSymbol.Kind.CLASS) {
      return null;
    }
    if (classifier.isBound()) {
      return ((IrClass)classifier.getOwner()).fqNameWhenAvailable();
    }
    DeclarationDescriptor descriptor = classifier.getDescriptor();
    if (descriptor instanceof ClassDescriptor) {
      return ((ClassDescriptor)descriptor).getFqName();
    }
    return null;
  }

  /**
   * @return true if type is the non-null built-in class with name
   */
  public static boolean isBuiltIn(IrType type, String name) {
    FqName fqName = classFqName(type);
    return fqName != null && !type.isNullable() &&
        fqName.equals(BuiltIns.BUILT_INS_PACKAGE_NAME.child(name));
  }
}
