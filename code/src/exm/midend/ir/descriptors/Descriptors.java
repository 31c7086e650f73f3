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

package exm.midend.ir.descriptors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.midend.ir.ClassKind;
import exm.midend.ir.FqName;
import exm.midend.ir.Modality;
import exm.midend.ir.Visibility;

/**
 * Front-end view of declarations from other modules.  Only what is
 * needed to identify a declaration and generate a stub for it is kept.
 *
 * Descriptors are compared by identity.
 */
public class Descriptors {

  public static abstract class DeclarationDescriptor {
    private final DeclarationDescriptor containingDeclaration;
    private final String name;

    protected DeclarationDescriptor(DeclarationDescriptor containingDeclaration,
                                    String name) {
      this.containingDeclaration = containingDeclaration;
      this.name = name;
    }

    /**
     * @return containing declaration, or null for a package fragment
     */
    public DeclarationDescriptor getContainingDeclaration() {
      return containingDeclaration;
    }

    public String getName() {
      return name;
    }

    @Override
    public String toString() {
      return getClass().getSimpleName() + "(" + name + ")";
    }
  }

  public static class PackageFragmentDescriptor extends DeclarationDescriptor {
    private final FqName fqName;

    public PackageFragmentDescriptor(FqName fqName) {
      super(null, fqName.isRoot() ? "<root>" : fqName.shortName());
      this.fqName = fqName;
    }

    public FqName getFqName() {
      return fqName;
    }
  }

  public static class ClassDescriptor extends DeclarationDescriptor {
    private final ClassKind kind;
    private Visibility visibility = Visibility.PUBLIC;
    private Modality modality = Modality.FINAL;
    private boolean isCompanion = false;
    private boolean isInner = false;
    private boolean isData = false;
    private boolean isExternal = false;
    private boolean isInline = false;
    private final List<TypeParameterDescriptor> typeParameters =
                          new ArrayList<TypeParameterDescriptor>();
    private final List<TypeDescriptor> superTypes =
                          new ArrayList<TypeDescriptor>();

    public ClassDescriptor(DeclarationDescriptor containingDeclaration,
                           String name, ClassKind kind) {
      super(containingDeclaration, name);
      this.kind = kind;
    }

    public ClassKind getKind() {
      return kind;
    }

    public FqName getFqName() {
      DeclarationDescriptor container = getContainingDeclaration();
      if (container instanceof PackageFragmentDescriptor) {
        return ((PackageFragmentDescriptor)container).getFqName()
                                                     .child(getName());
      } else if (container instanceof ClassDescriptor) {
        return ((ClassDescriptor)container).getFqName().child(getName());
      } else {
        return null;
      }
    }

    public Visibility getVisibility() {
      return visibility;
    }

    public void setVisibility(Visibility visibility) {
      this.visibility = visibility;
    }

    public Modality getModality() {
      return modality;
    }

    public void setModality(Modality modality) {
      this.modality = modality;
    }

    public boolean isCompanion() {
      return isCompanion;
    }

    public void setCompanion(boolean isCompanion) {
      this.isCompanion = isCompanion;
    }

    public boolean isInner() {
      return isInner;
    }

    public void setInner(boolean isInner) {
      this.isInner = isInner;
    }

    public boolean isData() {
      return isData;
    }

    public void setData(boolean isData) {
      this.isData = isData;
    }

    public boolean isExternal() {
      return isExternal;
    }

    public void setExternal(boolean isExternal) {
      this.isExternal = isExternal;
    }

    public boolean isInline() {
      return isInline;
    }

    public void setInline(boolean isInline) {
      this.isInline = isInline;
    }

    public List<TypeParameterDescriptor> getTypeParameters() {
      return typeParameters;
    }

    public List<TypeDescriptor> getSuperTypes() {
      return superTypes;
    }
  }

  public static enum CallableKind {
    DECLARATION,
    FAKE_OVERRIDE,
    DELEGATION,
    SYNTHESIZED;
  }

  /**
   * Function, constructor or property
   */
  public static abstract class CallableMemberDescriptor
                                    extends DeclarationDescriptor {
    private Visibility visibility = Visibility.PUBLIC;
    private Modality modality = Modality.FINAL;
    private CallableKind kind = CallableKind.DECLARATION;
    private TypeDescriptor returnType;
    private TypeDescriptor dispatchReceiverType = null;
    private TypeDescriptor extensionReceiverType = null;
    private final List<TypeParameterDescriptor> typeParameters =
                                new ArrayList<TypeParameterDescriptor>();
    private final List<ValueParameterDescriptor> valueParameters =
                                new ArrayList<ValueParameterDescriptor>();
    /** Class file holding a top-level member loaded from a library */
    private FqName implClassFqName = null;

    protected CallableMemberDescriptor(
          DeclarationDescriptor containingDeclaration, String name,
          TypeDescriptor returnType) {
      super(containingDeclaration, name);
      this.returnType = returnType;
    }

    public Visibility getVisibility() {
      return visibility;
    }

    public void setVisibility(Visibility visibility) {
      this.visibility = visibility;
    }

    public Modality getModality() {
      return modality;
    }

    public void setModality(Modality modality) {
      this.modality = modality;
    }

    public CallableKind getKind() {
      return kind;
    }

    public void setKind(CallableKind kind) {
      this.kind = kind;
    }

    public TypeDescriptor getReturnType() {
      return returnType;
    }

    public void setReturnType(TypeDescriptor returnType) {
      this.returnType = returnType;
    }

    /**
     * @return type of this in member, or null if not a member
     */
    public TypeDescriptor getDispatchReceiverType() {
      return dispatchReceiverType;
    }

    public void setDispatchReceiverType(TypeDescriptor dispatchReceiverType) {
      this.dispatchReceiverType = dispatchReceiverType;
    }

    public TypeDescriptor getExtensionReceiverType() {
      return extensionReceiverType;
    }

    public void setExtensionReceiverType(TypeDescriptor extensionReceiverType) {
      this.extensionReceiverType = extensionReceiverType;
    }

    public List<TypeParameterDescriptor> getTypeParameters() {
      return typeParameters;
    }

    public List<ValueParameterDescriptor> getValueParameters() {
      return valueParameters;
    }

    public FqName getImplClassFqName() {
      return implClassFqName;
    }

    public void setImplClassFqName(FqName implClassFqName) {
      this.implClassFqName = implClassFqName;
    }
  }

  public static class FunctionDescriptor extends CallableMemberDescriptor {
    private boolean isInline = false;
    private boolean isExternal = false;
    private boolean isTailrec = false;
    private boolean isSuspend = false;

    public FunctionDescriptor(DeclarationDescriptor containingDeclaration,
                              String name, TypeDescriptor returnType) {
      super(containingDeclaration, name, returnType);
    }

    public boolean isInline() {
      return isInline;
    }

    public void setInline(boolean isInline) {
      this.isInline = isInline;
    }

    public boolean isExternal() {
      return isExternal;
    }

    public void setExternal(boolean isExternal) {
      this.isExternal = isExternal;
    }

    public boolean isTailrec() {
      return isTailrec;
    }

    public void setTailrec(boolean isTailrec) {
      this.isTailrec = isTailrec;
    }

    public boolean isSuspend() {
      return isSuspend;
    }

    public void setSuspend(boolean isSuspend) {
      this.isSuspend = isSuspend;
    }
  }

  public static class PropertyAccessorDescriptor extends FunctionDescriptor {
    private final PropertyDescriptor correspondingProperty;
    private final boolean isGetter;

    public PropertyAccessorDescriptor(PropertyDescriptor correspondingProperty,
                                      boolean isGetter) {
      super(correspondingProperty.getContainingDeclaration(),
            (isGetter ? "<get-" : "<set-") + correspondingProperty.getName()
            + ">", isGetter ? correspondingProperty.getReturnType() :
                              TypeDescriptor.UNIT);
      this.correspondingProperty = correspondingProperty;
      this.isGetter = isGetter;
      setVisibility(correspondingProperty.getVisibility());
      setModality(correspondingProperty.getModality());
      setKind(correspondingProperty.getKind());
      setDispatchReceiverType(correspondingProperty.getDispatchReceiverType());
      setExtensionReceiverType(
                  correspondingProperty.getExtensionReceiverType());
      if (!isGetter) {
        getValueParameters().add(new ValueParameterDescriptor(this,
                  "<set-?>", 0, correspondingProperty.getReturnType()));
      }
    }

    public PropertyDescriptor getCorrespondingProperty() {
      return correspondingProperty;
    }

    public boolean isGetter() {
      return isGetter;
    }
  }

  public static class ClassConstructorDescriptor
                                  extends CallableMemberDescriptor {
    private final boolean isPrimary;

    public ClassConstructorDescriptor(ClassDescriptor constructedClass,
                                      boolean isPrimary,
                                      TypeDescriptor returnType) {
      super(constructedClass, "<init>", returnType);
      this.isPrimary = isPrimary;
    }

    public ClassDescriptor getConstructedClass() {
      return (ClassDescriptor)getContainingDeclaration();
    }

    public boolean isPrimary() {
      return isPrimary;
    }
  }

  public static class PropertyDescriptor extends CallableMemberDescriptor {
    private final boolean isVar;
    private boolean isConst = false;
    private boolean isLateinit = false;
    private boolean isDelegated = false;
    private boolean isExternal = false;
    private boolean hasBackingField = true;
    private PropertyAccessorDescriptor getter = null;
    private PropertyAccessorDescriptor setter = null;

    public PropertyDescriptor(DeclarationDescriptor containingDeclaration,
                              String name, TypeDescriptor type,
                              boolean isVar) {
      super(containingDeclaration, name, type);
      this.isVar = isVar;
    }

    /**
     * Create default accessors.  Call after visibility and receivers
     * are set, since the accessors copy them.
     */
    public void createAccessors() {
      getter = new PropertyAccessorDescriptor(this, true);
      if (isVar) {
        setter = new PropertyAccessorDescriptor(this, false);
      }
    }

    public TypeDescriptor getType() {
      return getReturnType();
    }

    public boolean isVar() {
      return isVar;
    }

    public boolean isConst() {
      return isConst;
    }

    public void setConst(boolean isConst) {
      this.isConst = isConst;
    }

    public boolean isLateinit() {
      return isLateinit;
    }

    public void setLateinit(boolean isLateinit) {
      this.isLateinit = isLateinit;
    }

    public boolean isDelegated() {
      return isDelegated;
    }

    public void setDelegated(boolean isDelegated) {
      this.isDelegated = isDelegated;
    }

    public boolean isExternal() {
      return isExternal;
    }

    public void setExternal(boolean isExternal) {
      this.isExternal = isExternal;
    }

    public boolean hasBackingField() {
      return hasBackingField;
    }

    public void setHasBackingField(boolean hasBackingField) {
      this.hasBackingField = hasBackingField;
    }

    public PropertyAccessorDescriptor getGetter() {
      return getter;
    }

    public PropertyAccessorDescriptor getSetter() {
      return setter;
    }
  }

  public static class ValueParameterDescriptor extends DeclarationDescriptor {
    private final int index;
    private final TypeDescriptor type;
    private TypeDescriptor varargElementType = null;
    private boolean declaresDefaultValue = false;
    private boolean isCrossinline = false;
    private boolean isNoinline = false;

    public ValueParameterDescriptor(CallableMemberDescriptor function,
                              String name, int index, TypeDescriptor type) {
      super(function, name);
      this.index = index;
      this.type = type;
    }

    public int getIndex() {
      return index;
    }

    public TypeDescriptor getType() {
      return type;
    }

    public TypeDescriptor getVarargElementType() {
      return varargElementType;
    }

    public void setVarargElementType(TypeDescriptor varargElementType) {
      this.varargElementType = varargElementType;
    }

    public boolean declaresDefaultValue() {
      return declaresDefaultValue;
    }

    public void setDeclaresDefaultValue(boolean declaresDefaultValue) {
      this.declaresDefaultValue = declaresDefaultValue;
    }

    public boolean isCrossinline() {
      return isCrossinline;
    }

    public void setCrossinline(boolean isCrossinline) {
      this.isCrossinline = isCrossinline;
    }

    public boolean isNoinline() {
      return isNoinline;
    }

    public void setNoinline(boolean isNoinline) {
      this.isNoinline = isNoinline;
    }
  }

  public static class TypeParameterDescriptor extends DeclarationDescriptor {
    private final int index;
    private final boolean isReified;
    private final List<TypeDescriptor> upperBounds =
                                        new ArrayList<TypeDescriptor>();

    public TypeParameterDescriptor(DeclarationDescriptor containingDeclaration,
                                   String name, int index, boolean isReified) {
      super(containingDeclaration, name);
      this.index = index;
      this.isReified = isReified;
    }

    public int getIndex() {
      return index;
    }

    public boolean isReified() {
      return isReified;
    }

    public List<TypeDescriptor> getUpperBounds() {
      return upperBounds;
    }
  }

  /**
   * Type as seen by the front end.  The classifier is a class or a
   * type parameter; error types have none.
   */
  public static class TypeDescriptor {
    public static final TypeDescriptor ERROR =
                new TypeDescriptor(null, false,
                                   Collections.<TypeDescriptor>emptyList());
    public static final TypeDescriptor UNIT = builtin("Unit");

    private final DeclarationDescriptor classifier;
    private final boolean nullable;
    private final List<TypeDescriptor> arguments;

    public TypeDescriptor(DeclarationDescriptor classifier, boolean nullable,
                          List<TypeDescriptor> arguments) {
      assert(classifier == null || classifier instanceof ClassDescriptor ||
             classifier instanceof TypeParameterDescriptor);
      this.classifier = classifier;
      this.nullable = nullable;
      this.arguments = new ArrayList<TypeDescriptor>(arguments);
    }

    public static TypeDescriptor of(DeclarationDescriptor classifier) {
      return new TypeDescriptor(classifier, false,
                                Collections.<TypeDescriptor>emptyList());
    }

    /**
     * Type of a class in package kotlin
     */
    public static TypeDescriptor builtin(String name) {
      return of(BuiltIns.getBuiltInClass(name));
    }

    public DeclarationDescriptor getClassifier() {
      return classifier;
    }

    public boolean isNullable() {
      return nullable;
    }

    public boolean isError() {
      return classifier == null;
    }

    public List<TypeDescriptor> getArguments() {
      return Collections.unmodifiableList(arguments);
    }

    public TypeDescriptor makeNullable() {
      return new TypeDescriptor(classifier, true, arguments);
    }

    @Override
    public String toString() {
      if (classifier == null) {
        return "<error>";
      }
      return classifier.getName() + (nullable ? "?" : "");
    }
  }
}
