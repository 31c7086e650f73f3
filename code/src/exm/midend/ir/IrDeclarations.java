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
import java.util.List;

import exm.midend.ir.IrExpressions.IrBody;
import exm.midend.ir.IrExpressions.IrConstructorCall;
import exm.midend.ir.IrExpressions.IrExpression;
import exm.midend.ir.IrExpressions.IrExpressionBody;
import exm.midend.ir.IrTypes.IrType;

/**
 * Declarations of the IR tree and the package-level containers that
 * hold them.
 *
 * Each declaration binds its symbol on construction.  Parents are set
 * by whoever inserts a declaration into a tree.  Child lists are
 * mutable so that passes can rewrite them.
 */
public class IrDeclarations {

  // --------------------------------------------------------------------
  // Module and package fragments
  // --------------------------------------------------------------------

  public static class IrModuleFragment implements IrDeclarationParent {
    private final String name;
    private final List<IrFile> files = new ArrayList<IrFile>();

    public IrModuleFragment(String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }

    public List<IrFile> getFiles() {
      return files;
    }

    /**
     * Add file to module, and set module as its parent
     */
    public void addFile(IrFile file) {
      files.add(file);
      file.setModule(this);
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitModuleFragment(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      IrTransforms.acceptAll(files, visitor, data);
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      IrTransforms.transformList(files, IrFile.class, transformer, data);
    }

    @Override
    public String toString() {
      return "IrModuleFragment(" + name + ")";
    }
  }

  public static abstract class IrPackageFragment
                implements IrDeclarationContainer, IrSymbolOwner {
    private final FqName fqName;
    private final List<IrDeclaration> declarations =
                                      new ArrayList<IrDeclaration>();

    protected IrPackageFragment(FqName fqName) {
      this.fqName = fqName;
    }

    public FqName getFqName() {
      return fqName;
    }

    @Override
    public List<IrDeclaration> getDeclarations() {
      return declarations;
    }

    /**
     * Add declaration, and set this as its parent
     */
    public void addChild(IrDeclaration declaration) {
      declarations.add(declaration);
      declaration.setParent(this);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      IrTransforms.acceptAll(declarations, visitor, data);
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      IrTransforms.transformList(declarations, IrDeclaration.class,
                                 transformer, data);
    }
  }

  public static class IrFile extends IrPackageFragment {
    private final IrSymbol<IrFile> symbol;
    private final String fileName;
    private final List<IrConstructorCall> annotations =
                                    new ArrayList<IrConstructorCall>();
    private IrModuleFragment module = null;

    /**
     * @param fileName path of source file
     */
    public IrFile(IrSymbol<IrFile> symbol, String fileName, FqName fqName) {
      super(fqName);
      this.symbol = symbol;
      this.fileName = fileName;
      symbol.bind(this);
    }

    @Override
    public IrSymbol<IrFile> getSymbol() {
      return symbol;
    }

    public String getFileName() {
      return fileName;
    }

    public List<IrConstructorCall> getAnnotations() {
      return annotations;
    }

    public IrModuleFragment getModule() {
      return module;
    }

    public void setModule(IrModuleFragment module) {
      this.module = module;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitFile(this, data);
    }

    @Override
    public String toString() {
      return "IrFile(" + fileName + ")";
    }
  }

  /**
   * Package contents coming from outside the module being compiled
   */
  public static class IrExternalPackageFragment extends IrPackageFragment {
    private final IrSymbol<IrExternalPackageFragment> symbol;

    public IrExternalPackageFragment(
            IrSymbol<IrExternalPackageFragment> symbol, FqName fqName) {
      super(fqName);
      this.symbol = symbol;
      symbol.bind(this);
    }

    @Override
    public IrSymbol<IrExternalPackageFragment> getSymbol() {
      return symbol;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitExternalPackageFragment(this, data);
    }

    @Override
    public String toString() {
      return "IrExternalPackageFragment(" + getFqName() + ")";
    }
  }

  // --------------------------------------------------------------------
  // Declarations
  // --------------------------------------------------------------------

  public static abstract class IrDeclaration implements IrStatement,
                                                        IrSymbolOwner {
    private final int startOffset;
    private final int endOffset;
    private IrDeclarationOrigin origin;
    private final String name;
    private IrDeclarationParent parent = null;
    private final List<IrConstructorCall> annotations =
                                      new ArrayList<IrConstructorCall>();

    protected IrDeclaration(int startOffset, int endOffset,
                            IrDeclarationOrigin origin, String name) {
      assert(origin != null);
      this.startOffset = startOffset;
      this.endOffset = endOffset;
      this.origin = origin;
      this.name = name;
    }

    public int getStartOffset() {
      return startOffset;
    }

    public int getEndOffset() {
      return endOffset;
    }

    public IrDeclarationOrigin getOrigin() {
      return origin;
    }

    public void setOrigin(IrDeclarationOrigin origin) {
      this.origin = origin;
    }

    public String getName() {
      return name;
    }

    /**
     * @return parent, or null if not yet inserted into a tree
     */
    public IrDeclarationParent getParent() {
      return parent;
    }

    public void setParent(IrDeclarationParent parent) {
      this.parent = parent;
    }

    public List<IrConstructorCall> getAnnotations() {
      return annotations;
    }

    /**
     * @return fully-qualified name if every parent up to the package
     *        has a name, else null
     */
    public FqName fqNameWhenAvailable() {
      if (parent instanceof IrPackageFragment) {
        return ((IrPackageFragment)parent).getFqName().child(name);
      } else if (parent instanceof IrDeclaration) {
        FqName parentName = ((IrDeclaration)parent).fqNameWhenAvailable();
        return parentName == null ? null : parentName.child(name);
      } else {
        return null;
      }
    }

    @Override
    public String toString() {
      return getClass().getSimpleName() + "(" + name + ")";
    }
  }

  public static class IrClass extends IrDeclaration
            implements IrDeclarationContainer, IrTypeParametersContainer {
    private final IrSymbol<IrClass> symbol;
    private final ClassKind kind;
    private Visibility visibility;
    private final Modality modality;
    private final boolean isCompanion;
    private final boolean isInner;
    private final boolean isData;
    private final boolean isExternal;
    private final boolean isInline;

    private final List<IrDeclaration> declarations =
                                      new ArrayList<IrDeclaration>();
    private final List<IrTypeParameter> typeParameters =
                                      new ArrayList<IrTypeParameter>();
    private final List<IrType> superTypes = new ArrayList<IrType>();
    private IrValueParameter thisReceiver = null;

    public IrClass(int startOffset, int endOffset, IrDeclarationOrigin origin,
                   IrSymbol<IrClass> symbol, String name, ClassKind kind,
                   Visibility visibility, Modality modality,
                   boolean isCompanion, boolean isInner, boolean isData,
                   boolean isExternal, boolean isInline) {
      super(startOffset, endOffset, origin, name);
      this.symbol = symbol;
      this.kind = kind;
      this.visibility = visibility;
      this.modality = modality;
      this.isCompanion = isCompanion;
      this.isInner = isInner;
      this.isData = isData;
      this.isExternal = isExternal;
      this.isInline = isInline;
      symbol.bind(this);
    }

    @Override
    public IrSymbol<IrClass> getSymbol() {
      return symbol;
    }

    public ClassKind getKind() {
      return kind;
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

    public boolean isCompanion() {
      return isCompanion;
    }

    public boolean isInner() {
      return isInner;
    }

    public boolean isData() {
      return isData;
    }

    public boolean isExternal() {
      return isExternal;
    }

    public boolean isInline() {
      return isInline;
    }

    @Override
    public List<IrDeclaration> getDeclarations() {
      return declarations;
    }

    /**
     * Add declaration, and set this as its parent
     */
    public void addChild(IrDeclaration declaration) {
      declarations.add(declaration);
      declaration.setParent(this);
    }

    @Override
    public List<IrTypeParameter> getTypeParameters() {
      return typeParameters;
    }

    public List<IrType> getSuperTypes() {
      return superTypes;
    }

    public IrValueParameter getThisReceiver() {
      return thisReceiver;
    }

    public void setThisReceiver(IrValueParameter thisReceiver) {
      this.thisReceiver = thisReceiver;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitClass(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      IrTransforms.acceptAll(typeParameters, visitor, data);
      IrTransforms.acceptIfPresent(thisReceiver, visitor, data);
      IrTransforms.acceptAll(declarations, visitor, data);
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      IrTransforms.transformList(typeParameters, IrTypeParameter.class,
                                 transformer, data);
      thisReceiver = IrTransforms.transform(thisReceiver,
                            IrValueParameter.class, transformer, data);
      IrTransforms.transformList(declarations, IrDeclaration.class,
                                 transformer, data);
    }
  }

  public static abstract class IrFunction extends IrDeclaration
                              implements IrTypeParametersContainer {
    private Visibility visibility;
    private IrType returnType;
    private final boolean isInline;
    private final boolean isExternal;

    private final List<IrTypeParameter> typeParameters =
                                    new ArrayList<IrTypeParameter>();
    private IrValueParameter dispatchReceiverParameter = null;
    private IrValueParameter extensionReceiverParameter = null;
    private final List<IrValueParameter> valueParameters =
                                    new ArrayList<IrValueParameter>();
    private IrBody body = null;

    protected IrFunction(int startOffset, int endOffset,
                         IrDeclarationOrigin origin, String name,
                         Visibility visibility, IrType returnType,
                         boolean isInline, boolean isExternal) {
      super(startOffset, endOffset, origin, name);
      this.visibility = visibility;
      this.returnType = returnType;
      this.isInline = isInline;
      this.isExternal = isExternal;
    }

    @Override
    public abstract IrSymbol<? extends IrFunction> getSymbol();

    public Visibility getVisibility() {
      return visibility;
    }

    public void setVisibility(Visibility visibility) {
      this.visibility = visibility;
    }

    public IrType getReturnType() {
      return returnType;
    }

    public void setReturnType(IrType returnType) {
      this.returnType = returnType;
    }

    public boolean isInline() {
      return isInline;
    }

    public boolean isExternal() {
      return isExternal;
    }

    @Override
    public List<IrTypeParameter> getTypeParameters() {
      return typeParameters;
    }

    public IrValueParameter getDispatchReceiverParameter() {
      return dispatchReceiverParameter;
    }

    public void setDispatchReceiverParameter(IrValueParameter param) {
      this.dispatchReceiverParameter = param;
    }

    public IrValueParameter getExtensionReceiverParameter() {
      return extensionReceiverParameter;
    }

    public void setExtensionReceiverParameter(IrValueParameter param) {
      this.extensionReceiverParameter = param;
    }

    public List<IrValueParameter> getValueParameters() {
      return valueParameters;
    }

    /**
     * @return body, or null for a declaration without one
     */
    public IrBody getBody() {
      return body;
    }

    public void setBody(IrBody body) {
      this.body = body;
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      IrTransforms.acceptAll(typeParameters, visitor, data);
      IrTransforms.acceptIfPresent(dispatchReceiverParameter, visitor, data);
      IrTransforms.acceptIfPresent(extensionReceiverParameter, visitor, data);
      IrTransforms.acceptAll(valueParameters, visitor, data);
      IrTransforms.acceptIfPresent(body, visitor, data);
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      IrTransforms.transformList(typeParameters, IrTypeParameter.class,
                                 transformer, data);
      dispatchReceiverParameter = IrTransforms.transform(
              dispatchReceiverParameter, IrValueParameter.class,
              transformer, data);
      extensionReceiverParameter = IrTransforms.transform(
              extensionReceiverParameter, IrValueParameter.class,
              transformer, data);
      IrTransforms.transformList(valueParameters, IrValueParameter.class,
                                 transformer, data);
      body = IrTransforms.transform(body, IrBody.class, transformer, data);
    }
  }

  public static class IrSimpleFunction extends IrFunction {
    private final IrSymbol<IrSimpleFunction> symbol;
    private final Modality modality;
    private final boolean isTailrec;
    private final boolean isSuspend;
    private final List<IrSymbol<IrSimpleFunction>> overriddenSymbols =
                                new ArrayList<IrSymbol<IrSimpleFunction>>();
    /** Property this is an accessor of, or null */
    private IrSymbol<IrProperty> correspondingPropertySymbol = null;

    public IrSimpleFunction(int startOffset, int endOffset,
              IrDeclarationOrigin origin, IrSymbol<IrSimpleFunction> symbol,
              String name, Visibility visibility, Modality modality,
              IrType returnType, boolean isInline, boolean isExternal,
              boolean isTailrec, boolean isSuspend) {
      super(startOffset, endOffset, origin, name, visibility, returnType,
            isInline, isExternal);
      this.symbol = symbol;
      this.modality = modality;
      this.isTailrec = isTailrec;
      this.isSuspend = isSuspend;
      symbol.bind(this);
    }

    @Override
    public IrSymbol<IrSimpleFunction> getSymbol() {
      return symbol;
    }

    public Modality getModality() {
      return modality;
    }

    public boolean isTailrec() {
      return isTailrec;
    }

    public boolean isSuspend() {
      return isSuspend;
    }

    public List<IrSymbol<IrSimpleFunction>> getOverriddenSymbols() {
      return overriddenSymbols;
    }

    public IrSymbol<IrProperty> getCorrespondingPropertySymbol() {
      return correspondingPropertySymbol;
    }

    public void setCorrespondingPropertySymbol(
                            IrSymbol<IrProperty> correspondingPropertySymbol) {
      this.correspondingPropertySymbol = correspondingPropertySymbol;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitSimpleFunction(this, data);
    }
  }

  public static class IrConstructor extends IrFunction {
    private final IrSymbol<IrConstructor> symbol;
    private final boolean isPrimary;

    public IrConstructor(int startOffset, int endOffset,
              IrDeclarationOrigin origin, IrSymbol<IrConstructor> symbol,
              String name, Visibility visibility, IrType returnType,
              boolean isInline, boolean isExternal, boolean isPrimary) {
      super(startOffset, endOffset, origin, name, visibility, returnType,
            isInline, isExternal);
      this.symbol = symbol;
      this.isPrimary = isPrimary;
      symbol.bind(this);
    }

    @Override
    public IrSymbol<IrConstructor> getSymbol() {
      return symbol;
    }

    public boolean isPrimary() {
      return isPrimary;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitConstructor(this, data);
    }
  }

  /**
   * Property with its accessors and backing field.  The accessors and
   * field are children of the property, not of the enclosing container.
   */
  public static class IrProperty extends IrDeclaration {
    private final IrSymbol<IrProperty> symbol;
    private final Visibility visibility;
    private final Modality modality;
    private final boolean isVar;
    private final boolean isConst;
    private final boolean isLateinit;
    private final boolean isDelegated;
    private final boolean isExternal;

    private IrSimpleFunction getter = null;
    private IrSimpleFunction setter = null;
    private IrField backingField = null;

    public IrProperty(int startOffset, int endOffset,
              IrDeclarationOrigin origin, IrSymbol<IrProperty> symbol,
              String name, Visibility visibility, Modality modality,
              boolean isVar, boolean isConst, boolean isLateinit,
              boolean isDelegated, boolean isExternal) {
      super(startOffset, endOffset, origin, name);
      this.symbol = symbol;
      this.visibility = visibility;
      this.modality = modality;
      this.isVar = isVar;
      this.isConst = isConst;
      this.isLateinit = isLateinit;
      this.isDelegated = isDelegated;
      this.isExternal = isExternal;
      symbol.bind(this);
    }

    @Override
    public IrSymbol<IrProperty> getSymbol() {
      return symbol;
    }

    public Visibility getVisibility() {
      return visibility;
    }

    public Modality getModality() {
      return modality;
    }

    public boolean isVar() {
      return isVar;
    }

    public boolean isConst() {
      return isConst;
    }

    public boolean isLateinit() {
      return isLateinit;
    }

    public boolean isDelegated() {
      return isDelegated;
    }

    public boolean isExternal() {
      return isExternal;
    }

    public IrSimpleFunction getGetter() {
      return getter;
    }

    public void setGetter(IrSimpleFunction getter) {
      this.getter = getter;
    }

    public IrSimpleFunction getSetter() {
      return setter;
    }

    public void setSetter(IrSimpleFunction setter) {
      this.setter = setter;
    }

    public IrField getBackingField() {
      return backingField;
    }

    public void setBackingField(IrField backingField) {
      this.backingField = backingField;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitProperty(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      IrTransforms.acceptIfPresent(backingField, visitor, data);
      IrTransforms.acceptIfPresent(getter, visitor, data);
      IrTransforms.acceptIfPresent(setter, visitor, data);
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      backingField = IrTransforms.transform(backingField, IrField.class,
                                            transformer, data);
      getter = IrTransforms.transform(getter, IrSimpleFunction.class,
                                      transformer, data);
      setter = IrTransforms.transform(setter, IrSimpleFunction.class,
                                      transformer, data);
    }
  }

  public static class IrField extends IrDeclaration {
    private final IrSymbol<IrField> symbol;
    private final IrType type;
    private final Visibility visibility;
    private final boolean isFinal;
    private final boolean isExternal;
    private final boolean isStatic;
    private IrExpressionBody initializer = null;
    private final List<IrSymbol<IrField>> overriddenSymbols =
                                    new ArrayList<IrSymbol<IrField>>();
    private IrSymbol<IrProperty> correspondingPropertySymbol = null;

    public IrField(int startOffset, int endOffset,
              IrDeclarationOrigin origin, IrSymbol<IrField> symbol,
              String name, IrType type, Visibility visibility,
              boolean isFinal, boolean isExternal, boolean isStatic) {
      super(startOffset, endOffset, origin, name);
      this.symbol = symbol;
      this.type = type;
      this.visibility = visibility;
      this.isFinal = isFinal;
      this.isExternal = isExternal;
      this.isStatic = isStatic;
      symbol.bind(this);
    }

    @Override
    public IrSymbol<IrField> getSymbol() {
      return symbol;
    }

    public IrType getType() {
      return type;
    }

    public Visibility getVisibility() {
      return visibility;
    }

    public boolean isFinal() {
      return isFinal;
    }

    public boolean isExternal() {
      return isExternal;
    }

    public boolean isStatic() {
      return isStatic;
    }

    public IrExpressionBody getInitializer() {
      return initializer;
    }

    public void setInitializer(IrExpressionBody initializer) {
      this.initializer = initializer;
    }

    public List<IrSymbol<IrField>> getOverriddenSymbols() {
      return overriddenSymbols;
    }

    public IrSymbol<IrProperty> getCorrespondingPropertySymbol() {
      return correspondingPropertySymbol;
    }

    public void setCorrespondingPropertySymbol(
                          IrSymbol<IrProperty> correspondingPropertySymbol) {
      this.correspondingPropertySymbol = correspondingPropertySymbol;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitField(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      IrTransforms.acceptIfPresent(initializer, visitor, data);
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      initializer = IrTransforms.transform(initializer,
                              IrExpressionBody.class, transformer, data);
    }
  }

  public static class IrEnumEntry extends IrDeclaration {
    private final IrSymbol<IrEnumEntry> symbol;

    public IrEnumEntry(int startOffset, int endOffset,
                       IrDeclarationOrigin origin,
                       IrSymbol<IrEnumEntry> symbol, String name) {
      super(startOffset, endOffset, origin, name);
      this.symbol = symbol;
      symbol.bind(this);
    }

    @Override
    public IrSymbol<IrEnumEntry> getSymbol() {
      return symbol;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitEnumEntry(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      // No children
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      // No children
    }
  }

  /**
   * Declaration whose value can be read with IrGetValue
   */
  public static abstract class IrValueDeclaration extends IrDeclaration {
    protected IrValueDeclaration(int startOffset, int endOffset,
                                 IrDeclarationOrigin origin, String name) {
      super(startOffset, endOffset, origin, name);
    }

    @Override
    public abstract IrSymbol<? extends IrValueDeclaration> getSymbol();

    public abstract IrType getType();
  }

  public static class IrValueParameter extends IrValueDeclaration {
    private final IrSymbol<IrValueParameter> symbol;
    /** Position in value parameter list, -1 for receivers */
    private final int index;
    private final IrType type;
    private final IrType varargElementType;
    private final boolean isCrossinline;
    private final boolean isNoinline;
    private IrExpressionBody defaultValue = null;

    public IrValueParameter(int startOffset, int endOffset,
              IrDeclarationOrigin origin, IrSymbol<IrValueParameter> symbol,
              String name, int index, IrType type, IrType varargElementType,
              boolean isCrossinline, boolean isNoinline) {
      super(startOffset, endOffset, origin, name);
      this.symbol = symbol;
      this.index = index;
      this.type = type;
      this.varargElementType = varargElementType;
      this.isCrossinline = isCrossinline;
      this.isNoinline = isNoinline;
      symbol.bind(this);
    }

    @Override
    public IrSymbol<IrValueParameter> getSymbol() {
      return symbol;
    }

    public int getIndex() {
      return index;
    }

    @Override
    public IrType getType() {
      return type;
    }

    public IrType getVarargElementType() {
      return varargElementType;
    }

    public boolean isCrossinline() {
      return isCrossinline;
    }

    public boolean isNoinline() {
      return isNoinline;
    }

    public IrExpressionBody getDefaultValue() {
      return defaultValue;
    }

    public void setDefaultValue(IrExpressionBody defaultValue) {
      this.defaultValue = defaultValue;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitValueParameter(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      IrTransforms.acceptIfPresent(defaultValue, visitor, data);
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      defaultValue = IrTransforms.transform(defaultValue,
                              IrExpressionBody.class, transformer, data);
    }
  }

  public static class IrTypeParameter extends IrDeclaration {
    private final IrSymbol<IrTypeParameter> symbol;
    private final int index;
    private final boolean isReified;
    private final List<IrType> superTypes = new ArrayList<IrType>();

    public IrTypeParameter(int startOffset, int endOffset,
              IrDeclarationOrigin origin, IrSymbol<IrTypeParameter> symbol,
              String name, int index, boolean isReified) {
      super(startOffset, endOffset, origin, name);
      this.symbol = symbol;
      this.index = index;
      this.isReified = isReified;
      symbol.bind(this);
    }

    @Override
    public IrSymbol<IrTypeParameter> getSymbol() {
      return symbol;
    }

    public int getIndex() {
      return index;
    }

    public boolean isReified() {
      return isReified;
    }

    public List<IrType> getSuperTypes() {
      return superTypes;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitTypeParameter(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      // No children
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      // No children
    }
  }

  /**
   * Local variable in a function body
   */
  public static class IrVariable extends IrValueDeclaration {
    private final IrSymbol<IrVariable> symbol;
    private final IrType type;
    private final boolean isVar;
    private IrExpression initializer = null;

    public IrVariable(int startOffset, int endOffset,
              IrDeclarationOrigin origin, IrSymbol<IrVariable> symbol,
              String name, IrType type, boolean isVar) {
      super(startOffset, endOffset, origin, name);
      this.symbol = symbol;
      this.type = type;
      this.isVar = isVar;
      symbol.bind(this);
    }

    @Override
    public IrSymbol<IrVariable> getSymbol() {
      return symbol;
    }

    @Override
    public IrType getType() {
      return type;
    }

    public boolean isVar() {
      return isVar;
    }

    public IrExpression getInitializer() {
      return initializer;
    }

    public void setInitializer(IrExpression initializer) {
      this.initializer = initializer;
    }

    @Override
    public <R, D> R accept(IrElementVisitor<R, D> visitor, D data) {
      return visitor.visitVariable(this, data);
    }

    @Override
    public <D> void acceptChildren(IrElementVisitor<?, D> visitor, D data) {
      IrTransforms.acceptIfPresent(initializer, visitor, data);
    }

    @Override
    public <D> void transformChildren(IrElementTransformer<D> transformer,
                                      D data) {
      initializer = IrTransforms.transform(initializer, IrExpression.class,
                                           transformer, data);
    }
  }
}
