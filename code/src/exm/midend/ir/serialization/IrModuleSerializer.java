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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.common.exceptions.UnresolvedIdentityError;
import exm.midend.common.exceptions.UnsupportedInputError;
import exm.midend.ir.IrElement;
import exm.midend.ir.IrElementVisitor;
import exm.midend.ir.IrStatement;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.IrSymbolOwner;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrConstructor;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrEnumEntry;
import exm.midend.ir.IrDeclarations.IrField;
import exm.midend.ir.IrDeclarations.IrFunction;
import exm.midend.ir.IrDeclarations.IrProperty;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrDeclarations.IrTypeParameter;
import exm.midend.ir.IrDeclarations.IrValueParameter;
import exm.midend.ir.IrDeclarations.IrVariable;
import exm.midend.ir.IrExpressions.IrBlockBody;
import exm.midend.ir.IrExpressions.IrBody;
import exm.midend.ir.IrExpressions.IrCall;
import exm.midend.ir.IrExpressions.IrClassReference;
import exm.midend.ir.IrExpressions.IrConst;
import exm.midend.ir.IrExpressions.IrConstructorCall;
import exm.midend.ir.IrExpressions.IrExpression;
import exm.midend.ir.IrExpressions.IrExpressionBody;
import exm.midend.ir.IrExpressions.IrFunctionReference;
import exm.midend.ir.IrExpressions.IrGetEnumValue;
import exm.midend.ir.IrExpressions.IrGetField;
import exm.midend.ir.IrExpressions.IrGetValue;
import exm.midend.ir.IrExpressions.IrMemberAccessExpression;
import exm.midend.ir.IrExpressions.IrPropertyReference;
import exm.midend.ir.IrExpressions.IrReturn;
import exm.midend.ir.IrTypes.IrSimpleType;
import exm.midend.ir.IrTypes.IrType;
import exm.midend.ir.serialization.JvmIr.Body;
import exm.midend.ir.serialization.JvmIr.Declaration;
import exm.midend.ir.serialization.JvmIr.DeclarationContainer;
import exm.midend.ir.serialization.JvmIr.Expression;
import exm.midend.ir.serialization.JvmIr.Statement;
import exm.midend.ir.serialization.JvmIr.Symbol;
import exm.midend.ir.serialization.JvmIr.Type;

/**
 * Serializes declarations, bodies and expressions of one unit into
 * wire records, interning strings, symbols and types into tables as it
 * goes.  Subclasses emit the tables.
 *
 * Once the string table is frozen, interning a new string is an error.
 */
public class IrModuleSerializer {
  protected final Logger logger;
  protected final DeclarationTable declarationTable;

  private final List<String> protoStringArray = new ArrayList<String>();
  private final Map<String, Integer> protoStringMap =
                                          new HashMap<String, Integer>();
  private boolean stringTableFrozen = false;

  private final List<Symbol> protoSymbolArray = new ArrayList<Symbol>();
  /** Symbols are compared by identity */
  private final Map<IrSymbol<?>, Integer> protoSymbolMap =
                                      new HashMap<IrSymbol<?>, Integer>();

  private final List<Type> protoTypeArray = new ArrayList<Type>();
  private final Map<IrType, Integer> protoTypeMap =
                                      new HashMap<IrType, Integer>();

  public IrModuleSerializer(Logger logger,
                            DeclarationTable declarationTable) {
    this.logger = logger;
    this.declarationTable = declarationTable;
  }

  // --------------------------------------------------------------------
  // Tables
  // --------------------------------------------------------------------

  public int serializeString(String value) {
    Integer index = protoStringMap.get(value);
    if (index != null) {
      return index;
    }
    if (stringTableFrozen) {
      throw new StructuralInvariantError("String table frozen, can't add \""
                                         + value + "\"");
    }
    index = protoStringArray.size();
    protoStringArray.add(value);
    protoStringMap.put(value, index);
    return index;
  }

  /**
   * Freeze the string table and return its contents
   */
  protected List<String> freezeStringTable() {
    stringTableFrozen = true;
    return new ArrayList<String>(protoStringArray);
  }

  public boolean isStringTableFrozen() {
    return stringTableFrozen;
  }

  protected List<Symbol> getSymbolTable() {
    return new ArrayList<Symbol>(protoSymbolArray);
  }

  protected List<Type> getTypeTable() {
    return new ArrayList<Type>(protoTypeArray);
  }

  public int serializeIrSymbol(IrSymbol<?> symbol) {
    Integer index = protoSymbolMap.get(symbol);
    if (index != null) {
      return index;
    }
    if (!symbol.isBound()) {
      throw new UnresolvedIdentityError("Can't serialize unbound symbol "
                                        + symbol);
    }
    IrSymbolOwner owner = symbol.getOwner();
    if (!(owner instanceof IrDeclaration)) {
      throw new UnsupportedInputError("Can't serialize symbol of " + owner);
    }
    UniqId id = declarationTable.uniqIdByDeclaration((IrDeclaration)owner);
    index = protoSymbolArray.size();
    protoSymbolArray.add(new Symbol(symbol.getKind().name(), id.getIndex(),
                                    id.isLocal()));
    protoSymbolMap.put(symbol, index);
    return index;
  }

  /**
   * @return index in type table, or NO_INDEX for null
   */
  public int serializeIrType(IrType type) {
    if (type == null) {
      return JvmIr.NO_INDEX;
    }
    Integer index = protoTypeMap.get(type);
    if (index != null) {
      return index;
    }
    Type proto = new Type();
    if (type instanceof IrSimpleType) {
      IrSimpleType simple = (IrSimpleType)type;
      proto.kind = "SIMPLE";
      proto.classifier = serializeIrSymbol(simple.getClassifier());
      proto.nullable = simple.isNullable();
      for (IrType arg: simple.getArguments()) {
        proto.arguments.add(serializeIrType(arg));
      }
    } else {
      proto.kind = "ERROR";
    }
    index = protoTypeArray.size();
    protoTypeArray.add(proto);
    protoTypeMap.put(type, index);
    return index;
  }

  private List<Integer> serializeTypes(List<IrType> types) {
    List<Integer> result = new ArrayList<Integer>(types.size());
    for (IrType type: types) {
      result.add(serializeIrType(type));
    }
    return result;
  }

  // --------------------------------------------------------------------
  // Declarations
  // --------------------------------------------------------------------

  public DeclarationContainer serializeIrDeclarationContainer(
                          List<? extends IrDeclaration> declarations) {
    DeclarationContainer proto = new DeclarationContainer();
    for (IrDeclaration declaration: declarations) {
      proto.declarations.add(serializeDeclaration(declaration));
    }
    return proto;
  }

  public List<Expression> serializeAnnotations(
                              List<IrConstructorCall> annotations) {
    List<Expression> result = new ArrayList<Expression>(annotations.size());
    for (IrConstructorCall annotation: annotations) {
      result.add(serializeExpression(annotation));
    }
    return result;
  }

  public Declaration serializeIrClass(IrClass cls) {
    return serializeDeclaration(cls);
  }

  public Declaration serializeDeclaration(IrDeclaration declaration) {
    Declaration proto = new Declaration();
    proto.symbol = serializeIrSymbol(declaration.getSymbol());
    proto.name = serializeString(declaration.getName());
    proto.origin = serializeString(declaration.getOrigin().getName());
    proto.startOffset = declaration.getStartOffset();
    proto.endOffset = declaration.getEndOffset();
    proto.annotations = serializeAnnotations(declaration.getAnnotations());

    if (declaration instanceof IrClass) {
      serializeClassFields((IrClass)declaration, proto);
    } else if (declaration instanceof IrFunction) {
      serializeFunctionFields((IrFunction)declaration, proto);
    } else if (declaration instanceof IrProperty) {
      serializePropertyFields((IrProperty)declaration, proto);
    } else if (declaration instanceof IrField) {
      serializeFieldFields((IrField)declaration, proto);
    } else if (declaration instanceof IrEnumEntry) {
      proto.kind = "ENUM_ENTRY";
    } else if (declaration instanceof IrValueParameter) {
      IrValueParameter param = (IrValueParameter)declaration;
      proto.kind = "VALUE_PARAMETER";
      proto.index = param.getIndex();
      proto.type = serializeIrType(param.getType());
      proto.varargElementType = serializeIrType(param.getVarargElementType());
      addFlag(proto, param.isCrossinline(), "crossinline");
      addFlag(proto, param.isNoinline(), "noinline");
      if (param.getDefaultValue() != null) {
        proto.defaultValue = serializeExpression(
                                param.getDefaultValue().getExpression());
      }
    } else if (declaration instanceof IrTypeParameter) {
      IrTypeParameter tp = (IrTypeParameter)declaration;
      proto.kind = "TYPE_PARAMETER";
      proto.index = tp.getIndex();
      addFlag(proto, tp.isReified(), "reified");
      proto.superTypes = serializeTypes(tp.getSuperTypes());
    } else if (declaration instanceof IrVariable) {
      IrVariable var = (IrVariable)declaration;
      proto.kind = "VARIABLE";
      proto.type = serializeIrType(var.getType());
      addFlag(proto, var.isVar(), "var");
      if (var.getInitializer() != null) {
        proto.initializer = serializeExpression(var.getInitializer());
      }
    } else {
      throw new UnsupportedInputError("No serialization rule for " +
                                      declaration);
    }
    return proto;
  }

  private void serializeClassFields(IrClass cls, Declaration proto) {
    proto.kind = "CLASS";
    proto.classKind = cls.getKind().name();
    proto.visibility = cls.getVisibility().name();
    proto.modality = cls.getModality().name();
    addFlag(proto, cls.isCompanion(), "companion");
    addFlag(proto, cls.isInner(), "inner");
    addFlag(proto, cls.isData(), "data");
    addFlag(proto, cls.isExternal(), "external");
    addFlag(proto, cls.isInline(), "inline");
    proto.typeParameters = serializeDeclarations(cls.getTypeParameters());
    proto.superTypes = serializeTypes(cls.getSuperTypes());
    if (cls.getThisReceiver() != null) {
      proto.thisReceiver = serializeDeclaration(cls.getThisReceiver());
    }
    proto.declarationContainer =
            serializeIrDeclarationContainer(cls.getDeclarations());
  }

  private void serializeFunctionFields(IrFunction fn, Declaration proto) {
    proto.visibility = fn.getVisibility().name();
    proto.type = serializeIrType(fn.getReturnType());
    addFlag(proto, fn.isInline(), "inline");
    addFlag(proto, fn.isExternal(), "external");
    if (fn instanceof IrSimpleFunction) {
      IrSimpleFunction simple = (IrSimpleFunction)fn;
      proto.kind = "SIMPLE_FUNCTION";
      proto.modality = simple.getModality().name();
      addFlag(proto, simple.isTailrec(), "tailrec");
      addFlag(proto, simple.isSuspend(), "suspend");
      proto.overridden = new ArrayList<Integer>();
      for (IrSymbol<IrSimpleFunction> overridden:
                                        simple.getOverriddenSymbols()) {
        proto.overridden.add(serializeIrSymbol(overridden));
      }
      if (simple.getCorrespondingPropertySymbol() != null) {
        proto.correspondingProperty =
                serializeIrSymbol(simple.getCorrespondingPropertySymbol());
      }
    } else {
      proto.kind = "CONSTRUCTOR";
      addFlag(proto, ((IrConstructor)fn).isPrimary(), "primary");
    }
    proto.typeParameters = serializeDeclarations(fn.getTypeParameters());
    if (fn.getDispatchReceiverParameter() != null) {
      proto.dispatchReceiverParameter =
              serializeDeclaration(fn.getDispatchReceiverParameter());
    }
    if (fn.getExtensionReceiverParameter() != null) {
      proto.extensionReceiverParameter =
              serializeDeclaration(fn.getExtensionReceiverParameter());
    }
    proto.valueParameters = serializeDeclarations(fn.getValueParameters());
    if (fn.getBody() != null) {
      proto.body = serializeBody(fn.getBody());
    }
  }

  private void serializePropertyFields(IrProperty prop, Declaration proto) {
    proto.kind = "PROPERTY";
    proto.visibility = prop.getVisibility().name();
    proto.modality = prop.getModality().name();
    addFlag(proto, prop.isVar(), "var");
    addFlag(proto, prop.isConst(), "const");
    addFlag(proto, prop.isLateinit(), "lateinit");
    addFlag(proto, prop.isDelegated(), "delegated");
    addFlag(proto, prop.isExternal(), "external");
    if (prop.getGetter() != null) {
      proto.getter = serializeDeclaration(prop.getGetter());
    }
    if (prop.getSetter() != null) {
      proto.setter = serializeDeclaration(prop.getSetter());
    }
    if (prop.getBackingField() != null) {
      proto.backingField = serializeDeclaration(prop.getBackingField());
    }
  }

  private void serializeFieldFields(IrField field, Declaration proto) {
    proto.kind = "FIELD";
    proto.visibility = field.getVisibility().name();
    proto.type = serializeIrType(field.getType());
    addFlag(proto, field.isFinal(), "final");
    addFlag(proto, field.isExternal(), "external");
    addFlag(proto, field.isStatic(), "static");
    proto.overridden = new ArrayList<Integer>();
    for (IrSymbol<IrField> overridden: field.getOverriddenSymbols()) {
      proto.overridden.add(serializeIrSymbol(overridden));
    }
    if (field.getCorrespondingPropertySymbol() != null) {
      proto.correspondingProperty =
              serializeIrSymbol(field.getCorrespondingPropertySymbol());
    }
    if (field.getInitializer() != null) {
      proto.initializer = serializeExpression(
                              field.getInitializer().getExpression());
    }
  }

  private List<Declaration> serializeDeclarations(
                          List<? extends IrDeclaration> declarations) {
    List<Declaration> result = new ArrayList<Declaration>();
    for (IrDeclaration declaration: declarations) {
      result.add(serializeDeclaration(declaration));
    }
    return result;
  }

  private static void addFlag(Declaration proto, boolean set, String flag) {
    if (set) {
      proto.flags.add(flag);
    }
  }

  // --------------------------------------------------------------------
  // Bodies and expressions
  // --------------------------------------------------------------------

  public Body serializeBody(IrBody body) {
    Body proto = new Body();
    if (body instanceof IrBlockBody) {
      proto.statements = new ArrayList<Statement>();
      for (IrStatement stmt: ((IrBlockBody)body).getStatements()) {
        proto.statements.add(serializeStatement(stmt));
      }
    } else if (body instanceof IrExpressionBody) {
      proto.expression = serializeExpression(
                              ((IrExpressionBody)body).getExpression());
    } else {
      throw new UnsupportedInputError("No serialization rule for " + body);
    }
    return proto;
  }

  public Statement serializeStatement(IrStatement statement) {
    Statement proto = new Statement();
    if (statement instanceof IrDeclaration) {
      proto.declaration = serializeDeclaration((IrDeclaration)statement);
    } else if (statement instanceof IrExpression) {
      proto.expression = serializeExpression((IrExpression)statement);
    } else {
      throw new UnsupportedInputError("No serialization rule for "
                                      + statement);
    }
    return proto;
  }

  /**
   * @return serialized expression, or null for null
   */
  public Expression serializeExpression(IrExpression expression) {
    if (expression == null) {
      return null;
    }
    Expression proto = new Expression();
    proto.type = serializeIrType(expression.getType());
    proto.startOffset = expression.getStartOffset();
    proto.endOffset = expression.getEndOffset();
    expression.accept(expressionSerializer, proto);
    return proto;
  }

  private void serializeMemberAccess(IrMemberAccessExpression expr,
                                     Expression proto) {
    proto.symbol = serializeIrSymbol(expr.getSymbol());
    proto.dispatchReceiver = serializeExpression(expr.getDispatchReceiver());
    proto.extensionReceiver =
                    serializeExpression(expr.getExtensionReceiver());
    proto.valueArguments = new ArrayList<Expression>();
    for (int i = 0; i < expr.getValueArgumentsCount(); i++) {
      proto.valueArguments.add(serializeExpression(expr.getValueArgument(i)));
    }
    proto.typeArguments = new ArrayList<Integer>();
    for (int i = 0; i < expr.getTypeArgumentsCount(); i++) {
      proto.typeArguments.add(serializeIrType(expr.getTypeArgument(i)));
    }
  }

  private final IrElementVisitor<Void, Expression> expressionSerializer =
                              new IrElementVisitor<Void, Expression>() {
    @Override
    public Void visitElement(IrElement element, Expression proto) {
      throw new UnsupportedInputError("No serialization rule for "
                                      + element);
    }

    @Override
    public Void visitCall(IrCall expr, Expression proto) {
      proto.kind = "CALL";
      serializeMemberAccess(expr, proto);
      if (expr.getSuperQualifierSymbol() != null) {
        proto.superQualifier =
                      serializeIrSymbol(expr.getSuperQualifierSymbol());
      }
      return null;
    }

    @Override
    public Void visitConstructorCall(IrConstructorCall expr,
                                     Expression proto) {
      proto.kind = "CONSTRUCTOR_CALL";
      serializeMemberAccess(expr, proto);
      return null;
    }

    @Override
    public Void visitFunctionReference(IrFunctionReference expr,
                                       Expression proto) {
      proto.kind = "FUNCTION_REFERENCE";
      serializeMemberAccess(expr, proto);
      return null;
    }

    @Override
    public Void visitPropertyReference(IrPropertyReference expr,
                                       Expression proto) {
      proto.kind = "PROPERTY_REFERENCE";
      serializeMemberAccess(expr, proto);
      if (expr.getField() != null) {
        proto.field = serializeIrSymbol(expr.getField());
      }
      if (expr.getGetter() != null) {
        proto.getter = serializeIrSymbol(expr.getGetter());
      }
      if (expr.getSetter() != null) {
        proto.setter = serializeIrSymbol(expr.getSetter());
      }
      return null;
    }

    @Override
    public Void visitGetValue(IrGetValue expr, Expression proto) {
      proto.kind = "GET_VALUE";
      proto.symbol = serializeIrSymbol(expr.getSymbol());
      return null;
    }

    @Override
    public Void visitGetField(IrGetField expr, Expression proto) {
      proto.kind = "GET_FIELD";
      proto.symbol = serializeIrSymbol(expr.getSymbol());
      proto.receiver = serializeExpression(expr.getReceiver());
      return null;
    }

    @Override
    public Void visitGetEnumValue(IrGetEnumValue expr, Expression proto) {
      proto.kind = "GET_ENUM_VALUE";
      proto.symbol = serializeIrSymbol(expr.getSymbol());
      return null;
    }

    @Override
    public Void visitClassReference(IrClassReference expr,
                                    Expression proto) {
      proto.kind = "CLASS_REFERENCE";
      proto.symbol = serializeIrSymbol(expr.getClassSymbol());
      proto.classType = serializeIrType(expr.getClassType());
      return null;
    }

    @Override
    public Void visitConst(IrConst expr, Expression proto) {
      proto.kind = "CONST";
      proto.constKind = expr.getKind().name();
      proto.constValue = expr.getValue() == null ? null :
                                        String.valueOf(expr.getValue());
      return null;
    }

    @Override
    public Void visitReturn(IrReturn expr, Expression proto) {
      proto.kind = "RETURN";
      proto.symbol = serializeIrSymbol(expr.getReturnTargetSymbol());
      proto.value = serializeExpression(expr.getValue());
      return null;
    }
  };
}
