package exm.midend.ir;

import exm.midend.common.Logging;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrField;
import exm.midend.ir.IrDeclarations.IrFile;
import exm.midend.ir.IrDeclarations.IrProperty;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrDeclarations.IrValueDeclaration;
import exm.midend.ir.IrDeclarations.IrValueParameter;
import exm.midend.ir.IrExpressions.IrBlockBody;
import exm.midend.ir.IrExpressions.IrCall;
import exm.midend.ir.IrExpressions.IrGetValue;
import exm.midend.ir.IrTypes.IrSimpleType;
import exm.midend.ir.IrTypes.IrType;
import exm.midend.ir.descriptors.BuiltIns;
import exm.midend.ir.util.DeclarationStubGenerator;
import exm.midend.ir.util.IrUtils;
import exm.midend.ir.util.SymbolTable;

/**
 * Small hand-built IR trees for tests.  Built-in classes come from a
 * stub generator, so every type refers to a bound class in package
 * kotlin.
 */
public class IrFixtures {
  private final DeclarationStubGenerator stubs;
  private int offset = 0;

  public IrFixtures() {
    stubs = new DeclarationStubGenerator(Logging.getMidendLogger(),
                                         new SymbolTable());
  }

  public DeclarationStubGenerator getStubs() {
    return stubs;
  }

  public IrClass builtInClass(String name) {
    return stubs.generateClassStub(BuiltIns.getBuiltInClass(name));
  }

  public IrType unitType() {
    return new IrSimpleType(builtInClass("Unit").getSymbol(), false);
  }

  public IrType intType() {
    return new IrSimpleType(builtInClass("Int").getSymbol(), false);
  }

  public static IrType typeOf(IrClass cls) {
    return new IrSimpleType(cls.getSymbol(), false);
  }

  public static IrFile file(String fileName, String pkg) {
    return new IrFile(new IrSymbol<IrFile>(IrSymbol.Kind.FILE), fileName,
                      FqName.fromString(pkg));
  }

  public IrClass cls(IrDeclarationContainer parent, String name) {
    IrClass cls = new IrClass(nextOffset(), nextOffset(),
        IrDeclarationOrigin.DEFINED,
        new IrSymbol<IrClass>(IrSymbol.Kind.CLASS), name, ClassKind.CLASS,
        Visibility.PUBLIC, Modality.FINAL,
        false, false, false, false, false);
    addTo(parent, cls);
    IrUtils.createParameterDeclarations(cls);
    return cls;
  }

  /**
   * Function returning Unit with an empty block body and Int
   * parameters.  A function inside a class gets a dispatch receiver.
   */
  public IrSimpleFunction function(IrDeclarationContainer parent,
          String name, Visibility visibility, String... paramNames) {
    IrSimpleFunction fn = new IrSimpleFunction(nextOffset(), nextOffset(),
        IrDeclarationOrigin.DEFINED,
        new IrSymbol<IrSimpleFunction>(IrSymbol.Kind.SIMPLE_FUNCTION),
        name, visibility, Modality.FINAL, unitType(),
        false, false, false, false);
    if (parent != null) {
      addTo(parent, fn);
    }
    if (parent instanceof IrClass) {
      IrValueParameter receiver = valueParameter(fn, "<this>", -1,
                                            typeOf((IrClass)parent));
      fn.setDispatchReceiverParameter(receiver);
    }
    for (int i = 0; i < paramNames.length; i++) {
      fn.getValueParameters().add(valueParameter(fn, paramNames[i], i,
                                                 intType()));
    }
    fn.setBody(new IrBlockBody(nextOffset(), nextOffset()));
    return fn;
  }

  /**
   * Property with a getter and a backing field, both linked back to it
   */
  public IrProperty property(IrDeclarationContainer parent, String name,
                             Visibility visibility) {
    IrProperty property = new IrProperty(nextOffset(), nextOffset(),
        IrDeclarationOrigin.DEFINED,
        new IrSymbol<IrProperty>(IrSymbol.Kind.PROPERTY), name, visibility,
        Modality.FINAL, false, false, false, false, false);
    addTo(parent, property);

    IrSimpleFunction getter = function(null, "<get-" + name + ">",
                                       visibility);
    getter.setParent(parent);
    if (parent instanceof IrClass) {
      getter.setDispatchReceiverParameter(valueParameter(getter, "<this>",
                                          -1, typeOf((IrClass)parent)));
    }
    getter.setReturnType(intType());
    getter.setCorrespondingPropertySymbol(property.getSymbol());
    property.setGetter(getter);

    IrField field = new IrField(nextOffset(), nextOffset(),
        IrDeclarationOrigin.DEFINED,
        new IrSymbol<IrField>(IrSymbol.Kind.FIELD), name,
        intType(), Visibility.PRIVATE, true, false,
        !(parent instanceof IrClass));
    field.setParent(parent);
    field.setCorrespondingPropertySymbol(property.getSymbol());
    property.setBackingField(field);
    return property;
  }

  public IrValueParameter valueParameter(IrSimpleFunction fn, String name,
                                         int index, IrType type) {
    IrValueParameter param = new IrValueParameter(nextOffset(), nextOffset(),
        IrDeclarationOrigin.DEFINED,
        new IrSymbol<IrValueParameter>(IrSymbol.Kind.VALUE_PARAMETER),
        name, index, type, null, false, false);
    param.setParent(fn);
    return param;
  }

  /**
   * Call of target with no arguments filled in
   */
  public IrCall call(IrSimpleFunction target) {
    return new IrCall(nextOffset(), nextOffset(), target.getReturnType(),
                      target.getSymbol(), target.getValueParameters().size(),
                      target.getTypeParameters().size());
  }

  public IrGetValue get(IrValueDeclaration value) {
    return new IrGetValue(nextOffset(), nextOffset(), value.getType(),
                          value.getSymbol());
  }

  public static IrBlockBody body(IrSimpleFunction fn) {
    return (IrBlockBody)fn.getBody();
  }

  private static void addTo(IrDeclarationContainer parent,
                            IrDeclaration declaration) {
    parent.getDeclarations().add(declaration);
    declaration.setParent(parent);
  }

  private int nextOffset() {
    return offset++;
  }
}
