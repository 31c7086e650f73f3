package exm.midend.ir.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.midend.common.Logging;
import exm.midend.common.exceptions.UnresolvedIdentityError;
import exm.midend.ir.ClassKind;
import exm.midend.ir.FqName;
import exm.midend.ir.IrConstants;
import exm.midend.ir.IrDeclarationOrigin;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.Visibility;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrExternalPackageFragment;
import exm.midend.ir.IrDeclarations.IrField;
import exm.midend.ir.IrDeclarations.IrProperty;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrDeclarations.IrValueParameter;
import exm.midend.ir.IrExpressions.ConstKind;
import exm.midend.ir.IrExpressions.IrConst;
import exm.midend.ir.descriptors.BuiltIns;
import exm.midend.ir.descriptors.Descriptors.CallableKind;
import exm.midend.ir.descriptors.Descriptors.ClassDescriptor;
import exm.midend.ir.descriptors.Descriptors.FunctionDescriptor;
import exm.midend.ir.descriptors.Descriptors.PackageFragmentDescriptor;
import exm.midend.ir.descriptors.Descriptors.PropertyDescriptor;
import exm.midend.ir.descriptors.Descriptors.TypeDescriptor;
import exm.midend.ir.descriptors.Descriptors.ValueParameterDescriptor;

public class DeclarationStubGeneratorTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("DeclarationStubGeneratorTest.midend.log", true);
  }

  private DeclarationStubGenerator stubs;
  private PackageFragmentDescriptor lib;

  @Before
  public void setUp() {
    stubs = new DeclarationStubGenerator(Logging.getMidendLogger(),
                                         new SymbolTable());
    lib = new PackageFragmentDescriptor(FqName.fromString("lib"));
  }

  @Test
  public void testClassStubIsShared() {
    ClassDescriptor unit = BuiltIns.getBuiltInClass("Unit");
    IrClass stub = stubs.generateClassStub(unit);
    assertSame(stub, stubs.generateClassStub(unit));
    assertSame(stub, stubs.getSymbolTable().referenceClass(unit).getOwner());
    assertSame(IrDeclarationOrigin.IR_EXTERNAL_DECLARATION_STUB,
               stub.getOrigin());
    assertEquals(IrConstants.UNDEFINED_OFFSET, stub.getStartOffset());
    assertNotNull(stub.getThisReceiver());
    IrExternalPackageFragment pkg = (IrExternalPackageFragment)stub.getParent();
    assertEquals("kotlin", pkg.getFqName().asString());
    assertEquals("kotlin.Unit", stub.fqNameWhenAvailable().asString());
  }

  @Test
  public void testMemberStubInsideClassStub() {
    ClassDescriptor box = new ClassDescriptor(lib, "Box", ClassKind.CLASS);
    FunctionDescriptor open = new FunctionDescriptor(box, "open",
                                                     TypeDescriptor.UNIT);
    open.setDispatchReceiverType(TypeDescriptor.of(box));

    IrSimpleFunction stub = (IrSimpleFunction)stubs.generateMemberStub(open);
    IrClass boxStub = (IrClass)stub.getParent();
    assertEquals("Box", boxStub.getName());
    assertNotNull(stub.getDispatchReceiverParameter());
    assertSame(stub, stub.getDispatchReceiverParameter().getParent());
    assertEquals("lib.Box.open", stub.fqNameWhenAvailable().asString());
  }

  @Test
  public void testPropertyStubLinksAccessorsAndField() {
    PropertyDescriptor count = new PropertyDescriptor(lib, "count",
                                    TypeDescriptor.builtin("Int"), true);
    count.createAccessors();

    IrProperty property = stubs.generatePropertyStub(count);
    IrSimpleFunction getter = property.getGetter();
    IrSimpleFunction setter = property.getSetter();
    assertSame(property.getSymbol(), getter.getCorrespondingPropertySymbol());
    assertSame(property.getSymbol(), setter.getCorrespondingPropertySymbol());
    assertEquals(1, setter.getValueParameters().size());

    IrField field = property.getBackingField();
    assertSame(property.getSymbol(), field.getCorrespondingPropertySymbol());
    assertEquals(Visibility.PRIVATE, field.getVisibility());
    assertFalse(field.isFinal());
    assertTrue("top-level backing field is static", field.isStatic());

    // Asking for an accessor goes through its property
    assertSame(getter, stubs.generateFunctionStub(count.getGetter(), true));
    assertSame(property, stubs.generateMemberStub(count));
  }

  @Test
  public void testDefaultValueBecomesZero() {
    FunctionDescriptor fn = new FunctionDescriptor(lib, "fn",
                                                   TypeDescriptor.UNIT);
    ValueParameterDescriptor n = new ValueParameterDescriptor(fn, "n", 0,
                                            TypeDescriptor.builtin("Int"));
    n.setDeclaresDefaultValue(true);
    ValueParameterDescriptor s = new ValueParameterDescriptor(fn, "s", 1,
                                        TypeDescriptor.builtin("String"));
    s.setDeclaresDefaultValue(true);
    ValueParameterDescriptor plain = new ValueParameterDescriptor(fn,
                              "plain", 2, TypeDescriptor.builtin("Int"));
    fn.getValueParameters().add(n);
    fn.getValueParameters().add(s);
    fn.getValueParameters().add(plain);

    IrSimpleFunction stub = stubs.generateFunctionStub(fn, true);
    IrValueParameter nStub = stub.getValueParameters().get(0);
    IrConst zero = (IrConst)nStub.getDefaultValue().getExpression();
    assertEquals(ConstKind.INT, zero.getKind());
    assertEquals(0, zero.getValue());

    IrConst nullConst = (IrConst)stub.getValueParameters().get(1)
                                    .getDefaultValue().getExpression();
    assertEquals(ConstKind.NULL, nullConst.getKind());
    assertNull(stub.getValueParameters().get(2).getDefaultValue());
  }

  @Test
  public void testFakeOverrideOrigin() {
    FunctionDescriptor fn = new FunctionDescriptor(lib, "inherited",
                                                   TypeDescriptor.UNIT);
    fn.setKind(CallableKind.FAKE_OVERRIDE);
    assertSame(IrDeclarationOrigin.FAKE_OVERRIDE,
               stubs.generateFunctionStub(fn, true).getOrigin());
  }

  @Test
  public void testStubBySymbolNeedsDescriptor() {
    exception.expect(UnresolvedIdentityError.class);
    stubs.generateStubBySymbol(
            new IrSymbol<IrClass>(IrSymbol.Kind.CLASS));
  }
}
