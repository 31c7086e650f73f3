package exm.midend.ir.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.midend.common.Logging;
import exm.midend.common.exceptions.UnresolvedIdentityError;
import exm.midend.ir.IrDeclarationOrigin;
import exm.midend.ir.IrFixtures;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.Visibility;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrFile;
import exm.midend.ir.IrDeclarations.IrProperty;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrDeclarations.IrTypeParameter;
import exm.midend.ir.IrExpressions.IrCall;
import exm.midend.ir.IrExpressions.IrGetValue;
import exm.midend.ir.IrTypes.IrSimpleType;

public class IrUtilsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("IrUtilsTest.midend.log", true);
  }

  @Test
  public void testDeepCopyWithSymbols() {
    IrFixtures ir = new IrFixtures();
    IrFile file = IrFixtures.file("src/a.kt", "pkg");
    IrFile target = IrFixtures.file("src/b.kt", "pkg");
    IrSimpleFunction g = ir.function(file, "g", Visibility.PUBLIC, "y");
    IrSimpleFunction f = ir.function(file, "f", Visibility.PUBLIC, "x");
    IrCall call = ir.call(g);
    call.putValueArgument(0, ir.get(f.getValueParameters().get(0)));
    IrFixtures.body(f).getStatements().add(call);

    IrSimpleFunction copy = IrUtils.deepCopyWithSymbols(f, target);
    assertNotSame(f, copy);
    assertNotSame(f.getSymbol(), copy.getSymbol());
    assertSame(copy, copy.getSymbol().getOwner());
    assertSame(target, copy.getParent());
    assertSame(copy, copy.getValueParameters().get(0).getParent());

    IrCall copiedCall = (IrCall)IrFixtures.body(copy).getStatements().get(0);
    assertNotSame(call, copiedCall);
    assertSame("references outside the copy are kept",
               g.getSymbol(), copiedCall.getSymbol());
    assertSame(copy.getValueParameters().get(0).getSymbol(),
               ((IrGetValue)copiedCall.getValueArgument(0)).getSymbol());
  }

  @Test
  public void testPatchParentsSkipsProperties() {
    IrFixtures ir = new IrFixtures();
    IrFile file = IrFixtures.file("src/a.kt", "pkg");
    IrClass c = ir.cls(file, "C");
    IrProperty p = ir.property(c, "p", Visibility.PUBLIC);
    IrSimpleFunction m = ir.function(c, "m", Visibility.PUBLIC);
    p.getGetter().setParent(null);
    p.getBackingField().setParent(null);
    m.setParent(null);

    IrUtils.patchDeclarationParents(c, file);
    assertSame(file, c.getParent());
    assertSame(c, m.getParent());
    assertSame(c, p.getGetter().getParent());
    assertSame(c, p.getBackingField().getParent());
    assertSame(m, m.getDispatchReceiverParameter().getParent());
  }

  @Test
  public void testFindPackageFragment() {
    IrFixtures ir = new IrFixtures();
    IrFile file = IrFixtures.file("src/a.kt", "pkg");
    IrClass c = ir.cls(file, "C");
    IrSimpleFunction m = ir.function(c, "m", Visibility.PUBLIC);
    assertSame(c, IrUtils.findTopLevelDeclaration(m));
    assertSame(file, IrUtils.findPackageFragment(m));
    assertEquals("pkg.C.m", IrUtils.fqNameWhenAvailable(m).asString());
  }

  @Test
  public void testFindPackageFragmentOfOrphan() {
    IrSimpleFunction orphan = new IrFixtures().function(null, "orphan",
                                                        Visibility.PUBLIC);
    exception.expect(UnresolvedIdentityError.class);
    IrUtils.findPackageFragment(orphan);
  }

  @Test
  public void testCopyTypeParametersRewritesBounds() {
    IrFixtures ir = new IrFixtures();
    IrSimpleFunction source = ir.function(null, "source", Visibility.PUBLIC);
    IrTypeParameter t = new IrTypeParameter(0, 0,
        IrDeclarationOrigin.DEFINED,
        new IrSymbol<IrTypeParameter>(IrSymbol.Kind.TYPE_PARAMETER),
        "T", 0, false);
    t.getSuperTypes().add(new IrSimpleType(t.getSymbol(), true));
    t.getSuperTypes().add(ir.intType());
    source.getTypeParameters().add(t);

    IrSimpleFunction target = ir.function(null, "target", Visibility.PUBLIC);
    IrUtils.copyTypeParametersFrom(target, source);
    IrTypeParameter copy = target.getTypeParameters().get(0);
    assertNotSame(t, copy);
    assertSame(target, copy.getParent());
    assertEquals("T", copy.getName());
    IrSimpleType selfBound = (IrSimpleType)copy.getSuperTypes().get(0);
    assertSame(copy.getSymbol(), selfBound.getClassifier());
    assertEquals(ir.intType(), copy.getSuperTypes().get(1));
  }
}
