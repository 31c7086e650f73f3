package exm.midend.ir.serialization;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Map;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.google.common.collect.Iterables;

import exm.midend.common.Logging;
import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.ir.IrConstants;
import exm.midend.ir.IrDeclarationOrigin;
import exm.midend.ir.IrFixtures;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.Visibility;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrConstructor;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrExternalPackageFragment;
import exm.midend.ir.IrDeclarations.IrFile;
import exm.midend.ir.IrDeclarations.IrProperty;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrExpressions.IrCall;
import exm.midend.ir.IrExpressions.IrConst;
import exm.midend.ir.IrExpressions.IrConstructorCall;
import exm.midend.ir.IrExpressions.IrExpressionBody;
import exm.midend.ir.IrTypes.IrErrorType;

public class ExternalReferencesTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ExternalReferencesTest.midend.log", true);
  }

  private IrFixtures ir;
  private IrFile unit;
  private IrFile other;
  private IrSimpleFunction f;

  @Before
  public void setUp() {
    ir = new IrFixtures();
    unit = IrFixtures.file("src/a.kt", "pkg");
    other = IrFixtures.file("src/b.kt", "pkg");
    f = ir.function(unit, "f", Visibility.PUBLIC);
  }

  private ExternalReferencesInfo collect(boolean undefinedOffsets) {
    return ExternalReferences.collect(Logging.getMidendLogger(), unit,
                                      undefinedOffsets);
  }

  private static IrDeclaration onlyReference(ExternalReferencesInfo info) {
    return Iterables.getOnlyElement(info.getReferences().keySet());
  }

  @Test
  public void testRepeatedReferenceSharesMirror() {
    IrSimpleFunction g = ir.function(other, "g", Visibility.PUBLIC);
    IrFixtures.body(f).getStatements().add(ir.call(g));
    IrFixtures.body(f).getStatements().add(ir.call(g));

    ExternalReferencesInfo info = collect(false);
    assertEquals(1, info.getPackageFragments().size());
    IrExternalPackageFragment pkg =
        (IrExternalPackageFragment)info.getPackageFragments().get(0);
    assertEquals("pkg", pkg.getFqName().asString());

    IrSimpleFunction mirror = (IrSimpleFunction)onlyReference(info);
    assertNotSame(g, mirror);
    assertNotSame(g.getSymbol(), mirror.getSymbol());
    assertEquals("g", mirror.getName());
    assertNull("mirrors have no body", mirror.getBody());
    assertSame(pkg, mirror.getParent());
    assertEquals(1, pkg.getDeclarations().size());
    assertEquals(Integer.valueOf(0), info.getReferences().get(mirror));
    assertEquals(g.getStartOffset(), mirror.getStartOffset());

    // Source tree is untouched
    assertSame(other, g.getParent());
    IrCall call = (IrCall)IrFixtures.body(f).getStatements().get(0);
    assertSame(g.getSymbol(), call.getSymbol());
  }

  @Test
  public void testNoMirrorInsideUnit() {
    IrSimpleFunction h = ir.function(unit, "h", Visibility.PRIVATE);
    IrFixtures.body(f).getStatements().add(ir.call(h));
    IrSimpleFunction local = ir.function(null, "local", Visibility.LOCAL);
    local.setParent(f);
    IrFixtures.body(f).getStatements().add(local);
    IrFixtures.body(f).getStatements().add(ir.call(local));

    ExternalReferencesInfo info = collect(false);
    assertTrue(info.getReferences().isEmpty());
    assertTrue(info.getPackageFragments().isEmpty());
  }

  @Test
  public void testOnePlaceholderPerPackageName() {
    IrFile third = IrFixtures.file("src/c.kt", "pkg");
    IrFile elsewhere = IrFixtures.file("src/d.kt", "pkg.sub");
    IrFixtures.body(f).getStatements().add(
              ir.call(ir.function(other, "g", Visibility.PUBLIC)));
    IrFixtures.body(f).getStatements().add(
              ir.call(ir.function(third, "h", Visibility.PUBLIC)));
    IrFixtures.body(f).getStatements().add(
              ir.call(ir.function(elsewhere, "k", Visibility.PUBLIC)));

    ExternalReferencesInfo info = collect(false);
    assertEquals(2, info.getPackageFragments().size());
    assertEquals("pkg",
        info.getPackageFragments().get(0).getFqName().asString());
    assertEquals("pkg.sub",
        info.getPackageFragments().get(1).getFqName().asString());
    assertEquals(2, info.getPackageFragments().get(0).getDeclarations()
                                                      .size());

    int[] expectedIndex = {0, 0, 1};
    int i = 0;
    for (Map.Entry<IrDeclaration, Integer> e:
                              info.getReferences().entrySet()) {
      assertEquals(expectedIndex[i++], e.getValue().intValue());
    }
  }

  @Test
  public void testMemberMirroredInsideClassMirror() {
    IrClass c = ir.cls(other, "C");
    IrSimpleFunction m = ir.function(c, "m", Visibility.PUBLIC);
    IrFixtures.body(f).getStatements().add(ir.call(m));

    ExternalReferencesInfo info = collect(false);
    IrSimpleFunction mirror = (IrSimpleFunction)onlyReference(info);
    IrClass classMirror = (IrClass)mirror.getParent();
    assertNotSame(c, classMirror);
    assertEquals("C", classMirror.getName());
    assertTrue(classMirror.getDeclarations().contains(mirror));
    assertSame(info.getPackageFragments().get(0), classMirror.getParent());
    assertEquals("kfun:pkg.C.m()", JvmMangler.INSTANCE.mangledName(mirror));
    assertEquals(JvmMangler.INSTANCE.mangledName(m),
                 JvmMangler.INSTANCE.mangledName(mirror));
  }

  @Test
  public void testAccessorAndPropertyLinkedBothWays() {
    IrProperty p = ir.property(other, "p", Visibility.PUBLIC);
    IrFixtures.body(f).getStatements().add(ir.call(p.getGetter()));

    ExternalReferencesInfo info = collect(false);
    IrSimpleFunction getterMirror = (IrSimpleFunction)onlyReference(info);
    IrProperty propertyMirror =
            getterMirror.getCorrespondingPropertySymbol().getOwner();
    assertNotSame(p, propertyMirror);
    assertSame(getterMirror, propertyMirror.getGetter());
    assertSame(propertyMirror.getSymbol(), propertyMirror.getBackingField()
                                        .getCorrespondingPropertySymbol());
    assertNotSame(p.getBackingField(), propertyMirror.getBackingField());

    // Accessors live in the property, not the container
    IrExternalPackageFragment pkg =
        (IrExternalPackageFragment)info.getPackageFragments().get(0);
    assertEquals(1, pkg.getDeclarations().size());
    assertSame(propertyMirror, pkg.getDeclarations().get(0));
  }

  @Test
  public void testUnpairedAccessor() {
    IrProperty p = ir.property(other, "p", Visibility.PUBLIC);
    IrSimpleFunction getter = p.getGetter();
    p.setGetter(null);
    IrFixtures.body(f).getStatements().add(ir.call(getter));

    exception.expect(StructuralInvariantError.class);
    collect(false);
  }

  @Test
  public void testUndefinedOffsetsAndDroppedDefaults() {
    IrSimpleFunction g = ir.function(other, "g", Visibility.PUBLIC, "x");
    g.getValueParameters().get(0).setDefaultValue(new IrExpressionBody(
            IrConst.intConst(1, 2, ir.intType(), 42)));
    IrFixtures.body(f).getStatements().add(ir.call(g));

    IrSimpleFunction mirror = (IrSimpleFunction)onlyReference(collect(true));
    assertEquals(IrConstants.UNDEFINED_OFFSET, mirror.getStartOffset());
    assertEquals(IrConstants.UNDEFINED_OFFSET, mirror.getEndOffset());
    assertEquals(1, mirror.getValueParameters().size());
    assertNull(mirror.getValueParameters().get(0).getDefaultValue());
    assertSame(mirror, mirror.getValueParameters().get(0).getParent());
    assertFalse(g.getValueParameters().get(0).getDefaultValue() == null);
  }

  @Test
  public void testAnnotationsCopiedUnlessErrorTyped() {
    IrFile annFile = IrFixtures.file("src/ann.kt", "ann");
    IrClass ann = ir.cls(annFile, "Ann");
    IrConstructor ctor = new IrConstructor(0, 0, IrDeclarationOrigin.DEFINED,
        new IrSymbol<IrConstructor>(IrSymbol.Kind.CONSTRUCTOR), "<init>",
        Visibility.PUBLIC, IrFixtures.typeOf(ann), false, false, true);
    ann.addChild(ctor);

    IrSimpleFunction g = ir.function(other, "g", Visibility.PUBLIC);
    g.getAnnotations().add(new IrConstructorCall(0, 0,
        IrFixtures.typeOf(ann), ctor.getSymbol(), 0, 0));
    IrConstructorCall broken = new IrConstructorCall(0, 0,
        IrFixtures.typeOf(ann), ctor.getSymbol(), 1, 0);
    broken.putValueArgument(0,
        IrConst.intConst(0, 0, IrErrorType.INSTANCE, 1));
    g.getAnnotations().add(broken);
    IrFixtures.body(f).getStatements().add(ir.call(g));

    IrSimpleFunction mirror = (IrSimpleFunction)onlyReference(collect(false));
    assertEquals(1, mirror.getAnnotations().size());
    IrConstructor ctorMirror =
                mirror.getAnnotations().get(0).getSymbol().getOwner();
    assertNotSame(ctor, ctorMirror);
    assertEquals("Ann", ((IrClass)ctorMirror.getParent()).getName());
  }
}
