package exm.midend.ir.serialization;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.midend.common.Logging;
import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.common.exceptions.UnresolvedIdentityError;
import exm.midend.common.exceptions.UnsupportedInputError;
import exm.midend.ir.FqName;
import exm.midend.ir.IrDeclarationOrigin;
import exm.midend.ir.IrFixtures;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.Modality;
import exm.midend.ir.Visibility;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrFile;
import exm.midend.ir.IrDeclarations.IrModuleFragment;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrExpressions.IrCall;
import exm.midend.ir.descriptors.Descriptors.FunctionDescriptor;
import exm.midend.ir.descriptors.Descriptors.PackageFragmentDescriptor;
import exm.midend.ir.descriptors.Descriptors.TypeDescriptor;
import exm.midend.ir.serialization.JvmIr.AuxTables;
import exm.midend.ir.serialization.JvmIr.Declaration;
import exm.midend.ir.serialization.JvmIr.Expression;
import exm.midend.ir.serialization.JvmIr.JvmIrClass;
import exm.midend.ir.serialization.JvmIr.JvmIrFile;
import exm.midend.ir.serialization.JvmIr.Symbol;
import exm.midend.ir.serialization.JvmIr.UniqIdInfo;

public class JvmIrSerializerTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("JvmIrSerializerTest.midend.log", true);
  }

  private IrFixtures ir;
  private IrFile unit;
  private IrFile other;
  private IrSimpleFunction f;
  private IrSimpleFunction g;

  /**
   * src/a.kt: fun f() { g() }   src/b.kt: fun g() {}
   */
  @Before
  public void setUp() {
    ir = new IrFixtures();
    unit = IrFixtures.file("src/a.kt", "pkg");
    other = IrFixtures.file("src/b.kt", "pkg");
    f = ir.function(unit, "f", Visibility.PUBLIC);
    g = ir.function(other, "g", Visibility.PUBLIC);
    IrFixtures.body(f).getStatements().add(ir.call(g));
  }

  private static JvmIrSerializer newSerializer() {
    return new JvmIrSerializer(Logging.getMidendLogger(),
        new DeclarationTable(JvmMangler.INSTANCE, true), false);
  }

  private static String string(AuxTables tables, int index) {
    return tables.stringTable.get(index);
  }

  @Test
  public void testCallAcrossFiles() {
    JvmIrFile out = newSerializer().serializeJvmIrFile(unit);
    AuxTables tables = out.auxTables;
    long gId = JvmMangler.INSTANCE.hashedMangle(g);

    List<Declaration> decls = out.declarationContainer.declarations;
    assertEquals(1, decls.size());
    assertEquals("SIMPLE_FUNCTION", decls.get(0).kind);
    assertEquals("f", string(tables, decls.get(0).name));

    // g is compiled into the facade class of the other file
    assertEquals(1, tables.uniqIdTable.size());
    UniqIdInfo info = tables.uniqIdTable.get(0);
    assertEquals(gId, info.id);
    assertEquals("pkg.BKt", string(tables, info.toplevelFqName));

    assertEquals(1, tables.externalRefs.packages.size());
    assertEquals("pkg", tables.externalRefs.packages.get(0).fqName);
    Declaration mirror = tables.externalRefs.packages.get(0)
                              .declarationContainer.declarations.get(0);
    assertEquals("g", string(tables, mirror.name));
    assertEquals(null, mirror.body);
    assertEquals(1, tables.externalRefs.references.size());
    assertEquals(gId, tables.externalRefs.references.get(0).id);
    assertEquals(0, tables.externalRefs.references.get(0).index);

    Expression call = decls.get(0).body.statements.get(0).expression;
    assertEquals("CALL", call.kind);
    Symbol target = tables.symbolTable.get(call.symbol);
    assertEquals("SIMPLE_FUNCTION", target.kind);
    assertEquals(gId, target.uniqId);
    assertFalse(target.isLocal);
  }

  @Test
  public void testSameFileCallHasNoEntry() {
    IrSimpleFunction h = ir.function(unit, "h", Visibility.PRIVATE);
    IrFixtures.body(f).getStatements().clear();
    IrFixtures.body(f).getStatements().add(ir.call(h));

    AuxTables tables = newSerializer().serializeJvmIrFile(unit).auxTables;
    assertTrue(tables.uniqIdTable.isEmpty());
    assertTrue(tables.externalRefs.packages.isEmpty());
    assertTrue(tables.externalRefs.references.isEmpty());
  }

  @Test
  public void testFileExcludesClasses() {
    ir.cls(unit, "C");
    JvmIrFile out = newSerializer().serializeJvmIrFile(unit);
    assertEquals(1, out.declarationContainer.declarations.size());
  }

  /**
   * src/a.kt: fun f() {}  class C { fun m() { g() } }: the class is its
   * own unit, so its call is not in the file's uniq id table
   */
  @Test
  public void testFileUniqIdsExcludeClassBodies() {
    IrFixtures.body(f).getStatements().clear();
    IrClass c = ir.cls(unit, "C");
    IrSimpleFunction m = ir.function(c, "m", Visibility.PUBLIC);
    IrFixtures.body(m).getStatements().add(ir.call(g));
    IrSimpleFunction n = ir.function(c, "n", Visibility.PUBLIC);
    IrCall callN = ir.call(n);
    callN.setDispatchReceiver(ir.get(m.getDispatchReceiverParameter()));
    IrFixtures.body(m).getStatements().add(callN);

    AuxTables tables = newSerializer().serializeJvmIrFile(unit).auxTables;
    assertTrue(tables.uniqIdTable.isEmpty());
    // External references still cover the whole file
    assertEquals(1, tables.externalRefs.references.size());
    assertEquals(JvmMangler.INSTANCE.hashedMangle(g),
                 tables.externalRefs.references.get(0).id);
  }

  /**
   * src/a.kt: private fun h() {}  class C { fun m() { h() } }: h has a
   * local id, and both tables of C must use the same one
   */
  @Test
  public void testLocalIdSharedByBothTables() {
    IrSimpleFunction h = ir.function(unit, "h", Visibility.PRIVATE);
    IrClass c = ir.cls(unit, "C");
    IrSimpleFunction m = ir.function(c, "m", Visibility.PUBLIC);
    IrFixtures.body(m).getStatements().add(ir.call(h));

    AuxTables tables = newSerializer().serializeJvmToplevelClass(c)
                                                        .auxTables;
    assertEquals(1, tables.uniqIdTable.size());
    assertEquals("pkg.AKt",
                 string(tables, tables.uniqIdTable.get(0).toplevelFqName));
    assertEquals(1, tables.externalRefs.references.size());
    assertEquals(tables.uniqIdTable.get(0).id,
                 tables.externalRefs.references.get(0).id);
  }

  @Test
  public void testToplevelClassReferencesFileFacade() {
    IrClass c = ir.cls(unit, "C");
    IrSimpleFunction m = ir.function(c, "m", Visibility.PUBLIC);
    IrSimpleFunction n = ir.function(c, "n", Visibility.PUBLIC);
    IrFixtures.body(m).getStatements().add(ir.call(f));
    IrCall callN = ir.call(n);
    callN.setDispatchReceiver(ir.get(m.getDispatchReceiverParameter()));
    IrFixtures.body(m).getStatements().add(callN);

    JvmIrClass out = newSerializer().serializeJvmToplevelClass(c);
    assertEquals("CLASS", out.irClass.kind);
    AuxTables tables = out.auxTables;
    // The call to n stays inside the class
    assertEquals(1, tables.uniqIdTable.size());
    assertEquals(JvmMangler.INSTANCE.hashedMangle(f),
                 tables.uniqIdTable.get(0).id);
    assertEquals("pkg.AKt",
                 string(tables, tables.uniqIdTable.get(0).toplevelFqName));
    // f lives in the same file but outside the class
    assertEquals(1, tables.externalRefs.references.size());
  }

  @Test
  public void testStringTableFrozenAfterUnit() {
    JvmIrSerializer serializer = newSerializer();
    JvmIrFile out = serializer.serializeJvmIrFile(unit);
    assertTrue(serializer.isStringTableFrozen());
    assertEquals(out.auxTables.stringTable.indexOf("f"),
                 serializer.serializeString("f"));

    exception.expect(StructuralInvariantError.class);
    serializer.serializeString("not-yet-seen");
  }

  @Test
  public void testSerializerServesOneUnit() {
    JvmIrSerializer serializer = newSerializer();
    serializer.serializeJvmIrFile(unit);

    exception.expect(StructuralInvariantError.class);
    serializer.serializeJvmIrFile(other);
  }

  @Test
  public void testUnboundTarget() {
    IrCall dangling = new IrCall(0, 0, ir.unitType(),
        new IrSymbol<IrSimpleFunction>(IrSymbol.Kind.SIMPLE_FUNCTION), 0, 0);
    IrFixtures.body(f).getStatements().add(dangling);

    exception.expect(UnresolvedIdentityError.class);
    newSerializer().serializeJvmIrFile(unit);
  }

  @Test
  public void testFacadeName() {
    assertEquals("pkg.MainKt", JvmIrSerializer.facadeFqName(
            IrFixtures.file("/home/src/main.kt", "pkg")).asString());
    assertEquals("UtilsKt", JvmIrSerializer.facadeFqName(
            IrFixtures.file("utils.kt", "")).asString());
  }

  @Test
  public void testLibraryMemberUsesImplClass() {
    PackageFragmentDescriptor lib =
            new PackageFragmentDescriptor(FqName.fromString("lib"));
    FunctionDescriptor descriptor =
            new FunctionDescriptor(lib, "util", TypeDescriptor.UNIT);
    descriptor.setImplClassFqName(FqName.fromString("lib.UtilKt"));
    IrSimpleFunction util = new IrSimpleFunction(0, 0,
        IrDeclarationOrigin.IR_EXTERNAL_DECLARATION_STUB,
        new IrSymbol<IrSimpleFunction>(IrSymbol.Kind.SIMPLE_FUNCTION,
                                       descriptor),
        "util", Visibility.PUBLIC, Modality.FINAL, ir.unitType(),
        false, false, false, false);
    util.setParent(new IrModuleFragment("lib"));

    assertEquals("lib.UtilKt",
                 newSerializer().getToplevelFqName(util).asString());
  }

  @Test
  public void testLibraryMemberWithoutImplClass() {
    IrSimpleFunction orphan = ir.function(null, "orphan", Visibility.PUBLIC);
    orphan.setParent(new IrModuleFragment("lib"));

    exception.expect(UnresolvedIdentityError.class);
    newSerializer().getToplevelFqName(orphan);
  }

  @Test
  public void testWriterKeepsTables() {
    JvmIrWriter writer = new JvmIrWriter();
    JvmIrFile out = newSerializer().serializeJvmIrFile(unit);
    JvmIrFile read = writer.readFile(writer.toBytes(out));

    assertEquals(out.auxTables.stringTable, read.auxTables.stringTable);
    assertEquals(out.auxTables.uniqIdTable.get(0).id,
                 read.auxTables.uniqIdTable.get(0).id);
    assertEquals(out.auxTables.symbolTable.size(),
                 read.auxTables.symbolTable.size());
    Expression call = read.declarationContainer.declarations.get(0)
                          .body.statements.get(0).expression;
    assertEquals("CALL", call.kind);
  }

  @Test
  public void testWriterRejectsGarbage() {
    exception.expect(UnsupportedInputError.class);
    new JvmIrWriter().readFile("{\"auxTables\": [1, 2".getBytes());
  }
}
