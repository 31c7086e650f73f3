package exm.midend.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.midend.common.Logging;
import exm.midend.common.Settings;
import exm.midend.common.exceptions.InvalidOptionException;
import exm.midend.common.exceptions.UnresolvedIdentityError;
import exm.midend.fir.FirTypeRef;
import exm.midend.fir.FirDeclarations.FirFunction;
import exm.midend.fir.FirExpressions.FirBlock;
import exm.midend.fir.FirExpressions.FirStatement;
import exm.midend.fir.cfg.ControlFlowGraph;
import exm.midend.ir.IrFixtures;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.Visibility;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrFile;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrExpressions.IrCall;
import exm.midend.ir.serialization.JvmIrWriter;
import exm.midend.ir.serialization.JvmIr.JvmIrClass;
import exm.midend.ir.serialization.JvmIr.JvmIrFile;

public class MidendCompilerTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("MidendCompilerTest.midend.log", true);
  }

  private static MidendCompiler compiler() throws InvalidOptionException {
    return new MidendCompiler(Logging.getMidendLogger(),
                              Settings.defaultSettings());
  }

  private static FirFunction emptyFunction(String name) {
    FirFunction function = new FirFunction(name, FirTypeRef.UNIT);
    function.setBody(new FirBlock(Collections.<FirStatement>emptyList(),
                                  FirTypeRef.UNIT));
    return function;
  }

  @Test
  public void testMalformedSettings() throws InvalidOptionException {
    Settings settings = Settings.defaultSettings();
    settings.set(Settings.UNDEFINED_OFFSETS, "maybe");
    exception.expect(InvalidOptionException.class);
    new MidendCompiler(Logging.getMidendLogger(), settings);
  }

  @Test
  public void testMalformedSystemProperty() throws InvalidOptionException {
    System.setProperty(Settings.VALIDATE_CFG, "often");
    try {
      exception.expect(InvalidOptionException.class);
      MidendCompiler.fromSystemProperties();
    } finally {
      System.clearProperty(Settings.VALIDATE_CFG);
    }
  }

  @Test
  public void testGraphsInOrder()throws InvalidOptionException {
    FirFunction a = emptyFunction("a");
    FirFunction b = emptyFunction("b");
    Map<FirFunction, ControlFlowGraph> graphs =
                          compiler().buildGraphs(Arrays.asList(a, b));
    assertEquals(2, graphs.size());
    List<FirFunction> keys = new ArrayList<FirFunction>(graphs.keySet());
    assertSame(a, keys.get(0));
    assertSame(b, keys.get(1));
    assertSame(a, graphs.get(a).getFunction());
  }

  @Test
  public void testCompileFile() throws InvalidOptionException {
    IrFixtures ir = new IrFixtures();
    IrFile unit = IrFixtures.file("src/main.kt", "app");
    IrFile other = IrFixtures.file("src/lib.kt", "app");
    IrSimpleFunction f = ir.function(unit, "f", Visibility.PUBLIC);
    IrSimpleFunction g = ir.function(other, "g", Visibility.PUBLIC);
    IrFixtures.body(f).getStatements().add(ir.call(g));

    byte[] bytes = compiler().compileFile(unit);
    JvmIrFile read = new JvmIrWriter().readFile(bytes);
    assertEquals(1, read.declarationContainer.declarations.size());
    assertEquals(1, read.auxTables.uniqIdTable.size());
    assertTrue(read.auxTables.stringTable.contains("app.LibKt"));
  }

  @Test
  public void testCompileToplevelClass() throws InvalidOptionException {
    IrFixtures ir = new IrFixtures();
    IrFile unit = IrFixtures.file("src/main.kt", "app");
    IrClass c = ir.cls(unit, "Main");
    ir.function(c, "run", Visibility.PUBLIC);

    JvmIrClass read = new JvmIrWriter().readClass(
                              compiler().compileToplevelClass(c));
    assertEquals("CLASS", read.irClass.kind);
    assertEquals(1, read.irClass.declarationContainer.declarations.size());
    assertTrue(read.auxTables.uniqIdTable.isEmpty());
  }

  @Test
  public void testFailureIsRethrown() throws InvalidOptionException {
    IrFixtures ir = new IrFixtures();
    IrFile unit = IrFixtures.file("src/main.kt", "app");
    IrSimpleFunction f = ir.function(unit, "f", Visibility.PUBLIC);
    IrFixtures.body(f).getStatements().add(new IrCall(0, 0, ir.unitType(),
        new IrSymbol<IrSimpleFunction>(IrSymbol.Kind.SIMPLE_FUNCTION), 0, 0));

    exception.expect(UnresolvedIdentityError.class);
    compiler().serializeFile(unit);
  }
}
