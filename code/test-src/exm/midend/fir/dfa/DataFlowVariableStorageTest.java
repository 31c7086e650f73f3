package exm.midend.fir.dfa;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.midend.common.Logging;
import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.fir.FirTypeRef;
import exm.midend.fir.FirDeclarations.FirFunction;
import exm.midend.fir.FirDeclarations.FirValueParameter;
import exm.midend.fir.FirDeclarations.FirVariable;
import exm.midend.fir.FirExpressions.FirBlock;
import exm.midend.fir.FirExpressions.FirConstExpression;
import exm.midend.fir.FirExpressions.FirQualifiedAccessExpression;
import exm.midend.fir.FirExpressions.FirStatement;
import exm.midend.fir.FirExpressions.FirWhenBranch;
import exm.midend.fir.FirExpressions.FirWhenExpression;
import exm.midend.fir.cfg.FunctionGraphGenerator;

public class DataFlowVariableStorageTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("DataFlowVariableStorageTest.midend.log", true);
  }

  @Test
  public void testRealVariableIdentity() {
    DataFlowVariableStorage storage = new DataFlowVariableStorage();
    FirVariable v = new FirVariable("v", FirTypeRef.INT, true, null);

    DataFlowVariable first = storage.getOrCreateRealVariable(v.getSymbol());
    DataFlowVariable second = storage.getOrCreateRealVariable(v.getSymbol());
    assertSame(first, second);
    assertFalse(first.isSynthetic());
    assertEquals(FirTypeRef.INT, first.getType());
    assertEquals("d1", first.getName());
    assertEquals(1, storage.size());
  }

  @Test
  public void testSyntheticVariableIdentity() {
    DataFlowVariableStorage storage = new DataFlowVariableStorage();
    FirConstExpression c = FirConstExpression.intConst(1);

    DataFlowVariable first = storage.getOrCreateSyntheticVariable(c);
    assertSame(first, storage.getOrCreateSyntheticVariable(c));
    assertTrue(first.isSynthetic());
    assertSame(first, storage.get(c));
  }

  @Test
  public void testNamesAreFreshUntilReset() {
    DataFlowVariableStorage storage = new DataFlowVariableStorage();
    DataFlowVariable a = storage.getOrCreateSyntheticVariable(
                                  FirConstExpression.intConst(1));
    DataFlowVariable b = storage.getOrCreateSyntheticVariable(
                                  FirConstExpression.intConst(2));
    assertEquals("d1", a.getName());
    assertEquals("d2", b.getName());

    storage.reset();
    assertEquals(0, storage.size());
    DataFlowVariable c = storage.getOrCreateSyntheticVariable(
                                  FirConstExpression.intConst(3));
    assertEquals("d1", c.getName());
  }

  @Test
  public void testRemovePurgesAttachedReferences() {
    DataFlowVariableStorage storage = new DataFlowVariableStorage();
    FirVariable v = new FirVariable("v", FirTypeRef.INT, false, null);
    DataFlowVariable var = storage.getOrCreateRealVariable(v.getSymbol());
    FirQualifiedAccessExpression access = new FirQualifiedAccessExpression(
                                    v.getSymbol(), null, FirTypeRef.INT);
    storage.attachReference(access, var);
    assertSame(var, storage.get(access));
    assertEquals(2, storage.getElements(var).size());

    storage.remove(var);
    assertNull(storage.get(access));
    assertNull(storage.get(v.getSymbol()));
    assertTrue(storage.getElements(var).isEmpty());
    assertEquals(0, storage.size());
  }

  @Test
  public void testAttachToUnknownVariable() {
    DataFlowVariableStorage storage = new DataFlowVariableStorage();
    DataFlowVariable stray = new DataFlowVariable("d9", FirTypeRef.INT,
                                                  false);
    exception.expect(StructuralInvariantError.class);
    storage.attachReference(FirConstExpression.intConst(1), stray);
  }

  @Test
  public void testAttachConflict() {
    DataFlowVariableStorage storage = new DataFlowVariableStorage();
    FirVariable v = new FirVariable("v", FirTypeRef.INT, false, null);
    FirVariable w = new FirVariable("w", FirTypeRef.INT, false, null);
    DataFlowVariable vVar = storage.getOrCreateRealVariable(v.getSymbol());
    DataFlowVariable wVar = storage.getOrCreateRealVariable(w.getSymbol());
    FirQualifiedAccessExpression access = new FirQualifiedAccessExpression(
                                    v.getSymbol(), null, FirTypeRef.INT);
    storage.attachReference(access, vVar);

    exception.expect(StructuralInvariantError.class);
    storage.attachReference(access, wVar);
  }

  @Test
  public void testValueEquality() {
    assertEquals(new DataFlowVariable("d1", FirTypeRef.INT, false),
                 new DataFlowVariable("d1", FirTypeRef.INT, false));
    assertFalse(new DataFlowVariable("d1", FirTypeRef.INT, false).equals(
                new DataFlowVariable("d1", FirTypeRef.INT, true)));
  }

  @Test
  public void testConditionNegate() {
    for (Condition c: Condition.values()) {
      assertEquals(c, c.negate().negate());
    }
    assertEquals(Condition.EQ_FALSE, Condition.EQ_TRUE.negate());
  }

  /**
   * fun f(p) { val v = p; when { true -> {} } }: the local goes out of
   * scope with its block, the parameter stays, the when gets a
   * synthetic variable
   */
  @Test
  public void testGeneratorScopesVariables() {
    FirValueParameter p = new FirValueParameter("p", FirTypeRef.INT);
    FirFunction f = new FirFunction("f", FirTypeRef.UNIT,
                                    Collections.singletonList(p));
    FirQualifiedAccessExpression readP = new FirQualifiedAccessExpression(
                                    p.getSymbol(), null, FirTypeRef.INT);
    FirVariable v = new FirVariable("v", FirTypeRef.INT, false, readP);
    FirWhenExpression when = new FirWhenExpression(
        Collections.singletonList(new FirWhenBranch(
            FirConstExpression.booleanConst(true), emptyBlock())),
        true, FirTypeRef.UNIT);
    f.setBody(new FirBlock(Arrays.<FirStatement>asList(v, when),
                           FirTypeRef.UNIT));

    DataFlowVariableStorage storage = new DataFlowVariableStorage();
    FunctionGraphGenerator generator = new FunctionGraphGenerator(
                            Logging.getMidendLogger(), true, storage);
    generator.generate(f);

    DataFlowVariable pVar = storage.get(p.getSymbol());
    assertNotNull(pVar);
    assertSame(pVar, storage.get(readP));
    assertNull("local removed at end of block", storage.get(v.getSymbol()));
    DataFlowVariable whenVar = storage.get(when);
    assertNotNull(whenVar);
    assertTrue(whenVar.isSynthetic());
  }

  private static FirBlock emptyBlock() {
    return new FirBlock(Collections.<FirStatement>emptyList(),
                        FirTypeRef.UNIT);
  }
}
