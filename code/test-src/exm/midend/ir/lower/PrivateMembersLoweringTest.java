package exm.midend.ir.lower;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.midend.common.Logging;
import exm.midend.common.Settings;
import exm.midend.common.exceptions.MidendRuntimeError;
import exm.midend.ir.IrFixtures;
import exm.midend.ir.Visibility;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrFile;
import exm.midend.ir.IrDeclarations.IrProperty;
import exm.midend.ir.IrDeclarations.IrSimpleFunction;
import exm.midend.ir.IrDeclarations.IrValueParameter;
import exm.midend.ir.IrExpressions.IrCall;
import exm.midend.ir.IrExpressions.IrConst;
import exm.midend.ir.IrExpressions.IrGetValue;

public class PrivateMembersLoweringTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("PrivateMembersLoweringTest.midend.log", true);
  }

  private IrFixtures ir;
  private IrFile file;
  private IrClass c;
  private IrSimpleFunction p;
  private IrSimpleFunction q;
  private IrSimpleFunction r;

  /**
   * class C { private fun p(x) { q(x) }  fun q(y) {}  fun r() { p(1) } }
   */
  @Before
  public void setUp() {
    ir = new IrFixtures();
    file = IrFixtures.file("src/c.kt", "pkg");
    c = ir.cls(file, "C");
    p = ir.function(c, "p", Visibility.PRIVATE, "x");
    q = ir.function(c, "q", Visibility.PUBLIC, "y");
    r = ir.function(c, "r", Visibility.PUBLIC);

    IrCall callQ = ir.call(q);
    callQ.setDispatchReceiver(ir.get(p.getDispatchReceiverParameter()));
    callQ.putValueArgument(0, ir.get(p.getValueParameters().get(0)));
    IrFixtures.body(p).getStatements().add(callQ);

    IrCall callP = ir.call(p);
    callP.setDispatchReceiver(ir.get(r.getDispatchReceiverParameter()));
    callP.putValueArgument(0, IrConst.intConst(0, 0, ir.intType(), 1));
    IrFixtures.body(r).getStatements().add(callP);
  }

  private void lower() {
    new PrivateMembersLowering().lower(Logging.getMidendLogger(), file);
  }

  private static IrCall onlyCall(IrSimpleFunction fn) {
    assertEquals(1, IrFixtures.body(fn).getStatements().size());
    return (IrCall)IrFixtures.body(fn).getStatements().get(0);
  }

  @Test
  public void testPrivateMemberBecomesStatic() {
    lower();
    IrSimpleFunction ps = (IrSimpleFunction)c.getDeclarations().get(0);
    assertNotSame(p, ps);
    assertEquals("p", ps.getName());
    assertSame(c, ps.getParent());
    assertNull(ps.getDispatchReceiverParameter());
    assertEquals(2, ps.getValueParameters().size());

    IrValueParameter thisParam = ps.getValueParameters().get(0);
    assertEquals(PrivateMembersLowering.THIS_PARAMETER_NAME,
                 thisParam.getName());
    assertEquals(0, thisParam.getIndex());
    assertSame(PrivateMembersLowering.STATIC_THIS_PARAMETER,
               thisParam.getOrigin());
    assertEquals(IrFixtures.typeOf(c), thisParam.getType());
    assertEquals("x", ps.getValueParameters().get(1).getName());
    assertEquals(1, ps.getValueParameters().get(1).getIndex());

    // Public members stay as they are
    assertSame(q, c.getDeclarations().get(1));
    assertSame(r, c.getDeclarations().get(2));
  }

  @Test
  public void testBodyRefersToNewParameters() {
    lower();
    IrSimpleFunction ps = (IrSimpleFunction)c.getDeclarations().get(0);
    IrCall callQ = onlyCall(ps);
    assertSame(q.getSymbol(), callQ.getSymbol());
    assertSame(ps.getValueParameters().get(0).getSymbol(),
               ((IrGetValue)callQ.getDispatchReceiver()).getSymbol());
    assertSame(ps.getValueParameters().get(1).getSymbol(),
               ((IrGetValue)callQ.getValueArgument(0)).getSymbol());
  }

  @Test
  public void testCallSiteReceiverBecomesFirstArgument() {
    lower();
    IrSimpleFunction ps = (IrSimpleFunction)c.getDeclarations().get(0);
    IrCall call = onlyCall(r);
    assertSame(ps.getSymbol(), call.getSymbol());
    assertNull(call.getDispatchReceiver());
    assertEquals(2, call.getValueArgumentsCount());
    assertSame(r.getDispatchReceiverParameter().getSymbol(),
               ((IrGetValue)call.getValueArgument(0)).getSymbol());
    assertEquals(1, ((IrConst)call.getValueArgument(1)).getValue());
  }

  @Test
  public void testRecursiveCall() {
    IrSimpleFunction rec = ir.function(c, "rec", Visibility.PRIVATE);
    IrCall self = ir.call(rec);
    self.setDispatchReceiver(ir.get(rec.getDispatchReceiverParameter()));
    IrFixtures.body(rec).getStatements().add(self);

    lower();
    IrSimpleFunction recs = (IrSimpleFunction)c.getDeclarations().get(3);
    IrCall call = onlyCall(recs);
    assertSame(recs.getSymbol(), call.getSymbol());
    assertNull(call.getDispatchReceiver());
    assertEquals(1, call.getValueArgumentsCount());
    assertSame(recs.getValueParameters().get(0).getSymbol(),
               ((IrGetValue)call.getValueArgument(0)).getSymbol());
  }

  @Test
  public void testPrivateAccessor() {
    IrProperty prop = ir.property(c, "v", Visibility.PRIVATE);
    IrSimpleFunction getter = prop.getGetter();

    lower();
    assertNotSame(getter, prop.getGetter());
    assertNull(prop.getGetter().getDispatchReceiverParameter());
    assertSame(prop.getSymbol(),
               prop.getGetter().getCorrespondingPropertySymbol());
    assertEquals(1, prop.getGetter().getValueParameters().size());
  }

  @Test
  public void testTopLevelPrivateUntouched() {
    IrSimpleFunction top = ir.function(file, "top", Visibility.PRIVATE);
    lower();
    assertSame(top, file.getDeclarations().get(1));
  }

  @Test
  public void testPipelineSkipsDisabledPass() {
    Settings settings = Settings.defaultSettings();
    settings.set(Settings.LOWER_PRIVATE_MEMBERS, "false");
    LoweringPipeline.standard(settings).runPipeline(
                                    Logging.getMidendLogger(), file);
    assertSame(p, c.getDeclarations().get(0));
  }

  @Test
  public void testPipelineRejectsMalformedSetting() {
    Settings settings = Settings.defaultSettings();
    settings.set(Settings.LOWER_PRIVATE_MEMBERS, "sometimes");
    exception.expect(MidendRuntimeError.class);
    LoweringPipeline.standard(settings).runPipeline(
                                    Logging.getMidendLogger(), file);
  }
}
