package exm.midend.ir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.midend.ir.IrExpressions.ConstKind;
import exm.midend.ir.IrExpressions.IrConst;

public class IrConstTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testIntConst() {
    IrConst c = IrConst.intConst(0, 0, new IrFixtures().intType(), 7);
    assertEquals(ConstKind.INT, c.getKind());
    assertEquals(7, c.getValue());
  }

  @Test
  public void testNullConst() {
    IrConst c = IrConst.constNull(0, 0, new IrFixtures().unitType());
    assertEquals(ConstKind.NULL, c.getKind());
    assertNull(c.getValue());
  }

  @Test
  public void testNullKindWithValue() {
    exception.expect(AssertionError.class);
    exception.expectMessage("NULL 1");
    new IrConst(0, 0, new IrFixtures().unitType(), ConstKind.NULL, 1);
  }
}
