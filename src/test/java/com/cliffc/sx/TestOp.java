package com.cliffc.sx;

import com.cliffc.sx.util.SB;
import org.junit.Test;

import static org.junit.Assert.*;

// Operator table: arities, flags and numeric semantics
public class TestOp {
  @Test public void testFlags() {
    for( Op op : Op.values() ) {
      switch( op ) {
      case CONST: case PARAMETER: assertEquals(op.toString(),0,op._nargs); break;
      default: assertTrue(op.toString(), op.isUnary() || op.isBinary());
      }
      boolean comm = op==Op.ADD || op==Op.MUL || op==Op.EQ || op==Op.NE ||
        op==Op.AND || op==Op.OR || op==Op.FMIN || op==Op.FMAX;
      assertEquals(op.toString(),comm,op._comm);
      if( op._comm ) assertTrue(op.isBinary());
    }
    assertTrue (Op.LT .isLogical());
    assertTrue (Op.NOT.isLogical());
    assertFalse(Op.ADD.isLogical());
    assertFalse(Op.IF_ELSE_ZERO.isLogical());
    assertEquals(1,Op.INV._nargs);
    assertEquals(2,Op.IF_ELSE_ZERO._nargs);
    assertEquals(2,Op.PRINTME._nargs);
  }

  @Test public void testArith() {
    assertEquals( 5.0,Op.ADD.eval(2,3),0);
    assertEquals(-1.0,Op.SUB.eval(2,3),0);
    assertEquals( 6.0,Op.MUL.eval(2,3),0);
    assertEquals( 0.5,Op.DIV.eval(1,2),0);
    assertEquals(-2.0,Op.NEG.eval(2,0),0);
    assertEquals( 9.0,Op.SQ .eval(-3,0),0);
    assertEquals(0.25,Op.INV.eval(4,0),0);
    assertEquals( 8.0,Op.POW.eval(2,3),0);
    assertEquals( 8.0,Op.CONSTPOW.eval(2,3),0);
    assertEquals( 3.0,Op.SQRT.eval(9,0),0);
    assertEquals(-1.0,Op.FMOD.eval(-7,3),0);  // Truncating
    assertEquals( 1.0,Op.FMOD.eval(7,-3),0);
    assertEquals( 2.0,Op.FLOOR.eval(2.7,0),0);
    assertEquals(-2.0,Op.CEIL.eval(-2.7,0),0);
    assertEquals( 2.5,Op.FABS.eval(-2.5,0),0);
    assertEquals(-3.0,Op.COPYSIGN.eval(3,-0.0),0);
    assertEquals( 7.0,Op.PRINTME.eval(7,1),0);
    assertTrue(Double.isInfinite(Op.DIV.eval(1,0)));
    assertTrue(Double.isNaN(Op.LOG.eval(-1,0)));
  }

  @Test public void testTranscendental() {
    double x = 0.3;
    assertEquals(Math.exp (x),Op.EXP .eval(x,0),0);
    assertEquals(Math.log (x),Op.LOG .eval(x,0),0);
    assertEquals(Math.sin (x),Op.SIN .eval(x,0),0);
    assertEquals(Math.cos (x),Op.COS .eval(x,0),0);
    assertEquals(Math.tan (x),Op.TAN .eval(x,0),0);
    assertEquals(Math.asin(x),Op.ASIN.eval(x,0),0);
    assertEquals(Math.acos(x),Op.ACOS.eval(x,0),0);
    assertEquals(Math.atan(x),Op.ATAN.eval(x,0),0);
    assertEquals(Math.sinh(x),Op.SINH.eval(x,0),0);
    assertEquals(Math.cosh(x),Op.COSH.eval(x,0),0);
    assertEquals(Math.tanh(x),Op.TANH.eval(x,0),0);
    assertEquals(Math.atan2(1,-1),Op.ATAN2.eval(1,-1),0);
    assertEquals(0.881373587019543 ,Op.ASINH.eval( 1  ,0),1e-14);
    assertEquals(-0.881373587019543,Op.ASINH.eval(-1  ,0),1e-14);
    assertEquals(1.3169578969248166,Op.ACOSH.eval( 2  ,0),1e-14);
    assertEquals(0.5493061443340549,Op.ATANH.eval( 0.5,0),1e-14);
    assertTrue(Double.isNaN(Op.ACOSH.eval(0.5,0)));
    assertEquals(Double.POSITIVE_INFINITY,Op.ATANH.eval(1,0),0);
    assertEquals(Double.NEGATIVE_INFINITY,Op.ATANH.eval(-1,0),0);
    assertTrue(Double.isNaN(Op.ATANH.eval(2,0)));
    assertEquals(0.0,Op.ACOSH.eval(1,0),0);
    // Huge arguments do not overflow, tiny ones keep their digits
    assertEquals( 691.4686750787736,Op.ASINH.eval( 1e300,0),1e-12);
    assertEquals(-691.4686750787736,Op.ASINH.eval(-1e300,0),1e-12);
    assertEquals( 691.4686750787736,Op.ACOSH.eval( 1e300,0),1e-12);
    assertEquals( 1e-20,Op.ASINH.eval( 1e-20,0),1e-36);
    assertEquals(-1e-20,Op.ASINH.eval(-1e-20,0),1e-36);
    assertEquals( 1e-20,Op.ATANH.eval( 1e-20,0),1e-36);
    assertEquals(-1e-20,Op.ATANH.eval(-1e-20,0),1e-36);
    assertEquals(Double.POSITIVE_INFINITY,Op.ASINH.eval(Double.POSITIVE_INFINITY,0),0);
    assertEquals(Double.POSITIVE_INFINITY,Op.ACOSH.eval(Double.POSITIVE_INFINITY,0),0);
  }

  @Test public void testErf() {
    assertEquals( 0.0               ,Op.ERF.eval( 0  ,0),0);
    assertEquals( 0.5204998778130465,Op.ERF.eval( 0.5,0),1e-14);
    assertEquals(-0.8427007929497149,Op.ERF.eval(-1  ,0),1e-14);
    assertEquals( 0.9953222650189527,Op.ERF.eval( 2  ,0),1e-14);
    assertEquals( 0.9999779095030014,Op.ERF.eval( 3  ,0),1e-14);
    assertEquals( 1.0               ,Op.ERF.eval(10  ,0),0);
    assertEquals(-1.0,Op.ERF.eval(Double.NEGATIVE_INFINITY,0),0);
    for( double v : new double[]{-0.99,-0.5,-0.1,0.1,0.3,0.7,0.95,0.999} )
      assertEquals(v,Op.ERF.eval(Op.ERFINV.eval(v,0),0),1e-13);
    assertEquals(Double.POSITIVE_INFINITY,Op.ERFINV.eval( 1,0),0);
    assertEquals(Double.NEGATIVE_INFINITY,Op.ERFINV.eval(-1,0),0);
    assertTrue(Double.isNaN(Op.ERFINV.eval(1.5,0)));
  }

  // Logic: any non-zero, including NaN, is true
  @Test public void testLogic() {
    double nan = Double.NaN;
    assertEquals(1.0,Op.LT.eval(1,2),0);
    assertEquals(0.0,Op.LT.eval(2,2),0);
    assertEquals(1.0,Op.LE.eval(2,2),0);
    assertEquals(1.0,Op.EQ.eval(2,2),0);
    assertEquals(0.0,Op.NE.eval(2,2),0);
    assertEquals(1.0,Op.NE.eval(nan,nan),0);
    assertEquals(0.0,Op.EQ.eval(nan,nan),0);
    assertEquals(1.0,Op.NOT.eval(0,0),0);
    assertEquals(0.0,Op.NOT.eval(nan,0),0);
    assertEquals(1.0,Op.AND.eval(nan,3),0);
    assertEquals(0.0,Op.AND.eval(0,3),0);
    assertEquals(1.0,Op.OR .eval(0,-2),0);
    assertEquals(0.0,Op.OR .eval(0,0),0);
    assertEquals(5.0,Op.IF_ELSE_ZERO.eval(1,5),0);
    assertEquals(0.0,Op.IF_ELSE_ZERO.eval(0,5),0);
    assertEquals(5.0,Op.IF_ELSE_ZERO.eval(nan,5),0);
  }

  @Test public void testMinMaxSign() {
    double nan = Double.NaN;
    assertEquals(2.0,Op.FMIN.eval(nan,2),0);
    assertEquals(2.0,Op.FMAX.eval(2,nan),0);
    assertEquals(1.0,Op.FMIN.eval(1,2),0);
    assertEquals(2.0,Op.FMAX.eval(1,2),0);
    assertTrue(Double.isNaN(Op.FMIN.eval(nan,nan)));
    assertEquals(-1.0,Op.SIGN.eval(-3,0),0);
    assertEquals( 1.0,Op.SIGN.eval( 3,0),0);
    assertEquals( 0.0,Op.SIGN.eval( 0,0),0);
    assertTrue(Double.isNaN(Op.SIGN.eval(nan,0)));
  }

  @Test public void testLeavesHaveNoSemantics() {
    assertThrows(RuntimeException.class, () -> Op.CONST.eval(1,2));
    assertThrows(RuntimeException.class, () -> Op.PARAMETER.eval(1,2));
  }

  @Test public void testPrint() {
    assertEquals("(a+b)"     ,Op.ADD.print(new SB(),"a","b").toString());
    assertEquals("sin(a)"    ,Op.SIN.print(new SB(),"a",null).toString());
    assertEquals("pow(a,b)"  ,Op.POW.print(new SB(),"a","b").toString());
    assertEquals("(-a)"      ,Op.NEG.print(new SB(),"a",null).toString());
    assertEquals("(c?y:0)"   ,Op.IF_ELSE_ZERO.print(new SB(),"c","y").toString());
  }
}
