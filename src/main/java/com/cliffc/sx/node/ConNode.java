package com.cliffc.sx.node;

import com.cliffc.sx.Op;
import com.cliffc.sx.SXContext;

// Numeric constant.  Hash-consed per context: at most one node per value, made
// only by the context's constant cache, which pins it for the context's life.
public abstract class ConNode extends SXNode {
  ConNode( SXContext ctx ) { super(ctx); }

  @Override public Op op() { return Op.CONST; }
  @Override public boolean isConstant() { return true; }
  @Override public abstract double getValue();
  @Override public boolean isAlmostZero( double tol ) { return Math.abs(getValue()) <= tol; }
  // Neither NaN nor an infinity
  public boolean isRegular() { return !isNan() && !isInf() && !isMinusInf(); }
}
