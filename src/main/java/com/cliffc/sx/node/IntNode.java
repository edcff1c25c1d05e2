package com.cliffc.sx.node;

import com.cliffc.sx.SXContext;

// Integer-valued constant
public final class IntNode extends ConNode {
  public final int _con;
  public IntNode( SXContext ctx, int con ) { super(ctx); _con = con; }
  @Override public boolean isInteger() { return true; }
  @Override public double getValue() { return _con; }
  @Override public int getIntValue() { return _con; }
}
