package com.cliffc.sx.node;

import com.cliffc.sx.SXContext;

// Non-integral, non-int-range or non-finite constant
public final class RealNode extends ConNode {
  public final double _con;
  public RealNode( SXContext ctx, double con ) { super(ctx); _con = con; }
  @Override public double getValue() { return _con; }
  // Truncates
  @Override public int getIntValue() { return (int)_con; }
}
