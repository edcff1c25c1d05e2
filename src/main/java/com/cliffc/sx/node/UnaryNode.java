package com.cliffc.sx.node;

import com.cliffc.sx.Op;

// One operator applied to one operand.  Built only by the simplifier.
public final class UnaryNode extends SXNode {
  public final Op _op;
  SXNode _x;

  UnaryNode( Op op, SXNode x ) {
    super(x._ctx);
    assert op.isUnary();
    _op = op;
    _x = x.keep();
  }

  @Override public Op op() { return _op; }
  @Override public int len() { return _x==null ? 0 : 1; }
  @Override SXNode in( int i ) { return _x; }
  @Override void clear() { _x = null; }

  @Override boolean _isEqual( SXNode n, int depth ) {
    assert depth > 0;
    return n instanceof UnaryNode u && u._op==_op && isEqual(_x,u._x,depth-1);
  }
}
