package com.cliffc.sx.node;

import com.cliffc.sx.Op;

// One operator applied to two ordered operands.  Commutative operators are not
// normalized; equality matches the swapped pairing instead.
public final class BinaryNode extends SXNode {
  public final Op _op;
  SXNode _x, _y;

  BinaryNode( Op op, SXNode x, SXNode y ) {
    super(x._ctx);
    assert op.isBinary() && x._ctx==y._ctx;
    _op = op;
    _x = x.keep();
    _y = y.keep();
  }

  @Override public Op op() { return _op; }
  @Override public int len() { return _x==null ? 0 : 2; }
  @Override SXNode in( int i ) { return i==0 ? _x : _y; }
  @Override void clear() { _x = _y = null; }

  @Override boolean _isEqual( SXNode n, int depth ) {
    assert depth > 0;
    if( !(n instanceof BinaryNode b) || b._op!=_op ) return false;
    if( isEqual(_x,b._x,depth-1) && isEqual(_y,b._y,depth-1) ) return true;
    return _op._comm && isEqual(_x,b._y,depth-1) && isEqual(_y,b._x,depth-1);
  }
}
