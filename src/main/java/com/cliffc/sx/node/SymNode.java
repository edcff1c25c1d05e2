package com.cliffc.sx.node;

import com.cliffc.sx.Op;
import com.cliffc.sx.SXContext;

// Named free variable.  Never hash-consed: two symbols with the same name are
// distinct nodes.
public final class SymNode extends SXNode {
  public final String _name;
  public SymNode( SXContext ctx, String name ) { super(ctx); _name = name; }
  @Override public Op op() { return Op.PARAMETER; }
  @Override public boolean isSymbolic() { return true; }
  @Override public String getName() { return _name; }
}
