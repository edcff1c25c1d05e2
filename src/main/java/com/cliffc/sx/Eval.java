package com.cliffc.sx;

import com.cliffc.sx.node.SXNode;
import com.cliffc.sx.node.Walk;
import org.jetbrains.annotations.NotNull;

import java.util.IdentityHashMap;

/** Numeric evaluation of an expression graph under a binding of its symbols.
 *  Shared sub-expressions are evaluated once; the walk is iterative.
 */
public class Eval {
  private final IdentityHashMap<SXNode,Double> _binds = new IdentityHashMap<>();

  // Bind a symbol to a value.  Returns this for flow-coding.
  public Eval bind( @NotNull SXElem sym, double v ) {
    SXNode n = sym.node();
    if( !n.isSymbolic() ) throw SX.err("Can only bind symbols, not "+sym);
    _binds.put(n,v);
    return this;
  }

  public double eval( @NotNull SXElem x ) {
    IdentityHashMap<SXNode,Double> vals = new IdentityHashMap<>();
    double v = 0;
    for( SXNode n : Walk.postOrder(x.node()) ) {
      if( n.isConstant() ) v = n.getValue();
      else if( n.isSymbolic() ) {
        Double b = _binds.get(n);
        if( b==null ) throw SX.err("Unbound symbol "+n.getName());
        v = b;
      } else {
        double a = vals.get(n.dep(0));
        double c = n.len()==2 ? vals.get(n.dep(1)) : 0;
        v = n.op().eval(a,c);
      }
      vals.put(n,v);
    }
    return v;                   // Root is last
  }
}
