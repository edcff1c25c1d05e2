package com.cliffc.sx.node;

import com.cliffc.sx.util.Ary;
import com.cliffc.sx.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.IdentityHashMap;

// Human-readable expression printer.  Operator nodes used more than once
// within the printed expression are printed once, as "@k=..." definitions
// ahead of the root expression:
//
//   @1=(x+y), (sin(@1)+cos(@1))
//
// Not a stable format.
public abstract class NodePrinter {
  public static @NotNull String print( @NotNull SXNode root ) {
    if( root.isDead() ) return "<dead "+root._uid+">";
    Ary<SXNode> order = Walk.postOrder(root);

    // Parent references within this expression
    IdentityHashMap<SXNode,Integer> refs = new IdentityHashMap<>();
    for( SXNode n : order )
      for( int i=0; i<n.len(); i++ )
        refs.merge(n.in(i),1,Integer::sum);

    IdentityHashMap<SXNode,String> strs = new IdentityHashMap<>();
    SB defs = new SB();
    int k=1;
    for( SXNode n : order ) {
      String s = str(n,strs);
      if( n != root && n.hasDep() && refs.getOrDefault(n,0) > 1 ) {
        String name = "@"+(k++);
        defs.p(name).p('=').p(s).p(", ");
        s = name;
      }
      strs.put(n,s);
    }
    return defs.p(strs.get(root)).toString();
  }

  private static String str( SXNode n, IdentityHashMap<SXNode,String> strs ) {
    if( n instanceof SymNode sym ) return sym._name;
    if( n instanceof ConNode con ) return new SB().p(con.getValue()).toString();
    String x = strs.get(n.in(0));
    String y = n.len()==2 ? strs.get(n.in(1)) : null;
    return n.op().print(new SB(),x,y).toString();
  }
}
