package com.cliffc.sx.node;

import com.cliffc.sx.util.Ary;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

// Graph walks, iterative so deep expressions do not blow the stack.
public abstract class Walk {
  // Distinct nodes reachable from 'root', operands before their users; 'root'
  // is last.
  public static @NotNull Ary<SXNode> postOrder( @NotNull SXNode root ) {
    Ary<SXNode> order = new Ary<>(SXNode.class);
    Ary<SXNode> stack = new Ary<>(SXNode.class);
    // Sized by the walked graph, not by the context's uid range
    Set<SXNode> visit = Collections.newSetFromMap(new IdentityHashMap<>());
    Set<SXNode> done  = Collections.newSetFromMap(new IdentityHashMap<>());
    stack.push(root);
    while( !stack.isEmpty() ) {
      SXNode n = stack.last();
      if( visit.contains(n) ) {   // Second time on top: all operands are done
        stack.pop();
        if( !done.contains(n) ) { done.add(n); order.push(n); }
        continue;
      }
      visit.add(n);
      for( int i=n.len()-1; i>=0; i-- )
        if( !visit.contains(n.in(i)) )
          stack.push(n.in(i));
    }
    return order;
  }
}
