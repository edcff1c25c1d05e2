package com.cliffc.sx;

import org.junit.Test;

import static org.junit.Assert.*;

// Handles own counted references; nodes die with their last reference.
public class TestRefCount {
  @Test public void testCloseKills() {
    SXContext C = new SXContext();
    int base = C.liveNodes();
    SXElem x = C.sym("x"), y = C.sym("y");
    SXElem s = x.plus(y);
    assertEquals(base+3,C.liveNodes());
    x.close();
    y.close();
    assertEquals(base+3,C.liveNodes()); // Still held by the sum
    assertEquals(2,s.node().dep(0).cnt()+s.node().dep(1).cnt());
    s.close();
    assertEquals(base,C.liveNodes());
    s.close();                  // Idempotent
    assertEquals(base,C.liveNodes());
  }

  @Test public void testDup() {
    SXContext C = new SXContext();
    int base = C.liveNodes();
    SXElem x = C.sym("x");
    SXElem d = x.dup();
    assertEquals(2,x.node().cnt());
    assertEquals(x,d);
    x.close();
    assertEquals(base+1,C.liveNodes());
    assertEquals("x",d.getName());
    d.close();
    assertEquals(base,C.liveNodes());
  }

  @Test public void testSelfAssign() {
    SXContext C = new SXContext();
    try( SXElem x = C.sym("x"); SXElem x2 = x.dup() ) {
      x.set(x2);
      x.set(x);
      assertEquals(2,x.node().cnt());
      assertFalse(x.node().isDead());
    }
  }

  @Test public void testSet() {
    SXContext C = new SXContext();
    int base = C.liveNodes();
    try( SXElem a = C.sym("a"); SXElem b = C.sym("b") ) {
      assertEquals(base+2,C.liveNodes());
      a.set(b);
      assertEquals(base+1,C.liveNodes());
      assertSame(a.node(),b.node());
      assertEquals(2,b.node().cnt());
      a.set(3.5);
      assertEquals(3.5,a.getValue(),0);
      assertEquals(1,b.node().cnt());
    }
    assertEquals(base+1,C.liveNodes()); // Only the cached 3.5 remains
  }

  // Moving a handle onto an operand of its own node
  @Test public void testSetToOwnOperand() {
    SXContext C = new SXContext();
    int base = C.liveNodes();
    SXElem x = C.sym("x");
    SXElem e = x.sin();
    x.close();
    assertEquals(base+2,C.liveNodes());
    try( SXElem d = e.getDep() ) { e.set(d); }
    assertEquals(base+1,C.liveNodes());
    assertTrue(e.isSymbolic());
    assertEquals(1,e.node().cnt());
    e.close();
    assertEquals(base,C.liveNodes());
  }

  @Test public void testClosedHandle() {
    SXContext C = new SXContext();
    SXElem x = C.sym("x");
    x.close();
    assertTrue(x.isClosed());
    assertEquals("<closed>",x.toString());
    assertThrows(SXException.class, x::sin);
    assertThrows(SXException.class, x::dup);
    assertThrows(SXException.class, x::getName);
  }

  // A long chain dies without recursion
  @Test public void testDeepChain() {
    SXContext C = new SXContext();
    int base = C.liveNodes();
    SXElem e = C.sym("x");
    for( int i=0; i<100000; i++ )
      try( SXElem t = e.sin() ) { e.set(t); }
    assertEquals(base+100001,C.liveNodes());
    assertEquals(100001,e.nodeCount());
    e.close();
    assertEquals(base,C.liveNodes());
  }

  @Test public void testAssignIfDuplicate() {
    SXContext C = new SXContext();
    int base = C.liveNodes();
    try( SXElem x = C.sym("x"); SXElem a = x.sin(); SXElem b = x.sin(); SXElem c = x.cos() ) {
      assertNotSame(a.node(),b.node());
      assertEquals(base+4,C.liveNodes());
      a.assignIfDuplicate(b,1);
      assertSame(a.node(),b.node());
      assertEquals(base+3,C.liveNodes());
      c.assignIfDuplicate(b,2);
      assertTrue(c.isOp(Op.COS));
    }
    assertEquals(base,C.liveNodes());
  }

  // Equal only past depth 1: not replaced at depth 1
  @Test public void testAssignIfDuplicateDepth() {
    SXContext C = new SXContext();
    try( SXElem x = C.sym("x"); SXElem y = C.sym("y");
         SXElem s1 = x.plus(y); SXElem s2 = x.plus(y);
         SXElem a = s1.sin(); SXElem b = s2.sin() ) {
      a.assignIfDuplicate(b,1);
      assertNotSame(a.node(),b.node());
      a.assignIfDuplicate(b,2);
      assertSame(a.node(),b.node());
    }
  }

  // Temporaries built while rewriting are reclaimed
  // The one-argument form compares at the context's equality depth
  @Test public void testAssignIfDuplicateContextDepth() {
    SXContext C = new SXContext().eqDepth(2);
    try( SXElem x = C.sym("x"); SXElem y = C.sym("y");
         SXElem a = x.plus(y); SXElem b = x.plus(y);
         SXElem s = a.sin(); SXElem t = b.sin() ) {
      assertNotSame(s.node(),t.node());
      s.assignIfDuplicate(t);
      assertSame(t.node(),s.node());
    }
  }

  // Closed handles still hash, and stop being equal to anything else
  @Test public void testClosedHash() {
    SXContext C = new SXContext();
    SXElem x = C.sym("x");
    SXElem d = x.dup();
    assertEquals(x.hashCode(),d.hashCode());
    x.close();
    assertEquals(0,x.hashCode());
    assertNotEquals(x,d);
    assertEquals(x,x);
    d.close();
  }

  @Test public void testTemporariesReclaimed() {
    SXContext C = new SXContext();
    int base = C.liveNodes();
    try( SXElem x = C.sym("x"); SXElem y = C.sym("y") ) {
      try( SXElem lt = x.lt(y) ) {
        assertTrue(lt.isOp(Op.LT));
        assertEquals(base+3,C.liveNodes()); // x, y, x<y
      }
      try( SXElem p = x.pow(2) ) {
        assertTrue(p.isOp(Op.SQ));
        assertEquals(base+3,C.liveNodes()); // x, y, sq(x)
      }
      int cons = C.cachedConstants();
      try( SXElem p = x.pow(5) ) {
        assertTrue(p.isOp(Op.MUL));
        assertEquals(4,p.nodeCount()); // x*sq(sq(x))
        assertEquals(base+2+4-1+C.cachedConstants()-cons,C.liveNodes());
      }
      assertEquals(base+2+C.cachedConstants()-cons,C.liveNodes());
    }
  }
}
