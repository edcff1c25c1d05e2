package com.cliffc.sx.node;

import com.cliffc.sx.Op;
import com.cliffc.sx.SX;
import com.cliffc.sx.SXContext;
import com.cliffc.sx.util.Ary;

// Scalar expression node.  Nodes are immutable once built: the operator and
// operands never change, only the scratch fields 'temp' and 'marked'.  The
// graph is a DAG; operands are shared and reference-counted.
//
// The count is the number of live handles on the node, plus one per parent
// operand slot, plus one pin from the context for cached constants.  A node is
// killed when the count falls to zero; killing releases its operands and may
// kill them in turn.
public abstract class SXNode {
  public final int _uid;        // Dense unique id, per context
  public final SXContext _ctx;  // Owning context
  int _cnt;                     // Reference count
  int _temp;                    // Scratch, for external traversals
  boolean _marked;              // Scratch, for external traversals
  boolean _dead;                // Set once killed

  SXNode( SXContext ctx ) {
    _ctx = ctx;
    _uid = ctx.newuid();
  }

  public abstract Op op();

  // Operand count; 0 for leaves.
  public int len() { return 0; }
  // Raw operand access, no checking.  Null once killed.
  SXNode in( int i ) { throw SX.TODO(); }
  // Null out operands after a kill.
  void clear() { }

  // Checked operand access
  public SXNode dep( int i ) {
    if( !hasDep() ) throw SX.err("Leaf "+this+" has no operands");
    if( i<0 || i>=len() ) throw SX.err("Operand index "+i+" out of range for "+op()+" with "+len()+" operands");
    return in(i);
  }

  // ---------------------------------------------------------------------------
  // Reference counting

  public int cnt() { return _cnt; }
  public boolean isDead() { return _dead; }

  // Count a reference.  Returns this for flow-coding.
  public SXNode keep() { assert !_dead; _cnt++; return this; }
  // Drop a reference without killing; for temporarily pinning fresh nodes.
  public SXNode unkeep() { assert _cnt>0; _cnt--; return this; }
  // Drop a reference, killing on the last one.
  public void release() {
    assert _cnt>0 && !_dead;
    if( --_cnt==0 ) kill();
  }

  // Kill a node with no references.  All operands are released, and those
  // falling to zero are killed from a worklist so long chains do not blow the
  // stack.  Returns this.
  public SXNode kill() {
    if( _dead ) return this;
    assert _cnt==0;
    Ary<SXNode> work = new Ary<>(SXNode.class);
    work.push(this);
    while( !work.isEmpty() ) {
      SXNode n = work.pop();
      n._dead = true;
      _ctx.died(n);
      for( int i=0; i<n.len(); i++ ) {
        SXNode d = n.in(i);
        assert d._cnt>0;
        if( --d._cnt==0 ) work.push(d);
      }
      n.clear();                // Poor-man's indication of a dead node
    }
    return this;
  }

  // Kill 'this' if nothing references it, keeping 'n' alive.  Returns 'n'.
  // Used to reclaim temporaries built while rewriting.
  public SXNode kill( SXNode n ) {
    if( n==this || _cnt>0 || _dead ) return n;
    if( n!=null ) n.keep();
    kill();
    return n==null ? null : n.unkeep();
  }

  // ---------------------------------------------------------------------------
  // Classification

  public boolean isConstant() { return false; }
  public boolean isInteger () { return false; }
  public boolean isSymbolic() { return false; }
  public boolean hasDep() { return len()>0; }
  public boolean isLeaf() { return !hasDep(); }
  public boolean isOp( Op op ) { return hasDep() && op()==op; }

  public boolean isZero    () { return this==_ctx.ZERO; }
  public boolean isOne     () { return this==_ctx.ONE; }
  public boolean isTwo     () { return this==_ctx.TWO; }
  public boolean isMinusOne() { return this==_ctx.MINUS_ONE; }
  public boolean isNan     () { return this==_ctx.NAN; }
  public boolean isInf     () { return this==_ctx.INF; }
  public boolean isMinusInf() { return this==_ctx.MINUS_INF; }
  public boolean isAlmostZero( double tol ) { return false; }

  // Provably >= 0 without evaluating
  public boolean isNonNegative() {
    if( isConstant() ) return getValue() >= 0;
    return isOp(Op.SQ) || isOp(Op.FABS);
  }

  // x+x, up to structural equality
  public boolean isDoubled() {
    return isOp(Op.ADD) && isEqual(in(0),in(1),_ctx.eqDepth());
  }

  public double getValue() { throw SX.err("Cannot get the value of non-constant "+this); }
  public int getIntValue() { throw SX.err("Cannot get the integer value of non-constant "+this); }
  public String getName() { throw SX.err("Only symbols have a name, not "+this); }

  public int temp() { return _temp; }
  public void temp( int t ) { _temp = t; }
  public boolean marked() { return _marked; }
  public void mark( boolean m ) { _marked = m; }

  // ---------------------------------------------------------------------------
  // Structural equality: identical nodes are equal; otherwise, with depth
  // remaining, same operator and operands equal at one less depth.
  public static boolean isEqual( SXNode x, SXNode y, int depth ) {
    if( x==y ) return true;
    return depth > 0 && x._isEqual(y,depth);
  }
  // Leaves compare by identity only
  boolean _isEqual( SXNode n, int depth ) {
    assert depth > 0;
    return false;
  }

  @Override public String toString() { return NodePrinter.print(this); }
}
