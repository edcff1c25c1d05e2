package com.cliffc.sx;

import com.cliffc.sx.node.*;
import org.jetbrains.annotations.NotNull;

/** Counted handle on one expression node.
 *
 *  <p>A handle owns one reference: {@link #dup} adds a reference, {@link #set}
 *  moves the handle to another node, {@link #close} gives the reference up and
 *  the node dies with its last reference.  Every operation returns a fresh
 *  handle the caller owns.  Using a closed handle is an error.
 *
 *  <p>Two handles are {@code equals} when they hold the very same node.
 */
public class SXElem implements AutoCloseable {
  private SXNode _n;            // Null once closed

  // Adopt and count a node
  public SXElem( @NotNull SXNode n ) { _n = n.keep(); }

  public @NotNull SXNode node() {
    if( _n==null ) throw SX.err("Use of a closed expression handle");
    return _n;
  }
  private SXContext ctx() { return node()._ctx; }

  // Another reference to the same node
  public @NotNull SXElem dup() { return new SXElem(node()); }

  // Release the old node, adopt the new one.  Same node is a no-op, so the
  // count never touches zero in between.
  public SXElem set( @NotNull SXElem x ) {
    SXNode old = node(), nnn = x.node();
    if( old == nnn ) return this;
    nnn.keep();                 // Before the release, in case 'old' holds 'nnn'
    _n = nnn;
    old.release();
    return this;
  }
  public SXElem set( double d ) {
    try( SXElem c = ctx().con(d) ) { return set(c); }
  }

  @Override public void close() {
    if( _n==null ) return;
    SXNode n = _n;
    _n = null;
    n.release();
  }
  public boolean isClosed() { return _n==null; }

  // Replace this node by 'x' when not identical but structurally equal up to
  // 'depth'.  Lets a caller collapse duplicate sub-expressions.
  public void assignIfDuplicate( @NotNull SXElem x, int depth ) {
    assert depth >= 1;
    if( node() != x.node() && SXNode.isEqual(node(),x.node(),depth) )
      set(x);
  }
  public void assignIfDuplicate( @NotNull SXElem x ) { assignIfDuplicate(x,Math.max(1,ctx().eqDepth())); }

  // ---------------------------------------------------------------------------
  // Builders

  private SXElem un ( Op op ) { return new SXElem(Ideal.unary (op,node())); }
  private SXElem bin( Op op, SXElem y ) {
    SXNode yn = y.node();
    if( yn._ctx != ctx() ) throw SX.err("Operands of "+op+" belong to different contexts");
    return new SXElem(Ideal.binary(op,node(),yn));
  }
  private SXElem bin( Op op, double d ) {
    try( SXElem c = ctx().con(d) ) { return bin(op,c); }
  }

  public SXElem plus ( SXElem y ) { return bin(Op.ADD,y); }
  public SXElem minus( SXElem y ) { return bin(Op.SUB,y); }
  public SXElem times( SXElem y ) { return bin(Op.MUL,y); }
  public SXElem div  ( SXElem y ) { return bin(Op.DIV,y); }
  public SXElem plus ( double d ) { return bin(Op.ADD,d); }
  public SXElem minus( double d ) { return bin(Op.SUB,d); }
  public SXElem times( double d ) { return bin(Op.MUL,d); }
  public SXElem div  ( double d ) { return bin(Op.DIV,d); }

  public SXElem neg  () { return un(Op.NEG ); }
  public SXElem inv  () { return un(Op.INV ); }
  public SXElem sq   () { return un(Op.SQ  ); }
  public SXElem sqrt () { return un(Op.SQRT); }
  public SXElem exp  () { return un(Op.EXP ); }
  public SXElem log  () { return un(Op.LOG ); }
  public SXElem log10() {
    try( SXElem l = log() ) { return l.times(1.0/Math.log(10.0)); }
  }
  public SXElem sin  () { return un(Op.SIN  ); }
  public SXElem cos  () { return un(Op.COS  ); }
  public SXElem tan  () { return un(Op.TAN  ); }
  public SXElem asin () { return un(Op.ASIN ); }
  public SXElem acos () { return un(Op.ACOS ); }
  public SXElem atan () { return un(Op.ATAN ); }
  public SXElem sinh () { return un(Op.SINH ); }
  public SXElem cosh () { return un(Op.COSH ); }
  public SXElem tanh () { return un(Op.TANH ); }
  public SXElem asinh() { return un(Op.ASINH); }
  public SXElem acosh() { return un(Op.ACOSH); }
  public SXElem atanh() { return un(Op.ATANH); }
  public SXElem floor() { return un(Op.FLOOR); }
  public SXElem ceil () { return un(Op.CEIL ); }
  public SXElem fabs () { return un(Op.FABS ); }
  public SXElem sign () { return un(Op.SIGN ); }
  public SXElem erf  () { return un(Op.ERF  ); }
  public SXElem erfinv() { return un(Op.ERFINV); }
  public SXElem not  () { return un(Op.NOT  ); }

  public SXElem pow     ( SXElem n ) { return bin(Op.POW,n); }
  public SXElem pow     ( double n ) { return bin(Op.POW,n); }
  public SXElem constpow( SXElem n ) { return bin(Op.CONSTPOW,n); }
  public SXElem copysign( SXElem y ) { return bin(Op.COPYSIGN,y); }
  public SXElem fmod    ( SXElem y ) { return bin(Op.FMOD,y); }
  public SXElem fmin    ( SXElem y ) { return bin(Op.FMIN,y); }
  public SXElem fmax    ( SXElem y ) { return bin(Op.FMAX,y); }
  public SXElem atan2   ( SXElem y ) { return bin(Op.ATAN2,y); }
  public SXElem printme ( SXElem y ) { return bin(Op.PRINTME,y); }

  public SXElem lt ( SXElem y ) { return bin(Op.LT,y); }
  public SXElem le ( SXElem y ) { return bin(Op.LE,y); }
  public SXElem gt ( SXElem y ) { return y.lt(this); }
  public SXElem ge ( SXElem y ) { return y.le(this); }
  public SXElem eq ( SXElem y ) { return bin(Op.EQ,y); }
  public SXElem ne ( SXElem y ) { return bin(Op.NE,y); }
  public SXElem and( SXElem y ) { return bin(Op.AND,y); }
  public SXElem or ( SXElem y ) { return bin(Op.OR ,y); }
  // this ? y : 0
  public SXElem ifElseZero( SXElem y ) { return bin(Op.IF_ELSE_ZERO,y); }

  // ---------------------------------------------------------------------------
  // Queries

  public boolean isLeaf    () { return node().isLeaf(); }
  public boolean isConstant() { return node().isConstant(); }
  public boolean isInteger () { return node().isInteger(); }
  public boolean isSymbolic() { return node().isSymbolic(); }
  public boolean hasDep    () { return node().hasDep(); }
  public boolean isZero    () { return node().isZero(); }
  public boolean isOne     () { return node().isOne(); }
  public boolean isTwo     () { return node().isTwo(); }
  public boolean isMinusOne() { return node().isMinusOne(); }
  public boolean isNan     () { return node().isNan(); }
  public boolean isInf     () { return node().isInf(); }
  public boolean isMinusInf() { return node().isMinusInf(); }
  public boolean isAlmostZero( double tol ) { return node().isAlmostZero(tol); }
  public boolean isNonNegative() { return node().isNonNegative(); }
  public boolean isDoubled () { return node().isDoubled(); }
  public boolean isOp( Op op ) { return node().isOp(op); }

  public boolean isCommutative() {
    if( !hasDep() ) throw SX.err("Commutativity of leaf "+this);
    return node().op()._comm;
  }
  public boolean isRegular() {
    if( !(node() instanceof ConNode con) ) throw SX.err("Cannot check regularity of non-constant "+this);
    return con.isRegular();
  }
  // Truth value of a constant
  public boolean toBoolean() {
    if( !isConstant() ) throw SX.err("Cannot take the truth value of symbolic "+this);
    return !isZero();
  }

  public double getValue   () { return node().getValue(); }
  public int    getIntValue() { return node().getIntValue(); }
  public String getName    () { return node().getName(); }
  public Op     getOp      () { return node().op(); }
  public SXElem getDep( int i ) { return new SXElem(node().dep(i)); }
  public SXElem getDep() { return getDep(0); }
  public int getNdeps() {
    if( !hasDep() ) throw SX.err("Operand count of leaf "+this);
    return node().len();
  }

  public static boolean isEqual( @NotNull SXElem x, @NotNull SXElem y, int depth ) {
    return SXNode.isEqual(x.node(),y.node(),depth);
  }
  public boolean isEqual( @NotNull SXElem y, int depth ) { return isEqual(this,y,depth); }

  // Scratch fields for external traversals
  public int  getTemp() { return node().temp(); }
  public void setTemp( int t ) { node().temp(t); }
  public boolean marked() { return node().marked(); }
  public void mark  () { node().mark(true ); }
  public void unmark() { node().mark(false); }

  // Distinct nodes reachable from here, this one included
  public int nodeCount() { return Walk.postOrder(node()).len(); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof SXElem x && _n!=null && _n==x._n;
  }
  // Follows the held node, so a handle moved by 'set' or closed while sitting
  // in a hashed collection is lost there.  Closed handles hash to 0.
  @Override public int hashCode() { return _n==null ? 0 : _n._uid; }
  @Override public String toString() { return _n==null ? "<closed>" : NodePrinter.print(_n); }
}
