package com.cliffc.sx;

import com.cliffc.sx.node.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;

/** Owner of all shared expression state: the constant caches, the singleton
 *  constants, the node id source, the live-node counter and the simplifier
 *  settings.  Nothing is static; distinct contexts are fully independent.
 *  A context and its nodes are confined to one thread at a time.
 *
 *  <p>Constants are hash-consed: every numeric value maps to exactly one
 *  constant node, pinned by the context for its whole life.  Operator nodes
 *  are never hash-consed.
 */
public class SXContext {
  private static final Logger LOG = LogManager.getLogger(SXContext.class);

  private int _uid;             // Next node id
  private int _live;            // Nodes built and not yet killed
  private boolean _simplify;
  private int _eqDepth;

  private final HashMap<Integer,IntNode > _ints  = new HashMap<>();
  private final HashMap<Double ,RealNode> _reals = new HashMap<>();

  // Singletons, built eagerly and pinned forever
  public final IntNode  ZERO, ONE, TWO, MINUS_ONE;
  public final RealNode NAN, INF, MINUS_INF;

  public SXContext() {
    _simplify = Boolean.parseBoolean(System.getProperty(SX.PROP_SIMPLIFY,"true"));
    _eqDepth  = Integer.getInteger(SX.PROP_EQ_DEPTH,SX.EQ_DEPTH);
    if( _eqDepth < 0 ) throw SX.err("Negative equality depth "+_eqDepth+" from -D"+SX.PROP_EQ_DEPTH);
    ZERO      = pin(new IntNode (this, 0));
    ONE       = pin(new IntNode (this, 1));
    TWO       = pin(new IntNode (this, 2));
    MINUS_ONE = pin(new IntNode (this,-1));
    NAN       = pin(new RealNode(this,Double.NaN));
    INF       = pin(new RealNode(this,Double.POSITIVE_INFINITY));
    MINUS_INF = pin(new RealNode(this,Double.NEGATIVE_INFINITY));
    // 2 is also an ordinary integer cache entry
    _ints.put(2,TWO);
    LOG.debug("New context, simplify={} eqDepth={}",_simplify,_eqDepth);
  }

  private static <N extends SXNode> N pin( N n ) { n.keep(); return n; }

  // ---------------------------------------------------------------------------
  // Settings

  public boolean simplify() { return _simplify; }
  public SXContext simplify( boolean b ) {
    if( b != _simplify ) LOG.info("Simplification on the fly {}",b ? "enabled" : "disabled");
    _simplify = b;
    return this;
  }

  public int eqDepth() { return _eqDepth; }
  public SXContext eqDepth( int depth ) {
    if( depth < 0 ) throw SX.err("Negative equality depth "+depth);
    if( depth != _eqDepth ) LOG.info("Equality depth {} -> {}",_eqDepth,depth);
    _eqDepth = depth;
    return this;
  }

  // ---------------------------------------------------------------------------
  // Node bookkeeping, called by the nodes themselves

  public int newuid() { _live++; return _uid++; }
  public void died( SXNode n ) { assert n._ctx==this; _live--; }

  /** @return nodes built in this context and not yet killed, including the
   *  pinned constants */
  public int liveNodes() { return _live; }
  /** @return distinct non-singleton cached constants, plus the constant 2 */
  public int cachedConstants() { return _ints.size()+_reals.size(); }

  // ---------------------------------------------------------------------------
  // Constant canonicalization.  Integral values in int range take the integer
  // path, so -0.0 lands on ZERO.  Everything else takes the real path; the
  // non-finite values map to their singletons.
  public @NotNull ConNode conNode( double v ) {
    int i = (int)v;
    if( i==v ) {
      switch( i ) {
      case  0: return ZERO;
      case  1: return ONE;
      case -1: return MINUS_ONE;
      default: break;
      }
      IntNode n = _ints.get(i);
      if( n==null ) {
        _ints.put(i,n = pin(new IntNode(this,i)));
        LOG.trace("Cached integer constant {}",i);
      }
      return n;
    }
    if( Double.isNaN(v) ) return NAN;
    if( v==Double.POSITIVE_INFINITY ) return INF;
    if( v==Double.NEGATIVE_INFINITY ) return MINUS_INF;
    RealNode n = _reals.get(v);
    if( n==null ) {
      _reals.put(v,n = pin(new RealNode(this,v)));
      LOG.trace("Cached real constant {}",v);
    }
    return n;
  }

  // ---------------------------------------------------------------------------
  // Handle factories

  public @NotNull SXElem con( double v ) { return new SXElem(conNode(v)); }
  public @NotNull SXElem sym( @NotNull String name ) { return new SXElem(new SymNode(this,name)); }

  public @NotNull SXElem zero    () { return new SXElem(ZERO); }
  public @NotNull SXElem one     () { return new SXElem(ONE); }
  public @NotNull SXElem two     () { return new SXElem(TWO); }
  public @NotNull SXElem minusOne() { return new SXElem(MINUS_ONE); }
  public @NotNull SXElem nan     () { return new SXElem(NAN); }
  public @NotNull SXElem inf     () { return new SXElem(INF); }
  public @NotNull SXElem minusInf() { return new SXElem(MINUS_INF); }

  public @NotNull SXElem unaryOp( @NotNull Op op, @NotNull SXElem x ) {
    return new SXElem(Ideal.unary(op,mine(x)));
  }
  public @NotNull SXElem binaryOp( @NotNull Op op, @NotNull SXElem x, @NotNull SXElem y ) {
    return new SXElem(Ideal.binary(op,mine(x),mine(y)));
  }

  // if_else_zero(c,a) + if_else_zero(!c,b)
  public @NotNull SXElem ifElse( @NotNull SXElem c, @NotNull SXElem a, @NotNull SXElem b ) {
    try( SXElem t = c.ifElseZero(a); SXElem nc = c.not(); SXElem f = nc.ifElseZero(b) ) {
      return t.plus(f);
    }
  }

  private SXNode mine( SXElem x ) {
    SXNode n = x.node();
    if( n._ctx != this ) throw SX.err("Expression "+x+" belongs to a different context");
    return n;
  }
}
