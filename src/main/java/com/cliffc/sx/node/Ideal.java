package com.cliffc.sx.node;

import com.cliffc.sx.Op;
import com.cliffc.sx.SX;
import com.cliffc.sx.SXContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

// Peephole simplification, applied as every operator node is constructed.
//
// Only rewrites that build no more nodes than the literal operation are
// allowed.  The result is either an existing node (an operand, an operand's
// operand, or a constant) or a fresh node with a zero count, which the caller
// must adopt.  Temporaries built along the way and not used by the result are
// reclaimed before returning.
//
// With simplification off every call builds the literal node.
public abstract class Ideal {
  private static final Logger LOG = LogManager.getLogger(Ideal.class);

  public static @NotNull SXNode unary( @NotNull Op op, @NotNull SXNode x ) {
    if( !op.isUnary() ) throw SX.err("Operator "+op+" is not unary");
    if( !x._ctx.simplify() ) return new UnaryNode(op,x);
    SXContext C = x._ctx;
    return switch( op ) {
    case NEG   -> neg(x);
    case INV   -> inv(x);
    case SQRT  -> sqrt(x);
    case SQ    -> sq(x);
    case FABS  -> fabs(x);
    case NOT   -> not(x);
    case SINH, TANH, ASINH, ATANH -> x.isZero() ? C.ZERO : new UnaryNode(op,x);
    case COSH  -> x.isZero() ? C.ONE  : new UnaryNode(op,x);
    case ACOSH -> x.isOne () ? C.ZERO : new UnaryNode(op,x);
    default    -> new UnaryNode(op,x);
    };
  }

  public static @NotNull SXNode binary( @NotNull Op op, @NotNull SXNode x, @NotNull SXNode y ) {
    if( !op.isBinary() ) throw SX.err("Operator "+op+" is not binary");
    if( x._ctx != y._ctx ) throw SX.err("Operands of "+op+" belong to different contexts");
    if( !x._ctx.simplify() ) return new BinaryNode(op,x,y);
    return switch( op ) {
    case ADD -> plus   (x,y);
    case SUB -> minus  (x,y);
    case MUL -> times  (x,y);
    case DIV -> rdivide(x,y);
    case POW -> pow    (x,y);
    case LT  -> lt     (x,y);
    case LE  -> le     (x,y);
    case EQ  -> x==y ? x._ctx.ONE  : new BinaryNode(op,x,y);
    case NE  -> x==y ? x._ctx.ZERO : new BinaryNode(op,x,y);
    case IF_ELSE_ZERO -> ifElseZero(x,y);
    default  -> new BinaryNode(op,x,y);
    };
  }

  // Structural equality at the context's configured depth
  private static boolean eq( SXNode x, SXNode y ) { return SXNode.isEqual(x,y,x._ctx.eqDepth()); }

  private static boolean isCon( SXNode x, double d ) { return x.isConstant() && x.getValue()==d; }

  // ---------------------------------------------------------------------------
  static SXNode neg( SXNode x ) {
    SXContext C = x._ctx;
    if( x.isOp(Op.NEG) ) return x.in(0);
    if( x.isZero() ) return x;
    if( x.isMinusOne() ) return C.ONE;
    if( x.isOne() ) return C.MINUS_ONE;
    return new UnaryNode(Op.NEG,x);
  }

  static SXNode inv( SXNode x ) {
    return x.isOp(Op.INV) ? x.in(0) : new UnaryNode(Op.INV,x);
  }

  static SXNode sqrt( SXNode x ) {
    return x.isOp(Op.SQ) ? fabs(x.in(0)) : new UnaryNode(Op.SQRT,x);
  }

  static SXNode sq( SXNode x ) {
    if( x.isOp(Op.SQRT) ) return x.in(0);
    if( x.isOp(Op.NEG ) ) return sq(x.in(0));
    return new UnaryNode(Op.SQ,x);
  }

  static SXNode fabs( SXNode x ) {
    if( x.isOp(Op.FABS) || x.isOp(Op.SQ) ) return x;
    if( x.isOp(Op.NEG) ) return fabs(x.in(0));
    return new UnaryNode(Op.FABS,x);
  }

  // Double negation cancels only when the operand is already 0 or 1
  static SXNode not( SXNode x ) {
    if( x.isOp(Op.NOT) && x.in(0).hasDep() && x.in(0).op().isLogical() )
      return x.in(0);
    return new UnaryNode(Op.NOT,x);
  }

  // ---------------------------------------------------------------------------
  static SXNode plus( SXNode x, SXNode y ) {
    if( x.isZero() ) return y;
    if( y.isZero() ) return x;
    if( y.isOp(Op.NEG) ) return minus(x,y.in(0));    // x+(-y) ==> x-y
    if( x.isOp(Op.NEG) ) return minus(y,x.in(0));    // (-x)+y ==> y-x
    if( x.isOp(Op.MUL) && y.isOp(Op.MUL) &&          // 0.5*a+0.5*a ==> a
        isCon(x.in(0),0.5) && isCon(y.in(0),0.5) && eq(y.in(1),x.in(1)) )
      return x.in(1);
    if( x.isOp(Op.DIV) && y.isOp(Op.DIV) &&          // a/2+a/2 ==> a
        isCon(x.in(1),2) && isCon(y.in(1),2) && eq(y.in(0),x.in(0)) )
      return x.in(0);
    if( x.isOp(Op.SUB) && eq(x.in(1),y) ) return x.in(0); // (a-y)+y ==> a
    if( y.isOp(Op.SUB) && eq(x,y.in(1)) ) return y.in(0); // x+(a-x) ==> a
    if( x.isOp(Op.SQ) && y.isOp(Op.SQ) ) {           // sin^2+cos^2 ==> 1
      SXNode a = x.in(0), b = y.in(0);
      if( ((a.isOp(Op.SIN) && b.isOp(Op.COS)) || (a.isOp(Op.COS) && b.isOp(Op.SIN))) &&
          eq(a.in(0),b.in(0)) )
        return x._ctx.ONE;
    }
    return new BinaryNode(Op.ADD,x,y);
  }

  static SXNode minus( SXNode x, SXNode y ) {
    if( y.isZero() ) return x;
    if( x.isZero() ) return neg(y);
    if( eq(x,y) ) return x._ctx.ZERO;
    if( y.isOp(Op.NEG) ) return plus(x,y.in(0));     // x-(-y) ==> x+y
    if( x.isOp(Op.ADD) && eq(x.in(1),y) ) return x.in(0); // (a+y)-y ==> a
    if( x.isOp(Op.ADD) && eq(x.in(0),y) ) return x.in(1); // (y+b)-y ==> b
    if( y.isOp(Op.ADD) && eq(x,y.in(1)) ) return neg(y.in(0)); // x-(a+x) ==> -a
    if( y.isOp(Op.ADD) && eq(x,y.in(0)) ) return neg(y.in(1)); // x-(x+b) ==> -b
    if( x.isOp(Op.NEG) ) {                            // (-a)-y ==> -(a+y)
      SXNode t = plus(x.in(0),y);
      return t.kill(neg(t));
    }
    return new BinaryNode(Op.SUB,x,y);
  }

  static SXNode times( SXNode x, SXNode y ) {
    SXContext C = x._ctx;
    if( eq(y,x) ) return sq(x);
    if( !x.isConstant() && y.isConstant() ) return times(y,x); // Constant to the left
    if( x.isZero() || y.isZero() ) return C.ZERO;
    if( x.isOne() ) return y;
    if( y.isOne() ) return x;
    if( y.isMinusOne() ) return neg(x);
    if( x.isMinusOne() ) return neg(y);
    if( y.isOp(Op.INV) ) return rdivide(x,y.in(0)); // x*(1/b) ==> x/b
    if( x.isOp(Op.INV) ) return rdivide(y,x.in(0)); // (1/a)*y ==> y/a
    if( x.isConstant() && y.isOp(Op.MUL) && y.in(0).isConstant() &&
        x.getValue()*y.in(0).getValue()==1 )         // 5*(0.2*a) ==> a
      return y.in(1);
    if( x.isConstant() && y.isOp(Op.DIV) && y.in(1).isConstant() &&
        x.getValue()==y.in(1).getValue() )           // 5*(a/5) ==> a
      return y.in(0);
    if( x.isOp(Op.DIV) && eq(x.in(1),y) ) return x.in(0); // (a/y)*y ==> a
    if( y.isOp(Op.DIV) && eq(y.in(1),x) ) return y.in(0); // x*(a/x) ==> a
    if( x.isOp(Op.NEG) ) {                            // (-a)*y ==> -(a*y)
      SXNode t = times(x.in(0),y);
      return t.kill(neg(t));
    }
    if( y.isOp(Op.NEG) ) {                            // x*(-b) ==> -(x*b)
      SXNode t = times(x,y.in(0));
      return t.kill(neg(t));
    }
    return new BinaryNode(Op.MUL,x,y);
  }

  static SXNode rdivide( SXNode x, SXNode y ) {
    SXContext C = x._ctx;
    if( y.isZero() ) return C.NAN;                   // Never an exception
    if( x.isZero() ) return C.ZERO;
    if( y.isOne() ) return x;
    if( y.isMinusOne() ) return neg(x);
    if( eq(x,y) ) return C.ONE;
    if( x.isDoubled() && y.isTwo() ) return x.in(0);  // (a+a)/2 ==> a
    if( x.isOp(Op.MUL) && eq(y,x.in(0)) ) return x.in(1); // (y*b)/y ==> b
    if( x.isOp(Op.MUL) && eq(y,x.in(1)) ) return x.in(0); // (a*y)/y ==> a
    if( x.isOne() ) return inv(y);
    if( y.isOp(Op.INV) ) return times(x,y.in(0));    // x/(1/b) ==> x*b
    if( x.isDoubled() && y.isDoubled() ) return rdivide(x.in(0),y.in(0));
    if( y.isConstant() && x.isOp(Op.DIV) && x.in(1).isConstant() &&
        y.getValue()*x.in(1).getValue()==1 )         // (a/5)/0.2 ==> a
      return x.in(0);
    if( y.isOp(Op.MUL) && eq(y.in(1),x) )            // x/(b*x) ==> 1/b
      return new BinaryNode(Op.DIV,C.ONE,y.in(0));
    if( x.isOp(Op.NEG) && eq(x.in(0),y) ) return C.MINUS_ONE; // (-y)/y
    if( y.isOp(Op.NEG) && eq(y.in(0),x) ) return C.MINUS_ONE; // x/(-x)
    if( y.isOp(Op.NEG) && x.isOp(Op.NEG) && eq(x.in(0),y.in(0)) ) return C.ONE;
    if( x.isOp(Op.DIV) && eq(y,x.in(0)) ) return inv(x.in(1)); // (y/b)/y ==> 1/b
    if( x.isOp(Op.NEG) ) {                            // (-a)/y ==> -(a/y)
      SXNode t = rdivide(x.in(0),y);
      return t.kill(neg(t));
    }
    if( y.isOp(Op.NEG) ) {                            // x/(-b) ==> -(x/b)
      SXNode t = rdivide(x,y.in(0));
      return t.kill(neg(t));
    }
    return new BinaryNode(Op.DIV,x,y);
  }

  // Constant integer exponents expand by repeated squaring
  static SXNode pow( SXNode x, SXNode n ) {
    SXContext C = x._ctx;
    if( !n.isConstant() ) return new BinaryNode(Op.POW,x,n);
    if( !n.isInteger() )
      return n.getValue()==0.5 ? sqrt(x) : new BinaryNode(Op.CONSTPOW,x,n);
    int nn = n.getIntValue();
    if( nn==0 ) return C.ONE;
    if( nn > SX.MAX_POW || nn < -SX.MAX_POW ) {
      LOG.debug("Exponent {} out of expansion range, building constpow",nn);
      return new BinaryNode(Op.CONSTPOW,x,n);
    }
    if( nn < 0 ) {                                    // x^-n ==> 1/x^n
      SXNode t = pow(x,C.conNode(-nn));
      return t.kill(rdivide(C.ONE,t));
    }
    if( (nn&1)==1 ) {                                 // x^n ==> x*x^(n-1)
      SXNode t = pow(x,C.conNode(nn-1));
      return t.kill(times(x,t));
    }
    SXNode t = pow(x,C.conNode(nn>>1));               // x^n ==> (x^(n/2))^2
    return t.kill(times(t,t));
  }

  // ---------------------------------------------------------------------------
  static SXNode le( SXNode x, SXNode y ) {
    SXNode t = minus(y,x);
    SXNode r = t.isNonNegative() ? x._ctx.ONE : new BinaryNode(Op.LE,x,y);
    return t.kill(r);
  }

  static SXNode lt( SXNode x, SXNode y ) {
    SXNode t = minus(x,y);
    SXNode r = t.isNonNegative() ? x._ctx.ZERO : new BinaryNode(Op.LT,x,y);
    return t.kill(r);
  }

  static SXNode ifElseZero( SXNode c, SXNode y ) {
    if( y.isZero() ) return y;
    if( c.isConstant() ) return c.getValue()!=0 ? y : c._ctx.ZERO;
    return new BinaryNode(Op.IF_ELSE_ZERO,c,y);
  }
}
