package com.cliffc.sx;

import com.cliffc.sx.util.SB;
import com.cliffc.sx.util.SpecialFns;

/** Operator table.

Every expression node carries one of these codes.  Leaves use CONST (numeric
constants) and PARAMETER (free symbols); everything else is a unary or binary
operator with a fixed arity.  Binary operators are flagged commutative where
swapping the operands never changes the value; structural equality uses the
flag to match swapped operands.

Evaluation follows the C math library: logic and comparisons produce 1 or 0,
any non-zero value (including NaN) is true, FMIN/FMAX drop a single NaN
operand.

Printing is a template of prefix, infix and suffix strings:
  ADD:  "(" x "+" y ")"
  SIN:  "sin(" x ")"
  POW:  "pow(" x "," y ")"
 */
public enum Op {
  CONST       (0,false,null    ,null  ,null),
  PARAMETER   (0,false,null    ,null  ,null),
  ADD         (2,true ,"("     ,"+"   ,")" ),
  SUB         (2,false,"("     ,"-"   ,")" ),
  MUL         (2,true ,"("     ,"*"   ,")" ),
  DIV         (2,false,"("     ,"/"   ,")" ),
  NEG         (1,false,"(-"    ,null  ,")" ),
  EXP         (1,false,"exp("  ,null  ,")" ),
  LOG         (1,false,"log("  ,null  ,")" ),
  POW         (2,false,"pow("  ,","   ,")" ),
  CONSTPOW    (2,false,"pow("  ,","   ,")" ),
  SQRT        (1,false,"sqrt(" ,null  ,")" ),
  SQ          (1,false,"sq("   ,null  ,")" ),
  SIN         (1,false,"sin("  ,null  ,")" ),
  COS         (1,false,"cos("  ,null  ,")" ),
  TAN         (1,false,"tan("  ,null  ,")" ),
  ASIN        (1,false,"asin(" ,null  ,")" ),
  ACOS        (1,false,"acos(" ,null  ,")" ),
  ATAN        (1,false,"atan(" ,null  ,")" ),
  LT          (2,false,"("     ,"<"   ,")" ),
  LE          (2,false,"("     ,"<="  ,")" ),
  EQ          (2,true ,"("     ,"=="  ,")" ),
  NE          (2,true ,"("     ,"!="  ,")" ),
  NOT         (1,false,"(!"    ,null  ,")" ),
  AND         (2,true ,"("     ,"&&"  ,")" ),
  OR          (2,true ,"("     ,"||"  ,")" ),
  FLOOR       (1,false,"floor(",null  ,")" ),
  CEIL        (1,false,"ceil(" ,null  ,")" ),
  FMOD        (2,false,"fmod(" ,","   ,")" ),
  FABS        (1,false,"fabs(" ,null  ,")" ),
  SIGN        (1,false,"sign(" ,null  ,")" ),
  COPYSIGN    (2,false,"copysign(",",",")" ),
  IF_ELSE_ZERO(2,false,"("     ,"?"   ,":0)"),
  ERF         (1,false,"erf("  ,null  ,")" ),
  FMIN        (2,true ,"fmin(" ,","   ,")" ),
  FMAX        (2,true ,"fmax(" ,","   ,")" ),
  INV         (1,false,"(1./"  ,null  ,")" ),
  SINH        (1,false,"sinh(" ,null  ,")" ),
  COSH        (1,false,"cosh(" ,null  ,")" ),
  TANH        (1,false,"tanh(" ,null  ,")" ),
  ASINH       (1,false,"asinh(",null  ,")" ),
  ACOSH       (1,false,"acosh(",null  ,")" ),
  ATANH       (1,false,"atanh(",null  ,")" ),
  ATAN2       (2,false,"atan2(",","   ,")" ),
  ERFINV      (1,false,"erfinv(",null ,")" ),
  PRINTME     (2,false,"printme(",",",")" );

  public final int _nargs;      // 0 for leaves, else 1 or 2
  public final boolean _comm;   // Binary and operands swap freely
  private final String _pre, _mid, _post;

  Op( int nargs, boolean comm, String pre, String mid, String post ) {
    _nargs = nargs;
    _comm  = comm;
    _pre   = pre;  _mid = mid;  _post = post;
  }

  public boolean isUnary () { return _nargs==1; }
  public boolean isBinary() { return _nargs==2; }

  // Result is always exactly 0 or 1
  public boolean isLogical() {
    return switch( this ) {
    case LT, LE, EQ, NE, NOT, AND, OR -> true;
    default -> false;
    };
  }

  // Print an operator application around already-printed operands.
  public SB print( SB sb, String x, String y ) {
    assert _nargs > 0 : "leaves print themselves";
    sb.p(_pre).p(x);
    if( _nargs==2 ) sb.p(_mid).p(y);
    return sb.p(_post);
  }

  private static double b( boolean b ) { return b ? 1.0 : 0.0; }
  private static boolean t( double d ) { return d != 0; } // NaN is true

  // Numeric semantics; for unary operators 'y' is ignored.
  public double eval( double x, double y ) {
    return switch( this ) {
    case ADD      -> x+y;
    case SUB      -> x-y;
    case MUL      -> x*y;
    case DIV      -> x/y;
    case NEG      -> -x;
    case EXP      -> Math.exp(x);
    case LOG      -> Math.log(x);
    case POW, CONSTPOW -> Math.pow(x,y);
    case SQRT     -> Math.sqrt(x);
    case SQ       -> x*x;
    case SIN      -> Math.sin(x);
    case COS      -> Math.cos(x);
    case TAN      -> Math.tan(x);
    case ASIN     -> Math.asin(x);
    case ACOS     -> Math.acos(x);
    case ATAN     -> Math.atan(x);
    case LT       -> b(x< y);
    case LE       -> b(x<=y);
    case EQ       -> b(x==y);
    case NE       -> b(x!=y);
    case NOT      -> b(!t(x));
    case AND      -> b(t(x) && t(y));
    case OR       -> b(t(x) || t(y));
    case FLOOR    -> Math.floor(x);
    case CEIL     -> Math.ceil(x);
    case FMOD     -> x%y;           // Truncating, same as C fmod
    case FABS     -> Math.abs(x);
    case SIGN     -> Math.signum(x);
    case COPYSIGN -> Math.copySign(x,y);
    case IF_ELSE_ZERO -> t(x) ? y : 0.0;
    case ERF      -> SpecialFns.erf(x);
    case FMIN     -> Double.isNaN(x) ? y : (Double.isNaN(y) ? x : Math.min(x,y));
    case FMAX     -> Double.isNaN(x) ? y : (Double.isNaN(y) ? x : Math.max(x,y));
    case INV      -> 1.0/x;
    case SINH     -> Math.sinh(x);
    case COSH     -> Math.cosh(x);
    case TANH     -> Math.tanh(x);
    case ASINH    -> SpecialFns.asinh(x);
    case ACOSH    -> SpecialFns.acosh(x);
    case ATANH    -> SpecialFns.atanh(x);
    case ATAN2    -> Math.atan2(x,y);
    case ERFINV   -> SpecialFns.erfinv(x);
    case PRINTME  -> x;
    case CONST, PARAMETER -> throw SX.TODO("leaf "+this+" has no operator semantics");
    };
  }
}
