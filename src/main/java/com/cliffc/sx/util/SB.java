package com.cliffc.sx.util;

/** Tight/tiny StringBuilder wrapper for expression printing.
 *  Short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   c ) { _sb.append(c); return this; }
  public SB p( long   l ) { _sb.append(l); return this; }
  // Numeric constants print C-style: integral values without a fraction,
  // and the non-finite values as nan/inf.
  public SB p( double d ) {
    if( Double.isNaN(d) ) return p("nan");
    if( Double.isInfinite(d) ) return p(d > 0 ? "inf" : "-inf");
    if( d == (long)d && Math.abs(d) < 1e15 ) return p((long)d);
    _sb.append(d);
    return this;
  }
  // Not spelled "p" on purpose: too easy to accidentally say "p(1.0)" and
  // suddenly call the autoboxed version.
  public SB pobj( Object o ) { _sb.append(o.toString()); return this; }

  @Override public String toString() { return _sb.toString(); }
}
