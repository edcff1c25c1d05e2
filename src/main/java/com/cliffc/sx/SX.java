package com.cliffc.sx;

/** Scalar symbolic expressions: a hash-consed, reference-counted DAG of
 *  scalar operations, simplified on construction.
 */

public abstract class SX {
  public static RuntimeException TODO() { return TODO("unimplemented"); }
  public static RuntimeException TODO( String msg) { throw new RuntimeException(msg); }

  // Programmer misuse of the expression API; never retried.
  public static SXException err( String msg ) { return new SXException(msg); }

  // Default depth for structural equality inside the simplifier.  Deeper
  // finds more common sub-expressions (e.g. sin^2+cos^2 over a non-leaf
  // argument), at a cost on every constructed node.
  public static final int EQ_DEPTH = 1;

  // Integer powers beyond this magnitude are left as an opaque CONSTPOW
  // instead of expanding by repeated squaring.
  public static final int MAX_POW = 100;

  // System properties supplying process-wide defaults to new contexts
  public static final String PROP_SIMPLIFY = "sx.simplify";
  public static final String PROP_EQ_DEPTH = "sx.eqdepth";
}
