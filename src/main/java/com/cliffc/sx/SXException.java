package com.cliffc.sx;

// Misuse of the expression API: asking a symbol for its value, an operand
// index past the arity, the truth value of a symbolic expression and so on.
public class SXException extends RuntimeException {
  public SXException( String msg ) { super(msg); }
}
