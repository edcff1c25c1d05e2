package com.cliffc.sx.util;

// Special functions missing from java.lang.Math, with C99 <math.h> semantics.
public abstract class SpecialFns {
  private static final double TWO_BY_SQRT_PI = 2.0/Math.sqrt(Math.PI);

  private static final double LN2 = Math.log(2.0);
  private static final double BIG = 0x1p28; // Past here x*x overflows or swamps the 1

  public static double asinh( double x ) {
    if( x==0 || Double.isNaN(x) || Double.isInfinite(x) ) return x;
    double a = Math.abs(x);
    double r = a > BIG
      ? Math.log(a)+LN2
      : Math.log1p(a + a*a/(1+Math.sqrt(1+a*a)));
    return x < 0 ? -r : r;
  }
  public static double acosh( double x ) {
    if( Double.isNaN(x) || x < 1 ) return Double.NaN;
    if( x > BIG ) return Double.isInfinite(x) ? x : Math.log(x)+LN2;
    double t = x-1;             // Exact near 1
    return Math.log1p(t + Math.sqrt(2*t + t*t));
  }
  // 0.5*log((1+x)/(1-x)), without the quotient rounding to 1 for tiny x
  public static double atanh( double x ) {
    if( x==0 ) return x;        // Keep the sign of zero
    return 0.5*Math.log1p(2*x/(1-x));
  }

  // Power series near zero, continued fraction for erfc in the tails.
  public static double erf( double x ) {
    if( Double.isNaN(x) ) return x;
    if( x==0 ) return x;
    double a = Math.abs(x);
    if( a < 2.0 ) return series(x);
    double r = 1.0 - erfc_cf(a);
    return x < 0 ? -r : r;
  }

  // erf(x) = 2/sqrt(pi) * sum (-1)^n x^(2n+1) / (n! (2n+1))
  private static double series( double x ) {
    double x2 = x*x, term = x, sum = x;
    for( int n=1; n<100; n++ ) {
      term *= -x2/n;
      double d = term/(2*n+1);
      sum += d;
      if( Math.abs(d) < 1e-17*Math.abs(sum) ) break;
    }
    return TWO_BY_SQRT_PI*sum;
  }

  // erfc(a) = exp(-a^2)/sqrt(pi) / (a + (1/2)/(a + 1/(a + (3/2)/(a + ...)))), a > 0
  private static double erfc_cf( double a ) {
    if( Double.isInfinite(a) ) return 0;
    double f = a;
    for( int k=100; k>=1; k-- )
      f = a + (k*0.5)/f;
    return Math.exp(-a*a)/Math.sqrt(Math.PI)/f;
  }

  // Giles' single-precision approximation, polished with Newton steps on erf.
  public static double erfinv( double y ) {
    if( Double.isNaN(y) || y < -1 || y > 1 ) return Double.NaN;
    if( y ==  1 ) return Double.POSITIVE_INFINITY;
    if( y == -1 ) return Double.NEGATIVE_INFINITY;
    if( y ==  0 ) return y;
    double w = -Math.log((1.0-y)*(1.0+y)), p;
    if( w < 5.0 ) {
      w -= 2.5;
      p =  2.81022636e-08;
      p =  3.43273939e-07 + p*w;
      p = -3.5233877e-06  + p*w;
      p = -4.39150654e-06 + p*w;
      p =  0.00021858087  + p*w;
      p = -0.00125372503  + p*w;
      p = -0.00417768164  + p*w;
      p =  0.246640727    + p*w;
      p =  1.50140941     + p*w;
    } else {
      w = Math.sqrt(w) - 3.0;
      p = -0.000200214257;
      p =  0.000100950558 + p*w;
      p =  0.00134934322  + p*w;
      p = -0.00367342844  + p*w;
      p =  0.00573950773  + p*w;
      p = -0.0076224613   + p*w;
      p =  0.00943887047  + p*w;
      p =  1.00167406     + p*w;
      p =  2.83297682     + p*w;
    }
    double x = p*y;
    for( int i=0; i<2; i++ ) {
      double dx = (erf(x)-y)/(TWO_BY_SQRT_PI*Math.exp(-x*x));
      if( Double.isNaN(dx) || Double.isInfinite(dx) ) break;
      x -= dx;
    }
    return x;
  }
}
