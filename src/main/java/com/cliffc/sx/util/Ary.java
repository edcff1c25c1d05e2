package com.cliffc.sx.util;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

// Growable array.  Serves as the node list returned by graph walks and as the
// explicit stack for the iterative walks and kills.
@SuppressWarnings("unchecked")
public class Ary<E> implements Iterable<E> {
  public E[] _es;
  public int _len;
  public Ary( Class<E> clazz ) { _es = (E[])Array.newInstance(clazz,4); }

  public boolean isEmpty() { return _len==0; }
  public int len() { return _len; }

  public E at( int i ) { check(i); return _es[i]; }
  public E last() { check(_len-1); return _es[_len-1]; }
  public E pop () { check(_len-1); E e = _es[--_len]; _es[_len] = null; return e; }

  // Append, doubling as needed.  Returns this for flow-coding.
  public Ary<E> push( E e ) {
    if( _len == _es.length ) _es = Arrays.copyOf(_es,_len<<1);
    _es[_len++] = e;
    return this;
  }

  // Index of 'e' by identity, or -1
  public int find( E e ) {
    for( int i=0; i<_len; i++ )
      if( _es[i]==e ) return i;
    return -1;
  }

  private void check( int i ) {
    if( i<0 || i>=_len ) throw new ArrayIndexOutOfBoundsException("index "+i+", length "+_len);
  }

  @Override public Iterator<E> iterator() {
    return new Iterator<>() {
      int _i;
      @Override public boolean hasNext() { return _i<_len; }
      @Override public E next() {
        if( _i>=_len ) throw new NoSuchElementException();
        return _es[_i++];
      }
    };
  }

  @Override public String toString() {
    SB sb = new SB().p('{');
    for( int i=0; i<_len; i++ )
      sb.p(i==0 ? "" : ",").pobj(_es[i]);
    return sb.p('}').toString();
  }
}
