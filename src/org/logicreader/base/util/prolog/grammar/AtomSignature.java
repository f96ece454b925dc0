package org.logicreader.base.util.prolog.grammar;

import java.io.Serializable;

/**
 * The signature of an atom or function: its name and its arity.  Signatures tell apart predicates (or functions) that
 * share a name but take a different number of arguments.
 *
 * <p>For example, <code>happensAt(walking(person1), T)</code> has signature <code>happensAt/2</code> and contains a
 * function with signature <code>walking/1</code>.  The values of a function count towards its arity, so
 * <code>meeting(X, Y)=V</code> has signature <code>meeting/3</code>.
 */
public final class AtomSignature implements Serializable
{
  private static final long serialVersionUID = 1L;

  private final String symbol;
  private final int    arity;

  /**
   * Create a signature.
   *
   * @param symbol - the name.  Must be non-empty.
   * @param arity  - the number of arguments.  Must not be negative.
   */
  public AtomSignature(String symbol, int arity)
  {
    if (symbol == null)
    {
      throw new IllegalArgumentException("Cannot use null string as symbol.");
    }
    if (symbol.isEmpty())
    {
      throw new IllegalArgumentException("Cannot use an empty string as symbol.");
    }
    if (arity < 0)
    {
      throw new IllegalArgumentException("The arity of an atom cannot be a negative number (was " + arity + ").");
    }

    this.symbol = symbol;
    this.arity = arity;
  }

  public String getSymbol()
  {
    return symbol;
  }

  public int getArity()
  {
    return arity;
  }

  @Override
  public int hashCode()
  {
    return symbol.hashCode() ^ arity;
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof AtomSignature))
    {
      return false;
    }
    AtomSignature signature = (AtomSignature)other;
    return (signature.arity == arity) && signature.symbol.equals(symbol);
  }

  @Override
  public String toString()
  {
    return symbol + "/" + arity;
  }
}
