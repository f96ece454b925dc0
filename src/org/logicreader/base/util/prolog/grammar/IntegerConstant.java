package org.logicreader.base.util.prolog.grammar;

/**
 * A 64-bit signed integer constant, e.g. <code>10</code> or <code>-10</code>.
 */
@SuppressWarnings("serial")
public final class IntegerConstant extends Constant
{
  private final long symbol;

  public IntegerConstant(long symbol)
  {
    this.symbol = symbol;
  }

  public long getSymbol()
  {
    return symbol;
  }

  @Override
  public Type getType()
  {
    return Type.INTEGER;
  }

  @Override
  public String toText()
  {
    return Long.toString(symbol);
  }

  @Override
  public int hashCode()
  {
    return Long.hashCode(symbol);
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof IntegerConstant) && (((IntegerConstant)other).symbol == symbol);
  }
}
