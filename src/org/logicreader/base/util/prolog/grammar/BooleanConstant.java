package org.logicreader.base.util.prolog.grammar;

/**
 * A boolean constant, written <code>true</code> or <code>false</code>.
 */
@SuppressWarnings("serial")
public final class BooleanConstant extends Constant
{
  private final boolean symbol;

  public BooleanConstant(boolean symbol)
  {
    this.symbol = symbol;
  }

  public boolean getSymbol()
  {
    return symbol;
  }

  @Override
  public Type getType()
  {
    return Type.BOOLEAN;
  }

  @Override
  public String toText()
  {
    return Boolean.toString(symbol);
  }

  @Override
  public int hashCode()
  {
    return Boolean.hashCode(symbol);
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof BooleanConstant) && (((BooleanConstant)other).symbol == symbol);
  }
}
