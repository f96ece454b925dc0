package org.logicreader.base.util.prolog.grammar;

/**
 * A string constant.  The symbol is kept verbatim, so a quoted literal that keeps its quotes (e.g. <code>'X'</code>)
 * is a different constant from the bare word <code>X</code>.
 *
 * A symbol that would read back as something else when written bare (<code>true</code>, <code>false</code>, or one
 * starting with '-') is written in single quotes.
 */
@SuppressWarnings("serial")
public final class StringConstant extends Constant
{
  private final String symbol;

  public StringConstant(String symbol)
  {
    if (symbol == null)
    {
      throw new NullPointerException("A string constant must have a symbol");
    }
    this.symbol = symbol;
  }

  public String getSymbol()
  {
    return symbol;
  }

  @Override
  public Type getType()
  {
    return Type.STRING;
  }

  @Override
  public String toText()
  {
    if (symbol.equals("true") || symbol.equals("false") || symbol.startsWith("-"))
    {
      return "'" + symbol + "'";
    }
    return symbol;
  }

  @Override
  public int hashCode()
  {
    return symbol.hashCode();
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof StringConstant) && ((StringConstant)other).symbol.equals(symbol);
  }
}
