package org.logicreader.base.util.prolog.grammar;

import java.math.BigDecimal;

/**
 * A double precision floating point constant, e.g. <code>10.1</code> or <code>-10.1</code>.
 *
 * The text form is always a plain decimal with a fractional part (<code>0.0001</code>, <code>10000000.0</code>),
 * never scientific notation, so that it reads back as the same constant.
 */
@SuppressWarnings("serial")
public final class FloatConstant extends Constant
{
  private final double symbol;

  public FloatConstant(double symbol)
  {
    this.symbol = symbol;
  }

  public double getSymbol()
  {
    return symbol;
  }

  @Override
  public Type getType()
  {
    return Type.FLOAT;
  }

  @Override
  public String toText()
  {
    if ((symbol == 0) || Double.isNaN(symbol) || Double.isInfinite(symbol))
    {
      // Keeps the sign of -0.0.
      return Double.toString(symbol);
    }

    String text = BigDecimal.valueOf(symbol).stripTrailingZeros().toPlainString();
    return (text.indexOf('.') < 0) ? text + ".0" : text;
  }

  @Override
  public int hashCode()
  {
    return Double.hashCode(symbol);
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof FloatConstant) &&
           (Double.doubleToLongBits(((FloatConstant)other).symbol) == Double.doubleToLongBits(symbol));
  }
}
