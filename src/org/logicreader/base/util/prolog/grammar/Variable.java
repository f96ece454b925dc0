package org.logicreader.base.util.prolog.grammar;

import java.util.Set;

/**
 * A <i>variable</i> is a word starting with an uppercase letter.  It can stand for any other term.  Variables are
 * never bound here, so a variable is never ground.
 *
 * See {@link Term} for a description of the term hierarchy.
 */
@SuppressWarnings("serial")
public final class Variable extends Term
{

  private final String symbol;

  public Variable(String symbol)
  {
    if (symbol == null)
    {
      throw new NullPointerException("A variable must have a name");
    }
    this.symbol = symbol;
  }

  public String getSymbol()
  {
    return symbol;
  }

  @Override
  public Kind getKind()
  {
    return Kind.VARIABLE;
  }

  @Override
  public boolean isGround()
  {
    return false;
  }

  @Override
  void addVariablesTo(Set<Variable> variables)
  {
    variables.add(this);
  }

  @Override
  void addConstantsTo(Set<Constant> constants)
  {
    // Nothing to add.
  }

  @Override
  void addFunctionsTo(Set<TermFunction> functions)
  {
    // Nothing to add.
  }

  @Override
  public String toText()
  {
    return symbol;
  }

  @Override
  public String toString()
  {
    return "Variable(" + symbol + ")";
  }

  @Override
  public int hashCode()
  {
    return symbol.hashCode();
  }

  @Override
  public boolean equals(Object other)
  {
    if (this == other)
    {
      return true;
    }
    if (!(other instanceof Variable))
    {
      return false;
    }
    return symbol.equals(((Variable)other).symbol);
  }

}
