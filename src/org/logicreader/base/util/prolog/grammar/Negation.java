package org.logicreader.base.util.prolog.grammar;

import java.util.Collections;
import java.util.List;

/**
 * A <i>negation</i> is a negated formula.  It may be written <code>not f</code>, <code>\+ f</code>,
 * <code>not (f)</code> or <code>not (f, g)</code>, and is always printed as <code>not(...)</code>.
 *
 * See {@link LogicalExpression} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public final class Negation extends DefiniteClauseConstruct
{
  private final Formula formula;

  public Negation(Formula formula)
  {
    if (formula == null)
    {
      throw new NullPointerException("The specified formula cannot be null");
    }
    this.formula = formula;
  }

  public Formula getFormula()
  {
    return formula;
  }

  @Override
  public List<Formula> getSubFormulas()
  {
    return Collections.singletonList(formula);
  }

  @Override
  public boolean isUnit()
  {
    return formula.isUnit();
  }

  @Override
  public int countAtoms()
  {
    return 1;
  }

  @Override
  public String toText()
  {
    return "not(" + formula.toText() + ")";
  }

  @Override
  public int hashCode()
  {
    return ~formula.hashCode();
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof Negation) && ((Negation)other).formula.equals(formula);
  }
}
