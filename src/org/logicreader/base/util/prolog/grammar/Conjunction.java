package org.logicreader.base.util.prolog.grammar;

import java.util.Arrays;
import java.util.List;

/**
 * A <i>conjunction</i> of two formulas, written <code>left, right</code>.  Longer conjunctions nest to the left, so
 * <code>a, b, c</code> is <code>Conjunction(Conjunction(a, b), c)</code>.
 *
 * See {@link LogicalExpression} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public final class Conjunction extends DefiniteClauseConstruct
{
  private final Formula left;
  private final Formula right;

  public Conjunction(Formula left, Formula right)
  {
    if (left == null)
    {
      throw new NullPointerException("The left part of a conjunction cannot be empty");
    }
    if (right == null)
    {
      throw new NullPointerException("The right part of a conjunction cannot be empty");
    }
    this.left = left;
    this.right = right;
  }

  public Formula getLeft()
  {
    return left;
  }

  public Formula getRight()
  {
    return right;
  }

  @Override
  public List<Formula> getSubFormulas()
  {
    return Arrays.asList(left, right);
  }

  @Override
  public boolean isUnit()
  {
    return false;
  }

  @Override
  public String toText()
  {
    return left.toText() + ", " + right.toText();
  }

  @Override
  public int hashCode()
  {
    return 31 * left.hashCode() + right.hashCode();
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof Conjunction))
    {
      return false;
    }
    Conjunction conjunction = (Conjunction)other;
    return conjunction.left.equals(left) && conjunction.right.equals(right);
  }
}
