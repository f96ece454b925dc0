package org.logicreader.base.util.prolog.grammar;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A formula is an <i>atom</i>, a <i>conjunction</i>, a <i>negation</i> or a <i>rule</i>.
 *
 * The variables, constants and functions of a formula are the union of those of its sub-formulas (an atom collects
 * them from its arguments).  They are computed on first use and cached.
 *
 * See {@link LogicalExpression} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public abstract class Formula extends LogicalExpression
{
  private transient Set<Variable>     variables;
  private transient Set<Constant>     constants;
  private transient Set<TermFunction> functions;

  /**
   * @return the formulas that this formula directly contains.
   */
  public abstract List<Formula> getSubFormulas();

  /**
   * @return whether this is a unit formula - a bare atom, or a negation of a unit formula.
   */
  public abstract boolean isUnit();

  /**
   * @return the number of atomic formulas in this formula.  A negation counts as a single literal, whatever it wraps.
   */
  public int countAtoms()
  {
    int count = 0;
    for (Formula formula : getSubFormulas())
    {
      count += formula.countAtoms();
    }
    return count;
  }

  public final Set<Variable> getVariables()
  {
    if (variables == null)
    {
      variables = computeVariables();
    }
    return variables;
  }

  public final Set<Constant> getConstants()
  {
    if (constants == null)
    {
      constants = computeConstants();
    }
    return constants;
  }

  public final Set<TermFunction> getFunctions()
  {
    if (functions == null)
    {
      functions = computeFunctions();
    }
    return functions;
  }

  protected Set<Variable> computeVariables()
  {
    Set<Variable> result = new LinkedHashSet<>();
    for (Formula formula : getSubFormulas())
    {
      result.addAll(formula.getVariables());
    }
    return Collections.unmodifiableSet(result);
  }

  protected Set<Constant> computeConstants()
  {
    Set<Constant> result = new LinkedHashSet<>();
    for (Formula formula : getSubFormulas())
    {
      result.addAll(formula.getConstants());
    }
    return Collections.unmodifiableSet(result);
  }

  protected Set<TermFunction> computeFunctions()
  {
    Set<TermFunction> result = new LinkedHashSet<>();
    for (Formula formula : getSubFormulas())
    {
      result.addAll(formula.getFunctions());
    }
    return Collections.unmodifiableSet(result);
  }
}
