package org.logicreader.base.util.prolog.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * An <i>atom</i> (atomic formula) is a predicate name followed, optionally, by a parenthesised list of <i>terms</i>,
 * e.g. <code>happensAt(walking(X), T)</code> or <code>raining</code>.
 *
 * See {@link LogicalExpression} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public final class Atom extends DefiniteClauseConstruct
{
  private final String     symbol;
  private final List<Term> args;

  private transient AtomSignature signature;

  public Atom(String symbol, List<? extends Term> args)
  {
    if (symbol == null)
    {
      throw new NullPointerException("An atom must have a symbol");
    }
    this.symbol = symbol;
    this.args = Collections.unmodifiableList(new ArrayList<Term>(args));
  }

  public String getSymbol()
  {
    return symbol;
  }

  public List<Term> getArgs()
  {
    return args;
  }

  public Term get(int index)
  {
    return args.get(index);
  }

  public int arity()
  {
    return args.size();
  }

  public AtomSignature getSignature()
  {
    if (signature == null)
    {
      signature = new AtomSignature(symbol, args.size());
    }
    return signature;
  }

  public boolean isGround()
  {
    return getVariables().isEmpty();
  }

  @Override
  public List<Formula> getSubFormulas()
  {
    return Collections.emptyList();
  }

  @Override
  public boolean isUnit()
  {
    return true;
  }

  @Override
  public int countAtoms()
  {
    return 1;
  }

  @Override
  protected Set<Variable> computeVariables()
  {
    return TermCollector.collectVariables(args);
  }

  @Override
  protected Set<Constant> computeConstants()
  {
    return TermCollector.collectConstants(args);
  }

  @Override
  protected Set<TermFunction> computeFunctions()
  {
    return TermCollector.collectFunctions(args);
  }

  @Override
  public String toText()
  {
    if (args.isEmpty())
    {
      return symbol;
    }
    return symbol + "(" + Term.toText(args) + ")";
  }

  @Override
  public int hashCode()
  {
    return 31 * symbol.hashCode() + args.hashCode();
  }

  @Override
  public boolean equals(Object other)
  {
    if (this == other)
    {
      return true;
    }
    if (!(other instanceof Atom))
    {
      return false;
    }
    Atom atom = (Atom)other;
    return atom.symbol.equals(symbol) && atom.args.equals(args);
  }
}
