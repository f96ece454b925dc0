package org.logicreader.base.util.prolog.grammar;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Utilities for collecting the variables, constants and functions that are reachable from sequences of terms.
 *
 * A variable contributes itself to the variables, a constant contributes itself to the constants and a function
 * contributes itself to the functions.  Functions and lists also contribute everything reachable through their
 * bodies (using their cached sets).
 */
public final class TermCollector
{
  private TermCollector()
  {
  }

  public static Set<Variable> collectVariables(List<? extends Term> terms)
  {
    Set<Variable> variables = new LinkedHashSet<>();
    for (Term term : terms)
    {
      term.addVariablesTo(variables);
    }
    return Collections.unmodifiableSet(variables);
  }

  public static Set<Variable> collectVariablesLists(List<? extends List<? extends Term>> termLists)
  {
    Set<Variable> variables = new LinkedHashSet<>();
    for (List<? extends Term> terms : termLists)
    {
      for (Term term : terms)
      {
        term.addVariablesTo(variables);
      }
    }
    return Collections.unmodifiableSet(variables);
  }

  public static Set<Constant> collectConstants(List<? extends Term> terms)
  {
    Set<Constant> constants = new LinkedHashSet<>();
    for (Term term : terms)
    {
      term.addConstantsTo(constants);
    }
    return Collections.unmodifiableSet(constants);
  }

  public static Set<Constant> collectConstantsLists(List<? extends List<? extends Term>> termLists)
  {
    Set<Constant> constants = new LinkedHashSet<>();
    for (List<? extends Term> terms : termLists)
    {
      for (Term term : terms)
      {
        term.addConstantsTo(constants);
      }
    }
    return Collections.unmodifiableSet(constants);
  }

  public static Set<TermFunction> collectFunctions(List<? extends Term> terms)
  {
    Set<TermFunction> functions = new LinkedHashSet<>();
    for (Term term : terms)
    {
      term.addFunctionsTo(functions);
    }
    return Collections.unmodifiableSet(functions);
  }

  public static Set<TermFunction> collectFunctionsLists(List<? extends List<? extends Term>> termLists)
  {
    Set<TermFunction> functions = new LinkedHashSet<>();
    for (List<? extends Term> terms : termLists)
    {
      for (Term term : terms)
      {
        term.addFunctionsTo(functions);
      }
    }
    return Collections.unmodifiableSet(functions);
  }
}
