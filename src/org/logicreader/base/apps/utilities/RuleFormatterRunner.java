package org.logicreader.base.apps.utilities;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.logicreader.base.util.configuration.ParserConfiguration;
import org.logicreader.base.util.prolog.exceptions.PrologException;
import org.logicreader.base.util.prolog.factory.PrologFactory;
import org.logicreader.base.util.prolog.grammar.Formula;
import org.logicreader.base.util.prolog.transforms.SentenceReformatter;

/**
 * RuleFormatterRunner is a utility program that prints rules in canonical form.
 *
 * Each argument is a rule (or a single atom) in free form.  It's reformatted, parsed and printed back out, one per
 * line.  If any argument can't be parsed, the problem is reported and the program exits with status 1 once all the
 * arguments have been processed.
 */
public final class RuleFormatterRunner
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final String sHelp = "Args: <Rule or atom> [<Rule or atom> ...]\n";

  private RuleFormatterRunner()
  {
  }

  public static void main(String[] args)
  {
    if (args.length == 0)
    {
      System.err.println(sHelp);
      System.exit(1);
    }

    ParserConfiguration.logConfig();

    boolean failed = false;
    for (String arg : args)
    {
      try
      {
        System.out.println(format(arg));
      }
      catch (PrologException e)
      {
        LOGGER.debug("Failed to format '" + arg + "'", e);
        System.err.println(e.getMessage());
        failed = true;
      }
    }

    if (failed)
    {
      System.exit(1);
    }
  }

  /**
   * @return the canonical text of a rule or atom.
   *
   * @param text - the rule or atom, in free form.
   *
   * @throws PrologException if the text can't be parsed.
   */
  public static String format(String text) throws PrologException
  {
    String reformatted = SentenceReformatter.reformat(text);
    Formula formula;
    if (reformatted.contains(":-"))
    {
      formula = PrologFactory.parseRule(reformatted);
    }
    else
    {
      formula = PrologFactory.parseAtom(reformatted.substring(0, reformatted.length() - 1));
    }
    return formula.toText();
  }
}
