package org.logicreader.base.util.prolog.transforms;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.logicreader.base.util.configuration.ParserConfiguration;
import org.logicreader.base.util.configuration.ParserConfiguration.CfgItem;
import org.logicreader.base.util.prolog.exceptions.MalformedSentenceException;

/**
 * Rewrites free-form rule text into the single line form that the parser reads most easily.
 *
 * <ul>
 *   <li>A body written over several lines (one literal per line, each ending with a comma) is joined onto a single
 *       line.  Blank lines and full stops at the end of a line are dropped.</li>
 *   <li>The list bar is respaced as a comma, so <code>[H | T]</code> becomes <code>[H, T]</code>.</li>
 *   <li>Both negation spellings become <code>not(...)</code>: <code>\+ (a, b)</code> becomes <code>not(a, b)</code>
 *       and <code>not a(X)</code> becomes <code>not(a(X))</code>.</li>
 * </ul>
 *
 * The rewrite is purely textual.  It doesn't check that the result can be parsed.
 */
public final class SentenceReformatter
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final String RULE_SEPARATOR = ":-";

  private static final Pattern MARGIN = Pattern.compile("(?m)^[ \\t]*\\|");

  private static final Pattern LINE_BREAK = Pattern.compile(",[ ]*\\n");

  private static final Pattern LIST_BAR = Pattern.compile("[ ]*\\|[ ]*");

  // "not (" and "\+(".
  private static final Pattern PARENTHESISED_NEGATION = Pattern.compile("(?<![a-zA-Z0-9_])(?:not|\\\\\\+)[ ]*\\(");

  // "not x" and "\+ x", up to the end of the line.
  private static final Pattern BARE_NEGATION = Pattern.compile("(?<![a-zA-Z0-9_])(?:not|\\\\\\+)[ ]+(\\S.*)");

  private SentenceReformatter()
  {
  }

  /**
   * Reformat a sentence onto a single line.
   *
   * @see #reformat(String, boolean)
   */
  public static String reformat(String sentence) throws MalformedSentenceException
  {
    return reformat(sentence, false);
  }

  /**
   * Reformat a rule (<code>head :- body</code>) or a plain sentence.  The result always ends with a single full stop.
   *
   * @param sentence  - the text to reformat.
   * @param multiline - whether to put each literal of the body on its own indented line (see
   *                    {@link CfgItem#MULTILINE_INDENT}) rather than on one line.
   *
   * @return the reformatted text.
   *
   * @throws MalformedSentenceException if the sentence has more than one ":-", or nothing is left of the body (or of
   * the sentence) once it has been cleaned up.
   */
  public static String reformat(String sentence, boolean multiline) throws MalformedSentenceException
  {
    String[] parts = StringUtils.splitByWholeSeparatorPreserveAllTokens(sentence, RULE_SEPARATOR);
    String indent = ParserConfiguration.getCfgStr(CfgItem.MULTILINE_INDENT);

    String result;
    if (parts.length <= 1)
    {
      List<String> segments = cleanup(sentence, sentence);
      result = StringUtils.join(segments, multiline ? ",\n" + indent : ", ") + ".";
    }
    else if (parts.length == 2)
    {
      String head = StringUtils.join(cleanup(sentence, parts[0].trim()), ", ");
      List<String> body = cleanup(sentence, parts[1]);
      if (multiline)
      {
        result = head + " " + RULE_SEPARATOR + "\n" + indent + StringUtils.join(body, ",\n" + indent) + ".";
      }
      else
      {
        result = head + " " + RULE_SEPARATOR + " " + StringUtils.join(body, ", ") + ".";
      }
    }
    else
    {
      throw new MalformedSentenceException(sentence, "it has " + (parts.length - 1) + " '" + RULE_SEPARATOR +
                                                     "' separators");
    }

    LOGGER.debug("Reformatted '" + sentence + "' as '" + result + "'");
    return result;
  }

  /**
   * Split text into its non-blank line segments and tidy each of them up.
   *
   * @param sentence - the complete sentence, for error reporting.
   * @param text     - the part of the sentence to clean up.
   */
  private static List<String> cleanup(String sentence, String text) throws MalformedSentenceException
  {
    List<String> segments = new ArrayList<>();
    for (String segment : LINE_BREAK.split(MARGIN.matcher(text).replaceAll("")))
    {
      if (StringUtils.isBlank(segment))
      {
        continue;
      }
      segment = StringUtils.removeEnd(segment.trim(), ".");
      segment = LIST_BAR.matcher(segment).replaceAll(", ");
      segment = PARENTHESISED_NEGATION.matcher(segment).replaceAll("not(");
      segment = BARE_NEGATION.matcher(segment).replaceAll("not($1)");
      segments.add(segment);
    }

    if (segments.isEmpty())
    {
      throw new MalformedSentenceException(sentence, "there is nothing to reformat in '" + text + "'");
    }
    return segments;
  }
}
