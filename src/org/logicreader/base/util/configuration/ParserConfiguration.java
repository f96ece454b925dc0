package org.logicreader.base.util.configuration;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to parser configuration.
 *
 * Values are read once from the classpath resource {@link #PROPERTIES_RESOURCE}.  Anything not configured there takes
 * its default from {@link CfgItem}.
 */
public class ParserConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Name of the (optional) classpath resource holding the configuration.
   */
  public static final String PROPERTIES_RESOURCE = "/logicreader.properties";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Whether the parse entry points reject input that has anything but whitespace and comments left over after the
     * requested construct.  If disabled, the longest parsable prefix is returned and the rest is ignored.
     */
    REQUIRE_COMPLETE_INPUT(true),

    /**
     * Indent used for the body lines of a multi-line reformatted rule.
     */
    MULTILINE_INDENT("\t");

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(String xiDefault)
    {
      mDefault = xiDefault;
    }

    private CfgItem(boolean xiDefault)
    {
      mDefault = xiDefault ? "true" : "false";
    }
  }

  private static final Properties PARSER_PROPERTIES = new Properties();
  static
  {
    try (InputStream lPropStream = ParserConfiguration.class.getResourceAsStream(PROPERTIES_RESOURCE))
    {
      if (lPropStream == null)
      {
        LOGGER.debug("No " + PROPERTIES_RESOURCE + " on the classpath - using default configuration");
      }
      else
      {
        PARSER_PROPERTIES.load(lPropStream);
      }
    }
    catch (IOException lEx)
    {
      LOGGER.warn("Invalid parser configuration in " + PROPERTIES_RESOURCE + " - using default configuration", lEx);
    }
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return (PARSER_PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault));
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey));
  }

  /**
   * Log all configured parser properties.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with parser properties:");
    for (Entry<Object, Object> e : PARSER_PROPERTIES.entrySet())
    {
      // Get the key.
      String lKey = (String)e.getKey();

      // Check that this is a known configuration parameter (and not a typo in the config file).
      try
      {
        CfgItem lItem = CfgItem.valueOf(lKey);
        LOGGER.info("\t" + lKey + " = " + e.getValue() + " (default: " + lItem.mDefault + ")");
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
      }
    }
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, boolean xiValue)
  {
    PARSER_PROPERTIES.setProperty(xiKey.toString(), xiValue ? "true" : "false");
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    PARSER_PROPERTIES.setProperty(xiKey.toString(), xiValue);
  }

  /**
   * UT-only method for dropping an override, so that the item takes its default value.
   *
   * @param xiKey - the property to reset.
   */
  public static void utResetCfgVal(CfgItem xiKey)
  {
    PARSER_PROPERTIES.remove(xiKey.toString());
  }
}
