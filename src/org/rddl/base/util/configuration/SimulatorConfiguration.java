package org.rddl.base.util.configuration;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to simulator configuration.
 *
 * Defaults come from the enumeration below, overridden by <code>simulator.properties</code> on the classpath and
 * then by the properties file named by the <code>rddl.cfg</code> system property (if set).
 */
public class SimulatorConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * System property naming an additional configuration file.
   */
  public static final String CFG_FILE_PROPERTY = "rddl.cfg";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Seed for the random source of episodes that aren't given one explicitly.
     */
    DEFAULT_RANDOM_SEED(20141122),

    /**
     * Whether to reject action assignments with more non-default actions than the instance's max-nondef-actions.
     */
    ENFORCE_MAX_NONDEF_ACTIONS(true),

    /**
     * Whether to check state invariants on the initial state and after every transition.
     */
    CHECK_STATE_INVARIANTS(true),

    /**
     * Whether to log every transition (at trace level).
     */
    TRACE_TRANSITIONS(false);

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
    }

    private CfgItem(boolean xiDefault)
    {
      mDefault = xiDefault ? "true" : "false";
    }
  }

  private static final Properties SIMULATOR_PROPERTIES = new Properties();
  static
  {
    try (InputStream lPropStream = SimulatorConfiguration.class.getClassLoader()
                                                               .getResourceAsStream("simulator.properties"))
    {
      if (lPropStream != null)
      {
        SIMULATOR_PROPERTIES.load(lPropStream);
      }
    }
    catch (IOException lEx)
    {
      System.err.println("Invalid simulator.properties on the classpath: " + lEx);
    }

    String lFileName = System.getProperty(CFG_FILE_PROPERTY);
    if (lFileName != null)
    {
      try (InputStream lPropStream = new FileInputStream(lFileName))
      {
        SIMULATOR_PROPERTIES.load(lPropStream);
      }
      catch (IOException lEx)
      {
        System.err.println("Missing/invalid simulator configuration " + lFileName);
      }
    }
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return (SIMULATOR_PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault));
  }

  /**
   * @return the specified long configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static long getCfgLong(CfgItem xiKey)
  {
    return Long.parseLong(getCfgStr(xiKey));
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey));
  }

  /**
   * Log all configured (non-default) simulator properties.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with simulator properties:");
    for (Entry<Object, Object> e : SIMULATOR_PROPERTIES.entrySet())
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
    SIMULATOR_PROPERTIES.setProperty(xiKey.toString(), xiValue ? "true" : "false");
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, long xiValue)
  {
    SIMULATOR_PROPERTIES.setProperty(xiKey.toString(), Long.toString(xiValue));
  }

  /**
   * UT-only method for reverting an item to its default.
   *
   * @param xiKey - the property to revert.
   */
  public static void utResetCfgVal(CfgItem xiKey)
  {
    SIMULATOR_PROPERTIES.remove(xiKey.toString());
  }
}
