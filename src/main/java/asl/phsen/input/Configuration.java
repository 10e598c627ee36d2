package asl.phsen.input;

import java.io.File;
import java.net.URL;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration file holding the processing options that are site choices rather than part of
 * the pH formula: the salinity to assume when no CTD value is supplied, whether batches are run
 * in parallel, and the pH range outside of which results get flagged.
 *
 * The empirical constants of the calculation are fixed in code and not read from here.
 */
public class Configuration {

  private static Configuration instance;

  public static final String DEFAULT_CONFIG_PATH = "phsen-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  public static final double DEFAULT_SALINITY = 35.0;
  public static final double DEFAULT_EXPECTED_PH_LOW = 6.5;
  public static final double DEFAULT_EXPECTED_PH_HIGH = 8.5;

  private String loadedConfigPath = DEFAULT_CONFIG_PATH;

  private double defaultSalinity = DEFAULT_SALINITY;
  private boolean parallelBatch = false;
  private double expectedPhLow = DEFAULT_EXPECTED_PH_LOW;
  private double expectedPhHigh = DEFAULT_EXPECTED_PH_HIGH;

  private Configuration(String configLocation) {
    File configFile = new File(configLocation);
    try {
      XMLConfiguration config;
      if (configFile.exists()) {
        logger.info("Attempting reading in config file from " + configFile.getAbsolutePath());
        config = new XMLConfiguration(configFile);
        loadedConfigPath = configFile.getAbsolutePath();
      } else {
        URL embedded = Configuration.class.getClassLoader().getResource(DEFAULT_CONFIG_PATH);
        if (embedded == null) {
          logger.warn("No config at " + configLocation + " and none embedded, using defaults");
          return;
        }
        logger.info("No config file at " + configLocation + ", reading embedded " + embedded);
        config = new XMLConfiguration(embedded);
        loadedConfigPath = embedded.toString();
      }
      readParameters(config);
      logger.info("Succesfully loaded in configuration: " + loadedConfigPath);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  private void readParameters(XMLConfiguration config) {
    defaultSalinity = config.getDouble("Processing.DefaultSalinity", DEFAULT_SALINITY);
    parallelBatch = config.getBoolean("Processing.ParallelBatch", false);
    expectedPhLow = config.getDouble("Reporting.ExpectedPhLow", DEFAULT_EXPECTED_PH_LOW);
    expectedPhHigh = config.getDouble("Reporting.ExpectedPhHigh", DEFAULT_EXPECTED_PH_HIGH);
    if (expectedPhLow > expectedPhHigh) {
      logger.warn("Expected pH range is inverted (" + expectedPhLow + " > " + expectedPhHigh
          + "), reverting to defaults");
      expectedPhLow = DEFAULT_EXPECTED_PH_LOW;
      expectedPhHigh = DEFAULT_EXPECTED_PH_HIGH;
    }
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists. The file is
   * looked for in the working directory; if it is not there, the copy embedded in the jar is used.
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    return getInstance(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists.
   * @param configLocation Configuration file location to read from
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance(String configLocation) {
    if (instance == null) {
      instance = new Configuration(configLocation);
    }
    return instance;
  }

  /**
   * Reads a configuration from the given file without touching the shared instance. Used when a
   * caller needs settings other than the process-wide ones, such as a gateway serving a
   * particular deployment.
   * @param configLocation Configuration file location to read from; if it does not exist the
   * embedded defaults are used
   * @return a new configuration
   */
  public static Configuration load(String configLocation) {
    return new Configuration(configLocation);
  }

  /**
   * Gets the path or URL the configuration was read from.
   * @return Location of the loaded configuration
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Gets the salinity assumed for records that have no co-located CTD value. Defaults to 35.0.
   *
   * The property is defined from Configuration.Processing.DefaultSalinity
   * @return Practical salinity to use by default
   */
  public double getDefaultSalinity() {
    return defaultSalinity;
  }

  /**
   * Gets whether batches of records are computed on a parallel stream. Defaults to false.
   *
   * The property is defined from Configuration.Processing.ParallelBatch
   * @return True if batch records may run concurrently
   */
  public boolean useParallelBatch() {
    return parallelBatch;
  }

  /**
   * The property is defined from Configuration.Reporting.ExpectedPhLow
   * @return Lowest pH not flagged as out of range
   */
  public double getExpectedPhLow() {
    return expectedPhLow;
  }

  /**
   * The property is defined from Configuration.Reporting.ExpectedPhHigh
   * @return Highest pH not flagged as out of range
   */
  public double getExpectedPhHigh() {
    return expectedPhHigh;
  }
}
