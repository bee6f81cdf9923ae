package com.gentoro.onepress;

import com.gentoro.onepress.datasource.DataSourceConfig;
import com.gentoro.onepress.datasource.FilesystemDataSource;
import com.gentoro.onepress.export.ItemJsonWriter;
import com.gentoro.onepress.logging.LoggingService;
import java.io.PrintStream;
import org.apache.commons.configuration2.Configuration;

/** Wires settings, logging and the data source for one command-line run. */
public class OnePress {

  private static final org.slf4j.Logger log = LoggingService.getLogger(OnePress.class);

  private final StartupParameters startupParameters;
  private final PrintStream out;
  private ConfigurationProvider configurationProvider;
  private FilesystemDataSource dataSource;

  public OnePress(String[] applicationArgs) {
    this(applicationArgs, System.out);
  }

  public OnePress(String[] applicationArgs, PrintStream out) {
    this.startupParameters = new StartupParameters(applicationArgs);
    this.out = out;
  }

  /**
   * Loads settings, ingests the source root and reports the outcome according to the mode.
   *
   * @return counts of the run; {@code null} in help mode.
   */
  public IngestionSummary run() {
    if ("help".equals(startupParameters.mode())) {
      out.println(
          "Usage: onepress [--config-file <location>] [--source-root <dir>]"
              + " [--mode summary|dump|help]");
      return null;
    }

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());
    startupParameters
        .sourceRoot()
        .ifPresent(
            root ->
                configuration()
                    .setProperty(
                        DataSourceConfig.PREFIX + "." + DataSourceConfig.SOURCE_ROOT, root));

    DataSourceConfig config = DataSourceConfig.fromConfiguration(configuration());
    this.dataSource = new FilesystemDataSource(config);
    dataSource.configure();
    dataSource.process();

    IngestionSummary summary =
        IngestionSummary.of(dataSource.items(), dataSource.layouts(), dataSource.includes());
    log.info(
        "Ingested {} content item(s) ({} binary, {} dated), {} layout(s), {} include(s)",
        summary.contentItems(),
        summary.binaryItems(),
        summary.datedItems(),
        summary.layouts(),
        summary.includes());

    if ("dump".equals(startupParameters.mode())) {
      out.println(new ItemJsonWriter().write(dataSource.items()));
    }
    return summary;
  }

  public Configuration configuration() {
    return configurationProvider.config();
  }

  public FilesystemDataSource dataSource() {
    return dataSource;
  }
}
