package de.anton.cos.shift_monitor;

import de.anton.cos.shift_monitor.controller.MonitorController;
import de.anton.cos.shift_monitor.service.MonitorConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;

/**
 * Command line entry point. Runs the complete shift monitor.
 * <p>
 * Usage: {@code App [config.properties]}. Without an argument the bundled
 * {@value MonitorConfiguration#DEFAULT_RESOURCE} is used.
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        // Charts are rendered to files only
        if (System.getProperty("java.awt.headless") == null) {
            System.setProperty("java.awt.headless", "true");
        }
        if (args.length > 1) {
            logger.error("Usage: App [config.properties]");
            System.exit(2);
        }

        try {
            MonitorConfiguration config = args.length == 1
                    ? MonitorConfiguration.load(Paths.get(args[0]))
                    : MonitorConfiguration.loadDefaults();
            logger.debug("Configuration: {}", config);

            MonitorController controller = new MonitorController(config);
            controller.run();
        } catch (Exception e) {
            logger.error("Critical error during monitor run", e);
            System.exit(1);
        }
    }
}
