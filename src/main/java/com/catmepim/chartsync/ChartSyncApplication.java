package com.catmepim.chartsync;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.chartsync.action.ActionSelector;
import com.catmepim.chartsync.action.ChartAction;
import com.catmepim.chartsync.config.ChartSyncConfig;
import com.catmepim.chartsync.exception.ChartSyncException;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;

/**
 * Command line entry point.
 * <p>
 * Parses arguments, opens the input document with the configured archive limits, runs the
 * selected action and, for actions that change the document, saves it to {@code --output}.
 * Results are printed to standard output; logging goes to standard error.
 *
 * @invariant The input file is never modified. The configuration is not mutated after
 *      validation. The extracted working copy is deleted when the run ends.
 */
public class ChartSyncApplication {

    private static final Logger logger = LoggerFactory.getLogger(ChartSyncApplication.class);

    /**
     * @param args command line arguments as defined in {@link ChartSyncConfig}
     * @pre args != null
     * @post the action's result is printed, or the process exits with a non-zero code
     */
    public static void main(String[] args) {
        if (args == null) {
            throw new IllegalArgumentException("args must not be null");
        }
        int exitCode = run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs the command without terminating the JVM.
     *
     * @return the process exit code
     */
    static int run(String[] args) {
        long startTime = System.nanoTime();
        ChartSyncConfig config = new ChartSyncConfig();
        CommandLine cmd = new CommandLine(config);

        try {
            cmd.parseArgs(args);

            if (cmd.isUsageHelpRequested()) {
                cmd.usage(System.out);
                return 0;
            }
            if (cmd.isVersionHelpRequested()) {
                cmd.printVersionHelp(System.out);
                return 0;
            }

            config.validate();
            if (config.verbose) {
                enableVerboseLogging();
            }
            logger.info("Input file: {}", config.inputFile);
            logger.info("Action: {}", config.action);
            if (config.outputFile != null) {
                logger.info("Output file: {}", config.outputFile);
            }

            ChartAction action = new ActionSelector().select(config);
            try (DocxChartEditor editor = DocxChartEditor.open(config.inputFile, config.toArchiveLimits())) {
                action.execute(editor, config, System.out);
                if (action.mutatesPackage()) {
                    editor.save(config.outputFile);
                    logger.info("Saved {}", config.outputFile);
                }
            }
            return 0;

        } catch (CommandLine.MissingParameterException ex) {
            logger.error("Missing required parameter(s): {}", ex.getMessage());
            cmd.usage(System.err);
            return cmd.getCommandSpec().exitCodeOnInvalidInput();
        } catch (CommandLine.ParameterException ex) {
            logger.error("Invalid parameter(s): {}", ex.getMessage());
            cmd.usage(System.err);
            return cmd.getCommandSpec().exitCodeOnInvalidInput();
        } catch (IllegalArgumentException ex) {
            logger.error("Configuration validation failed: {}", ex.getMessage());
            return 1;
        } catch (ChartSyncException ex) {
            logger.error("Chart operation failed: {}", ex.getMessage());
            logger.debug("Failure details", ex);
            return 1;
        } catch (Exception ex) {
            logger.error("An unexpected error occurred: {}", ex.getMessage(), ex);
            return 1;
        } finally {
            long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
            logger.info("DOCX Chart Sync finished in {} ms.", durationMillis);
        }
    }

    private static void enableVerboseLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger("com.catmepim.chartsync");
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }
}
