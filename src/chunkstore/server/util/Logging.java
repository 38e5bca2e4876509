package chunkstore.server.util;

import java.io.*;
import java.nio.file.Path;
import java.util.logging.*;

public class Logging {
    private static final Logger LOG = Logger.getGlobal();

    private static boolean isInitialised = false;
    public static Logger LOG() {
        return LOG;
    }

    /**
     * Initialise logging to a file in the store directory
     * @param a
     */
    public static synchronized void init(Args a) {
        Path logPath = a.fromStoreDir("log-name", "chunkstore.%g.log");
        logPath.toFile().getParentFile().mkdirs();
        int logLimit = a.getInt("log-limit", 1024 * 1024);
        int logCount = a.getInt("log-count", 10);
        boolean logAppend = a.getBoolean("log-append", true);
        boolean logToConsole = a.getBoolean("log-to-console", false);
        boolean logToFile = a.getBoolean("log-to-file", true);
        boolean printLogLocation = a.getBoolean("print-log-location", true);

        init(logPath, logLimit, logCount, logAppend, logToConsole, logToFile, printLogLocation);
    }

    public static synchronized void init(Path logPath,
                                         int logLimit,
                                         int logCount,
                                         boolean logAppend,
                                         boolean logToConsole,
                                         boolean logToFile,
                                         boolean printLocation) {

        if (isInitialised)
            return;

        try {
            // also logging to stdout?
            if (! logToConsole)
                LOG().setUseParentHandlers(false);
            if (! logToFile)
                return;

            String logPathS = logPath.toString();
            FileHandler fileHandler = new FileHandler(logPathS, logLimit, logCount, logAppend);
            fileHandler.setFormatter(new SimpleFormatter());

            if (printLocation)
                LOG().info("Logging to "+ logPathS.replace("%g", "0"));

            Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
                String msg = "Uncaught Exception in thread " + thread.getId() + ":" + thread.getName();
                LOG().log(Level.SEVERE, msg, throwable);
            });

            LOG().addHandler(fileHandler);
        } catch (IOException ioe) {
            throw new IllegalStateException(ioe.getMessage(), ioe);
        } finally {
            isInitialised = true;
        }
    }
}
