package net.stategraph.util;

import java.io.OutputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

public final class Logging {

    private Logging() {}

    public static void initFormat() {
        System.setProperty("java.util.logging.SimpleFormatter.format",
                           "[%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS.%1$tL " +
                           "%4$s %3$s] %5$s%6$s%n");
    }

    /**
     * Route all log output of the named logger (and its children) to os
     * instead of the root handlers. Returns the installed handler so that
     * it can be removed again.
     */
    public static Handler redirectToStream(String loggerName,
                                           OutputStream os) {
        Logger logger = Logger.getLogger(loggerName);
        Handler newhnd = new StreamHandler(os, new SimpleFormatter()) {
            public synchronized void publish(LogRecord record) {
                // Flush eagerly so that output is visible immediately.
                super.publish(record);
                flush();
            }
        };
        newhnd.setLevel(Level.ALL);
        for (Handler hnd : logger.getHandlers()) {
            logger.removeHandler(hnd);
        }
        logger.addHandler(newhnd);
        return newhnd;
    }
    public static Handler redirectToStream(OutputStream os) {
        return redirectToStream("", os);
    }

}
