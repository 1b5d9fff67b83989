/*-
 * Copyright (c) 2011, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.sqldb.driver.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods to facilitate Logging. All methods accept a null logger,
 * in which case nothing is logged.
 */
public class LogUtil {

    /* Name of the logger used when the application does not supply one */
    public static final String DEFAULT_LOGGER_NAME = "oracle.sqldb.driver";

    public static Logger getDefaultLogger() {
        return Logger.getLogger(DEFAULT_LOGGER_NAME);
    }

    public static boolean isFineEnabled(Logger logger) {
        return logger != null && logger.isLoggable(Level.FINE);
    }

    public static void logFine(Logger logger, String msg) {
        if (logger != null) {
            logger.log(Level.FINE, msg);
        }
    }

    public static void logFine(Logger logger, String msg, Throwable thrown) {
        if (logger != null) {
            logger.log(Level.FINE, msg, thrown);
        }
    }

    /**
     * Shortens text for inclusion in a log message.
     *
     * @param text the text, may be null
     * @param max the maximum number of characters kept
     *
     * @return the text, or its first max characters followed by "..."
     */
    public static String abbreviate(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + "...";
    }
}
