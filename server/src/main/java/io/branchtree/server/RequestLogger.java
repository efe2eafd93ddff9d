// file: server/src/main/java/io/branchtree/server/RequestLogger.java
package io.branchtree.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place to log every HTTP request: method, path, status and latency.
 * 5xx responses are logged at WARNING together with their cause.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * @param totalMillis   wall-clock latency for the whole request
     * @param serviceMillis time spent inside the branch/conversation service, or -1 if not measured
     * @param error         exception behind the response, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long serviceMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                serviceMillis >= 0 ? ", service=" + serviceMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.FINE, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
