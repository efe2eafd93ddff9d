// file: server/src/main/java/io/branchtree/server/ServerConfig.java
package io.branchtree.server;

import java.time.DateTimeException;
import java.time.ZoneOffset;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort: external HTTP API port
 *  - dataDir:  root directory for conversation files; every file id is resolved under it
 *  - zone:     UTC offset used for document and node timestamps
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        String zone
) {

    public static final int DEFAULT_HTTP_PORT = 8080;
    public static final String DEFAULT_DATA_DIR = "./data/conversations";
    public static final String DEFAULT_ZONE = "+08:00";

    /** Timestamp offset; the zone is validated when parsed, so this never throws for parsed configs. */
    public ZoneOffset zoneOffset() {
        return ZoneOffset.of(zone);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --data-dir,  -d   <path>
     *   --zone,      -z   <offset>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        int httpPort = DEFAULT_HTTP_PORT;
        String dataDir = DEFAULT_DATA_DIR;
        String zone = DEFAULT_ZONE;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        httpPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid http-port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--zone", "-z" -> {
                    ensureValue(args, i);
                    zone = args[++i];
                    try {
                        ZoneOffset.of(zone);
                    } catch (DateTimeException e) {
                        System.err.println("Invalid zone offset: " + zone);
                        System.exit(1);
                    }
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(httpPort, dataDir, zone);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --http-port, -p   HTTP port (default: 8080)
              --data-dir,  -d   Conversation directory (default: ./data/conversations)
              --zone,      -z   Timestamp UTC offset (default: +08:00)
              --help,      -h   Show this help message
            """);
        System.exit(0);
    }
}
