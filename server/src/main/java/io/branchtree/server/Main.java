// file: server/src/main/java/io/branchtree/server/Main.java
package io.branchtree.server;

import io.branchtree.core.BranchEngine;
import io.branchtree.storage.ConversationStore;
import io.branchtree.storage.DocumentCodec;
import io.branchtree.storage.FileDocumentStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Entry point for the branch-tree server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire the codec, file stores, engine and service.
 *  - Start the HTTP server and stop it on shutdown.
 */
public final class Main {

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        var cfg = ServerConfig.fromArgs(args);

        // ------ Storage layer ------
        Path dataDir = Files.createDirectories(Path.of(cfg.dataDir()));
        var codec = new DocumentCodec();
        var clock = Clock.system(cfg.zoneOffset());
        var documents = new FileDocumentStore(dataDir, codec);
        var conversations = new ConversationStore(dataDir, codec, clock);

        // ------ Engine + service ------
        var service = new BranchService(documents, codec, new BranchEngine(clock));

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), service, conversations, codec);
        web.start();

        System.out.printf(
                "Branch server listening on http://%s:%d (data: %s, zone: %s)%n",
                "localhost", cfg.httpPort(), dataDir.toAbsolutePath(), cfg.zone()
        );

        Runtime.getRuntime().addShutdownHook(new Thread(web::stop));
    }
}
