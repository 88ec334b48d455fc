package com.topostat.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: topostat serve
 * <p>
 * Starts the collector: the envelope endpoint plus the ingestion worker. The web
 * server is enabled by {@link com.topostat.TopostatApplication#main} detecting
 * "serve" in args; {@link CliRunner} then skips picocli. The startup banner is
 * printed once the embedded server is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 topostat serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the result collector")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached via --help style invocations; serve mode bypasses picocli
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Collector listening on port " + port);
        System.out.println();
        System.out.println("  Envelopes:  POST http://localhost:" + port + "/api/v1/envelopes");
        System.out.println("  Health:     GET  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
