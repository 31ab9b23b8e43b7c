package com.magicfolder.dispatch.cli;

import com.magicfolder.dispatch.server.ClassificationServer;
import com.magicfolder.dispatch.server.EndpointBindException;
import com.magicfolder.dispatch.server.EndpointProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: magicfolder serve
 * <p>
 * Binds the request/reply endpoint and blocks serving classification requests
 * until the process is told to stop (Ctrl+C or SIGTERM closes the Spring
 * context, which stops the server). A bind failure exits with code 1.
 * <p>
 * Configure the endpoint via: {@code MAGICFOLDER_SERVER_ENDPOINT=tcp://127.0.0.1:6000 magicfolder serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the classification server")
@Component
public class ServeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    private final ClassificationServer server;
    private final EndpointProperties properties;

    public ServeCommand(ClassificationServer server, EndpointProperties properties) {
        this.server = server;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        try {
            server.bind();
        } catch (EndpointBindException e) {
            log.error("Startup failed: {}", e.getMessage());
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Classification server listening on " + properties.getEndpoint());
        ConsoleOutput.info("Press Ctrl+C to stop.");
        server.serve();
        return 0;
    }
}
