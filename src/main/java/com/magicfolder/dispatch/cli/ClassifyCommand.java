package com.magicfolder.dispatch.cli;

import com.magicfolder.core.model.ClassificationResponse;
import com.magicfolder.core.model.ClassificationResult;
import com.magicfolder.dispatch.server.EndpointProperties;
import com.magicfolder.dispatch.server.RequestCodec;
import com.magicfolder.dispatch.server.RequestParseException;
import org.springframework.stereotype.Component;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: magicfolder classify &lt;file&gt;...
 * <p>
 * Client for a running server: sends one batch request and prints the
 * category for each file. Relative paths are resolved against the current
 * directory because the server runs in its own process.
 */
@Command(name = "classify", mixinStandardHelpOptions = true,
        description = "Send files to a running classification server")
@Component
public class ClassifyCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to classify")
    private List<String> files;

    @Option(names = {"-e", "--endpoint"}, description = "Server endpoint (default: configured endpoint)")
    private String endpoint;

    @Option(names = {"-t", "--timeout"}, description = "Reply timeout in milliseconds (default: configured timeout)")
    private Integer timeoutMs;

    @Option(names = "--raw", description = "Print the raw JSON reply")
    private boolean raw;

    private final ZContext context;
    private final RequestCodec codec;
    private final EndpointProperties properties;

    public ClassifyCommand(ZContext context, RequestCodec codec, EndpointProperties properties) {
        this.context = context;
        this.codec = codec;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        String target = endpoint != null ? endpoint : properties.getEndpoint();
        int timeout = timeoutMs != null ? timeoutMs : properties.getClientTimeoutMs();
        List<String> paths = files.stream()
                .map(f -> Path.of(f).toAbsolutePath().normalize().toString())
                .toList();

        String reply;
        ZMQ.Socket socket = context.createSocket(SocketType.REQ);
        try {
            socket.setReceiveTimeOut(timeout);
            socket.setLinger(0);
            socket.connect(target);
            socket.send(codec.encodeRequest(paths));
            reply = socket.recvStr();
        } finally {
            socket.close();
        }

        if (reply == null) {
            ConsoleOutput.error("No reply from " + target + " within " + timeout + "ms");
            return 1;
        }
        if (raw) {
            System.out.println(reply);
            return 0;
        }

        ClassificationResponse response;
        try {
            response = codec.decodeResponse(reply);
        } catch (RequestParseException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        if (response.hasError()) {
            ConsoleOutput.error("Server error: " + response.error());
            return 1;
        }
        for (ClassificationResult result : response.results()) {
            ConsoleOutput.result(result);
        }
        ConsoleOutput.success(response.results().size() + " file(s) classified");
        return 0;
    }
}
