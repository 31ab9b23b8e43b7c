package com.magicfolder.dispatch.server;

import com.magicfolder.core.metrics.ClassifierMetrics;
import com.magicfolder.core.model.ClassificationRequest;
import com.magicfolder.core.model.ClassificationResponse;
import com.magicfolder.core.pipeline.ClassificationPipeline;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;
import org.zeromq.ZMQException;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Synchronous request/reply loop on a ZeroMQ REP socket.
 * <p>
 * One request is in flight at a time: receive, run the whole pipeline, reply.
 * Every received message gets exactly one reply. Malformed input and internal
 * failures become {@code {"error": ...}} replies and the loop keeps going.
 * The receive uses a short timeout so {@link #stop()} is noticed promptly.
 */
@Component
public class ClassificationServer {

    private static final Logger log = LoggerFactory.getLogger(ClassificationServer.class);

    private final ZContext context;
    private final ClassificationPipeline pipeline;
    private final RequestCodec codec;
    private final EndpointProperties properties;
    private final ClassifierMetrics metrics;

    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile boolean running;
    private ZMQ.Socket socket;

    public ClassificationServer(ZContext context,
                                ClassificationPipeline pipeline,
                                RequestCodec codec,
                                EndpointProperties properties,
                                @Autowired(required = false) ClassifierMetrics metrics) {
        this.context = context;
        this.pipeline = pipeline;
        this.codec = codec;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * @throws EndpointBindException if the endpoint cannot be bound
     */
    public void bind() {
        String endpoint = properties.getEndpoint();
        ZMQ.Socket rep = context.createSocket(SocketType.REP);
        rep.setReceiveTimeOut(properties.getPollTimeoutMs());
        rep.setLinger(0);
        try {
            rep.bind(endpoint);
        } catch (ZMQException e) {
            rep.close();
            throw new EndpointBindException("Could not bind " + endpoint + ": " + e.getMessage(), e);
        }
        socket = rep;
        running = true;
        log.info("Classification server listening on {}", endpoint);
    }

    public void serve() {
        if (socket == null) {
            throw new IllegalStateException("serve() called before bind()");
        }
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                String message;
                try {
                    message = socket.recvStr();
                } catch (ZMQException e) {
                    if (e.getErrorCode() == ZMQ.Error.ETERM.getCode()) {
                        log.info("ZeroMQ context terminated, leaving serve loop");
                        break;
                    }
                    log.warn("Receive failed: {}", e.getMessage());
                    continue;
                }
                if (message == null) {
                    continue;
                }
                String reply = handle(message);
                if (!socket.send(reply)) {
                    log.warn("Reply could not be sent, caller may have gone away");
                }
            }
        } finally {
            socket.close();
            socket = null;
            running = false;
            stopped.countDown();
            log.info("Classification server stopped");
        }
    }

    /**
     * Turns one raw request into one raw reply. Never throws, except for a
     * {@link VirtualMachineError}.
     */
    public String handle(String message) {
        log.debug("Received request: {}", message);
        ClassificationRequest request;
        try {
            request = codec.decodeRequest(message);
        } catch (RequestParseException e) {
            log.warn("Rejected request: {}", e.getMessage());
            if (metrics != null) {
                metrics.recordProtocolError();
            }
            return codec.errorReply(e.getMessage());
        }

        try {
            ClassificationResponse response = pipeline.process(request);
            return codec.encodeResponse(response);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            log.error("Request failed: {}", e.getMessage(), e);
            return codec.errorReply("Internal error: " + e.getMessage());
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Asks the loop to exit and waits briefly for it to release the endpoint.
     */
    @PreDestroy
    public void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping classification server");
        running = false;
        try {
            if (!stopped.await(properties.getPollTimeoutMs() * 4L, TimeUnit.MILLISECONDS)) {
                log.warn("Serve loop did not exit in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
