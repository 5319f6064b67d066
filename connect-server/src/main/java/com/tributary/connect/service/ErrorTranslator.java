package com.tributary.connect.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.Any;
import com.google.rpc.Code;
import com.google.rpc.ErrorInfo;
import com.tributary.exception.ErrorOrigin;
import com.tributary.exception.TributaryException;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import io.grpc.protobuf.StatusProto;
import io.grpc.stub.StreamObserver;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns failures raised while serving an RPC into gRPC statuses.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>a {@link StatusRuntimeException} is passed through;</li>
 *   <li>if the cause chain holds a failure raised by the embedded database,
 *       that failure is translated instead of its wrappers;</li>
 *   <li>domain exceptions and non-fatal throwables become {@code INTERNAL}
 *       with an {@link ErrorInfo} detail naming the exception class and its
 *       superclasses;</li>
 *   <li>anything else becomes {@code UNKNOWN} with the cause attached.</li>
 * </ol>
 * Messages are abbreviated to the configured maximum size.
 */
public class ErrorTranslator {

    private static final Logger logger = LoggerFactory.getLogger(ErrorTranslator.class);

    public static final String ERROR_DOMAIN = "com.tributary";
    public static final String CLASSES_METADATA_KEY = "classes";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int maxMessageSize;

    /**
     * @param maxMessageSize longest message sent to clients, at least 4
     */
    public ErrorTranslator(int maxMessageSize) {
        if (maxMessageSize < 4) {
            throw new IllegalArgumentException("maxMessageSize must be at least 4, got: " + maxMessageSize);
        }
        this.maxMessageSize = maxMessageSize;
    }

    /**
     * Logs the failure and terminates the stream with the translated status.
     *
     * @param operation label for the log line, e.g. "[op-id] ExecutePlan"
     * @param observer the response stream
     * @param t the failure
     */
    public void handleError(String operation, StreamObserver<?> observer, Throwable t) {
        StatusRuntimeException status = toStatusException(t);
        logger.error("{} failed: {}", operation, status.getStatus().getCode(), t);
        observer.onError(status);
    }

    /**
     * Translates a failure without logging it.
     *
     * @param t the failure
     * @return the status to send
     */
    public StatusRuntimeException toStatusException(Throwable t) {
        if (t instanceof StatusRuntimeException statusRuntimeException) {
            return statusRuntimeException;
        }
        if (t instanceof StatusException statusException) {
            return statusException.getStatus().asRuntimeException(statusException.getTrailers());
        }

        Throwable target = embeddedRuntimeCause(t);
        String message = abbreviate(target.getMessage());

        if (target instanceof TributaryException || isNonFatal(target)) {
            ErrorInfo errorInfo = ErrorInfo.newBuilder()
                .setReason(target.getClass().getName())
                .setDomain(ERROR_DOMAIN)
                .putMetadata(CLASSES_METADATA_KEY, classChainJson(target))
                .build();
            com.google.rpc.Status status = com.google.rpc.Status.newBuilder()
                .setCode(Code.INTERNAL_VALUE)
                .setMessage(message)
                .addDetails(Any.pack(errorInfo))
                .build();
            return StatusProto.toStatusRuntimeException(status);
        }

        return Status.UNKNOWN
            .withDescription(message)
            .withCause(target)
            .asRuntimeException();
    }

    /**
     * Returns the first failure in the cause chain that the embedded database
     * raised, or {@code t} itself when there is none.
     */
    static Throwable embeddedRuntimeCause(Throwable t) {
        Throwable current = t;
        int depth = 0;
        while (current != null && depth++ < 64) {
            if (current instanceof TributaryException tributaryException
                    && tributaryException.origin() == ErrorOrigin.EMBEDDED_RUNTIME) {
                return current;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return t;
    }

    /**
     * Fatal throwables are virtual machine errors, thread death, interruption
     * and linkage errors.
     */
    static boolean isNonFatal(Throwable t) {
        return !(t instanceof VirtualMachineError
            || t instanceof ThreadDeath
            || t instanceof InterruptedException
            || t instanceof LinkageError);
    }

    /**
     * Lists the class of {@code t} and its superclasses, stopping before
     * {@code java.lang.Object}.
     */
    static List<String> classChain(Throwable t) {
        List<String> classes = new ArrayList<>();
        Class<?> current = t.getClass();
        while (current != null && current != Object.class) {
            classes.add(current.getName());
            current = current.getSuperclass();
        }
        return classes;
    }

    private static String classChainJson(Throwable t) {
        try {
            return MAPPER.writeValueAsString(classChain(t));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private String abbreviate(String message) {
        return StringUtils.abbreviate(Objects.toString(message, ""), maxMessageSize);
    }
}
