package com.tributary.connect.service;

import com.tributary.connect.proto.AnalyzePlanRequest;
import com.tributary.connect.proto.AnalyzePlanResponse;
import com.tributary.connect.proto.ConnectServiceGrpc;
import com.tributary.connect.proto.ExecutePlanRequest;
import com.tributary.connect.proto.ExecutePlanResponse;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * gRPC entry point. Each RPC delegates to its handler and translates any
 * failure into the stream's terminal error.
 */
public class ConnectServiceImpl extends ConnectServiceGrpc.ConnectServiceImplBase {
    private static final Logger logger = LoggerFactory.getLogger(ConnectServiceImpl.class);

    private final ExecutePlanHandler executePlanHandler;
    private final AnalyzePlanHandler analyzePlanHandler;
    private final ErrorTranslator errorTranslator;

    public ConnectServiceImpl(ExecutePlanHandler executePlanHandler,
                              AnalyzePlanHandler analyzePlanHandler,
                              ErrorTranslator errorTranslator) {
        this.executePlanHandler = executePlanHandler;
        this.analyzePlanHandler = analyzePlanHandler;
        this.errorTranslator = errorTranslator;

        logger.info("ConnectServiceImpl initialized");
    }

    /**
     * Execute a plan and stream results back to the client.
     *
     * @param request ExecutePlanRequest containing the plan
     * @param responseObserver Stream observer for responses
     */
    @Override
    public void executePlan(ExecutePlanRequest request,
                            StreamObserver<ExecutePlanResponse> responseObserver) {
        String operationId = request.getOperationId().isEmpty()
            ? UUID.randomUUID().toString()
            : request.getOperationId();
        logger.info("[{}] executePlan called for session: {}", operationId, request.getClientId());

        try {
            executePlanHandler.handle(request, operationId, responseObserver);
        } catch (Throwable t) {
            errorTranslator.handleError("[" + operationId + "] ExecutePlan", responseObserver, t);
        }
    }

    /**
     * Analyze a query plan without executing it.
     *
     * @param request AnalyzePlanRequest
     * @param responseObserver Response observer
     */
    @Override
    public void analyzePlan(AnalyzePlanRequest request,
                            StreamObserver<AnalyzePlanResponse> responseObserver) {
        logger.info("analyzePlan called for session: {}", request.getClientId());

        AnalyzePlanResponse response;
        try {
            response = analyzePlanHandler.handle(request);
        } catch (Throwable t) {
            errorTranslator.handleError("AnalyzePlan", responseObserver, t);
            return;
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }
}
