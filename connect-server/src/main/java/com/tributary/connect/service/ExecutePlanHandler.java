package com.tributary.connect.service;

import com.tributary.arrow.ArrowBatchDecoder;
import com.tributary.arrow.ArrowBatchEncoder;
import com.tributary.connect.config.ConnectConfig;
import com.tributary.connect.converter.RelationConverter;
import com.tributary.connect.proto.ExecutePlanRequest;
import com.tributary.connect.proto.ExecutePlanResponse;
import com.tributary.connect.proto.Plan;
import com.tributary.connect.session.Session;
import com.tributary.connect.session.SessionManager;
import com.tributary.execution.PhysicalPlan;
import com.tributary.execution.PhysicalPlanner;
import com.tributary.execution.QueryExecution;
import com.tributary.logical.LogicalPlan;
import com.tributary.scheduler.JobScheduler;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes one plan for one session: commands run synchronously and complete
 * the stream with no data, queries are streamed by a
 * {@link StreamingResultHandler}.
 *
 * <p>The session is held for the whole request so that eviction cannot close
 * its database while partitions are still reading from it.
 */
public class ExecutePlanHandler {

    private static final Logger logger = LoggerFactory.getLogger(ExecutePlanHandler.class);

    private final SessionManager sessionManager;
    private final JobScheduler scheduler;
    private final ArrowBatchEncoder encoder;
    private final ArrowBatchDecoder decoder;
    private final long maxEstimatedBatchBytes;

    public ExecutePlanHandler(SessionManager sessionManager,
                              JobScheduler scheduler,
                              ArrowBatchEncoder encoder,
                              ArrowBatchDecoder decoder,
                              ConnectConfig config) {
        this.sessionManager = sessionManager;
        this.scheduler = scheduler;
        this.encoder = encoder;
        this.decoder = decoder;
        this.maxEstimatedBatchBytes = config.maxEstimatedBatchBytes();
    }

    /**
     * Runs the request's plan and writes the full response stream. Failures
     * are thrown before the stream is completed.
     *
     * @param request the request
     * @param operationId operation identifier for responses and logs
     * @param responseObserver the response stream
     * @throws UnsupportedOperationException if the plan is neither a query nor a command
     */
    public void handle(ExecutePlanRequest request,
                       String operationId,
                       StreamObserver<ExecutePlanResponse> responseObserver) {
        if (request.getClientId().isEmpty()) {
            throw new IllegalArgumentException("client_id must be set");
        }
        Plan plan = request.getPlan();
        Session session = sessionManager.acquire(request.getUserContext().getUserId(), request.getClientId());
        try {
            logger.debug("[{}] Plan type: {}", operationId, plan.getOpTypeCase());
            RelationConverter converter = new RelationConverter(session, decoder);
            switch (plan.getOpTypeCase()) {
                case COMMAND:
                    new CommandHandler(session, converter, operationId).handle(plan.getCommand());
                    responseObserver.onCompleted();
                    break;
                case ROOT:
                    LogicalPlan logical = converter.convert(plan.getRoot());
                    executeQuery(session, logical, operationId, request.getClientId(), responseObserver);
                    break;
                default:
                    throw new UnsupportedOperationException(plan.getOpTypeCase() + " not supported.");
            }
        } finally {
            session.release();
        }
    }

    private void executeQuery(Session session,
                              LogicalPlan logical,
                              String operationId,
                              String clientId,
                              StreamObserver<ExecutePlanResponse> responseObserver) {
        QueryExecution queryExecution = new QueryExecution(
            logical, new PhysicalPlanner(session.runtime(), session.plannerOptions()));
        PhysicalPlan executedPlan = queryExecution.executedPlan();
        logger.debug("[{}] Physical plan:\n{}", operationId, executedPlan.treeString());

        StreamingResultHandler resultHandler = new StreamingResultHandler(
            responseObserver, scheduler, encoder, clientId, operationId);
        resultHandler.streamResults(
            executedPlan,
            session.maxRecordsPerBatch(),
            maxEstimatedBatchBytes,
            session.timeZone().getId());
    }
}
