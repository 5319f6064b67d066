package com.tributary.connect.service;

import com.tributary.arrow.ArrowBatchDecoder;
import com.tributary.connect.converter.RelationConverter;
import com.tributary.connect.converter.SchemaConverter;
import com.tributary.connect.proto.AnalyzePlanRequest;
import com.tributary.connect.proto.AnalyzePlanResponse;
import com.tributary.connect.proto.Explain;
import com.tributary.connect.proto.Plan;
import com.tributary.connect.session.Session;
import com.tributary.connect.session.SessionManager;
import com.tributary.execution.ExplainMode;
import com.tributary.execution.PhysicalPlanner;
import com.tributary.execution.QueryExecution;
import com.tributary.logical.LogicalPlan;
import com.tributary.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers AnalyzePlan: output schema, explain text and input files of a query.
 */
public class AnalyzePlanHandler {

    private static final Logger logger = LoggerFactory.getLogger(AnalyzePlanHandler.class);

    static final String UNSPECIFIED_EXPLAIN_MODE_MESSAGE =
        "Explain mode unspecified. Accepted explain modes are "
            + "'simple', 'extended', 'codegen', 'cost', 'formatted'.";

    private final SessionManager sessionManager;
    private final ArrowBatchDecoder decoder;

    public AnalyzePlanHandler(SessionManager sessionManager, ArrowBatchDecoder decoder) {
        this.sessionManager = sessionManager;
        this.decoder = decoder;
    }

    /**
     * @param request the request; its plan must be a query
     * @return the analysis
     * @throws UnsupportedOperationException if the plan is not a query
     * @throws IllegalArgumentException if the explain mode is unspecified
     */
    public AnalyzePlanResponse handle(AnalyzePlanRequest request) {
        if (request.getClientId().isEmpty()) {
            throw new IllegalArgumentException("client_id must be set");
        }
        Plan plan = request.getPlan();
        if (plan.getOpTypeCase() != Plan.OpTypeCase.ROOT) {
            throw new UnsupportedOperationException(plan.getOpTypeCase() + " not supported.");
        }
        ExplainMode mode = toExplainMode(request.getExplain().getExplainMode());

        Session session = sessionManager.acquire(request.getUserContext().getUserId(), request.getClientId());
        try {
            LogicalPlan logical = new RelationConverter(session, decoder).convert(plan.getRoot());
            QueryExecution queryExecution = new QueryExecution(
                logical, new PhysicalPlanner(session.runtime(), session.plannerOptions()));
            StructType schema = queryExecution.schema();
            logger.debug("Analyzed plan for session {} with explain mode {}", session.key(), mode);

            return AnalyzePlanResponse.newBuilder()
                .setClientId(request.getClientId())
                .setSchema(SchemaConverter.toProto(schema))
                .setExplainString(queryExecution.explainString(mode))
                .setTreeString(schema.treeString())
                .setIsLocal(logical.isLocal())
                .setIsStreaming(false)
                .addAllInputFiles(logical.inputFiles())
                .build();
        } finally {
            session.release();
        }
    }

    static ExplainMode toExplainMode(Explain.ExplainMode mode) {
        switch (mode) {
            case EXPLAIN_MODE_SIMPLE:
                return ExplainMode.SIMPLE;
            case EXPLAIN_MODE_EXTENDED:
                return ExplainMode.EXTENDED;
            case EXPLAIN_MODE_CODEGEN:
                return ExplainMode.CODEGEN;
            case EXPLAIN_MODE_COST:
                return ExplainMode.COST;
            case EXPLAIN_MODE_FORMATTED:
                return ExplainMode.FORMATTED;
            default:
                throw new IllegalArgumentException(UNSPECIFIED_EXPLAIN_MODE_MESSAGE);
        }
    }
}
