package com.tributary.connect.service;

import com.tributary.connect.converter.PlanConversionException;
import com.tributary.connect.converter.RelationConverter;
import com.tributary.connect.proto.Command;
import com.tributary.connect.proto.ConfigCommand;
import com.tributary.connect.proto.CreateDataFrameViewCommand;
import com.tributary.connect.session.Session;
import com.tributary.logical.LogicalPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs side-effecting commands against one session on the calling thread.
 */
public class CommandHandler {

    private static final Logger logger = LoggerFactory.getLogger(CommandHandler.class);

    private final Session session;
    private final RelationConverter relationConverter;
    private final String operationId;

    public CommandHandler(Session session, RelationConverter relationConverter, String operationId) {
        this.session = session;
        this.relationConverter = relationConverter;
        this.operationId = operationId;
    }

    /**
     * Executes the command. Returns normally on success.
     *
     * @param command the command
     * @throws UnsupportedOperationException for an unset or unknown command type
     */
    public void handle(Command command) {
        logger.debug("[{}] Command type: {}", operationId, command.getCommandTypeCase());
        switch (command.getCommandTypeCase()) {
            case SQL_COMMAND:
                executeSql(command.getSqlCommand().getSql());
                break;
            case CREATE_DATAFRAME_VIEW:
                createView(command.getCreateDataframeView());
                break;
            case CONFIG:
                setConfig(command.getConfig());
                break;
            default:
                throw new UnsupportedOperationException(command.getCommandTypeCase() + " not supported.");
        }
    }

    private void executeSql(String sql) {
        if (sql.isBlank()) {
            throw new PlanConversionException("SQL command has an empty statement");
        }
        session.runtime().execute(sql);
        logger.info("[{}] SQL command executed", operationId);
    }

    private void createView(CreateDataFrameViewCommand view) {
        if (view.getName().isEmpty()) {
            throw new PlanConversionException("View name must not be empty");
        }
        if (!view.hasInput()) {
            throw new PlanConversionException("View '" + view.getName() + "' has no input relation");
        }
        LogicalPlan plan = relationConverter.convert(view.getInput());
        session.registerTempView(view.getName(), plan, view.getReplace());
        logger.info("[{}] Registered temporary view '{}'", operationId, view.getName());
    }

    private void setConfig(ConfigCommand config) {
        for (ConfigCommand.KeyValue pair : config.getPairsList()) {
            session.setConfig(pair.getKey(), pair.getValue());
            logger.info("[{}] Set session conf {}={}", operationId, pair.getKey(), session.getConfig(pair.getKey()));
        }
    }
}
