package com.tributary.connect.converter;

import com.tributary.arrow.ArrowBatchDecoder;
import com.tributary.connect.proto.Read;
import com.tributary.connect.proto.Relation;
import com.tributary.connect.session.Session;
import com.tributary.exception.AnalysisException;
import com.tributary.logical.Limit;
import com.tributary.logical.LocalRelation;
import com.tributary.logical.LogicalPlan;
import com.tributary.logical.RangeRelation;
import com.tributary.logical.SQLRelation;
import com.tributary.logical.TableScan;
import com.tributary.logical.Union;
import com.tributary.schema.SchemaInferrer;
import com.tributary.types.StructType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Converts wire relations to logical plans, resolving names against one session.
 *
 * <p>Named tables are looked up in the session's temporary views first and then
 * in the session database. Schemas of SQL queries, tables and files are
 * inferred by DuckDB.
 */
public class RelationConverter {
    private static final Logger logger = LoggerFactory.getLogger(RelationConverter.class);

    private final Session session;
    private final SchemaInferrer schemaInferrer;
    private final ArrowBatchDecoder decoder;

    /**
     * @param session the session whose views and database resolve names
     * @param decoder decoder for client-supplied Arrow data
     */
    public RelationConverter(Session session, ArrowBatchDecoder decoder) {
        this.session = session;
        this.schemaInferrer = new SchemaInferrer(session.runtime());
        this.decoder = decoder;
    }

    /**
     * Converts a relation to a LogicalPlan.
     *
     * @param relation the Protobuf relation
     * @return the converted LogicalPlan
     * @throws PlanConversionException if the relation is malformed
     * @throws AnalysisException if a name cannot be resolved or inputs do not line up
     */
    public LogicalPlan convert(Relation relation) {
        logger.debug("Converting relation type: {}", relation.getRelTypeCase());

        switch (relation.getRelTypeCase()) {
            case READ:
                return convertRead(relation.getRead());
            case SQL:
                return convertSql(relation.getSql().getQuery());
            case RANGE:
                return convertRange(relation.getRange());
            case LIMIT:
                return convertLimit(relation.getLimit());
            case UNION:
                return convertUnion(relation.getUnion());
            case LOCAL_RELATION:
                return convertLocalRelation(relation.getLocalRelation());
            default:
                throw new PlanConversionException("Unsupported relation type: " + relation.getRelTypeCase());
        }
    }

    private LogicalPlan convertSql(String query) {
        if (query.isBlank()) {
            throw new PlanConversionException("SQL relation has an empty query");
        }
        return new SQLRelation(query, schemaInferrer.inferSchema(query));
    }

    private LogicalPlan convertRead(Read read) {
        switch (read.getReadTypeCase()) {
            case NAMED_TABLE:
                return resolveTable(read.getNamedTable().getUnparsedIdentifier());
            case DATA_SOURCE:
                return convertDataSource(read.getDataSource());
            default:
                throw new PlanConversionException("Read relation must have either data_source or named_table");
        }
    }

    private LogicalPlan resolveTable(String name) {
        Optional<LogicalPlan> view = session.getTempView(name);
        if (view.isPresent()) {
            logger.debug("Resolved '{}' to a temporary view", name);
            return view.get();
        }
        if (session.runtime().tableExists(name)) {
            List<String> sources = List.of(name);
            StructType schema = schemaInferrer.inferSchema(
                TableScan.toDuckDBQuery(TableScan.TableFormat.TABLE, sources));
            return new TableScan(TableScan.TableFormat.TABLE, sources, schema);
        }
        throw new AnalysisException("Table or view not found: " + name);
    }

    private LogicalPlan convertDataSource(Read.DataSource dataSource) {
        TableScan.TableFormat format;
        try {
            format = TableScan.TableFormat.fromFileFormat(dataSource.getFormat());
        } catch (IllegalArgumentException e) {
            throw new PlanConversionException(e.getMessage(), e);
        }
        List<String> paths = dataSource.getPathsList();
        if (paths.isEmpty()) {
            throw new PlanConversionException("No path specified for " + format.name().toLowerCase() + " read");
        }
        StructType schema = schemaInferrer.inferSchema(TableScan.toDuckDBQuery(format, paths));
        logger.debug("Creating {} TableScan over {} path(s)", format, paths.size());
        return new TableScan(format, paths, schema);
    }

    private LogicalPlan convertRange(com.tributary.connect.proto.Range range) {
        long start = range.hasStart() ? range.getStart() : 0;
        long end = range.getEnd();
        long step = range.getStep();

        if (step == 0) {
            throw new PlanConversionException("Range step cannot be zero");
        }
        OptionalInt numPartitions = OptionalInt.empty();
        if (range.hasNumPartitions()) {
            if (range.getNumPartitions() <= 0) {
                throw new PlanConversionException(
                    "Range num_partitions must be positive, got " + range.getNumPartitions());
            }
            numPartitions = OptionalInt.of(range.getNumPartitions());
        }

        logger.debug("Creating RangeRelation(start={}, end={}, step={})", start, end, step);
        return new RangeRelation(start, end, step, numPartitions);
    }

    private LogicalPlan convertLimit(com.tributary.connect.proto.Limit limit) {
        if (!limit.hasInput()) {
            throw new PlanConversionException("Limit relation has no input");
        }
        if (limit.getLimit() < 0) {
            throw new PlanConversionException("Limit must be non-negative, got " + limit.getLimit());
        }
        return new Limit(convert(limit.getInput()), limit.getLimit());
    }

    private LogicalPlan convertUnion(com.tributary.connect.proto.Union union) {
        if (union.getInputsCount() == 0) {
            throw new PlanConversionException("Union relation has no inputs");
        }
        List<LogicalPlan> inputs = new ArrayList<>(union.getInputsCount());
        for (Relation input : union.getInputsList()) {
            inputs.add(convert(input));
        }
        return new Union(inputs);
    }

    private LogicalPlan convertLocalRelation(com.tributary.connect.proto.LocalRelation localRelation) {
        if (!localRelation.hasData() || localRelation.getData().isEmpty()) {
            throw new PlanConversionException("LocalRelation must carry Arrow data");
        }
        byte[] arrowData = localRelation.getData().toByteArray();
        logger.debug("LocalRelation has {} bytes of Arrow IPC data", arrowData.length);
        ArrowBatchDecoder.DecodedRows decoded = decoder.decode(arrowData);
        return new LocalRelation(decoded.schema(), decoded.rows());
    }
}
