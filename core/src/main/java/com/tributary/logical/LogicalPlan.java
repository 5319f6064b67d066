package com.tributary.logical;

import com.tributary.types.StructType;
import com.tributary.util.TreeStrings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Base class for all logical plan nodes.
 *
 * <p>A logical plan is the analyzed form of a client relation: each node
 * knows its output schema and, where cheap to compute, its row count. The
 * physical planner turns it into an executable operator tree.
 */
public abstract class LogicalPlan {

    protected final List<LogicalPlan> children;

    /** Cached output schema. */
    protected StructType schema;

    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    protected LogicalPlan(LogicalPlan child) {
        this.children = Collections.singletonList(child);
    }

    protected LogicalPlan(List<LogicalPlan> children) {
        this.children = new ArrayList<>(children);
    }

    /**
     * Computes the output schema of this node.
     *
     * @return the schema
     */
    public abstract StructType inferSchema();

    /**
     * Returns the one-line description of this node used in plan trees.
     *
     * @return the node description
     */
    public abstract String simpleString();

    public List<LogicalPlan> children() {
        return Collections.unmodifiableList(children);
    }

    public StructType schema() {
        if (schema == null) {
            schema = inferSchema();
        }
        return schema;
    }

    /**
     * Returns the number of rows this node produces, when known without
     * running it.
     *
     * @return the row count, or empty if unknown
     */
    public OptionalLong estimatedRowCount() {
        return OptionalLong.empty();
    }

    /**
     * Returns true if this plan is data held by the server itself rather
     * than something the engine has to compute.
     *
     * @return whether the plan is local
     */
    public boolean isLocal() {
        return false;
    }

    /**
     * Returns the distinct files read by this plan, in first-seen order.
     *
     * @return the input file paths
     */
    public List<String> inputFiles() {
        Set<String> files = new LinkedHashSet<>();
        collectInputFiles(files);
        return new ArrayList<>(files);
    }

    protected void collectInputFiles(Set<String> files) {
        for (LogicalPlan child : children) {
            child.collectInputFiles(files);
        }
    }

    public String treeString() {
        return TreeStrings.render(this, LogicalPlan::simpleString, LogicalPlan::children);
    }

    /**
     * Renders the tree with each node's row count appended where known.
     *
     * @return the annotated tree
     */
    public String treeStringWithStats() {
        return TreeStrings.render(this,
            plan -> plan.simpleString() + ", Statistics(rowCount="
                + (plan.estimatedRowCount().isPresent() ? String.valueOf(plan.estimatedRowCount().getAsLong()) : "unknown")
                + ")",
            LogicalPlan::children);
    }

    @Override
    public String toString() {
        return simpleString();
    }
}
