package com.tributary.execution;

import com.tributary.logical.LogicalPlan;
import com.tributary.types.StructField;
import com.tributary.types.StructType;
import com.tributary.util.TreeStrings;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One query: its logical plan and, planned on first use, its operator tree.
 */
public class QueryExecution {

    private final LogicalPlan logical;
    private final PhysicalPlanner planner;
    private PhysicalPlan executedPlan;

    public QueryExecution(LogicalPlan logical, PhysicalPlanner planner) {
        this.logical = logical;
        this.planner = planner;
    }

    public LogicalPlan logical() {
        return logical;
    }

    public StructType schema() {
        return logical.schema();
    }

    /**
     * Returns the operator tree, planning it on the first call.
     *
     * @return the physical root
     */
    public synchronized PhysicalPlan executedPlan() {
        if (executedPlan == null) {
            executedPlan = planner.plan(logical);
        }
        return executedPlan;
    }

    /**
     * Describes the query in the given format.
     *
     * @param mode the explain format
     * @return the explain text
     */
    public String explainString(ExplainMode mode) {
        PhysicalPlan physical = executedPlan();
        switch (mode) {
            case SIMPLE:
                return "== Physical Plan ==\n" + physical.treeString();
            case EXTENDED:
                return "== Analyzed Logical Plan ==\n"
                    + schema().fields().stream()
                        .map(f -> f.name() + ": " + f.dataType().simpleString())
                        .collect(Collectors.joining(", "))
                    + "\n" + logical.treeString()
                    + "\n== Physical Plan ==\n" + physical.treeString();
            case CODEGEN:
                return "Found 0 WholeStageCodegen subtrees.\n";
            case COST:
                return "== Optimized Logical Plan ==\n" + logical.treeStringWithStats()
                    + "\n== Physical Plan ==\n" + physical.treeString();
            case FORMATTED:
                return formattedString(physical);
            default:
                throw new IllegalArgumentException("Unhandled explain mode: " + mode);
        }
    }

    private static String formattedString(PhysicalPlan root) {
        // Operators are numbered children first
        Map<PhysicalPlan, Integer> numbers = new IdentityHashMap<>();
        List<PhysicalPlan> ordered = new ArrayList<>();
        number(root, numbers, ordered);

        StringBuilder sb = new StringBuilder("== Physical Plan ==\n");
        sb.append(TreeStrings.render(root,
            plan -> plan.nodeName() + " (" + numbers.get(plan) + ")",
            PhysicalPlan::children));

        for (PhysicalPlan plan : ordered) {
            sb.append('\n')
              .append('(').append(numbers.get(plan)).append(") ").append(plan.nodeName()).append('\n')
              .append("Output [").append(plan.schema().size()).append("]: ")
              .append(plan.schema().fields().stream().map(StructField::name)
                  .collect(Collectors.joining(", ", "[", "]")))
              .append('\n');
            String args = plan.argString();
            if (!args.isEmpty()) {
                sb.append("Arguments: ").append(args).append('\n');
            }
        }
        return sb.toString();
    }

    private static void number(PhysicalPlan plan, Map<PhysicalPlan, Integer> numbers, List<PhysicalPlan> ordered) {
        for (PhysicalPlan child : plan.children()) {
            number(child, numbers, ordered);
        }
        ordered.add(plan);
        numbers.put(plan, ordered.size());
    }
}
