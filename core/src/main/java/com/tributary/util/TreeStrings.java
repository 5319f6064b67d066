package com.tributary.util;

import java.util.List;
import java.util.function.Function;

/**
 * Renders plan trees in the indented form used by explain output:
 * <pre>
 * Union
 * :- Range (0, 10, step=1, splits=2)
 * +- GlobalLimit 5
 *    +- Range (0, 100, step=1, splits=4)
 * </pre>
 */
public final class TreeStrings {

    private TreeStrings() {}

    /**
     * Renders a tree, one node per line.
     *
     * @param root the root node
     * @param label the text of one node
     * @param children the children of one node, in display order
     * @param <T> node type
     * @return the rendered tree, ending with a newline
     */
    public static <T> String render(T root, Function<T, String> label, Function<T, List<T>> children) {
        StringBuilder sb = new StringBuilder();
        append(sb, root, label, children, "", "");
        return sb.toString();
    }

    private static <T> void append(StringBuilder sb, T node, Function<T, String> label,
                                   Function<T, List<T>> children, String linePrefix, String childPrefix) {
        sb.append(linePrefix).append(label.apply(node)).append('\n');
        List<T> kids = children.apply(node);
        for (int i = 0; i < kids.size(); i++) {
            boolean last = i == kids.size() - 1;
            append(sb, kids.get(i), label, children,
                childPrefix + (last ? "+- " : ":- "),
                childPrefix + (last ? "   " : ":  "));
        }
    }
}
