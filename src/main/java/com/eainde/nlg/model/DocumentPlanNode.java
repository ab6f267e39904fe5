package com.eainde.nlg.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Internal node of the document plan. The root stands for the whole document, its children are
 * paragraphs, and each paragraph holds the nucleus message followed by its satellites.
 */
public class DocumentPlanNode implements PlanNode {

    private final List<PlanNode> children;
    private final Relation relation;

    public DocumentPlanNode(List<? extends PlanNode> children, Relation relation) {
        this.children = new ArrayList<>(children);
        this.relation = relation;
    }

    public static DocumentPlanNode sequence(PlanNode... children) {
        return new DocumentPlanNode(Arrays.asList(children), Relation.SEQUENCE);
    }

    public static DocumentPlanNode sequence(List<? extends PlanNode> children) {
        return new DocumentPlanNode(children, Relation.SEQUENCE);
    }

    @Override
    public Kind kind() {
        return Kind.BRANCH;
    }

    @Override
    public DocumentPlanNode asBranch() {
        return this;
    }

    /** Live, mutable list of children. Stages rewrite it in place. */
    public List<PlanNode> getChildren() {
        return children;
    }

    public Relation getRelation() {
        return relation;
    }

    /** All message leaves under this node, in document order. */
    public List<Message> messages() {
        List<Message> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    private static void collect(PlanNode node, List<Message> out) {
        switch (node.kind()) {
            case LEAF -> out.add(node.asLeaf());
            case BRANCH -> node.asBranch().getChildren().forEach(child -> collect(child, out));
        }
    }

    /** Indented rendering for debug logging. */
    public String toTreeString() {
        StringBuilder sb = new StringBuilder();
        appendTree(this, "", sb);
        return sb.toString();
    }

    private static void appendTree(PlanNode node, String indent, StringBuilder sb) {
        switch (node.kind()) {
            case LEAF -> sb.append(indent).append(node.asLeaf()).append('\n');
            case BRANCH -> {
                DocumentPlanNode branch = node.asBranch();
                sb.append(indent).append(branch.getRelation()).append('\n');
                branch.getChildren().forEach(child -> appendTree(child, indent + "  ", sb));
            }
        }
    }

    @Override
    public String toString() {
        return relation + children.toString();
    }
}
