package com.eainde.nlg.model;

import java.io.Serializable;

/**
 * A node of the document plan: either a {@link DocumentPlanNode} branch or a {@link Message} leaf.
 *
 * <p>Traversals switch on {@link #kind()} instead of testing concrete types.</p>
 */
public interface PlanNode extends Serializable {

    enum Kind { BRANCH, LEAF }

    Kind kind();

    default DocumentPlanNode asBranch() {
        throw new IllegalStateException("Not a branch: " + this);
    }

    default Message asLeaf() {
        throw new IllegalStateException("Not a leaf: " + this);
    }
}
