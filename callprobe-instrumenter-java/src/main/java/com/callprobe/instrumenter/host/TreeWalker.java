package com.callprobe.instrumenter.host;

import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.ChildListPropertyDescriptor;
import org.eclipse.jdt.core.dom.ChildPropertyDescriptor;
import org.eclipse.jdt.core.dom.StructuralPropertyDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Top-down rewrite over a JDT tree.
 *
 * Each node is offered to the transform while still attached to its parent. A different node
 * returned in its place is spliced into the parent's slot, and the walk then descends into the
 * children of the replacement. The replacement itself is not offered again.
 */
public class TreeWalker {

    /** Returns the new root, which is {@code root} unless the transform replaced it. */
    public ASTNode walk(ASTNode root, UnaryOperator<ASTNode> transform) {
        return visit(root, transform);
    }

    private ASTNode visit(ASTNode node, UnaryOperator<ASTNode> transform) {
        ASTNode current = transform.apply(node);
        if (current != node) {
            splice(node, current);
        }
        descend(current, transform);
        return current;
    }

    @SuppressWarnings("unchecked")
    private void descend(ASTNode node, UnaryOperator<ASTNode> transform) {
        for (Object property : node.structuralPropertiesForType()) {
            if (property instanceof ChildPropertyDescriptor child) {
                ASTNode value = (ASTNode) node.getStructuralProperty(child);
                if (value != null) {
                    visit(value, transform);
                }
            } else if (property instanceof ChildListPropertyDescriptor list) {
                // Snapshot: visiting replaces elements of the live list
                List<ASTNode> values = new ArrayList<>((List<ASTNode>) node.getStructuralProperty(list));
                for (ASTNode value : values) {
                    visit(value, transform);
                }
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void splice(ASTNode original, ASTNode replacement) {
        ASTNode parent = original.getParent();
        if (parent == null) {
            return;
        }
        StructuralPropertyDescriptor location = original.getLocationInParent();
        if (location.isChildListProperty()) {
            List<ASTNode> siblings = (List<ASTNode>) parent.getStructuralProperty(location);
            siblings.set(siblings.indexOf(original), replacement);
        } else {
            parent.setStructuralProperty(location, replacement);
        }
    }
}
