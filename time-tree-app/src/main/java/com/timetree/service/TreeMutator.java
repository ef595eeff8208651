package com.timetree.service;

import com.timetree.model.Node;
import com.timetree.model.TimeTree;
import com.timetree.model.TimeTreeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Structural edits on time trees. Each call is all-or-nothing and leaves a validated tree.
 */
@Service
public class TreeMutator {

    private static final Logger log = LoggerFactory.getLogger(TreeMutator.class);

    /**
     * Cuts {@code node} and its descendants out of {@code tree}.
     *
     * @return the detached subtree as a tree of its own, rooted at {@code node}
     * @throws TimeTreeException.RootRemoval when {@code node} is the root
     */
    public TimeTree prune(TimeTree tree, Node node) {
        TimeTree pruned = tree.prune(node);
        log.debug("Pruned {} nodes at node #{}; {} remain", pruned.size(), node.getId(), tree.size());
        return pruned;
    }

    /**
     * Re-anchors {@code tree} at {@code newRoot}, reversing ancestry along the path to it.
     *
     * @return the same tree instance, now rooted at {@code newRoot}
     * @throws TimeTreeException.InconsistentTree when a reversed edge would run from a younger
     *         parent to an older child; the tree is unchanged
     */
    public TimeTree reroot(TimeTree tree, Node newRoot) {
        int previousRoot = tree.root().getId();
        tree.reroot(newRoot);
        log.debug("Rerooted tree from node #{} to node #{}", previousRoot, newRoot.getId());
        return tree;
    }

    /**
     * @throws TimeTreeException.InvalidScale unless {@code factor} is finite and positive
     */
    public void rescale(TimeTree tree, double factor) {
        tree.rescale(factor);
        log.debug("Rescaled {} node ages by {}", tree.size(), factor);
    }

    /**
     * Adds {@code offset} to every age. Shifting the whole tree keeps relative order; only a
     * shift that would push some age below zero is rejected.
     *
     * @throws TimeTreeException.InvalidAge when an age would become negative
     */
    public void shift(TimeTree tree, double offset) {
        tree.shift(offset);
        log.debug("Shifted {} node ages by {}", tree.size(), offset);
    }

    public void ladderize(TimeTree tree, boolean increasing) {
        tree.ladderize(increasing);
        log.debug("Ladderized tree ({} clades first)", increasing ? "smaller" : "larger");
    }
}
