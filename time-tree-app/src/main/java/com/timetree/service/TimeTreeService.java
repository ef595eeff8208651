package com.timetree.service;

import com.timetree.config.TimeTreeConfig;
import com.timetree.model.Node;
import com.timetree.model.TimeTree;
import com.timetree.model.TreeSummary;
import org.springframework.stereotype.Service;

/**
 * Loads trees from text and describes them; the entry point used by the API layer.
 */
@Service
public class TimeTreeService {

    private final NewickParser newickParser;
    private final NewickWriter newickWriter;
    private final NexusTreeExtractor nexusTreeExtractor;
    private final TimeTreeConfig config;

    public TimeTreeService(NewickParser newickParser,
                           NewickWriter newickWriter,
                           NexusTreeExtractor nexusTreeExtractor,
                           TimeTreeConfig config) {
        this.newickParser = newickParser;
        this.newickWriter = newickWriter;
        this.nexusTreeExtractor = nexusTreeExtractor;
        this.config = config;
    }

    /**
     * Parse Newick or NEXUS text.
     *
     * @param rootAge     age of the outermost node; null means 0
     * @param leafAligned when true the root age is derived so the youngest node sits at 0,
     *                    and {@code rootAge} is ignored
     */
    public TimeTree load(String text, Double rootAge, boolean leafAligned) {
        String newick = nexusTreeExtractor.extractNewick(text);
        if (leafAligned) {
            return newickParser.parseLeafAligned(newick);
        }
        return newickParser.parse(newick, rootAge != null ? rootAge : 0.0);
    }

    public Node requireNode(TimeTree tree, String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("A node label is required");
        }
        return tree.findByLabel(label)
                .orElseThrow(() -> new NodeNotFoundException("No node labelled '" + label + "'"));
    }

    public TreeSummary summarize(TimeTree tree) {
        return new TreeSummary(
                newickWriter.write(tree),
                tree.root().getAge(),
                tree.origin().isPresent() ? tree.origin().getAsDouble() : null,
                tree.size(),
                tree.leafCount(),
                tree.isUltrametric(config.getUltrametricTolerance())
        );
    }

    public static class NodeNotFoundException extends RuntimeException {
        public NodeNotFoundException(String message) {
            super(message);
        }
    }
}
