package com.timetree.service;

import com.timetree.model.TimeTreeException.MalformedDescription;
import org.springframework.stereotype.Service;

/**
 * Pulls the Newick string out of NEXUS text. Text that is not NEXUS is assumed to be Newick
 * already and is returned trimmed.
 */
@Service
public class NexusTreeExtractor {

    private static final String NEXUS_HEADER = "#nexus";

    public String extractNewick(String text) {
        if (text == null) {
            throw new MalformedDescription("Tree description is empty");
        }
        String trimmed = text.strip();
        if (!trimmed.toLowerCase().startsWith(NEXUS_HEADER)) {
            return trimmed;
        }

        for (String line : trimmed.split("\\R")) {
            String statement = line.strip();
            if (statement.toLowerCase().startsWith("tree ") && statement.indexOf('=') > 0) {
                return stripRootingComment(statement.substring(statement.indexOf('=') + 1).strip());
            }
        }
        throw new MalformedDescription("NEXUS text contains no tree statement");
    }

    // "[&R] (A:1,B:1);" -> "(A:1,B:1);"
    private String stripRootingComment(String newick) {
        if (newick.startsWith("[&") && newick.indexOf(']') > 0) {
            String comment = newick.substring(2, newick.indexOf(']')).strip();
            if (comment.equalsIgnoreCase("R") || comment.equalsIgnoreCase("U")) {
                return newick.substring(newick.indexOf(']') + 1).strip();
            }
        }
        return newick;
    }
}
