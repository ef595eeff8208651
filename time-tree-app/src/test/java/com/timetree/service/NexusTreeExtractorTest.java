package com.timetree.service;

import com.timetree.model.TimeTreeException.MalformedDescription;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NexusTreeExtractorTest {

    private final NexusTreeExtractor extractor = new NexusTreeExtractor();

    @Test
    void returnsPlainNewickTrimmed() {
        assertThat(extractor.extractNewick("  (A:1,B:1);\n")).isEqualTo("(A:1,B:1);");
    }

    @Test
    void readsFirstTreeStatement() {
        String nexus = """
            #NEXUS
            Begin trees;
                tree first = (A:1,B:1);
                tree second = (C:1,D:1);
            End;
            """;

        assertThat(extractor.extractNewick(nexus)).isEqualTo("(A:1,B:1);");
    }

    @Test
    void stripsRootingComment() {
        String nexus = "#nexus\nbegin trees;\nTREE t1 = [&R] ((A:1,B:1):1,C:2);\nend;";

        assertThat(extractor.extractNewick(nexus)).isEqualTo("((A:1,B:1):1,C:2);");
    }

    @Test
    void failsWhenNexusHasNoTree() {
        assertThatThrownBy(() -> extractor.extractNewick("#NEXUS\nbegin taxa;\nend;"))
                .isInstanceOf(MalformedDescription.class);
    }
}
