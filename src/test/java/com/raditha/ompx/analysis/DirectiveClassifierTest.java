package com.raditha.ompx.analysis;

import com.raditha.ompx.ast.DirectiveKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class DirectiveClassifierTest {

    @ParameterizedTest
    @EnumSource(DirectiveKind.class)
    void testEveryLoopDirectiveHasALabel(DirectiveKind kind) {
        String label = DirectiveClassifier.classify(kind, false);
        if (kind.isLoopAssociated() || kind == DirectiveKind.TARGET_DATA) {
            assertFalse(label.isEmpty(), kind + " should be classified");
        } else {
            assertEquals("", label);
        }
    }

    @ParameterizedTest
    @EnumSource(DirectiveKind.class)
    void testLabelsUseCorrectSpelling(DirectiveKind kind) {
        String label = DirectiveClassifier.classify(kind, true);
        assertFalse(label.contains("ditribute"));
        assertFalse(label.contains("smid"));
    }

    @Test
    void testForBecomesParallelForInsideParallelRegion() {
        assertEquals("for", DirectiveClassifier.classify(DirectiveKind.FOR, false));
        assertEquals("parallel for", DirectiveClassifier.classify(DirectiveKind.FOR, true));
        assertEquals("for simd", DirectiveClassifier.classify(DirectiveKind.FOR_SIMD, false));
        assertEquals("parallel for simd", DirectiveClassifier.classify(DirectiveKind.FOR_SIMD, true));
    }

    @Test
    void testParallelFlagDoesNotChangeOtherLabels() {
        assertEquals("simd", DirectiveClassifier.classify(DirectiveKind.SIMD, true));
        assertEquals("target teams distribute parallel for",
                DirectiveClassifier.classify(DirectiveKind.TARGET_TEAMS_DISTRIBUTE_PARALLEL_FOR, true));
        assertEquals("distribute parallel for simd",
                DirectiveClassifier.classify(DirectiveKind.DISTRIBUTE_PARALLEL_FOR_SIMD, false));
        assertEquals("target data", DirectiveClassifier.classify(DirectiveKind.TARGET_DATA, true));
    }

    @ParameterizedTest
    @EnumSource(value = DirectiveKind.class, names = {
            "TARGET_PARALLEL_FOR", "TARGET_PARALLEL_FOR_SIMD", "TARGET_TEAMS_DISTRIBUTE",
            "TARGET_TEAMS_DISTRIBUTE_PARALLEL_FOR", "TARGET_TEAMS_DISTRIBUTE_PARALLEL_FOR_SIMD",
            "TARGET_TEAMS_DISTRIBUTE_SIMD", "TARGET_PARALLEL", "TARGET_TEAMS", "TARGET_UPDATE", "TARGET"})
    void testOffloadingDirectives(DirectiveKind kind) {
        assertTrue(DirectiveClassifier.causesOffload(kind));
    }

    @ParameterizedTest
    @EnumSource(value = DirectiveKind.class, names = {
            "TARGET_DATA", "TARGET_ENTER_DATA", "TARGET_EXIT_DATA", "TARGET_SIMD", "PARALLEL_FOR", "TEAMS"})
    void testDataMovementAndHostDirectivesDoNotOffload(DirectiveKind kind) {
        assertFalse(DirectiveClassifier.causesOffload(kind));
    }

    @Test
    void testLoopAssociatedKindCount() {
        long loopKinds = java.util.Arrays.stream(DirectiveKind.values())
                .filter(DirectiveKind::isLoopAssociated)
                .count();
        assertEquals(22, loopKinds);
    }
}
