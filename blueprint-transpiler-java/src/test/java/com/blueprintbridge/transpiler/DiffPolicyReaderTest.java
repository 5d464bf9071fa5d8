package com.blueprintbridge.transpiler;

import com.blueprintbridge.transpiler.diff.DiffPolicy;
import com.blueprintbridge.transpiler.diff.DiffPolicyReader;
import com.blueprintbridge.transpiler.diff.DiffPolicyReader.PolicyReadException;
import com.blueprintbridge.transpiler.report.ConflictLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DiffPolicyReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void bundledPolicyMatchesBuiltInDefaults() {
        DiffPolicy bundled = new DiffPolicyReader().readDefault();
        DiffPolicy builtIn = DiffPolicy.defaults();

        assertEquals(builtIn.getRenameSimilarityThreshold(), bundled.getRenameSimilarityThreshold());
        assertEquals(builtIn.isWideningCompatible(), bundled.isWideningCompatible());
        assertEquals(builtIn.isOptionalParametersCompatible(), bundled.isOptionalParametersCompatible());
        assertEquals(builtIn.getRemovalConflictLevel(), bundled.getRemovalConflictLevel());
        assertEquals(0.6, bundled.getRenameSimilarityThreshold());
        assertEquals(ConflictLevel.CONFLICT, bundled.getRemovalConflictLevel());
    }

    @Test
    void readsPolicyFileAndDefaultsMissingFields() throws IOException {
        Path file = tempDir.resolve("policy.json");
        Files.writeString(file, """
            {
              "rename_similarity_threshold": 0.75,
              "removal_conflict_level": "compatible"
            }
            """);

        DiffPolicy policy = new DiffPolicyReader().read(file);

        assertEquals(0.75, policy.getRenameSimilarityThreshold());
        assertEquals(ConflictLevel.COMPATIBLE, policy.getRemovalConflictLevel());
        assertTrue(policy.isWideningCompatible());
        assertTrue(policy.isOptionalParametersCompatible());
    }

    @Test
    void missingFileThrows() {
        Path missing = tempDir.resolve("nope.json");
        PolicyReadException e = assertThrows(PolicyReadException.class, () -> new DiffPolicyReader().read(missing));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void invalidJsonThrows() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ \"rename_similarity_threshold\": ");
        assertThrows(PolicyReadException.class, () -> new DiffPolicyReader().read(file));
    }

    @Test
    void emptyFileThrows() throws IOException {
        Path file = tempDir.resolve("empty.json");
        Files.writeString(file, "");
        PolicyReadException e = assertThrows(PolicyReadException.class, () -> new DiffPolicyReader().read(file));
        assertTrue(e.getMessage().contains("empty"));
    }

    @Test
    void thresholdOutsideUnitRangeIsRejected() {
        PolicyReadException e = assertThrows(PolicyReadException.class,
                () -> new DiffPolicyReader().fromJson("{ \"rename_similarity_threshold\": 1.5 }"));
        assertTrue(e.getMessage().contains("rename_similarity_threshold"));
    }

    @Test
    void emptyObjectIsTheDefaultPolicy() {
        DiffPolicy policy = new DiffPolicyReader().fromJson("{}");
        assertEquals(0.6, policy.getRenameSimilarityThreshold());
        assertTrue(policy.isWideningCompatible());
    }
}
