package com.blueprintbridge.transpiler.diff;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

public class DiffPolicyReader {

    static final String DEFAULT_RESOURCE = "blueprint-diff-policy.json";

    private static final Gson GSON = new Gson();

    /**
     * Reads a policy file.
     *
     * @throws PolicyReadException if the file is missing or malformed
     */
    public DiffPolicy read(Path policyPath) {
        if (!policyPath.toFile().exists()) {
            throw new PolicyReadException("Diff policy file not found: " + policyPath);
        }
        try (FileReader reader = new FileReader(policyPath.toFile(), StandardCharsets.UTF_8)) {
            return parse(reader, policyPath.toString());
        } catch (FileNotFoundException e) {
            throw new PolicyReadException("Diff policy file not found: " + policyPath, e);
        } catch (IOException e) {
            throw new PolicyReadException("Failed to read diff policy: " + policyPath + ": " + e.getMessage(), e);
        }
    }

    public DiffPolicy fromJson(String json) {
        try {
            return validate(GSON.fromJson(json, DiffPolicy.class), "inline policy");
        } catch (JsonParseException e) {
            throw new PolicyReadException("Diff policy is not valid JSON: " + e.getMessage(), e);
        }
    }

    /** The bundled default policy. */
    public DiffPolicy readDefault() {
        InputStream in = DiffPolicyReader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            throw new PolicyReadException("Bundled diff policy not found on classpath: " + DEFAULT_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new PolicyReadException("Failed to read bundled diff policy: " + e.getMessage(), e);
        }
    }

    private DiffPolicy parse(Reader reader, String source) {
        try {
            return validate(GSON.fromJson(reader, DiffPolicy.class), source);
        } catch (JsonParseException e) {
            throw new PolicyReadException("Diff policy is not valid JSON: " + source + ": " + e.getMessage(), e);
        }
    }

    private static DiffPolicy validate(DiffPolicy policy, String source) {
        if (policy == null) {
            throw new PolicyReadException("Diff policy is empty or invalid JSON: " + source);
        }
        double threshold = policy.getRenameSimilarityThreshold();
        if (threshold < 0.0 || threshold > 1.0) {
            throw new PolicyReadException("rename_similarity_threshold must be within [0, 1], got " + threshold);
        }
        return policy;
    }

    public static class PolicyReadException extends RuntimeException {
        public PolicyReadException(String message) { super(message); }
        public PolicyReadException(String message, Throwable cause) { super(message, cause); }
    }
}
