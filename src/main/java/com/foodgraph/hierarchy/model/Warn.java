package com.foodgraph.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Represents a recoverable issue encountered while analyzing or finalizing a
 * consolidation run.
 *
 * <p>Warnings never abort a run. They are logged as they happen and collected
 * into the run report so that a reviewer can see what the pipeline skipped or
 * repaired on its own.
 *
 * <h3>Warning Types</h3>
 * <ul>
 *   <li><strong>CYCLE_DETECTED</strong> - Parent/child edges form a cycle through the subject node</li>
 *   <li><strong>SELF_REFERENCE</strong> - A proposal lists a parent as its own child</li>
 *   <li><strong>GROUP_TOO_SMALL</strong> - An edited group kept fewer children than the minimum group size</li>
 *   <li><strong>SYNONYMS_MISSING</strong> - The optional synonyms export was not found</li>
 *   <li><strong>DEPTH_LIMIT_EXCEEDED</strong> - A node sits deeper than the configured hierarchy limit</li>
 *   <li><strong>UNREPRESENTABLE_NAME</strong> - A proposal line had to be commented out because the name would read back differently</li>
 * </ul>
 *
 * @see com.foodgraph.hierarchy.service.hierarchy.HierarchyBuilder
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Warn {
    public static final String CYCLE_DETECTED = "CYCLE_DETECTED";
    public static final String SELF_REFERENCE = "SELF_REFERENCE";
    public static final String GROUP_TOO_SMALL = "GROUP_TOO_SMALL";
    public static final String SYNONYMS_MISSING = "SYNONYMS_MISSING";
    public static final String DEPTH_LIMIT_EXCEEDED = "DEPTH_LIMIT_EXCEEDED";
    public static final String UNREPRESENTABLE_NAME = "UNREPRESENTABLE_NAME";

    /** Warning code for categorization */
    private String code;

    /** Ingredient, group or file the warning is about */
    private String subject;

    /** Human-readable warning message */
    private String message;

    /** Supporting evidence or context for the warning */
    private String evidence;

    /**
     * Default constructor for JSON deserialization.
     */
    public Warn() {}

    public Warn(String code, String subject, String message, String evidence) {
        this.code = code;
        this.subject = subject;
        this.message = message;
        this.evidence = evidence;
    }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public String getSubject() { return subject; }
    public void setSubject(String subject) { this.subject = subject; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public String getEvidence() { return evidence; }
    public void setEvidence(String evidence) { this.evidence = evidence; }

    /**
     * Creates a cycle warning naming the node at which depth resolution was
     * cut short.
     *
     * @param node Node revisited while its own depth was still being resolved
     * @param path Traversal path that led back to the node
     * @return A cycle warning
     */
    public static Warn cycleDetected(String node, String path) {
        return new Warn(CYCLE_DETECTED, node,
            String.format("Cycle detected involving '%s'; its depth resolves to 0", node), path);
    }

    public static Warn selfReference(String parent) {
        return new Warn(SELF_REFERENCE, parent,
            String.format("Skipping self-reference for '%s' (same as parent)", parent), null);
    }

    /**
     * Creates a warning for an edited group that no longer has enough children.
     *
     * @param parent Parent key of the dropped group
     * @param size Number of children left in the group
     * @param minSize Minimum number of children a group needs
     * @return A group-too-small warning
     */
    public static Warn groupTooSmall(String parent, int size, int minSize) {
        return new Warn(GROUP_TOO_SMALL, parent,
            String.format("Dropping group '%s' with %d child(ren); at least %d required", parent, size, minSize), null);
    }

    public static Warn synonymsMissing(String path) {
        return new Warn(SYNONYMS_MISSING, path,
            String.format("Synonyms file '%s' not found, skipping alias generation", path), null);
    }

    public static Warn depthLimitExceeded(String node, int depth, int limit) {
        return new Warn(DEPTH_LIMIT_EXCEEDED, node,
            String.format("Hierarchy depth %d of '%s' exceeds limit %d", depth, node, limit), null);
    }

    /**
     * Creates a warning for a proposal entry written commented out because its
     * name would read back as a different line.
     *
     * @param parent Parent key of the group
     * @param name The offending parent or child name
     * @return An unrepresentable-name warning
     */
    public static Warn unrepresentableName(String parent, String name) {
        return new Warn(UNREPRESENTABLE_NAME, name,
            String.format("'%s' under [%s] cannot be written to the proposal as is; its line is commented out", name, parent),
            parent);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
