package com.foodgraph.hierarchy.service.proposal;

import com.foodgraph.hierarchy.model.GroupMember;
import com.foodgraph.hierarchy.model.Warn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the human-editable consolidation proposal.
 *
 * <pre>
 * [PARENT_NAME]
 * child_name,food_group
 * child_name,food_group
 *
 * [NEXT_PARENT]
 * ...
 * </pre>
 *
 * <p>The format has no escaping: names that would parse back differently are
 * written commented out (see {@link #serialize(Map, List)}).
 *
 * <p>Groups are written largest first, children alphabetically. On parse, blank
 * lines and lines starting with {@code #} are ignored, a {@code [...]} line opens
 * a section keyed by its exact contents, and a child line is split on its first
 * comma. Anything else is skipped without complaint since reviewers leave stray
 * notes in the file. Sections left without children are dropped.
 */
public class ProposalCodec {
    private static final Logger log = LoggerFactory.getLogger(ProposalCodec.class);

    static final List<String> HEADER = List.of(
        "# Ingredient Consolidation Proposal",
        "# ",
        "# This file contains proposed ingredient consolidations.",
        "# Each section represents a potential parent ingredient with its children.",
        "# ",
        "# The same ingredient can appear under multiple parent sections.",
        "# ",
        "# To DISABLE a consolidation group, comment out the entire section",
        "# by adding '#' at the beginning of each line.",
        "# ",
        "# To REMOVE specific children from a group, comment out just those lines.",
        "# ",
        "# Format:",
        "# [PARENT_INGREDIENT_NAME]",
        "# child_ingredient_name,food_group",
        "# ",
        "# After editing, run the finalize command to process this file.",
        "# "
    );

    public String serialize(Map<String, List<GroupMember>> groups) {
        return serialize(groups, new ArrayList<>());
    }

    /**
     * Writes the proposal. A parent or child whose name would read back as a
     * different line (a comma in a child name, a leading {@code #}, the
     * {@code [...]} shape, surrounding blanks, line breaks) is written commented
     * out and reported.
     *
     * @param groups parent key to children
     * @param warnings receives one {@code UNREPRESENTABLE_NAME} entry per commented-out line
     * @return proposal text
     */
    public String serialize(Map<String, List<GroupMember>> groups, List<Warn> warnings) {
        StringBuilder sb = new StringBuilder();
        for (String line : HEADER) {
            sb.append(line).append('\n');
        }

        // stable: equally sized groups keep their assignment order
        List<Map.Entry<String, List<GroupMember>>> ordered = new ArrayList<>(groups.entrySet());
        ordered.sort(Comparator.<Map.Entry<String, List<GroupMember>>>comparingInt(e -> e.getValue().size()).reversed());

        for (Map.Entry<String, List<GroupMember>> group : ordered) {
            String parent = group.getKey();
            boolean parentOk = isRepresentableParent(parent);
            if (!parentOk) {
                log.warn("Parent '{}' cannot be written as a section header, commenting out its group", parent);
                warnings.add(Warn.unrepresentableName(parent, parent));
                sb.append('#');
            }
            sb.append('[').append(singleLine(parent)).append("]\n");
            List<GroupMember> children = new ArrayList<>(group.getValue());
            children.sort(Comparator.comparing(GroupMember::getName));
            for (GroupMember child : children) {
                String line = singleLine(child.getName()) + ',' + singleLine(String.valueOf(child.getFoodGroup()));
                if (!parentOk) {
                    sb.append('#');
                } else if (!isRepresentableChild(child)) {
                    log.warn("Child '{}' of {} cannot be written as a proposal line, commenting it out",
                        child.getName(), parent);
                    warnings.add(Warn.unrepresentableName(parent, child.getName()));
                    sb.append('#');
                }
                sb.append(line).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    static boolean isRepresentableParent(String parent) {
        return isPlainLine(parent);
    }

    static boolean isRepresentableChild(GroupMember child) {
        String name = child.getName();
        String foodGroup = child.getFoodGroup();
        return isPlainLine(name)
            && name.indexOf(',') < 0
            && !name.startsWith("#")
            && !name.startsWith("[")
            && (foodGroup == null || (foodGroup.equals(foodGroup.strip()) && !containsLineBreak(foodGroup)));
    }

    private static boolean isPlainLine(String value) {
        return value != null && !value.isEmpty() && value.equals(value.strip()) && !containsLineBreak(value);
    }

    private static boolean containsLineBreak(String value) {
        return value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
    }

    private static String singleLine(String value) {
        return value.replace('\r', ' ').replace('\n', ' ');
    }

    public Map<String, List<GroupMember>> parse(String text) {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses an edited proposal.
     *
     * @param reader proposal text; not closed by this method
     * @return parent key to children in file order, sections in file order
     * @throws IOException if reading fails
     */
    public Map<String, List<GroupMember>> parse(Reader reader) throws IOException {
        Map<String, List<GroupMember>> groups = new LinkedHashMap<>();
        BufferedReader in = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        String currentParent = null;
        int lineNumber = 0;
        String raw;
        while ((raw = in.readLine()) != null) {
            lineNumber++;
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;

            if (line.startsWith("[") && line.endsWith("]")) {
                currentParent = line.substring(1, line.length() - 1);
                // a repeated header restarts its section
                groups.put(currentParent, new ArrayList<>());
                continue;
            }

            int comma = line.indexOf(',');
            if (currentParent == null || comma < 0) {
                log.debug("Skipping proposal line {}: {}", lineNumber, line);
                continue;
            }
            String childName = line.substring(0, comma).strip();
            String foodGroup = line.substring(comma + 1).strip();
            groups.get(currentParent).add(new GroupMember(childName, foodGroup));
        }

        groups.values().removeIf(List::isEmpty);
        return groups;
    }
}
