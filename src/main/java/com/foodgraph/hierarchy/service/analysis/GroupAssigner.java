package com.foodgraph.hierarchy.service.analysis;

import com.foodgraph.hierarchy.model.GroupMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Greedily turns scored candidate words into consolidation groups.
 *
 * <p>Candidates are visited in descending score order, ties broken by word. Each
 * candidate claims the ingredients of its postings that still have parent
 * capacity; the group is formed only if at least {@code minGroupSize} of them
 * remain. Candidates scoring below {@code secondaryParentMinScore} may not give
 * an ingredient its third or later parent: they only claim ingredients that
 * have at most one parent so far. High-scoring groups therefore reserve
 * capacity first.
 */
public class GroupAssigner {
    private static final Logger log = LoggerFactory.getLogger(GroupAssigner.class);

    /** Ingredients with this many parents count as multi-parented. */
    private static final int MULTI_PARENT = 2;

    private final ScoringConfig config;

    public GroupAssigner(ScoringConfig config) {
        this.config = config;
    }

    public static Comparator<Map.Entry<String, Double>> rankingOrder() {
        return Map.Entry.<String, Double>comparingByValue().reversed()
            .thenComparing(Map.Entry.comparingByKey());
    }

    public Assignment assign(Map<String, Double> candidateScores, WordIndex index) {
        List<Map.Entry<String, Double>> ranked = new ArrayList<>(candidateScores.entrySet());
        ranked.sort(rankingOrder());

        Map<String, List<GroupMember>> groups = new LinkedHashMap<>();
        ParentCapState state = ParentCapState.empty(config.getMaxParentsPerIngredient());
        for (Map.Entry<String, Double> candidate : ranked) {
            StepResult step = step(candidate.getKey(), candidate.getValue(), index, state);
            if (step.group != null) {
                groups.put(candidate.getKey(), step.group);
            }
            state = step.state;
        }
        log.debug("Assigned {} groups from {} candidates", groups.size(), ranked.size());
        return new Assignment(groups, state);
    }

    /**
     * Applies one candidate to the current parent counts.
     *
     * @return the group formed (or null) and the parent counts after the step
     */
    public StepResult step(String word, double score, WordIndex index, ParentCapState state) {
        boolean secondary = score < config.getSecondaryParentMinScore();
        int limit = secondary ? Math.min(MULTI_PARENT, state.getMaxParents()) : state.getMaxParents();

        List<String> available = new ArrayList<>();
        for (String ingredient : index.postings(word)) {
            if (state.count(ingredient) < limit) available.add(ingredient);
        }
        if (available.size() < config.getMinGroupSize()) {
            log.debug("Skipping {} (score {}): only {} ingredient(s) available", word, score, available.size());
            return new StepResult(null, state);
        }

        List<GroupMember> members = new ArrayList<>(available.size());
        for (String ingredient : available) {
            members.add(new GroupMember(ingredient, index.foodGroupOf(ingredient)));
        }
        return new StepResult(Collections.unmodifiableList(members), state.join(available));
    }

    public static final class StepResult {
        private final List<GroupMember> group;
        private final ParentCapState state;

        StepResult(List<GroupMember> group, ParentCapState state) {
            this.group = group;
            this.state = state;
        }

        public List<GroupMember> getGroup() { return group; }
        public ParentCapState getState() { return state; }
    }

    /** Groups in assignment order plus the parent counts they consumed. */
    public static final class Assignment {
        private final Map<String, List<GroupMember>> groups;
        private final ParentCapState state;

        Assignment(Map<String, List<GroupMember>> groups, ParentCapState state) {
            this.groups = Collections.unmodifiableMap(groups);
            this.state = state;
        }

        public Map<String, List<GroupMember>> getGroups() { return groups; }
        public ParentCapState getState() { return state; }
    }
}
