package com.foodgraph.hierarchy.service.analysis;

import com.foodgraph.hierarchy.model.GroupMember;
import com.foodgraph.hierarchy.model.Ingredient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

/**
 * Runs the unsupervised half of the consolidation: mines shared words across
 * ingredient names and proposes parent groups for human review.
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li><strong>Tokenizer</strong> - clean names and extract meaningful words</li>
 *   <li><strong>WordIndex</strong> - word to ingredients postings and frequencies</li>
 *   <li><strong>ProcessingTermFilter</strong> - drop preparation words from candidacy</li>
 *   <li><strong>GroupScorer</strong> - score and threshold the remaining words</li>
 *   <li><strong>GroupAssigner</strong> - greedy multi-parent assignment under the parent cap</li>
 * </ol>
 *
 * <p>The analysis is deterministic: the same ingredients and configuration
 * always produce the same groups in the same order.
 */
public class ConsolidationAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ConsolidationAnalyzer.class);

    static final int TOP_GROUPS_TO_REPORT = 10;
    static final int EXAMPLE_CHILDREN_TO_REPORT = 2;

    private final ScoringConfig config;
    private final Tokenizer tokenizer;
    private final ProcessingTermFilter processingTermFilter;
    private final GroupScorer scorer;
    private final GroupAssigner assigner;

    public ConsolidationAnalyzer(ScoringConfig config) {
        this.config = config;
        this.tokenizer = new Tokenizer(config);
        this.processingTermFilter = new ProcessingTermFilter(config);
        this.scorer = new GroupScorer(config);
        this.assigner = new GroupAssigner(config);
    }

    public Result analyze(List<Ingredient> ingredients) {
        log.info("Analyzing {} ingredients, up to {} parents per ingredient",
            ingredients.size(), config.getMaxParentsPerIngredient());

        WordIndex index = WordIndex.build(ingredients, tokenizer);
        Set<String> processingTerms = processingTermFilter.identify(index);
        log.debug("{} distinct words, processing terms: {}", index.distinctWordCount(), processingTerms);

        SortedMap<String, Double> scores = scorer.scoreCandidates(index, processingTerms);
        GroupAssigner.Assignment assignment = assigner.assign(scores, index);

        AnalysisReport report = AnalysisReport.of(index, processingTerms, scores.size(), assignment.getGroups(),
            TOP_GROUPS_TO_REPORT, EXAMPLE_CHILDREN_TO_REPORT);
        log.info("Consolidation groups found: {}, unique ingredients: {}, relations: {}, multi-parent: {}",
            report.getGroups(), report.getUniqueIngredients(), report.getRelations(), report.getMultiParentIngredients());
        return new Result(assignment.getGroups(), report);
    }

    public static final class Result {
        private final Map<String, List<GroupMember>> groups;
        private final AnalysisReport report;

        Result(Map<String, List<GroupMember>> groups, AnalysisReport report) {
            this.groups = groups;
            this.report = report;
        }

        public Map<String, List<GroupMember>> getGroups() { return groups; }
        public AnalysisReport getReport() { return report; }
    }
}
