package com.foodgraph.hierarchy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodgraph.hierarchy.service.analysis.ConsolidationAnalyzer;
import com.foodgraph.hierarchy.service.analysis.ScoringConfig;
import com.foodgraph.hierarchy.service.hierarchy.HierarchyBuilder;
import com.foodgraph.hierarchy.service.io.HierarchyCsvWriter;
import com.foodgraph.hierarchy.service.io.IngredientCsvReader;
import com.foodgraph.hierarchy.service.io.ReportWriter;
import com.foodgraph.hierarchy.service.proposal.ProposalCodec;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({AppProperties.class, ConsolidationProperties.class})
public class PipelineConfig {

    @Bean
    public ScoringConfig scoringConfig(ConsolidationProperties properties) {
        return properties.toScoringConfig();
    }

    @Bean
    public ConsolidationAnalyzer consolidationAnalyzer(ScoringConfig scoringConfig) {
        return new ConsolidationAnalyzer(scoringConfig);
    }

    @Bean
    public HierarchyBuilder hierarchyBuilder(ScoringConfig scoringConfig, AppProperties appProperties) {
        return new HierarchyBuilder(scoringConfig.getMinGroupSize(), appProperties.getMaxHierarchyDepth());
    }

    @Bean
    public ProposalCodec proposalCodec() {
        return new ProposalCodec();
    }

    @Bean
    public IngredientCsvReader ingredientCsvReader() {
        return new IngredientCsvReader();
    }

    @Bean
    public HierarchyCsvWriter hierarchyCsvWriter() {
        return new HierarchyCsvWriter();
    }

    @Bean
    public ReportWriter reportWriter(ObjectMapper objectMapper) {
        return new ReportWriter(objectMapper);
    }
}
