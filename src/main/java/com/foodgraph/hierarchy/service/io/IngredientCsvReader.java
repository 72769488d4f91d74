package com.foodgraph.hierarchy.service.io;

import com.foodgraph.hierarchy.model.Ingredient;
import com.foodgraph.hierarchy.model.Synonym;
import com.foodgraph.hierarchy.service.ConsolidationException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the thesaurus exports the consolidation runs on: {@code pd_name,food_group}
 * ingredient rows and {@code pd_name,alias_name} synonym rows. Both files carry a
 * header line; values are trimmed and rows with a blank key are skipped.
 */
public class IngredientCsvReader {
    private static final Logger log = LoggerFactory.getLogger(IngredientCsvReader.class);

    static final String PD_NAME = "pd_name";
    static final String FOOD_GROUP = "food_group";
    static final String ALIAS_NAME = "alias_name";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreHeaderCase(true)
        .setTrim(true)
        .build();

    public List<Ingredient> readIngredients(Path file) {
        List<Ingredient> out = new ArrayList<>();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser p = FORMAT.parse(r)) {
            requireColumns(file, p, PD_NAME, FOOD_GROUP);
            for (CSVRecord rec : p) {
                String name = value(file, rec, PD_NAME);
                if (name == null || name.isBlank()) continue;
                out.add(new Ingredient(name, value(file, rec, FOOD_GROUP)));
            }
        } catch (IOException e) {
            throw new ConsolidationException("Failed to read ingredients from " + file, e);
        }
        log.info("Read {} ingredients from {}", out.size(), file);
        return out;
    }

    public List<Synonym> readSynonyms(Path file) {
        List<Synonym> out = new ArrayList<>();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser p = FORMAT.parse(r)) {
            requireColumns(file, p, PD_NAME, ALIAS_NAME);
            for (CSVRecord rec : p) {
                String pd = value(file, rec, PD_NAME);
                String alias = value(file, rec, ALIAS_NAME);
                if (pd == null || pd.isBlank() || alias == null || alias.isBlank()) continue;
                out.add(new Synonym(pd, alias));
            }
        } catch (IOException e) {
            throw new ConsolidationException("Failed to read synonyms from " + file, e);
        }
        log.info("Read {} synonyms from {}", out.size(), file);
        return out;
    }

    private static String value(Path file, CSVRecord rec, String column) {
        if (!rec.isSet(column)) {
            throw new ConsolidationException("Row at line " + rec.getParser().getCurrentLineNumber() + " of " + file
                + " has " + rec.size() + " value(s), missing '" + column + "'");
        }
        return rec.get(column);
    }

    private static void requireColumns(Path file, CSVParser parser, String... columns) {
        Map<String, Integer> header = parser.getHeaderMap();
        for (String c : columns) {
            boolean present = header != null && header.keySet().stream().anyMatch(h -> h.equalsIgnoreCase(c));
            if (!present) {
                throw new ConsolidationException("Column '" + c + "' missing in " + file);
            }
        }
    }
}
