package com.foodgraph.hierarchy.model;

import java.util.Objects;

/** Row of the synonyms export: an alternate name for a preferred descriptor. */
public class Synonym {
    private final String pdName;
    private final String aliasName;

    public Synonym(String pdName, String aliasName) {
        this.pdName = Objects.requireNonNull(pdName, "pdName");
        this.aliasName = Objects.requireNonNull(aliasName, "aliasName");
    }

    public String getPdName() { return pdName; }
    public String getAliasName() { return aliasName; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Synonym other)) return false;
        return pdName.equals(other.pdName) && aliasName.equals(other.aliasName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pdName, aliasName);
    }
}
