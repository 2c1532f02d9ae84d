package com.blackroad.catalog.models;

public class ImportResult {
    private int imported;
    private int duplicates;
    private int invalid;

    public int getImported() { return imported; }
    public int getDuplicates() { return duplicates; }
    public int getInvalid() { return invalid; }

    public void countImported() { imported++; }
    public void countDuplicate() { duplicates++; }
    public void countInvalid() { invalid++; }

    @Override
    public String toString() {
        return "imported=" + imported + ", duplicates=" + duplicates + ", invalid=" + invalid;
    }
}
