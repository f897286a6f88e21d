package uk.gegc.assessment.features.randomization.domain.model;

public enum SeedType {
    QUESTION("question"),
    OPTION("option");

    private final String key;

    SeedType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
