package de.leipzig.htwk.gitrdf.fixstrategy.model.embedding;

/**
 * The two vector representations an embedder can produce.
 */
public enum EmbeddingKind {
    DENSE("dense", "Fixed-width vectors from the neural sentence encoder"),
    SPARSE("sparse", "Hashed term vectors from the statistical fallback");

    private final String value;
    private final String description;

    EmbeddingKind(String value, String description) {
        this.value = value;
        this.description = description;
    }

    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }
}
