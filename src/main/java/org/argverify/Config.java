package org.argverify;

public class Config {
    // key names in inline data
    public static final String FROM_KEY = System.getProperty("verifier.from.key", "from");
    public static final String FORMALIZATION_KEY = System.getProperty("verifier.formalization.key", "formalization");
    public static final String DECLARATIONS_KEY = System.getProperty("verifier.declarations.key", "declarations");
    public static final String ANNOTATION_IDS_KEY = "annotation_ids";

    // solver
    public static final long SOLVER_TIMEOUT_MS = Long.getLong("verifier.solver.timeout.ms", 10_000L);
    public static final int SOLVER_CACHE_SIZE = Integer.getInteger("verifier.solver.cache.size", 256);

    // reconstructions checked against a map
    public static final int MIN_RECONSTRUCTED_ARGUMENTS = Integer.getInteger("verifier.min.arguments", 2);

    // annotation source text integrity
    public static final double LEVENSHTEIN_TOLERANCE = 0.01;
    public static final int SHORTENING_WORD_THRESHOLD = 200;
}
