package net.maasbridge.model.query;

/**
 * Shared constraint for ids spliced into backend paths.
 */
final class IdPatterns {

    /** Letters, digits, underscore and hyphen. Blank values pass so the handler reports them as missing. */
    static final String RESOURCE_ID = "\\s*|[A-Za-z0-9_-]+";

    private IdPatterns() {
    }
}
