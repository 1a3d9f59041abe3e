package com.adlanda.ragassistant.model;

/**
 * A bounded segment of source text, the unit that gets embedded and indexed.
 *
 * @param chunkIndex Sequential index within one ingestion, starting at 1
 * @param text       Chunk text with page markers removed
 * @param pageNumber Page the chunk starts on, or {@link #UNKNOWN_PAGE} when it starts mid-page
 * @param source     Provenance of the chunk; null until the chunk has been enriched
 */
public record Chunk(
        int chunkIndex,
        String text,
        int pageNumber,
        SourceMetadata source
) {
    public static final int UNKNOWN_PAGE = 0;

    /**
     * Creates a chunk straight out of the chunker, before provenance is attached.
     */
    public static Chunk unattributed(int chunkIndex, String text, int pageNumber) {
        return new Chunk(chunkIndex, text, pageNumber, null);
    }

    /**
     * Returns a copy carrying the given provenance. Index, text and page are unchanged.
     */
    public Chunk withSource(SourceMetadata source) {
        return new Chunk(chunkIndex, text, pageNumber, source);
    }

    public boolean hasKnownPage() {
        return pageNumber != UNKNOWN_PAGE;
    }
}
