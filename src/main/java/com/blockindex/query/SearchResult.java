package com.blockindex.query;

import java.nio.file.Path;
import java.util.List;

public record SearchResult(
        String query,
        List<Path> documents,
        int totalMatches,
        long elapsedMs
) {
    public SearchResult {
        documents = List.copyOf(documents);
    }
}
