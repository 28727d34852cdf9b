package io.lexstream.core.citation;

import java.util.List;
import java.util.Optional;

@FunctionalInterface
public interface UrlHeuristic {
    Optional<String> apply(String uri);

    static Optional<String> firstSuccess(List<UrlHeuristic> chain, String uri) {
        for (UrlHeuristic heuristic : chain) {
            Optional<String> result = heuristic.apply(uri);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }
}
