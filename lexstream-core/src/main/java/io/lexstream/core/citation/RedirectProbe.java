package io.lexstream.core.citation;

import java.util.Optional;

public interface RedirectProbe {
    Optional<String> follow(String redirectUri);

    static RedirectProbe disabled() {
        return uri -> Optional.empty();
    }
}
