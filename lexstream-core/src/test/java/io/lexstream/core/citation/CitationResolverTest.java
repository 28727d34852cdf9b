package io.lexstream.core.citation;

import static org.assertj.core.api.Assertions.assertThat;

import io.lexstream.core.model.CitationFragment;
import io.lexstream.core.model.Source;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CitationResolverTest {

    private static final String REDIRECT = "https://vertexaisearch.cloud.google.com/grounding-api-redirect/";
    private static final RedirectProbe FAILING_PROBE = uri -> {
        throw new AssertionError("probe must not be called for " + uri);
    };

    @Test
    void shouldResolveOriginalUrlWithoutNetwork() {
        try (CitationResolver resolver = resolver(FAILING_PROBE, Duration.ofSeconds(5))) {
            Source source = resolver.resolve(new CitationFragment(
                "EEOC",
                REDIRECT + "abc?originalUrl=https%3A%2F%2Fwww.eeoc.gov%2Flaws",
                "Federal laws"
            )).join();

            assertThat(source.url()).isEqualTo("https://www.eeoc.gov/laws");
            assertThat(source.title()).isEqualTo("EEOC");
            assertThat(source.snippet()).isEqualTo("Federal laws");
        }
    }

    @Test
    void shouldResolveUnencodedOriginalUrlOffline() {
        try (CitationResolver resolver = resolver(FAILING_PROBE, Duration.ofSeconds(5))) {
            assertThat(resolver.resolveOffline(REDIRECT + "x?originalUrl=https://example.com/page"))
                .contains("https://example.com/page");
        }
    }

    @Test
    void shouldProbeOpaqueRedirects() {
        AtomicInteger calls = new AtomicInteger();
        RedirectProbe probe = uri -> {
            calls.incrementAndGet();
            return Optional.of("https://www.nlrb.gov/guidance");
        };
        try (CitationResolver resolver = resolver(probe, Duration.ofSeconds(5))) {
            Source source = resolver.resolve(Source.of("NLRB", REDIRECT + "AUZIYQ", null)).join();

            assertThat(source.url()).isEqualTo("https://www.nlrb.gov/guidance");
            assertThat(calls).hasValue(1);
        }
    }

    @Test
    void shouldKeepRedirectWhenProbeTimesOut() {
        CountDownLatch never = new CountDownLatch(1);
        RedirectProbe slow = uri -> {
            try {
                never.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Optional.of("https://too.late.example");
        };
        try (CitationResolver resolver = resolver(slow, Duration.ofMillis(100))) {
            Source original = Source.of("Slow", REDIRECT + "AUZIYQ", null);

            Source source = resolver.resolve(original).join();

            assertThat(source).isEqualTo(original);
        }
    }

    @Test
    void shouldKeepRedirectWhenProbeThrows() {
        RedirectProbe broken = uri -> {
            throw new IllegalStateException("boom");
        };
        try (CitationResolver resolver = resolver(broken, Duration.ofSeconds(5))) {
            Source original = Source.of("Broken", REDIRECT + "AUZIYQ", null);

            assertThat(resolver.resolve(original).join()).isEqualTo(original);
        }
    }

    @Test
    void shouldLeaveNonRedirectLinksAlone() {
        try (CitationResolver resolver = resolver(FAILING_PROBE, Duration.ofSeconds(5))) {
            assertThat(resolver.resolveUrl("ftp://files.example/doc")).isEqualTo("ftp://files.example/doc");
            assertThat(resolver.resolveUrl("justia.com")).isEqualTo("https://justia.com");
        }
    }

    @Test
    void shouldResolveAllInOrderAndCollapseDuplicates() {
        RedirectProbe probe = uri -> uri.endsWith("two") || uri.endsWith("three")
            ? Optional.of("https://www.dol.gov/flsa")
            : Optional.empty();
        try (CitationResolver resolver = resolver(probe, Duration.ofSeconds(5))) {
            List<Source> resolved = resolver.resolveAll(List.of(
                Source.of("EEOC", "https://www.eeoc.gov", null),
                Source.of("DOL", REDIRECT + "two", null),
                Source.of("DOL", REDIRECT + "three", null),
                Source.of("Unknown", REDIRECT + "four", null)
            ));

            assertThat(resolved).extracting(Source::url).containsExactly(
                "https://www.eeoc.gov",
                "https://www.dol.gov/flsa",
                REDIRECT + "four"
            );
        }
    }

    @Test
    void shouldStartEachTimeoutWhenTheProbeStartsRatherThanWhenQueued() {
        AtomicInteger calls = new AtomicInteger();
        RedirectProbe slow = uri -> {
            calls.incrementAndGet();
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Optional.of("https://www.example.com/" + uri.substring(uri.lastIndexOf('/') + 1));
        };
        try (CitationResolver resolver = new CitationResolver(RedirectMarkers.defaults(), slow, 1, Duration.ofMillis(500))) {
            List<Source> resolved = resolver.resolveAll(List.of(
                Source.of("A", REDIRECT + "a", null),
                Source.of("B", REDIRECT + "b", null),
                Source.of("C", REDIRECT + "c", null)
            ));

            assertThat(resolved).extracting(Source::url).containsExactly(
                "https://www.example.com/a",
                "https://www.example.com/b",
                "https://www.example.com/c"
            );
            assertThat(calls).hasValue(3);
        }
    }

    private static CitationResolver resolver(RedirectProbe probe, Duration timeout) {
        return new CitationResolver(RedirectMarkers.defaults(), probe, 4, timeout);
    }
}
