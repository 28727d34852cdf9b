package io.lexstream.core.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lexstream.core.model.CitationFragment;
import io.lexstream.core.wire.GenerateContentChunk;
import io.lexstream.core.wire.GenerateContentChunk.Candidate;
import io.lexstream.core.wire.GenerateContentChunk.GroundingChunk;
import io.lexstream.core.wire.GenerateContentChunk.Part;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ChunkDecoder {
    private static final Logger LOG = LoggerFactory.getLogger(ChunkDecoder.class);

    private final ObjectMapper mapper;

    public ChunkDecoder() {
        this(new ObjectMapper());
    }

    public ChunkDecoder(ObjectMapper mapper) {
        this.mapper = mapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    }

    public Optional<GenerateContentChunk> parse(Frame frame) {
        try {
            GenerateContentChunk chunk = mapper.readValue(frame.data(), GenerateContentChunk.class);
            return Optional.ofNullable(chunk);
        } catch (JsonProcessingException e) {
            LOG.debug("Dropping undecodable frame ({} chars): {}", frame.data().length(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public Optional<ResponseDelta> decode(Frame frame) {
        return parse(frame).map(ChunkDecoder::toDelta);
    }

    public static ResponseDelta toDelta(GenerateContentChunk chunk) {
        Candidate candidate = chunk.firstCandidate();
        StringBuilder text = new StringBuilder();
        for (Part part : candidate.content().parts()) {
            if (part.isAnswerText()) {
                text.append(part.text());
            }
        }
        return new ResponseDelta(text.toString(), fragments(candidate));
    }

    public static List<CitationFragment> fragments(Candidate candidate) {
        List<CitationFragment> fragments = new ArrayList<>();
        for (GroundingChunk chunk : candidate.groundingMetadata().groundingChunks()) {
            if (chunk == null || chunk.web() == null) {
                continue;
            }
            fragments.add(new CitationFragment(
                chunk.web().title(),
                chunk.web().preferredUri(),
                chunk.web().snippet()
            ));
        }
        return fragments;
    }
}
