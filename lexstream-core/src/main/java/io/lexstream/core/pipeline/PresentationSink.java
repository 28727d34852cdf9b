package io.lexstream.core.pipeline;

import io.lexstream.core.model.Source;
import java.util.List;

public interface PresentationSink {
    void revealed(String textSoFar);

    void completed(List<Source> sources, List<String> followUpQuestions);
}
