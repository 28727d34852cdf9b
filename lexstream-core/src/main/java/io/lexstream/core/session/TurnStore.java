package io.lexstream.core.session;

import java.io.IOException;
import java.util.List;

public interface TurnStore {
    void append(AnswerTurn turn) throws IOException;

    List<AnswerTurn> list() throws IOException;
}
