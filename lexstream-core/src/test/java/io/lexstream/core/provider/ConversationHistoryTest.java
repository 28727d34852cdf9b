package io.lexstream.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ConversationHistoryTest {

    @Test
    void shouldRemoveOnlyTrailingUserTurn() {
        ConversationHistory history = new ConversationHistory();
        history.appendUser("What is at-will employment?");
        history.appendModel("It means either party may end the employment.");

        assertThat(history.removeLastUser()).isFalse();

        history.appendUser("Any exceptions?");
        assertThat(history.removeLastUser()).isTrue();
        assertThat(history.snapshot()).containsExactly(
            HistoryEntry.user("What is at-will employment?"),
            HistoryEntry.model("It means either party may end the employment.")
        );
    }

    @Test
    void shouldClearAllTurns() {
        ConversationHistory history = new ConversationHistory();
        history.appendUser("Question");

        history.clear();

        assertThat(history.size()).isZero();
        assertThat(history.removeLastUser()).isFalse();
    }
}
