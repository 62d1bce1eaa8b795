package dk.cloudcreate.cqrs.bus.transport;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SubjectsTest {
    @Test
    void literal_patterns_only_match_the_same_subject() {
        assertThat(Subjects.matches("command.user", "command.user")).isTrue();
        assertThat(Subjects.matches("command.user", "command.order")).isFalse();
        assertThat(Subjects.matches("command.user", "command.user.extra")).isFalse();
        assertThat(Subjects.matches("command.user.extra", "command.user")).isFalse();
    }

    @Test
    void a_star_matches_exactly_one_token() {
        assertThat(Subjects.matches("event.c1.*", "event.c1.success")).isTrue();
        assertThat(Subjects.matches("event.c1.*", "event.c1.error")).isTrue();
        assertThat(Subjects.matches("event.c1.*", "event.c2.success")).isFalse();
        assertThat(Subjects.matches("event.c1.*", "event.c1")).isFalse();
        assertThat(Subjects.matches("event.*.error", "event.c1.error")).isTrue();
    }

    @Test
    void a_trailing_greater_than_matches_one_or_more_tokens() {
        assertThat(Subjects.matches("event.>", "event.c1.success")).isTrue();
        assertThat(Subjects.matches("event.>", "event.c1")).isTrue();
        assertThat(Subjects.matches("event.>", "event")).isFalse();
        assertThat(Subjects.matches("command.>", "event.c1.success")).isFalse();
    }

    @Test
    void lastToken_returns_the_text_after_the_last_dot() {
        assertThat(Subjects.lastToken("event.c1.success")).isEqualTo("success");
        assertThat(Subjects.lastToken("single")).isEqualTo("single");
    }
}
