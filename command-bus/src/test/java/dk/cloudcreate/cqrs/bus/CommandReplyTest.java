package dk.cloudcreate.cqrs.bus;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class CommandReplyTest {
    @Test
    void ack_is_encoded_as_ok_ack() {
        assertThat(new String(CommandReply.ack().encode(), StandardCharsets.UTF_8)).isEqualTo("ok:ack");
    }

    @Test
    void error_replies_carry_the_message_after_the_prefix() {
        // When
        var reply = CommandReply.decode("error:unknown identifier 'x'".getBytes(StandardCharsets.UTF_8));

        // Then
        assertThat(reply.isOk()).isFalse();
        assertThat(reply.text()).isEqualTo("unknown identifier 'x'");
        assertThat(reply).isEqualTo(CommandReply.error("unknown identifier 'x'"));
    }

    @Test
    void a_reply_without_a_known_prefix_is_rejected() {
        assertThatThrownBy(() -> CommandReply.decode("maybe".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(CommandBusException.class);
    }
}
