package dk.cloudcreate.cqrs.bus;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The immediate reply to a command request. It only acknowledges that the command was received and decoded,
 * the outcome of handling it is published later on the correlation id's outcome subjects (see {@link CommandChannels}).<br>
 * Wire format: <code>ok:ack</code> or <code>error:&lt;message&gt;</code>
 */
public final class CommandReply {
    public static final String OK_PREFIX    = "ok:";
    public static final String ERROR_PREFIX = "error:";

    private static final CommandReply ACK = new CommandReply(true, "ack");

    private final boolean ok;
    private final String  text;

    private CommandReply(boolean ok, String text) {
        this.ok = ok;
        this.text = requireNonNull(text, "No text provided");
    }

    public static CommandReply ack() {
        return ACK;
    }

    public static CommandReply error(String message) {
        return new CommandReply(false, message == null ? "" : message);
    }

    public static CommandReply decode(byte[] data) {
        requireNonNull(data, "No data provided");
        var value = new String(data, StandardCharsets.UTF_8);
        if (value.startsWith(OK_PREFIX)) {
            return new CommandReply(true, value.substring(OK_PREFIX.length()));
        }
        if (value.startsWith(ERROR_PREFIX)) {
            return new CommandReply(false, value.substring(ERROR_PREFIX.length()));
        }
        throw new CommandBusException("Malformed command reply: '" + value + "'");
    }

    public byte[] encode() {
        return ((ok ? OK_PREFIX : ERROR_PREFIX) + text).getBytes(StandardCharsets.UTF_8);
    }

    public boolean isOk() {
        return ok;
    }

    /**
     * The text after the prefix; the error message for an error reply
     */
    public String text() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommandReply)) return false;
        var that = (CommandReply) o;
        return ok == that.ok && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ok, text);
    }

    @Override
    public String toString() {
        return (ok ? OK_PREFIX : ERROR_PREFIX) + text;
    }
}
