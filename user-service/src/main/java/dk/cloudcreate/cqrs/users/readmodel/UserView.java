package dk.cloudcreate.cqrs.users.readmodel;

import dk.cloudcreate.cqrs.common.types.CorrelationId;

import java.util.Objects;

/**
 * Query side representation of a user. Never contains the password
 */
public final class UserView {
    private final String        id;
    private final String        email;
    private final boolean       enabled;
    /**
     * The correlation id of the last command that changed the user
     */
    private final CorrelationId lastCorrelationId;

    public UserView(String id, String email, boolean enabled, CorrelationId lastCorrelationId) {
        this.id = id;
        this.email = email;
        this.enabled = enabled;
        this.lastCorrelationId = lastCorrelationId;
    }

    public String getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public CorrelationId getLastCorrelationId() {
        return lastCorrelationId;
    }

    UserView withEmail(String email, CorrelationId correlationId) {
        return new UserView(id, email, enabled, correlationId);
    }

    UserView withEnabled(boolean enabled, CorrelationId correlationId) {
        return new UserView(id, email, enabled, correlationId);
    }

    UserView touchedBy(CorrelationId correlationId) {
        return new UserView(id, email, enabled, correlationId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UserView that = (UserView) o;
        return enabled == that.enabled &&
                Objects.equals(id, that.id) &&
                Objects.equals(email, that.email) &&
                Objects.equals(lastCorrelationId, that.lastCorrelationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, email, enabled, lastCorrelationId);
    }

    @Override
    public String toString() {
        return "UserView{" +
                "id='" + id + '\'' +
                ", email='" + email + '\'' +
                ", enabled=" + enabled +
                ", lastCorrelationId=" + lastCorrelationId +
                '}';
    }
}
