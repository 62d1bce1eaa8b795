package dk.cloudcreate.cqrs.users;

import dk.cloudcreate.cqrs.aggregates.event.EventPayload;
import dk.cloudcreate.cqrs.common.types.EventId;

import java.util.*;

/**
 * Every event the {@link User} aggregate produces
 */
public interface UserEvent extends EventPayload {
    EventId CREATED          = EventId.of("user.created");
    EventId EMAIL_CHANGED    = EventId.of("user.email.changed");
    EventId PASSWORD_CHANGED = EventId.of("user.password.changed");
    EventId ENABLED          = EventId.of("user.enabled");
    EventId DISABLED         = EventId.of("user.disabled");

    List<EventId> ALL = List.of(CREATED, EMAIL_CHANGED, PASSWORD_CHANGED, ENABLED, DISABLED);

    void accept(Visitor visitor);

    interface Visitor {
        void visit(UserCreated event);

        void visit(UserEmailChanged event);

        void visit(UserPasswordChanged event);

        void visit(UserEnabled event);

        void visit(UserDisabled event);
    }

    class UserCreated implements UserEvent {
        private String  id;
        private String  email;
        private String  password;
        private boolean enabled;

        public UserCreated() {
        }

        public UserCreated(String id, String email, String password, boolean enabled) {
            this.id = id;
            this.email = email;
            this.password = password;
            this.enabled = enabled;
        }

        public String getId() {
            return id;
        }

        public String getEmail() {
            return email;
        }

        public String getPassword() {
            return password;
        }

        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            UserCreated that = (UserCreated) o;
            return enabled == that.enabled && Objects.equals(id, that.id) && Objects.equals(email, that.email) && Objects.equals(password, that.password);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, email, password, enabled);
        }

        @Override
        public String toString() {
            return "UserCreated{id='" + id + "', email='" + email + "', enabled=" + enabled + "}";
        }
    }

    class UserEmailChanged implements UserEvent {
        private String oldEmail;
        private String newEmail;

        public UserEmailChanged() {
        }

        public UserEmailChanged(String oldEmail, String newEmail) {
            this.oldEmail = oldEmail;
            this.newEmail = newEmail;
        }

        public String getOldEmail() {
            return oldEmail;
        }

        public String getNewEmail() {
            return newEmail;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            UserEmailChanged that = (UserEmailChanged) o;
            return Objects.equals(oldEmail, that.oldEmail) && Objects.equals(newEmail, that.newEmail);
        }

        @Override
        public int hashCode() {
            return Objects.hash(oldEmail, newEmail);
        }

        @Override
        public String toString() {
            return "UserEmailChanged{oldEmail='" + oldEmail + "', newEmail='" + newEmail + "'}";
        }
    }

    class UserPasswordChanged implements UserEvent {
        private String oldPassword;
        private String newPassword;

        public UserPasswordChanged() {
        }

        public UserPasswordChanged(String oldPassword, String newPassword) {
            this.oldPassword = oldPassword;
            this.newPassword = newPassword;
        }

        public String getOldPassword() {
            return oldPassword;
        }

        public String getNewPassword() {
            return newPassword;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            UserPasswordChanged that = (UserPasswordChanged) o;
            return Objects.equals(oldPassword, that.oldPassword) && Objects.equals(newPassword, that.newPassword);
        }

        @Override
        public int hashCode() {
            return Objects.hash(oldPassword, newPassword);
        }

        @Override
        public String toString() {
            return "UserPasswordChanged{}";
        }
    }

    class UserEnabled implements UserEvent {
        public UserEnabled() {
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            return o != null && getClass() == o.getClass();
        }

        @Override
        public int hashCode() {
            return UserEnabled.class.hashCode();
        }

        @Override
        public String toString() {
            return "UserEnabled{}";
        }
    }

    class UserDisabled implements UserEvent {
        public UserDisabled() {
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            return o != null && getClass() == o.getClass();
        }

        @Override
        public int hashCode() {
            return UserDisabled.class.hashCode();
        }

        @Override
        public String toString() {
            return "UserDisabled{}";
        }
    }
}
