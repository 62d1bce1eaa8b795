package dk.cloudcreate.cqrs.users;

import dk.cloudcreate.cqrs.aggregates.AggregateRoot;
import dk.cloudcreate.cqrs.aggregates.command.*;
import dk.cloudcreate.cqrs.common.types.CommandId;

import java.util.Objects;

/**
 * Every command supported by the {@link User} aggregate.<br>
 * Adding a command means adding a {@link Visitor} method, which the compiler then demands from every handler.
 */
public interface UserCommand extends CommandPayload {
    CommandId CREATE          = CommandId.of("user.create");
    CommandId CHANGE_EMAIL    = CommandId.of("user.change.email");
    CommandId CHANGE_PASSWORD = CommandId.of("user.change.password");
    CommandId ENABLE          = CommandId.of("user.enable");
    CommandId DISABLE         = CommandId.of("user.disable");
    CommandId MODIFY          = CommandId.of("user.modify");

    void accept(Visitor visitor);

    interface Visitor {
        void visit(CreateUser command);

        void visit(ChangeUserEmail command);

        void visit(ChangeUserPassword command);

        void visit(EnableUser command);

        void visit(DisableUser command);

        void visit(ModifyUser command);
    }

    /**
     * Passwords are hashed before they reach the service; a hashed value starts with its hash scheme
     */
    static boolean isPreHashed(String password) {
        return password != null && (password.startsWith("bcrypt") || password.startsWith("hashed:"));
    }

    private static void requireExistingUser(AggregateRoot aggregateRoot) {
        if (!aggregateRoot.hasIdentity()) {
            throw new CommandValidationException("User doesn't exist");
        }
    }

    private static void requirePreHashed(String password) {
        if (!isPreHashed(password)) {
            throw new CommandValidationException("Password must be hashed");
        }
    }

    private static void requireEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new CommandValidationException("No email provided");
        }
    }

    class CreateUser implements UserCommand {
        private String email;
        private String password;

        public CreateUser() {
        }

        public CreateUser(String email, String password) {
            this.email = email;
            this.password = password;
        }

        public String getEmail() {
            return email;
        }

        public String getPassword() {
            return password;
        }

        @Override
        public void validate(Command<?> command, AggregateRoot aggregateRoot) {
            if (aggregateRoot.hasIdentity()) {
                throw new CommandValidationException("User already exists");
            }
            requireEmail(email);
            requirePreHashed(password);
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            CreateUser that = (CreateUser) o;
            return Objects.equals(email, that.email) && Objects.equals(password, that.password);
        }

        @Override
        public int hashCode() {
            return Objects.hash(email, password);
        }

        @Override
        public String toString() {
            return "CreateUser{email='" + email + "'}";
        }
    }

    class ChangeUserEmail implements UserCommand {
        private String email;

        public ChangeUserEmail() {
        }

        public ChangeUserEmail(String email) {
            this.email = email;
        }

        public String getEmail() {
            return email;
        }

        @Override
        public void validate(Command<?> command, AggregateRoot aggregateRoot) {
            requireExistingUser(aggregateRoot);
            requireEmail(email);
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return Objects.equals(email, ((ChangeUserEmail) o).email);
        }

        @Override
        public int hashCode() {
            return Objects.hash(email);
        }

        @Override
        public String toString() {
            return "ChangeUserEmail{email='" + email + "'}";
        }
    }

    class ChangeUserPassword implements UserCommand {
        private String password;

        public ChangeUserPassword() {
        }

        public ChangeUserPassword(String password) {
            this.password = password;
        }

        public String getPassword() {
            return password;
        }

        @Override
        public void validate(Command<?> command, AggregateRoot aggregateRoot) {
            requireExistingUser(aggregateRoot);
            requirePreHashed(password);
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return Objects.equals(password, ((ChangeUserPassword) o).password);
        }

        @Override
        public int hashCode() {
            return Objects.hash(password);
        }

        @Override
        public String toString() {
            return "ChangeUserPassword{}";
        }
    }

    class EnableUser implements UserCommand {
        public EnableUser() {
        }

        @Override
        public void validate(Command<?> command, AggregateRoot aggregateRoot) {
            requireExistingUser(aggregateRoot);
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
            return EnableUser.class.hashCode();
        }

        @Override
        public String toString() {
            return "EnableUser{}";
        }
    }

    class DisableUser implements UserCommand {
        public DisableUser() {
        }

        @Override
        public void validate(Command<?> command, AggregateRoot aggregateRoot) {
            requireExistingUser(aggregateRoot);
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
            return DisableUser.class.hashCode();
        }

        @Override
        public String toString() {
            return "DisableUser{}";
        }
    }

    /**
     * Change any combination of fields in one command. A <code>null</code> field is left untouched
     */
    class ModifyUser implements UserCommand {
        private String  email;
        private String  password;
        private Boolean enabled;

        public ModifyUser() {
        }

        public ModifyUser(String email, String password, Boolean enabled) {
            this.email = email;
            this.password = password;
            this.enabled = enabled;
        }

        public String getEmail() {
            return email;
        }

        public String getPassword() {
            return password;
        }

        public Boolean getEnabled() {
            return enabled;
        }

        @Override
        public void validate(Command<?> command, AggregateRoot aggregateRoot) {
            requireExistingUser(aggregateRoot);
            if (email != null) {
                requireEmail(email);
            }
            if (password != null) {
                requirePreHashed(password);
            }
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ModifyUser that = (ModifyUser) o;
            return Objects.equals(email, that.email) && Objects.equals(password, that.password) && Objects.equals(enabled, that.enabled);
        }

        @Override
        public int hashCode() {
            return Objects.hash(email, password, enabled);
        }

        @Override
        public String toString() {
            return "ModifyUser{email='" + email + "', password=" + (password != null ? "***" : "null") + ", enabled=" + enabled + "}";
        }
    }
}
