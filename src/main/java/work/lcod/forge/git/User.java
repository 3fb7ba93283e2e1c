package work.lcod.forge.git;

import java.util.Objects;

/**
 * Author, committer or tagger identity.
 */
public record User(String name, String email) {
    public User {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(email, "email");
    }

    @Override
    public String toString() {
        return name + " <" + email + ">";
    }
}
