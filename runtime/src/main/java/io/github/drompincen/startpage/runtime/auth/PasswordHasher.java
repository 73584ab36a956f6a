package io.github.drompincen.startpage.runtime.auth;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Salted one-way hashing of the admin password with Argon2id. The salt and parameters are
 * embedded in the PHC-format output, so a stored hash stays verifiable after the cost
 * settings change.
 */
@Component
public class PasswordHasher {

    private static final int SALT_LENGTH = 16;
    private static final int HASH_LENGTH = 32;

    private final Argon2 argon2;
    private final int iterations;
    private final int memoryKib;
    private final int parallelism;

    public PasswordHasher(@Value("${startpage.auth.argon2.iterations:3}") int iterations,
                          @Value("${startpage.auth.argon2.memory-kib:65536}") int memoryKib,
                          @Value("${startpage.auth.argon2.parallelism:1}") int parallelism) {
        this.argon2 = Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id, SALT_LENGTH, HASH_LENGTH);
        this.iterations = iterations;
        this.memoryKib = memoryKib;
        this.parallelism = parallelism;
    }

    public String hash(String password) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        char[] chars = password.toCharArray();
        try {
            return argon2.hash(iterations, memoryKib, parallelism, chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }

    public boolean verify(String storedHash, String password) {
        if (storedHash == null || password == null || password.isEmpty()) {
            return false;
        }
        char[] chars = password.toCharArray();
        try {
            return argon2.verify(storedHash, chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }
}
