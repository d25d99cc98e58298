package ai.vmhost.common;

import java.security.SecureRandom;
import java.util.random.RandomGenerator;

/**
 * Lowercase alphanumeric ids, safe to use in host interface names and file names.
 */
public class RandomIdGenerator implements IdGenerator {
    private static final String SYMBOLS = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final RandomGenerator RND = new SecureRandom();

    @Override
    public String generate(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Id length must be positive, got " + length);
        }
        var buf = new char[length];
        for (int i = 0; i < length; ++i) {
            buf[i] = SYMBOLS.charAt(RND.nextInt(SYMBOLS.length()));
        }
        return new String(buf);
    }
}
