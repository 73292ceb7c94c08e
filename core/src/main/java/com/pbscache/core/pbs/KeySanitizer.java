package com.pbscache.core.pbs;

/**
 * Rewrites node and job identifiers into keys that are legal in the structured path syntax.
 * <p>
 * Substitutions, applied in order: {@code .} to {@code _}, {@code [} to {@code _},
 * {@code ]} removed. The mapping is one-way: {@code "1.a"} and {@code "1_a"} collide, so
 * records keep their original identifier in their {@code id} field.
 * </p>
 */
public final class KeySanitizer {
    private KeySanitizer() {
    }

    public static String sanitize(String key) {
        StringBuilder sb = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            switch (c) {
                case '.':
                case '[':
                    sb.append('_');
                    break;
                case ']':
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
