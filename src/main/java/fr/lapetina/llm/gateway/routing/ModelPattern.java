package fr.lapetina.llm.gateway.routing;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Glob over model names: {@code *} matches any run of characters,
 * {@code ?} exactly one. Everything else is literal.
 */
public final class ModelPattern {

    private final String glob;
    private final Pattern regex;

    private ModelPattern(String glob) {
        this.glob = glob;
        this.regex = Pattern.compile(toRegex(glob));
    }

    public static ModelPattern of(String glob) {
        Objects.requireNonNull(glob, "Model pattern is required");
        if (glob.isBlank()) {
            throw new IllegalArgumentException("Model pattern must not be blank");
        }
        return new ModelPattern(glob);
    }

    private static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.toString();
    }

    public boolean matches(String model) {
        return model != null && regex.matcher(model).matches();
    }

    public String getGlob() {
        return glob;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return glob.equals(((ModelPattern) o).glob);
    }

    @Override
    public int hashCode() {
        return glob.hashCode();
    }

    @Override
    public String toString() {
        return glob;
    }
}
